package com.p14n.relay.data;

/**
 * Verified identity attached to a connection when it is accepted.
 *
 * @param userId      the authenticated user id
 * @param displayName the user's display name, may be null
 * @param avatarRef   reference to the user's avatar image, may be null
 */
public record Identity(String userId, String displayName, String avatarRef) {

    public Identity {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId cannot be null or empty");
        }
    }
}
