package com.p14n.relay.typing;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A user currently typing in a channel.
 *
 * @param userId      the typing user
 * @param displayName the name shown to other members, sent as {@code username}
 * @param lastSeenAt  epoch millis of the latest typing signal, sent as
 *                    {@code timestamp}
 */
public record TypingEntry(@JsonProperty("userId") String userId,
        @JsonProperty("username") String displayName,
        @JsonProperty("timestamp") long lastSeenAt) {

    boolean isExpired(long nowMillis, long idleMillis) {
        return nowMillis - lastSeenAt > idleMillis;
    }
}
