package com.p14n.relay.registry;

import com.p14n.relay.connection.RelayConnection;

/**
 * Binding of one connection and user to one channel.
 *
 * @param connection  the subscribed connection
 * @param userId      the user the subscription was made for
 * @param channelName the channel
 * @param userInfo    opaque client-supplied user details, may be null
 */
public record Subscription(RelayConnection connection, String userId, String channelName, Object userInfo) {

    boolean matches(RelayConnection other, String otherUserId) {
        return connection == other && userId.equals(otherUserId);
    }
}
