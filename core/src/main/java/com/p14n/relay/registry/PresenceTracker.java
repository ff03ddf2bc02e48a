package com.p14n.relay.registry;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-channel sets of online users.
 *
 * <p>
 * Not thread-safe on its own: every call is made by {@link ChannelRegistry}
 * while it holds its write lock, which keeps presence in step with the
 * subscription tables. The registry broadcasts the returned update once the
 * lock has been released.
 * </p>
 */
class PresenceTracker {
    private static final Logger logger = LoggerFactory.getLogger(PresenceTracker.class);

    private final Map<String, Set<String>> onlineUsers = new HashMap<>();

    /**
     * Marks a user online or offline in a channel.
     *
     * @param channelName the channel
     * @param userId      the user
     * @param isOnline    the new status
     * @return the update to broadcast, carrying the online set after the change
     */
    PresenceUpdate setOnline(String channelName, String userId, boolean isOnline) {
        Set<String> users;
        if (isOnline) {
            users = onlineUsers.computeIfAbsent(channelName, k -> new LinkedHashSet<>());
            users.add(userId);
        } else {
            users = onlineUsers.getOrDefault(channelName, Set.of());
            if (!users.isEmpty()) {
                users.remove(userId);
                if (users.isEmpty()) {
                    onlineUsers.remove(channelName);
                }
            }
        }

        var snapshot = List.copyOf(users);
        logger.atDebug()
                .addArgument(channelName)
                .addArgument(userId)
                .addArgument(isOnline)
                .addArgument(snapshot.size())
                .log("Updated online status in {}: user {} online={}, {} online");
        return new PresenceUpdate(channelName, userId, isOnline, snapshot);
    }

    Set<String> onlineUsers(String channelName) {
        return Set.copyOf(onlineUsers.getOrDefault(channelName, Set.of()));
    }
}
