package com.p14n.relay.registry;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.p14n.relay.codec.FrameEncoder;
import com.p14n.relay.connection.ConnectionState;
import com.p14n.relay.connection.RelayConnection;
import com.p14n.relay.data.EventType;
import com.p14n.relay.data.RelayConfig;
import com.p14n.relay.telemetry.RelayMetrics;
import com.p14n.relay.typing.TypingTracker;

import io.opentelemetry.api.OpenTelemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of channel subscriptions and the broadcast engine that fans events
 * out to them.
 *
 * <p>
 * Key features:
 * </p>
 * <ul>
 * <li>Channels are created by their first subscription and removed as soon as
 * their last subscription goes</li>
 * <li>A per-connection index mirrors the channel tables so a closing
 * connection can be torn down without scanning every channel</li>
 * <li>Online presence is derived from subscriptions and announced with a
 * {@link EventType#MEMBER_STATUS_UPDATE} broadcast</li>
 * <li>Typing indicators are held by a {@link TypingTracker} that broadcasts
 * through this registry</li>
 * </ul>
 *
 * <p>
 * All tables are guarded by one read-write lock. Mutations take the write lock
 * and release it before announcing presence changes. A broadcast copies the
 * channel's subscriptions under the read lock and sends outside it, so a slow
 * or failing connection never holds up subscribe or teardown calls.
 * </p>
 *
 * <p>
 * Presence frames are not ordered across concurrent mutations. Two updates in
 * the same channel may reach a client in the opposite order to the one in
 * which they were applied; each frame carries the full {@code onlineUsers}
 * list as of its own mutation. Clients that need the current state should
 * take the latest frame for a user rather than replay them as deltas.
 * </p>
 */
public class ChannelRegistry implements Broadcaster {
    private static final Logger logger = LoggerFactory.getLogger(ChannelRegistry.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, List<Subscription>> channels = new LinkedHashMap<>();
    private final Map<RelayConnection, ConnectionIndex> connections = new IdentityHashMap<>();
    private final PresenceTracker presence = new PresenceTracker();

    private final FrameEncoder encoder;
    private final RelayMetrics metrics;
    private final TypingTracker typing;
    private final boolean announceOfflineOnUnsubscribe;

    /**
     * Creates a registry from the process configuration, using the system
     * clock for typing timestamps.
     *
     * @param config    the relay configuration
     * @param encoder   the frame encoder
     * @param ot        the OpenTelemetry instance for metrics
     * @param scopeName the instrumentation scope name
     */
    public ChannelRegistry(RelayConfig config, FrameEncoder encoder, OpenTelemetry ot, String scopeName) {
        this(encoder, ot, scopeName, Clock.systemUTC(), config.typingTimeoutMillis(),
                config.announceOfflineOnUnsubscribe());
    }

    /**
     * Creates a registry.
     *
     * @param encoder                      the frame encoder
     * @param ot                           the OpenTelemetry instance for metrics
     * @param scopeName                    the instrumentation scope name
     * @param clock                        clock for typing timestamps
     * @param typingTimeoutMillis          idle window of a typing indicator
     * @param announceOfflineOnUnsubscribe whether an unsubscribe that takes a
     *                                     user offline is broadcast
     */
    public ChannelRegistry(FrameEncoder encoder, OpenTelemetry ot, String scopeName, Clock clock,
            long typingTimeoutMillis, boolean announceOfflineOnUnsubscribe) {
        this.encoder = encoder;
        this.metrics = new RelayMetrics(ot.getMeter(scopeName));
        this.typing = new TypingTracker(this, clock, typingTimeoutMillis, metrics);
        this.announceOfflineOnUnsubscribe = announceOfflineOnUnsubscribe;
    }

    /**
     * Subscribes a connection to a channel on behalf of a user.
     *
     * <p>
     * A connection carrying a verified identity may only subscribe as that
     * identity; any other user id is logged and ignored. Subscribing the same
     * connection and user to a channel twice has no effect.
     * </p>
     *
     * @param channelName the channel to join
     * @param connection  the subscribing connection
     * @param userId      the user the subscription is for
     * @param userInfo    opaque user details supplied by the client, may be null
     * @return true if a new subscription was added
     * @throws IllegalArgumentException if the channel name is blank or the
     *                                  connection or user id is null
     */
    public boolean subscribe(String channelName, RelayConnection connection, String userId, Object userInfo) {
        if (channelName == null || channelName.isBlank()) {
            throw new IllegalArgumentException("Channel name cannot be blank");
        }
        if (connection == null) {
            throw new IllegalArgumentException("Connection cannot be null");
        }
        if (userId == null) {
            throw new IllegalArgumentException("User id cannot be null");
        }

        var verified = connection.identity();
        if (verified.isPresent() && !verified.get().userId().equals(userId)) {
            logger.atWarn()
                    .addArgument(connection.id())
                    .addArgument(verified.get().userId())
                    .addArgument(userId)
                    .addArgument(channelName)
                    .log("Connection {} authenticated as {} attempted to subscribe as {} to {}");
            return false;
        }

        PresenceUpdate update;
        lock.writeLock().lock();
        try {
            var subscriptions = channels.computeIfAbsent(channelName, k -> new ArrayList<>());
            for (Subscription existing : subscriptions) {
                if (existing.matches(connection, userId)) {
                    logger.atDebug()
                            .addArgument(userId)
                            .addArgument(channelName)
                            .log("User {} already subscribed to {}");
                    return false;
                }
            }
            subscriptions.add(new Subscription(connection, userId, channelName, userInfo));
            connections.computeIfAbsent(connection, k -> new ConnectionIndex(userId)).channels.add(channelName);
            update = presence.setOnline(channelName, userId, true);
        } finally {
            lock.writeLock().unlock();
        }

        metrics.recordSubscriptionAdded(channelName);
        logger.atInfo()
                .addArgument(userId)
                .addArgument(connection.id())
                .addArgument(channelName)
                .log("User {} on connection {} subscribed to {}");
        broadcast(channelName, EventType.MEMBER_STATUS_UPDATE, update);
        return true;
    }

    /**
     * Removes a connection's subscriptions from one channel.
     *
     * <p>
     * Presence is updated for every user left without a subscription in the
     * channel. Those changes are only broadcast when the registry was built
     * with {@code announceOfflineOnUnsubscribe}.
     * </p>
     *
     * @param channelName the channel to leave
     * @param connection  the connection
     * @return true if any subscription was removed
     */
    public boolean unsubscribe(String channelName, RelayConnection connection) {
        Removal removal;
        lock.writeLock().lock();
        try {
            if (!channels.containsKey(channelName)) {
                logger.atWarn()
                        .addArgument(channelName)
                        .log("Attempted to unsubscribe from non-existent channel {}");
                return false;
            }
            removal = removeFromChannel(channelName, connection);
            if (removal.removed() == 0) {
                return false;
            }
            var index = connections.get(connection);
            if (index != null) {
                index.channels.remove(channelName);
                if (index.channels.isEmpty()) {
                    connections.remove(connection);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }

        metrics.recordSubscriptionsRemoved(channelName, removal.removed());
        logger.atInfo()
                .addArgument(connection.id())
                .addArgument(channelName)
                .log("Connection {} unsubscribed from {}");
        if (announceOfflineOnUnsubscribe) {
            announce(removal);
        }
        return true;
    }

    /**
     * Removes every subscription held by a connection, announcing users who go
     * offline and clearing their typing indicators.
     *
     * <p>
     * Safe to call for a connection the registry does not know, and safe to
     * call more than once.
     * </p>
     *
     * @param connection the closing connection
     * @return the number of channels the connection was removed from
     */
    public int teardown(RelayConnection connection) {
        List<Removal> removals = new ArrayList<>();
        ConnectionIndex index;
        lock.writeLock().lock();
        try {
            index = connections.remove(connection);
            if (index == null) {
                return 0;
            }
            for (String channelName : index.channels) {
                removals.add(removeFromChannel(channelName, connection));
            }
        } finally {
            lock.writeLock().unlock();
        }

        for (Removal removal : removals) {
            metrics.recordSubscriptionsRemoved(removal.channelName(), removal.removed());
            announce(removal);
            for (String userId : removal.userIds()) {
                typing.clear(removal.channelName(), userId);
            }
        }

        logger.atInfo()
                .addArgument(connection.id())
                .addArgument(index.userId)
                .addArgument(removals.size())
                .log("Connection {} for {} removed from {} channels");
        return removals.size();
    }

    @Override
    public BroadcastResult broadcast(String channelName, EventType event, Object payload, RelayConnection exclude) {
        List<Subscription> snapshot;
        lock.readLock().lock();
        try {
            var subscriptions = channels.get(channelName);
            snapshot = subscriptions == null ? null : List.copyOf(subscriptions);
        } finally {
            lock.readLock().unlock();
        }

        if (snapshot == null) {
            logger.atWarn()
                    .addArgument(event.wire())
                    .addArgument(channelName)
                    .log("No subscribers for {} on non-existent channel {}");
            return BroadcastResult.noChannel(channelName, event);
        }

        var frame = encoder.encode(event, payload);
        Set<RelayConnection> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        int delivered = 0;
        int excluded = 0;
        int skipped = 0;
        for (Subscription subscription : snapshot) {
            var connection = subscription.connection();
            if (!seen.add(connection)) {
                continue;
            }
            if (connection == exclude) {
                excluded++;
            } else if (connection.state() != ConnectionState.OPEN) {
                skipped++;
            } else if (deliver(connection, frame, channelName)) {
                delivered++;
            } else {
                skipped++;
            }
        }

        metrics.recordBroadcast(channelName, delivered, skipped);
        logger.atDebug()
                .addArgument(event.wire())
                .addArgument(channelName)
                .addArgument(delivered)
                .addArgument(snapshot.size())
                .addArgument(skipped)
                .log("Broadcast {} to {}: delivered {} of {} subscriptions, {} skipped");
        return new BroadcastResult(channelName, event, snapshot.size(), delivered, excluded, skipped);
    }

    /**
     * Returns a copy of the current channels and their subscriber counts.
     *
     * @return the registry stats
     */
    public RegistryStats getStats() {
        lock.readLock().lock();
        try {
            List<RegistryStats.ChannelStats> stats = new ArrayList<>(channels.size());
            channels.forEach((name, subscriptions) -> stats
                    .add(new RegistryStats.ChannelStats(name, subscriptions.size())));
            return new RegistryStats(channels.size(), stats);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Tears down every indexed connection that is no longer open, reclaiming
     * subscriptions whose close event was lost.
     *
     * @return the number of connections reclaimed
     */
    public int cleanupInactiveConnections() {
        List<RelayConnection> inactive = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (RelayConnection connection : connections.keySet()) {
                if (connection.state() != ConnectionState.OPEN) {
                    inactive.add(connection);
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        for (RelayConnection connection : inactive) {
            teardown(connection);
        }
        logger.atInfo()
                .addArgument(inactive.size())
                .log("Cleaned up {} inactive connections");
        return inactive.size();
    }

    public boolean isSubscribed(String channelName, RelayConnection connection) {
        lock.readLock().lock();
        try {
            var index = connections.get(connection);
            return index != null && index.channels.contains(channelName);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> channelsOf(RelayConnection connection) {
        lock.readLock().lock();
        try {
            var index = connections.get(connection);
            return index == null ? Set.of() : Set.copyOf(index.channels);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> onlineUsers(String channelName) {
        lock.readLock().lock();
        try {
            return presence.onlineUsers(channelName);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Number of connections holding at least one subscription.
     */
    public int connectionCount() {
        lock.readLock().lock();
        try {
            return connections.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public TypingTracker typingTracker() {
        return typing;
    }

    private boolean deliver(RelayConnection connection, String frame, String channelName) {
        try {
            if (connection.send(frame)) {
                return true;
            }
            logger.atWarn()
                    .addArgument(connection.id())
                    .addArgument(channelName)
                    .log("Connection {} refused a frame for {}");
        } catch (RuntimeException e) {
            logger.atWarn()
                    .addArgument(connection.id())
                    .addArgument(channelName)
                    .setCause(e)
                    .log("Failed to send to connection {} in {}");
        }
        return false;
    }

    /**
     * Removes the connection's subscriptions from a channel and takes offline
     * every user left without one. Caller holds the write lock.
     */
    private Removal removeFromChannel(String channelName, RelayConnection connection) {
        var subscriptions = channels.get(channelName);
        if (subscriptions == null) {
            return new Removal(channelName, 0, List.of(), List.of(), false);
        }

        Set<String> userIds = new LinkedHashSet<>();
        int removed = 0;
        Iterator<Subscription> it = subscriptions.iterator();
        while (it.hasNext()) {
            var subscription = it.next();
            if (subscription.connection() == connection) {
                userIds.add(subscription.userId());
                it.remove();
                removed++;
            }
        }

        List<PresenceUpdate> offline = new ArrayList<>();
        for (String userId : userIds) {
            if (subscriptions.stream().noneMatch(s -> s.userId().equals(userId))) {
                offline.add(presence.setOnline(channelName, userId, false));
            }
        }

        boolean reaped = subscriptions.isEmpty();
        if (reaped) {
            channels.remove(channelName);
            logger.atDebug()
                    .addArgument(channelName)
                    .log("Removed empty channel {}");
        }
        return new Removal(channelName, removed, List.copyOf(userIds), offline, reaped);
    }

    // Offline updates only reach a channel that still has subscribers.
    private void announce(Removal removal) {
        if (removal.reaped()) {
            return;
        }
        for (PresenceUpdate update : removal.offline()) {
            broadcast(removal.channelName(), EventType.MEMBER_STATUS_UPDATE, update);
        }
    }

    private record Removal(String channelName,
            int removed,
            List<String> userIds,
            List<PresenceUpdate> offline,
            boolean reaped) {
    }

    private static final class ConnectionIndex {
        private final String userId;
        private final Set<String> channels = new LinkedHashSet<>();

        private ConnectionIndex(String userId) {
            this.userId = userId;
        }
    }
}
