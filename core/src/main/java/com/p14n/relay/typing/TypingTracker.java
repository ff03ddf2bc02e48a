package com.p14n.relay.typing;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

import com.p14n.relay.data.EventType;
import com.p14n.relay.registry.Broadcaster;
import com.p14n.relay.telemetry.RelayMetrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks which users are typing in each channel and broadcasts changes.
 *
 * <p>
 * Entries are created or refreshed by a typing signal, removed by a stop
 * signal, by {@link #clear(String, String)} when a connection goes away, or by
 * {@link #sweep()} once they have been idle for longer than the configured
 * window. Expired entries are never returned to readers, even before the
 * sweep has run.
 * </p>
 *
 * <p>
 * Each channel's entries are only touched inside
 * {@link ConcurrentHashMap#compute} for that channel, so a sweep locks one
 * channel at a time and never holds a lock while broadcasting.
 * </p>
 */
public class TypingTracker {
    private static final Logger logger = LoggerFactory.getLogger(TypingTracker.class);

    private final ConcurrentHashMap<String, Map<String, TypingEntry>> typingUsers = new ConcurrentHashMap<>();
    private final Broadcaster broadcaster;
    private final Clock clock;
    private final long idleMillis;
    private final RelayMetrics metrics;

    /**
     * Creates a tracker.
     *
     * @param broadcaster where typing changes are sent
     * @param clock       source of entry timestamps
     * @param idleMillis  how long an entry stays visible without a refresh
     * @param metrics     metrics for sweep evictions
     */
    public TypingTracker(Broadcaster broadcaster, Clock clock, long idleMillis, RelayMetrics metrics) {
        if (idleMillis <= 0) {
            throw new IllegalArgumentException("idleMillis must be positive");
        }
        this.broadcaster = broadcaster;
        this.clock = clock;
        this.idleMillis = idleMillis;
        this.metrics = metrics;
    }

    /**
     * Records a typing start or stop signal and broadcasts the result.
     *
     * <p>
     * A start inserts or refreshes the entry and broadcasts
     * {@code member-typing} with everyone typing in the channel. A stop removes
     * the entry if present and always broadcasts {@code member-stop-typing}
     * with the users still typing.
     * </p>
     *
     * @param channelName the channel
     * @param userId      the user
     * @param displayName the user's display name
     * @param isTyping    true for a start signal, false for a stop signal
     */
    public void setTyping(String channelName, String userId, String displayName, boolean isTyping) {
        logger.atDebug()
                .addArgument(channelName)
                .addArgument(userId)
                .addArgument(isTyping)
                .log("Handling typing event in {} for {}: typing={}");

        if (isTyping) {
            List<TypingEntry> typing = new ArrayList<>();
            long now = clock.millis();
            typingUsers.compute(channelName, (k, entries) -> {
                var channel = entries == null ? new LinkedHashMap<String, TypingEntry>() : entries;
                channel.put(userId, new TypingEntry(userId, displayName, now));
                visible(channel, now, typing);
                return channel;
            });
            broadcaster.broadcast(channelName, EventType.MEMBER_TYPING, new TypingUpdate(typing));
        } else {
            var remaining = remove(channelName, userId, new AtomicReference<>());
            broadcaster.broadcast(channelName, EventType.MEMBER_STOP_TYPING,
                    new StopTypingUpdate(userId, displayName, remaining));
        }
    }

    /**
     * Removes a user's entry from a channel, broadcasting
     * {@code member-stop-typing} only if there was one.
     *
     * @param channelName the channel
     * @param userId      the user
     * @return true if an entry was removed
     */
    public boolean clear(String channelName, String userId) {
        var removed = new AtomicReference<TypingEntry>();
        var remaining = remove(channelName, userId, removed);
        var entry = removed.get();
        if (entry == null) {
            return false;
        }
        broadcaster.broadcast(channelName, EventType.MEMBER_STOP_TYPING,
                new StopTypingUpdate(userId, entry.displayName(), remaining));
        logger.atDebug()
                .addArgument(userId)
                .addArgument(channelName)
                .log("Removed typing indicator for {} in {}");
        return true;
    }

    /**
     * Returns the users currently typing in a channel, oldest signal first.
     *
     * @param channelName the channel
     * @return the non-expired entries
     */
    public List<TypingEntry> typingUsers(String channelName) {
        List<TypingEntry> typing = new ArrayList<>();
        long now = clock.millis();
        typingUsers.computeIfPresent(channelName, (k, channel) -> {
            visible(channel, now, typing);
            return channel;
        });
        return List.copyOf(typing);
    }

    /**
     * Number of channels holding at least one typing entry.
     *
     * @return the channel count
     */
    public int channelCount() {
        return typingUsers.size();
    }

    /**
     * Evicts every entry idle for longer than the window, broadcasting one
     * {@code member-stop-typing} per eviction. Channels left without entries
     * are dropped.
     *
     * @return the number of evicted entries
     */
    public int sweep() {
        long now = clock.millis();
        int evicted = 0;
        for (String channelName : typingUsers.keySet()) {
            List<TypingEntry> expired = new ArrayList<>();
            List<TypingEntry> remaining = new ArrayList<>();
            typingUsers.computeIfPresent(channelName, (k, channel) -> {
                var it = channel.values().iterator();
                while (it.hasNext()) {
                    var entry = it.next();
                    if (entry.isExpired(now, idleMillis)) {
                        expired.add(entry);
                        it.remove();
                    }
                }
                remaining.addAll(channel.values());
                return channel.isEmpty() ? null : channel;
            });

            for (TypingEntry entry : expired) {
                metrics.recordTypingEviction(channelName);
                broadcaster.broadcast(channelName, EventType.MEMBER_STOP_TYPING,
                        new StopTypingUpdate(entry.userId(), entry.displayName(), remaining));
            }
            evicted += expired.size();
        }

        if (evicted > 0) {
            logger.atDebug()
                    .addArgument(evicted)
                    .log("Expired {} typing indicators");
        }
        return evicted;
    }

    private List<TypingEntry> remove(String channelName, String userId, AtomicReference<TypingEntry> removed) {
        List<TypingEntry> remaining = new ArrayList<>();
        long now = clock.millis();
        typingUsers.computeIfPresent(channelName, (k, channel) -> {
            removed.set(channel.remove(userId));
            visible(channel, now, remaining);
            return channel.isEmpty() ? null : channel;
        });
        return remaining;
    }

    private void visible(Map<String, TypingEntry> channel, long now, List<TypingEntry> into) {
        for (TypingEntry entry : channel.values()) {
            if (!entry.isExpired(now, idleMillis)) {
                into.add(entry);
            }
        }
    }
}
