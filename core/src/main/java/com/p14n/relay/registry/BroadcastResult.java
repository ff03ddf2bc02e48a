package com.p14n.relay.registry;

import com.p14n.relay.data.EventType;

/**
 * Outcome of a single broadcast.
 *
 * @param channelName the target channel
 * @param event       the event type
 * @param subscribers subscriptions in the channel when the broadcast started
 * @param delivered   connections that accepted the frame
 * @param excluded    connections skipped because they were excluded
 * @param skipped     connections skipped because they were not open or failed
 */
public record BroadcastResult(String channelName,
        EventType event,
        int subscribers,
        int delivered,
        int excluded,
        int skipped) {

    /**
     * Result for a broadcast to a channel that does not exist.
     */
    static BroadcastResult noChannel(String channelName, EventType event) {
        return new BroadcastResult(channelName, event, 0, 0, 0, 0);
    }
}
