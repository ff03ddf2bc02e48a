package com.p14n.relay.registry;

import com.p14n.relay.connection.RelayConnection;
import com.p14n.relay.data.EventType;

/**
 * Fans an event out to the subscribers of a channel.
 */
public interface Broadcaster {

    /**
     * Sends an event to every open subscriber of a channel except one.
     *
     * @param channelName the target channel
     * @param event       the event type
     * @param payload     the event data
     * @param exclude     a connection that must not receive the event, or null
     * @return delivery counts for the broadcast
     */
    BroadcastResult broadcast(String channelName, EventType event, Object payload, RelayConnection exclude);

    /**
     * Sends an event to every open subscriber of a channel.
     *
     * @param channelName the target channel
     * @param event       the event type
     * @param payload     the event data
     * @return delivery counts for the broadcast
     */
    default BroadcastResult broadcast(String channelName, EventType event, Object payload) {
        return broadcast(channelName, event, payload, null);
    }
}
