package com.p14n.relay.registry;

import java.util.List;

/**
 * Point-in-time copy of the registry's channels.
 *
 * @param totalChannels number of live channels
 * @param channels      per channel subscriber counts
 */
public record RegistryStats(int totalChannels, List<ChannelStats> channels) {

    public RegistryStats {
        channels = List.copyOf(channels);
    }

    /**
     * Subscriber count of a single channel.
     *
     * @param name        the channel name
     * @param subscribers the number of subscriptions
     */
    public record ChannelStats(String name, int subscribers) {
    }
}
