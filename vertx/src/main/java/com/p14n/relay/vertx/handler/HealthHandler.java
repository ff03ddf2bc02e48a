package com.p14n.relay.vertx.handler;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.p14n.relay.registry.ChannelRegistry;
import com.p14n.relay.registry.RegistryStats;
import com.p14n.relay.vertx.ConnectionStats;

import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;

/**
 * Handles {@code GET /health} with connection counts and per-channel
 * subscriber counts.
 */
public class HealthHandler implements Handler<RoutingContext> {

    private final ChannelRegistry registry;
    private final ConnectionStats stats;
    private final ObjectMapper mapper;
    private final Clock clock;

    public HealthHandler(ChannelRegistry registry, ConnectionStats stats, ObjectMapper mapper, Clock clock) {
        this.registry = registry;
        this.stats = stats;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public void handle(RoutingContext ctx) {
        var registryStats = registry.getStats();
        var report = new HealthReport("healthy",
                Instant.now(clock).toString(),
                stats.activeConnections(),
                stats.totalConnections(),
                registryStats.totalChannels(),
                registryStats.channels());
        JsonResponses.send(ctx.response(), mapper, 200, report);
    }

    /**
     * Body of a health response.
     */
    public record HealthReport(String status,
            String timestamp,
            int activeConnections,
            long totalConnections,
            int totalChannels,
            List<RegistryStats.ChannelStats> channels) {
    }
}
