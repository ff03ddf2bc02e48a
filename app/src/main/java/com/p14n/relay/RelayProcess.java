package com.p14n.relay;

import java.util.concurrent.TimeUnit;

import com.p14n.relay.codec.FrameEncoder;
import com.p14n.relay.data.RelayConfig;
import com.p14n.relay.executor.AsyncExecutor;
import com.p14n.relay.executor.DefaultExecutor;
import com.p14n.relay.registry.ChannelRegistry;
import com.p14n.relay.registry.MaintenanceScheduler;
import com.p14n.relay.vertx.VertxRelayServer;
import com.p14n.relay.vertx.auth.JwtCredentialVerifier;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.vertx.core.Vertx;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A running relay: the registry, its maintenance timers and the HTTP server,
 * closed in reverse order of startup.
 */
public class RelayProcess implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(RelayProcess.class);

    private final Vertx vertx;
    private final AsyncExecutor executor;
    private final MaintenanceScheduler scheduler;
    private final VertxRelayServer server;
    private final OpenTelemetry ot;
    private final ChannelRegistry registry;
    private final int port;

    private RelayProcess(Vertx vertx, AsyncExecutor executor, MaintenanceScheduler scheduler,
            VertxRelayServer server, OpenTelemetry ot, ChannelRegistry registry, int port) {
        this.vertx = vertx;
        this.executor = executor;
        this.scheduler = scheduler;
        this.server = server;
        this.ot = ot;
        this.registry = registry;
        this.port = port;
    }

    /**
     * Starts a relay and waits for it to accept connections.
     *
     * @param config the relay configuration
     * @param ot     the OpenTelemetry instance; closed with the process when it
     *               is an SDK
     * @return the running process
     * @throws InterruptedException if interrupted while starting
     */
    public static RelayProcess start(RelayConfig config, OpenTelemetry ot) throws InterruptedException {
        var vertx = Vertx.vertx();
        var executor = new DefaultExecutor(1);
        var registry = new ChannelRegistry(config, new FrameEncoder(), ot, "com.p14n.relay");
        var scheduler = new MaintenanceScheduler(registry, executor, config);
        var server = new VertxRelayServer(vertx, config, registry, new JwtCredentialVerifier(config.jwtSecret()), ot);
        try {
            int port = server.start();
            scheduler.start();
            return new RelayProcess(vertx, executor, scheduler, server, ot, registry, port);
        } catch (RuntimeException | InterruptedException e) {
            executor.close();
            vertx.close();
            throw e;
        }
    }

    public int port() {
        return port;
    }

    public ChannelRegistry registry() {
        return registry;
    }

    @Override
    public void close() throws Exception {
        logger.atInfo().log("Stopping relay");
        scheduler.close();
        server.close();
        executor.close();
        vertx.close()
                .toCompletionStage()
                .toCompletableFuture()
                .get(10, TimeUnit.SECONDS);
        if (ot instanceof OpenTelemetrySdk sdk) {
            sdk.close();
        }
        logger.atInfo().log("Relay stopped");
    }
}
