package com.p14n.relay.vertx;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.p14n.relay.data.RelayConfig;
import com.p14n.relay.registry.ChannelRegistry;
import com.p14n.relay.vertx.auth.CredentialVerifier;
import com.p14n.relay.vertx.handler.BroadcastHandler;
import com.p14n.relay.vertx.handler.HealthHandler;

import io.opentelemetry.api.OpenTelemetry;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.ext.web.handler.CorsHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vert.x HTTP server exposing the relay.
 *
 * <p>
 * Routes:
 * </p>
 * <ul>
 * <li>{@code GET <webSocketPath>?token=...}: authenticated WebSocket
 * upgrade</li>
 * <li>{@code POST /api/broadcast}: broadcast an event into a channel</li>
 * <li>{@code GET /health}: connection and channel counts</li>
 * </ul>
 * <p>
 * When allowed origins are configured every route sits behind a CORS handler
 * that admits only those origins.
 * </p>
 */
public class VertxRelayServer implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(VertxRelayServer.class);

    /** Largest accepted ingestion body, in bytes. */
    public static final long MAX_BODY_BYTES = 100 * 1024;

    private final Vertx vertx;
    private final RelayConfig config;
    private final ChannelRegistry registry;
    private final CredentialVerifier verifier;
    private final OpenTelemetry ot;
    private final ObjectMapper mapper = new ObjectMapper();
    private final ConnectionStats stats = new ConnectionStats();
    private HttpServer server;

    /**
     * Creates a new VertxRelayServer.
     *
     * @param vertx    the Vert.x instance that owns the HTTP server
     * @param config   the relay configuration
     * @param registry the channel registry
     * @param verifier verifier for connection tokens
     * @param ot       the OpenTelemetry instance for tracing
     */
    public VertxRelayServer(Vertx vertx, RelayConfig config, ChannelRegistry registry, CredentialVerifier verifier,
            OpenTelemetry ot) {
        this.vertx = vertx;
        this.config = config;
        this.registry = registry;
        this.verifier = verifier;
        this.ot = ot;
    }

    /**
     * Starts listening and waits for the server to bind.
     *
     * @return the bound port
     * @throws InterruptedException  if interrupted while waiting
     * @throws IllegalStateException if the server is already started or fails
     *                               to bind in time
     */
    public synchronized int start() throws InterruptedException {
        if (server != null) {
            throw new IllegalStateException("Server already started");
        }
        logger.atInfo().log("Starting relay server");

        var router = Router.router(vertx);
        if (!config.allowedOrigins().isEmpty()) {
            router.route().handler(CorsHandler.create()
                    .addOrigins(List.copyOf(config.allowedOrigins()))
                    .allowedMethod(HttpMethod.GET)
                    .allowedMethod(HttpMethod.POST)
                    .allowedHeader("Content-Type")
                    .allowCredentials(true));
        }

        var tracer = ot.getTracer("com.p14n.relay.vertx");
        router.post("/api/broadcast")
                .handler(BodyHandler.create().setBodyLimit(MAX_BODY_BYTES))
                .handler(new BroadcastHandler(registry, mapper, tracer));
        router.get("/health")
                .handler(new HealthHandler(registry, stats, mapper, Clock.systemUTC()));
        router.get(config.webSocketPath())
                .handler(new WebSocketAcceptor(verifier, new ConnectionHandler(registry, mapper, stats), mapper));

        var httpServer = vertx.createHttpServer().requestHandler(router);
        try {
            server = httpServer.listen(config.port())
                    .toCompletionStage()
                    .toCompletableFuture()
                    .get(config.startupTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            throw new IllegalStateException("Failed to start relay server on port " + config.port(), e);
        }

        logger.atInfo()
                .addArgument(server.actualPort())
                .addArgument(config.webSocketPath())
                .log("Relay server listening on port {}, WebSocket path {}");
        return server.actualPort();
    }

    public ConnectionStats connectionStats() {
        return stats;
    }

    @Override
    public synchronized void close() {
        if (server == null) {
            return;
        }
        try {
            server.close()
                    .toCompletionStage()
                    .toCompletableFuture()
                    .get(config.shutdownTimeoutSeconds(), TimeUnit.SECONDS);
            logger.atInfo().log("Relay server stopped");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.atWarn().log("Interrupted while stopping relay server");
        } catch (ExecutionException | TimeoutException e) {
            logger.atWarn()
                    .setCause(e)
                    .log("Relay server did not stop cleanly");
        } finally {
            server = null;
        }
    }
}
