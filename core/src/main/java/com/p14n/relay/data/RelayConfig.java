package com.p14n.relay.data;

import java.util.Set;

/**
 * Configuration for a relay process.
 * Covers the listening endpoint, credential verification and the timings of the
 * periodic maintenance tasks.
 */
public interface RelayConfig {

    /**
     * Gets the HTTP port serving WebSocket upgrades, ingestion and health.
     * Zero binds an ephemeral port.
     *
     * @return the port number
     */
    int port();

    /**
     * Gets the shared secret used to verify connection tokens.
     *
     * @return the secret
     */
    String jwtSecret();

    /**
     * Gets the browser origins allowed by CORS. An empty set disables the CORS
     * handler entirely.
     *
     * @return the allowed origins
     */
    Set<String> allowedOrigins();

    /**
     * Gets the request path that accepts WebSocket upgrades.
     *
     * @return the path
     */
    String webSocketPath();

    /**
     * Gets the interval between sweeps for connections that closed without a
     * close event.
     *
     * @return the interval in seconds
     */
    long cleanupIntervalSeconds();

    /**
     * Gets how long a typing indicator stays visible without a refresh.
     *
     * @return the idle window in milliseconds
     */
    long typingTimeoutMillis();

    /**
     * Gets the interval between typing expiry sweeps.
     *
     * @return the interval in milliseconds
     */
    long typingSweepMillis();

    /**
     * Whether removing a single subscription outside a connection teardown
     * announces the user as offline to the rest of the channel.
     *
     * @return true to broadcast offline presence on unsubscribe
     */
    boolean announceOfflineOnUnsubscribe();

    /**
     * Gets the time allowed for a graceful shutdown before the process halts.
     *
     * @return the timeout in seconds
     */
    int shutdownTimeoutSeconds();

    /**
     * Gets the OTLP collector endpoint, or null when telemetry export is off.
     *
     * @return the endpoint URL or null
     */
    String otlpEndpoint();

    /**
     * Gets the startup timeout in seconds.
     * Default is 30 seconds.
     *
     * @return The startup timeout in seconds
     */
    default int startupTimeoutSeconds() {
        return 30;
    }
}
