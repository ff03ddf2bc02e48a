package com.p14n.relay.data;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

public record ConfigData(int port,
        String jwtSecret,
        Set<String> allowedOrigins,
        String webSocketPath,
        long cleanupIntervalSeconds,
        long typingTimeoutMillis,
        long typingSweepMillis,
        boolean announceOfflineOnUnsubscribe,
        int shutdownTimeoutSeconds,
        String otlpEndpoint) implements RelayConfig {

    public static final int DEFAULT_PORT = 3001;
    public static final long DEFAULT_CLEANUP_INTERVAL_SECONDS = 300;
    public static final long DEFAULT_TYPING_TIMEOUT_MILLIS = 3000;
    public static final long DEFAULT_TYPING_SWEEP_MILLIS = 1000;
    public static final int DEFAULT_SHUTDOWN_TIMEOUT_SECONDS = 10;
    public static final Set<String> DEFAULT_ALLOWED_ORIGINS = Set.of(
            "https://channels-livid.vercel.app",
            "http://localhost:3000");

    public ConfigData {
        if (jwtSecret == null || jwtSecret.isBlank()) {
            throw new IllegalArgumentException("jwtSecret cannot be null or empty");
        }
        if (typingTimeoutMillis <= 0 || typingSweepMillis <= 0 || cleanupIntervalSeconds <= 0) {
            throw new IllegalArgumentException("Maintenance intervals must be positive");
        }
        allowedOrigins = allowedOrigins == null ? Set.of() : Set.copyOf(allowedOrigins);
        webSocketPath = webSocketPath == null || webSocketPath.isBlank() ? "/" : webSocketPath;
    }

    public ConfigData(int port, String jwtSecret) {
        this(port, jwtSecret, Set.of(), "/", DEFAULT_CLEANUP_INTERVAL_SECONDS, DEFAULT_TYPING_TIMEOUT_MILLIS,
                DEFAULT_TYPING_SWEEP_MILLIS, false, DEFAULT_SHUTDOWN_TIMEOUT_SECONDS, null);
    }

    /**
     * Builds a configuration from environment variables, applying defaults for
     * anything not set.
     *
     * @param env the environment, usually {@code System.getenv()}
     * @return the configuration
     * @throws IllegalArgumentException if WS_JWT_SECRET is missing or a numeric
     *                                  value cannot be parsed
     */
    public static ConfigData fromEnvironment(Map<String, String> env) {
        var origins = env.containsKey("ALLOWED_ORIGINS")
                ? csv(env.get("ALLOWED_ORIGINS"))
                : DEFAULT_ALLOWED_ORIGINS;
        return new ConfigData(
                intValue(env, "PORT", DEFAULT_PORT),
                env.get("WS_JWT_SECRET"),
                origins,
                env.getOrDefault("WS_PATH", "/"),
                longValue(env, "CLEANUP_INTERVAL_SECONDS", DEFAULT_CLEANUP_INTERVAL_SECONDS),
                longValue(env, "TYPING_TIMEOUT_MILLIS", DEFAULT_TYPING_TIMEOUT_MILLIS),
                longValue(env, "TYPING_SWEEP_MILLIS", DEFAULT_TYPING_SWEEP_MILLIS),
                Boolean.parseBoolean(env.getOrDefault("ANNOUNCE_OFFLINE_ON_UNSUBSCRIBE", "false")),
                intValue(env, "SHUTDOWN_TIMEOUT_SECONDS", DEFAULT_SHUTDOWN_TIMEOUT_SECONDS),
                env.get("OTEL_EXPORTER_OTLP_ENDPOINT"));
    }

    private static Set<String> csv(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static int intValue(Map<String, String> env, String name, int defaultValue) {
        var value = longValue(env, name, defaultValue);
        try {
            return Math.toIntExact(value);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(name + " must be a number but was '" + env.get(name) + "'", e);
        }
    }

    private static long longValue(Map<String, String> env, String name, long defaultValue) {
        var value = env.get(name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a number but was '" + value + "'", e);
        }
    }
}
