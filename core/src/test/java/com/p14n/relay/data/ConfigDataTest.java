package com.p14n.relay.data;

import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConfigDataTest {

    @Test
    void shouldApplyDefaults() {
        var config = ConfigData.fromEnvironment(Map.of("WS_JWT_SECRET", "secret"));

        assertEquals(3001, config.port());
        assertEquals("/", config.webSocketPath());
        assertEquals(ConfigData.DEFAULT_ALLOWED_ORIGINS, config.allowedOrigins());
        assertEquals(300, config.cleanupIntervalSeconds());
        assertEquals(3000, config.typingTimeoutMillis());
        assertEquals(1000, config.typingSweepMillis());
        assertFalse(config.announceOfflineOnUnsubscribe());
        assertNull(config.otlpEndpoint());
        assertEquals(30, config.startupTimeoutSeconds());
    }

    @Test
    void shouldReadEnvironment() {
        var config = ConfigData.fromEnvironment(Map.of(
                "WS_JWT_SECRET", "secret",
                "PORT", "8080",
                "ALLOWED_ORIGINS", "https://a.example, https://b.example,,",
                "WS_PATH", "/ws",
                "TYPING_TIMEOUT_MILLIS", "5000",
                "ANNOUNCE_OFFLINE_ON_UNSUBSCRIBE", "true"));

        assertEquals(8080, config.port());
        assertEquals(Set.of("https://a.example", "https://b.example"), config.allowedOrigins());
        assertEquals("/ws", config.webSocketPath());
        assertEquals(5000, config.typingTimeoutMillis());
        assertTrue(config.announceOfflineOnUnsubscribe());
    }

    @Test
    void shouldRejectMissingSecretAndBadNumbers() {
        assertThrows(IllegalArgumentException.class, () -> ConfigData.fromEnvironment(Map.of()));
        var e = assertThrows(IllegalArgumentException.class,
                () -> ConfigData.fromEnvironment(Map.of("WS_JWT_SECRET", "s", "PORT", "eighty")));
        assertTrue(e.getMessage().contains("PORT"));
        assertThrows(IllegalArgumentException.class,
                () -> ConfigData.fromEnvironment(Map.of("WS_JWT_SECRET", "s", "TYPING_SWEEP_MILLIS", "0")));
    }

    @Test
    void shouldRejectIntegerSettingsOutOfRange() {
        var port = assertThrows(IllegalArgumentException.class,
                () -> ConfigData.fromEnvironment(Map.of("WS_JWT_SECRET", "s", "PORT", "4294967297")));
        assertTrue(port.getMessage().contains("PORT"));
        var shutdown = assertThrows(IllegalArgumentException.class,
                () -> ConfigData.fromEnvironment(Map.of("WS_JWT_SECRET", "s", "SHUTDOWN_TIMEOUT_SECONDS", "3000000000")));
        assertTrue(shutdown.getMessage().contains("SHUTDOWN_TIMEOUT_SECONDS"));
    }
}
