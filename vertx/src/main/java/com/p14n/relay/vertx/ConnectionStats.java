package com.p14n.relay.vertx;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts of accepted WebSocket connections since the server started.
 */
public class ConnectionStats {
    private final AtomicLong total = new AtomicLong();
    private final AtomicInteger active = new AtomicInteger();

    void opened() {
        total.incrementAndGet();
        active.incrementAndGet();
    }

    void closed() {
        active.decrementAndGet();
    }

    public long totalConnections() {
        return total.get();
    }

    public int activeConnections() {
        return active.get();
    }
}
