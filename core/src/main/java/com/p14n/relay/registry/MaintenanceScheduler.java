package com.p14n.relay.registry;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import com.p14n.relay.data.RelayConfig;
import com.p14n.relay.executor.AsyncExecutor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the registry's periodic maintenance: reclaiming connections that closed
 * without a close event and expiring idle typing indicators.
 *
 * <p>
 * The two tasks run on independent fixed-rate timers. A failing run is logged
 * and the next run goes ahead as scheduled.
 * </p>
 */
public class MaintenanceScheduler implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private final ChannelRegistry registry;
    private final AsyncExecutor executor;
    private final long cleanupIntervalSeconds;
    private final long typingSweepMillis;
    private ScheduledFuture<?> cleanup;
    private ScheduledFuture<?> sweep;

    public MaintenanceScheduler(ChannelRegistry registry, AsyncExecutor executor, RelayConfig config) {
        this(registry, executor, config.cleanupIntervalSeconds(), config.typingSweepMillis());
    }

    public MaintenanceScheduler(ChannelRegistry registry, AsyncExecutor executor, long cleanupIntervalSeconds,
            long typingSweepMillis) {
        this.registry = registry;
        this.executor = executor;
        this.cleanupIntervalSeconds = cleanupIntervalSeconds;
        this.typingSweepMillis = typingSweepMillis;
    }

    /**
     * Starts both timers.
     *
     * @throws IllegalStateException if already started
     */
    public synchronized void start() {
        if (cleanup != null) {
            throw new IllegalStateException("Maintenance already started");
        }
        cleanup = executor.scheduleAtFixedRate(() -> runGuarded("connection cleanup",
                registry::cleanupInactiveConnections),
                cleanupIntervalSeconds, cleanupIntervalSeconds, TimeUnit.SECONDS);
        sweep = executor.scheduleAtFixedRate(() -> runGuarded("typing sweep",
                () -> registry.typingTracker().sweep()),
                typingSweepMillis, typingSweepMillis, TimeUnit.MILLISECONDS);
        logger.atInfo()
                .addArgument(cleanupIntervalSeconds)
                .addArgument(typingSweepMillis)
                .log("Maintenance started: cleanup every {}s, typing sweep every {}ms");
    }

    private void runGuarded(String name, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            logger.atError()
                    .addArgument(name)
                    .setCause(e)
                    .log("Maintenance task {} failed");
        }
    }

    @Override
    public synchronized void close() {
        if (cleanup != null) {
            cleanup.cancel(false);
            sweep.cancel(false);
            cleanup = null;
            sweep = null;
            logger.atInfo().log("Maintenance stopped");
        }
    }
}
