package com.p14n.relay.executor;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Default implementation of {@link AsyncExecutor} backed by a scheduled thread
 * pool with named daemon threads.
 */
public class DefaultExecutor implements AsyncExecutor {

        private final ScheduledExecutorService se;

        /**
         * Creates a new executor with a scheduled thread pool.
         *
         * @param scheduledSize the size of the scheduled thread pool
         */
        public DefaultExecutor(int scheduledSize) {
                this.se = createScheduledExecutorService(scheduledSize);
        }

        /**
         * Creates a scheduled thread pool with named threads.
         *
         * @param size the size of the pool
         * @return a scheduled thread pool executor service
         */
        protected ScheduledExecutorService createScheduledExecutorService(int size) {
                return Executors.newScheduledThreadPool(size,
                                new ThreadFactoryBuilder()
                                                .setNameFormat("relay-scheduled-%d")
                                                .setDaemon(true)
                                                .build());
        }

        @Override
        public ScheduledFuture<?> scheduleAtFixedRate(Runnable command, long initialDelay, long period, TimeUnit unit) {
                return se.scheduleAtFixedRate(command, initialDelay, period, unit);
        }

        @Override
        public List<Runnable> shutdownNow() {
                return se.shutdownNow();
        }
}
