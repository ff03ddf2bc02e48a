package com.p14n.relay.executor;

import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Interface for the timers that drive periodic maintenance.
 */
public interface AsyncExecutor extends AutoCloseable {

    /**
     * Schedules a task for repeated fixed-rate execution.
     * 
     * @param command      The task to execute
     * @param initialDelay The time to delay first execution
     * @param period       The period between successive executions
     * @param unit         The time unit of the initialDelay and period parameters
     * @return A ScheduledFuture representing pending completion of the task
     */
    ScheduledFuture<?> scheduleAtFixedRate(Runnable command,
            long initialDelay,
            long period,
            TimeUnit unit);

    /**
     * Shuts down the executor and returns a list of runnables that were not
     * executed.
     * 
     * @return A list of runnables that were not executed
     */
    List<Runnable> shutdownNow();

    @Override
    default void close() {
        shutdownNow();
    }
}
