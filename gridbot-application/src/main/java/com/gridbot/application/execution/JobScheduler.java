package com.gridbot.application.execution;

/**
 * Schedules repeated cycles. Production uses a thread pool, tests a manual scheduler; the
 * application code does not care which.
 */
public interface JobScheduler {

    /**
     * Runs {@code task} repeatedly with {@code delayMs} between the end of one run and the start of
     * the next. Runs of the same key never overlap.
     */
    RunHandle scheduleWithFixedDelay(String key, CycleTask task, long initialDelayMs, long delayMs);
}
