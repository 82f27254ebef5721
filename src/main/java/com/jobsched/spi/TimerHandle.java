package com.jobsched.spi;

/**
 * Handle of a task armed on a {@link TaskTimer}.
 */
public interface TimerHandle {

    /**
     * Cancel the task. Idempotent; a task already running is not interrupted.
     */
    void cancel();

    boolean isCancelled();
}
