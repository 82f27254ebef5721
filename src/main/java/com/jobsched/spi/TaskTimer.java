package com.jobsched.spi;

import java.time.Duration;

/**
 * Arms one-shot and periodic tasks and returns handles that cancel them.
 */
public interface TaskTimer {

    TimerHandle schedule(Runnable task, Duration delay);

    TimerHandle scheduleAtFixedRate(Runnable task, Duration period);

    /**
     * Cancel everything still armed and stop accepting tasks.
     */
    void shutdown();
}
