package com.jobsched.strategy;

import com.jobsched.core.ScheduledJobConfig;
import com.jobsched.core.SchedulingStrategy;

/**
 * Scheduling behavior of one strategy.
 */
public interface StrategyHandler {

    SchedulingStrategy strategy();

    /**
     * Start scheduling a newly registered job.
     *
     * @throws com.jobsched.exception.DispatchException if a synchronous first dispatch fails
     */
    void schedule(ScheduledJobConfig job);

    /**
     * Resume a job reloaded from persistence. Jobs that fire once on registration are not replayed.
     */
    default void restore(ScheduledJobConfig job) {
    }
}
