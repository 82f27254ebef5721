package com.jobsched.strategy;

import com.jobsched.core.ScheduledJobConfig;
import com.jobsched.core.SchedulingStrategy;

/**
 * Dispatches on registration. Dispatch failures reach the caller.
 */
public class ImmediateStrategyHandler implements StrategyHandler {

    private final JobDispatcher dispatcher;

    public ImmediateStrategyHandler(JobDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public SchedulingStrategy strategy() {
        return SchedulingStrategy.IMMEDIATE;
    }

    @Override
    public void schedule(ScheduledJobConfig job) {
        dispatcher.dispatch(job);
    }
}
