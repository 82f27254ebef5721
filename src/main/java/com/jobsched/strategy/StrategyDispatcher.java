package com.jobsched.strategy;

import com.jobsched.core.ScheduledJobConfig;
import com.jobsched.core.SchedulingStrategy;
import com.jobsched.exception.SchedulerException;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Routes a job to the handler of its strategy and owns cancellation of the job's timers.
 */
public class StrategyDispatcher {

    private final Map<SchedulingStrategy, StrategyHandler> handlers = new EnumMap<>(SchedulingStrategy.class);
    private final ScheduledTaskRegistry tasks;
    private final DependencyIndex dependencies;

    public StrategyDispatcher(Collection<StrategyHandler> handlers, ScheduledTaskRegistry tasks,
                              DependencyIndex dependencies) {
        for (StrategyHandler handler : handlers) {
            this.handlers.put(handler.strategy(), handler);
        }
        for (SchedulingStrategy strategy : SchedulingStrategy.values()) {
            if (!this.handlers.containsKey(strategy)) {
                throw new SchedulerException("No handler for strategy " + strategy);
            }
        }
        this.tasks = tasks;
        this.dependencies = dependencies;
    }

    public void schedule(ScheduledJobConfig job) {
        handlers.get(job.strategy()).schedule(job);
    }

    public void restore(ScheduledJobConfig job) {
        handlers.get(job.strategy()).restore(job);
    }

    /**
     * Cancel every timer armed for the job and drop its dependency edges.
     *
     * @return true if a timer was cancelled
     */
    public boolean cancel(String jobId) {
        dependencies.remove(jobId);
        return tasks.cancelAll(jobId);
    }

    public Set<String> dependentsOf(String jobId) {
        return dependencies.dependentsOf(jobId);
    }

    public int pendingTasks() {
        return tasks.size();
    }

    public void cancelEverything() {
        tasks.cancelEverything();
    }
}
