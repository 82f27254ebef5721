package com.jobsched.stats;

import com.jobsched.core.JobPriority;
import com.jobsched.core.SchedulingStrategy;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable snapshot of the scheduling counters.
 */
public record SchedulingStats(
        long totalJobsScheduled,
        long totalJobsExecuted,
        long totalJobsFailed,
        double averageExecutionTime,
        Map<JobPriority, PriorityStats> byPriority,
        Map<SchedulingStrategy, StrategyStats> byStrategy,
        Map<String, QueueHealth> queueHealth
) {
    public SchedulingStats {
        byPriority = Collections.unmodifiableMap(new EnumMap<>(byPriority));
        byStrategy = Collections.unmodifiableMap(new EnumMap<>(byStrategy));
        queueHealth = Collections.unmodifiableMap(new LinkedHashMap<>(queueHealth));
    }

    public PriorityStats priority(JobPriority priority) {
        return byPriority.get(priority);
    }

    public StrategyStats strategy(SchedulingStrategy strategy) {
        return byStrategy.get(strategy);
    }

    public QueueHealth queue(String queueName) {
        return queueHealth.getOrDefault(queueName, QueueHealth.empty());
    }

    /**
     * Share of failed dispatch attempts, 0 when nothing was attempted.
     */
    public double failureRate() {
        long attempts = totalJobsExecuted + totalJobsFailed;
        return attempts > 0 ? (double) totalJobsFailed / attempts : 0;
    }
}
