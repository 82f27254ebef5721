package com.jobsched.stats;

/**
 * Counters for one priority tier.
 *
 * @param avgWaitTime      Running average of creation-to-dispatch time (ms)
 * @param avgExecutionTime Running average of reported execution durations (ms)
 */
public record PriorityStats(
        long scheduled,
        long executed,
        long failed,
        double avgWaitTime,
        double avgExecutionTime
) {
}
