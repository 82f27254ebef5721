package com.jobsched.config;

/**
 * Per-tier settings within a queue.
 *
 * @param weight         Relative weight of the tier
 * @param maxConcurrency Maximum concurrent jobs of the tier (advisory, forwarded to operators)
 */
public record PriorityLevelConfig(
        int weight,
        int maxConcurrency
) {
}
