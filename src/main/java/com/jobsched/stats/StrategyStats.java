package com.jobsched.stats;

/**
 * Counters for one scheduling strategy.
 */
public record StrategyStats(
        long scheduled,
        long executed,
        long failed
) {
}
