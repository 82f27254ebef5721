package com.jobsched.priority;

/**
 * Dynamic priority of a job and the terms it was computed from. Lower is more urgent.
 */
public record PriorityScore(
        int base,
        double ageBoost,
        double starvationBoost,
        double loadPenalty,
        double score
) {
    /**
     * Score rounded for the executor.
     */
    public int rounded() {
        return (int) Math.round(score);
    }
}
