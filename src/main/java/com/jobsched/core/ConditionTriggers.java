package com.jobsched.core;

/**
 * Environmental gates for a conditional job. Every declared trigger must hold.
 *
 * @param queueDepth Backlog of a named queue must reach a threshold
 * @param timeWindow Current local time must fall within HH:mm bounds
 * @param systemLoad One-minute load average must not exceed a threshold
 */
public record ConditionTriggers(
        QueueDepth queueDepth,
        TimeWindow timeWindow,
        SystemLoad systemLoad
) {
    public record QueueDepth(String queue, long threshold) {
    }

    public record TimeWindow(String start, String end) {
    }

    public record SystemLoad(double threshold) {
    }

    public boolean hasAny() {
        return queueDepth != null || timeWindow != null || systemLoad != null;
    }
}
