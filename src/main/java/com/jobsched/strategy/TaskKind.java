package com.jobsched.strategy;

/**
 * Kinds of timer task armed for a job. Each job holds at most one task per kind.
 */
public enum TaskKind {
    SCHEDULED("scheduled_"),
    RECURRING("recurring_"),
    CONDITIONAL("conditional_");

    private final String prefix;

    TaskKind(String prefix) {
        this.prefix = prefix;
    }

    public String key(String jobId) {
        return prefix + jobId;
    }
}
