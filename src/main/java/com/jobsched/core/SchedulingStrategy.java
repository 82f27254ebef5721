package com.jobsched.core;

import java.util.Locale;

/**
 * How a job is handed to the executor.
 */
public enum SchedulingStrategy {
    /**
     * Dispatch now, with a fairness delay.
     */
    IMMEDIATE,

    /**
     * Dispatch once at {@code executeAt} or after {@code delay}.
     */
    DELAYED,

    /**
     * Dispatch on every fire of a cron pattern, until limit or end date.
     */
    RECURRING,

    /**
     * Dispatch once when dependencies, triggers and expression all hold.
     */
    CONDITIONAL,

    /**
     * Hand the payload's items to the batch collaborator.
     */
    BATCH;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
