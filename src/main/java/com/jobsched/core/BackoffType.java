package com.jobsched.core;

/**
 * Retry backoff forwarded to the executor.
 */
public enum BackoffType {
    FIXED(5000),
    EXPONENTIAL(2000);

    private final long baseDelayMs;

    BackoffType(long baseDelayMs) {
        this.baseDelayMs = baseDelayMs;
    }

    public long baseDelayMs() {
        return baseDelayMs;
    }
}
