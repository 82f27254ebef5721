package com.jobsched.core;

/**
 * Outcome of a dispatch attempt.
 */
public enum ExecutionStatus {
    COMPLETED,
    FAILED,
    TIMEOUT,
    CANCELLED
}
