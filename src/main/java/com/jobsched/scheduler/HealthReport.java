package com.jobsched.scheduler;

import java.util.List;

/**
 * Result of {@link JobScheduler#healthCheck()}.
 *
 * @param scheduledJobs    Jobs held by the registry
 * @param pendingJobs      Timer tasks still armed
 * @param failureRate      Failed share of dispatch attempts
 * @param avgExecutionTime Average reported execution time (ms)
 * @param issues           Human readable findings, empty when healthy
 */
public record HealthReport(
        HealthStatus status,
        int scheduledJobs,
        int pendingJobs,
        double failureRate,
        double avgExecutionTime,
        List<String> issues
) {
    public HealthReport {
        issues = List.copyOf(issues);
    }

    static HealthReport failed() {
        return new HealthReport(HealthStatus.CRITICAL, 0, 0, 1, 0, List.of("Health check failed"));
    }
}
