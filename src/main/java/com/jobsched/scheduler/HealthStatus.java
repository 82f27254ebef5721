package com.jobsched.scheduler;

public enum HealthStatus {
    HEALTHY,
    WARNING,
    CRITICAL
}
