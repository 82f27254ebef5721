package com.jobsched.config;

import com.jobsched.core.JobPriority;

import java.util.Map;

/**
 * Partial update of a {@link PriorityQueueConfig}. Null fields are left unchanged.
 */
public record PriorityQueueConfigPatch(
        Map<JobPriority, PriorityLevelConfig> priorityLevels,
        Double fairnessRatio,
        Boolean starvationPrevention,
        Integer maxQueueSize,
        RateLimitConfig rateLimiting
) {
    public static PriorityQueueConfigPatch fairnessRatio(double ratio) {
        return new PriorityQueueConfigPatch(null, ratio, null, null, null);
    }

    public static PriorityQueueConfigPatch maxQueueSize(int size) {
        return new PriorityQueueConfigPatch(null, null, null, size, null);
    }

    public static PriorityQueueConfigPatch starvationPrevention(boolean enabled) {
        return new PriorityQueueConfigPatch(null, null, enabled, null, null);
    }
}
