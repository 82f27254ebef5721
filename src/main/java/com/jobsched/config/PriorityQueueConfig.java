package com.jobsched.config;

import com.jobsched.core.JobPriority;
import com.jobsched.exception.ConfigurationException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Fairness configuration for one execution queue.
 *
 * @param queueName            Queue name
 * @param priorityLevels       Weight and concurrency per tier
 * @param fairnessRatio        0..1, scales weighted fair queuing delays (0 disables them)
 * @param starvationPrevention Whether starved tiers receive an urgency boost
 * @param maxQueueSize         Backlog considered full capacity
 * @param rateLimiting         Optional submission rate limit
 */
public record PriorityQueueConfig(
        String queueName,
        Map<JobPriority, PriorityLevelConfig> priorityLevels,
        double fairnessRatio,
        boolean starvationPrevention,
        int maxQueueSize,
        RateLimitConfig rateLimiting
) {
    public PriorityQueueConfig {
        if (queueName == null || queueName.isBlank()) {
            throw new ConfigurationException("Queue name cannot be blank");
        }
        if (fairnessRatio < 0 || fairnessRatio > 1) {
            throw new ConfigurationException("Queue '" + queueName
                    + "' fairness-ratio must be within [0,1], got " + fairnessRatio);
        }
        if (maxQueueSize <= 0) {
            throw new ConfigurationException("Queue '" + queueName
                    + "' max-queue-size must be positive, got " + maxQueueSize);
        }
        if (rateLimiting != null && (rateLimiting.windowMs() <= 0 || rateLimiting.maxJobs() <= 0)) {
            throw new ConfigurationException("Queue '" + queueName
                    + "' rate-limiting requires positive window-ms and max-jobs");
        }
        EnumMap<JobPriority, PriorityLevelConfig> levels = new EnumMap<>(JobPriority.class);
        levels.putAll(defaultLevels());
        if (priorityLevels != null) {
            levels.putAll(priorityLevels);
        }
        priorityLevels = Collections.unmodifiableMap(levels);
    }

    /**
     * Queue with the default fairness settings.
     */
    public static PriorityQueueConfig defaults(String queueName) {
        return new PriorityQueueConfig(queueName, defaultLevels(), 0.3, true, 10_000,
                RateLimitConfig.perMinute(1000));
    }

    public static Map<JobPriority, PriorityLevelConfig> defaultLevels() {
        Map<JobPriority, PriorityLevelConfig> levels = new EnumMap<>(JobPriority.class);
        levels.put(JobPriority.URGENT, new PriorityLevelConfig(1, 10));
        levels.put(JobPriority.HIGH, new PriorityLevelConfig(2, 8));
        levels.put(JobPriority.NORMAL, new PriorityLevelConfig(3, 5));
        levels.put(JobPriority.LOW, new PriorityLevelConfig(4, 3));
        levels.put(JobPriority.DEFERRED, new PriorityLevelConfig(5, 1));
        return levels;
    }

    public PriorityLevelConfig level(JobPriority priority) {
        return priorityLevels.get(priority);
    }

    /**
     * Apply a partial update. Absent fields keep their current value.
     */
    public PriorityQueueConfig apply(PriorityQueueConfigPatch patch) {
        if (patch == null) {
            return this;
        }
        Map<JobPriority, PriorityLevelConfig> levels = new EnumMap<>(JobPriority.class);
        levels.putAll(priorityLevels);
        if (patch.priorityLevels() != null) {
            levels.putAll(patch.priorityLevels());
        }
        return new PriorityQueueConfig(
                queueName,
                levels,
                patch.fairnessRatio() != null ? patch.fairnessRatio() : fairnessRatio,
                patch.starvationPrevention() != null ? patch.starvationPrevention() : starvationPrevention,
                patch.maxQueueSize() != null ? patch.maxQueueSize() : maxQueueSize,
                patch.rateLimiting() != null ? patch.rateLimiting() : rateLimiting
        );
    }
}
