package com.jobsched.config;

import com.jobsched.exception.ConfigurationException;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Root configuration of the scheduling engine.
 *
 * @param name                       Scheduler name identifier
 * @param queues                     Known queues (fixed for the lifetime of the process)
 * @param conditionCheckIntervalMs   Period of conditional re-checks
 * @param healthSweepIntervalMs      Period of the queue-health sweep
 * @param jobTtlSeconds              TTL of persisted job records
 * @param defaultTimeoutMs           Timeout forwarded when a job declares none
 * @param defaultRetries             Attempts forwarded when a job declares none
 */
public record SchedulerConfig(
        String name,
        List<PriorityQueueConfig> queues,
        long conditionCheckIntervalMs,
        long healthSweepIntervalMs,
        long jobTtlSeconds,
        long defaultTimeoutMs,
        int defaultRetries
) {
    public static final List<String> DEFAULT_QUEUES =
            List.of("email", "media", "notifications", "moderation", "analytics", "blockchain");

    public static final long DEFAULT_CONDITION_CHECK_INTERVAL_MS = 30_000;
    public static final long DEFAULT_HEALTH_SWEEP_INTERVAL_MS = 3_600_000;
    public static final long DEFAULT_JOB_TTL_SECONDS = 7 * 24 * 60 * 60;
    public static final long DEFAULT_TIMEOUT_MS = 300_000;
    public static final int DEFAULT_RETRIES = 3;

    public SchedulerConfig {
        queues = queues == null || queues.isEmpty() ? defaultQueues() : List.copyOf(queues);
        Set<String> seen = new HashSet<>();
        for (PriorityQueueConfig queue : queues) {
            if (!seen.add(queue.queueName())) {
                throw new ConfigurationException("Duplicate queue name: " + queue.queueName());
            }
        }
        if (conditionCheckIntervalMs <= 0 || healthSweepIntervalMs <= 0 || jobTtlSeconds <= 0) {
            throw new ConfigurationException("Scheduler intervals and job TTL must be positive");
        }
    }

    /**
     * Default configuration with the six standard queues.
     */
    public static SchedulerConfig defaults() {
        return new SchedulerConfig("job-scheduler", defaultQueues(),
                DEFAULT_CONDITION_CHECK_INTERVAL_MS, DEFAULT_HEALTH_SWEEP_INTERVAL_MS,
                DEFAULT_JOB_TTL_SECONDS, DEFAULT_TIMEOUT_MS, DEFAULT_RETRIES);
    }

    /**
     * Defaults restricted to the given queue configurations, for tests and embedding.
     */
    public static SchedulerConfig of(List<PriorityQueueConfig> queues) {
        return new SchedulerConfig("job-scheduler", queues,
                DEFAULT_CONDITION_CHECK_INTERVAL_MS, DEFAULT_HEALTH_SWEEP_INTERVAL_MS,
                DEFAULT_JOB_TTL_SECONDS, DEFAULT_TIMEOUT_MS, DEFAULT_RETRIES);
    }

    private static List<PriorityQueueConfig> defaultQueues() {
        return DEFAULT_QUEUES.stream().map(PriorityQueueConfig::defaults).toList();
    }

    public Set<String> queueNames() {
        return queues.stream().map(PriorityQueueConfig::queueName).collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Find queue by name.
     */
    public PriorityQueueConfig getQueue(String name) {
        return queues.stream()
                .filter(q -> q.queueName().equals(name))
                .findFirst()
                .orElse(null);
    }
}
