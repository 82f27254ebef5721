package com.jobsched.core;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The unit of schedulable work.
 * Immutable; metadata changes produce a new instance through {@link #withMetadata(String, Object, Instant)}.
 *
 * @param id           Identifier assigned by the scheduler on creation
 * @param name         Human readable name
 * @param queueName    Target execution queue
 * @param jobType      Job type forwarded to the executor and batch collaborator
 * @param data         Opaque payload forwarded to the executor
 * @param priority     Declared priority tier
 * @param strategy     Scheduling strategy
 * @param executeAt    Fire time for delayed jobs
 * @param delayMs      Offset from creation for delayed jobs
 * @param repeat       Recurrence settings for recurring jobs
 * @param condition    Gate for conditional jobs
 * @param timeoutMs    Execution timeout forwarded verbatim to the executor
 * @param retries      Attempts forwarded to the executor
 * @param backoff      Retry backoff forwarded to the executor
 * @param tags         Free-form tags used for filtering
 * @param metadata     Free-form metadata, written by strategy handlers
 * @param createdBy    Caller identity
 * @param createdAt    Creation time
 * @param lastModified Last metadata change
 */
public record ScheduledJobConfig(
        String id,
        String name,
        String queueName,
        String jobType,
        Map<String, Object> data,
        JobPriority priority,
        SchedulingStrategy strategy,
        Instant executeAt,
        Long delayMs,
        RepeatConfig repeat,
        JobCondition condition,
        Long timeoutMs,
        Integer retries,
        BackoffType backoff,
        List<String> tags,
        Map<String, Object> metadata,
        String createdBy,
        Instant createdAt,
        Instant lastModified
) {
    public ScheduledJobConfig {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        tags = tags == null ? List.of() : List.copyOf(tags);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Assign identity and timestamps, as done once by the scheduler.
     */
    public ScheduledJobConfig withIdentity(String newId, Instant now) {
        return new ScheduledJobConfig(newId, name, queueName, jobType, data, priority, strategy,
                executeAt, delayMs, repeat, condition, timeoutMs, retries, backoff, tags, metadata,
                createdBy, now, now);
    }

    /**
     * Copy with one metadata entry added or replaced.
     */
    public ScheduledJobConfig withMetadata(String key, Object value, Instant now) {
        Map<String, Object> updated = new LinkedHashMap<>(metadata);
        updated.put(key, value);
        return new ScheduledJobConfig(id, name, queueName, jobType, data, priority, strategy,
                executeAt, delayMs, repeat, condition, timeoutMs, retries, backoff, tags, updated,
                createdBy, createdAt, now);
    }

    /**
     * Resolve the fire time of a delayed job: explicit timestamp first, then offset from creation.
     */
    public Instant resolveExecuteAt() {
        if (executeAt != null) {
            return executeAt;
        }
        Instant base = createdAt != null ? createdAt : Instant.now();
        return base.plusMillis(delayMs != null ? delayMs : 0L);
    }

    /**
     * Age of the job relative to the given instant, never negative.
     */
    public Duration ageAt(Instant now) {
        if (createdAt == null || now.isBefore(createdAt)) {
            return Duration.ZERO;
        }
        return Duration.between(createdAt, now);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "ScheduledJobConfig{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", queueName='" + queueName + '\'' +
                ", priority=" + priority +
                ", strategy=" + strategy +
                '}';
    }

    /**
     * Builder for job requests. Identity and timestamps are assigned by the scheduler.
     */
    public static class Builder {
        private String name;
        private String queueName;
        private String jobType;
        private final Map<String, Object> data = new LinkedHashMap<>();
        private JobPriority priority = JobPriority.NORMAL;
        private SchedulingStrategy strategy = SchedulingStrategy.IMMEDIATE;
        private Instant executeAt;
        private Long delayMs;
        private RepeatConfig repeat;
        private JobCondition condition;
        private Long timeoutMs;
        private Integer retries;
        private BackoffType backoff;
        private final List<String> tags = new ArrayList<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private String createdBy;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder queueName(String queueName) {
            this.queueName = queueName;
            return this;
        }

        public Builder jobType(String jobType) {
            this.jobType = jobType;
            return this;
        }

        public Builder data(String key, Object value) {
            if (key != null) {
                this.data.put(key, value);
            }
            return this;
        }

        public Builder data(Map<String, Object> data) {
            if (data != null) {
                this.data.putAll(data);
            }
            return this;
        }

        public Builder priority(JobPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder strategy(SchedulingStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder executeAt(Instant executeAt) {
            this.executeAt = executeAt;
            return this;
        }

        public Builder delayMs(Long delayMs) {
            this.delayMs = delayMs;
            return this;
        }

        public Builder repeat(RepeatConfig repeat) {
            this.repeat = repeat;
            return this;
        }

        public Builder condition(JobCondition condition) {
            this.condition = condition;
            return this;
        }

        public Builder timeoutMs(Long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder retries(Integer retries) {
            this.retries = retries;
            return this;
        }

        public Builder backoff(BackoffType backoff) {
            this.backoff = backoff;
            return this;
        }

        public Builder tag(String tag) {
            if (tag != null) {
                this.tags.add(tag);
            }
            return this;
        }

        public Builder tags(List<String> tags) {
            if (tags != null) {
                this.tags.addAll(tags);
            }
            return this;
        }

        public Builder metadata(String key, Object value) {
            if (key != null) {
                this.metadata.put(key, value);
            }
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public ScheduledJobConfig build() {
            return new ScheduledJobConfig(null, name, queueName, jobType, data, priority, strategy,
                    executeAt, delayMs, repeat, condition, timeoutMs, retries, backoff, tags, metadata,
                    createdBy, null, null);
        }
    }
}
