package com.jobsched.registry;

import com.jobsched.core.JobPriority;
import com.jobsched.core.ScheduledJobConfig;
import com.jobsched.core.SchedulingStrategy;

import java.util.List;

/**
 * Criteria for listing scheduled jobs. Null criteria match everything;
 * a job matches the tag criterion if it carries any of the listed tags.
 */
public record JobFilter(
        String queueName,
        JobPriority priority,
        SchedulingStrategy strategy,
        List<String> tags
) {
    public JobFilter {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static JobFilter all() {
        return new JobFilter(null, null, null, null);
    }

    public static JobFilter byQueue(String queueName) {
        return new JobFilter(queueName, null, null, null);
    }

    public static JobFilter byStrategy(SchedulingStrategy strategy) {
        return new JobFilter(null, null, strategy, null);
    }

    public boolean matches(ScheduledJobConfig job) {
        if (queueName != null && !queueName.equals(job.queueName())) {
            return false;
        }
        if (priority != null && priority != job.priority()) {
            return false;
        }
        if (strategy != null && strategy != job.strategy()) {
            return false;
        }
        return tags.isEmpty() || tags.stream().anyMatch(job.tags()::contains);
    }
}
