package com.jobsched.core;

import java.time.Instant;

/**
 * Recurrence settings for a recurring job.
 *
 * @param pattern  Five-field cron pattern (required for recurring jobs)
 * @param limit    Maximum number of fires, or null for unlimited
 * @param endDate  Instant after which the job no longer fires, or null
 * @param timezone IANA zone id used to interpret the pattern, or null for the scheduler zone
 */
public record RepeatConfig(
        String pattern,
        Integer limit,
        Instant endDate,
        String timezone
) {
    public static RepeatConfig of(String pattern) {
        return new RepeatConfig(pattern, null, null, null);
    }

    public boolean hasEnded(Instant now) {
        return endDate != null && now.isAfter(endDate);
    }

    public boolean limitReached(long fires) {
        return limit != null && fires >= limit;
    }
}
