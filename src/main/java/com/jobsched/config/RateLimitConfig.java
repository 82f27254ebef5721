package com.jobsched.config;

/**
 * Submission rate limit for a queue.
 *
 * @param windowMs Sliding window length
 * @param maxJobs  Submissions allowed per window
 */
public record RateLimitConfig(
        long windowMs,
        int maxJobs
) {
    public static RateLimitConfig perMinute(int maxJobs) {
        return new RateLimitConfig(60_000, maxJobs);
    }
}
