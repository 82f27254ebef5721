package com.jobsched.fairness;

import com.jobsched.config.RateLimitConfig;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-queue submission rate tracking. Queues without a rate limit are never throttled.
 */
public class RateLimiter {

    private final Map<String, SlidingWindowCounter> counters = new ConcurrentHashMap<>();
    private final Clock clock;

    public RateLimiter(Clock clock) {
        this.clock = clock;
    }

    /**
     * Delay that pushes a submission past the current window once the window is full.
     */
    public long delayFor(String queueName, RateLimitConfig limit) {
        if (limit == null) {
            return 0;
        }
        return counter(queueName, limit).count() >= limit.maxJobs() ? limit.windowMs() : 0;
    }

    public void recordSubmission(String queueName, RateLimitConfig limit) {
        if (limit != null) {
            counter(queueName, limit).add();
        }
    }

    int submissionsInWindow(String queueName) {
        SlidingWindowCounter counter = counters.get(queueName);
        return counter == null ? 0 : counter.count();
    }

    private SlidingWindowCounter counter(String queueName, RateLimitConfig limit) {
        // a changed window length starts a fresh counter
        return counters.compute(queueName, (name, existing) ->
                existing != null && existing.getWindowSizeMs() == limit.windowMs()
                        ? existing
                        : new SlidingWindowCounter(limit.windowMs(), clock));
    }
}
