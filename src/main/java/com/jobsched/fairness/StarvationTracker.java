package com.jobsched.fairness;

import com.jobsched.core.JobPriority;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last successful submission per (queue, priority tier), and the urgency boost a tier earns
 * while it goes without one. A tier with no submission yet counts from the instant tracking began.
 */
public class StarvationTracker {

    static final long STARVATION_THRESHOLD_MS = 5 * 60 * 1000;
    static final long BOOST_UNIT_MS = 10 * 60 * 1000;
    static final double MAX_BOOST = 2.0;

    private final Map<String, Map<JobPriority, Instant>> lastExecution = new ConcurrentHashMap<>();
    private final Instant trackingSince;

    public StarvationTracker(Instant trackingSince) {
        this.trackingSince = trackingSince;
    }

    public void recordSubmission(String queueName, JobPriority priority, Instant at) {
        lastExecution.computeIfAbsent(queueName, q -> new ConcurrentHashMap<>()).put(priority, at);
    }

    public Optional<Instant> lastExecution(String queueName, JobPriority priority) {
        Map<JobPriority, Instant> tiers = lastExecution.get(queueName);
        return tiers == null ? Optional.empty() : Optional.ofNullable(tiers.get(priority));
    }

    /**
     * Boost in [0, 2]. Zero when prevention is off, or when the tier's last submission (or the start
     * of tracking, if it has none) is at most five minutes old.
     */
    public double starvationBoost(String queueName, JobPriority priority, boolean enabled, Instant now) {
        if (!enabled) {
            return 0;
        }
        Instant last = lastExecution(queueName, priority).orElse(trackingSince);
        long elapsedMs = Duration.between(last, now).toMillis();
        if (elapsedMs <= STARVATION_THRESHOLD_MS) {
            return 0;
        }
        return Math.min(MAX_BOOST, (double) elapsedMs / BOOST_UNIT_MS);
    }
}
