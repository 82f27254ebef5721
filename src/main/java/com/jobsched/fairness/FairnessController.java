package com.jobsched.fairness;

import com.jobsched.config.PriorityQueueConfig;
import com.jobsched.core.JobPriority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Turns a dynamic priority score and the queue backlog into a submission delay.
 * Fairness, capacity and rate pressure are alternative signals: the largest one wins.
 */
public class FairnessController {

    private static final Logger log = LoggerFactory.getLogger(FairnessController.class);

    static final double BASE_DELAY_MS = 1000;
    static final double CAPACITY_THRESHOLD = 0.8;
    static final double CAPACITY_DELAY_MS = 10_000;

    private final StarvationTracker starvationTracker;
    private final RateLimiter rateLimiter;

    public FairnessController(StarvationTracker starvationTracker, RateLimiter rateLimiter) {
        this.starvationTracker = starvationTracker;
        this.rateLimiter = rateLimiter;
    }

    /**
     * @return Delay in milliseconds, never negative
     */
    public long calculateDelay(PriorityQueueConfig config, double priorityScore, long backlog) {
        if (config == null) {
            return 0;
        }
        double fairness = fairnessDelay(config, priorityScore, backlog);
        double capacity = capacityDelay(config, backlog);
        long rate = rateLimiter.delayFor(config.queueName(), config.rateLimiting());
        long delay = Math.max(Math.round(Math.max(fairness, capacity)), rate);
        log.debug("Delay for queue {}: fairness={}ms, capacity={}ms, rate={}ms -> {}ms",
                config.queueName(), fairness, capacity, rate, delay);
        return Math.max(0, delay);
    }

    /**
     * Weighted fair queuing delay: grows with the score (less urgent) and the backlog.
     */
    public static double fairnessDelay(PriorityQueueConfig config, double priorityScore, long backlog) {
        if (backlog <= 0) {
            return 0;
        }
        double priorityMultiplier = Math.max(0, priorityScore - 1) * 0.5;
        double depthMultiplier = Math.min(10, backlog / 100.0);
        return BASE_DELAY_MS * priorityMultiplier * depthMultiplier * config.fairnessRatio();
    }

    /**
     * Back-pressure above 80% of the queue's capacity.
     */
    public static double capacityDelay(PriorityQueueConfig config, long backlog) {
        double ratio = (double) backlog / config.maxQueueSize();
        return ratio > CAPACITY_THRESHOLD ? (ratio - CAPACITY_THRESHOLD) * CAPACITY_DELAY_MS : 0;
    }

    public double starvationBoost(PriorityQueueConfig config, JobPriority priority, Instant now) {
        if (config == null) {
            return 0;
        }
        return starvationTracker.starvationBoost(config.queueName(), priority, config.starvationPrevention(), now);
    }

    /**
     * Record a successful submission for starvation and rate bookkeeping.
     */
    public void recordSubmission(PriorityQueueConfig config, JobPriority priority, Instant at) {
        starvationTracker.recordSubmission(config.queueName(), priority, at);
        rateLimiter.recordSubmission(config.queueName(), config.rateLimiting());
    }
}
