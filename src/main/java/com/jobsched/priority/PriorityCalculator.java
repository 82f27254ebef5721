package com.jobsched.priority;

import com.jobsched.config.PriorityQueueConfig;
import com.jobsched.core.ScheduledJobConfig;
import com.jobsched.fairness.FairnessController;

import java.time.Instant;

/**
 * Computes the dynamic priority of a job from its declared tier, its age, the starvation of
 * its tier and the backlog of its queue.
 * <p>
 * {@code score = max(1, base - ageBoost - starvationBoost + loadPenalty)}
 */
public class PriorityCalculator {

    static final double AGE_BOOST_WINDOW_MS = 60 * 60 * 1000;
    static final double MAX_AGE_BOOST = 1.0;
    static final double LOAD_PENALTY_UNIT = 1000;
    static final double MAX_LOAD_PENALTY = 2.0;

    private final FairnessController fairnessController;

    public PriorityCalculator(FairnessController fairnessController) {
        this.fairnessController = fairnessController;
    }

    public PriorityScore calculate(ScheduledJobConfig job, PriorityQueueConfig queueConfig,
                                   long backlog, Instant now) {
        int base = job.priority().weight();
        double ageBoost = Math.min(MAX_AGE_BOOST, job.ageAt(now).toMillis() / AGE_BOOST_WINDOW_MS);
        double loadPenalty = Math.min(MAX_LOAD_PENALTY, Math.max(0, backlog) / LOAD_PENALTY_UNIT);
        double starvationBoost = fairnessController.starvationBoost(queueConfig, job.priority(), now);
        double score = Math.max(1, base - ageBoost - starvationBoost + loadPenalty);
        return new PriorityScore(base, ageBoost, starvationBoost, loadPenalty, score);
    }
}
