package com.jobsched.condition;

import com.jobsched.config.ConditionExpressionParser;
import com.jobsched.core.ConditionTriggers;
import com.jobsched.core.JobCondition;
import com.jobsched.core.ScheduledJobConfig;
import com.jobsched.exception.ConditionEvaluationException;
import com.jobsched.spi.QueueHealthProvider;
import com.jobsched.spi.SystemLoadProvider;
import com.jobsched.stats.ExecutionResultTracker;
import com.jobsched.stats.StatsCollector;
import com.jobsched.variable.EvaluationContextFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides whether a conditional job may fire.
 * Dependencies, each declared trigger and the expression must all hold. Any failure while
 * checking counts as "not met"; the job is checked again on the next tick.
 */
public class JobConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(JobConditionEvaluator.class);

    private final ExecutionResultTracker resultTracker;
    private final QueueHealthProvider queueHealthProvider;
    private final SystemLoadProvider systemLoadProvider;
    private final ConditionEvaluator conditionEvaluator;
    private final EvaluationContextFactory contextFactory;
    private final StatsCollector statsCollector;
    private final Clock clock;

    private final Map<String, Condition> compiled = new ConcurrentHashMap<>();

    public JobConditionEvaluator(ExecutionResultTracker resultTracker,
                                 QueueHealthProvider queueHealthProvider,
                                 SystemLoadProvider systemLoadProvider,
                                 ConditionEvaluator conditionEvaluator,
                                 EvaluationContextFactory contextFactory,
                                 StatsCollector statsCollector,
                                 Clock clock) {
        this.resultTracker = resultTracker;
        this.queueHealthProvider = queueHealthProvider;
        this.systemLoadProvider = systemLoadProvider;
        this.conditionEvaluator = conditionEvaluator;
        this.contextFactory = contextFactory;
        this.statsCollector = statsCollector;
        this.clock = clock;
    }

    /**
     * @return true only if every part of the job's condition holds; false on any error
     */
    public boolean checkJobCondition(ScheduledJobConfig job) {
        try {
            boolean met = evaluate(job);
            log.debug("Condition of job {} {}", job.id(), met ? "met" : "not met");
            return met;
        } catch (RuntimeException e) {
            log.warn("Condition check failed for job {}, treating as not met: {}", job.id(), e.getMessage());
            return false;
        }
    }

    private boolean evaluate(ScheduledJobConfig job) {
        JobCondition condition = job.condition();
        if (condition == null) {
            throw new ConditionEvaluationException("Job " + job.id() + " has no condition");
        }
        for (String dependency : condition.dependencies()) {
            if (!resultTracker.isCompleted(dependency)) {
                log.debug("Job {} waits for dependency {}", job.id(), dependency);
                return false;
            }
        }
        ConditionTriggers triggers = condition.triggers();
        if (triggers != null) {
            if (triggers.queueDepth() != null && !queueDepthReached(triggers.queueDepth())) {
                return false;
            }
            if (triggers.timeWindow() != null && !insideTimeWindow(triggers.timeWindow())) {
                return false;
            }
            if (triggers.systemLoad() != null && !loadBelow(triggers.systemLoad())) {
                return false;
            }
        }
        if (condition.hasExpression()) {
            Condition predicate = compiled.computeIfAbsent(condition.expression(),
                    expr -> conditionEvaluator.create(ConditionExpressionParser.parse(expr)));
            return predicate.evaluate(contextFactory.create(job, statsCollector.snapshot()));
        }
        return true;
    }

    private boolean queueDepthReached(ConditionTriggers.QueueDepth trigger) {
        try {
            return queueHealthProvider.getQueueStats(trigger.queue()).waiting() >= trigger.threshold();
        } catch (RuntimeException e) {
            throw new ConditionEvaluationException("Queue stats unavailable for " + trigger.queue(), e);
        }
    }

    private boolean insideTimeWindow(ConditionTriggers.TimeWindow trigger) {
        LocalTimeWindow window = LocalTimeWindow.parse(trigger.start(), trigger.end());
        return window.contains(LocalTime.now(clock));
    }

    private boolean loadBelow(ConditionTriggers.SystemLoad trigger) {
        double load = systemLoadProvider.oneMinuteLoadAverage();
        if (load < 0) {
            throw new ConditionEvaluationException("System load average is unavailable");
        }
        return load <= trigger.threshold();
    }
}
