package com.jobsched.registry;

import com.jobsched.condition.ConditionEvaluator;
import com.jobsched.condition.LocalTimeWindow;
import com.jobsched.config.ConditionExpressionParser;
import com.jobsched.core.ConditionTriggers;
import com.jobsched.core.JobCondition;
import com.jobsched.core.RepeatConfig;
import com.jobsched.core.ScheduledJobConfig;
import com.jobsched.exception.ValidationException;
import com.jobsched.spi.ScheduleCalculator;

import java.util.Set;

/**
 * Strategy-aware validation of job requests. Runs once, before anything is persisted.
 */
public class JobValidator {

    private final Set<String> knownQueues;
    private final ScheduleCalculator scheduleCalculator;
    private final ConditionEvaluator conditionEvaluator;

    public JobValidator(Set<String> knownQueues, ScheduleCalculator scheduleCalculator,
                        ConditionEvaluator conditionEvaluator) {
        this.knownQueues = Set.copyOf(knownQueues);
        this.scheduleCalculator = scheduleCalculator;
        this.conditionEvaluator = conditionEvaluator;
    }

    /**
     * @throws ValidationException describing the first problem found
     * @throws com.jobsched.exception.CronParseException if a recurring pattern is malformed
     */
    public void validate(ScheduledJobConfig job) {
        if (job == null) {
            throw new ValidationException("Job configuration cannot be null");
        }
        requireText(job.name(), "name");
        requireText(job.queueName(), "queueName");
        requireText(job.jobType(), "jobType");
        if (!knownQueues.contains(job.queueName())) {
            throw new ValidationException("Unknown queue '" + job.queueName() + "', expected one of "
                    + knownQueues);
        }
        if (job.priority() == null) {
            throw new ValidationException("priority is required");
        }
        if (job.strategy() == null) {
            throw new ValidationException("strategy is required");
        }
        if (job.timeoutMs() != null && job.timeoutMs() <= 0) {
            throw new ValidationException("timeoutMs must be positive, got " + job.timeoutMs());
        }
        if (job.retries() != null && job.retries() < 0) {
            throw new ValidationException("retries cannot be negative, got " + job.retries());
        }

        switch (job.strategy()) {
            case DELAYED -> validateDelayed(job);
            case RECURRING -> validateRecurring(job.repeat());
            case CONDITIONAL -> validateConditional(job.condition());
            case IMMEDIATE, BATCH -> {
            }
        }
    }

    private void validateDelayed(ScheduledJobConfig job) {
        if (job.executeAt() == null && job.delayMs() == null) {
            throw new ValidationException("Delayed jobs require executeAt or delayMs");
        }
        if (job.delayMs() != null && job.delayMs() < 0) {
            throw new ValidationException("delayMs cannot be negative, got " + job.delayMs());
        }
    }

    private void validateRecurring(RepeatConfig repeat) {
        if (repeat == null || repeat.pattern() == null || repeat.pattern().isBlank()) {
            throw new ValidationException("Recurring jobs require repeat.pattern");
        }
        if (repeat.limit() != null && repeat.limit() < 1) {
            throw new ValidationException("repeat.limit must be at least 1, got " + repeat.limit());
        }
        scheduleCalculator.validate(repeat.pattern(), repeat.timezone());
    }

    private void validateConditional(JobCondition condition) {
        if (condition == null) {
            throw new ValidationException("Conditional jobs require a condition");
        }
        for (String dependency : condition.dependencies()) {
            requireText(dependency, "condition.dependencies[]");
        }
        if (condition.hasExpression()) {
            conditionEvaluator.create(ConditionExpressionParser.parse(condition.expression()));
        }
        ConditionTriggers triggers = condition.triggers();
        if (triggers == null) {
            return;
        }
        if (triggers.queueDepth() != null) {
            requireText(triggers.queueDepth().queue(), "condition.triggers.queueDepth.queue");
            if (triggers.queueDepth().threshold() < 0) {
                throw new ValidationException("queueDepth threshold cannot be negative");
            }
        }
        if (triggers.timeWindow() != null) {
            LocalTimeWindow.parse(triggers.timeWindow().start(), triggers.timeWindow().end());
        }
        if (triggers.systemLoad() != null && triggers.systemLoad().threshold() < 0) {
            throw new ValidationException("systemLoad threshold cannot be negative");
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
    }
}
