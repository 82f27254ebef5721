package com.jobsched.exception;

/**
 * Failure inside condition evaluation.
 * Never escapes the evaluator: it is converted into "condition not met".
 */
public class ConditionEvaluationException extends SchedulerException {

    public ConditionEvaluationException(String message) {
        super(message);
    }

    public ConditionEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
