package com.jobsched.exception;

/**
 * Exception thrown when a job configuration is rejected at scheduling time.
 * Nothing is persisted when this is raised.
 */
public class ValidationException extends SchedulerException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
