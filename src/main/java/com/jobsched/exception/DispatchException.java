package com.jobsched.exception;

/**
 * Exception thrown when a job cannot be handed to the executor.
 * Typically due to an unknown queue or a connectivity failure.
 */
public class DispatchException extends SchedulerException {

    private final String scheduledJobId;

    public DispatchException(String scheduledJobId, String message) {
        super(message);
        this.scheduledJobId = scheduledJobId;
    }

    public DispatchException(String scheduledJobId, String message, Throwable cause) {
        super(message, cause);
        this.scheduledJobId = scheduledJobId;
    }

    public String getScheduledJobId() {
        return scheduledJobId;
    }
}
