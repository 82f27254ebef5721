package com.jobsched.exception;

/**
 * Exception thrown when scheduler or queue configuration is invalid.
 * Results in fail-fast at startup.
 */
public class ConfigurationException extends SchedulerException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
