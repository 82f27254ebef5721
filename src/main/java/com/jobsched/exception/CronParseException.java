package com.jobsched.exception;

/**
 * Exception thrown when a recurring pattern cannot be parsed.
 */
public class CronParseException extends ValidationException {

    private final String pattern;

    public CronParseException(String pattern, String message) {
        super("Invalid cron pattern '" + pattern + "': " + message);
        this.pattern = pattern;
    }

    public CronParseException(String pattern, String message, Throwable cause) {
        super("Invalid cron pattern '" + pattern + "': " + message, cause);
        this.pattern = pattern;
    }

    public String getPattern() {
        return pattern;
    }
}
