package com.jobsched.spi;

/**
 * Job counts of one execution queue.
 */
public record QueueSnapshot(
        long waiting,
        long active,
        long delayed,
        long completed,
        long failed
) {
    public static QueueSnapshot empty() {
        return new QueueSnapshot(0, 0, 0, 0, 0);
    }
}
