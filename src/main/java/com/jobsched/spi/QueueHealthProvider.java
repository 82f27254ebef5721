package com.jobsched.spi;

/**
 * Live view of execution queue depths. The scheduler treats {@code waiting} as the backlog.
 */
public interface QueueHealthProvider {

    QueueSnapshot getQueueStats(String queueName);
}
