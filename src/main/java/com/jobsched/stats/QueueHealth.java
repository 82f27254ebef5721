package com.jobsched.stats;

/**
 * Health snapshot of one queue.
 *
 * @param backlog           Waiting jobs observed at the last dispatch
 * @param avgProcessingTime Running average of reported execution durations (ms)
 * @param errorRate         Share of unsuccessful outcomes over the last sweep interval
 * @param throughput        Successful dispatches per minute over the last sweep interval
 * @param trend             Change of the success fraction against the previous interval
 */
public record QueueHealth(
        long backlog,
        double avgProcessingTime,
        double errorRate,
        double throughput,
        QueueTrend trend
) {
    public static QueueHealth empty() {
        return new QueueHealth(0, 0, 0, 0, QueueTrend.STABLE);
    }
}
