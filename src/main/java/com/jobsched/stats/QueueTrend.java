package com.jobsched.stats;

/**
 * Direction of a queue's success fraction between two health sweeps.
 */
public enum QueueTrend {
    IMPROVING,
    STABLE,
    DECLINING
}
