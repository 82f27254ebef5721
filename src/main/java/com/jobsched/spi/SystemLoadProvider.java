package com.jobsched.spi;

/**
 * Host load readings for the system-load trigger.
 */
public interface SystemLoadProvider {

    /**
     * @return One-minute load average, negative when unavailable
     */
    double oneMinuteLoadAverage();
}
