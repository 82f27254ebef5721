package com.jobsched.adapter.system;

import com.jobsched.spi.SystemLoadProvider;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/**
 * Reads the load average from the platform {@link OperatingSystemMXBean}.
 */
public class OperatingSystemLoadProvider implements SystemLoadProvider {

    private final OperatingSystemMXBean osBean = ManagementFactory.getOperatingSystemMXBean();

    @Override
    public double oneMinuteLoadAverage() {
        return osBean.getSystemLoadAverage();
    }
}
