package com.jobsched.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the job scheduler.
 */
@ConfigurationProperties(prefix = "jobsched")
public class SchedulerProperties {

    /**
     * Whether the scheduler is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the scheduler configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:scheduler.yaml";

    /**
     * Whether persisted jobs are resumed and timers armed when the bean is created.
     */
    private boolean autoStart = true;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }
}
