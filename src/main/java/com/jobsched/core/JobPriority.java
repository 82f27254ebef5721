package com.jobsched.core;

import java.util.Locale;

/**
 * Declared priority tiers. Lower weight = more urgent.
 */
public enum JobPriority {
    URGENT(1),
    HIGH(2),
    NORMAL(3),
    LOW(4),
    DEFERRED(5);

    private final int weight;

    JobPriority(int weight) {
        this.weight = weight;
    }

    /**
     * Fixed ordinal weight used as the base of the dynamic priority score.
     */
    public int weight() {
        return weight;
    }

    /**
     * Lower-case name as used in configuration files and expressions.
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static JobPriority fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Priority cannot be blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
