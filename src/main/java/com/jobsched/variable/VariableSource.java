package com.jobsched.variable;

/**
 * Namespace a condition field is resolved from.
 */
public enum VariableSource {
    /**
     * Scheduled job fields ($job.*)
     */
    JOB("$job"),

    /**
     * Scheduling statistics ($stats.*)
     */
    STATS("$stats"),

    /**
     * Clock values ($sys.*)
     */
    SYSTEM("$sys");

    private final String prefix;

    VariableSource(String prefix) {
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }

    /**
     * @throws IllegalArgumentException if the reference has no known namespace
     */
    public static VariableSource fromReference(String reference) {
        if (reference == null || reference.isEmpty()) {
            throw new IllegalArgumentException("Variable reference cannot be null or empty");
        }
        for (VariableSource source : values()) {
            if (reference.startsWith(source.prefix + ".")) {
                return source;
            }
        }
        throw new IllegalArgumentException("Invalid variable reference: " + reference
                + ". Must start with $job., $stats. or $sys.");
    }

    public static String extractName(String reference) {
        VariableSource source = fromReference(reference);
        return reference.substring(source.prefix.length() + 1);
    }
}
