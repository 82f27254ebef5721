package com.jobsched.core;

import java.util.List;

/**
 * Gate for a conditional job.
 *
 * @param expression   Optional restricted boolean expression over job and stats fields
 * @param dependencies Scheduled job ids whose last result must be COMPLETED
 * @param triggers     Optional environmental triggers
 */
public record JobCondition(
        String expression,
        List<String> dependencies,
        ConditionTriggers triggers
) {
    public JobCondition {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public static JobCondition dependsOn(String... jobIds) {
        return new JobCondition(null, List.of(jobIds), null);
    }

    public boolean hasExpression() {
        return expression != null && !expression.isBlank();
    }
}
