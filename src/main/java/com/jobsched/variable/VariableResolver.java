package com.jobsched.variable;

import java.util.Optional;

/**
 * Resolves field references against an evaluation snapshot.
 */
public interface VariableResolver {

    /**
     * @param reference Field reference (e.g., "$job.priority", "$stats.totalJobsFailed")
     * @return Resolved value, or empty if not present
     */
    Optional<Object> resolve(String reference, EvaluationContext context);

    /**
     * Resolve as a double, converting numeric strings. Empty if missing or not numeric.
     */
    Optional<Double> resolveAsDouble(String reference, EvaluationContext context);
}
