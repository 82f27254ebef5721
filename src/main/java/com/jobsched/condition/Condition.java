package com.jobsched.condition;

import com.jobsched.variable.EvaluationContext;

/**
 * A compiled boolean predicate over an evaluation snapshot.
 */
public interface Condition {

    /**
     * Evaluate this condition against the given snapshot.
     *
     * @param context Flattened job, stats and clock values
     * @return true if the condition holds, false otherwise
     */
    boolean evaluate(EvaluationContext context);

    ConditionType getType();
}
