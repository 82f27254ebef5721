package com.jobsched.condition;

import com.jobsched.config.ConditionConfig;
import com.jobsched.variable.EvaluationContext;

/**
 * Compiles parsed condition trees into executable conditions.
 */
public interface ConditionEvaluator {

    /**
     * Create a Condition instance from a parsed tree.
     *
     * @param config Parsed condition
     * @return Condition instance
     * @throws com.jobsched.exception.ValidationException if the tree is malformed
     */
    Condition create(ConditionConfig config);

    default boolean evaluate(ConditionConfig config, EvaluationContext context) {
        return create(config).evaluate(context);
    }
}
