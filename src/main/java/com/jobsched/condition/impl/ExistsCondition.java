package com.jobsched.condition.impl;

import com.jobsched.condition.Condition;
import com.jobsched.condition.ConditionType;
import com.jobsched.variable.EvaluationContext;
import com.jobsched.variable.VariableResolver;

/**
 * EXISTS (present and not null) and its complement IS_NULL.
 */
public class ExistsCondition implements Condition {

    private final String field;
    private final boolean negated;
    private final VariableResolver resolver;

    public ExistsCondition(String field, boolean negated, VariableResolver resolver) {
        this.field = field;
        this.negated = negated;
        this.resolver = resolver;
    }

    @Override
    public boolean evaluate(EvaluationContext context) {
        return resolver.resolve(field, context).isPresent() != negated;
    }

    @Override
    public ConditionType getType() {
        return negated ? ConditionType.IS_NULL : ConditionType.EXISTS;
    }

    @Override
    public String toString() {
        return field + (negated ? " IS_NULL" : " EXISTS");
    }
}
