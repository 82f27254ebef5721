package com.jobsched.condition.impl;

import com.jobsched.condition.Condition;
import com.jobsched.condition.ConditionType;
import com.jobsched.variable.EvaluationContext;
import com.jobsched.variable.VariableResolver;

import java.util.Optional;

/**
 * Equality and inequality against a literal. A missing field fails both.
 */
public class EqualsCondition implements Condition {

    private final String field;
    private final Object expectedValue;
    private final boolean negated;
    private final VariableResolver resolver;

    public EqualsCondition(String field, Object expectedValue, boolean negated, VariableResolver resolver) {
        this.field = field;
        this.expectedValue = expectedValue;
        this.negated = negated;
        this.resolver = resolver;
    }

    @Override
    public boolean evaluate(EvaluationContext context) {
        Optional<Object> actual = resolver.resolve(field, context);
        if (actual.isEmpty()) {
            // null literal compares against absence
            return expectedValue == null ? !negated : false;
        }
        return ValueMatcher.matches(actual.get(), expectedValue) != negated;
    }

    @Override
    public ConditionType getType() {
        return negated ? ConditionType.NOT_EQUALS : ConditionType.EQUALS;
    }

    @Override
    public String toString() {
        return field + (negated ? " != " : " == ") + expectedValue;
    }
}
