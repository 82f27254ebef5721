package com.jobsched.condition.impl;

import com.jobsched.condition.Condition;
import com.jobsched.condition.ConditionType;
import com.jobsched.variable.EvaluationContext;
import com.jobsched.variable.VariableResolver;

import java.util.List;
import java.util.Optional;

/**
 * Membership of a field value in a literal list. A missing field fails both IN and NOT IN.
 */
public class InCondition implements Condition {

    private final String field;
    private final List<Object> candidates;
    private final boolean negated;
    private final VariableResolver resolver;

    public InCondition(String field, List<Object> candidates, boolean negated, VariableResolver resolver) {
        this.field = field;
        this.candidates = List.copyOf(candidates);
        this.negated = negated;
        this.resolver = resolver;
    }

    @Override
    public boolean evaluate(EvaluationContext context) {
        Optional<Object> actual = resolver.resolve(field, context);
        if (actual.isEmpty()) {
            return false;
        }
        Object value = actual.get();
        boolean found = candidates.stream().anyMatch(candidate -> ValueMatcher.matches(value, candidate));
        return found != negated;
    }

    @Override
    public ConditionType getType() {
        return negated ? ConditionType.NOT_IN : ConditionType.IN;
    }

    @Override
    public String toString() {
        return field + (negated ? " NOT IN " : " IN ") + candidates;
    }
}
