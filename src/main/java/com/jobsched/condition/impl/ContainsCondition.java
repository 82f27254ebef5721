package com.jobsched.condition.impl;

import com.jobsched.condition.Condition;
import com.jobsched.condition.ConditionType;
import com.jobsched.variable.EvaluationContext;
import com.jobsched.variable.VariableResolver;

import java.util.Collection;
import java.util.Optional;

/**
 * Element test for list fields (such as tags), substring test for anything else.
 */
public class ContainsCondition implements Condition {

    private final String field;
    private final Object element;
    private final VariableResolver resolver;

    public ContainsCondition(String field, Object element, VariableResolver resolver) {
        this.field = field;
        this.element = element;
        this.resolver = resolver;
    }

    @Override
    public boolean evaluate(EvaluationContext context) {
        Optional<Object> actual = resolver.resolve(field, context);
        if (actual.isEmpty()) {
            return false;
        }
        Object value = actual.get();
        if (value instanceof Collection<?> collection) {
            return collection.stream().anyMatch(item -> ValueMatcher.matches(item, element));
        }
        return String.valueOf(value).contains(String.valueOf(element));
    }

    @Override
    public ConditionType getType() {
        return ConditionType.CONTAINS;
    }

    @Override
    public String toString() {
        return field + " CONTAINS " + element;
    }
}
