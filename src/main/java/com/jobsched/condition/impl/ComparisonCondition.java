package com.jobsched.condition.impl;

import com.jobsched.condition.Condition;
import com.jobsched.condition.ConditionType;
import com.jobsched.variable.EvaluationContext;
import com.jobsched.variable.VariableResolver;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.IntPredicate;

/**
 * Orders a numeric field against a numeric literal. A field that is missing or not numeric
 * fails every comparison.
 */
public class ComparisonCondition implements Condition {

    private static final Map<ConditionType, String> SYMBOLS = new EnumMap<>(Map.of(
            ConditionType.GREATER_THAN, ">",
            ConditionType.GREATER_THAN_OR_EQUALS, ">=",
            ConditionType.LESS_THAN, "<",
            ConditionType.LESS_THAN_OR_EQUALS, "<="));

    private final String field;
    private final double threshold;
    private final ConditionType type;
    private final IntPredicate accepts;
    private final VariableResolver resolver;

    public ComparisonCondition(String field, Number threshold, ConditionType type, VariableResolver resolver) {
        this.field = field;
        this.threshold = threshold.doubleValue();
        this.type = type;
        this.resolver = resolver;
        // applied to Double.compare(actual, threshold)
        this.accepts = switch (type) {
            case GREATER_THAN -> order -> order > 0;
            case GREATER_THAN_OR_EQUALS -> order -> order >= 0;
            case LESS_THAN -> order -> order < 0;
            case LESS_THAN_OR_EQUALS -> order -> order <= 0;
            default -> throw new IllegalArgumentException("Not a comparison: " + type);
        };
    }

    @Override
    public boolean evaluate(EvaluationContext context) {
        return resolver.resolveAsDouble(field, context)
                .filter(actual -> !actual.isNaN())
                .map(actual -> accepts.test(Double.compare(actual, threshold)))
                .orElse(false);
    }

    @Override
    public ConditionType getType() {
        return type;
    }

    @Override
    public String toString() {
        return field + " " + SYMBOLS.get(type) + " " + threshold;
    }
}
