package com.jobsched.condition;

import com.jobsched.condition.impl.*;
import com.jobsched.config.ConditionConfig;
import com.jobsched.exception.ValidationException;
import com.jobsched.variable.VariableResolver;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.PatternSyntaxException;

/**
 * Default implementation of ConditionEvaluator.
 * Every node resolves its operand through the {@link VariableResolver}, so a compiled
 * condition can only read values already present in the snapshot.
 */
public class DefaultConditionEvaluator implements ConditionEvaluator {

    private final VariableResolver variableResolver;

    public DefaultConditionEvaluator(VariableResolver variableResolver) {
        this.variableResolver = variableResolver;
    }

    @Override
    public Condition create(ConditionConfig config) {
        if (config == null) {
            throw new ValidationException("Condition cannot be null");
        }
        ConditionType type = config.type();
        if (type == null) {
            throw new ValidationException("Condition type cannot be null");
        }

        return switch (type) {
            case ALWAYS_TRUE -> ConstantCondition.TRUE;
            case ALWAYS_FALSE -> ConstantCondition.FALSE;

            case EQUALS, NOT_EQUALS -> {
                validateField(config);
                yield new EqualsCondition(config.field(), config.value(), type == ConditionType.NOT_EQUALS,
                        variableResolver);
            }

            case GREATER_THAN, GREATER_THAN_OR_EQUALS, LESS_THAN, LESS_THAN_OR_EQUALS -> {
                validateField(config);
                if (!(config.value() instanceof Number threshold)) {
                    throw new ValidationException(type + " condition requires a numeric value");
                }
                yield new ComparisonCondition(config.field(), threshold, type, variableResolver);
            }

            case IN, NOT_IN -> {
                validateField(config);
                if (config.values() == null || config.values().isEmpty()) {
                    throw new ValidationException(type + " condition requires a values list");
                }
                yield new InCondition(config.field(), config.values(), type == ConditionType.NOT_IN,
                        variableResolver);
            }

            case CONTAINS -> {
                validateField(config);
                if (config.value() == null) {
                    throw new ValidationException("CONTAINS condition requires a value");
                }
                yield new ContainsCondition(config.field(), config.value(), variableResolver);
            }

            case REGEX, STARTS_WITH, ENDS_WITH -> {
                validateField(config);
                validatePattern(config);
                try {
                    yield new TextCondition(config.field(), config.pattern(), type, variableResolver);
                } catch (PatternSyntaxException e) {
                    throw new ValidationException("Invalid REGEX pattern '" + config.pattern() + "'", e);
                }
            }

            case EXISTS, IS_NULL -> {
                validateField(config);
                yield new ExistsCondition(config.field(), type == ConditionType.IS_NULL, variableResolver);
            }

            case AND, OR -> new JunctionCondition(type, createNested(config));
            case NOT -> {
                List<Condition> nested = createNested(config);
                if (nested.size() != 1) {
                    throw new ValidationException("NOT condition must have exactly one nested condition");
                }
                yield new NotCondition(nested.get(0));
            }
        };
    }

    private List<Condition> createNested(ConditionConfig config) {
        if (config.conditions() == null || config.conditions().isEmpty()) {
            throw new ValidationException(config.type() + " condition requires nested conditions");
        }
        List<Condition> conditions = new ArrayList<>();
        for (ConditionConfig nested : config.conditions()) {
            conditions.add(create(nested));
        }
        return conditions;
    }

    private void validateField(ConditionConfig config) {
        if (config.field() == null || config.field().isBlank()) {
            throw new ValidationException(config.type() + " condition requires a field");
        }
    }

    private void validatePattern(ConditionConfig config) {
        if (config.pattern() == null || config.pattern().isEmpty()) {
            throw new ValidationException(config.type() + " condition requires a pattern");
        }
    }
}
