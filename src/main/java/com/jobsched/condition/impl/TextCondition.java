package com.jobsched.condition.impl;

import com.jobsched.condition.Condition;
import com.jobsched.condition.ConditionType;
import com.jobsched.variable.EvaluationContext;
import com.jobsched.variable.VariableResolver;

import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * REGEX, STARTS_WITH and ENDS_WITH over the string form of a field.
 * A regex must match the whole value. A missing field never matches.
 */
public class TextCondition implements Condition {

    private final String field;
    private final String pattern;
    private final ConditionType type;
    private final Predicate<String> matcher;
    private final VariableResolver resolver;

    /**
     * @throws java.util.regex.PatternSyntaxException if a REGEX pattern does not compile
     */
    public TextCondition(String field, String pattern, ConditionType type, VariableResolver resolver) {
        this.field = field;
        this.pattern = pattern;
        this.type = type;
        this.resolver = resolver;
        this.matcher = switch (type) {
            case REGEX -> Pattern.compile(pattern).asMatchPredicate();
            case STARTS_WITH -> value -> value.startsWith(pattern);
            case ENDS_WITH -> value -> value.endsWith(pattern);
            default -> throw new IllegalArgumentException("Not a text match: " + type);
        };
    }

    @Override
    public boolean evaluate(EvaluationContext context) {
        Optional<Object> actual = resolver.resolve(field, context);
        return actual.map(String::valueOf).filter(matcher).isPresent();
    }

    @Override
    public ConditionType getType() {
        return type;
    }

    @Override
    public String toString() {
        return type == ConditionType.REGEX
                ? field + " REGEX /" + pattern + "/"
                : field + " " + type + " '" + pattern + "'";
    }
}
