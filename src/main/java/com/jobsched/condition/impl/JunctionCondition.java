package com.jobsched.condition.impl;

import com.jobsched.condition.Condition;
import com.jobsched.condition.ConditionType;
import com.jobsched.variable.EvaluationContext;

import java.util.List;
import java.util.stream.Collectors;

/**
 * AND / OR over one or more children, evaluated left to right. AND stops at the first
 * false child, OR at the first true one.
 */
public class JunctionCondition implements Condition {

    private final ConditionType type;
    private final List<Condition> children;

    public JunctionCondition(ConditionType type, List<Condition> children) {
        if (type != ConditionType.AND && type != ConditionType.OR) {
            throw new IllegalArgumentException("Not a junction: " + type);
        }
        if (children.isEmpty()) {
            throw new IllegalArgumentException(type + " needs at least one operand");
        }
        this.type = type;
        this.children = List.copyOf(children);
    }

    @Override
    public boolean evaluate(EvaluationContext context) {
        boolean decisive = type == ConditionType.OR;
        for (Condition child : children) {
            if (child.evaluate(context) == decisive) {
                return decisive;
            }
        }
        return !decisive;
    }

    @Override
    public ConditionType getType() {
        return type;
    }

    @Override
    public String toString() {
        return children.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(" " + type + " ", "(", ")"));
    }
}
