package com.jobsched.condition.impl;

import com.jobsched.condition.Condition;
import com.jobsched.condition.ConditionType;
import com.jobsched.variable.EvaluationContext;

import java.util.Objects;

public record NotCondition(Condition operand) implements Condition {

    public NotCondition {
        Objects.requireNonNull(operand, "operand");
    }

    @Override
    public boolean evaluate(EvaluationContext context) {
        return !operand.evaluate(context);
    }

    @Override
    public ConditionType getType() {
        return ConditionType.NOT;
    }

    @Override
    public String toString() {
        return "NOT " + operand;
    }
}
