package com.jobsched.condition.impl;

import com.jobsched.condition.Condition;
import com.jobsched.condition.ConditionType;
import com.jobsched.variable.EvaluationContext;

/**
 * The TRUE and FALSE literals.
 */
public final class ConstantCondition implements Condition {

    public static final ConstantCondition TRUE = new ConstantCondition(true);
    public static final ConstantCondition FALSE = new ConstantCondition(false);

    private final boolean value;

    private ConstantCondition(boolean value) {
        this.value = value;
    }

    @Override
    public boolean evaluate(EvaluationContext context) {
        return value;
    }

    @Override
    public ConditionType getType() {
        return value ? ConditionType.ALWAYS_TRUE : ConditionType.ALWAYS_FALSE;
    }

    @Override
    public String toString() {
        return value ? "TRUE" : "FALSE";
    }
}
