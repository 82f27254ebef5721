package com.jobsched.config;

import com.jobsched.condition.ConditionType;

import java.util.List;

/**
 * Parsed form of a condition expression, before it is bound to a resolver.
 *
 * @param type       Node type
 * @param field      Fully prefixed field reference (e.g. "$job.priority")
 * @param value      Operand of comparison nodes
 * @param values     Operands of IN / NOT_IN
 * @param pattern    Operand of REGEX / STARTS_WITH / ENDS_WITH
 * @param conditions Children of AND / OR / NOT
 */
public record ConditionConfig(
        ConditionType type,
        String field,
        Object value,
        List<Object> values,
        String pattern,
        List<ConditionConfig> conditions
) {
    public static ConditionConfig alwaysTrue() {
        return new ConditionConfig(ConditionType.ALWAYS_TRUE, null, null, null, null, null);
    }

    public static ConditionConfig alwaysFalse() {
        return new ConditionConfig(ConditionType.ALWAYS_FALSE, null, null, null, null, null);
    }

    public static ConditionConfig compare(ConditionType type, String field, Object value) {
        return new ConditionConfig(type, field, value, null, null, null);
    }

    public static ConditionConfig collection(ConditionType type, String field, List<Object> values) {
        return new ConditionConfig(type, field, null, values, null, null);
    }

    public static ConditionConfig pattern(ConditionType type, String field, String pattern) {
        return new ConditionConfig(type, field, null, null, pattern, null);
    }

    public static ConditionConfig existence(ConditionType type, String field) {
        return new ConditionConfig(type, field, null, null, null, null);
    }

    public static ConditionConfig and(List<ConditionConfig> conditions) {
        return new ConditionConfig(ConditionType.AND, null, null, null, null, conditions);
    }

    public static ConditionConfig or(List<ConditionConfig> conditions) {
        return new ConditionConfig(ConditionType.OR, null, null, null, null, conditions);
    }

    public static ConditionConfig not(ConditionConfig inner) {
        return new ConditionConfig(ConditionType.NOT, null, null, null, null, List.of(inner));
    }
}
