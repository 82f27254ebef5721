package com.jobsched.condition;

/**
 * Node types of a compiled condition expression.
 */
public enum ConditionType {
    // Comparison
    EQUALS,
    NOT_EQUALS,
    GREATER_THAN,
    GREATER_THAN_OR_EQUALS,
    LESS_THAN,
    LESS_THAN_OR_EQUALS,

    // Collection
    IN,
    NOT_IN,
    CONTAINS,

    // String
    REGEX,
    STARTS_WITH,
    ENDS_WITH,

    // Existence
    EXISTS,
    IS_NULL,

    // Logical
    AND,
    OR,
    NOT,

    // Literals
    ALWAYS_TRUE,
    ALWAYS_FALSE
}
