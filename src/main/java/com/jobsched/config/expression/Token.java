package com.jobsched.config.expression;

/**
 * A lexical token of a condition expression.
 *
 * @param type     Token type
 * @param text     Source text
 * @param literal  Parsed value for strings, numbers and booleans
 * @param position Offset in the expression
 */
public record Token(TokenType type, String text, Object literal, int position) {

    @Override
    public String toString() {
        return type + "(" + (literal != null ? literal : text) + ")";
    }
}
