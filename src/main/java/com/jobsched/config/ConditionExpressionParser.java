package com.jobsched.config;

import com.jobsched.config.expression.ExpressionParser;
import com.jobsched.config.expression.ExpressionTokenizer;
import com.jobsched.config.expression.Token;

import java.util.List;

/**
 * Facade for parsing condition expressions into {@link ConditionConfig} trees.
 * <p>
 * Supports:
 * <ul>
 *   <li>Logical operators: AND, OR, NOT (also {@code &&}, {@code ||}, {@code !})</li>
 *   <li>Comparisons: ==, =, !=, >, >=, <, <=</li>
 *   <li>Collection: IN, NOT IN, CONTAINS</li>
 *   <li>String: REGEX, STARTS_WITH, ENDS_WITH</li>
 *   <li>Existence: EXISTS, IS_NULL</li>
 *   <li>Parentheses for grouping</li>
 * </ul>
 * Fields are restricted to the {@code $job.}, {@code $stats.} and {@code $sys.} namespaces.
 * There is no function call, member access or arithmetic.
 */
public final class ConditionExpressionParser {

    private ConditionExpressionParser() {
    }

    /**
     * Parse an expression. A blank expression is always true.
     *
     * @throws com.jobsched.exception.ValidationException on syntax errors
     */
    public static ConditionConfig parse(String expression) {
        if (expression == null || expression.isBlank()) {
            return ConditionConfig.alwaysTrue();
        }
        List<Token> tokens = new ExpressionTokenizer(expression).tokenize();
        return new ExpressionParser(expression, tokens).parse();
    }
}
