package com.jobsched.config.expression;

import com.jobsched.condition.ConditionType;
import com.jobsched.config.ConditionConfig;
import com.jobsched.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;

import static com.jobsched.config.expression.ExpressionConfig.*;

/**
 * Recursive descent parser for condition expressions.
 * <p>
 * Grammar (precedence: NOT > AND > OR):
 * <pre>
 * expression := or
 * or         := and ('OR' and)*
 * and        := not ('AND' not)*
 * not        := 'NOT' not | primary
 * primary    := '(' expression ')' | TRUE | FALSE | comparison
 * comparison := field operator value
 * </pre>
 */
public final class ExpressionParser {

    private final String input;
    private final List<Token> tokens;
    private int index;

    public ExpressionParser(String input, List<Token> tokens) {
        this.input = input;
        this.tokens = tokens;
        this.index = 0;
    }

    public ConditionConfig parse() {
        ConditionConfig result = parseOr();
        expect(TokenType.EOF);
        return result;
    }

    private ConditionConfig parseOr() {
        List<ConditionConfig> conditions = new ArrayList<>();
        conditions.add(parseAnd());
        while (match(TokenType.OR)) {
            conditions.add(parseAnd());
        }
        return conditions.size() == 1 ? conditions.get(0) : ConditionConfig.or(conditions);
    }

    private ConditionConfig parseAnd() {
        List<ConditionConfig> conditions = new ArrayList<>();
        conditions.add(parseNot());
        while (match(TokenType.AND)) {
            conditions.add(parseNot());
        }
        return conditions.size() == 1 ? conditions.get(0) : ConditionConfig.and(conditions);
    }

    private ConditionConfig parseNot() {
        if (match(TokenType.NOT)) {
            return ConditionConfig.not(parseNot());
        }
        return parsePrimary();
    }

    private ConditionConfig parsePrimary() {
        if (match(TokenType.LPAREN)) {
            ConditionConfig expr = parseOr();
            expect(TokenType.RPAREN);
            return expr;
        }
        if (match(TokenType.BOOLEAN)) {
            return (Boolean) previous().literal() ? ConditionConfig.alwaysTrue() : ConditionConfig.alwaysFalse();
        }
        return parseComparison();
    }

    private ConditionConfig parseComparison() {
        Token fieldToken = consume(TokenType.IDENT, "Expected field identifier");
        String field = normalizeField(fieldToken);

        if (match(TokenType.EXISTS)) {
            return ConditionConfig.existence(ConditionType.EXISTS, field);
        }
        if (match(TokenType.IS_NULL)) {
            return ConditionConfig.existence(ConditionType.IS_NULL, field);
        }

        if (match(TokenType.NOT)) {
            if (match(TokenType.IN)) {
                return ConditionConfig.collection(ConditionType.NOT_IN, field, parseList());
            }
            throw error("Expected IN after NOT");
        }
        if (match(TokenType.IN)) {
            return ConditionConfig.collection(ConditionType.IN, field, parseList());
        }

        if (match(TokenType.REGEX)) {
            return ConditionConfig.pattern(ConditionType.REGEX, field, parsePattern());
        }
        if (match(TokenType.STARTS_WITH)) {
            return ConditionConfig.pattern(ConditionType.STARTS_WITH, field, parsePattern());
        }
        if (match(TokenType.ENDS_WITH)) {
            return ConditionConfig.pattern(ConditionType.ENDS_WITH, field, parsePattern());
        }
        if (match(TokenType.CONTAINS)) {
            return ConditionConfig.compare(ConditionType.CONTAINS, field, parseValue());
        }

        if (match(TokenType.EQ)) {
            return ConditionConfig.compare(ConditionType.EQUALS, field, parseValue());
        }
        if (match(TokenType.NE)) {
            return ConditionConfig.compare(ConditionType.NOT_EQUALS, field, parseValue());
        }
        if (match(TokenType.GTE)) {
            return ConditionConfig.compare(ConditionType.GREATER_THAN_OR_EQUALS, field, parseNumber(">="));
        }
        if (match(TokenType.GT)) {
            return ConditionConfig.compare(ConditionType.GREATER_THAN, field, parseNumber(">"));
        }
        if (match(TokenType.LTE)) {
            return ConditionConfig.compare(ConditionType.LESS_THAN_OR_EQUALS, field, parseNumber("<="));
        }
        if (match(TokenType.LT)) {
            return ConditionConfig.compare(ConditionType.LESS_THAN, field, parseNumber("<"));
        }

        throw error("Expected operator after field");
    }

    private List<Object> parseList() {
        boolean bracket = match(TokenType.LBRACKET);
        if (!bracket) {
            expect(TokenType.LPAREN);
        }
        TokenType close = bracket ? TokenType.RBRACKET : TokenType.RPAREN;

        List<Object> values = new ArrayList<>();
        if (!check(close)) {
            values.add(parseValue());
            while (match(TokenType.COMMA)) {
                values.add(parseValue());
            }
        }
        expect(close);
        if (values.isEmpty()) {
            throw error("IN list cannot be empty");
        }
        return values;
    }

    private Object parseValue() {
        if (match(TokenType.STRING, TokenType.NUMBER, TokenType.BOOLEAN, TokenType.NULL)) {
            return previous().literal();
        }
        // Bare words are string constants, never field lookups
        if (match(TokenType.IDENT)) {
            return previous().text();
        }
        throw error("Expected value");
    }

    private Object parseNumber(String operator) {
        if (match(TokenType.NUMBER)) {
            return previous().literal();
        }
        throw error(operator + " requires a numeric value");
    }

    private String parsePattern() {
        if (match(TokenType.STRING, TokenType.IDENT)) {
            return previous().text();
        }
        throw error("Expected pattern");
    }

    private String normalizeField(Token token) {
        String field = token.text();
        if (field.startsWith("$")) {
            for (String prefix : PREFIXES) {
                if (field.startsWith(prefix) && field.length() > prefix.length()) {
                    return field;
                }
            }
            throw new ValidationException("Invalid condition expression at position " + token.position()
                    + ": unknown field namespace in '" + field + "', expected one of " + PREFIXES);
        }
        return JOB_PREFIX + field;
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(message);
    }

    private void expect(TokenType type) {
        if (!check(type)) {
            throw error("Expected " + type);
        }
        advance();
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (peek().type() != TokenType.EOF) {
            index++;
        }
        return previous();
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(index - 1);
    }

    private ValidationException error(String message) {
        return new ValidationException("Invalid condition expression at position "
                + peek().position() + ": " + message + " in '" + input + "'");
    }
}
