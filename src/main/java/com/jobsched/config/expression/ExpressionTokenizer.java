package com.jobsched.config.expression;

import com.jobsched.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;

import static com.jobsched.config.expression.ExpressionConfig.*;

/**
 * Splits a condition expression into tokens.
 */
public final class ExpressionTokenizer {

    private final String input;
    private final int length;
    private int pos;

    public ExpressionTokenizer(String input) {
        this.input = input;
        this.length = input.length();
        this.pos = 0;
    }

    public List<Token> tokenize() {
        if (length > MAX_EXPRESSION_LENGTH) {
            throw new ValidationException("Condition expression exceeds " + MAX_EXPRESSION_LENGTH + " characters");
        }
        List<Token> tokens = new ArrayList<>();

        while (!isAtEnd()) {
            char c = peek();
            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }

            int start = pos;
            switch (c) {
                case Operators.LEFT_PAREN -> tokens.add(single(TokenType.LPAREN, start));
                case Operators.RIGHT_PAREN -> tokens.add(single(TokenType.RPAREN, start));
                case Operators.LEFT_BRACKET -> tokens.add(single(TokenType.LBRACKET, start));
                case Operators.RIGHT_BRACKET -> tokens.add(single(TokenType.RBRACKET, start));
                case Operators.COMMA -> tokens.add(single(TokenType.COMMA, start));
                case Operators.EQUALS -> {
                    advance();
                    // '=' and '==' are the same operator
                    String text = match(Operators.EQUALS) ? "==" : "=";
                    tokens.add(new Token(TokenType.EQ, text, null, start));
                }
                case Operators.BANG -> {
                    advance();
                    if (match(Operators.EQUALS)) {
                        tokens.add(new Token(TokenType.NE, "!=", null, start));
                    } else {
                        tokens.add(new Token(TokenType.NOT, "!", null, start));
                    }
                }
                case Operators.GREATER -> {
                    advance();
                    tokens.add(match(Operators.EQUALS)
                            ? new Token(TokenType.GTE, ">=", null, start)
                            : new Token(TokenType.GT, ">", null, start));
                }
                case Operators.LESS -> {
                    advance();
                    tokens.add(match(Operators.EQUALS)
                            ? new Token(TokenType.LTE, "<=", null, start)
                            : new Token(TokenType.LT, "<", null, start));
                }
                case Operators.AMPERSAND, Operators.PIPE -> tokens.add(readSymbolicLogic(start));
                case Operators.QUOTE_DOUBLE, Operators.QUOTE_SINGLE -> tokens.add(readString());
                default -> {
                    if (isIdentifierStart(c)) {
                        tokens.add(readIdentifierOrKeyword());
                    } else if (isNumberStart(c)) {
                        tokens.add(readNumber());
                    } else {
                        throw error("Unexpected character '" + c + "'", start);
                    }
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", null, pos));
        return tokens;
    }

    private Token single(TokenType type, int start) {
        char c = advance();
        return new Token(type, String.valueOf(c), null, start);
    }

    private Token readSymbolicLogic(int start) {
        char first = advance();
        if (isAtEnd() || peek() != first) {
            throw error("Unexpected '" + first + "'", start);
        }
        advance();
        String text = "" + first + first;
        return new Token(SYMBOLIC_LOGIC.get(text), text, null, start);
    }

    private Token readIdentifierOrKeyword() {
        int start = pos;
        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }

        String text = input.substring(start, pos);
        String upper = text.toUpperCase();

        TokenType keywordType = KEYWORDS.get(upper);
        if (keywordType != null) {
            Object literal = keywordType == TokenType.BOOLEAN ? Boolean.valueOf(upper.equals("TRUE")) : null;
            return new Token(keywordType, text, literal, start);
        }
        return new Token(TokenType.IDENT, text, text, start);
    }

    private Token readNumber() {
        int start = pos;
        if (peek() == Operators.MINUS) {
            advance();
        }
        while (!isAtEnd() && Character.isDigit(peek())) {
            advance();
        }
        if (!isAtEnd() && peek() == Operators.DOT) {
            advance();
            while (!isAtEnd() && Character.isDigit(peek())) {
                advance();
            }
        }

        String text = input.substring(start, pos);
        try {
            Object number = text.contains(".") ? (Object) Double.parseDouble(text) : (Object) Long.parseLong(text);
            return new Token(TokenType.NUMBER, text, number, start);
        } catch (NumberFormatException e) {
            throw error("Invalid number '" + text + "'", start);
        }
    }

    private Token readString() {
        int start = pos;
        char quote = advance();
        StringBuilder sb = new StringBuilder();

        while (!isAtEnd() && peek() != quote) {
            char c = advance();
            if (c == Operators.BACKSLASH && !isAtEnd()) {
                char escaped = advance();
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    default -> sb.append(escaped);
                }
            } else {
                sb.append(c);
            }
        }

        if (isAtEnd()) {
            throw error("Unterminated string", start);
        }
        advance();
        return new Token(TokenType.STRING, sb.toString(), sb.toString(), start);
    }

    private boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == Operators.UNDERSCORE || c == Operators.DOLLAR;
    }

    private boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == Operators.UNDERSCORE || c == Operators.DOT;
    }

    private boolean isNumberStart(char c) {
        return Character.isDigit(c) || c == Operators.MINUS;
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || input.charAt(pos) != expected) {
            return false;
        }
        pos++;
        return true;
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }

    private ValidationException error(String message, int position) {
        return new ValidationException("Invalid condition expression at position "
                + position + ": " + message + " in '" + input + "'");
    }
}
