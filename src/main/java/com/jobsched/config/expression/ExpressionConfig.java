package com.jobsched.config.expression;

import java.util.List;
import java.util.Map;

/**
 * Keywords, operator symbols and field namespaces of the condition language.
 */
public final class ExpressionConfig {

    private ExpressionConfig() {
    }

    public static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("AND", TokenType.AND),
            Map.entry("OR", TokenType.OR),
            Map.entry("NOT", TokenType.NOT),
            Map.entry("IN", TokenType.IN),
            Map.entry("CONTAINS", TokenType.CONTAINS),
            Map.entry("REGEX", TokenType.REGEX),
            Map.entry("STARTS_WITH", TokenType.STARTS_WITH),
            Map.entry("ENDS_WITH", TokenType.ENDS_WITH),
            Map.entry("EXISTS", TokenType.EXISTS),
            Map.entry("IS_NULL", TokenType.IS_NULL),
            Map.entry("TRUE", TokenType.BOOLEAN),
            Map.entry("FALSE", TokenType.BOOLEAN),
            Map.entry("NULL", TokenType.NULL)
    );

    /**
     * Symbolic aliases accepted for the logical keywords.
     */
    public static final Map<String, TokenType> SYMBOLIC_LOGIC = Map.of(
            "&&", TokenType.AND,
            "||", TokenType.OR
    );

    public static final class Operators {
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char LEFT_BRACKET = '[';
        public static final char RIGHT_BRACKET = ']';
        public static final char COMMA = ',';
        public static final char EQUALS = '=';
        public static final char BANG = '!';
        public static final char GREATER = '>';
        public static final char LESS = '<';
        public static final char AMPERSAND = '&';
        public static final char PIPE = '|';
        public static final char QUOTE_DOUBLE = '"';
        public static final char QUOTE_SINGLE = '\'';
        public static final char BACKSLASH = '\\';
        public static final char DOT = '.';
        public static final char MINUS = '-';
        public static final char UNDERSCORE = '_';
        public static final char DOLLAR = '$';

        private Operators() {
        }
    }

    /**
     * Namespace of scheduled job fields. Unprefixed fields belong here.
     */
    public static final String JOB_PREFIX = "$job.";

    /**
     * Namespace of scheduling statistics.
     */
    public static final String STATS_PREFIX = "$stats.";

    /**
     * Namespace of clock values.
     */
    public static final String SYSTEM_PREFIX = "$sys.";

    public static final List<String> PREFIXES = List.of(JOB_PREFIX, STATS_PREFIX, SYSTEM_PREFIX);

    /**
     * Upper bound on expression length, to keep parsing and evaluation cheap.
     */
    public static final int MAX_EXPRESSION_LENGTH = 2048;
}
