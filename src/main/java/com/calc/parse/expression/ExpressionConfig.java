package com.calc.parse.expression;

import java.util.Map;

/**
 * Configuration for expression operators and parser messages.
 */
public final class ExpressionConfig {

    private ExpressionConfig() {
    }

    /**
     * Single-character symbols mapped to token types.
     */
    public static final Map<Character, TokenType> SYMBOLS = Map.of(
            Operators.PLUS, TokenType.PLUS,
            Operators.MINUS, TokenType.MINUS,
            Operators.STAR, TokenType.STAR,
            Operators.SLASH, TokenType.SLASH,
            Operators.LEFT_PAREN, TokenType.LEFT_PAREN,
            Operators.RIGHT_PAREN, TokenType.RIGHT_PAREN
    );

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char PLUS = '+';
        public static final char MINUS = '-';
        public static final char STAR = '*';
        public static final char SLASH = '/';
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char DOT = '.';
        public static final char SPACE = ' ';

        private Operators() {
        }
    }

    /**
     * Grammar violation messages, rendered after the "Syntax error: " prefix.
     */
    public static final class Messages {
        public static final String TOO_MANY_RIGHT_PARENS = "Too many ')'.";
        public static final String UNEXPECTED_LEFT_PAREN = "Unexpected '('.";
        public static final String EXPECT_RIGHT_PAREN = "Expect ')' after expression.";
        public static final String EXPECTED_PRIMARY = "Expected number or '('.";
        public static final String TOO_DEEPLY_NESTED = "Expression nested too deeply.";

        private Messages() {
        }
    }
}
