package com.calc.parse.expression;

/**
 * Represents a token in an arithmetic expression.
 *
 * @param type     Token type
 * @param text     Original text
 * @param value    Parsed value (numbers only, null otherwise)
 * @param position Position in the input string
 */
public record Token(TokenType type, String text, Double value, int position) {

    public static Token of(TokenType type, char symbol, int position) {
        return new Token(type, String.valueOf(symbol), null, position);
    }

    public static Token number(String text, double value, int position) {
        return new Token(TokenType.NUMBER, text, value, position);
    }

    @Override
    public String toString() {
        if (value != null) {
            return type + "(" + value + ")";
        }
        return type + "(" + text + ")";
    }
}
