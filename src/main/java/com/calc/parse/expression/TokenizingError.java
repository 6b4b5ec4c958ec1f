package com.calc.parse.expression;

/**
 * Lexical failure reported by {@link ExpressionTokenizer}.
 *
 * @param type      What went wrong
 * @param character The offending character as a full code point, only set for {@link Type#INVALID_CHARACTER}
 */
public record TokenizingError(Type type, String character) {

    public enum Type {
        INVALID_CHARACTER,
        INVALID_NUMBER
    }

    public static TokenizingError invalidCharacter(int codePoint) {
        return new TokenizingError(Type.INVALID_CHARACTER, Character.toString(codePoint));
    }

    public static TokenizingError invalidNumber() {
        return new TokenizingError(Type.INVALID_NUMBER, null);
    }

    @Override
    public String toString() {
        return switch (type) {
            case INVALID_CHARACTER -> "Unexpected token '" + character + "'";
            case INVALID_NUMBER -> "Invalid number format";
        };
    }
}
