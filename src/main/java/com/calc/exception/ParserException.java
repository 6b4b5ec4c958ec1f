package com.calc.exception;

import com.calc.parse.expression.TokenizingError;

/**
 * Exception thrown when an expression cannot be parsed.
 * <p>
 * Lexical and grammatical failures render with the same {@code "Syntax error: "}
 * prefix; use {@link #getKind()} to tell them apart.
 */
public class ParserException extends CalculatorException {

    public static final String PREFIX = "Syntax error: ";

    public enum Kind {
        UNEXPECTED_TOKEN,
        SYNTAX_ERROR
    }

    private final Kind kind;
    private final String detail;
    private final TokenizingError tokenizingError;

    private ParserException(Kind kind, String detail, TokenizingError tokenizingError, Throwable cause) {
        super(PREFIX + detail, cause);
        this.kind = kind;
        this.detail = detail;
        this.tokenizingError = tokenizingError;
    }

    public static ParserException unexpectedToken(TokenizingException cause) {
        TokenizingError error = cause.getError();
        return new ParserException(Kind.UNEXPECTED_TOKEN, error.toString(), error, cause);
    }

    public static ParserException syntaxError(String message) {
        return new ParserException(Kind.SYNTAX_ERROR, message, null, null);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Message without the {@code "Syntax error: "} prefix.
     */
    public String getDetail() {
        return detail;
    }

    /**
     * @return the lexical error, or null for grammar violations
     */
    public TokenizingError getTokenizingError() {
        return tokenizingError;
    }
}
