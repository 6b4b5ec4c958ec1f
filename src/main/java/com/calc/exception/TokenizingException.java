package com.calc.exception;

import com.calc.parse.expression.TokenizingError;

/**
 * Exception thrown when the input cannot be split into tokens.
 */
public class TokenizingException extends CalculatorException {

    private final TokenizingError error;

    public TokenizingException(TokenizingError error) {
        super(error.toString());
        this.error = error;
    }

    public TokenizingError getError() {
        return error;
    }
}
