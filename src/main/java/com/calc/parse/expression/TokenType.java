package com.calc.parse.expression;

/**
 * Token types for arithmetic expressions.
 */
public enum TokenType {
    // Literals
    NUMBER,

    // Operators
    PLUS,
    MINUS,
    STAR,
    SLASH,

    // Delimiters
    LEFT_PAREN,
    RIGHT_PAREN
}
