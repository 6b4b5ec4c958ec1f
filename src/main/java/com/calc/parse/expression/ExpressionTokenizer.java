package com.calc.parse.expression;

import com.calc.exception.TokenizingException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static com.calc.parse.expression.ExpressionConfig.*;

/**
 * Tokenizer for arithmetic expressions.
 * <p>
 * Produces tokens lazily, one per call to {@link #next()}. The sequence is
 * single-pass: once input is exhausted or an error has been thrown, no further
 * tokens are produced.
 */
public final class ExpressionTokenizer implements Iterator<Token> {

    private final String input;
    private final int length;
    private int pos;
    private boolean failed;

    public ExpressionTokenizer(String input) {
        this.input = input;
        this.length = input.length();
        this.pos = 0;
    }

    /**
     * Tokenize the whole input string.
     *
     * @return List of tokens
     * @throws TokenizingException on the first invalid character or number
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (hasNext()) {
            tokens.add(next());
        }
        return tokens;
    }

    @Override
    public boolean hasNext() {
        if (failed) {
            return false;
        }
        // Only plain spaces are skipped, tabs and newlines are invalid characters
        while (!isAtEnd() && peek() == Operators.SPACE) {
            advance();
        }
        return !isAtEnd();
    }

    @Override
    public Token next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more tokens in '" + input + "'");
        }

        int start = pos;
        int c = input.codePointAt(pos);
        pos += Character.charCount(c);

        TokenType symbol = Character.isBmpCodePoint(c) ? SYMBOLS.get((char) c) : null;
        if (symbol != null) {
            return Token.of(symbol, (char) c, start);
        }
        if (isDigit(c)) {
            return readNumber(start);
        }
        throw error(TokenizingError.invalidCharacter(c));
    }

    private Token readNumber(int start) {
        // Dots are accumulated without validation, the parse decides
        while (!isAtEnd() && (isDigit(peek()) || peek() == Operators.DOT)) {
            advance();
        }

        String text = input.substring(start, pos);
        try {
            return Token.number(text, Double.parseDouble(text), start);
        } catch (NumberFormatException e) {
            throw error(TokenizingError.invalidNumber());
        }
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }

    private TokenizingException error(TokenizingError error) {
        failed = true;
        return new TokenizingException(error);
    }
}
