package com.calc.parse.expression;

import com.calc.exception.TokenizingException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExpressionTokenizer.
 */
class ExpressionTokenizerTest {

    @ParameterizedTest
    @CsvSource({
            "+, PLUS",
            "-, MINUS",
            "*, STAR",
            "/, SLASH",
            "(, LEFT_PAREN",
            "), RIGHT_PAREN"
    })
    @DisplayName("Should map single-character symbols to tokens")
    void shouldTokenizeSymbols(String input, TokenType expected) {
        ExpressionTokenizer tokenizer = new ExpressionTokenizer(input);

        assertTrue(tokenizer.hasNext());
        Token token = tokenizer.next();
        assertEquals(expected, token.type());
        assertEquals(input, token.text());
        assertNull(token.value());
        assertFalse(tokenizer.hasNext());
    }

    @ParameterizedTest
    @CsvSource({
            "7, 7.0",
            "42, 42.0",
            "3.14, 3.14",
            "0.5, 0.5",
            "10., 10.0",
            "007, 7.0"
    })
    @DisplayName("Should parse numeric literals")
    void shouldTokenizeNumbers(String input, double expected) {
        List<Token> tokens = new ExpressionTokenizer(input).tokenize();

        assertEquals(1, tokens.size());
        assertEquals(TokenType.NUMBER, tokens.get(0).type());
        assertEquals(expected, tokens.get(0).value());
    }

    @Test
    @DisplayName("Should skip spaces between tokens")
    void shouldSkipSpaces() {
        List<Token> tokens = new ExpressionTokenizer("  12 +   (3.5*4 )  ").tokenize();

        List<TokenType> types = tokens.stream().map(Token::type).toList();
        assertEquals(List.of(TokenType.NUMBER, TokenType.PLUS, TokenType.LEFT_PAREN, TokenType.NUMBER,
                TokenType.STAR, TokenType.NUMBER, TokenType.RIGHT_PAREN), types);
        assertEquals(12.0, tokens.get(0).value());
        assertEquals(3.5, tokens.get(3).value());
        assertEquals(4.0, tokens.get(5).value());
    }

    @Test
    @DisplayName("Should record the position of each token")
    void shouldRecordPositions() {
        List<Token> tokens = new ExpressionTokenizer("1 + 23").tokenize();

        assertEquals(0, tokens.get(0).position());
        assertEquals(2, tokens.get(1).position());
        assertEquals(4, tokens.get(2).position());
        assertEquals("23", tokens.get(2).text());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "     "})
    @DisplayName("Should produce no tokens for blank input")
    void shouldProduceNothingForBlankInput(String input) {
        ExpressionTokenizer tokenizer = new ExpressionTokenizer(input);

        assertFalse(tokenizer.hasNext());
        assertTrue(new ExpressionTokenizer(input).tokenize().isEmpty());
    }

    @Test
    @DisplayName("Should throw when reading past the end")
    void shouldThrowPastEnd() {
        ExpressionTokenizer tokenizer = new ExpressionTokenizer("1");
        tokenizer.next();

        assertThrows(NoSuchElementException.class, tokenizer::next);
    }

    @Test
    @DisplayName("Should produce tokens lazily up to an invalid character")
    void shouldFailLazilyOnInvalidCharacter() {
        ExpressionTokenizer tokenizer = new ExpressionTokenizer("2#");

        Token first = tokenizer.next();
        assertEquals(TokenType.NUMBER, first.type());
        assertEquals(2.0, first.value());

        TokenizingException e = assertThrows(TokenizingException.class, tokenizer::next);
        assertEquals(TokenizingError.invalidCharacter('#'), e.getError());
        assertEquals("Unexpected token '#'", e.getMessage());

        // Exhausted after the error
        assertFalse(tokenizer.hasNext());
    }

    static Stream<Arguments> invalidCharacters() {
        return Stream.of(
                Arguments.of("1\t2", "\t"),
                Arguments.of("1\n", "\n"),
                Arguments.of("a", "a"),
                Arguments.of(".5", "."),
                Arguments.of("2^3", "^"),
                Arguments.of("1,5", ","),
                Arguments.of("2\uD83D\uDE00", "\uD83D\uDE00"),
                Arguments.of("\uD835\uDFD9 + 1", "\uD835\uDFD9")
        );
    }

    @ParameterizedTest
    @MethodSource("invalidCharacters")
    @DisplayName("Should reject characters that are not operators, digits or spaces")
    void shouldRejectInvalidCharacters(String input, String expected) {
        TokenizingException e = assertThrows(TokenizingException.class,
                () -> new ExpressionTokenizer(input).tokenize());

        assertEquals(TokenizingError.Type.INVALID_CHARACTER, e.getError().type());
        assertEquals(expected, e.getError().character());
    }

    @Test
    @DisplayName("Should report a supplementary character as a whole code point")
    void shouldKeepSupplementaryCharacterWhole() {
        String emoji = new String(Character.toChars(0x1F600));
        ExpressionTokenizer tokenizer = new ExpressionTokenizer("2" + emoji);
        tokenizer.next();

        TokenizingException e = assertThrows(TokenizingException.class, tokenizer::next);
        assertEquals(TokenizingError.invalidCharacter(0x1F600), e.getError());
        assertEquals(2, e.getError().character().length());
        assertEquals("Unexpected token '" + emoji + "'", e.getMessage());
    }

    @ParameterizedTest
    @ValueSource(strings = {"1....", "1.324.3", "2 + 1..5"})
    @DisplayName("Should reject malformed numbers")
    void shouldRejectInvalidNumbers(String input) {
        TokenizingException e = assertThrows(TokenizingException.class,
                () -> new ExpressionTokenizer(input).tokenize());

        assertEquals(TokenizingError.invalidNumber(), e.getError());
        assertEquals("Invalid number format", e.getMessage());
    }
}
