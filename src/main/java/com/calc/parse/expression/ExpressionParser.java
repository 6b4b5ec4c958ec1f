package com.calc.parse.expression;

import com.calc.ast.Expression;
import com.calc.exception.ParserException;
import com.calc.exception.TokenizingException;

import java.util.List;

import static com.calc.parse.expression.ExpressionConfig.*;

/**
 * Parser for arithmetic expressions.
 * Converts tokens into an {@link Expression} tree using recursive descent parsing.
 * <p>
 * Grammar (precedence: unary minus > * / > + -, binary operators left-associative):
 * <pre>
 * expression := term
 * term       := factor (('+' | '-') factor)*
 * factor     := unary (('*' | '/') unary)*
 * unary      := '-' unary | primary
 * primary    := NUMBER | '(' expression ')'
 * </pre>
 * The whole input is tokenized when the parser is created, so a lexical error
 * surfaces from the constructor before any parsing happens. Each instance
 * parses its input once.
 */
public final class ExpressionParser {

    /**
     * Limit on nested brackets plus chained unary minus signs.
     */
    public static final int MAX_NESTING = 256;

    private final String input;
    private final List<Token> tokens;
    private int index;
    private int depth;
    private int nesting;

    /**
     * @param input Expression text
     * @throws ParserException of kind {@link ParserException.Kind#UNEXPECTED_TOKEN}
     *                         if the input contains an invalid character or number
     */
    public ExpressionParser(String input) {
        this.input = input;
        try {
            this.tokens = List.copyOf(new ExpressionTokenizer(input).tokenize());
        } catch (TokenizingException e) {
            throw ParserException.unexpectedToken(e);
        }
        this.index = 0;
        this.depth = 0;
    }

    public String getInput() {
        return input;
    }

    public List<Token> getTokens() {
        return tokens;
    }

    /**
     * Parse the token stream into an expression tree.
     *
     * @return Root expression
     * @throws ParserException of kind {@link ParserException.Kind#SYNTAX_ERROR} on a grammar violation
     */
    public Expression parse() {
        return parseExpression();
    }

    private Expression parseExpression() {
        return parseTerm();
    }

    private Expression parseTerm() {
        Expression expression = parseFactor();

        while (true) {
            if (match(TokenType.PLUS)) {
                expression = new Expression.Add(expression, parseFactor());
            } else if (match(TokenType.MINUS)) {
                expression = new Expression.Subtract(expression, parseFactor());
            } else if (depth == 0 && check(TokenType.RIGHT_PAREN)) {
                throw error(Messages.TOO_MANY_RIGHT_PARENS);
            } else if (depth == 0 && check(TokenType.LEFT_PAREN)) {
                throw error(Messages.UNEXPECTED_LEFT_PAREN);
            } else {
                return expression;
            }
        }
    }

    private Expression parseFactor() {
        Expression expression = parseUnary();

        while (true) {
            if (match(TokenType.STAR)) {
                expression = new Expression.Multiply(expression, parseUnary());
            } else if (match(TokenType.SLASH)) {
                expression = new Expression.Divide(expression, parseUnary());
            } else if (depth == 0 && check(TokenType.RIGHT_PAREN)) {
                throw error(Messages.TOO_MANY_RIGHT_PARENS);
            } else {
                return expression;
            }
        }
    }

    private Expression parseUnary() {
        if (match(TokenType.MINUS)) {
            enterNested();
            Expression operand = parseUnary();
            nesting--;
            return new Expression.Negate(operand);
        }
        return parsePrimary();
    }

    private Expression parsePrimary() {
        Token token = advance();
        if (token != null && token.type() == TokenType.NUMBER) {
            return new Expression.Number(token.value());
        }
        if (token != null && token.type() == TokenType.LEFT_PAREN) {
            depth++;
            enterNested();
            Expression inner = parseExpression();
            expectRightParen();
            nesting--;
            return new Expression.Grouping(inner);
        }
        throw error(Messages.EXPECTED_PRIMARY);
    }

    private void expectRightParen() {
        Token token = advance();
        if (token == null || token.type() != TokenType.RIGHT_PAREN) {
            throw error(Messages.EXPECT_RIGHT_PAREN);
        }
        depth--;
    }

    private void enterNested() {
        if (++nesting > MAX_NESTING) {
            throw error(Messages.TOO_DEEPLY_NESTED);
        }
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        Token token = peek();
        return token != null && token.type() == type;
    }

    /**
     * Consume the current token; the cursor moves past the end as well.
     *
     * @return the consumed token, or null at end of input
     */
    private Token advance() {
        Token token = peek();
        index++;
        return token;
    }

    private boolean isAtEnd() {
        return index >= tokens.size();
    }

    private Token peek() {
        return isAtEnd() ? null : tokens.get(index);
    }

    private ParserException error(String message) {
        return ParserException.syntaxError(message);
    }
}
