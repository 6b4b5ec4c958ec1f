package com.calc.core;

import com.calc.ast.Expression;
import com.calc.exception.CalculatorException;
import com.calc.exception.ParserException;
import com.calc.parse.expression.ExpressionParser;
import com.calc.visitor.Evaluator;
import com.calc.visitor.NumberFormatter;
import com.calc.visitor.PrettyPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Facade over the tokenize, parse and evaluate pipeline.
 * <p>
 * Takes one line of input and returns one line of output: the formatted result,
 * or the error message when any stage fails. Holds no per-call state, so a
 * single instance can be shared between threads.
 */
public class ExpressionCalculator {

    private static final Logger log = LoggerFactory.getLogger(ExpressionCalculator.class);

    private final Evaluator evaluator = new Evaluator();
    private final PrettyPrinter printer = new PrettyPrinter();

    /**
     * Parse an expression into its tree.
     *
     * @param input Expression text, e.g. "(1 + 2) * 3"
     * @return Expression tree
     * @throws ParserException if the input is not a valid expression
     */
    public Expression parse(String input) {
        Expression expression = new ExpressionParser(input).parse();
        log.debug("Parsed '{}' to {}", input, expression);
        return expression;
    }

    /**
     * Evaluate an expression.
     *
     * @param input Expression text
     * @return Numeric result
     * @throws CalculatorException if parsing or evaluation fails
     */
    public double evaluate(String input) {
        return evaluator.evaluate(parse(input));
    }

    /**
     * Evaluate one line and render the outcome as text.
     *
     * @param line Trimmed input line
     * @return Formatted result or error message
     */
    public String calculate(String line) {
        try {
            double result = evaluate(line);
            log.debug("Evaluated '{}' = {}", line, result);
            return NumberFormatter.format(result);
        } catch (CalculatorException e) {
            log.debug("Rejected expression '{}': {}", line, e.getMessage());
            return e.getMessage();
        }
    }

    /**
     * Parse an expression and render it back to infix text.
     *
     * @param input Expression text
     * @return Normalized text, brackets kept where the input had them
     * @throws ParserException if the input is not a valid expression
     */
    public String prettyPrint(String input) {
        return printer.print(parse(input));
    }
}
