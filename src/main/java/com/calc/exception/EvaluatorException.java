package com.calc.exception;

/**
 * Exception thrown when a parsed expression cannot be evaluated.
 * Currently only raised for division by zero.
 */
public class EvaluatorException extends CalculatorException {

    public static final String DIVISION_BY_ZERO = "Division by zero";

    public EvaluatorException(String message) {
        super(message);
    }

    public static EvaluatorException divisionByZero() {
        return new EvaluatorException(DIVISION_BY_ZERO);
    }
}
