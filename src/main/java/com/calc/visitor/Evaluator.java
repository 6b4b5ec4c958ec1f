package com.calc.visitor;

import com.calc.ast.Expression;
import com.calc.exception.EvaluatorException;

/**
 * Evaluates an expression tree to a double.
 * <p>
 * Follows IEEE-754 semantics, overflow to infinity is not an error. The only
 * failure is a divisor that evaluates to exactly zero.
 */
public class Evaluator implements ExpressionVisitor<Double, EvaluatorException> {

    public double evaluate(Expression expression) {
        return visitExpression(expression);
    }

    @Override
    public Double visitNumber(double value) {
        return value;
    }

    @Override
    public Double visitAdd(Expression left, Expression right) {
        return visitExpression(left) + visitExpression(right);
    }

    @Override
    public Double visitSubtract(Expression left, Expression right) {
        return visitExpression(left) - visitExpression(right);
    }

    @Override
    public Double visitMultiply(Expression left, Expression right) {
        return visitExpression(left) * visitExpression(right);
    }

    @Override
    public Double visitDivide(Expression left, Expression right) {
        // Divisor first, the dividend is never evaluated when it is zero
        double divisor = visitExpression(right);
        if (divisor == 0.0) {
            throw EvaluatorException.divisionByZero();
        }
        return visitExpression(left) / divisor;
    }

    @Override
    public Double visitNegate(Expression operand) {
        return -visitExpression(operand);
    }

    @Override
    public Double visitGrouping(Expression operand) {
        return visitExpression(operand);
    }
}
