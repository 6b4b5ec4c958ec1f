package com.calc.visitor;

import com.calc.ast.Expression;

/**
 * Renders an expression tree back to infix text.
 */
public class PrettyPrinter implements ExpressionVisitor<String, RuntimeException> {

    public String print(Expression expression) {
        return visitExpression(expression);
    }

    @Override
    public String visitNumber(double value) {
        return NumberFormatter.format(value);
    }

    @Override
    public String visitAdd(Expression left, Expression right) {
        return binary(left, "+", right);
    }

    @Override
    public String visitSubtract(Expression left, Expression right) {
        return binary(left, "-", right);
    }

    @Override
    public String visitMultiply(Expression left, Expression right) {
        return binary(left, "*", right);
    }

    @Override
    public String visitDivide(Expression left, Expression right) {
        return binary(left, "/", right);
    }

    @Override
    public String visitNegate(Expression operand) {
        return "-" + visitExpression(operand);
    }

    @Override
    public String visitGrouping(Expression operand) {
        return "(" + visitExpression(operand) + ")";
    }

    private String binary(Expression left, String operator, Expression right) {
        return visitExpression(left) + " " + operator + " " + visitExpression(right);
    }
}
