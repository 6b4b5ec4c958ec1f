package com.calc.visitor;

import com.calc.ast.Expression;

/**
 * Operation over an {@link Expression} tree, one method per node type.
 * <p>
 * Implementations recurse into children through {@link #visitExpression(Expression)}.
 *
 * @param <T> Result type
 * @param <E> Failure type, use {@link RuntimeException} for operations that cannot fail
 */
public interface ExpressionVisitor<T, E extends Exception> {

    T visitNumber(double value) throws E;

    T visitAdd(Expression left, Expression right) throws E;

    T visitSubtract(Expression left, Expression right) throws E;

    T visitMultiply(Expression left, Expression right) throws E;

    T visitDivide(Expression left, Expression right) throws E;

    T visitNegate(Expression operand) throws E;

    T visitGrouping(Expression operand) throws E;

    /**
     * Route a node to the method for its type.
     */
    default T visitExpression(Expression expression) throws E {
        if (expression instanceof Expression.Number n) {
            return visitNumber(n.value());
        }
        if (expression instanceof Expression.Add add) {
            return visitAdd(add.left(), add.right());
        }
        if (expression instanceof Expression.Subtract sub) {
            return visitSubtract(sub.left(), sub.right());
        }
        if (expression instanceof Expression.Multiply mul) {
            return visitMultiply(mul.left(), mul.right());
        }
        if (expression instanceof Expression.Divide div) {
            return visitDivide(div.left(), div.right());
        }
        if (expression instanceof Expression.Negate neg) {
            return visitNegate(neg.operand());
        }
        if (expression instanceof Expression.Grouping group) {
            return visitGrouping(group.operand());
        }
        throw new IllegalArgumentException("Unknown expression: " + expression);
    }
}
