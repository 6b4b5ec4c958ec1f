package com.calc.ast;

import java.util.Objects;

/**
 * Abstract syntax tree of an arithmetic expression.
 * <p>
 * Every node owns its children exclusively and is immutable once built.
 * {@link Grouping} is kept in the tree so bracketing can be rendered back.
 */
public sealed interface Expression {

    record Number(double value) implements Expression {
    }

    record Add(Expression left, Expression right) implements Expression {
        public Add {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    record Subtract(Expression left, Expression right) implements Expression {
        public Subtract {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    record Multiply(Expression left, Expression right) implements Expression {
        public Multiply {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    record Divide(Expression left, Expression right) implements Expression {
        public Divide {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    record Negate(Expression operand) implements Expression {
        public Negate {
            Objects.requireNonNull(operand, "operand");
        }
    }

    record Grouping(Expression operand) implements Expression {
        public Grouping {
            Objects.requireNonNull(operand, "operand");
        }
    }

    static Expression number(double value) {
        return new Number(value);
    }

    static Expression add(Expression left, Expression right) {
        return new Add(left, right);
    }

    static Expression subtract(Expression left, Expression right) {
        return new Subtract(left, right);
    }

    static Expression multiply(Expression left, Expression right) {
        return new Multiply(left, right);
    }

    static Expression divide(Expression left, Expression right) {
        return new Divide(left, right);
    }

    static Expression negate(Expression operand) {
        return new Negate(operand);
    }

    static Expression grouping(Expression operand) {
        return new Grouping(operand);
    }
}
