package com.logstuff.query;

import java.util.Objects;

/**
 * Represents a binary expression (AND/OR)
 */
public class BinaryExpression implements Expression {
    private final LogicalOperator operator;
    private final Expression left;
    private final Expression right;

    public BinaryExpression(LogicalOperator operator, Expression left, Expression right) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public static BinaryExpression and(Expression left, Expression right) {
        return new BinaryExpression(LogicalOperator.AND, left, right);
    }

    public static BinaryExpression or(Expression left, Expression right) {
        return new BinaryExpression(LogicalOperator.OR, left, right);
    }

    public LogicalOperator getOperator() {
        return operator;
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BinaryExpression)) return false;
        BinaryExpression that = (BinaryExpression) o;
        return operator == that.operator && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, left, right);
    }

    @Override
    public String toString() {
        return operator + "(" + left + ", " + right + ")";
    }
}
