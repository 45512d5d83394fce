package com.logstuff.query;

import java.util.Objects;

/**
 * Represents a negated expression
 */
public class NotExpression implements Expression {
    private final Expression operand;

    public NotExpression(Expression operand) {
        this.operand = Objects.requireNonNull(operand, "operand");
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NotExpression)) return false;
        return operand.equals(((NotExpression) o).operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash("not", operand);
    }

    @Override
    public String toString() {
        return "NOT(" + operand + ")";
    }
}
