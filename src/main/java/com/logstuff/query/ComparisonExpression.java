package com.logstuff.query;

import java.util.Objects;

/**
 * Represents a comparison expression (field op value)
 */
public class ComparisonExpression implements Expression {
    private final String field;
    private final Operator operator;
    private final Value value;

    public ComparisonExpression(String field, Operator operator, Value value) {
        this.field = Objects.requireNonNull(field, "field");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.value = Objects.requireNonNull(value, "value");
    }

    public String getField() {
        return field;
    }

    public Operator getOperator() {
        return operator;
    }

    public Value getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ComparisonExpression)) return false;
        ComparisonExpression that = (ComparisonExpression) o;
        return field.equals(that.field) && operator == that.operator && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, operator, value);
    }

    @Override
    public String toString() {
        return "Compare(" + field + " " + operator.getSymbol() + " " + value + ")";
    }
}
