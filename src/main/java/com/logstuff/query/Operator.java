package com.logstuff.query;

/**
 * Comparison operators of LQL.
 *
 * Not every operator accepts every value shape: {@code like} takes a text scalar,
 * the ordering operators take numeric scalars, {@code in} takes a list and {@code =}
 * takes either a scalar or a list (list equality means membership).
 */
public enum Operator {
    EQ("="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    LIKE("like"),
    IN("in");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isOrdering() {
        return this == LT || this == LE || this == GT || this == GE;
    }

    public static Operator fromSymbol(String symbol) {
        for (Operator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown operator: " + symbol);
    }
}
