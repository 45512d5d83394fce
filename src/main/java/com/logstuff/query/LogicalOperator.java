package com.logstuff.query;

/**
 * Connective of a {@link BinaryExpression}.
 */
public enum LogicalOperator {
    AND("and"),
    OR("or");

    private final String keyword;

    LogicalOperator(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }
}
