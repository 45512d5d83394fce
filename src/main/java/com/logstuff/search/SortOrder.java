package com.logstuff.search;

/**
 * Event order on {@code (tstamp, id)}.
 */
public enum SortOrder {
    /** Most recent first */
    DESC("DESC", "<"),
    ASC("ASC", ">");

    private final String sql;
    private final String keysetComparison;

    SortOrder(String sql, String keysetComparison) {
        this.sql = sql;
        this.keysetComparison = keysetComparison;
    }

    public String getSql() {
        return sql;
    }

    /**
     * Comparison selecting rows after the cursor in this order.
     */
    public String getKeysetComparison() {
        return keysetComparison;
    }

    public static SortOrder fromParameter(String value) {
        if (value == null || value.isBlank()) {
            return DESC;
        }
        for (SortOrder order : values()) {
            if (order.name().equalsIgnoreCase(value.trim())) {
                return order;
            }
        }
        throw new IllegalArgumentException("Invalid order: " + value + " (expected asc or desc)");
    }
}
