package com.logstuff.query;

import java.util.Objects;

/**
 * A literal of the query language: an integer, a float or a text string.
 */
public final class Scalar {

    public enum Kind {
        INT,
        FLOAT,
        TEXT
    }

    private final Kind kind;
    private final long longValue;
    private final double doubleValue;
    private final String textValue;

    private Scalar(Kind kind, long longValue, double doubleValue, String textValue) {
        this.kind = kind;
        this.longValue = longValue;
        this.doubleValue = doubleValue;
        this.textValue = textValue;
    }

    public static Scalar ofInt(long value) {
        return new Scalar(Kind.INT, value, 0, null);
    }

    public static Scalar ofFloat(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Float literal must be finite: " + value);
        }
        return new Scalar(Kind.FLOAT, 0, value, null);
    }

    public static Scalar ofText(String value) {
        return new Scalar(Kind.TEXT, 0, 0, Objects.requireNonNull(value, "value"));
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isNumeric() {
        return kind != Kind.TEXT;
    }

    public long asLong() {
        requireKind(Kind.INT);
        return longValue;
    }

    public double asDouble() {
        requireKind(Kind.FLOAT);
        return doubleValue;
    }

    public String asText() {
        requireKind(Kind.TEXT);
        return textValue;
    }

    /**
     * The value as it is bound to a JDBC parameter.
     */
    public Object toJdbcValue() {
        return switch (kind) {
            case INT -> longValue;
            case FLOAT -> doubleValue;
            case TEXT -> textValue;
        };
    }

    private void requireKind(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Scalar is " + kind + ", not " + expected);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Scalar)) return false;
        Scalar that = (Scalar) o;
        if (kind != that.kind) return false;
        return switch (kind) {
            case INT -> longValue == that.longValue;
            case FLOAT -> Double.compare(doubleValue, that.doubleValue) == 0;
            case TEXT -> textValue.equals(that.textValue);
        };
    }

    @Override
    public int hashCode() {
        return switch (kind) {
            case INT -> Objects.hash(kind, longValue);
            case FLOAT -> Objects.hash(kind, doubleValue);
            case TEXT -> Objects.hash(kind, textValue);
        };
    }

    @Override
    public String toString() {
        return switch (kind) {
            case INT -> Long.toString(longValue);
            case FLOAT -> Double.toString(doubleValue);
            case TEXT -> '"' + textValue + '"';
        };
    }
}
