package com.logstuff.query;

import java.util.List;
import java.util.Objects;

/**
 * Right-hand side of a comparison: a single scalar or a parenthesized list of scalars.
 */
public final class Value {
    private final Scalar scalar;
    private final List<Scalar> list;

    private Value(Scalar scalar, List<Scalar> list) {
        this.scalar = scalar;
        this.list = list;
    }

    public static Value of(Scalar scalar) {
        return new Value(Objects.requireNonNull(scalar, "scalar"), null);
    }

    public static Value list(List<Scalar> scalars) {
        return new Value(null, List.copyOf(scalars));
    }

    public static Value list(Scalar... scalars) {
        return list(List.of(scalars));
    }

    public boolean isList() {
        return list != null;
    }

    public Scalar getScalar() {
        if (scalar == null) {
            throw new IllegalStateException("Value is a list");
        }
        return scalar;
    }

    public List<Scalar> getList() {
        if (list == null) {
            throw new IllegalStateException("Value is a scalar");
        }
        return list;
    }

    /**
     * All scalars of this value in source order.
     */
    public List<Scalar> scalars() {
        return isList() ? list : List.of(scalar);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value that = (Value) o;
        return Objects.equals(scalar, that.scalar) && Objects.equals(list, that.list);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scalar, list);
    }

    @Override
    public String toString() {
        return isList() ? list.toString() : scalar.toString();
    }
}
