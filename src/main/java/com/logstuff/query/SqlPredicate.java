package com.logstuff.query;

import java.util.List;
import java.util.Objects;

/**
 * A SQL boolean fragment with JDBC positional placeholders and the scalars bound to them.
 * The n-th {@code ?} in {@link #getSql()} takes the n-th entry of {@link #getParameters()}.
 */
public final class SqlPredicate {

    private static final SqlPredicate MATCH_ALL = new SqlPredicate("TRUE", List.of());

    private final String sql;
    private final List<Scalar> parameters;

    public SqlPredicate(String sql, List<Scalar> parameters) {
        this.sql = Objects.requireNonNull(sql, "sql");
        this.parameters = List.copyOf(parameters);
    }

    public static SqlPredicate matchAll() {
        return MATCH_ALL;
    }

    public String getSql() {
        return sql;
    }

    public List<Scalar> getParameters() {
        return parameters;
    }

    public Object[] toJdbcArguments() {
        return parameters.stream().map(Scalar::toJdbcValue).toArray();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SqlPredicate)) return false;
        SqlPredicate that = (SqlPredicate) o;
        return sql.equals(that.sql) && parameters.equals(that.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sql, parameters);
    }

    @Override
    public String toString() {
        return sql + " " + parameters;
    }
}
