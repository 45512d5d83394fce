package com.logstuff.storage.partition;

import java.util.Objects;

/**
 * The logical event table, with the column definitions used when it has to be created.
 */
public final class RootPartition implements PartitionLevel {

    private final String table;
    private final String schema;

    public RootPartition(String table, String schema) {
        this.table = Objects.requireNonNull(table, "table");
        this.schema = Objects.requireNonNull(schema, "schema");
    }

    public String getTable() {
        return table;
    }

    public String getSchema() {
        return schema;
    }

    @Override
    public String describe() {
        return "root " + table;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RootPartition)) return false;
        RootPartition that = (RootPartition) o;
        return table.equals(that.table) && schema.equals(that.schema);
    }

    @Override
    public int hashCode() {
        return Objects.hash(table, schema);
    }
}
