package com.logstuff.storage.partition;

import java.util.Objects;

/**
 * A concrete table on the path from the root to the leaf for one event time.
 */
public final class PartitionTable {

    private final String name;
    private final String parent;
    private final TimeBucket bounds;
    private final boolean partitioned;

    private PartitionTable(String name, String parent, TimeBucket bounds, boolean partitioned) {
        this.name = Objects.requireNonNull(name, "name");
        this.parent = parent;
        this.bounds = bounds;
        this.partitioned = partitioned;
    }

    public static PartitionTable root(String name, boolean partitioned) {
        return new PartitionTable(name, null, null, partitioned);
    }

    public static PartitionTable child(String name, String parent, TimeBucket bounds, boolean partitioned) {
        return new PartitionTable(name, Objects.requireNonNull(parent, "parent"),
            Objects.requireNonNull(bounds, "bounds"), partitioned);
    }

    public String getName() {
        return name;
    }

    /**
     * Parent table, null for the root.
     */
    public String getParent() {
        return parent;
    }

    public TimeBucket getBounds() {
        return bounds;
    }

    /**
     * Whether this table is itself partitioned by range of tstamp.
     */
    public boolean isPartitioned() {
        return partitioned;
    }

    public boolean isRoot() {
        return parent == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PartitionTable)) return false;
        PartitionTable that = (PartitionTable) o;
        return partitioned == that.partitioned && name.equals(that.name)
            && Objects.equals(parent, that.parent) && Objects.equals(bounds, that.bounds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, parent, bounds, partitioned);
    }

    @Override
    public String toString() {
        return isRoot() ? name : name + " of " + parent + " " + bounds;
    }
}
