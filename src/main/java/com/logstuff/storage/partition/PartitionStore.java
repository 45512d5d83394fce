package com.logstuff.storage.partition;

/**
 * Catalog operations the {@link PartitionRouter} needs from the database.
 * Implementations throw Spring {@code DataAccessException}s.
 */
public interface PartitionStore {

    boolean exists(String table);

    /**
     * Create the root table from its column schema if it is missing.
     *
     * @param partitioned whether the root is range partitioned by tstamp
     */
    void createRoot(RootPartition root, boolean partitioned);

    /**
     * Create a partition of {@code table.getParent()} for {@code table.getBounds()}, owned by
     * the owner of the parent.
     */
    void createPartition(PartitionTable table);
}
