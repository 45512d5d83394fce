package com.logstuff.storage.partition;

/**
 * One entry of a {@link PartitionSpec}: the root table or a time range subdivision.
 */
public interface PartitionLevel {

    /**
     * Human readable description used in error messages.
     */
    String describe();
}
