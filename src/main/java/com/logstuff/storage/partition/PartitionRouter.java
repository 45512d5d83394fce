package com.logstuff.storage.partition;

import com.logstuff.storage.SqlStates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Routes event timestamps to leaf tables, creating missing partitions on demand.
 *
 * <p>Tables confirmed to exist are remembered for the lifetime of the router and never
 * checked again. Creation races with other ingestion processes are settled by the database:
 * a duplicate-object failure means another process created the table first.
 */
public class PartitionRouter {
    private static final Logger logger = LoggerFactory.getLogger(PartitionRouter.class);

    private final PartitionSpec spec;
    private final PartitionStore store;
    private final Set<String> knownTables = ConcurrentHashMap.newKeySet();
    private final AtomicLong createdPartitions = new AtomicLong();

    public PartitionRouter(PartitionSpec spec, PartitionStore store) {
        this.spec = spec;
        this.store = store;
    }

    /**
     * Tables from the root down to the leaf that holds events at {@code eventTime}.
     * Does not touch the database.
     */
    public List<PartitionTable> path(Instant eventTime) {
        RootPartition root = spec.getRoot();
        List<TimeRangePartition> ranges = spec.getTimeRanges();
        List<PartitionTable> path = new ArrayList<>(ranges.size() + 1);
        path.add(PartitionTable.root(root.getTable(), !ranges.isEmpty()));

        String parent = root.getTable();
        for (int i = 0; i < ranges.size(); i++) {
            TimeRangePartition range = ranges.get(i);
            TimeBucket bucket = range.getInterval().bucketOf(eventTime, spec.getZone());
            String name = range.getNameTemplate().format(bucket.getLower());
            path.add(PartitionTable.child(name, parent, bucket, i < ranges.size() - 1));
            parent = name;
        }
        return path;
    }

    /**
     * Leaf table for {@code eventTime}, created along with any missing ancestors.
     *
     * @throws DataAccessException if the database fails for any reason other than a lost creation race
     */
    public String resolve(Instant eventTime) {
        List<PartitionTable> path = path(eventTime);
        for (PartitionTable table : path) {
            ensureExists(table);
        }
        return path.get(path.size() - 1).getName();
    }

    void ensureExists(PartitionTable table) {
        if (knownTables.contains(table.getName())) {
            return;
        }
        if (!store.exists(table.getName())) {
            try {
                if (table.isRoot()) {
                    store.createRoot(spec.getRoot(), table.isPartitioned());
                } else {
                    store.createPartition(table);
                }
                createdPartitions.incrementAndGet();
                logger.info("Created table {}", table);
            } catch (DataAccessException e) {
                if (!SqlStates.isDuplicateObject(e)) {
                    throw e;
                }
                logger.debug("Table {} was created concurrently: {}", table.getName(), e.getMessage());
            }
        }
        knownTables.add(table.getName());
    }

    /**
     * Drop every table on the path of {@code eventTime} from the cache, e.g. after an insert
     * found that an operator retired the partition.
     */
    public void forgetPath(Instant eventTime) {
        for (PartitionTable table : path(eventTime)) {
            knownTables.remove(table.getName());
        }
    }

    public boolean isKnown(String table) {
        return knownTables.contains(table);
    }

    public Set<String> getKnownTables() {
        return Collections.unmodifiableSet(knownTables);
    }

    public long getCreatedPartitions() {
        return createdPartitions.get();
    }

    public PartitionSpec getSpec() {
        return spec;
    }
}
