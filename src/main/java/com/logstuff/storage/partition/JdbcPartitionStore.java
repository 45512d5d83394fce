package com.logstuff.storage.partition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * PostgreSQL catalog operations for partition management.
 *
 * <p>Each partition is created and handed to the parent's owner in one transaction, so a
 * concurrent writer never sees a partition owned by the ingestion role.
 */
public class JdbcPartitionStore implements PartitionStore {
    private static final Logger logger = LoggerFactory.getLogger(JdbcPartitionStore.class);

    static final String TIME_COLUMN = "tstamp";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final String searchColumn;

    /**
     * @param searchColumn column to GIN index on a newly created root, or null for none
     */
    public JdbcPartitionStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate, String searchColumn) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.searchColumn = searchColumn;
    }

    @Override
    public boolean exists(String table) {
        Boolean exists = jdbcTemplate.queryForObject("SELECT to_regclass(?) IS NOT NULL", Boolean.class, table);
        return Boolean.TRUE.equals(exists);
    }

    @Override
    public void createRoot(RootPartition root, boolean partitioned) {
        String table = root.getTable();
        transactionTemplate.executeWithoutResult(status -> {
            for (String ddl : rootDdl(root, partitioned)) {
                logger.debug("Executing: {}", ddl);
                jdbcTemplate.execute(ddl);
            }
        });
        logger.info("Root table {} ready (partitioned: {})", table, partitioned);
    }

    List<String> rootDdl(RootPartition root, boolean partitioned) {
        String table = root.getTable();
        String create = "CREATE TABLE IF NOT EXISTS " + table + " (" + root.getSchema() + ")"
            + (partitioned ? " PARTITION BY RANGE (" + TIME_COLUMN + ")" : "");
        String timeIndex = "CREATE INDEX IF NOT EXISTS " + table + "_" + TIME_COLUMN + "_idx ON "
            + table + " (" + TIME_COLUMN + ")";
        if (searchColumn == null) {
            return List.of(create, timeIndex);
        }
        String searchIndex = "CREATE INDEX IF NOT EXISTS " + table + "_" + searchColumn + "_idx ON "
            + table + " USING gin (" + searchColumn + ")";
        return List.of(create, timeIndex, searchIndex);
    }

    @Override
    public void createPartition(PartitionTable table) {
        transactionTemplate.executeWithoutResult(status -> {
            ResultSetExtractor<String> firstColumn = rs -> rs.next() ? rs.getString(1) : null;
            String owner = jdbcTemplate.query(
                "SELECT pg_get_userbyid(relowner) FROM pg_class WHERE oid = to_regclass(?)",
                firstColumn, table.getParent());

            String ddl = partitionDdl(table);
            logger.debug("Executing: {}", ddl);
            jdbcTemplate.execute(ddl);

            if (owner != null) {
                jdbcTemplate.execute("ALTER TABLE " + table.getName() + " OWNER TO " + quoteIdentifier(owner));
            }
        });
    }

    static String partitionDdl(PartitionTable table) {
        TimeBucket bounds = table.getBounds();
        return "CREATE TABLE IF NOT EXISTS " + table.getName()
            + " PARTITION OF " + table.getParent()
            + " FOR VALUES FROM ('" + bounds.lowerLiteral() + "') TO ('" + bounds.upperLiteral() + "')"
            + (table.isPartitioned() ? " PARTITION BY RANGE (" + TIME_COLUMN + ")" : "");
    }

    static String quoteIdentifier(String identifier) {
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }
}
