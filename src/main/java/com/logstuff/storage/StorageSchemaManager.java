package com.logstuff.storage;

import com.logstuff.query.PostgresTranspiler;
import com.logstuff.storage.partition.PartitionSpec;
import com.logstuff.storage.partition.PartitionStore;
import com.logstuff.storage.partition.RootPartition;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Creates the numeric coercion function and the root event table on startup when they
 * are missing. Disable with {@code logstuff.storage.initialize-schema=false} when the
 * schema is managed outside the application (see {@code db/schema.sql}).
 */
@Component
public class StorageSchemaManager {
    private static final Logger logger = LoggerFactory.getLogger(StorageSchemaManager.class);

    private final JdbcTemplate jdbcTemplate;
    private final PartitionStore partitionStore;
    private final PartitionSpec partitionSpec;
    private final String numericFunction;

    @Value("${logstuff.storage.initialize-schema:true}")
    private boolean initializeSchema;

    public StorageSchemaManager(JdbcTemplate jdbcTemplate, PartitionStore partitionStore,
                                PartitionSpec partitionSpec, PostgresTranspiler transpiler) {
        this.jdbcTemplate = jdbcTemplate;
        this.partitionStore = partitionStore;
        this.partitionSpec = partitionSpec;
        this.numericFunction = transpiler.getNumericFunction();
    }

    @PostConstruct
    public void initialize() {
        if (!initializeSchema) {
            logger.info("Schema initialization disabled");
            return;
        }
        try {
            createNumericFunction();
            createRootTable();
            logger.info("PostgreSQL schema initialized successfully");
        } catch (DataAccessException e) {
            if (!SqlStates.isDuplicateObject(e)) {
                throw SqlStates.classify("Failed to initialize schema", e);
            }
            logger.debug("Schema object created concurrently: {}", e.getMessage());
        }
    }

    /**
     * Parse-or-null numeric coercion used by translated queries: text that is not a number
     * yields NULL instead of an error.
     */
    void createNumericFunction() {
        Boolean exists = jdbcTemplate.queryForObject(
            "SELECT to_regprocedure(?) IS NOT NULL", Boolean.class, numericFunction + "(text)");
        if (Boolean.TRUE.equals(exists)) {
            return;
        }
        String sql = """
            CREATE OR REPLACE FUNCTION %s(value text) RETURNS numeric
                LANGUAGE plpgsql IMMUTABLE AS $$
            BEGIN
                RETURN value::numeric;
            EXCEPTION WHEN others THEN
                RETURN NULL;
            END;
            $$
            """.formatted(numericFunction);
        jdbcTemplate.execute(sql);
        logger.info("Created function: {}(text)", numericFunction);
    }

    void createRootTable() {
        RootPartition root = partitionSpec.getRoot();
        if (!partitionStore.exists(root.getTable())) {
            partitionStore.createRoot(root, !partitionSpec.getTimeRanges().isEmpty());
        }
    }
}
