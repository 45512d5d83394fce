package com.logstuff.storage;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.UncategorizedSQLException;
import org.springframework.jdbc.support.SQLExceptionTranslator;
import org.springframework.jdbc.support.SQLStateSQLExceptionTranslator;

import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded cache of prepared inserts keyed by leaf table name.
 *
 * <p>Statements belong to the {@link PinnedConnection}; evicted statements are closed on the
 * calling thread. The size only affects how often statements are re-prepared, never which
 * table an event lands in.
 */
public class InsertStatementCache {
    private static final Logger logger = LoggerFactory.getLogger(InsertStatementCache.class);

    private final PinnedConnection connection;
    private final boolean searchEnabled;
    private final Cache<String, PreparedInsert> cache;
    private final SQLExceptionTranslator exceptionTranslator = new SQLStateSQLExceptionTranslator();
    private final AtomicLong prepareCount = new AtomicLong();

    public InsertStatementCache(PinnedConnection connection, int capacity, boolean searchEnabled) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Statement cache capacity must be positive: " + capacity);
        }
        this.connection = connection;
        this.searchEnabled = searchEnabled;
        this.cache = Caffeine.newBuilder()
            .maximumSize(capacity)
            .executor(Runnable::run)
            .removalListener(this::onRemoval)
            .build();
    }

    /**
     * The cached insert for {@code table}, preparing it on a miss.
     *
     * @throws DataAccessException if the statement cannot be prepared
     */
    public PreparedInsert getOrPrepare(String table) {
        return cache.get(table, this::prepare);
    }

    private PreparedInsert prepare(String table) {
        String sql = PreparedInsert.insertSql(table, searchEnabled);
        try {
            PreparedInsert insert = new PreparedInsert(table, connection.get().prepareStatement(sql), searchEnabled);
            prepareCount.incrementAndGet();
            logger.debug("Prepared insert for {}", table);
            return insert;
        } catch (SQLException e) {
            throw translate("prepare insert", sql, e);
        }
    }

    public DataAccessException translate(String task, String sql, SQLException e) {
        DataAccessException translated = exceptionTranslator.translate(task, sql, e);
        return translated != null ? translated : new UncategorizedSQLException(task, sql, e);
    }

    private void onRemoval(String table, PreparedInsert insert, RemovalCause cause) {
        if (insert == null) {
            return;
        }
        try {
            insert.close();
        } catch (SQLException e) {
            // The connection may already be gone after a reset
            logger.debug("Failed to close statement for {} ({}): {}", table, cause, e.getMessage());
        }
    }

    public void invalidate(String table) {
        cache.invalidate(table);
    }

    /**
     * Close every cached statement, e.g. before the connection is replaced.
     */
    public void invalidateAll() {
        cache.invalidateAll();
        cache.cleanUp();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public long getPrepareCount() {
        return prepareCount.get();
    }
}
