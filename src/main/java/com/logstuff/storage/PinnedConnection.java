package com.logstuff.storage;

import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * One connection held for the life of an ingestion process, so that prepared insert
 * statements stay valid between events. {@link #reset()} discards it after a failure;
 * the next {@link #get()} opens a replacement.
 */
public class PinnedConnection implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PinnedConnection.class);

    private final DataSource dataSource;
    private Connection connection;

    public PinnedConnection(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public synchronized Connection get() throws SQLException {
        if (connection == null) {
            connection = dataSource.getConnection();
            connection.setAutoCommit(true);
            logger.debug("Pinned a new connection");
        }
        return connection;
    }

    /**
     * Evict the current connection from the pool instead of returning it, since it may be broken.
     */
    public synchronized void reset() {
        if (connection == null) {
            return;
        }
        Connection broken = connection;
        connection = null;
        try {
            if (dataSource instanceof HikariDataSource) {
                ((HikariDataSource) dataSource).evictConnection(broken);
            } else {
                broken.close();
            }
        } catch (SQLException | RuntimeException e) {
            logger.debug("Ignoring failure while discarding connection: {}", e.getMessage());
        }
        logger.info("Discarded pinned connection; a new one is opened on next use");
    }

    @Override
    public synchronized void close() {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            logger.warn("Failed to release pinned connection: {}", e.getMessage());
        } finally {
            connection = null;
        }
    }
}
