package com.logstuff.ingestion;

import com.logstuff.metrics.IngestionMetrics;
import com.logstuff.storage.FatalStoreException;
import com.logstuff.storage.InsertStatementCache;
import com.logstuff.storage.LogEvent;
import com.logstuff.storage.PinnedConnection;
import com.logstuff.storage.PreparedInsert;
import com.logstuff.storage.SqlStates;
import com.logstuff.storage.StoreException;
import com.logstuff.storage.TransientStoreException;
import com.logstuff.storage.partition.PartitionRouter;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.sql.SQLException;
import java.time.DateTimeException;
import java.time.Instant;

/**
 * Stores one input line at a time.
 *
 * <p>A line is decoded, routed to its leaf partition and inserted on the pinned connection.
 * Transient failures are retried by the configured {@link Retry}; between attempts the
 * connection is replaced and every prepared statement dropped. Anything that cannot succeed
 * by retrying either rejects the event (bad input) or is raised as a
 * {@link FatalStoreException} (bad store), in which case the event must not be confirmed.
 */
public class EventIngester {
    private static final Logger logger = LoggerFactory.getLogger(EventIngester.class);

    private static final int MAX_LOGGED_LINE = 512;

    private final EventDecoder decoder;
    private final PartitionRouter router;
    private final InsertStatementCache statementCache;
    private final PinnedConnection connection;
    private final Retry retry;
    private final IngestionMetrics metrics;

    public EventIngester(EventDecoder decoder,
                         PartitionRouter router,
                         InsertStatementCache statementCache,
                         PinnedConnection connection,
                         Retry retry,
                         IngestionMetrics metrics) {
        this.decoder = decoder;
        this.router = router;
        this.statementCache = statementCache;
        this.connection = connection;
        this.retry = retry;
        this.metrics = metrics;

        retry.getEventPublisher().onRetry(event -> {
            metrics.recordRetry();
            logger.warn("Insert attempt {} failed, retrying in {} ms: {}",
                event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown");
        });
    }

    /**
     * @throws FatalStoreException if the event could not be stored and must not be confirmed
     */
    public LineOutcome process(String line) {
        if (line == null || line.isBlank()) {
            metrics.recordBlankLine();
            return LineOutcome.IGNORED;
        }

        LogEvent event;
        try {
            event = decoder.decode(line);
        } catch (EventDecodeException e) {
            logger.warn("Rejecting undecodable {} event: {} | line: {}",
                decoder.getFormat(), e.getMessage(), abbreviate(line));
            metrics.recordRejected();
            return LineOutcome.REJECTED;
        }

        long start = System.nanoTime();
        try {
            Retry.decorateRunnable(retry, () -> insertOnce(event)).run();
        } catch (TransientStoreException e) {
            throw new FatalStoreException("Giving up on event after "
                + retry.getRetryConfig().getMaxAttempts() + " attempts", e.getSqlState(), e);
        } catch (DateTimeException e) {
            logger.warn("Rejecting event that cannot be routed to a partition: {} | line: {}",
                e.getMessage(), abbreviate(line));
            metrics.recordRejected();
            return LineOutcome.REJECTED;
        } catch (FatalStoreException e) {
            if (!SqlStates.isDataException(e)) {
                throw e;
            }
            logger.error("Database rejected event at {}: {} | line: {}",
                event.getTimestamp(), e.getMessage(), abbreviate(line));
            metrics.recordRejected();
            return LineOutcome.REJECTED;
        }
        metrics.recordInserted(System.nanoTime() - start);
        return LineOutcome.INSERTED;
    }

    /**
     * One attempt, including a single re-route when a cached partition turned out to be gone.
     *
     * @throws StoreException classified as transient or fatal
     */
    void insertOnce(LogEvent event) {
        String docJson = event.getDoc().toString();
        Instant timestamp = event.getTimestamp();
        try {
            String table = router.resolve(timestamp);
            try {
                insertInto(table, event, docJson);
            } catch (DataAccessException e) {
                if (!SqlStates.isUndefinedTable(e)) {
                    throw e;
                }
                logger.warn("Partition {} no longer exists, routing again", table);
                metrics.recordPartitionForgotten();
                router.forgetPath(timestamp);
                statementCache.invalidate(table);
                insertInto(router.resolve(timestamp), event, docJson);
            }
        } catch (DataAccessException e) {
            StoreException failure = SqlStates.classify("Failed to insert event at " + timestamp, e);
            if (failure.isRetryable()) {
                statementCache.invalidateAll();
                connection.reset();
                metrics.recordConnectionReset();
            }
            throw failure;
        }
    }

    private void insertInto(String table, LogEvent event, String docJson) {
        PreparedInsert insert = statementCache.getOrPrepare(table);
        try {
            insert.insert(event.getTimestamp(), docJson, event.getSearch());
        } catch (SQLException e) {
            throw statementCache.translate("insert event", table, e);
        }
    }

    static String abbreviate(String line) {
        if (line.length() <= MAX_LOGGED_LINE) {
            return line;
        }
        return line.substring(0, MAX_LOGGED_LINE) + "...";
    }
}
