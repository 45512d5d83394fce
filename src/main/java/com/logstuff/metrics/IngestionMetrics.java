package com.logstuff.metrics;

import com.logstuff.storage.InsertStatementCache;
import com.logstuff.storage.partition.PartitionRouter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Metrics for the ingestion process.
 *
 * Tracks:
 * - Events inserted, rejected (undecodable or refused by the database) and skipped blank lines
 * - Insert retries and connection resets
 * - Insert latency including partition routing
 * - Partitions created and prepared statements cached
 */
@Component
public class IngestionMetrics {

    private final MeterRegistry registry;
    private final Counter eventsInserted;
    private final Counter eventsRejected;
    private final Counter blankLines;
    private final Counter insertRetries;
    private final Counter connectionResets;
    private final Counter partitionsForgotten;
    private final Timer insertLatency;

    public IngestionMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.eventsInserted = Counter.builder("logstuff.ingest.events.inserted")
            .description("Number of events stored and confirmed")
            .tag("component", "ingestion")
            .register(registry);

        this.eventsRejected = Counter.builder("logstuff.ingest.events.rejected")
            .description("Number of events confirmed without being stored")
            .tag("component", "ingestion")
            .register(registry);

        this.blankLines = Counter.builder("logstuff.ingest.lines.blank")
            .description("Number of blank input lines ignored")
            .tag("component", "ingestion")
            .register(registry);

        this.insertRetries = Counter.builder("logstuff.ingest.insert.retries")
            .description("Number of insert attempts retried after a transient failure")
            .tag("component", "ingestion")
            .register(registry);

        this.connectionResets = Counter.builder("logstuff.ingest.connection.resets")
            .description("Number of times the insert connection was replaced")
            .tag("component", "ingestion")
            .register(registry);

        this.partitionsForgotten = Counter.builder("logstuff.ingest.partitions.forgotten")
            .description("Number of cached partitions found missing on insert")
            .tag("component", "ingestion")
            .register(registry);

        this.insertLatency = Timer.builder("logstuff.ingest.insert.latency")
            .description("Latency of routing and inserting one event")
            .tag("component", "ingestion")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry);
    }

    /**
     * Register gauges over the router and statement cache of this process.
     */
    public void bind(PartitionRouter router, InsertStatementCache statementCache) {
        Gauge.builder("logstuff.ingest.partitions.created", router, PartitionRouter::getCreatedPartitions)
            .description("Number of partition tables created by this process")
            .tag("component", "ingestion")
            .register(registry);

        Gauge.builder("logstuff.ingest.partitions.known", router, r -> r.getKnownTables().size())
            .description("Number of tables known to exist")
            .tag("component", "ingestion")
            .register(registry);

        Gauge.builder("logstuff.ingest.statements.cached", statementCache, InsertStatementCache::size)
            .description("Number of prepared inserts held open")
            .tag("component", "ingestion")
            .register(registry);
    }

    public void recordInserted(long durationNanos) {
        eventsInserted.increment();
        insertLatency.record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordRejected() {
        eventsRejected.increment();
    }

    public void recordBlankLine() {
        blankLines.increment();
    }

    public void recordRetry() {
        insertRetries.increment();
    }

    public void recordConnectionReset() {
        connectionResets.increment();
    }

    public void recordPartitionForgotten() {
        partitionsForgotten.increment();
    }

    public double getEventsInserted() {
        return eventsInserted.count();
    }

    public double getEventsRejected() {
        return eventsRejected.count();
    }

    public double getInsertRetries() {
        return insertRetries.count();
    }
}
