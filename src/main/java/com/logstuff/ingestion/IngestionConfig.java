package com.logstuff.ingestion;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logstuff.LogstuffApplication;
import com.logstuff.metrics.IngestionMetrics;
import com.logstuff.storage.InsertStatementCache;
import com.logstuff.storage.PinnedConnection;
import com.logstuff.storage.StoreException;
import com.logstuff.storage.partition.PartitionRouter;
import com.logstuff.storage.partition.PartitionSpec;
import com.logstuff.storage.partition.PartitionStore;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Duration;

/**
 * Beans of the ingestion mode: one pinned connection, its statement cache, the partition
 * router and the stdin/stdout line loop.
 */
@Configuration
@Profile(LogstuffApplication.MODE_INGEST)
public class IngestionConfig {
    private static final Logger logger = LoggerFactory.getLogger(IngestionConfig.class);

    @Value("${logstuff.ingest.format:rsyslog}")
    private String format;

    @Value("${logstuff.ingest.timestamp-field:timestamp}")
    private String timestampField;

    @Value("${logstuff.ingest.statement-cache-size:3}")
    private int statementCacheSize;

    @Value("${logstuff.ingest.search-enabled:true}")
    private boolean searchEnabled;

    @Value("${logstuff.ingest.retry.max-attempts:5}")
    private int maxAttempts;

    @Value("${logstuff.ingest.retry.initial-backoff:200ms}")
    private Duration initialBackoff;

    @Value("${logstuff.ingest.retry.multiplier:2.0}")
    private double backoffMultiplier;

    @Bean(destroyMethod = "close")
    public PinnedConnection pinnedConnection(DataSource dataSource) {
        return new PinnedConnection(dataSource);
    }

    @Bean
    public InsertStatementCache insertStatementCache(PinnedConnection pinnedConnection) {
        return new InsertStatementCache(pinnedConnection, statementCacheSize, searchEnabled);
    }

    @Bean
    public PartitionRouter partitionRouter(PartitionSpec partitionSpec, PartitionStore partitionStore) {
        return new PartitionRouter(partitionSpec, partitionStore);
    }

    /**
     * Decoder for {@code logstuff.ingest.format}
     */
    @Bean
    public EventDecoder eventDecoder(ObjectMapper objectMapper) {
        return switch (format.trim().toLowerCase()) {
            case RsyslogEventDecoder.FORMAT -> new RsyslogEventDecoder(objectMapper);
            case JsonEventDecoder.FORMAT -> new JsonEventDecoder(objectMapper, timestampField, Clock.systemUTC());
            default -> throw new IllegalArgumentException("Unknown logstuff.ingest.format: " + format
                + " (expected " + RsyslogEventDecoder.FORMAT + " or " + JsonEventDecoder.FORMAT + ")");
        };
    }

    /**
     * Retry for transient store failures with exponential backoff
     */
    @Bean
    public Retry insertRetry() {
        RetryConfig config = RetryConfig.custom()
            .maxAttempts(maxAttempts)
            .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoff, backoffMultiplier))
            .retryOnException(e -> e instanceof StoreException && ((StoreException) e).isRetryable())
            .build();
        logger.info("Insert retry: {} attempts, backoff from {} ms x{}",
            maxAttempts, initialBackoff.toMillis(), backoffMultiplier);
        return Retry.of("insert", config);
    }

    @Bean
    public EventIngester eventIngester(EventDecoder eventDecoder,
                                       PartitionRouter partitionRouter,
                                       InsertStatementCache insertStatementCache,
                                       PinnedConnection pinnedConnection,
                                       Retry insertRetry,
                                       IngestionMetrics metrics) {
        metrics.bind(partitionRouter, insertStatementCache);
        logger.info("Ingesting {} events", eventDecoder.getFormat());
        return new EventIngester(eventDecoder, partitionRouter, insertStatementCache,
            pinnedConnection, insertRetry, metrics);
    }

    @Bean
    public LineProtocolRunner lineProtocolRunner(EventIngester eventIngester,
                                                 PinnedConnection pinnedConnection,
                                                 InsertStatementCache insertStatementCache) {
        return new LineProtocolRunner(eventIngester, pinnedConnection, insertStatementCache,
            new SignalHandlers(), System.in, System.out, System::exit);
    }
}
