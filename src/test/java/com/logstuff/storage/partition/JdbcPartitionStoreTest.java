package com.logstuff.storage.partition;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for JdbcPartitionStore DDL
 */
@ExtendWith(MockitoExtension.class)
class JdbcPartitionStoreTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Mock
    private PlatformTransactionManager transactionManager;

    private JdbcPartitionStore store;

    @BeforeEach
    void setUp() {
        store = new JdbcPartitionStore(jdbcTemplate, new TransactionTemplate(transactionManager), "search");
    }

    @Test
    void testPartitionDdl() {
        PartitionTable table = monthOf("logs", false);

        assertThat(JdbcPartitionStore.partitionDdl(table)).isEqualTo(
            "CREATE TABLE IF NOT EXISTS logs_2024_03 PARTITION OF logs"
                + " FOR VALUES FROM ('2024-03-01 00:00:00+00:00') TO ('2024-04-01 00:00:00+00:00')");
    }

    @Test
    void testIntermediatePartitionIsPartitionedAgain() {
        assertThat(JdbcPartitionStore.partitionDdl(monthOf("logs", true)))
            .endsWith(" PARTITION BY RANGE (tstamp)");
    }

    @Test
    @SuppressWarnings("unchecked")
    void testCreatePartitionHandsItToParentOwner() {
        // Given
        when(jdbcTemplate.query(anyString(), any(ResultSetExtractor.class), eq("logs"))).thenReturn("write_logs");

        // When
        store.createPartition(monthOf("logs", false));

        // Then: Created and re-owned inside one transaction
        InOrder order = inOrder(transactionManager, jdbcTemplate);
        order.verify(transactionManager).getTransaction(any());
        order.verify(jdbcTemplate).execute(JdbcPartitionStore.partitionDdl(monthOf("logs", false)));
        order.verify(jdbcTemplate).execute("ALTER TABLE logs_2024_03 OWNER TO \"write_logs\"");
        order.verify(transactionManager).commit(any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testOwnerIsSkippedWhenParentHasNone() {
        when(jdbcTemplate.query(anyString(), any(ResultSetExtractor.class), eq("logs"))).thenReturn(null);

        store.createPartition(monthOf("logs", false));

        verify(jdbcTemplate).execute(JdbcPartitionStore.partitionDdl(monthOf("logs", false)));
        verify(jdbcTemplate, never()).execute(startsWith("ALTER TABLE"));
    }

    @Test
    void testRootDdlWithSearchIndex() {
        RootPartition root = new RootPartition("logs", "tstamp timestamptz not null, doc jsonb not null, search tsvector");

        assertThat(store.rootDdl(root, true)).containsExactly(
            "CREATE TABLE IF NOT EXISTS logs (tstamp timestamptz not null, doc jsonb not null, search tsvector)"
                + " PARTITION BY RANGE (tstamp)",
            "CREATE INDEX IF NOT EXISTS logs_tstamp_idx ON logs (tstamp)",
            "CREATE INDEX IF NOT EXISTS logs_search_idx ON logs USING gin (search)");
    }

    @Test
    void testRootDdlWithoutSearchIndex() {
        JdbcPartitionStore plain = new JdbcPartitionStore(jdbcTemplate, new TransactionTemplate(transactionManager), null);

        assertThat(plain.rootDdl(new RootPartition("events", "tstamp timestamptz not null"), false)).containsExactly(
            "CREATE TABLE IF NOT EXISTS events (tstamp timestamptz not null)",
            "CREATE INDEX IF NOT EXISTS events_tstamp_idx ON events (tstamp)");
    }

    @Test
    void testExistsUsesRegclass() {
        when(jdbcTemplate.queryForObject("SELECT to_regclass(?) IS NOT NULL", Boolean.class, "logs_2024_03"))
            .thenReturn(true);
        when(jdbcTemplate.queryForObject("SELECT to_regclass(?) IS NOT NULL", Boolean.class, "logs_2024_04"))
            .thenReturn(false);

        assertThat(store.exists("logs_2024_03")).isTrue();
        assertThat(store.exists("logs_2024_04")).isFalse();
    }

    @Test
    void testQuoteIdentifier() {
        assertThat(JdbcPartitionStore.quoteIdentifier("write_logs")).isEqualTo("\"write_logs\"");
        assertThat(JdbcPartitionStore.quoteIdentifier("we\"ird")).isEqualTo("\"we\"\"ird\"");
    }

    // ========== Helper Methods ==========

    private PartitionTable monthOf(String parent, boolean partitioned) {
        TimeBucket bucket = Interval.MONTH.bucketOf(Instant.parse("2024-03-15T10:00:00Z"), ZoneOffset.UTC);
        return PartitionTable.child("logs_2024_03", parent, bucket, partitioned);
    }
}
