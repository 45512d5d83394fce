package com.logstuff.search;

import com.logstuff.query.SqlPredicate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;

import java.sql.ResultSet;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HistogramAggregatorTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Test
    void testEmptyBucketsAreFilledWithZero() throws Exception {
        // Given: Events in buckets 0 and 2 only
        TimeRange range = new TimeRange(Instant.parse("2024-03-15T10:00:00Z"), Instant.parse("2024-03-15T10:04:00Z"));
        HistogramSpec spec = HistogramSpec.equalWidth(range, 4);
        ResultSet rs = mock(ResultSet.class);
        when(rs.getLong("bucket")).thenReturn(0L, 2L);
        when(rs.getLong("events")).thenReturn(5L, 3L);
        doAnswer(invocation -> {
            RowCallbackHandler handler = invocation.getArgument(1);
            handler.processRow(rs);
            handler.processRow(rs);
            return null;
        }).when(jdbcTemplate).query(anyString(), any(RowCallbackHandler.class), any(Object[].class));

        // When
        List<HistogramBucket> buckets = new HistogramAggregator(jdbcTemplate, "logs")
            .histogram(SqlPredicate.matchAll(), range, spec);

        // Then
        assertThat(buckets).extracting(HistogramBucket::getCount).containsExactly(5L, 0L, 3L, 0L);
        assertThat(buckets).extracting(HistogramBucket::getStart).containsExactly(
            Instant.parse("2024-03-15T10:00:00Z"), Instant.parse("2024-03-15T10:01:00Z"),
            Instant.parse("2024-03-15T10:02:00Z"), Instant.parse("2024-03-15T10:03:00Z"));
    }

    @Test
    void testStatementBindsOriginAndWidth() {
        TimeRange range = new TimeRange(Instant.parse("2024-03-15T10:00:00Z"), Instant.parse("2024-03-15T10:04:00Z"));
        HistogramSpec spec = HistogramSpec.equalWidth(range, 4);
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<Object[]> args = ArgumentCaptor.forClass(Object[].class);

        new HistogramAggregator(jdbcTemplate, "logs").histogram(SqlPredicate.matchAll(), range, spec);

        verify(jdbcTemplate).query(sql.capture(), any(RowCallbackHandler.class), args.capture());
        assertThat(sql.getValue()).isEqualTo(
            "SELECT floor((extract(epoch from tstamp) * 1000 - ?) / ?)::bigint AS bucket, count(*) AS events"
                + " FROM logs WHERE tstamp >= ? AND tstamp < ? AND (TRUE) GROUP BY bucket ORDER BY bucket");
        assertThat(args.getValue()).hasSize(4);
        assertThat(args.getValue()[0]).isEqualTo(range.getStart().toEpochMilli());
        assertThat(args.getValue()[1]).isEqualTo(60000L);
    }
}
