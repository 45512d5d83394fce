package com.logstuff.search;

import com.logstuff.query.SqlPredicate;
import com.logstuff.storage.SqlStates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Exact event counts per time bucket. Buckets without events are reported with a count of 0.
 */
public class HistogramAggregator {
    private static final Logger logger = LoggerFactory.getLogger(HistogramAggregator.class);

    private final JdbcTemplate jdbcTemplate;
    private final String rootTable;

    public HistogramAggregator(JdbcTemplate jdbcTemplate, String rootTable) {
        this.jdbcTemplate = jdbcTemplate;
        this.rootTable = rootTable;
    }

    public List<HistogramBucket> histogram(SqlPredicate predicate, TimeRange range, HistogramSpec spec) {
        List<Object> args = new ArrayList<>();
        args.add(spec.getOrigin().toEpochMilli());
        args.add(spec.getWidth().toMillis());
        String sql = "SELECT floor((extract(epoch from tstamp) * 1000 - ?) / ?)::bigint AS bucket, count(*) AS events"
            + " FROM " + rootTable
            + " WHERE " + EventSearchExecutor.rangeCondition(range, args)
            + " AND (" + predicate.getSql() + ")"
            + " GROUP BY bucket ORDER BY bucket";
        args.addAll(Arrays.asList(predicate.toJdbcArguments()));
        logger.debug("Counting events: {} {}", sql, args);

        long[] counts = new long[spec.getBucketCount()];
        RowCallbackHandler tally = rs -> {
            long bucket = rs.getLong("bucket");
            if (bucket >= 0 && bucket < counts.length) {
                counts[(int) bucket] += rs.getLong("events");
            }
        };
        try {
            jdbcTemplate.query(sql, tally, args.toArray());
        } catch (DataAccessException e) {
            throw SqlStates.classify("Event histogram failed", e);
        }

        List<HistogramBucket> buckets = new ArrayList<>(counts.length);
        for (int i = 0; i < counts.length; i++) {
            buckets.add(new HistogramBucket(spec.bucketStart(i), counts[i]));
        }
        return buckets;
    }
}
