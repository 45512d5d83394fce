package com.logstuff.search;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.logstuff.query.SqlPredicate;
import com.logstuff.storage.LogEvent;
import com.logstuff.storage.SqlStates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Runs filtered event searches against the partitioned root table.
 *
 * <p>Every statement is bounded by the request's time range so that the planner prunes
 * partitions outside it. Pages are fetched by keyset on {@code (tstamp, id)}; one extra row is
 * read to tell whether another page follows.
 *
 * <p>{@link #follow} serves tailing clients, which poll for events stored after the last id
 * they have seen.
 */
public class EventSearchExecutor {
    private static final Logger logger = LoggerFactory.getLogger(EventSearchExecutor.class);

    private final JdbcTemplate jdbcTemplate;
    private final String rootTable;
    private final ObjectMapper objectMapper;
    private final RowMapper<LogEvent> eventMapper = this::mapEvent;

    public EventSearchExecutor(JdbcTemplate jdbcTemplate, String rootTable, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.rootTable = rootTable;
        this.objectMapper = objectMapper;
    }

    /**
     * Page of events and the total estimate, one statement after the other.
     */
    public EventPage search(SqlPredicate predicate, TimeRange range, PageRequest page) {
        return fetch(predicate, range, page).withTotalEstimate(estimate(predicate, range));
    }

    /**
     * Page of events without the estimate.
     *
     * @throws com.logstuff.storage.StoreException if the database fails
     */
    public EventPage fetch(SqlPredicate predicate, TimeRange range, PageRequest page) {
        List<Object> args = new ArrayList<>();
        String sql = selectSql(predicate, range, page, args);
        logger.debug("Searching events: {} {}", sql, args);

        List<LogEvent> rows;
        try {
            rows = jdbcTemplate.query(sql, eventMapper, args.toArray());
        } catch (DataAccessException e) {
            throw SqlStates.classify("Event search failed", e);
        }

        SearchCursor next = null;
        if (rows.size() > page.getLimit()) {
            rows = rows.subList(0, page.getLimit());
            LogEvent last = rows.get(rows.size() - 1);
            next = new SearchCursor(last.getId(), last.getTimestamp());
        }
        return new EventPage(rows, EventPage.UNKNOWN_ESTIMATE, next);
    }

    String selectSql(SqlPredicate predicate, TimeRange range, PageRequest page, List<Object> args) {
        SortOrder order = page.getOrder();
        StringBuilder sql = new StringBuilder()
            .append("SELECT id, tstamp, doc FROM ").append(rootTable)
            .append(" WHERE ").append(rangeCondition(range, args));
        if (page.getCursor() != null) {
            sql.append(" AND (tstamp, id) ").append(order.getKeysetComparison()).append(" (?, ?)");
            args.add(utc(page.getCursor().getLastTimestamp()));
            args.add(page.getCursor().getLastId());
        }
        sql.append(" AND (").append(predicate.getSql()).append(")");
        args.addAll(Arrays.asList(predicate.toJdbcArguments()));
        sql.append(" ORDER BY tstamp ").append(order.getSql()).append(", id ").append(order.getSql())
            .append(" LIMIT ?");
        args.add(page.getLimit() + 1);
        return sql.toString();
    }

    /**
     * The most recent {@code limit} matches with an id above {@code afterId} and a timestamp after
     * {@code notBefore}, oldest first.
     *
     * @throws com.logstuff.storage.StoreException if the database fails
     */
    public List<LogEvent> follow(SqlPredicate predicate, long afterId, Instant notBefore, int limit) {
        List<Object> args = new ArrayList<>();
        String sql = followSql(predicate, afterId, notBefore, limit, args);
        logger.debug("Following events: {} {}", sql, args);

        List<LogEvent> rows;
        try {
            rows = new ArrayList<>(jdbcTemplate.query(sql, eventMapper, args.toArray()));
        } catch (DataAccessException e) {
            throw SqlStates.classify("Event follow query failed", e);
        }
        Collections.reverse(rows);
        return rows;
    }

    String followSql(SqlPredicate predicate, long afterId, Instant notBefore, int limit, List<Object> args) {
        args.add(utc(notBefore));
        args.add(afterId);
        args.addAll(Arrays.asList(predicate.toJdbcArguments()));
        args.add(limit);
        return "SELECT id, tstamp, doc FROM " + rootTable
            + " WHERE tstamp > ? AND id > ?"
            + " AND (" + predicate.getSql() + ")"
            + " ORDER BY id DESC LIMIT ?";
    }

    /**
     * Planner row estimate for all matches in the range, from {@code EXPLAIN (FORMAT JSON)}.
     * Cheap on large tables; never an exact count.
     */
    public long estimate(SqlPredicate predicate, TimeRange range) {
        List<Object> args = new ArrayList<>();
        String sql = "EXPLAIN (FORMAT JSON) SELECT id FROM " + rootTable
            + " WHERE " + rangeCondition(range, args)
            + " AND (" + predicate.getSql() + ")";
        args.addAll(Arrays.asList(predicate.toJdbcArguments()));

        try {
            return planRows(jdbcTemplate.queryForObject(sql, String.class, args.toArray()));
        } catch (DataAccessException e) {
            throw SqlStates.classify("Event count estimate failed", e);
        }
    }

    long planRows(String plan) {
        if (plan == null) {
            throw new DataRetrievalFailureException("EXPLAIN returned no plan");
        }
        try {
            JsonNode rows = objectMapper.readTree(plan).path(0).path("Plan").path("Plan Rows");
            if (!rows.isNumber()) {
                throw new DataRetrievalFailureException("No row estimate in plan: " + plan);
            }
            return Math.max(0, rows.asLong());
        } catch (JsonProcessingException e) {
            throw new DataRetrievalFailureException("Unreadable plan: " + e.getOriginalMessage(), e);
        }
    }

    static String rangeCondition(TimeRange range, List<Object> args) {
        args.add(utc(range.getStart()));
        args.add(utc(range.getEnd()));
        return "tstamp >= ? AND tstamp < ?";
    }

    static OffsetDateTime utc(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private LogEvent mapEvent(ResultSet rs, int rowNum) throws SQLException {
        long id = rs.getLong("id");
        OffsetDateTime tstamp = rs.getObject("tstamp", OffsetDateTime.class);
        String doc = rs.getString("doc");
        try {
            JsonNode node = objectMapper.readTree(doc);
            if (!(node instanceof ObjectNode)) {
                throw new DataRetrievalFailureException("Document of event " + id + " is not an object");
            }
            return new LogEvent(id, tstamp.toInstant(), (ObjectNode) node, null);
        } catch (JsonProcessingException e) {
            throw new DataRetrievalFailureException("Unreadable document of event " + id, e);
        }
    }

    public String getRootTable() {
        return rootTable;
    }
}
