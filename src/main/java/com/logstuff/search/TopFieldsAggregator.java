package com.logstuff.search;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logstuff.query.SqlPredicate;
import com.logstuff.storage.SqlStates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Facet statistics: for the most recent matching events, how often each value of a
 * top-level document key occurs.
 *
 * <p>Array values count once per element. Strings are taken as they are, null as the empty
 * string and any other JSON value as its text. Percentages are relative to the number of
 * events actually sampled, which is below the sample size when fewer events match.
 */
public class TopFieldsAggregator {
    private static final Logger logger = LoggerFactory.getLogger(TopFieldsAggregator.class);

    private static final Comparator<Map.Entry<String, Long>> MOST_FREQUENT_FIRST =
        Map.Entry.<String, Long>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey());

    private final JdbcTemplate jdbcTemplate;
    private final String rootTable;
    private final ObjectMapper objectMapper;
    private final int sampleSize;
    private final int topN;
    private final List<String> keys;

    /**
     * @param keys top-level keys to report, or empty for every key found in the sample
     */
    public TopFieldsAggregator(JdbcTemplate jdbcTemplate, String rootTable, ObjectMapper objectMapper,
                               int sampleSize, int topN, List<String> keys) {
        if (sampleSize < 1 || topN < 1) {
            throw new IllegalArgumentException("Sample size and top N must be positive");
        }
        this.jdbcTemplate = jdbcTemplate;
        this.rootTable = rootTable;
        this.objectMapper = objectMapper;
        this.sampleSize = sampleSize;
        this.topN = topN;
        this.keys = List.copyOf(keys);
    }

    public TopFields topFields(SqlPredicate predicate, TimeRange range) {
        List<Object> args = new ArrayList<>();
        String sql = "SELECT doc FROM " + rootTable
            + " WHERE " + EventSearchExecutor.rangeCondition(range, args)
            + " AND (" + predicate.getSql() + ")"
            + " ORDER BY tstamp DESC, id DESC LIMIT ?";
        args.addAll(Arrays.asList(predicate.toJdbcArguments()));
        args.add(sampleSize);
        logger.debug("Sampling documents: {} {}", sql, args);

        List<String> docs;
        try {
            docs = jdbcTemplate.queryForList(sql, String.class, args.toArray());
        } catch (DataAccessException e) {
            throw SqlStates.classify("Top field sampling failed", e);
        }
        return tally(docs);
    }

    TopFields tally(List<String> docs) {
        Map<String, Map<String, Long>> counts = new HashMap<>();
        for (String doc : docs) {
            JsonNode node = parse(doc);
            if (keys.isEmpty()) {
                Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    count(counts, field.getKey(), field.getValue());
                }
            } else {
                for (String key : keys) {
                    if (node.has(key)) {
                        count(counts, key, node.get(key));
                    }
                }
            }
        }

        int sampled = docs.size();
        Map<String, List<FieldValueShare>> result = new TreeMap<>();
        counts.forEach((key, values) -> {
            List<FieldValueShare> top = new ArrayList<>(Math.min(topN, values.size()));
            values.entrySet().stream()
                .sorted(MOST_FREQUENT_FIRST)
                .limit(topN)
                .forEach(e -> top.add(new FieldValueShare(e.getKey(), e.getValue(), e.getValue() * 100.0 / sampled)));
            result.put(key, top);
        });
        return new TopFields(result, sampled);
    }

    private static void count(Map<String, Map<String, Long>> counts, String key, JsonNode value) {
        Map<String, Long> values = counts.computeIfAbsent(key, k -> new LinkedHashMap<>());
        if (value.isArray()) {
            for (JsonNode element : value) {
                values.merge(textOf(element), 1L, Long::sum);
            }
        } else {
            values.merge(textOf(value), 1L, Long::sum);
        }
    }

    static String textOf(JsonNode value) {
        if (value == null || value.isNull()) {
            return "";
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }

    private JsonNode parse(String doc) {
        try {
            return objectMapper.readTree(doc);
        } catch (JsonProcessingException e) {
            throw new DataRetrievalFailureException("Unreadable document in sample", e);
        }
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public int getTopN() {
        return topN;
    }
}
