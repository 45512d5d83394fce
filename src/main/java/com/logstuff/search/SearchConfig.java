package com.logstuff.search;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logstuff.LogstuffApplication;
import com.logstuff.metrics.SearchMetrics;
import com.logstuff.query.LqlCompiler;
import com.logstuff.storage.partition.PartitionSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Read path beans. Search statements run on their own {@link JdbcTemplate} so that they get the
 * search timeout rather than the storage one.
 */
@Configuration
@Profile("!" + LogstuffApplication.MODE_INGEST)
public class SearchConfig {
    private static final Logger logger = LoggerFactory.getLogger(SearchConfig.class);

    @Value("${logstuff.search.query-timeout:30s}")
    private Duration queryTimeout;

    @Value("${logstuff.search.request-timeout:35s}")
    private Duration requestTimeout;

    @Value("${logstuff.search.top-fields.sample-size:500}")
    private int sampleSize;

    @Value("${logstuff.search.top-fields.top-n:5}")
    private int topN;

    @Value("${logstuff.search.top-fields.keys:}")
    private String topFieldKeys;

    @Bean
    public EventSearchService eventSearchService(DataSource dataSource,
                                                 PartitionSpec partitionSpec,
                                                 ObjectMapper objectMapper,
                                                 LqlCompiler compiler,
                                                 SearchMetrics metrics) {
        JdbcTemplate searchTemplate = new JdbcTemplate(dataSource);
        searchTemplate.setQueryTimeout((int) Math.max(1, queryTimeout.toSeconds()));
        String root = partitionSpec.getRoot().getTable();

        logger.info("Searching {} (statement timeout {}s, request timeout {}s, top {} of {} sampled)",
            root, queryTimeout.toSeconds(), requestTimeout.toSeconds(), topN, sampleSize);
        return new EventSearchService(
            compiler,
            new EventSearchExecutor(searchTemplate, root, objectMapper),
            new HistogramAggregator(searchTemplate, root),
            new TopFieldsAggregator(searchTemplate, root, objectMapper, sampleSize, topN,
                parseKeys(topFieldKeys)),
            metrics,
            requestTimeout);
    }

    static List<String> parseKeys(String keys) {
        return Arrays.stream(keys.split(","))
            .map(String::trim)
            .filter(key -> !key.isEmpty())
            .collect(Collectors.toList());
    }
}
