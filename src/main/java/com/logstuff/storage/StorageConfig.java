package com.logstuff.storage;

import com.logstuff.config.LogstuffProperties;
import com.logstuff.query.PostgresTranspiler;
import com.logstuff.storage.partition.JdbcPartitionStore;
import com.logstuff.storage.partition.PartitionSpec;
import com.logstuff.storage.partition.PartitionSpecValidator;
import com.logstuff.storage.partition.PartitionStore;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Duration;

/**
 * Configuration for the PostgreSQL connection pool and the partition spec.
 */
@Configuration
public class StorageConfig {
    private static final Logger logger = LoggerFactory.getLogger(StorageConfig.class);

    @Value("${logstuff.storage.url:jdbc:postgresql://localhost:5432/logs}")
    private String url;

    @Value("${logstuff.storage.username:logs}")
    private String username;

    @Value("${logstuff.storage.password:}")
    private String password;

    @Value("${logstuff.storage.pool-size:10}")
    private int poolSize;

    @Value("${logstuff.storage.connection-timeout:10s}")
    private Duration connectionTimeout;

    @Value("${logstuff.storage.query-timeout:30s}")
    private Duration queryTimeout;

    @Value("${logstuff.storage.search-index:true}")
    private boolean searchIndex;

    /**
     * Create PostgreSQL DataSource with connection pooling
     */
    @Bean
    public DataSource dataSource() {
        HikariConfig config = new HikariConfig();
        config.setPoolName("logstuff");
        config.setJdbcUrl(url);
        config.setUsername(username);
        config.setPassword(password);
        config.setDriverClassName("org.postgresql.Driver");

        // Connection pool settings
        config.setMaximumPoolSize(poolSize);
        config.setMinimumIdle(Math.min(2, poolSize));
        config.setConnectionTimeout(connectionTimeout.toMillis());
        config.setIdleTimeout(600000);
        config.setMaxLifetime(1800000);

        config.addDataSourceProperty("ApplicationName", "logstuff");
        config.addDataSourceProperty("tcpKeepAlive", "true");

        HikariDataSource dataSource = new HikariDataSource(config);
        logger.info("PostgreSQL DataSource initialized: {} (pool size {})", url, poolSize);
        return dataSource;
    }

    /**
     * JdbcTemplate whose statements are bounded by the configured query timeout
     */
    @Bean
    public JdbcTemplate jdbcTemplate(DataSource dataSource) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.setQueryTimeout((int) Math.max(1, queryTimeout.toSeconds()));
        return jdbcTemplate;
    }

    @Bean
    public PlatformTransactionManager transactionManager(DataSource dataSource) {
        return new DataSourceTransactionManager(dataSource);
    }

    @Bean
    public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }

    @Bean
    public PartitionStore partitionStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
                                         PostgresTranspiler transpiler) {
        return new JdbcPartitionStore(jdbcTemplate, transactionTemplate,
            searchIndex ? transpiler.getSearchColumn() : null);
    }

    /**
     * Partition hierarchy from {@code logstuff.partitions}, validated before anything routes with it
     */
    @Bean
    public PartitionSpec partitionSpec(LogstuffProperties properties) {
        PartitionSpec spec = properties.toPartitionSpec();
        PartitionSpecValidator.validate(spec);
        return spec;
    }
}
