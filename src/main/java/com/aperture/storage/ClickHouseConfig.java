package com.aperture.storage;

import com.aperture.query.QueryCompilerProperties;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import javax.sql.DataSource;

/**
 * Read-only ClickHouse pool for compiled dashboard queries.
 *
 * <p>Sessions run with {@code readonly=2}: settings may be changed per query, writes and DDL
 * are refused by the server.
 */
@Configuration
public class ClickHouseConfig {
    private static final Logger logger = LoggerFactory.getLogger(ClickHouseConfig.class);

    static final String READONLY_SETTING = "2";

    @Value("${aperture.clickhouse.url:jdbc:clickhouse://localhost:8123/default}")
    private String url;

    @Value("${aperture.clickhouse.username:default}")
    private String username;

    @Value("${aperture.clickhouse.password:}")
    private String password;

    @Value("${aperture.clickhouse.pool.size:10}")
    private int poolSize;

    @Value("${aperture.clickhouse.pool.min-idle:2}")
    private int minIdle;

    @Value("${aperture.clickhouse.pool.connection-timeout-ms:30000}")
    private long connectionTimeoutMs;

    @Value("${aperture.clickhouse.max-execution-time-seconds:60}")
    private int maxExecutionTimeSeconds;

    @Bean(name = "clickHouseDataSource")
    public DataSource clickHouseDataSource() {
        HikariConfig config = new HikariConfig();
        config.setPoolName("clickhouse-query");
        config.setJdbcUrl(url);
        config.setUsername(username);
        config.setPassword(password);
        config.setDriverClassName("com.clickhouse.jdbc.ClickHouseDriver");
        config.setReadOnly(true);
        config.setMaximumPoolSize(poolSize);
        config.setMinimumIdle(Math.min(minIdle, poolSize));
        config.setConnectionTimeout(connectionTimeoutMs);
        // start even when ClickHouse is down; compilation does not need it
        config.setInitializationFailTimeout(-1);

        // server-side limits; the socket outlives max_execution_time so the server error wins
        config.addDataSourceProperty("readonly", READONLY_SETTING);
        config.addDataSourceProperty("max_execution_time", String.valueOf(maxExecutionTimeSeconds));
        config.addDataSourceProperty("socket_timeout", String.valueOf((maxExecutionTimeSeconds + 30) * 1000L));
        config.addDataSourceProperty("compress", "true");

        try {
            HikariDataSource dataSource = new HikariDataSource(config);
            logger.info("ClickHouse query pool '{}' initialized: {} (max {} connections, {}s execution limit)",
                config.getPoolName(), url, poolSize, maxExecutionTimeSeconds);
            return dataSource;
        } catch (RuntimeException e) {
            logger.error("Failed to initialize ClickHouse query pool for {}", url, e);
            throw new IllegalStateException("ClickHouse DataSource initialization failed", e);
        }
    }

    /**
     * Named-parameter template; compiled queries bind {@code :name} placeholders. The row cap
     * backs up the compiled LIMIT.
     */
    @Bean(name = "clickHouseJdbcTemplate")
    public NamedParameterJdbcTemplate clickHouseJdbcTemplate(@Qualifier("clickHouseDataSource") DataSource clickHouseDataSource,
                                                             QueryCompilerProperties properties) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(clickHouseDataSource);
        jdbcTemplate.setQueryTimeout(maxExecutionTimeSeconds);
        jdbcTemplate.setMaxRows((int) Math.min(Integer.MAX_VALUE, properties.getMaxLimit()));
        return new NamedParameterJdbcTemplate(jdbcTemplate);
    }
}
