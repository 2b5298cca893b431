package com.aperture.query.execution;

import com.aperture.query.CompiledQuery;
import com.aperture.query.QueryCompilerProperties;
import com.aperture.query.QueryParameter;
import com.aperture.query.TenantScope;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * {@link QueryExecutor} for ClickHouse over the pooled read-only JDBC connection.
 *
 * <p>Every parameter is bound with the JDBC type of its {@link com.aperture.schema.DbType}.
 * A query whose tenant parameter does not match the caller's scope is refused before it
 * reaches the database.
 */
@Service
public class JdbcQueryExecutor implements QueryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(JdbcQueryExecutor.class);

    private final NamedParameterJdbcTemplate clickHouseTemplate;
    private final QueryMetrics metrics;
    private final String tenantParameter;

    public JdbcQueryExecutor(@Qualifier("clickHouseJdbcTemplate") NamedParameterJdbcTemplate clickHouseTemplate,
                             QueryMetrics metrics,
                             QueryCompilerProperties properties) {
        this.clickHouseTemplate = clickHouseTemplate;
        this.metrics = metrics;
        this.tenantParameter = properties.getTenantParameter();
    }

    @Override
    public QueryResult execute(CompiledQuery query, TenantScope tenant) {
        verifyTenant(query, tenant);

        MapSqlParameterSource parameters = new MapSqlParameterSource();
        for (Map.Entry<String, QueryParameter> entry : query.getParameters().entrySet()) {
            QueryParameter parameter = entry.getValue();
            parameters.addValue(entry.getKey(), parameter.getValue(), parameter.getType().getSqlType());
        }

        logger.debug("Executing query for tenant {}: {}", tenant.getProjectId(), query.getSql());
        long startTime = System.currentTimeMillis();
        Timer.Sample sample = metrics.startQueryTimer();
        try {
            List<Map<String, Object>> rows = clickHouseTemplate.queryForList(query.getSql(), parameters);
            long executionTime = System.currentTimeMillis() - startTime;
            metrics.recordQueryLatency(sample);
            metrics.recordQueryExecuted();
            metrics.recordResultSize(rows.size());
            logger.info("Query for tenant {} returned {} rows in {}ms", tenant.getProjectId(), rows.size(), executionTime);
            return new QueryResult(rows, executionTime);
        } catch (DataAccessException e) {
            metrics.recordQueryFailed();
            logger.error("ClickHouse query execution failed: {}", e.getMessage(), e);
            throw new QueryExecutionException("ClickHouse query execution failed", query.getSql(), e);
        }
    }

    private void verifyTenant(CompiledQuery query, TenantScope tenant) {
        QueryParameter scope = query.getParameter(tenantParameter);
        if (scope == null || !tenant.getProjectId().equals(scope.getValue())) {
            metrics.recordQueryFailed();
            logger.error("Refusing query not scoped to tenant {}", tenant.getProjectId());
            throw new QueryExecutionException("Query is not scoped to the current tenant");
        }
    }
}
