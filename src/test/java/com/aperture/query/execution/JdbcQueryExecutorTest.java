package com.aperture.query.execution;

import com.aperture.query.CompiledQuery;
import com.aperture.query.QueryCompilerProperties;
import com.aperture.query.QueryParameter;
import com.aperture.query.TenantScope;
import com.aperture.schema.DbType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.sql.SQLException;
import java.sql.Types;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for JdbcQueryExecutor against a mocked ClickHouse template.
 */
@ExtendWith(MockitoExtension.class)
class JdbcQueryExecutorTest {

    private static final String SQL =
        "SELECT name FROM spans WHERE spans.project_id = :project_id AND (status = :p_0) LIMIT :limit";

    @Mock
    private NamedParameterJdbcTemplate clickHouseTemplate;

    private QueryMetrics metrics;
    private JdbcQueryExecutor executor;

    @BeforeEach
    void setUp() {
        metrics = new QueryMetrics();
        metrics.meterRegistry = new SimpleMeterRegistry();
        metrics.init();
        executor = new JdbcQueryExecutor(clickHouseTemplate, metrics, QueryCompilerProperties.defaults());
    }

    private static CompiledQuery query(String projectId) {
        Map<String, QueryParameter> parameters = new LinkedHashMap<>();
        parameters.put("project_id", QueryParameter.of(projectId, DbType.UUID));
        parameters.put("p_0", QueryParameter.of("error", DbType.STRING));
        parameters.put("limit", QueryParameter.of(100L, DbType.UINT32));
        return new CompiledQuery(SQL, parameters);
    }

    private static Map<String, Object> row(String name) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("name", name);
        return row;
    }

    @Test
    @DisplayName("Should bind typed parameters and return rows")
    void shouldExecuteWithTypedParameters() {
        // Given
        when(clickHouseTemplate.queryForList(eq(SQL), any(SqlParameterSource.class)))
            .thenReturn(List.of(row("llm.call"), row("tool.call")));

        // When
        QueryResult result = executor.execute(query("tenant-a"), TenantScope.of("tenant-a"));

        // Then
        assertThat(result.getRowCount()).isEqualTo(2);
        assertThat(result.getColumns()).containsExactly("name");

        ArgumentCaptor<SqlParameterSource> captor = ArgumentCaptor.forClass(SqlParameterSource.class);
        verify(clickHouseTemplate).queryForList(eq(SQL), captor.capture());
        MapSqlParameterSource bound = (MapSqlParameterSource) captor.getValue();
        assertThat(bound.getValue("project_id")).isEqualTo("tenant-a");
        assertThat(bound.getSqlType("project_id")).isEqualTo(Types.VARCHAR);
        assertThat(bound.getValue("limit")).isEqualTo(100L);
        assertThat(bound.getSqlType("limit")).isEqualTo(Types.BIGINT);

        assertThat(metrics.getQueriesExecuted().count()).isEqualTo(1.0);
        assertThat(metrics.getResultSize().totalAmount()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should refuse queries compiled for another tenant")
    void shouldRefuseForeignTenant() {
        assertThatThrownBy(() -> executor.execute(query("tenant-a"), TenantScope.of("tenant-b")))
            .isInstanceOf(QueryExecutionException.class)
            .hasMessageContaining("not scoped to the current tenant");

        verify(clickHouseTemplate, never()).queryForList(anyString(), any(SqlParameterSource.class));
        assertThat(metrics.getQueriesFailed().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should refuse queries without a tenant parameter")
    void shouldRefuseUnscopedQuery() {
        CompiledQuery unscoped = new CompiledQuery("SELECT 1", Map.of());

        assertThatThrownBy(() -> executor.execute(unscoped, TenantScope.of("tenant-a")))
            .isInstanceOf(QueryExecutionException.class);
    }

    @Test
    @DisplayName("Should wrap database errors with the failing query")
    void shouldWrapDataAccessErrors() {
        // Given
        when(clickHouseTemplate.queryForList(eq(SQL), any(SqlParameterSource.class)))
            .thenThrow(new BadSqlGrammarException("query", SQL, new SQLException("Code: 62. Syntax error")));

        // When / Then
        assertThatThrownBy(() -> executor.execute(query("tenant-a"), TenantScope.of("tenant-a")))
            .isInstanceOf(QueryExecutionException.class)
            .hasMessageContaining("ClickHouse query execution failed")
            .hasMessageContaining("[Query: " + SQL + "]")
            .hasCauseInstanceOf(BadSqlGrammarException.class);
        assertThat(metrics.getQueriesFailed().count()).isEqualTo(1.0);
        assertThat(metrics.getQueriesExecuted().count()).isEqualTo(0.0);
    }
}
