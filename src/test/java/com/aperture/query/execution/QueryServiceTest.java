package com.aperture.query.execution;

import com.aperture.query.CompilationResult;
import com.aperture.query.CompiledQuery;
import com.aperture.query.ErrorKind;
import com.aperture.query.QueryCompilerProperties;
import com.aperture.query.TenantScope;
import com.aperture.query.builder.Filter;
import com.aperture.query.builder.Metric;
import com.aperture.query.builder.SelectQueryBuilder;
import com.aperture.query.builder.SelectQueryOptions;
import com.aperture.query.convert.SqlToChartQueryConverter;
import com.aperture.query.sql.SqlFragmentValidator;
import com.aperture.query.sql.SqlTranspiler;
import com.aperture.query.time.TimeRangeInput;
import com.aperture.query.time.TimeRangeResolver;
import com.aperture.schema.StaticSchemaRegistry;
import com.aperture.security.TenantContext;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("QueryService")
class QueryServiceTest {

    private static final String TENANT_A = "tenant-a";
    private static final String TENANT_B = "tenant-b";

    @Mock
    private QueryExecutor executor;

    private QueryMetrics metrics;
    private QueryService service;

    @BeforeEach
    void setUp() {
        QueryCompilerProperties properties = QueryCompilerProperties.defaults();
        StaticSchemaRegistry registry = StaticSchemaRegistry.defaultRegistry();
        metrics = new QueryMetrics();
        metrics.meterRegistry = new SimpleMeterRegistry();
        metrics.init();
        service = new QueryService(
            new SqlTranspiler(registry, properties),
            new SelectQueryBuilder(registry,
                new TimeRangeResolver(Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC)),
                new SqlFragmentValidator(properties), properties),
            new SqlToChartQueryConverter(),
            executor,
            metrics,
            properties);
        TenantContext.setProjectId(TENANT_A);
    }

    @AfterEach
    void tearDown() {
        TenantContext.clear();
    }

    @Test
    @DisplayName("should execute compiled SQL for the current tenant")
    void shouldRunSql() {
        // Given
        QueryResult rows = new QueryResult(List.of(Map.of("name", "llm.call")), 3);
        when(executor.execute(any(CompiledQuery.class), eq(TenantScope.of(TENANT_A)))).thenReturn(rows);

        // When
        QueryOutcome outcome = service.runSql("SELECT name FROM spans WHERE status = 'error'");

        // Then
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getResult()).isSameAs(rows);
        assertThat(outcome.getCompilation().getQuery().getSql()).contains("spans.project_id = :project_id");
        assertThat(metrics.getQueriesCompiled().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should not execute rejected SQL")
    void shouldNotExecuteRejectedSql() {
        QueryOutcome outcome = service.runSql("DELETE FROM spans");

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getRejection()).isNotNull();
        verify(executor, never()).execute(any(), any());
        assertThat(metrics.getQueriesRejected(outcome.getRejection().getKind()).count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should serve repeated compilations from the cache")
    void shouldCacheCompilations() {
        CompilationResult first = service.compileSql("SELECT name FROM spans");
        CompilationResult second = service.compileSql("SELECT name FROM spans");

        assertThat(second).isSameAs(first);
        assertThat(metrics.getCacheMisses().count()).isEqualTo(1.0);
        assertThat(metrics.getCacheHits().count()).isEqualTo(1.0);
        assertThat(metrics.getQueriesCompiled().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should run structured queries")
    void shouldRunStructured() {
        when(executor.execute(any(CompiledQuery.class), any(TenantScope.class)))
            .thenReturn(new QueryResult(List.of(), 1));

        QueryOutcome outcome = service.runStructured(SelectQueryOptions.builder()
            .table("spans")
            .metric(Metric.count("total"))
            .filter(Filter.of("status", "eq", "error"))
            .build());

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getCompilation().getQuery().getSql()).startsWith("SELECT count(*) AS total FROM spans");
    }

    @Test
    @DisplayName("should report chart conversion failures as rejections")
    void shouldRejectUnconvertibleChart() {
        QueryOutcome outcome = service.runChart("SELECT * FROM spans", TimeRangeInput.pastHours(24));

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getRejection().getKind()).isEqualTo(ErrorKind.INVALID_QUERY);
        verify(executor, never()).execute(any(), any());
    }

    @Test
    @DisplayName("should require a tenant in the current context")
    void shouldRequireTenant() {
        TenantContext.clear();

        assertThatThrownBy(() -> service.compileSql("SELECT name FROM spans"))
            .isInstanceOf(IllegalStateException.class);
    }

    @Nested
    @DisplayName("tenant isolation")
    class TenantIsolation {

        @Test
        @DisplayName("should bind each tenant's own project id and never share cache entries")
        void shouldIsolateTenants() {
            // Given
            when(executor.execute(any(CompiledQuery.class), any(TenantScope.class)))
                .thenReturn(new QueryResult(List.of(), 1));

            // When
            service.runSql("SELECT name FROM spans");
            TenantContext.setProjectId(TENANT_B);
            service.runSql("SELECT name FROM spans");

            // Then
            ArgumentCaptor<CompiledQuery> queries = ArgumentCaptor.forClass(CompiledQuery.class);
            ArgumentCaptor<TenantScope> tenants = ArgumentCaptor.forClass(TenantScope.class);
            verify(executor, times(2)).execute(queries.capture(), tenants.capture());

            assertThat(queries.getAllValues().get(0).getParameter("project_id").getValue()).isEqualTo(TENANT_A);
            assertThat(queries.getAllValues().get(1).getParameter("project_id").getValue()).isEqualTo(TENANT_B);
            assertThat(tenants.getAllValues()).containsExactly(TenantScope.of(TENANT_A), TenantScope.of(TENANT_B));
            assertThat(metrics.getCacheHits().count()).isEqualTo(0.0);
        }

        @Test
        @DisplayName("should scope every table of a join to the current tenant")
        void shouldScopeJoinedTables() {
            CompilationResult result = service.compileSql(
                "SELECT s.name, e.name AS event_name FROM spans s JOIN events e ON s.span_id = e.span_id");

            assertThat(result.isValid()).isTrue();
            assertThat(result.getQuery().getSql())
                .contains("s.project_id = :project_id")
                .contains("e.project_id = :project_id");
            assertThat(result.getQuery().getParameter("project_id").getValue()).isEqualTo(TENANT_A);
        }
    }
}
