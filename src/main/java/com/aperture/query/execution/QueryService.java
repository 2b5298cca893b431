package com.aperture.query.execution;

import com.aperture.query.CompilationResult;
import com.aperture.query.ErrorKind;
import com.aperture.query.QueryCompilerProperties;
import com.aperture.query.QueryValidationException;
import com.aperture.query.TenantScope;
import com.aperture.query.builder.SelectQueryBuilder;
import com.aperture.query.builder.SelectQueryOptions;
import com.aperture.query.convert.ChartQuery;
import com.aperture.query.convert.SqlToChartQueryConverter;
import com.aperture.query.sql.SqlTranspiler;
import com.aperture.query.time.TimeRangeInput;
import com.aperture.security.TenantContext;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for dashboard queries. The tenant always comes from {@link TenantContext},
 * never from the request body.
 *
 * <p>Compilation of raw SQL is idempotent, so results are cached per (tenant, sql) in a bounded
 * Caffeine cache. Rejections are cached too.
 */
@Service
public class QueryService {

    private static final Logger logger = LoggerFactory.getLogger(QueryService.class);

    private final SqlTranspiler transpiler;
    private final SelectQueryBuilder builder;
    private final SqlToChartQueryConverter converter;
    private final QueryExecutor executor;
    private final QueryMetrics metrics;
    private final Cache<List<String>, CompilationResult> compileCache;

    public QueryService(SqlTranspiler transpiler,
                        SelectQueryBuilder builder,
                        SqlToChartQueryConverter converter,
                        QueryExecutor executor,
                        QueryMetrics metrics,
                        QueryCompilerProperties properties) {
        this.transpiler = transpiler;
        this.builder = builder;
        this.converter = converter;
        this.executor = executor;
        this.metrics = metrics;
        this.compileCache = Caffeine.newBuilder()
            .maximumSize(properties.getCompileCacheSize())
            .expireAfterWrite(properties.getCompileCacheTtlMinutes(), TimeUnit.MINUTES)
            .build();

        logger.info("QueryService initialized with compile cache (TTL={}min, maxSize={})",
            properties.getCompileCacheTtlMinutes(), properties.getCompileCacheSize());
    }

    /**
     * Validates and transpiles user SQL for the current tenant.
     *
     * @throws IllegalStateException if no tenant is set in the current context
     */
    public CompilationResult compileSql(String sql) {
        TenantScope tenant = currentTenant();
        List<String> key = Arrays.asList(tenant.getProjectId(), sql);
        CompilationResult cached = compileCache.getIfPresent(key);
        if (cached != null) {
            metrics.recordCacheHit();
            return cached;
        }
        metrics.recordCacheMiss();
        CompilationResult result = record(transpiler.validateAndTranspile(sql, tenant));
        compileCache.put(key, result);
        return result;
    }

    public QueryOutcome runSql(String sql) {
        return run(compileSql(sql));
    }

    public QueryOutcome runStructured(SelectQueryOptions options) {
        return run(record(builder.buildSelectQuery(options, currentTenant())));
    }

    /**
     * Re-runs a SQL-authored chart through the structured builder over {@code timeRange}.
     */
    public QueryOutcome runChart(String sql, TimeRangeInput timeRange) {
        ChartQuery chart;
        try {
            chart = converter.convert(sql);
        } catch (QueryValidationException e) {
            logger.warn("Chart conversion rejected: {} {}", e.getKind(), e.getMessage());
            return QueryOutcome.rejected(record(CompilationResult.rejected(e)));
        }
        return runStructured(chart.toSelectOptions(timeRange));
    }

    private QueryOutcome run(CompilationResult compilation) {
        if (!compilation.isValid()) {
            return QueryOutcome.rejected(compilation);
        }
        QueryResult result = executor.execute(compilation.getQuery(), currentTenant());
        return QueryOutcome.executed(compilation, result);
    }

    private CompilationResult record(CompilationResult result) {
        if (result.isValid()) {
            metrics.recordQueryCompiled();
        } else {
            ErrorKind kind = result.getRejection().getKind();
            metrics.recordQueryRejected(kind);
        }
        return result;
    }

    private static TenantScope currentTenant() {
        return TenantScope.of(TenantContext.requireProjectId());
    }
}
