package com.aperture.query.execution;

import com.aperture.query.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Metrics collector for query compilation and execution.
 * Tracks compiled and rejected queries (tagged by rejection kind), execution outcome and
 * latency, result sizes and compile cache hit rates.
 */
@Component
public class QueryMetrics {

    static final String REJECTED = "aperture.query.rejected";

    @Autowired
    MeterRegistry meterRegistry;

    private Counter queriesCompiled;
    private Counter queriesExecuted;
    private Counter queriesFailed;
    private Timer queryExecutionLatency;
    private DistributionSummary resultSize;
    private Counter cacheHits;
    private Counter cacheMisses;

    @PostConstruct
    public void init() {
        queriesCompiled = Counter.builder("aperture.query.compiled")
            .description("Total number of queries that compiled successfully")
            .register(meterRegistry);

        queriesExecuted = Counter.builder("aperture.query.executed")
            .description("Total number of queries executed")
            .register(meterRegistry);

        queriesFailed = Counter.builder("aperture.query.failed")
            .description("Total number of query executions that failed")
            .register(meterRegistry);

        queryExecutionLatency = Timer.builder("aperture.query.execution.latency")
            .description("Latency of query execution against ClickHouse")
            .publishPercentiles(0.5, 0.95, 0.99)
            .publishPercentileHistogram()
            .minimumExpectedValue(Duration.ofMillis(10))
            .maximumExpectedValue(Duration.ofSeconds(30))
            .register(meterRegistry);

        resultSize = DistributionSummary.builder("aperture.query.result.size")
            .description("Distribution of query result sizes (number of rows)")
            .baseUnit("rows")
            .publishPercentiles(0.5, 0.95, 0.99)
            .publishPercentileHistogram()
            .minimumExpectedValue(1.0)
            .maximumExpectedValue(100000.0)
            .register(meterRegistry);

        cacheHits = Counter.builder("aperture.query.cache.hits")
            .description("Total number of compile cache hits")
            .register(meterRegistry);

        cacheMisses = Counter.builder("aperture.query.cache.misses")
            .description("Total number of compile cache misses")
            .register(meterRegistry);
    }

    public void recordQueryCompiled() {
        queriesCompiled.increment();
    }

    public void recordQueryRejected(ErrorKind kind) {
        rejectedCounter(kind).increment();
    }

    public void recordQueryExecuted() {
        queriesExecuted.increment();
    }

    public void recordQueryFailed() {
        queriesFailed.increment();
    }

    public Timer.Sample startQueryTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordQueryLatency(Timer.Sample sample) {
        sample.stop(queryExecutionLatency);
    }

    public void recordResultSize(long size) {
        resultSize.record(size);
    }

    public void recordCacheHit() {
        cacheHits.increment();
    }

    public void recordCacheMiss() {
        cacheMisses.increment();
    }

    /**
     * Calculate cache hit rate as a percentage
     * @return cache hit rate (0-100) or 0 if no cache operations
     */
    public double getCacheHitRate() {
        double hits = cacheHits.count();
        double total = hits + cacheMisses.count();
        if (total == 0) {
            return 0.0;
        }
        return (hits / total) * 100.0;
    }

    // Getter methods for testing
    public Counter getQueriesCompiled() {
        return queriesCompiled;
    }

    public Counter getQueriesRejected(ErrorKind kind) {
        return rejectedCounter(kind);
    }

    public Counter getQueriesExecuted() {
        return queriesExecuted;
    }

    public Counter getQueriesFailed() {
        return queriesFailed;
    }

    public Timer getQueryExecutionLatency() {
        return queryExecutionLatency;
    }

    public DistributionSummary getResultSize() {
        return resultSize;
    }

    public Counter getCacheHits() {
        return cacheHits;
    }

    public Counter getCacheMisses() {
        return cacheMisses;
    }

    private Counter rejectedCounter(ErrorKind kind) {
        return Counter.builder(REJECTED)
            .description("Total number of queries rejected during compilation")
            .tag("kind", kind.name().toLowerCase(Locale.ROOT))
            .register(meterRegistry);
    }
}
