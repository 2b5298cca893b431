package com.aperture.query;

import com.aperture.schema.SchemaRegistry;
import com.aperture.schema.StaticSchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Wires the compiler limits, the schema registry and the clock used for relative time ranges.
 */
@Configuration
public class QueryCompilerConfig {
    private static final Logger logger = LoggerFactory.getLogger(QueryCompilerConfig.class);

    @Value("${aperture.query.max-limit:10000}")
    private long maxLimit;

    @Value("${aperture.query.default-lookback-hours:24}")
    private long defaultLookbackHours;

    @Value("${aperture.query.tenant-parameter:project_id}")
    private String tenantParameter;

    @Value("${aperture.query.extra-allowed-functions:}")
    private String extraAllowedFunctions;

    @Value("${aperture.query.compile-cache.size:1000}")
    private long compileCacheSize;

    @Value("${aperture.query.compile-cache.ttl-minutes:10}")
    private long compileCacheTtlMinutes;

    @Bean
    public QueryCompilerProperties queryCompilerProperties() {
        Set<String> extras = new LinkedHashSet<>();
        if (extraAllowedFunctions != null && !extraAllowedFunctions.isBlank()) {
            extras.addAll(Arrays.asList(extraAllowedFunctions.split(",")));
        }
        QueryCompilerProperties properties = new QueryCompilerProperties(maxLimit, defaultLookbackHours,
            tenantParameter, extras, compileCacheSize, compileCacheTtlMinutes);
        logger.info("Query compiler configured: maxLimit={}, defaultLookbackHours={}, extraFunctions={}",
            properties.getMaxLimit(), properties.getDefaultLookbackHours(), properties.getExtraAllowedFunctions());
        return properties;
    }

    @Bean
    public SchemaRegistry schemaRegistry() {
        StaticSchemaRegistry registry = StaticSchemaRegistry.defaultRegistry();
        logger.info("Schema registry loaded with tables {}", registry.tableNames());
        return registry;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
