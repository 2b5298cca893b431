package com.aperture.query;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Limits and knobs shared by both compilation paths.
 */
public class QueryCompilerProperties {

    public static final long DEFAULT_MAX_LIMIT = 10_000L;
    public static final long DEFAULT_LOOKBACK_HOURS = 24L;
    public static final String DEFAULT_TENANT_PARAMETER = "project_id";

    private final long maxLimit;
    private final long defaultLookbackHours;
    private final String tenantParameter;
    private final Set<String> extraAllowedFunctions;
    private final long compileCacheSize;
    private final long compileCacheTtlMinutes;

    public QueryCompilerProperties(long maxLimit, long defaultLookbackHours, String tenantParameter,
                                   Set<String> extraAllowedFunctions, long compileCacheSize,
                                   long compileCacheTtlMinutes) {
        if (maxLimit <= 0) {
            throw new IllegalArgumentException("maxLimit must be positive: " + maxLimit);
        }
        if (defaultLookbackHours <= 0) {
            throw new IllegalArgumentException("defaultLookbackHours must be positive: " + defaultLookbackHours);
        }
        this.maxLimit = maxLimit;
        this.defaultLookbackHours = defaultLookbackHours;
        this.tenantParameter = tenantParameter;
        Set<String> functions = new LinkedHashSet<>();
        for (String function : extraAllowedFunctions) {
            if (!function.isBlank()) {
                functions.add(function.trim().toLowerCase(Locale.ROOT));
            }
        }
        this.extraAllowedFunctions = Collections.unmodifiableSet(functions);
        this.compileCacheSize = compileCacheSize;
        this.compileCacheTtlMinutes = compileCacheTtlMinutes;
    }

    public static QueryCompilerProperties defaults() {
        return new QueryCompilerProperties(DEFAULT_MAX_LIMIT, DEFAULT_LOOKBACK_HOURS, DEFAULT_TENANT_PARAMETER,
            Collections.emptySet(), 1000, 10);
    }

    public long getMaxLimit() {
        return maxLimit;
    }

    public long getDefaultLookbackHours() {
        return defaultLookbackHours;
    }

    public String getTenantParameter() {
        return tenantParameter;
    }

    public Set<String> getExtraAllowedFunctions() {
        return extraAllowedFunctions;
    }

    public long getCompileCacheSize() {
        return compileCacheSize;
    }

    public long getCompileCacheTtlMinutes() {
        return compileCacheTtlMinutes;
    }
}
