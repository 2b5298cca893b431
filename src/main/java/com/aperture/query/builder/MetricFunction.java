package com.aperture.query.builder;

import java.util.Locale;

public enum MetricFunction {
    COUNT,
    SUM,
    AVG,
    MIN,
    MAX,
    QUANTILE,
    RAW;

    public String sqlName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MetricFunction fromString(String value) {
        try {
            return MetricFunction.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown metric function: " + value, e);
        }
    }
}
