package com.aperture.query.builder;

import java.util.Objects;

/**
 * One entry of a structured SELECT list: a bare column or a {@link Metric}.
 */
public final class QueryColumn {

    private final String column;
    private final Metric metric;

    private QueryColumn(String column, Metric metric) {
        this.column = column;
        this.metric = metric;
    }

    public static QueryColumn column(String name) {
        return new QueryColumn(Objects.requireNonNull(name, "name"), null);
    }

    public static QueryColumn metric(Metric metric) {
        return new QueryColumn(null, Objects.requireNonNull(metric, "metric"));
    }

    public boolean isMetric() {
        return metric != null;
    }

    public String getColumn() {
        return column;
    }

    public Metric getMetric() {
        return metric;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QueryColumn that = (QueryColumn) o;
        return Objects.equals(column, that.column) && Objects.equals(metric, that.metric);
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, metric);
    }

    @Override
    public String toString() {
        return isMetric() ? metric.toString() : column;
    }
}
