package com.aperture.query.builder;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An aggregate (or raw expression) in a chart query.
 *
 * <p>{@code args} carries function parameters, e.g. the level of a quantile. A raw metric has
 * no column; its {@code rawSql} is validated as an expression over the query's table.
 */
public class Metric {

    private final MetricFunction function;
    private final String column;
    private final List<Object> args;
    private final String alias;
    private final String rawSql;

    public Metric(MetricFunction function, String column, List<Object> args, String alias, String rawSql) {
        this.function = Objects.requireNonNull(function, "function");
        this.column = column;
        this.args = args != null ? List.copyOf(args) : Collections.emptyList();
        this.alias = alias;
        this.rawSql = rawSql;
    }

    public static Metric count(String alias) {
        return new Metric(MetricFunction.COUNT, null, null, alias, null);
    }

    public static Metric of(MetricFunction function, String column, String alias) {
        return new Metric(function, column, null, alias, null);
    }

    public static Metric quantile(String column, double level, String alias) {
        return new Metric(MetricFunction.QUANTILE, column, List.of(level), alias, null);
    }

    public static Metric raw(String sql, String alias) {
        return new Metric(MetricFunction.RAW, null, null, alias, sql);
    }

    public MetricFunction getFunction() {
        return function;
    }

    public String getColumn() {
        return column;
    }

    public List<Object> getArgs() {
        return args;
    }

    public String getAlias() {
        return alias;
    }

    public String getRawSql() {
        return rawSql;
    }

    /**
     * Alias used when none was given, e.g. {@code avg_duration} or {@code count}.
     */
    public String defaultAlias() {
        if (column == null || "*".equals(column)) {
            return function.sqlName();
        }
        return function.sqlName() + "_" + column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Metric metric = (Metric) o;
        return function == metric.function
            && Objects.equals(column, metric.column)
            && args.equals(metric.args)
            && Objects.equals(alias, metric.alias)
            && Objects.equals(rawSql, metric.rawSql);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, column, args, alias, rawSql);
    }

    @Override
    public String toString() {
        return function == MetricFunction.RAW
            ? "raw(" + rawSql + ") AS " + alias
            : function.sqlName() + "(" + (column != null ? column : "*") + ") AS " + alias;
    }
}
