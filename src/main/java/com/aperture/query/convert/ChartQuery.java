package com.aperture.query.convert;

import com.aperture.query.builder.Filter;
import com.aperture.query.builder.Metric;
import com.aperture.query.builder.OrderBy;
import com.aperture.query.builder.Pagination;
import com.aperture.query.builder.QueryColumn;
import com.aperture.query.builder.SelectQueryOptions;
import com.aperture.query.builder.TimeBucket;
import com.aperture.query.time.BucketInterval;
import com.aperture.query.time.TimeRangeInput;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Structured form of a simple aggregate chart query, as recovered from SQL by
 * {@link SqlToChartQueryConverter}.
 */
public class ChartQuery {

    private final String table;
    private final List<Metric> metrics;
    private final List<String> dimensions;
    private final List<Filter> filters;
    private final String bucketColumn;
    private final BucketInterval bucketInterval;
    private final List<OrderBy> orderBy;
    private final Long limit;

    public ChartQuery(String table, List<Metric> metrics, List<String> dimensions, List<Filter> filters,
                      String bucketColumn, BucketInterval bucketInterval, List<OrderBy> orderBy, Long limit) {
        this.table = table;
        this.metrics = Collections.unmodifiableList(new ArrayList<>(metrics));
        this.dimensions = Collections.unmodifiableList(new ArrayList<>(dimensions));
        this.filters = Collections.unmodifiableList(new ArrayList<>(filters));
        this.bucketColumn = bucketColumn;
        this.bucketInterval = bucketInterval;
        this.orderBy = Collections.unmodifiableList(new ArrayList<>(orderBy));
        this.limit = limit;
    }

    public String getTable() {
        return table;
    }

    public List<Metric> getMetrics() {
        return metrics;
    }

    public List<String> getDimensions() {
        return dimensions;
    }

    public List<Filter> getFilters() {
        return filters;
    }

    public String getBucketColumn() {
        return bucketColumn;
    }

    public BucketInterval getBucketInterval() {
        return bucketInterval;
    }

    public boolean isBucketed() {
        return bucketInterval != null;
    }

    public List<OrderBy> getOrderBy() {
        return orderBy;
    }

    public Long getLimit() {
        return limit;
    }

    /**
     * Options for {@link com.aperture.query.builder.SelectQueryBuilder} that rebuild this chart
     * over {@code timeRange}. Dimensions are selected and grouped; a bucketed chart fills gaps.
     */
    public SelectQueryOptions toSelectOptions(TimeRangeInput timeRange) {
        SelectQueryOptions.Builder builder = SelectQueryOptions.builder()
            .table(table)
            .timeRange(timeRange);
        List<QueryColumn> columns = new ArrayList<>();
        for (String dimension : dimensions) {
            columns.add(QueryColumn.column(dimension));
            builder.groupBy(dimension);
        }
        for (Metric metric : metrics) {
            columns.add(QueryColumn.metric(metric));
        }
        builder.columns(columns);
        builder.filters(filters);
        if (isBucketed()) {
            builder.timeColumn(bucketColumn).timeBucket(TimeBucket.filled(bucketInterval));
        }
        for (OrderBy order : orderBy) {
            builder.orderBy(order);
        }
        if (limit != null) {
            builder.pagination(Pagination.of(limit, 0));
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return "ChartQuery{table=" + table + ", metrics=" + metrics + ", dimensions=" + dimensions
            + ", filters=" + filters + ", bucket=" + bucketInterval + " on " + bucketColumn
            + ", orderBy=" + orderBy + ", limit=" + limit + "}";
    }
}
