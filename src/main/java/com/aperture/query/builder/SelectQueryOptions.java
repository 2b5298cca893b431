package com.aperture.query.builder;

import com.aperture.query.SqlCondition;
import com.aperture.query.time.TimeRangeInput;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Everything the structured path needs to build one SELECT. Built with {@link #builder()}.
 */
public class SelectQueryOptions {

    private final String table;
    private final List<QueryColumn> columns;
    private final List<SqlCondition> customConditions;
    private final TimeRangeInput timeRange;
    private final String timeColumn;
    private final List<Filter> filters;
    private final ColumnFilterConfig columnFilterConfig;
    private final List<OrderBy> orderBy;
    private final Pagination pagination;
    private final List<String> groupBy;
    private final TimeBucket timeBucket;
    private final SideAggregation sideAggregation;

    private SelectQueryOptions(Builder builder) {
        this.table = Objects.requireNonNull(builder.table, "table");
        this.columns = Collections.unmodifiableList(new ArrayList<>(builder.columns));
        this.customConditions = Collections.unmodifiableList(new ArrayList<>(builder.customConditions));
        this.timeRange = builder.timeRange;
        this.timeColumn = builder.timeColumn;
        this.filters = Collections.unmodifiableList(new ArrayList<>(builder.filters));
        this.columnFilterConfig = builder.columnFilterConfig != null ? builder.columnFilterConfig : ColumnFilterConfig.defaults();
        this.orderBy = Collections.unmodifiableList(new ArrayList<>(builder.orderBy));
        this.pagination = builder.pagination;
        this.groupBy = Collections.unmodifiableList(new ArrayList<>(builder.groupBy));
        this.timeBucket = builder.timeBucket;
        this.sideAggregation = builder.sideAggregation;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getTable() {
        return table;
    }

    public List<QueryColumn> getColumns() {
        return columns;
    }

    public List<SqlCondition> getCustomConditions() {
        return customConditions;
    }

    public TimeRangeInput getTimeRange() {
        return timeRange;
    }

    public String getTimeColumn() {
        return timeColumn;
    }

    public List<Filter> getFilters() {
        return filters;
    }

    public ColumnFilterConfig getColumnFilterConfig() {
        return columnFilterConfig;
    }

    public List<OrderBy> getOrderBy() {
        return orderBy;
    }

    public Pagination getPagination() {
        return pagination;
    }

    public List<String> getGroupBy() {
        return groupBy;
    }

    public TimeBucket getTimeBucket() {
        return timeBucket;
    }

    public SideAggregation getSideAggregation() {
        return sideAggregation;
    }

    public static class Builder {
        private String table;
        private final List<QueryColumn> columns = new ArrayList<>();
        private final List<SqlCondition> customConditions = new ArrayList<>();
        private TimeRangeInput timeRange;
        private String timeColumn;
        private final List<Filter> filters = new ArrayList<>();
        private ColumnFilterConfig columnFilterConfig;
        private final List<OrderBy> orderBy = new ArrayList<>();
        private Pagination pagination;
        private final List<String> groupBy = new ArrayList<>();
        private TimeBucket timeBucket;
        private SideAggregation sideAggregation;

        public Builder table(String table) {
            this.table = table;
            return this;
        }

        public Builder column(String column) {
            this.columns.add(QueryColumn.column(column));
            return this;
        }

        public Builder metric(Metric metric) {
            this.columns.add(QueryColumn.metric(metric));
            return this;
        }

        public Builder columns(List<QueryColumn> columns) {
            this.columns.addAll(columns);
            return this;
        }

        public Builder customCondition(SqlCondition condition) {
            this.customConditions.add(condition);
            return this;
        }

        public Builder timeRange(TimeRangeInput timeRange) {
            this.timeRange = timeRange;
            return this;
        }

        /**
         * Column the time range and bucketing apply to; defaults to the table's time column.
         */
        public Builder timeColumn(String timeColumn) {
            this.timeColumn = timeColumn;
            return this;
        }

        public Builder filter(Filter filter) {
            this.filters.add(filter);
            return this;
        }

        public Builder filters(List<Filter> filters) {
            this.filters.addAll(filters);
            return this;
        }

        public Builder columnFilterConfig(ColumnFilterConfig columnFilterConfig) {
            this.columnFilterConfig = columnFilterConfig;
            return this;
        }

        public Builder orderBy(OrderBy orderBy) {
            this.orderBy.add(orderBy);
            return this;
        }

        public Builder pagination(Pagination pagination) {
            this.pagination = pagination;
            return this;
        }

        public Builder groupBy(String column) {
            this.groupBy.add(column);
            return this;
        }

        public Builder timeBucket(TimeBucket timeBucket) {
            this.timeBucket = timeBucket;
            return this;
        }

        public Builder sideAggregation(SideAggregation sideAggregation) {
            this.sideAggregation = sideAggregation;
            return this;
        }

        public SelectQueryOptions build() {
            return new SelectQueryOptions(this);
        }
    }
}
