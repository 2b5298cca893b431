package com.aperture.query.builder;

import com.aperture.query.CompilationResult;
import com.aperture.query.CompiledQuery;
import com.aperture.query.ErrorKind;
import com.aperture.query.ParameterSet;
import com.aperture.query.QueryCompilerProperties;
import com.aperture.query.QueryParameter;
import com.aperture.query.QueryValidationException;
import com.aperture.query.SqlCondition;
import com.aperture.query.TenantScope;
import com.aperture.query.sql.FragmentValidator;
import com.aperture.query.sql.SqlIdentifiers;
import com.aperture.query.time.TimeRange;
import com.aperture.query.time.TimeRangeResolver;
import com.aperture.schema.ColumnSchema;
import com.aperture.schema.DbType;
import com.aperture.schema.SchemaRegistry;
import com.aperture.schema.SemanticType;
import com.aperture.schema.TableSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Builds tenant-scoped SELECTs from structured chart and table options.
 *
 * <p>Only identifiers taken from the {@link SchemaRegistry} are written into the SQL text;
 * every value is a named parameter. Output is identical for identical inputs.
 */
@Component
public class SelectQueryBuilder {

    private static final Logger logger = LoggerFactory.getLogger(SelectQueryBuilder.class);

    static final String FILTER_PREFIX = "f";
    static final String QUANTILE_PREFIX = "q";
    static final String LIMIT_PARAMETER = "limit";
    static final String OFFSET_PARAMETER = "offset";
    static final String SIDE_AGGREGATION_SUFFIX = "_agg";

    private final SchemaRegistry registry;
    private final TimeRangeResolver timeRangeResolver;
    private final FragmentValidator fragmentValidator;
    private final QueryCompilerProperties properties;

    public SelectQueryBuilder(SchemaRegistry registry, TimeRangeResolver timeRangeResolver,
                              FragmentValidator fragmentValidator, QueryCompilerProperties properties) {
        this.registry = registry;
        this.timeRangeResolver = timeRangeResolver;
        this.fragmentValidator = fragmentValidator;
        this.properties = properties;
    }

    public CompilationResult buildSelectQuery(SelectQueryOptions options, TenantScope tenant) {
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(tenant, "tenant");
        try {
            return build(options, tenant);
        } catch (QueryValidationException e) {
            logger.warn("Rejected structured query on {} for tenant {}: {} {}",
                options.getTable(), tenant.getProjectId(), e.getKind(), e.getMessage());
            return CompilationResult.rejected(e);
        }
    }

    private CompilationResult build(SelectQueryOptions options, TenantScope tenant) {
        TableSchema table = registry.resolveTable(options.getTable())
            .orElseThrow(() -> new QueryValidationException(ErrorKind.UNKNOWN_TABLE, "Unknown table '" + options.getTable() + "'"));
        ParameterSet parameters = new ParameterSet();
        List<String> warnings = new ArrayList<>();
        Set<String> outputNames = new HashSet<>();
        Set<String> computedAliases = new HashSet<>();
        SideAggregation side = options.getSideAggregation();
        TimeBucket bucket = options.getTimeBucket();

        TimeRange range = null;
        String timeExpression = null;
        if (options.getTimeRange() != null || bucket != null) {
            timeExpression = timeExpression(table, options.getTimeColumn());
            range = timeRangeResolver.resolve(options.getTimeRange(), properties.getDefaultLookbackHours());
        }

        // SELECT
        List<String> selectItems = new ArrayList<>();
        if (bucket != null) {
            selectItems.add("toStartOfInterval(" + timeExpression + ", " + bucket.getInterval().toSql() + ") AS " + TimeBucket.ALIAS);
            registerOutput(outputNames, TimeBucket.ALIAS);
            computedAliases.add(TimeBucket.ALIAS);
        }
        for (QueryColumn queryColumn : options.getColumns()) {
            if (queryColumn.isMetric()) {
                Metric metric = queryColumn.getMetric();
                String alias = metricAlias(metric);
                registerOutput(outputNames, alias);
                computedAliases.add(alias.toLowerCase(Locale.ROOT));
                selectItems.add(renderMetric(metric, table, parameters) + " AS " + alias);
            } else {
                ColumnSchema column = requireColumn(table, queryColumn.getColumn());
                registerOutput(outputNames, column.getName());
                selectItems.add(renderColumn(column, side != null ? table.getName() : null));
            }
        }
        String sideCte = null;
        if (side != null) {
            sideCte = renderSideAggregation(side, table, tenant, parameters);
            registerOutput(outputNames, side.getAlias());
            computedAliases.add(side.getAlias().toLowerCase(Locale.ROOT));
            selectItems.add(sideName(side) + "." + side.getAlias() + " AS " + side.getAlias());
        }
        if (selectItems.isEmpty()) {
            throw new QueryValidationException(ErrorKind.INVALID_QUERY, "Query must select at least one column or metric");
        }

        // WHERE
        List<String> conditions = new ArrayList<>();
        conditions.add(tenantCondition(table, tenant, parameters));
        for (SqlCondition custom : options.getCustomConditions()) {
            conditions.add("(" + custom.getSql() + ")");
            addCustomParameters(custom, parameters);
        }
        if (range != null) {
            SqlCondition timeCondition = timeRangeResolver.toCondition(range, timeExpression);
            conditions.add(timeCondition.getSql());
            parameters.addAll(timeCondition.getParameters());
        }
        applyFilters(options, table, parameters, warnings, conditions);

        List<String> groupBy = groupBy(options, table, bucket);
        List<String> orderBy = orderBy(options, table, bucket, computedAliases);

        StringBuilder sql = new StringBuilder();
        if (sideCte != null) {
            sql.append("WITH ").append(sideCte).append(' ');
        }
        sql.append("SELECT ").append(String.join(", ", selectItems));
        sql.append(" FROM ").append(table.getName());
        if (side != null) {
            sql.append(" LEFT JOIN ").append(sideName(side)).append(" ON ").append(sideJoinCondition(side, table));
        }
        sql.append(" WHERE ").append(String.join(" AND ", conditions));
        if (!groupBy.isEmpty()) {
            sql.append(" GROUP BY ").append(String.join(", ", groupBy));
        }
        if (!orderBy.isEmpty()) {
            sql.append(" ORDER BY ").append(String.join(", ", orderBy));
        }
        appendPagination(sql, options.getPagination(), parameters, warnings);

        CompiledQuery query = new CompiledQuery(sql.toString(), parameters.asMap());
        logger.debug("Built query on {} for tenant {}: {}", table.getName(), tenant.getProjectId(), query.getSql());
        return CompilationResult.success(query, warnings);
    }

    private String timeExpression(TableSchema table, String requestedColumn) {
        String name = requestedColumn != null ? requestedColumn : table.getTimeColumn();
        if (name == null) {
            throw new QueryValidationException(ErrorKind.INVALID_QUERY, "Table " + table.getName() + " has no time column");
        }
        ColumnSchema column = requireColumn(table, name);
        if (column.getType() != SemanticType.DATETIME) {
            throw new QueryValidationException(ErrorKind.INVALID_QUERY, "Column '" + name + "' is not a timestamp");
        }
        return column.getFilterExpression();
    }

    private String metricAlias(Metric metric) {
        String alias = metric.getAlias() != null ? metric.getAlias() : metric.defaultAlias();
        if (!SqlIdentifiers.isSimpleIdentifier(alias)) {
            throw new QueryValidationException(ErrorKind.INVALID_QUERY, "Invalid metric alias '" + alias + "'");
        }
        return alias;
    }

    private String renderMetric(Metric metric, TableSchema table, ParameterSet parameters) {
        MetricFunction function = metric.getFunction();
        if (function == MetricFunction.RAW) {
            if (metric.getRawSql() == null) {
                throw new QueryValidationException(ErrorKind.INVALID_QUERY, "Raw metric requires an expression");
            }
            return fragmentValidator.validate(metric.getRawSql(), table, parameters);
        }
        if (function == MetricFunction.COUNT && (metric.getColumn() == null || "*".equals(metric.getColumn()))) {
            return "count(*)";
        }
        if (metric.getColumn() == null) {
            throw new QueryValidationException(ErrorKind.INVALID_QUERY, "Metric " + function.sqlName() + " requires a column");
        }
        ColumnSchema column = requireColumn(table, metric.getColumn());
        String expression = column.getSelectExpression();
        return switch (function) {
            case COUNT -> "count(" + expression + ")";
            case SUM, AVG -> {
                requireType(column, function, SemanticType.NUMBER);
                yield function.sqlName() + "(" + expression + ")";
            }
            case MIN, MAX -> {
                requireType(column, function, SemanticType.NUMBER, SemanticType.DATETIME);
                yield function.sqlName() + "(" + expression + ")";
            }
            case QUANTILE -> {
                requireType(column, function, SemanticType.NUMBER);
                String level = parameters.next(QUANTILE_PREFIX, quantileLevel(metric), DbType.FLOAT64);
                yield "quantile(:" + level + ")(" + expression + ")";
            }
            case RAW -> throw new IllegalStateException("raw metrics are rendered above");
        };
    }

    private static double quantileLevel(Metric metric) {
        if (metric.getArgs().isEmpty() || !(metric.getArgs().get(0) instanceof Number)) {
            throw new QueryValidationException(ErrorKind.INVALID_QUERY, "quantile requires a numeric level argument");
        }
        double level = ((Number) metric.getArgs().get(0)).doubleValue();
        if (!(level > 0 && level < 1)) {
            throw new QueryValidationException(ErrorKind.INVALID_QUERY, "quantile level must be between 0 and 1: " + level);
        }
        return level;
    }

    private static void requireType(ColumnSchema column, MetricFunction function, SemanticType... allowed) {
        for (SemanticType type : allowed) {
            if (column.getType() == type) {
                return;
            }
        }
        throw new QueryValidationException(ErrorKind.INVALID_QUERY,
            "Cannot apply " + function.sqlName() + " to " + column.getType().name().toLowerCase(Locale.ROOT)
                + " column '" + column.getName() + "'");
    }

    private static String renderColumn(ColumnSchema column, String qualifier) {
        if (column.hasSelectExpression()) {
            return column.getSelectExpression() + " AS " + column.getName();
        }
        return qualifier != null
            ? qualifier + "." + column.getName() + " AS " + column.getName()
            : column.getName();
    }

    private String renderSideAggregation(SideAggregation side, TableSchema table, TenantScope tenant, ParameterSet parameters) {
        TableSchema sideTable = registry.resolveTable(side.getTable())
            .orElseThrow(() -> new QueryValidationException(ErrorKind.UNKNOWN_TABLE, "Unknown table '" + side.getTable() + "'"));
        if (!SqlIdentifiers.isSimpleIdentifier(side.getAlias())) {
            throw new QueryValidationException(ErrorKind.INVALID_QUERY, "Invalid aggregation alias '" + side.getAlias() + "'");
        }
        ColumnSchema key = requireColumn(sideTable, side.getKeyColumn());
        ColumnSchema name = requireColumn(sideTable, side.getNameColumn());
        ColumnSchema value = requireColumn(sideTable, side.getValueColumn());
        ColumnSchema join = requireColumn(table, side.getJoinColumn());
        // join keys are compared as physical columns
        for (ColumnSchema joinKey : List.of(key, join)) {
            if (joinKey.isDerived()) {
                throw new QueryValidationException(ErrorKind.INVALID_QUERY,
                    "Computed column '" + joinKey.getName() + "' cannot be used as a join key");
            }
        }
        if (value.getType() != SemanticType.NUMBER) {
            throw new QueryValidationException(ErrorKind.INVALID_QUERY, "Aggregated value column '" + value.getName() + "' must be numeric");
        }
        return sideName(side) + " AS (SELECT " + key.getName()
            + ", mapFromArrays(groupArray(" + name.getSelectExpression() + "), groupArray(toFloat64("
            + value.getSelectExpression() + "))) AS " + side.getAlias()
            + " FROM " + sideTable.getName()
            + " WHERE " + tenantCondition(sideTable, tenant, parameters)
            + " GROUP BY " + key.getName() + ")";
    }

    private String sideJoinCondition(SideAggregation side, TableSchema table) {
        TableSchema sideTable = registry.resolveTable(side.getTable()).orElseThrow();
        return table.getName() + '.' + requireColumn(table, side.getJoinColumn()).getName()
            + " = " + sideName(side) + '.' + requireColumn(sideTable, side.getKeyColumn()).getName();
    }

    private static String sideName(SideAggregation side) {
        return side.getAlias() + SIDE_AGGREGATION_SUFFIX;
    }

    private String tenantCondition(TableSchema table, TenantScope tenant, ParameterSet parameters) {
        String parameter = parameters.add(properties.getTenantParameter(), tenant.getProjectId(), table.getTenantColumnType());
        return table.getName() + "." + table.getTenantColumn() + " = :" + parameter;
    }

    /**
     * Custom conditions bring their own parameter names. Names the builder binds itself are
     * refused, as is a name already bound to another value.
     */
    private void addCustomParameters(SqlCondition custom, ParameterSet parameters) {
        for (Map.Entry<String, QueryParameter> entry : custom.getParameters().entrySet()) {
            String name = entry.getKey();
            if (isBuilderParameter(name)) {
                throw new QueryValidationException(ErrorKind.INVALID_QUERY,
                    "Custom condition parameter ':" + name + "' clashes with a parameter the query binds");
            }
            QueryParameter existing = parameters.get(name);
            if (existing != null && !existing.equals(entry.getValue())) {
                throw new QueryValidationException(ErrorKind.INVALID_QUERY,
                    "Custom condition parameter ':" + name + "' is bound to conflicting values");
            }
            parameters.add(name, entry.getValue().getValue(), entry.getValue().getType());
        }
    }

    private boolean isBuilderParameter(String name) {
        return name.equals(properties.getTenantParameter())
            || name.equals(LIMIT_PARAMETER)
            || name.equals(OFFSET_PARAMETER)
            || name.equals(TimeRangeResolver.START_PARAMETER)
            || name.equals(TimeRangeResolver.END_PARAMETER)
            || name.startsWith(FILTER_PREFIX + "_");
    }

    private void applyFilters(SelectQueryOptions options, TableSchema table, ParameterSet parameters,
                              List<String> warnings, List<String> conditions) {
        List<Filter> filters = options.getFilters();
        for (int i = 0; i < filters.size(); i++) {
            Filter filter = filters.get(i);
            Optional<ColumnSchema> column = table.getColumn(filter.getColumn());
            if (column.isEmpty() || !column.get().isFilterable()) {
                dropFilter(warnings, "Filter on unknown or non-filterable column '" + filter.getColumn() + "' was ignored");
                continue;
            }
            String parameterName = FILTER_PREFIX + "_" + column.get().getName() + "_" + i;
            try {
                SqlCondition condition = options.getColumnFilterConfig()
                    .processorFor(column.get().getName())
                    .process(filter, column.get(), parameterName);
                conditions.add(condition.getSql());
                parameters.addAll(condition.getParameters());
            } catch (QueryValidationException e) {
                if (e.getKind() != ErrorKind.INVALID_FILTER) {
                    throw e;
                }
                dropFilter(warnings, e.getMessage());
            }
        }
    }

    private static void dropFilter(List<String> warnings, String message) {
        logger.warn(message);
        warnings.add(message);
    }

    private static List<String> groupBy(SelectQueryOptions options, TableSchema table, TimeBucket bucket) {
        List<String> items = new ArrayList<>();
        if (bucket != null) {
            items.add(TimeBucket.ALIAS);
        }
        for (String name : options.getGroupBy()) {
            if (bucket != null && TimeBucket.ALIAS.equalsIgnoreCase(name)) {
                continue;
            }
            items.add(requireColumn(table, name).getSelectExpression());
        }
        return items;
    }

    private static List<String> orderBy(SelectQueryOptions options, TableSchema table, TimeBucket bucket,
                                        Set<String> computedAliases) {
        List<String> items = new ArrayList<>();
        boolean fill = bucket != null && bucket.isFillGaps();
        if (fill) {
            String interval = bucket.getInterval().toSql();
            items.add(TimeBucket.ALIAS + " ASC WITH FILL"
                + " FROM toStartOfInterval(toDateTime64(:" + TimeRangeResolver.START_PARAMETER + ", 3), " + interval + ")"
                + " TO toStartOfInterval(toDateTime64(:" + TimeRangeResolver.END_PARAMETER + ", 3), " + interval + ")"
                + " STEP " + interval);
        }
        for (OrderBy order : options.getOrderBy()) {
            String name = order.getColumn();
            if (fill && TimeBucket.ALIAS.equalsIgnoreCase(name)) {
                continue;
            }
            String expression;
            if (computedAliases.contains(name.toLowerCase(Locale.ROOT))) {
                expression = name;
            } else {
                ColumnSchema column = table.getColumn(name)
                    .orElseThrow(() -> new QueryValidationException(ErrorKind.UNKNOWN_COLUMN, "Unknown column '" + name + "'"));
                if (!column.isSortable()) {
                    throw new QueryValidationException(ErrorKind.UNSORTABLE_COLUMN, "Column '" + name + "' cannot be sorted");
                }
                expression = column.getSelectExpression();
            }
            items.add(expression + " " + order.getDirection().name());
        }
        if (items.isEmpty() && bucket != null) {
            items.add(TimeBucket.ALIAS + " ASC");
        }
        return items;
    }

    private void appendPagination(StringBuilder sql, Pagination pagination, ParameterSet parameters, List<String> warnings) {
        long maxLimit = properties.getMaxLimit();
        long limit = maxLimit;
        if (pagination != null) {
            if (pagination.getLimit() <= 0) {
                throw new QueryValidationException(ErrorKind.INVALID_QUERY, "limit must be positive: " + pagination.getLimit());
            }
            if (pagination.getOffset() < 0) {
                throw new QueryValidationException(ErrorKind.INVALID_QUERY, "offset must not be negative: " + pagination.getOffset());
            }
            if (pagination.getLimit() > maxLimit) {
                warnings.add("Requested limit " + pagination.getLimit() + " exceeds the maximum of " + maxLimit
                    + " rows and was reduced");
            } else {
                limit = pagination.getLimit();
            }
        }
        parameters.add(LIMIT_PARAMETER, limit, DbType.UINT32);
        sql.append(" LIMIT :").append(LIMIT_PARAMETER);
        if (pagination != null) {
            parameters.add(OFFSET_PARAMETER, pagination.getOffset(), DbType.UINT32);
            sql.append(" OFFSET :").append(OFFSET_PARAMETER);
        }
    }

    private static void registerOutput(Set<String> names, String name) {
        if (!names.add(name.toLowerCase(Locale.ROOT))) {
            throw new QueryValidationException(ErrorKind.INVALID_QUERY, "Duplicate output column '" + name + "'");
        }
    }

    private static ColumnSchema requireColumn(TableSchema table, String name) {
        return table.getColumn(name)
            .orElseThrow(() -> new QueryValidationException(ErrorKind.UNKNOWN_COLUMN,
                "Unknown column '" + name + "' on table " + table.getName()));
    }
}
