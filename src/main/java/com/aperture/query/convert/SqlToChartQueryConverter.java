package com.aperture.query.convert;

import com.aperture.query.ErrorKind;
import com.aperture.query.QueryValidationException;
import com.aperture.query.builder.Filter;
import com.aperture.query.builder.FilterOperator;
import com.aperture.query.builder.Metric;
import com.aperture.query.builder.MetricFunction;
import com.aperture.query.builder.OrderBy;
import com.aperture.query.sql.ColumnReference;
import com.aperture.query.sql.ExpressionWalker;
import com.aperture.query.sql.SqlIdentifiers;
import com.aperture.query.time.BucketInterval;
import com.aperture.query.time.IntervalUnit;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.DoubleValue;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.expression.IntervalExpression;
import net.sf.jsqlparser.expression.LongValue;
import net.sf.jsqlparser.expression.StringValue;
import net.sf.jsqlparser.expression.operators.conditional.AndExpression;
import net.sf.jsqlparser.expression.operators.relational.ComparisonOperator;
import net.sf.jsqlparser.expression.operators.relational.ExpressionList;
import net.sf.jsqlparser.expression.operators.relational.ParenthesedExpressionList;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.AllColumns;
import net.sf.jsqlparser.statement.select.Limit;
import net.sf.jsqlparser.statement.select.OrderByElement;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.SelectItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Recovers a {@link ChartQuery} from a simple aggregate SELECT so that a SQL-authored chart
 * can be edited in the structured chart builder.
 *
 * <p>Supported shape: one table, no joins or CTEs, an optional {@code toStartOfInterval(col, INTERVAL n UNIT)}
 * bucket, plain column dimensions, {@code count/sum/avg/min/max} metrics over a single column,
 * an AND-chain of column-versus-literal comparisons, ORDER BY and LIMIT. Any other select
 * expression is kept as a raw metric. Schema checks happen later, when the chart is compiled.
 */
@Component
public class SqlToChartQueryConverter {

    private static final Logger logger = LoggerFactory.getLogger(SqlToChartQueryConverter.class);

    private static final String BUCKET_FUNCTION = "tostartofinterval";
    private static final Set<String> AGGREGATES = Set.of("count", "sum", "avg", "min", "max");

    /**
     * @throws QueryValidationException SYNTAX_ERROR when the text does not parse, INVALID_QUERY
     *                                  when it is not a SELECT of the supported shape
     */
    public ChartQuery convert(String sql) {
        if (sql == null || sql.isBlank()) {
            throw new QueryValidationException(ErrorKind.SYNTAX_ERROR, "Query is empty");
        }
        Statement statement;
        try {
            statement = CCJSqlParserUtil.parse(sql);
        } catch (JSQLParserException e) {
            throw new QueryValidationException(ErrorKind.SYNTAX_ERROR, "Could not parse query", e);
        }
        if (!(statement instanceof PlainSelect)) {
            throw new QueryValidationException(ErrorKind.INVALID_QUERY,
                "Only a single plain SELECT can be converted to a chart");
        }
        PlainSelect select = (PlainSelect) statement;
        if (select.getWithItemsList() != null && !select.getWithItemsList().isEmpty()) {
            throw unsupported("WITH clauses");
        }
        if (select.getJoins() != null && !select.getJoins().isEmpty()) {
            throw unsupported("joins");
        }
        if (!(select.getFromItem() instanceof Table)) {
            throw unsupported("FROM items other than a table");
        }
        String table = ((Table) select.getFromItem()).getName();

        List<Metric> metrics = new ArrayList<>();
        List<String> dimensions = new ArrayList<>();
        String bucketColumn = null;
        BucketInterval bucketInterval = null;
        for (SelectItem<?> item : select.getSelectItems()) {
            Expression expression = item.getExpression();
            String alias = item.getAlias() != null ? SqlIdentifiers.normalize(item.getAlias().getName()) : null;
            if (expression instanceof AllColumns) {
                throw unsupported("SELECT *");
            }
            if (expression instanceof Column) {
                dimensions.add(SqlIdentifiers.normalize(((Column) expression).getColumnName()));
            } else if (isBucket(expression)) {
                if (bucketInterval != null) {
                    throw unsupported("more than one time bucket");
                }
                Function bucket = (Function) expression;
                bucketColumn = SqlIdentifiers.normalize(((Column) bucket.getParameters().get(0)).getColumnName());
                bucketInterval = interval((IntervalExpression) bucket.getParameters().get(1));
            } else {
                metrics.add(metric(expression, alias, metrics.size()));
            }
        }

        List<Filter> filters = new ArrayList<>();
        collectFilters(select.getWhere(), filters);

        List<OrderBy> orderBy = new ArrayList<>();
        if (select.getOrderByElements() != null) {
            for (OrderByElement element : select.getOrderByElements()) {
                if (!(element.getExpression() instanceof Column)) {
                    throw unsupported("ORDER BY expressions");
                }
                String name = SqlIdentifiers.normalize(((Column) element.getExpression()).getColumnName());
                orderBy.add(new OrderBy(name, element.isAsc() ? OrderBy.Direction.ASC : OrderBy.Direction.DESC));
            }
        }

        ChartQuery chart = new ChartQuery(table, metrics, dimensions, filters, bucketColumn, bucketInterval,
            orderBy, limit(select.getLimit()));
        logger.debug("Converted SQL to {}", chart);
        return chart;
    }

    private static boolean isBucket(Expression expression) {
        if (!(expression instanceof Function)) {
            return false;
        }
        Function function = (Function) expression;
        ExpressionList<?> parameters = function.getParameters();
        return BUCKET_FUNCTION.equals(function.getName().toLowerCase(Locale.ROOT))
            && parameters != null
            && parameters.size() == 2
            && parameters.get(0) instanceof Column
            && parameters.get(1) instanceof IntervalExpression;
    }

    static BucketInterval interval(IntervalExpression expression) {
        String amount = expression.getParameter();
        if (amount == null && expression.getExpression() instanceof LongValue) {
            amount = ((LongValue) expression.getExpression()).getStringValue();
        }
        String unit = expression.getIntervalType();
        if (amount == null && expression.getExpression() instanceof StringValue) {
            // INTERVAL '5 minute'
            String[] parts = ((StringValue) expression.getExpression()).getValue().trim().split("\\s+");
            if (parts.length == 2) {
                amount = parts[0];
                unit = parts[1];
            }
        }
        if (amount == null || unit == null) {
            throw unsupported("interval " + expression);
        }
        try {
            return BucketInterval.of(Long.parseLong(amount.trim()), IntervalUnit.fromString(unit));
        } catch (IllegalArgumentException e) {
            throw new QueryValidationException(ErrorKind.INVALID_QUERY, "Unsupported interval " + expression, e);
        }
    }

    private static Metric metric(Expression expression, String alias, int index) {
        if (expression instanceof Function) {
            Function function = (Function) expression;
            String name = function.getName().toLowerCase(Locale.ROOT);
            if (AGGREGATES.contains(name) && !function.isDistinct()) {
                MetricFunction metricFunction = MetricFunction.fromString(name);
                ExpressionList<?> parameters = function.getParameters();
                if ("count".equals(name) && (function.isAllColumns() || parameters == null || parameters.isEmpty()
                    || parameters.get(0) instanceof AllColumns)) {
                    return Metric.count(alias);
                }
                if (parameters != null && parameters.size() == 1 && parameters.get(0) instanceof Column) {
                    String column = SqlIdentifiers.normalize(((Column) parameters.get(0)).getColumnName());
                    return Metric.of(metricFunction, column, alias);
                }
            }
        }
        List<ColumnReference> references = ExpressionWalker.extractColumnReferences(expression);
        logger.debug("Keeping '{}' over {} column(s) as a raw metric", expression, references.size());
        return Metric.raw(expression.toString(), alias != null ? alias : "metric_" + index);
    }

    private static void collectFilters(Expression where, List<Filter> filters) {
        if (where == null) {
            return;
        }
        if (where instanceof AndExpression) {
            AndExpression and = (AndExpression) where;
            collectFilters(and.getLeftExpression(), filters);
            collectFilters(and.getRightExpression(), filters);
            return;
        }
        if (where instanceof ParenthesedExpressionList && ((ParenthesedExpressionList<?>) where).size() == 1) {
            collectFilters(((ParenthesedExpressionList<?>) where).get(0), filters);
            return;
        }
        if (!(where instanceof ComparisonOperator)) {
            throw unsupported("filter " + where);
        }
        ComparisonOperator comparison = (ComparisonOperator) where;
        if (!(comparison.getLeftExpression() instanceof Column)) {
            throw unsupported("filter " + where);
        }
        String column = SqlIdentifiers.normalize(((Column) comparison.getLeftExpression()).getColumnName());
        FilterOperator operator;
        try {
            String symbol = comparison.getStringExpression();
            operator = "<>".equals(symbol) ? FilterOperator.NE : FilterOperator.fromString(symbol);
        } catch (IllegalArgumentException e) {
            throw new QueryValidationException(ErrorKind.INVALID_QUERY, "Unsupported filter " + where, e);
        }
        filters.add(new Filter(column, operator, literal(comparison.getRightExpression(), where)));
    }

    private static Object literal(Expression expression, Expression filter) {
        if (expression instanceof StringValue) {
            return ((StringValue) expression).getValue();
        }
        if (expression instanceof LongValue) {
            return ((LongValue) expression).getValue();
        }
        if (expression instanceof DoubleValue) {
            return ((DoubleValue) expression).getValue();
        }
        throw unsupported("filter " + filter);
    }

    private static Long limit(Limit limit) {
        if (limit == null || limit.getRowCount() == null) {
            return null;
        }
        if (!(limit.getRowCount() instanceof LongValue)) {
            throw unsupported("non-numeric LIMIT");
        }
        return ((LongValue) limit.getRowCount()).getValue();
    }

    private static QueryValidationException unsupported(String what) {
        return new QueryValidationException(ErrorKind.INVALID_QUERY, "Chart queries do not support " + what);
    }
}
