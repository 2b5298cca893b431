package com.aperture.query.builder;

import com.aperture.query.ErrorKind;
import com.aperture.query.ParameterSet;
import com.aperture.query.QueryValidationException;
import com.aperture.query.SqlCondition;
import com.aperture.query.time.ClickHouseTimestamps;
import com.aperture.query.time.TimeRangeException;
import com.aperture.schema.ColumnSchema;
import com.aperture.schema.DbType;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Date;
import java.util.Locale;

/**
 * Stock filter strategies, selected by the column's semantic type.
 */
public final class FilterProcessors {

    private FilterProcessors() {
    }

    public static ColumnFilterProcessor byType() {
        return FilterProcessors::processByType;
    }

    private static SqlCondition processByType(Filter filter, ColumnSchema column, String parameterName) {
        if (filter.getValue() == null) {
            throw invalid(filter, "a value is required");
        }
        return switch (column.getType()) {
            case STRING -> column.getDbType() == DbType.ARRAY_STRING || column.getDbType() == DbType.ARRAY_UUID
                ? arrayCondition(filter, column, parameterName)
                : stringCondition(filter, column, parameterName);
            case NUMBER -> comparison(filter, column, parameterName, coerceNumber(filter, column), column.getDbType());
            case DATETIME -> comparison(filter, column, parameterName, coerceTimestamp(filter), DbType.DATETIME64);
            case BOOLEAN -> booleanCondition(filter, column, parameterName);
            case JSON -> jsonCondition(filter, column, parameterName);
        };
    }

    private static SqlCondition stringCondition(Filter filter, ColumnSchema column, String parameterName) {
        String value = String.valueOf(filter.getValue());
        String expression = column.getFilterExpression();
        ParameterSet parameters = new ParameterSet();
        if (filter.getOperator() == FilterOperator.EQ || filter.getOperator() == FilterOperator.NE) {
            parameters.add(parameterName, value, DbType.STRING);
            return new SqlCondition(expression + " " + filter.getOperator().getSymbol() + " :" + parameterName,
                parameters.asMap());
        }
        if (filter.getOperator() == FilterOperator.CONTAINS) {
            parameters.add(parameterName, "%" + escapeLike(value) + "%", DbType.STRING);
            return new SqlCondition(expression + " ILIKE :" + parameterName, parameters.asMap());
        }
        throw invalid(filter, "operator not supported for text columns");
    }

    private static SqlCondition arrayCondition(Filter filter, ColumnSchema column, String parameterName) {
        ParameterSet parameters = new ParameterSet();
        parameters.add(parameterName, String.valueOf(filter.getValue()), DbType.STRING);
        String has = "has(" + column.getFilterExpression() + ", :" + parameterName + ")";
        return switch (filter.getOperator()) {
            case EQ, CONTAINS -> new SqlCondition(has, parameters.asMap());
            case NE -> new SqlCondition("NOT " + has, parameters.asMap());
            default -> throw invalid(filter, "operator not supported for list columns");
        };
    }

    private static SqlCondition booleanCondition(Filter filter, ColumnSchema column, String parameterName) {
        if (filter.getOperator() != FilterOperator.EQ && filter.getOperator() != FilterOperator.NE) {
            throw invalid(filter, "only eq and ne apply to boolean columns");
        }
        Object raw = filter.getValue();
        Boolean value;
        if (raw instanceof Boolean) {
            value = (Boolean) raw;
        } else {
            String text = raw.toString().trim().toLowerCase(Locale.ROOT);
            if ("true".equals(text) || "1".equals(text)) {
                value = Boolean.TRUE;
            } else if ("false".equals(text) || "0".equals(text)) {
                value = Boolean.FALSE;
            } else {
                throw invalid(filter, "not a boolean");
            }
        }
        return comparison(filter, column, parameterName, value, DbType.BOOL);
    }

    // value is "key=value"; matched against the key's string value inside the JSON column
    private static SqlCondition jsonCondition(Filter filter, ColumnSchema column, String parameterName) {
        if (filter.getOperator() != FilterOperator.EQ && filter.getOperator() != FilterOperator.NE) {
            throw invalid(filter, "only eq and ne apply to JSON columns");
        }
        String text = filter.getValue().toString();
        int separator = text.indexOf('=');
        if (separator <= 0) {
            throw invalid(filter, "expected key=value");
        }
        String keyParameter = parameterName + "_key";
        String valueParameter = parameterName + "_value";
        ParameterSet parameters = new ParameterSet();
        parameters.add(keyParameter, text.substring(0, separator).trim(), DbType.STRING);
        parameters.add(valueParameter, text.substring(separator + 1).trim(), DbType.STRING);
        String sql = "JSONExtractString(" + column.getFilterExpression() + ", :" + keyParameter + ") "
            + filter.getOperator().getSymbol() + " :" + valueParameter;
        return new SqlCondition(sql, parameters.asMap());
    }

    private static SqlCondition comparison(Filter filter, ColumnSchema column, String parameterName,
                                           Object value, DbType type) {
        if (!filter.getOperator().isComparison()) {
            throw invalid(filter, "operator not supported for " + column.getType().name().toLowerCase(Locale.ROOT) + " columns");
        }
        ParameterSet parameters = new ParameterSet();
        parameters.add(parameterName, value, type);
        return new SqlCondition(column.getFilterExpression() + " " + filter.getOperator().getSymbol() + " :" + parameterName,
            parameters.asMap());
    }

    private static Object coerceNumber(Filter filter, ColumnSchema column) {
        BigDecimal number;
        try {
            number = new BigDecimal(filter.getValue().toString().trim());
        } catch (NumberFormatException e) {
            throw invalid(filter, "not a number");
        }
        if (!column.getDbType().isIntegral()) {
            return number.doubleValue();
        }
        try {
            long value = number.longValueExact();
            if (column.getDbType() == DbType.UINT32 && (value < 0 || value > 0xFFFF_FFFFL)) {
                throw invalid(filter, "out of range");
            }
            return value;
        } catch (ArithmeticException e) {
            throw invalid(filter, "not an integer");
        }
    }

    private static String coerceTimestamp(Filter filter) {
        Object raw = filter.getValue();
        if (raw instanceof Instant) {
            return ClickHouseTimestamps.format((Instant) raw);
        }
        if (raw instanceof Date) {
            return ClickHouseTimestamps.format(((Date) raw).toInstant());
        }
        if (raw instanceof Number) {
            return ClickHouseTimestamps.format(Instant.ofEpochMilli(((Number) raw).longValue()));
        }
        try {
            return ClickHouseTimestamps.format(ClickHouseTimestamps.parse(raw.toString()));
        } catch (TimeRangeException e) {
            throw invalid(filter, "not a timestamp");
        }
    }

    static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static QueryValidationException invalid(Filter filter, String reason) {
        return new QueryValidationException(ErrorKind.INVALID_FILTER,
            "Filter '" + filter + "' was ignored: " + reason);
    }
}
