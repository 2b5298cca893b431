package com.aperture.query.builder;

import java.util.Objects;

/**
 * A single column predicate from the dashboard filter bar.
 */
public class Filter {

    private final String column;
    private final FilterOperator operator;
    private final Object value;

    public Filter(String column, FilterOperator operator, Object value) {
        this.column = column;
        this.operator = Objects.requireNonNull(operator, "operator");
        this.value = value;
    }

    public static Filter of(String column, String operator, Object value) {
        return new Filter(column, FilterOperator.fromString(operator), value);
    }

    public String getColumn() {
        return column;
    }

    public FilterOperator getOperator() {
        return operator;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Filter filter = (Filter) o;
        return Objects.equals(column, filter.column) && operator == filter.operator && Objects.equals(value, filter.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, operator, value);
    }

    @Override
    public String toString() {
        return column + " " + operator.getCode() + " " + value;
    }
}
