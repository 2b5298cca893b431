package com.aperture.query.builder;

import com.aperture.query.SqlCondition;
import com.aperture.schema.ColumnSchema;

/**
 * Turns one filter on one column into a parameterized condition.
 * Implementations throw {@link com.aperture.query.QueryValidationException} with
 * {@link com.aperture.query.ErrorKind#INVALID_FILTER} to have the filter dropped.
 */
@FunctionalInterface
public interface ColumnFilterProcessor {

    /**
     * @param parameterName name to bind the filter value under; derived names must start with it
     */
    SqlCondition process(Filter filter, ColumnSchema column, String parameterName);
}
