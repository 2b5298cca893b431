package com.aperture.query.sql;

import com.aperture.query.ParameterSet;
import com.aperture.schema.TableSchema;

/**
 * Validates a free-form SQL expression (e.g. a custom metric) against a single table.
 */
public interface FragmentValidator {

    /**
     * @param fragment   the expression text supplied by the user
     * @param table      the only table the expression may reference
     * @param parameters receives the fragment's literals as named parameters
     * @return the rewritten expression, safe to embed in a SELECT list
     * @throws com.aperture.query.QueryValidationException if the fragment is not acceptable
     */
    String validate(String fragment, TableSchema table, ParameterSet parameters);
}
