package com.aperture.query;

/**
 * Reason a query was rejected.
 */
public enum ErrorKind {
    SYNTAX_ERROR,
    DISALLOWED_STATEMENT,
    UNKNOWN_TABLE,
    UNKNOWN_COLUMN,
    AMBIGUOUS_REFERENCE,
    DISALLOWED_FUNCTION,
    INVALID_FILTER,
    INVALID_TIME_RANGE,
    UNSORTABLE_COLUMN,
    INVALID_QUERY
}
