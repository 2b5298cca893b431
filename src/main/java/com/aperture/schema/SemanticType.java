package com.aperture.schema;

/**
 * Logical type of a column as seen by filters and the dashboard.
 * Decides which filter operators apply and how filter values are coerced.
 */
public enum SemanticType {
    STRING,
    NUMBER,
    BOOLEAN,
    DATETIME,
    JSON
}
