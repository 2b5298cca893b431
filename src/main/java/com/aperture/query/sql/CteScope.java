package com.aperture.query.sql;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Common table expressions visible at a point of the query. Immutable; each WITH item
 * produces a new scope so a CTE only sees those declared before it.
 */
final class CteScope {

    static final CteScope EMPTY = new CteScope(Collections.emptyMap());

    private final Map<String, Set<String>> columnsByName;

    private CteScope(Map<String, Set<String>> columnsByName) {
        this.columnsByName = columnsByName;
    }

    CteScope with(String name, Set<String> columns) {
        Map<String, Set<String>> next = new LinkedHashMap<>(columnsByName);
        next.put(SqlIdentifiers.normalize(name), columns);
        return new CteScope(Collections.unmodifiableMap(next));
    }

    Set<String> lookup(String name) {
        return columnsByName.get(SqlIdentifiers.normalize(name));
    }
}
