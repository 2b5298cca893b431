package com.aperture.query.sql;

import com.aperture.schema.TableSchema;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Something a SELECT reads from: a registry table, a CTE or a derived table,
 * with the column names it exposes (lower-cased).
 */
final class Relation {

    private final String qualifier;
    private final TableSchema table;
    private final Set<String> columns;

    private Relation(String qualifier, TableSchema table, Set<String> columns) {
        this.qualifier = qualifier;
        this.table = table;
        this.columns = Collections.unmodifiableSet(new LinkedHashSet<>(columns));
    }

    static Relation base(String qualifier, TableSchema table) {
        return new Relation(qualifier, table, new LinkedHashSet<>(table.getColumnNames()));
    }

    static Relation derived(String qualifier, Set<String> columns) {
        return new Relation(qualifier, null, columns);
    }

    /**
     * Alias or table name as written; {@code null} for an unaliased derived table.
     */
    String getQualifier() {
        return qualifier;
    }

    boolean isBaseTable() {
        return table != null;
    }

    TableSchema getTable() {
        return table;
    }

    Set<String> getColumns() {
        return columns;
    }

    boolean hasColumn(String normalizedName) {
        return columns.contains(normalizedName);
    }
}
