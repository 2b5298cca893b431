package com.aperture.schema;

import java.util.Optional;
import java.util.Set;

/**
 * Source of truth for which tables and columns user queries may reach.
 * Lookups are case-insensitive; an empty result means the name is not queryable.
 */
public interface SchemaRegistry {

    Optional<TableSchema> resolveTable(String tableName);

    default Optional<ColumnSchema> resolveColumn(String tableName, String columnName) {
        return resolveTable(tableName).flatMap(table -> table.getColumn(columnName));
    }

    Set<String> tableNames();
}
