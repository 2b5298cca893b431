package com.aperture.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Queryable table: its visible columns plus the hidden tenant column and the
 * designated time column used for time-range filtering.
 */
public class TableSchema {

    public static final String DEFAULT_TENANT_COLUMN = "project_id";

    private final String name;
    private final String description;
    private final Map<String, ColumnSchema> columns;
    private final String tenantColumn;
    private final DbType tenantColumnType;
    private final String timeColumn;

    public TableSchema(String name, String description, List<ColumnSchema> columns, String timeColumn) {
        this(name, description, columns, DEFAULT_TENANT_COLUMN, DbType.UUID, timeColumn);
    }

    public TableSchema(String name, String description, List<ColumnSchema> columns,
                       String tenantColumn, DbType tenantColumnType, String timeColumn) {
        this.name = name;
        this.description = description;
        this.tenantColumn = tenantColumn;
        this.tenantColumnType = tenantColumnType;
        this.timeColumn = timeColumn;

        Map<String, ColumnSchema> byName = new LinkedHashMap<>();
        for (ColumnSchema column : columns) {
            String key = column.getName().toLowerCase(Locale.ROOT);
            if (key.equals(tenantColumn.toLowerCase(Locale.ROOT))) {
                throw new IllegalArgumentException("Tenant column '" + tenantColumn + "' cannot be exposed on table " + name);
            }
            if (byName.put(key, column) != null) {
                throw new IllegalArgumentException("Duplicate column '" + column.getName() + "' on table " + name);
            }
        }
        if (timeColumn != null && !byName.containsKey(timeColumn.toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException("Time column '" + timeColumn + "' is not a column of " + name);
        }
        this.columns = Collections.unmodifiableMap(byName);
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public List<ColumnSchema> getColumns() {
        return Collections.unmodifiableList(new ArrayList<>(columns.values()));
    }

    public List<String> getColumnNames() {
        return new ArrayList<>(columns.keySet());
    }

    public Optional<ColumnSchema> getColumn(String columnName) {
        if (columnName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(columns.get(columnName.toLowerCase(Locale.ROOT)));
    }

    public boolean hasColumn(String columnName) {
        return getColumn(columnName).isPresent();
    }

    public String getTenantColumn() {
        return tenantColumn;
    }

    public DbType getTenantColumnType() {
        return tenantColumnType;
    }

    public String getTimeColumn() {
        return timeColumn;
    }

    @Override
    public String toString() {
        return "TableSchema{" + name + ", columns=" + columns.keySet() + "}";
    }
}
