package com.aperture.query.sql;

import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;

import java.util.Objects;

/**
 * A column mentioned in an expression, with its optional table qualifier and the AST node it came from.
 */
public class ColumnReference {

    private final String qualifier;
    private final String columnName;
    private final Column node;

    public ColumnReference(String qualifier, String columnName, Column node) {
        this.qualifier = qualifier;
        this.columnName = columnName;
        this.node = node;
    }

    static ColumnReference of(Column column) {
        Table table = column.getTable();
        String qualifier = null;
        if (table != null && table.getName() != null && !table.getName().isEmpty()) {
            qualifier = table.getFullyQualifiedName();
        }
        return new ColumnReference(qualifier, column.getColumnName(), column);
    }

    public String getQualifier() {
        return qualifier;
    }

    public String getColumnName() {
        return columnName;
    }

    public Column getNode() {
        return node;
    }

    public boolean isQualified() {
        return qualifier != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ColumnReference that = (ColumnReference) o;
        return Objects.equals(qualifier, that.qualifier) && Objects.equals(columnName, that.columnName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(qualifier, columnName);
    }

    @Override
    public String toString() {
        return qualifier != null ? qualifier + "." + columnName : columnName;
    }
}
