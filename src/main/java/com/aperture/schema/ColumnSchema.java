package com.aperture.schema;

import java.util.Objects;

/**
 * A column exposed to queries.
 *
 * <p>{@code selectExpression} is what appears in SELECT lists (it may differ from the physical
 * column, e.g. a truncated payload or a computed duration). {@code filterExpression}, when set,
 * is used in WHERE clauses instead. Derived columns have no physical counterpart, so their
 * select expression is substituted even for hand-written SQL.
 */
public class ColumnSchema {

    private final String name;
    private final SemanticType type;
    private final String selectExpression;
    private final String filterExpression;
    private final boolean filterable;
    private final boolean sortable;
    private final DbType dbType;
    private final boolean derived;

    private ColumnSchema(Builder builder) {
        this.name = builder.name;
        this.type = builder.type;
        this.selectExpression = builder.selectExpression != null ? builder.selectExpression : builder.name;
        this.filterExpression = builder.filterExpression;
        this.filterable = builder.filterable;
        this.sortable = builder.sortable;
        this.dbType = builder.dbType;
        this.derived = builder.derived;
    }

    public static Builder builder(String name, SemanticType type, DbType dbType) {
        return new Builder(name, type, dbType);
    }

    public String getName() {
        return name;
    }

    public SemanticType getType() {
        return type;
    }

    public String getSelectExpression() {
        return selectExpression;
    }

    public String getFilterExpression() {
        return filterExpression != null ? filterExpression : selectExpression;
    }

    public boolean isFilterable() {
        return filterable;
    }

    public boolean isSortable() {
        return sortable;
    }

    public DbType getDbType() {
        return dbType;
    }

    public boolean isDerived() {
        return derived;
    }

    /**
     * True when the SELECT list renders something other than the bare column name.
     */
    public boolean hasSelectExpression() {
        return !selectExpression.equals(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ColumnSchema that = (ColumnSchema) o;
        return filterable == that.filterable
            && sortable == that.sortable
            && derived == that.derived
            && name.equals(that.name)
            && type == that.type
            && selectExpression.equals(that.selectExpression)
            && Objects.equals(filterExpression, that.filterExpression)
            && dbType == that.dbType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, selectExpression, filterExpression, filterable, sortable, dbType, derived);
    }

    @Override
    public String toString() {
        return "ColumnSchema{" + name + " " + type + "/" + dbType.getClickHouseName() + "}";
    }

    public static class Builder {
        private final String name;
        private final SemanticType type;
        private final DbType dbType;
        private String selectExpression;
        private String filterExpression;
        private boolean filterable = true;
        private boolean sortable = true;
        private boolean derived;

        private Builder(String name, SemanticType type, DbType dbType) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Column name must not be blank");
            }
            this.name = name;
            this.type = Objects.requireNonNull(type, "type");
            this.dbType = Objects.requireNonNull(dbType, "dbType");
        }

        public Builder selectExpression(String selectExpression) {
            this.selectExpression = selectExpression;
            return this;
        }

        public Builder filterExpression(String filterExpression) {
            this.filterExpression = filterExpression;
            return this;
        }

        public Builder filterable(boolean filterable) {
            this.filterable = filterable;
            return this;
        }

        public Builder sortable(boolean sortable) {
            this.sortable = sortable;
            return this;
        }

        /**
         * Marks the column as computed: the select expression replaces every reference to it.
         */
        public Builder derived(String expression) {
            this.selectExpression = expression;
            this.derived = true;
            return this;
        }

        public ColumnSchema build() {
            return new ColumnSchema(this);
        }
    }
}
