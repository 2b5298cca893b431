package com.aperture.query.builder;

import java.util.Objects;

/**
 * Folds name/value rows of a second table into one {@code Map(String, Float64)} per row of the
 * main table, e.g. all evaluation scores of an evaluation result.
 * The side table is aggregated per {@code keyColumn} and LEFT JOINed on {@code joinColumn = keyColumn}.
 */
public class SideAggregation {

    private final String table;
    private final String keyColumn;
    private final String nameColumn;
    private final String valueColumn;
    private final String joinColumn;
    private final String alias;

    public SideAggregation(String table, String keyColumn, String nameColumn, String valueColumn,
                           String joinColumn, String alias) {
        this.table = Objects.requireNonNull(table, "table");
        this.keyColumn = Objects.requireNonNull(keyColumn, "keyColumn");
        this.nameColumn = Objects.requireNonNull(nameColumn, "nameColumn");
        this.valueColumn = Objects.requireNonNull(valueColumn, "valueColumn");
        this.joinColumn = Objects.requireNonNull(joinColumn, "joinColumn");
        this.alias = Objects.requireNonNull(alias, "alias");
    }

    public String getTable() {
        return table;
    }

    public String getKeyColumn() {
        return keyColumn;
    }

    public String getNameColumn() {
        return nameColumn;
    }

    public String getValueColumn() {
        return valueColumn;
    }

    public String getJoinColumn() {
        return joinColumn;
    }

    public String getAlias() {
        return alias;
    }
}
