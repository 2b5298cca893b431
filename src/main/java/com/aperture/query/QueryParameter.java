package com.aperture.query;

import com.aperture.schema.DbType;

import java.util.Objects;

/**
 * A bound value together with the store type it is sent as.
 */
public class QueryParameter {

    private final Object value;
    private final DbType type;

    public QueryParameter(Object value, DbType type) {
        this.value = value;
        this.type = Objects.requireNonNull(type, "type");
    }

    public static QueryParameter of(Object value, DbType type) {
        return new QueryParameter(value, type);
    }

    public Object getValue() {
        return value;
    }

    public DbType getType() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QueryParameter that = (QueryParameter) o;
        return Objects.equals(value, that.value) && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, type);
    }

    @Override
    public String toString() {
        return value + "::" + type.getClickHouseName();
    }
}
