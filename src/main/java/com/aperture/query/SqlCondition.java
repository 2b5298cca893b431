package com.aperture.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A boolean SQL fragment and the parameters it references.
 */
public class SqlCondition {

    private final String sql;
    private final Map<String, QueryParameter> parameters;

    public SqlCondition(String sql, Map<String, QueryParameter> parameters) {
        this.sql = Objects.requireNonNull(sql, "sql");
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static SqlCondition of(String sql) {
        return new SqlCondition(sql, Collections.emptyMap());
    }

    public String getSql() {
        return sql;
    }

    public Map<String, QueryParameter> getParameters() {
        return parameters;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SqlCondition that = (SqlCondition) o;
        return sql.equals(that.sql) && parameters.equals(that.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sql, parameters);
    }

    @Override
    public String toString() {
        return sql + " " + parameters;
    }
}
