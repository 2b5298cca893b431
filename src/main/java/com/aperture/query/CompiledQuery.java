package com.aperture.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Executable query text plus its named parameters. Every user-supplied value lives in
 * {@link #getParameters()}; the SQL references them as {@code :name}.
 */
public class CompiledQuery {

    private final String sql;
    private final Map<String, QueryParameter> parameters;

    public CompiledQuery(String sql, Map<String, QueryParameter> parameters) {
        this.sql = Objects.requireNonNull(sql, "sql");
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public String getSql() {
        return sql;
    }

    public Map<String, QueryParameter> getParameters() {
        return parameters;
    }

    public QueryParameter getParameter(String name) {
        return parameters.get(name);
    }

    /**
     * Parameter values without type tags, in declaration order.
     */
    public Map<String, Object> getParameterValues() {
        Map<String, Object> values = new LinkedHashMap<>();
        parameters.forEach((name, parameter) -> values.put(name, parameter.getValue()));
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CompiledQuery that = (CompiledQuery) o;
        return sql.equals(that.sql) && parameters.equals(that.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sql, parameters);
    }

    @Override
    public String toString() {
        return "CompiledQuery{sql='" + sql + "', parameters=" + parameters + "}";
    }
}
