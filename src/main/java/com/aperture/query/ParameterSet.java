package com.aperture.query;

import com.aperture.schema.DbType;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ordered collection of named parameters built up while compiling one query.
 * Generated names are deterministic: {@code prefix_0, prefix_1, ...} per prefix.
 */
public class ParameterSet {

    private final Map<String, QueryParameter> parameters = new LinkedHashMap<>();
    private final Map<String, Integer> counters = new HashMap<>();

    /**
     * Adds a parameter under a fixed name. Re-adding the same value is a no-op;
     * a conflicting value for an existing name is a programming error.
     */
    public String add(String name, Object value, DbType type) {
        QueryParameter parameter = new QueryParameter(value, type);
        QueryParameter existing = parameters.get(name);
        if (existing != null && !existing.equals(parameter)) {
            throw new IllegalStateException("Parameter '" + name + "' is already bound to a different value");
        }
        parameters.put(name, parameter);
        return name;
    }

    public String next(String prefix, Object value, DbType type) {
        String name;
        do {
            int index = counters.merge(prefix, 1, Integer::sum) - 1;
            name = prefix + "_" + index;
        } while (parameters.containsKey(name));
        return add(name, value, type);
    }

    public void addAll(Map<String, QueryParameter> other) {
        other.forEach((name, parameter) -> add(name, parameter.getValue(), parameter.getType()));
    }

    public QueryParameter get(String name) {
        return parameters.get(name);
    }

    public boolean contains(String name) {
        return parameters.containsKey(name);
    }

    public int size() {
        return parameters.size();
    }

    public Map<String, QueryParameter> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }
}
