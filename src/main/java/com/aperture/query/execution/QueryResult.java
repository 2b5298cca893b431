package com.aperture.query.execution;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Rows returned by one query execution. Column order follows the first row.
 */
public class QueryResult {

    @JsonProperty("rows")
    private final List<Map<String, Object>> rows;

    @JsonProperty("columns")
    private final List<String> columns;

    @JsonProperty("execution_time_ms")
    private final long executionTimeMs;

    public QueryResult(List<Map<String, Object>> rows, long executionTimeMs) {
        this.rows = rows != null ? Collections.unmodifiableList(new ArrayList<>(rows)) : Collections.emptyList();
        this.columns = this.rows.isEmpty()
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(this.rows.get(0).keySet())));
        this.executionTimeMs = executionTimeMs;
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public List<String> getColumns() {
        return columns;
    }

    @JsonProperty("row_count")
    public int getRowCount() {
        return rows.size();
    }

    public long getExecutionTimeMs() {
        return executionTimeMs;
    }

    @Override
    public String toString() {
        return "QueryResult{rows=" + rows.size() + ", columns=" + columns + ", executionTimeMs=" + executionTimeMs + "}";
    }
}
