package com.aperture.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, declarative {@link SchemaRegistry}.
 *
 * <p>{@link #defaultRegistry()} lists the tables the dashboard query surface exposes. Every table
 * carries a hidden {@code project_id} tenant column which is deliberately absent from the
 * column lists below.
 */
public class StaticSchemaRegistry implements SchemaRegistry {

    static final String DURATION_EXPRESSION =
        "(toUnixTimestamp64Nano(end_time) - toUnixTimestamp64Nano(start_time)) / 1000000000";

    private static final int PAYLOAD_PREVIEW_LENGTH = 1000;

    private final Map<String, TableSchema> tables;

    public StaticSchemaRegistry(List<TableSchema> tables) {
        Map<String, TableSchema> byName = new LinkedHashMap<>();
        for (TableSchema table : tables) {
            if (byName.put(table.getName().toLowerCase(Locale.ROOT), table) != null) {
                throw new IllegalArgumentException("Duplicate table '" + table.getName() + "'");
            }
        }
        this.tables = Collections.unmodifiableMap(byName);
    }

    @Override
    public Optional<TableSchema> resolveTable(String tableName) {
        if (tableName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tables.get(tableName.toLowerCase(Locale.ROOT)));
    }

    @Override
    public Set<String> tableNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(tables.keySet()));
    }

    public static StaticSchemaRegistry defaultRegistry() {
        List<TableSchema> tables = new ArrayList<>();
        tables.add(spans());
        tables.add(traces());
        tables.add(events());
        tables.add(tags());
        tables.add(evaluationDatapoints());
        tables.add(evaluationScores());
        tables.add(datasetDatapoints("dataset_datapoints", "Current datapoints of datasets"));
        tables.add(datasetDatapoints("dataset_datapoint_versions", "Every stored version of dataset datapoints"));
        return new StaticSchemaRegistry(tables);
    }

    private static TableSchema spans() {
        List<ColumnSchema> columns = new ArrayList<>();
        columns.add(uuid("span_id"));
        columns.add(string("status"));
        columns.add(string("name"));
        columns.add(string("path"));
        columns.add(uuid("parent_span_id"));
        columns.add(ColumnSchema.builder("span_type", SemanticType.NUMBER, DbType.UINT32).build());
        columns.add(datetime("start_time"));
        columns.add(datetime("end_time"));
        columns.add(duration());
        columns.add(payload("input"));
        columns.add(payload("output"));
        columns.add(string("request_model"));
        columns.add(string("response_model"));
        columns.add(string("model"));
        columns.add(string("provider"));
        addUsageColumns(columns);
        columns.add(json("attributes"));
        columns.add(uuid("trace_id"));
        columns.add(stringArray("tags"));
        return new TableSchema("spans", "Individual operations recorded inside a trace", columns, "start_time");
    }

    private static TableSchema traces() {
        List<ColumnSchema> columns = new ArrayList<>();
        columns.add(uuid("id"));
        columns.add(ColumnSchema.builder("trace_type", SemanticType.NUMBER, DbType.UINT32).build());
        columns.add(json("metadata"));
        columns.add(datetime("start_time"));
        columns.add(datetime("end_time"));
        columns.add(duration());
        addUsageColumns(columns);
        columns.add(string("status"));
        columns.add(string("user_id"));
        columns.add(string("session_id"));
        columns.add(uuid("top_span_id"));
        columns.add(string("top_span_name"));
        columns.add(ColumnSchema.builder("top_span_type", SemanticType.NUMBER, DbType.UINT32).build());
        columns.add(stringArray("tags"));
        return new TableSchema("traces", "End-to-end executions aggregated from their spans", columns, "start_time");
    }

    private static TableSchema events() {
        List<ColumnSchema> columns = new ArrayList<>();
        columns.add(uuid("id"));
        columns.add(uuid("span_id"));
        columns.add(string("name"));
        columns.add(datetime("timestamp"));
        columns.add(json("attributes"));
        columns.add(uuid("trace_id"));
        columns.add(string("user_id"));
        columns.add(string("session_id"));
        return new TableSchema("events", "Point-in-time events attached to spans", columns, "timestamp");
    }

    private static TableSchema tags() {
        List<ColumnSchema> columns = new ArrayList<>();
        columns.add(uuid("id"));
        columns.add(uuid("span_id"));
        columns.add(string("name"));
        columns.add(datetime("created_at"));
        columns.add(string("source"));
        return new TableSchema("tags", "Labels attached to spans", columns, "created_at");
    }

    private static TableSchema evaluationDatapoints() {
        List<ColumnSchema> columns = new ArrayList<>();
        columns.add(uuid("id"));
        columns.add(uuid("evaluation_id"));
        columns.add(uuid("trace_id"));
        columns.add(datetime("created_at"));
        columns.add(json("data"));
        columns.add(json("target"));
        columns.add(json("metadata"));
        columns.add(json("executor_output"));
        columns.add(ColumnSchema.builder("index", SemanticType.NUMBER, DbType.INT64).build());
        columns.add(string("group_id"));
        columns.add(json("scores"));
        return new TableSchema("evaluation_datapoints", "Results of evaluation runs, one row per datapoint", columns, "created_at");
    }

    private static TableSchema evaluationScores() {
        List<ColumnSchema> columns = new ArrayList<>();
        columns.add(uuid("id"));
        columns.add(uuid("result_id"));
        columns.add(string("name"));
        columns.add(ColumnSchema.builder("score", SemanticType.NUMBER, DbType.FLOAT64).build());
        columns.add(datetime("created_at"));
        return new TableSchema("evaluation_scores", "Named numeric scores of evaluation results", columns, "created_at");
    }

    private static TableSchema datasetDatapoints(String name, String description) {
        List<ColumnSchema> columns = new ArrayList<>();
        columns.add(uuid("id"));
        columns.add(datetime("created_at"));
        columns.add(uuid("dataset_id"));
        columns.add(json("data"));
        columns.add(json("target"));
        columns.add(json("metadata"));
        return new TableSchema(name, description, columns, "created_at");
    }

    private static void addUsageColumns(List<ColumnSchema> columns) {
        columns.add(ColumnSchema.builder("input_tokens", SemanticType.NUMBER, DbType.INT64).build());
        columns.add(ColumnSchema.builder("output_tokens", SemanticType.NUMBER, DbType.INT64).build());
        columns.add(ColumnSchema.builder("total_tokens", SemanticType.NUMBER, DbType.INT64).build());
        columns.add(ColumnSchema.builder("input_cost", SemanticType.NUMBER, DbType.FLOAT64).build());
        columns.add(ColumnSchema.builder("output_cost", SemanticType.NUMBER, DbType.FLOAT64).build());
        columns.add(ColumnSchema.builder("total_cost", SemanticType.NUMBER, DbType.FLOAT64).build());
    }

    private static ColumnSchema duration() {
        return ColumnSchema.builder("duration", SemanticType.NUMBER, DbType.FLOAT64)
            .derived(DURATION_EXPRESSION)
            .build();
    }

    // Payloads are previewed in result sets but filtered on their full text.
    private static ColumnSchema payload(String name) {
        return ColumnSchema.builder(name, SemanticType.STRING, DbType.STRING)
            .selectExpression("substring(" + name + ", 1, " + PAYLOAD_PREVIEW_LENGTH + ")")
            .filterExpression(name)
            .sortable(false)
            .build();
    }

    private static ColumnSchema string(String name) {
        return ColumnSchema.builder(name, SemanticType.STRING, DbType.STRING).build();
    }

    private static ColumnSchema uuid(String name) {
        return ColumnSchema.builder(name, SemanticType.STRING, DbType.UUID).build();
    }

    private static ColumnSchema datetime(String name) {
        return ColumnSchema.builder(name, SemanticType.DATETIME, DbType.DATETIME64).build();
    }

    private static ColumnSchema json(String name) {
        return ColumnSchema.builder(name, SemanticType.JSON, DbType.STRING)
            .sortable(false)
            .build();
    }

    private static ColumnSchema stringArray(String name) {
        return ColumnSchema.builder(name, SemanticType.STRING, DbType.ARRAY_STRING)
            .sortable(false)
            .build();
    }
}
