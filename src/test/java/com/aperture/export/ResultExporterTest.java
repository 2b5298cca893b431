package com.aperture.export;

import com.aperture.query.execution.QueryResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ResultExporter")
class ResultExporterTest {

    private final ResultExporter exporter = new ResultExporter();

    private static QueryResult sample() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("name", "llm.call");
        first.put("tokens", 12L);
        first.put("meta", Map.of("env", "prod"));
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("name", "a,b");
        second.put("tokens", null);
        second.put("meta", null);
        return new QueryResult(List.of(first, second), 5);
    }

    @Test
    @DisplayName("should write a header and one line per row")
    void shouldExportCsv() {
        // When
        String[] lines = exporter.export(sample(), ExportFormat.CSV).split("\n");

        // Then
        assertThat(lines).hasSize(3);
        assertThat(lines[0]).isEqualTo("name,tokens,meta");
        assertThat(lines[1]).isEqualTo("llm.call,12,\"{\"\"env\"\":\"\"prod\"\"}\"");
        assertThat(lines[2]).isEqualTo("\"a,b\",,");
    }

    @Test
    @DisplayName("should keep null apart from the empty string")
    void shouldDistinguishNullFromEmpty() throws Exception {
        // Given
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("name", "");
        row.put("model", null);
        QueryResult result = new QueryResult(List.of(row), 1);

        // When
        String[] lines = exporter.export(result, ExportFormat.CSV).split("\n");
        JsonNode json = new ObjectMapper().readTree(exporter.export(result, ExportFormat.JSON));

        // Then
        assertThat(lines[1]).isEqualTo("\"\",");
        assertThat(json.get(0).get("name").asText()).isEmpty();
        assertThat(json.get(0).get("model").isNull()).isTrue();
    }

    @Test
    @DisplayName("should export an array of row objects as JSON")
    void shouldExportJson() throws Exception {
        // When
        JsonNode json = new ObjectMapper().readTree(exporter.export(sample(), ExportFormat.JSON));

        // Then
        assertThat(json.isArray()).isTrue();
        assertThat(json.size()).isEqualTo(2);
        assertThat(json.get(0).get("name").asText()).isEqualTo("llm.call");
        assertThat(json.get(0).get("meta").get("env").asText()).isEqualTo("prod");
        assertThat(json.get(1).get("tokens").isNull()).isTrue();
    }

    @Test
    @DisplayName("should carry the same records in both formats")
    void shouldExportSameRecordsInBothFormats() throws Exception {
        // Given
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("model", "model-" + i);
            row.put("count", (long) i * 10);
            row.put("cost", i + 0.25);
            rows.add(row);
        }
        QueryResult result = new QueryResult(rows, 2);

        // When
        String csv = exporter.export(result, ExportFormat.CSV);
        JsonNode json = new ObjectMapper().readTree(exporter.export(result, ExportFormat.JSON));
        MappingIterator<Map<String, String>> csvRows = new CsvMapper()
            .readerFor(Map.class)
            .with(CsvSchema.emptySchema().withHeader())
            .readValues(csv);
        List<Map<String, String>> fromCsv = csvRows.readAll();

        // Then
        assertThat(fromCsv).hasSize(json.size());
        for (int i = 0; i < fromCsv.size(); i++) {
            for (String column : result.getColumns()) {
                assertThat(fromCsv.get(i).get(column)).isEqualTo(json.get(i).get(column).asText());
            }
        }
    }

    @Test
    @DisplayName("should export nothing for an empty result")
    void shouldExportEmptyResult() {
        QueryResult empty = new QueryResult(List.of(), 1);

        assertThat(exporter.export(empty, ExportFormat.CSV)).isEmpty();
        assertThat(exporter.export(empty, ExportFormat.JSON)).isEqualTo("[]");
    }

    @Test
    @DisplayName("should write UTF-8 to a stream")
    void shouldWriteToStream() throws Exception {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("name", "über");
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        exporter.export(new QueryResult(List.of(row), 1), ExportFormat.CSV, out);

        assertThat(out.toString(StandardCharsets.UTF_8)).isEqualTo("name\nüber\n");
    }

    @Test
    @DisplayName("should resolve formats by name or extension")
    void shouldParseFormat() {
        assertThat(ExportFormat.fromString("csv")).isEqualTo(ExportFormat.CSV);
        assertThat(ExportFormat.fromString("JSON")).isEqualTo(ExportFormat.JSON);
        assertThat(ExportFormat.CSV.getContentType()).isEqualTo("text/csv");
        assertThatThrownBy(() -> ExportFormat.fromString("xlsx")).isInstanceOf(IllegalArgumentException.class);
    }
}
