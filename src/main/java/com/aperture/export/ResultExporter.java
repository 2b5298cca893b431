package com.aperture.export;

import com.aperture.query.execution.QueryResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serializes query results for download.
 *
 * <p>CSV columns follow the key order of the first row, with a header line. Nested values
 * (maps, lists, arrays) are written as JSON text inside the cell. A null value leaves the cell
 * empty while an empty string is written quoted ({@code ""}), so the two stay apart as they do in
 * the JSON export. JSON export is an array of row objects. Both formats carry the same records.
 */
@Component
public class ResultExporter {

    private static final Logger logger = LoggerFactory.getLogger(ResultExporter.class);

    private final ObjectMapper jsonMapper;
    private final CsvMapper csvMapper;

    public ResultExporter() {
        this.jsonMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.csvMapper = new CsvMapper();
    }

    public String export(QueryResult result, ExportFormat format) {
        try {
            return switch (format) {
                case CSV -> toCsv(result);
                case JSON -> jsonMapper.writeValueAsString(result.getRows());
            };
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to export " + result.getRowCount() + " rows as " + format, e);
        }
    }

    public void export(QueryResult result, ExportFormat format, OutputStream out) throws IOException {
        out.write(export(result, format).getBytes(StandardCharsets.UTF_8));
        logger.debug("Exported {} rows as {}", result.getRowCount(), format);
    }

    private String toCsv(QueryResult result) throws JsonProcessingException {
        List<String> columns = result.getColumns();
        if (columns.isEmpty()) {
            return "";
        }
        CsvSchema.Builder schema = CsvSchema.builder().setUseHeader(true);
        for (String column : columns) {
            schema.addColumn(column);
        }
        List<Map<String, Object>> cells = new ArrayList<>(result.getRowCount());
        for (Map<String, Object> row : result.getRows()) {
            Map<String, Object> flat = new LinkedHashMap<>();
            for (String column : columns) {
                flat.put(column, cell(row.get(column)));
            }
            cells.add(flat);
        }
        return csvMapper.writer(schema.build())
            .with(CsvGenerator.Feature.ALWAYS_QUOTE_EMPTY_STRINGS)
            .writeValueAsString(cells);
    }

    private Object cell(Object value) throws JsonProcessingException {
        if (value == null) {
            return null;
        }
        if (value instanceof Map || value instanceof Collection || value.getClass().isArray()) {
            return jsonMapper.writeValueAsString(value);
        }
        if (value instanceof Number || value instanceof Boolean || value instanceof String) {
            return value;
        }
        return value.toString();
    }
}
