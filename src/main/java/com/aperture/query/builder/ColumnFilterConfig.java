package com.aperture.query.builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Chooses the {@link ColumnFilterProcessor} for each column: a per-column override if one is
 * registered, otherwise the default processor.
 */
public class ColumnFilterConfig {

    private final Map<String, ColumnFilterProcessor> processors;
    private final ColumnFilterProcessor defaultProcessor;

    public ColumnFilterConfig(Map<String, ColumnFilterProcessor> processors, ColumnFilterProcessor defaultProcessor) {
        Map<String, ColumnFilterProcessor> byColumn = new LinkedHashMap<>();
        processors.forEach((column, processor) -> byColumn.put(column.toLowerCase(Locale.ROOT), processor));
        this.processors = Collections.unmodifiableMap(byColumn);
        this.defaultProcessor = Objects.requireNonNull(defaultProcessor, "defaultProcessor");
    }

    public static ColumnFilterConfig defaults() {
        return new ColumnFilterConfig(Collections.emptyMap(), FilterProcessors.byType());
    }

    public ColumnFilterConfig withProcessor(String column, ColumnFilterProcessor processor) {
        Map<String, ColumnFilterProcessor> next = new LinkedHashMap<>(processors);
        next.put(column, processor);
        return new ColumnFilterConfig(next, defaultProcessor);
    }

    public ColumnFilterProcessor processorFor(String column) {
        return processors.getOrDefault(column.toLowerCase(Locale.ROOT), defaultProcessor);
    }
}
