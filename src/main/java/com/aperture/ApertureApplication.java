package com.aperture;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Aperture query layer.
 *
 * Aperture compiles dashboard queries over LLM observability data (spans, traces, events,
 * evaluations and datasets) into tenant-scoped, parameterized ClickHouse SQL.
 *
 * Key Features:
 * - Validation and tenant-scoping of user-written SQL
 * - Structured chart and table queries with filters, buckets and pagination
 * - Relative and absolute time range resolution
 * - CSV and JSON export of query results
 */
@SpringBootApplication
public class ApertureApplication {

    /**
     * Main entry point for the Aperture query application.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(ApertureApplication.class, args);
    }
}
