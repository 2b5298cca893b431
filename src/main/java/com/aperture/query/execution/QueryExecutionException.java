package com.aperture.query.execution;

/**
 * Exception thrown when a compiled query cannot be executed.
 * Carries the SQL text for diagnostics; parameter values are never included.
 */
public class QueryExecutionException extends RuntimeException {

    private final String query;

    public QueryExecutionException(String message) {
        super(message);
        this.query = null;
    }

    public QueryExecutionException(String message, String query, Throwable cause) {
        super(message, cause);
        this.query = query;
    }

    public String getQuery() {
        return query;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (query != null) {
            sb.append(" [Query: ").append(query).append("]");
        }
        return sb.toString();
    }
}
