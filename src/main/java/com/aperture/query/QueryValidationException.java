package com.aperture.query;

/**
 * Thrown inside the compilers when user input cannot be turned into a safe query.
 * Public compiler entry points convert it into a {@link QueryRejection}.
 */
public class QueryValidationException extends RuntimeException {

    private final ErrorKind kind;

    public QueryValidationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public QueryValidationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
