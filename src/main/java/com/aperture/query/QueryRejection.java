package com.aperture.query;

import java.util.Objects;

public class QueryRejection {

    private final ErrorKind kind;
    private final String message;

    public QueryRejection(ErrorKind kind, String message) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = message;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QueryRejection that = (QueryRejection) o;
        return kind == that.kind && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, message);
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
