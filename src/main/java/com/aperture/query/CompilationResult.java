package com.aperture.query;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of compiling user input: either a {@link CompiledQuery} with optional warnings,
 * or a {@link QueryRejection}. Never both.
 */
public class CompilationResult {

    private final CompiledQuery query;
    private final List<String> warnings;
    private final QueryRejection rejection;

    private CompilationResult(CompiledQuery query, List<String> warnings, QueryRejection rejection) {
        this.query = query;
        this.warnings = warnings;
        this.rejection = rejection;
    }

    public static CompilationResult success(CompiledQuery query, List<String> warnings) {
        return new CompilationResult(Objects.requireNonNull(query, "query"),
            Collections.unmodifiableList(List.copyOf(warnings)), null);
    }

    public static CompilationResult rejected(ErrorKind kind, String message) {
        return new CompilationResult(null, Collections.emptyList(), new QueryRejection(kind, message));
    }

    public static CompilationResult rejected(QueryValidationException e) {
        return rejected(e.getKind(), e.getMessage());
    }

    public boolean isValid() {
        return query != null;
    }

    public CompiledQuery getQuery() {
        return query;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public QueryRejection getRejection() {
        return rejection;
    }

    /**
     * @throws QueryValidationException carrying the rejection when compilation failed
     */
    public CompiledQuery orElseThrow() {
        if (query == null) {
            throw new QueryValidationException(rejection.getKind(), rejection.getMessage());
        }
        return query;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CompilationResult that = (CompilationResult) o;
        return Objects.equals(query, that.query)
            && warnings.equals(that.warnings)
            && Objects.equals(rejection, that.rejection);
    }

    @Override
    public int hashCode() {
        return Objects.hash(query, warnings, rejection);
    }

    @Override
    public String toString() {
        return isValid()
            ? "CompilationResult{valid, " + query + ", warnings=" + warnings + "}"
            : "CompilationResult{rejected, " + rejection + "}";
    }
}
