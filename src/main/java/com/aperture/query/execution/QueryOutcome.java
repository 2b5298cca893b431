package com.aperture.query.execution;

import com.aperture.query.CompilationResult;
import com.aperture.query.QueryRejection;

import java.util.List;

/**
 * Compilation result plus, when the query compiled, the rows it returned.
 */
public class QueryOutcome {

    private final CompilationResult compilation;
    private final QueryResult result;

    private QueryOutcome(CompilationResult compilation, QueryResult result) {
        this.compilation = compilation;
        this.result = result;
    }

    static QueryOutcome executed(CompilationResult compilation, QueryResult result) {
        return new QueryOutcome(compilation, result);
    }

    static QueryOutcome rejected(CompilationResult compilation) {
        return new QueryOutcome(compilation, null);
    }

    public boolean isSuccess() {
        return result != null;
    }

    public CompilationResult getCompilation() {
        return compilation;
    }

    public QueryResult getResult() {
        return result;
    }

    public List<String> getWarnings() {
        return compilation.getWarnings();
    }

    public QueryRejection getRejection() {
        return compilation.getRejection();
    }
}
