package com.aperture.query.execution;

import com.aperture.query.CompiledQuery;
import com.aperture.query.TenantScope;

/**
 * Runs a compiled query against the analytics store. Implementations never retry.
 */
public interface QueryExecutor {

    /**
     * @throws QueryExecutionException when the store rejects or fails the query, or when the
     *                                 query was not compiled for {@code tenant}
     */
    QueryResult execute(CompiledQuery query, TenantScope tenant);
}
