package com.aperture.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-local context for storing the current project (tenant) ID.
 *
 * The project ID is set by the request layer after authentication and read by
 * {@link com.aperture.query.execution.QueryService}, so that every compiled query is scoped to
 * the caller's project. Callers never pass a project ID in a query body.
 *
 * Usage:
 * <pre>
 * TenantContext.setProjectId(projectId);
 * try {
 *     queryService.runSql(sql);
 * } finally {
 *     TenantContext.clear();
 * }
 * </pre>
 *
 * @see ThreadLocal
 */
public final class TenantContext {

    private static final Logger log = LoggerFactory.getLogger(TenantContext.class);

    private static final ThreadLocal<String> PROJECT_ID = new ThreadLocal<>();

    private TenantContext() {
        throw new UnsupportedOperationException("TenantContext is a utility class and cannot be instantiated");
    }

    /**
     * Sets the project ID for the current thread.
     *
     * @param projectId the project ID to set, must not be null or empty
     * @throws IllegalArgumentException if projectId is null or empty
     */
    public static void setProjectId(String projectId) {
        if (projectId == null || projectId.trim().isEmpty()) {
            throw new IllegalArgumentException("Project ID must not be null or empty");
        }

        log.debug("Setting project ID: {}", projectId);
        PROJECT_ID.set(projectId.trim());
    }

    /**
     * @return the project ID for the current thread, or null if not set
     */
    public static String getProjectId() {
        return PROJECT_ID.get();
    }

    /**
     * Clears the project ID for the current thread. Must be called at the end of request
     * processing; pooled threads otherwise carry the previous request's project.
     */
    public static void clear() {
        String projectId = PROJECT_ID.get();
        if (projectId != null) {
            log.debug("Clearing project ID: {}", projectId);
        }
        PROJECT_ID.remove();
    }

    public static boolean isSet() {
        return PROJECT_ID.get() != null;
    }

    /**
     * Gets the project ID for the current thread, throwing an exception if none is set.
     *
     * @return the project ID for the current thread
     * @throws IllegalStateException if no project ID is set
     */
    public static String requireProjectId() {
        String projectId = getProjectId();
        if (projectId == null) {
            throw new IllegalStateException("No project ID set in current context");
        }
        return projectId;
    }
}
