package com.aperture.query;

import java.util.Objects;

/**
 * The project every compiled query is confined to. The id is opaque; it only ever
 * reaches SQL as a bound parameter.
 */
public final class TenantScope {

    private final String projectId;

    private TenantScope(String projectId) {
        this.projectId = projectId;
    }

    public static TenantScope of(String projectId) {
        if (projectId == null || projectId.trim().isEmpty()) {
            throw new IllegalArgumentException("Tenant scope requires a non-blank project id");
        }
        return new TenantScope(projectId.trim());
    }

    public String getProjectId() {
        return projectId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return projectId.equals(((TenantScope) o).projectId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(projectId);
    }

    @Override
    public String toString() {
        return "TenantScope{" + projectId + "}";
    }
}
