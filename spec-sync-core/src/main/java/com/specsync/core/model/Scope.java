package com.specsync.core.model;

import java.util.Objects;

/**
 * Tenant and project a synchronization pass or store operation is confined to.
 *
 * @param tenantId owning account identifier
 * @param projectId project identifier
 */
public record Scope(String tenantId, String projectId) {

    public Scope {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(projectId, "projectId must not be null");
    }

    /**
     * Returns a stable key for locking and storage partitioning.
     *
     * @return {@code tenantId/projectId}
     */
    public String key() {
        return tenantId + "/" + projectId;
    }
}
