package com.specsync.core.model;

import java.util.Objects;

/**
 * Directed dependency edge between two components.
 *
 * <p>The source component depends on the target component. Self edges are rejected.
 *
 * @param sourceId id of the depending component
 * @param targetId id of the component depended upon
 */
public record Dependency(String sourceId, String targetId) {

    public Dependency {
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(targetId, "targetId must not be null");
        if (sourceId.equals(targetId)) {
            throw new IllegalArgumentException("Component cannot depend on itself: " + sourceId);
        }
    }
}
