package com.specsync.core.graph;

import com.specsync.core.model.Dependency;

import java.util.List;
import java.util.Objects;

/**
 * A cycle in the dependency graph.
 *
 * @param componentIds ids along the cycle, first and last equal
 * @param edges edges forming the cycle, in order
 * @param description readable form such as {@code "A -> B -> A"}
 */
public record DependencyCycle(List<String> componentIds, List<Dependency> edges, String description) {

    public DependencyCycle {
        Objects.requireNonNull(componentIds, "componentIds must not be null");
        componentIds = List.copyOf(componentIds);
        edges = edges == null ? List.of() : List.copyOf(edges);
        if (description == null) {
            description = String.join(" -> ", componentIds);
        }
    }
}
