package com.specsync.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A designed unit of the system whose completion is tracked.
 *
 * <p>Dependency edges are not held on the component; see {@link Dependency}. The
 * parent reference forms a forest across a project's components.
 *
 * @param id unique identifier (generated via IdGenerator when absent)
 * @param name short display name
 * @param moduleName fully qualified module name, unique within the project
 * @param type component type
 * @param parentId id of the parent component, null for roots
 * @param description optional description
 * @param status latest derived file and test status
 * @param requirements evaluated requirements, in catalogue order
 */
public record Component(
    String id,
    String name,
    String moduleName,
    ComponentType type,
    String parentId,
    String description,
    ComponentStatus status,
    List<Requirement> requirements
) {

    /**
     * Compact constructor with validation.
     */
    public Component {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(moduleName, "moduleName must not be null");
        if (type == null) {
            type = ComponentType.UNKNOWN;
        }
        if (name == null || name.isBlank()) {
            int lastDot = moduleName.lastIndexOf('.');
            name = lastDot >= 0 ? moduleName.substring(lastDot + 1) : moduleName;
        }
        if (status == null) {
            status = ComponentStatus.unknown();
        }
        requirements = requirements == null ? List.of() : List.copyOf(requirements);
    }

    /**
     * Creates a component with no status and no requirements yet.
     *
     * @param id component id
     * @param moduleName fully qualified module name
     * @param type component type
     * @param parentId parent id, may be null
     * @return new component
     */
    public static Component of(String id, String moduleName, ComponentType type, String parentId) {
        return new Component(id, null, moduleName, type, parentId, null, null, List.of());
    }

    public Component withStatus(ComponentStatus newStatus) {
        return new Component(id, name, moduleName, type, parentId, description, newStatus, requirements);
    }

    public Component withRequirements(List<Requirement> newRequirements) {
        return new Component(id, name, moduleName, type, parentId, description, status, newRequirements);
    }

    /**
     * Returns whether every requirement is satisfied. A component without requirements counts as complete.
     *
     * @return true when no requirement is unsatisfied
     */
    public boolean allRequirementsSatisfied() {
        return requirements.stream().allMatch(Requirement::satisfied);
    }
}
