package com.specsync.core.store;

import com.specsync.core.model.Requirement;
import com.specsync.core.model.Scope;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Persistence for evaluated requirements, keyed by component id and requirement name.
 *
 * <p>Requirements are never updated in place: callers clear and recreate them. All
 * operations are confined to a {@link Scope}.
 */
public interface RequirementStore {

    /**
     * Stores a new requirement.
     *
     * @param scope tenant and project
     * @param requirement requirement to store
     * @return the stored requirement
     * @throws RequirementStoreException if a requirement with the same component and name exists,
     *         or the write fails
     */
    Requirement create(Scope scope, Requirement requirement);

    /**
     * Removes every requirement of one component.
     *
     * @param scope tenant and project
     * @param componentId component id
     */
    void clearAll(Scope scope, String componentId);

    /**
     * Removes requirements with the given names from the given components.
     *
     * @param scope tenant and project
     * @param componentIds component ids
     * @param names requirement names to remove
     */
    void clearByNames(Scope scope, Collection<String> componentIds, Set<String> names);

    /**
     * Removes every requirement in the scope.
     *
     * @param scope tenant and project
     */
    void clearProject(Scope scope);

    List<Requirement> listForComponent(Scope scope, String componentId);

    /**
     * Returns every stored requirement in the scope, grouped by component id.
     *
     * @param scope tenant and project
     * @return requirements per component
     */
    Map<String, List<Requirement>> listAll(Scope scope);

    /**
     * Atomically replaces a component's requirements.
     *
     * @param scope tenant and project
     * @param componentId component id
     * @param requirements new requirements
     */
    void replaceAll(Scope scope, String componentId, List<Requirement> requirements);

    /**
     * Returns ids of components with at least one unsatisfied requirement.
     *
     * @param scope tenant and project
     * @return component ids
     */
    default List<String> componentsWithUnsatisfiedRequirements(Scope scope) {
        return listAll(scope).entrySet().stream()
            .filter(entry -> entry.getValue().stream().anyMatch(requirement -> !requirement.satisfied()))
            .map(Map.Entry::getKey)
            .toList();
    }
}
