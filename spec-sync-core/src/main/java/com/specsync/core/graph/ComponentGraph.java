package com.specsync.core.graph;

import com.specsync.core.model.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Arena of a project's components indexed by id, with id-list adjacency.
 *
 * <p>The graph is immutable. Dependency and hierarchy links are attached by
 * {@link DependencyGraphBuilder} and {@link HierarchyTreeBuilder}; until then the
 * corresponding queries report the links as unavailable.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ComponentGraph graph = ComponentGraph.of(components);
 * graph = DependencyGraphBuilder.attach(graph, dependencies);
 * graph = HierarchyTreeBuilder.attach(graph);
 *
 * List<Component> deps = graph.dependenciesOf(id);
 * List<Component> subtree = graph.descendantsOf(id);
 * }</pre>
 */
public final class ComponentGraph {

    private final Map<String, Component> components;
    private final Map<String, List<String>> dependencies;
    private final Map<String, List<String>> dependents;
    private final Map<String, List<String>> children;
    private final boolean dependenciesAttached;
    private final boolean hierarchyAttached;

    private ComponentGraph(
            Map<String, Component> components,
            Map<String, List<String>> dependencies,
            Map<String, List<String>> dependents,
            Map<String, List<String>> children,
            boolean dependenciesAttached,
            boolean hierarchyAttached) {
        this.components = components;
        this.dependencies = dependencies;
        this.dependents = dependents;
        this.children = children;
        this.dependenciesAttached = dependenciesAttached;
        this.hierarchyAttached = hierarchyAttached;
    }

    /**
     * Creates a graph with no links attached.
     *
     * @param components components, ids must be unique
     * @return graph
     * @throws IllegalArgumentException on duplicate ids
     */
    public static ComponentGraph of(Collection<Component> components) {
        Objects.requireNonNull(components, "components must not be null");
        Map<String, Component> byId = new LinkedHashMap<>();
        for (Component component : components) {
            if (byId.put(component.id(), component) != null) {
                throw new IllegalArgumentException("Duplicate component id: " + component.id());
            }
        }
        return new ComponentGraph(Collections.unmodifiableMap(byId), Map.of(), Map.of(), Map.of(), false, false);
    }

    ComponentGraph withDependencyLinks(Map<String, List<String>> dependencies, Map<String, List<String>> dependents) {
        return new ComponentGraph(components, freeze(dependencies), freeze(dependents), children, true, hierarchyAttached);
    }

    ComponentGraph withChildLinks(Map<String, List<String>> children) {
        return new ComponentGraph(components, dependencies, dependents, freeze(children), dependenciesAttached, true);
    }

    /**
     * Returns a graph over new component snapshots with the same links.
     *
     * <p>Ids must match the current ids exactly.
     *
     * @param updated replacement snapshots
     * @return graph sharing this graph's adjacency
     */
    public ComponentGraph withComponents(Collection<Component> updated) {
        Map<String, Component> byId = new LinkedHashMap<>();
        for (Component component : updated) {
            byId.put(component.id(), component);
        }
        if (!byId.keySet().equals(components.keySet())) {
            throw new IllegalArgumentException("Replacement components must have the same ids");
        }
        Map<String, Component> ordered = new LinkedHashMap<>();
        components.keySet().forEach(id -> ordered.put(id, byId.get(id)));
        return new ComponentGraph(Collections.unmodifiableMap(ordered), dependencies, dependents, children,
            dependenciesAttached, hierarchyAttached);
    }

    /**
     * Returns a graph with one component snapshot replaced.
     *
     * @param updated replacement snapshot; its id must already be in the graph
     * @return graph sharing this graph's adjacency
     */
    public ComponentGraph withComponent(Component updated) {
        if (!components.containsKey(updated.id())) {
            throw new IllegalArgumentException("Unknown component id: " + updated.id());
        }
        Map<String, Component> byId = new LinkedHashMap<>(components);
        byId.put(updated.id(), updated);
        return new ComponentGraph(Collections.unmodifiableMap(byId), dependencies, dependents, children,
            dependenciesAttached, hierarchyAttached);
    }

    public List<Component> components() {
        return List.copyOf(components.values());
    }

    public Set<String> ids() {
        return components.keySet();
    }

    public int size() {
        return components.size();
    }

    public boolean contains(String id) {
        return components.containsKey(id);
    }

    public Optional<Component> component(String id) {
        return Optional.ofNullable(components.get(id));
    }

    public boolean hasDependencyGraph() {
        return dependenciesAttached;
    }

    public boolean hasHierarchy() {
        return hierarchyAttached;
    }

    public List<String> dependencyIds(String id) {
        return dependencies.getOrDefault(id, List.of());
    }

    public List<String> dependentIds(String id) {
        return dependents.getOrDefault(id, List.of());
    }

    public List<String> childIds(String id) {
        return children.getOrDefault(id, List.of());
    }

    public List<Component> dependenciesOf(String id) {
        return resolve(dependencyIds(id));
    }

    public List<Component> dependentsOf(String id) {
        return resolve(dependentIds(id));
    }

    public List<Component> childrenOf(String id) {
        return resolve(childIds(id));
    }

    /**
     * Returns the parent of a component, when the parent is part of this graph.
     *
     * @param id component id
     * @return parent component
     */
    public Optional<Component> parentOf(String id) {
        return component(id)
            .map(Component::parentId)
            .flatMap(this::component);
    }

    /**
     * Returns components whose parent is absent from this graph.
     *
     * @return root components in arena order
     */
    public List<Component> roots() {
        return components.values().stream()
            .filter(component -> component.parentId() == null || !components.containsKey(component.parentId()))
            .toList();
    }

    /**
     * Returns every descendant of a component, breadth first.
     *
     * @param id component id
     * @return descendants, excluding the component itself
     */
    public List<Component> descendantsOf(String id) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(childIds(id));
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current.equals(id) || !visited.add(current)) {
                continue;
            }
            queue.addAll(childIds(current));
        }
        return resolve(visited);
    }

    /**
     * Returns the chain from the root down to the component.
     *
     * @param id component id
     * @return path starting at the root and ending at the component
     */
    public List<Component> pathToRoot(String id) {
        List<Component> path = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Optional<Component> current = component(id);
        while (current.isPresent() && seen.add(current.get().id())) {
            path.add(0, current.get());
            current = parentOf(current.get().id());
        }
        return path;
    }

    /**
     * Returns whether {@code ancestorId} is a proper ancestor of {@code id}.
     *
     * @param ancestorId candidate ancestor
     * @param id component id
     * @return true if the candidate lies on the path to the root, false for the component itself
     */
    public boolean isAncestor(String ancestorId, String id) {
        if (ancestorId.equals(id)) {
            return false;
        }
        return pathToRoot(id).stream().anyMatch(component -> component.id().equals(ancestorId));
    }

    private List<Component> resolve(Collection<String> ids) {
        return ids.stream()
            .map(components::get)
            .filter(Objects::nonNull)
            .toList();
    }

    private static Map<String, List<String>> freeze(Map<String, List<String>> links) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        links.forEach((key, value) -> copy.put(key, List.copyOf(value)));
        return Collections.unmodifiableMap(copy);
    }
}
