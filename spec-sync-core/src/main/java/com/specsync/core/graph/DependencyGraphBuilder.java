package com.specsync.core.graph;

import com.specsync.core.model.Component;
import com.specsync.core.model.Dependency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Attaches direct dependency and dependent links to a {@link ComponentGraph}.
 */
public final class DependencyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    private DependencyGraphBuilder() {
        // Utility class
    }

    /**
     * Attaches dependency links.
     *
     * <p>Duplicate edges collapse into one. Edges whose endpoints are not in the graph are
     * dropped with a warning.
     *
     * @param graph component graph
     * @param edges dependency edges
     * @return graph with dependency links attached
     */
    public static ComponentGraph attach(ComponentGraph graph, Collection<Dependency> edges) {
        Map<String, Set<String>> dependencies = new LinkedHashMap<>();
        Map<String, Set<String>> dependents = new LinkedHashMap<>();
        for (String id : graph.ids()) {
            dependencies.put(id, new LinkedHashSet<>());
            dependents.put(id, new LinkedHashSet<>());
        }

        for (Dependency edge : edges) {
            if (!graph.contains(edge.sourceId()) || !graph.contains(edge.targetId())) {
                log.warn("Dropping dependency {} -> {}: endpoint not in component set",
                    edge.sourceId(), edge.targetId());
                continue;
            }
            dependencies.get(edge.sourceId()).add(edge.targetId());
            dependents.get(edge.targetId()).add(edge.sourceId());
        }

        return graph.withDependencyLinks(toLists(dependencies), toLists(dependents));
    }

    /**
     * Orders components so that each comes after its dependencies.
     *
     * <p>When a cycle prevents a complete order, a warning is logged and the remaining
     * components are appended in arena order.
     *
     * @param graph graph with dependency links attached
     * @return components, dependencies first
     */
    public static List<Component> topologicalOrder(ComponentGraph graph) {
        return kahn(graph, graph::dependencyIds, graph::dependentIds, "Dependency cycle detected");
    }

    /**
     * Orders components for relational checks: each comes after its dependencies and after
     * its whole descendant subtree.
     *
     * <p>A component's relational results are then complete before any dependent or ancestor
     * reads them. Components caught in a cycle of dependency and parent links are appended in
     * arena order with a warning.
     *
     * @param graph graph with dependency and child links attached
     * @return components, prerequisites first
     */
    public static List<Component> relationalOrder(ComponentGraph graph) {
        Map<String, List<String>> prerequisites = new HashMap<>();
        Map<String, List<String>> successors = new HashMap<>();
        for (String id : graph.ids()) {
            List<String> before = new ArrayList<>(graph.dependencyIds(id));
            before.addAll(graph.childIds(id));
            prerequisites.put(id, before);
            before.forEach(prerequisite -> successors.computeIfAbsent(prerequisite, key -> new ArrayList<>()).add(id));
        }
        return kahn(graph, id -> prerequisites.getOrDefault(id, List.of()),
            id -> successors.getOrDefault(id, List.of()), "Dependency or hierarchy cycle detected");
    }

    private static List<Component> kahn(ComponentGraph graph,
                                        Function<String, List<String>> prerequisites,
                                        Function<String, List<String>> successors,
                                        String cycleMessage) {
        Map<String, Integer> pending = new HashMap<>();
        Deque<String> ready = new ArrayDeque<>();
        for (String id : graph.ids()) {
            int count = new LinkedHashSet<>(prerequisites.apply(id)).size();
            pending.put(id, count);
            if (count == 0) {
                ready.add(id);
            }
        }

        List<Component> ordered = new ArrayList<>();
        Set<String> emitted = new LinkedHashSet<>();
        while (!ready.isEmpty()) {
            String id = ready.poll();
            emitted.add(id);
            graph.component(id).ifPresent(ordered::add);
            for (String successor : new LinkedHashSet<>(successors.apply(id))) {
                int remaining = pending.merge(successor, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(successor);
                }
            }
        }

        if (ordered.size() < graph.size()) {
            List<String> remaining = graph.ids().stream().filter(id -> !emitted.contains(id)).toList();
            log.warn("{}, appending {} unordered components: {}", cycleMessage, remaining.size(), remaining);
            remaining.forEach(id -> graph.component(id).ifPresent(ordered::add));
        }
        return ordered;
    }

    private static Map<String, List<String>> toLists(Map<String, Set<String>> links) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        links.forEach((key, value) -> result.put(key, new ArrayList<>(value)));
        return result;
    }
}
