package com.specsync.core.graph;

import com.specsync.core.model.Component;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Attaches parent to child links to a {@link ComponentGraph}.
 */
public final class HierarchyTreeBuilder {

    private static final Logger log = LoggerFactory.getLogger(HierarchyTreeBuilder.class);

    private HierarchyTreeBuilder() {
        // Utility class
    }

    /**
     * Builds child lists from parent back-references.
     *
     * <p>A parent id not present in the graph makes the component a root. A parent link
     * that would close a cycle is ignored with a warning.
     *
     * @param graph component graph
     * @return graph with child links attached
     */
    public static ComponentGraph attach(ComponentGraph graph) {
        Map<String, List<String>> children = new LinkedHashMap<>();
        for (String id : graph.ids()) {
            children.put(id, new ArrayList<>());
        }

        for (Component component : graph.components()) {
            String parentId = component.parentId();
            if (parentId == null) {
                continue;
            }
            if (!graph.contains(parentId)) {
                log.debug("Parent {} of {} not in component set, treating as root", parentId, component.moduleName());
                continue;
            }
            if (closesCycle(graph, component.id())) {
                log.warn("Hierarchy cycle detected at {}, ignoring its parent link", component.moduleName());
                continue;
            }
            children.get(parentId).add(component.id());
        }
        return graph.withChildLinks(children);
    }

    private static boolean closesCycle(ComponentGraph graph, String id) {
        Set<String> seen = new HashSet<>();
        String current = graph.component(id).map(Component::parentId).orElse(null);
        while (current != null && graph.contains(current)) {
            if (current.equals(id) || !seen.add(current)) {
                return true;
            }
            current = graph.component(current).map(Component::parentId).orElse(null);
        }
        return false;
    }
}
