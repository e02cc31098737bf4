package com.specsync.core.graph;

import com.specsync.core.model.Component;
import com.specsync.core.model.Dependency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds cycles in a component dependency graph using depth-first search.
 *
 * <p>Each back edge found during the search yields one cycle. Cycles are reported once
 * regardless of the node the search entered them from.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ComponentGraph graph = DependencyGraphBuilder.attach(ComponentGraph.of(components), edges);
 * List<DependencyCycle> cycles = CycleDetector.detect(graph);
 * }</pre>
 */
public final class CycleDetector {

    private static final Logger log = LoggerFactory.getLogger(CycleDetector.class);

    private enum Color { WHITE, GRAY, BLACK }

    private CycleDetector() {
        // Utility class
    }

    /**
     * Detects every distinct dependency cycle.
     *
     * @param graph graph with dependency links attached
     * @return cycles, empty when the graph is acyclic
     */
    public static List<DependencyCycle> detect(ComponentGraph graph) {
        if (!graph.hasDependencyGraph()) {
            throw new IllegalStateException("Dependency graph not attached");
        }

        Map<String, Color> colors = new LinkedHashMap<>();
        graph.ids().forEach(id -> colors.put(id, Color.WHITE));

        Map<String, DependencyCycle> cycles = new LinkedHashMap<>();
        for (String id : graph.ids()) {
            if (colors.get(id) == Color.WHITE) {
                visit(graph, id, colors, new ArrayList<>(), cycles);
            }
        }

        log.debug("Found {} dependency cycles across {} components", cycles.size(), graph.size());
        return List.copyOf(cycles.values());
    }

    private static void visit(
            ComponentGraph graph,
            String id,
            Map<String, Color> colors,
            List<String> stack,
            Map<String, DependencyCycle> cycles) {
        colors.put(id, Color.GRAY);
        stack.add(id);

        for (String next : graph.dependencyIds(id)) {
            Color color = colors.get(next);
            if (color == Color.GRAY) {
                List<String> path = new ArrayList<>(stack.subList(stack.indexOf(next), stack.size()));
                cycles.putIfAbsent(cycleKey(path), toCycle(graph, path));
            } else if (color == Color.WHITE) {
                visit(graph, next, colors, stack, cycles);
            }
        }

        stack.remove(stack.size() - 1);
        colors.put(id, Color.BLACK);
    }

    private static DependencyCycle toCycle(ComponentGraph graph, List<String> path) {
        List<String> closed = new ArrayList<>(path);
        closed.add(path.get(0));

        List<Dependency> edges = new ArrayList<>();
        for (int i = 0; i < closed.size() - 1; i++) {
            edges.add(new Dependency(closed.get(i), closed.get(i + 1)));
        }

        List<String> names = closed.stream()
            .map(id -> graph.component(id).map(Component::moduleName).orElse(id))
            .toList();
        return new DependencyCycle(closed, edges, String.join(" -> ", names));
    }

    // Rotation to the smallest id so the same cycle found from different entry points dedups
    private static String cycleKey(List<String> path) {
        int start = 0;
        for (int i = 1; i < path.size(); i++) {
            if (path.get(i).compareTo(path.get(start)) < 0) {
                start = i;
            }
        }
        List<String> rotated = new ArrayList<>(path.subList(start, path.size()));
        rotated.addAll(path.subList(0, start));
        return String.join("->", rotated);
    }
}
