package com.specsync.core.sync;

import com.specsync.core.graph.ComponentGraph;
import com.specsync.core.model.Component;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Expands a set of changed components to every component whose requirements may be stale.
 *
 * <p>A component is affected when it changed, when one of its direct dependencies is
 * affected, when its parent is affected, or when one of its direct children is affected.
 * Only the dependency links need to be attached; children are derived from parent ids.
 *
 * <p>Each pass walks the components in list order and tests them against the set as it grows.
 * {@link PropagationMode#SINGLE_PASS} stops after one such walk, so its result depends on the
 * list order; {@link PropagationMode#TRANSITIVE} repeats until nothing is added.
 */
public class AffectedComponentIdentifier {

    private static final Logger log = LoggerFactory.getLogger(AffectedComponentIdentifier.class);

    private final PropagationMode mode;

    public AffectedComponentIdentifier(PropagationMode mode) {
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
    }

    public PropagationMode mode() {
        return mode;
    }

    /**
     * Computes the affected set.
     *
     * @param graph graph with dependency links attached
     * @param changedIds ids of changed components; ids outside the graph are ignored
     * @return affected ids, a superset of the changed ids present in the graph
     */
    public Set<String> identify(ComponentGraph graph, Collection<String> changedIds) {
        if (!graph.hasDependencyGraph()) {
            throw new IllegalStateException("Dependency graph not attached");
        }

        Set<String> affected = new LinkedHashSet<>();
        for (String id : changedIds) {
            if (graph.contains(id)) {
                affected.add(id);
            } else {
                log.debug("Ignoring changed id {} not in component set", id);
            }
        }

        Map<String, List<String>> children = childrenByParent(graph);
        int passes = 0;
        boolean grew;
        do {
            grew = expand(graph, children, affected);
            passes++;
        } while (grew && mode == PropagationMode.TRANSITIVE);

        log.debug("Affected set of {} components from {} changed after {} passes",
            affected.size(), changedIds.size(), passes);
        return affected;
    }

    private static boolean expand(ComponentGraph graph, Map<String, List<String>> children, Set<String> affected) {
        // Components are visited in list order against the live set, so one pass can chain forward
        boolean grew = false;
        for (Component component : graph.components()) {
            String id = component.id();
            if (affected.contains(id)) {
                continue;
            }
            if (graph.dependencyIds(id).stream().anyMatch(affected::contains)
                || (component.parentId() != null && affected.contains(component.parentId()))
                || children.getOrDefault(id, List.of()).stream().anyMatch(affected::contains)) {
                affected.add(id);
                grew = true;
            }
        }
        return grew;
    }

    private static Map<String, List<String>> childrenByParent(ComponentGraph graph) {
        Map<String, List<String>> children = new HashMap<>();
        for (Component component : graph.components()) {
            if (component.parentId() != null) {
                children.computeIfAbsent(component.parentId(), key -> new ArrayList<>()).add(component.id());
            }
        }
        return children;
    }
}
