package com.specsync.core.manifest;

import com.specsync.core.layout.FileLayoutResolver;
import com.specsync.core.model.Component;
import com.specsync.core.model.ProjectInfo;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Maps changed file paths to the components whose expected artifacts they are.
 */
public class ChangedComponentResolver {

    private final Map<String, Set<String>> componentsByPath = new HashMap<>();

    public ChangedComponentResolver(Collection<Component> components, ProjectInfo project, FileLayoutResolver layout) {
        for (Component component : components) {
            layout.expectedFiles(component, project).values().forEach(path ->
                componentsByPath.computeIfAbsent(normalize(path), key -> new LinkedHashSet<>()).add(component.id()));
        }
    }

    /**
     * Resolves changed files to component ids.
     *
     * @param changedPaths relative paths; paths that belong to no component are ignored
     * @return ids of components owning at least one changed path
     */
    public Set<String> resolve(Collection<String> changedPaths) {
        Set<String> ids = new LinkedHashSet<>();
        for (String path : changedPaths) {
            ids.addAll(componentsByPath.getOrDefault(normalize(path), Set.of()));
        }
        return ids;
    }

    private static String normalize(String path) {
        String normalized = path.replace('\\', '/');
        return normalized.startsWith("./") ? normalized.substring(2) : normalized;
    }
}
