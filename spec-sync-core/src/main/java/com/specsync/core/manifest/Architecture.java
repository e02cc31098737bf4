package com.specsync.core.manifest;

import com.specsync.core.model.Component;
import com.specsync.core.model.Dependency;
import com.specsync.core.model.ProjectInfo;

import java.util.List;
import java.util.Optional;

/**
 * Components and dependency edges of a project, ready for a sync request.
 *
 * @param project project identity from the manifest, null when the manifest has none
 * @param components components
 * @param dependencies dependency edges
 */
public record Architecture(ProjectInfo project, List<Component> components, List<Dependency> dependencies) {

    public Architecture {
        components = components == null ? List.of() : List.copyOf(components);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public Optional<Component> byModuleName(String moduleName) {
        return components.stream().filter(component -> component.moduleName().equals(moduleName)).findFirst();
    }
}
