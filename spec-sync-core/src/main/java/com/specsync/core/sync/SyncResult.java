package com.specsync.core.sync;

import com.specsync.core.model.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Output of a sync pass.
 *
 * @param components components in request order, with status and ordered requirements
 * @param affectedIds components whose local requirements were recomputed
 * @param statistics pass counters
 */
public record SyncResult(List<Component> components, Set<String> affectedIds, SyncStatistics statistics) {

    public SyncResult {
        components = components == null ? List.of() : List.copyOf(components);
        affectedIds = affectedIds == null ? Set.of() : Set.copyOf(affectedIds);
    }

    public Optional<Component> component(String id) {
        return components.stream().filter(component -> component.id().equals(id)).findFirst();
    }

    public Optional<Component> componentByModule(String moduleName) {
        return components.stream().filter(component -> component.moduleName().equals(moduleName)).findFirst();
    }
}
