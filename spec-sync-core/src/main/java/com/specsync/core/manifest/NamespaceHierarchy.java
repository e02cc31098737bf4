package com.specsync.core.manifest;

import com.specsync.core.model.Component;
import com.specsync.core.model.ComponentType;
import com.specsync.core.util.ModuleNames;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Derives component types and parents from dotted module names.
 */
public final class NamespaceHierarchy {

    private NamespaceHierarchy() {
        // Utility class
    }

    /**
     * Returns the type implied by namespace depth.
     *
     * <p>{@code MyApp.Accounts} is a context; {@code MyApp.Accounts.User} is a module.
     *
     * @param moduleName dotted module name
     * @return {@link ComponentType#CONTEXT} for two segments or fewer, otherwise {@link ComponentType#MODULE}
     */
    public static ComponentType typeFromNamespace(String moduleName) {
        return ModuleNames.depth(moduleName) <= 2 ? ComponentType.CONTEXT : ComponentType.MODULE;
    }

    /**
     * Finds the nearest enclosing namespace that is itself a component.
     *
     * @param moduleName dotted module name
     * @param byModuleName known components by module name
     * @return nearest ancestor component
     */
    public static Optional<Component> nearestAncestor(String moduleName, Map<String, Component> byModuleName) {
        Optional<String> namespace = ModuleNames.parentNamespace(moduleName);
        while (namespace.isPresent()) {
            Component candidate = byModuleName.get(namespace.get());
            if (candidate != null) {
                return Optional.of(candidate);
            }
            namespace = ModuleNames.parentNamespace(namespace.get());
        }
        return Optional.empty();
    }

    /**
     * Fills in missing parent ids from the nearest existing namespace ancestor.
     *
     * @param components components, some possibly without a parent
     * @return components with derived parents; explicit parents are kept
     */
    public static List<Component> deriveParents(List<Component> components) {
        Map<String, Component> byModuleName = new HashMap<>();
        components.forEach(component -> byModuleName.put(component.moduleName(), component));
        return components.stream()
            .map(component -> {
                if (component.parentId() != null) {
                    return component;
                }
                return nearestAncestor(component.moduleName(), byModuleName)
                    .filter(parent -> !parent.id().equals(component.id()))
                    .map(parent -> new Component(component.id(), component.name(), component.moduleName(),
                        component.type(), parent.id(), component.description(), component.status(),
                        component.requirements()))
                    .orElse(component);
            })
            .toList();
    }
}
