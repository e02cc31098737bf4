package com.specsync.core.registry;

import com.specsync.core.model.ComponentType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per component type catalogue of requirement definitions.
 *
 * <p>The order of a type's definitions is significant: synced requirements are sorted
 * by it, and requirement names the catalogue does not know sort last.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * RequirementRegistry registry = RequirementRegistry.builtIn();
 *
 * List<RequirementDefinition> local = registry.localDefinitionsFor(ComponentType.CONTEXT);
 * List<RequirementDefinition> relational = registry.relationalDefinitionsFor(ComponentType.CONTEXT);
 * }</pre>
 */
public final class RequirementRegistry {

    /** Order index reported for requirement names outside a type's catalogue. */
    public static final int UNKNOWN_ORDER = Integer.MAX_VALUE;

    private final Map<ComponentType, TypeDefinition> types;
    private final TypeDefinition fallback;

    public RequirementRegistry(Map<ComponentType, TypeDefinition> types, TypeDefinition fallback) {
        Objects.requireNonNull(types, "types must not be null");
        Objects.requireNonNull(fallback, "fallback must not be null");
        EnumMap<ComponentType, TypeDefinition> copy = new EnumMap<>(ComponentType.class);
        copy.putAll(types);
        this.types = Collections.unmodifiableMap(copy);
        this.fallback = fallback;
    }

    /**
     * Returns the registry with the built-in catalogue.
     *
     * @return built-in registry
     */
    public static RequirementRegistry builtIn() {
        Map<ComponentType, TypeDefinition> types = new EnumMap<>(ComponentType.class);
        List<RequirementDefinition> defaults = RequirementDefinitions.defaultRequirements();

        types.put(ComponentType.CONTEXT, new TypeDefinition("Context",
            "Application domain boundary providing public API",
            RequirementDefinitions.contextRequirements()));
        types.put(ComponentType.COORDINATION_CONTEXT, new TypeDefinition("Coordination Context",
            "Context that coordinates between multiple domains",
            RequirementDefinitions.contextRequirements()));
        types.put(ComponentType.SCHEMA, new TypeDefinition("Schema",
            "Data structure definition with validation rules",
            RequirementDefinitions.schemaRequirements()));
        types.put(ComponentType.BEHAVIOUR, new TypeDefinition("Behaviour",
            "Behaviour that defines callbacks for other modules",
            RequirementDefinitions.behaviourRequirements()));
        types.put(ComponentType.MODULE, new TypeDefinition("Module",
            "Plain module with functions", defaults));
        types.put(ComponentType.CONTROLLER, new TypeDefinition("Controller",
            "Request handler translating transport calls into context calls", defaults));
        types.put(ComponentType.LIVEVIEW, new TypeDefinition("LiveView",
            "Stateful server rendered view", defaults));
        types.put(ComponentType.CLI, new TypeDefinition("CLI",
            "Command line entry point", defaults));
        types.put(ComponentType.WORKER, new TypeDefinition("Worker",
            "Background worker processing queued jobs", defaults));
        types.put(ComponentType.COORDINATOR, new TypeDefinition("Coordinator",
            "Orchestrates calls across several components", defaults));
        types.put(ComponentType.REPOSITORY, new TypeDefinition("Repository",
            "Data access layer abstracting database operations", defaults));
        types.put(ComponentType.GENSERVER, new TypeDefinition("GenServer",
            "Stateful process that handles requests and maintains state", defaults));
        types.put(ComponentType.TASK, new TypeDefinition("Task",
            "Background job or one-time operation", defaults));
        types.put(ComponentType.REGISTRY, new TypeDefinition("Registry",
            "Process registry for dynamic process lookup", defaults));
        types.put(ComponentType.OTHER, new TypeDefinition("Other",
            "Custom component type", defaults));

        return new RequirementRegistry(types,
            new TypeDefinition("Unknown", "Component without a recognised type", defaults));
    }

    /**
     * Returns a copy of this registry with one type's catalogue replaced.
     *
     * @param type component type
     * @param definition replacement catalogue entry
     * @return new registry
     */
    public RequirementRegistry withType(ComponentType type, TypeDefinition definition) {
        Map<ComponentType, TypeDefinition> copy = new EnumMap<>(ComponentType.class);
        copy.putAll(types);
        copy.put(type, definition);
        return new RequirementRegistry(copy, fallback);
    }

    public TypeDefinition typeDefinition(ComponentType type) {
        return types.getOrDefault(type, fallback);
    }

    public Map<ComponentType, TypeDefinition> types() {
        return types;
    }

    public List<RequirementDefinition> definitionsFor(ComponentType type) {
        return typeDefinition(type).requirements();
    }

    /**
     * Returns the definitions for a type that pass the filter, preserving catalogue order.
     *
     * @param type component type
     * @param filter name filter
     * @return filtered definitions
     */
    public List<RequirementDefinition> definitionsFor(ComponentType type, DefinitionFilter filter) {
        return definitionsFor(type).stream()
            .filter(filter::accepts)
            .toList();
    }

    public List<RequirementDefinition> localDefinitionsFor(ComponentType type) {
        return definitionsFor(type).stream()
            .filter(definition -> !definition.isRelational())
            .toList();
    }

    public List<RequirementDefinition> relationalDefinitionsFor(ComponentType type) {
        return definitionsFor(type).stream()
            .filter(RequirementDefinition::isRelational)
            .toList();
    }

    /**
     * Returns the position of a requirement name within a type's catalogue.
     *
     * @param type component type
     * @param requirementName requirement name
     * @return zero based index, or {@link #UNKNOWN_ORDER}
     */
    public int orderIndex(ComponentType type, String requirementName) {
        List<RequirementDefinition> definitions = definitionsFor(type);
        for (int i = 0; i < definitions.size(); i++) {
            if (definitions.get(i).name().equals(requirementName)) {
                return i;
            }
        }
        return UNKNOWN_ORDER;
    }
}
