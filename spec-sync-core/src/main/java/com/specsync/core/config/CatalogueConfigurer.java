package com.specsync.core.config;

import com.specsync.core.model.ComponentType;
import com.specsync.core.registry.RequirementDefinition;
import com.specsync.core.registry.RequirementDefinitionException;
import com.specsync.core.registry.RequirementDefinitions;
import com.specsync.core.registry.RequirementRegistry;
import com.specsync.core.registry.TypeDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies the {@code requirements} section of the configuration to a registry.
 *
 * <p>Custom definitions are validated eagerly. Per-type lists may reference custom
 * definitions, built-in definitions, or names already in that type's catalogue.
 */
public final class CatalogueConfigurer {

    private static final Logger log = LoggerFactory.getLogger(CatalogueConfigurer.class);

    private CatalogueConfigurer() {
        // Utility class
    }

    /**
     * Builds a registry from the built-in catalogue and the configured extensions.
     *
     * @param base registry to extend
     * @param settings catalogue settings
     * @return extended registry
     * @throws RequirementDefinitionException if a definition or reference is invalid
     */
    public static RequirementRegistry apply(RequirementRegistry base, SpecSyncConfig.CatalogueSettings settings) {
        Map<String, RequirementDefinition> custom = new LinkedHashMap<>();
        for (SpecSyncConfig.DefinitionSettings definition : settings.definitions()) {
            RequirementDefinition parsed = RequirementDefinition.of(
                definition.name(), definition.checker(), definition.artifactType(),
                definition.description(), definition.threshold(), definition.config());
            if (custom.put(parsed.name(), parsed) != null) {
                throw new RequirementDefinitionException("Duplicate custom requirement: " + parsed.name());
            }
        }

        RequirementRegistry registry = base;
        for (Map.Entry<String, List<String>> entry : settings.types().entrySet()) {
            ComponentType type = ComponentType.fromTag(entry.getKey());
            if (type == ComponentType.UNKNOWN && !"unknown".equalsIgnoreCase(entry.getKey())) {
                throw new RequirementDefinitionException("Unknown component type in catalogue: " + entry.getKey());
            }
            TypeDefinition current = registry.typeDefinition(type);
            List<RequirementDefinition> requirements = new ArrayList<>();
            for (String name : entry.getValue()) {
                requirements.add(resolve(name, custom, current));
            }
            registry = registry.withType(type, new TypeDefinition(current.displayName(), current.description(), requirements));
            log.info("Configured {} requirements for type {}", requirements.size(), type.tag());
        }
        return registry;
    }

    private static RequirementDefinition resolve(
            String name, Map<String, RequirementDefinition> custom, TypeDefinition current) {
        if (custom.containsKey(name)) {
            return custom.get(name);
        }
        for (RequirementDefinition existing : current.requirements()) {
            if (existing.name().equals(name)) {
                return existing;
            }
        }
        RequirementDefinition builtIn = RequirementDefinitions.builtIn(name);
        if (builtIn == null) {
            throw new RequirementDefinitionException("Unknown requirement in catalogue: " + name);
        }
        return builtIn;
    }
}
