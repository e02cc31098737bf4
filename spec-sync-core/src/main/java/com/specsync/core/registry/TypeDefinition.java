package com.specsync.core.registry;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Catalogue entry for a component type: display metadata plus its ordered requirements.
 *
 * @param displayName display name, for example {@code "Coordination Context"}
 * @param description what components of this type are
 * @param requirements ordered requirement definitions, names unique
 */
public record TypeDefinition(String displayName, String description, List<RequirementDefinition> requirements) {

    public TypeDefinition {
        Objects.requireNonNull(displayName, "displayName must not be null");
        if (description == null) {
            description = "";
        }
        requirements = requirements == null ? List.of() : List.copyOf(requirements);
        Set<String> seen = new HashSet<>();
        for (RequirementDefinition definition : requirements) {
            if (!seen.add(definition.name())) {
                throw new RequirementDefinitionException(
                    "Duplicate requirement '" + definition.name() + "' in catalogue for " + displayName);
            }
        }
    }
}
