package com.specsync.core.registry;

import java.util.Objects;
import java.util.Set;

/**
 * Selects a subset of a catalogue by requirement name.
 *
 * @param mode whether names are included or excluded
 * @param names requirement names the mode applies to
 */
public record DefinitionFilter(Mode mode, Set<String> names) {

    public enum Mode {
        ALL,
        INCLUDE,
        EXCLUDE
    }

    public DefinitionFilter {
        Objects.requireNonNull(mode, "mode must not be null");
        names = names == null ? Set.of() : Set.copyOf(names);
    }

    public static DefinitionFilter all() {
        return new DefinitionFilter(Mode.ALL, Set.of());
    }

    public static DefinitionFilter include(Set<String> names) {
        return new DefinitionFilter(Mode.INCLUDE, names);
    }

    public static DefinitionFilter exclude(Set<String> names) {
        return new DefinitionFilter(Mode.EXCLUDE, names);
    }

    public boolean accepts(RequirementDefinition definition) {
        return switch (mode) {
            case ALL -> true;
            case INCLUDE -> names.contains(definition.name());
            case EXCLUDE -> !names.contains(definition.name());
        };
    }
}
