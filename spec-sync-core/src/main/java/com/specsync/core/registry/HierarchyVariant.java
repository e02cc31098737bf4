package com.specsync.core.registry;

import java.util.Optional;

/**
 * Named hierarchical requirements and the descendant requirement each one aggregates.
 */
public enum HierarchyVariant {
    CHILDREN_DESIGNS("children_designs", RequirementDefinitions.SPEC_FILE),
    CHILDREN_IMPLEMENTATIONS("children_implementations", RequirementDefinitions.IMPLEMENTATION_FILE),
    CHILDREN_TESTS("children_tests", RequirementDefinitions.TEST_FILE),
    // null: every requirement of each descendant must hold
    CHILDREN_COMPLETE("children_complete", null);

    private final String requirementName;
    private final String childRequirement;

    HierarchyVariant(String requirementName, String childRequirement) {
        this.requirementName = requirementName;
        this.childRequirement = childRequirement;
    }

    public String requirementName() {
        return requirementName;
    }

    /**
     * Returns the requirement checked on each descendant.
     *
     * @return requirement name, or empty when all requirements are checked
     */
    public Optional<String> childRequirement() {
        return Optional.ofNullable(childRequirement);
    }

    public static Optional<HierarchyVariant> fromName(String name) {
        for (HierarchyVariant variant : values()) {
            if (variant.requirementName.equals(name)) {
                return Optional.of(variant);
            }
        }
        return Optional.empty();
    }

    public static boolean isKnown(String name) {
        return fromName(name).isPresent();
    }
}
