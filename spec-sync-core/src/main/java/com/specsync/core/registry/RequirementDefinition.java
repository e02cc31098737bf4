package com.specsync.core.registry;

import com.specsync.core.model.ArtifactType;
import com.specsync.core.model.CheckerKind;

import java.util.Map;
import java.util.Optional;

/**
 * Immutable template for a requirement within a component type's catalogue.
 *
 * <p>Definitions are validated when built: a blank name, a missing checker or artifact
 * category, a threshold outside [0.0, 1.0], or a hierarchical definition whose child
 * requirement cannot be determined all raise {@link RequirementDefinitionException}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * RequirementDefinition def = RequirementDefinition.of(
 *     "coverage_ok", "test_status", "tests", "Tests pass", 0.8, Map.of());
 *
 * boolean ok = def.isSatisfiedBy(0.85); // true
 * }</pre>
 *
 * @param name requirement name, unique within a catalogue
 * @param checker checker that evaluates the requirement
 * @param artifactType artifact category
 * @param description human readable description
 * @param threshold minimum score for the requirement to be satisfied
 * @param config checker specific configuration
 */
public record RequirementDefinition(
    String name,
    CheckerKind checker,
    ArtifactType artifactType,
    String description,
    double threshold,
    Map<String, Object> config
) {

    public static final double DEFAULT_THRESHOLD = 1.0;

    /** Config key naming the requirement a hierarchical definition aggregates over descendants. */
    public static final String CHILD_REQUIREMENT = "child_requirement";

    /** Config key overriding the document type used by the document validity checker. */
    public static final String DOCUMENT_TYPE = "document_type";

    /** Config key overriding the file kind used by the file existence checker. */
    public static final String FILE_KIND = "file_kind";

    public RequirementDefinition {
        if (name == null || name.isBlank()) {
            throw new RequirementDefinitionException("Requirement name must not be blank");
        }
        if (checker == null) {
            throw new RequirementDefinitionException("Requirement '" + name + "' has no checker");
        }
        if (artifactType == null) {
            throw new RequirementDefinitionException("Requirement '" + name + "' has no artifact type");
        }
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new RequirementDefinitionException(
                "Requirement '" + name + "' threshold must be within [0.0, 1.0]: " + threshold);
        }
        if (description == null) {
            description = "";
        }
        config = config == null ? Map.of() : Map.copyOf(config);
        if (checker == CheckerKind.HIERARCHICAL
            && !config.containsKey(CHILD_REQUIREMENT)
            && !HierarchyVariant.isKnown(name)) {
            throw new RequirementDefinitionException(
                "Hierarchical requirement '" + name + "' is not a known variant and names no "
                    + CHILD_REQUIREMENT);
        }
    }

    /**
     * Builds a definition from textual references, as found in configuration files.
     *
     * @param name requirement name
     * @param checkerReference checker reference, see {@link CheckerKind#fromReference(String)}
     * @param artifactTag artifact category tag
     * @param description description
     * @param threshold threshold, null for {@link #DEFAULT_THRESHOLD}
     * @param config checker configuration, may be null
     * @return validated definition
     * @throws RequirementDefinitionException if any reference does not resolve
     */
    public static RequirementDefinition of(
            String name,
            String checkerReference,
            String artifactTag,
            String description,
            Double threshold,
            Map<String, Object> config) {
        CheckerKind checker = CheckerKind.fromReference(checkerReference)
            .orElseThrow(() -> new RequirementDefinitionException(
                "Requirement '" + name + "' references unknown checker: " + checkerReference));
        ArtifactType artifactType = ArtifactType.fromTag(artifactTag)
            .orElseThrow(() -> new RequirementDefinitionException(
                "Requirement '" + name + "' has unknown artifact type: " + artifactTag));
        return new RequirementDefinition(name, checker, artifactType, description,
            threshold == null ? DEFAULT_THRESHOLD : threshold, config);
    }

    public boolean isRelational() {
        return checker.isRelational();
    }

    /**
     * Applies the threshold to a checker score.
     *
     * @param score checker score
     * @return true when {@code score >= threshold}
     */
    public boolean isSatisfiedBy(double score) {
        return score >= threshold;
    }

    public Optional<String> configString(String key) {
        Object value = config.get(key);
        return value == null ? Optional.empty() : Optional.of(value.toString());
    }
}
