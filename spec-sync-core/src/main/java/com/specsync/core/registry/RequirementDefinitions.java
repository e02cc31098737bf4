package com.specsync.core.registry;

import com.specsync.core.model.ArtifactType;
import com.specsync.core.model.CheckerKind;

import java.util.List;
import java.util.Map;

/**
 * Built-in requirement definitions and the per-type lists they form.
 */
public final class RequirementDefinitions {

    public static final String SPEC_FILE = "spec_file";
    public static final String SPEC_VALID = "spec_valid";
    public static final String IMPLEMENTATION_FILE = "implementation_file";
    public static final String TEST_FILE = "test_file";
    public static final String REVIEW_FILE = "review_file";
    public static final String TESTS_PASSING = "tests_passing";
    public static final String DEPENDENCIES_SATISFIED = "dependencies_satisfied";

    public static final RequirementDefinition SPEC_FILE_DEFINITION = definition(
        SPEC_FILE, CheckerKind.FILE_EXISTENCE, ArtifactType.SPECIFICATION,
        "Specification file exists", Map.of());

    public static final RequirementDefinition IMPLEMENTATION_FILE_DEFINITION = definition(
        IMPLEMENTATION_FILE, CheckerKind.FILE_EXISTENCE, ArtifactType.CODE,
        "Implementation file exists", Map.of());

    public static final RequirementDefinition TEST_FILE_DEFINITION = definition(
        TEST_FILE, CheckerKind.FILE_EXISTENCE, ArtifactType.TESTS,
        "Test file exists", Map.of());

    public static final RequirementDefinition REVIEW_FILE_DEFINITION = definition(
        REVIEW_FILE, CheckerKind.FILE_EXISTENCE, ArtifactType.REVIEW,
        "Design review file exists", Map.of());

    public static final RequirementDefinition TESTS_PASSING_DEFINITION = definition(
        TESTS_PASSING, CheckerKind.TEST_STATUS, ArtifactType.TESTS,
        "Tests exist and pass", Map.of());

    public static final RequirementDefinition DEPENDENCIES_SATISFIED_DEFINITION = definition(
        DEPENDENCIES_SATISFIED, CheckerKind.DEPENDENCY, ArtifactType.DEPENDENCIES,
        "All dependencies have their requirements satisfied", Map.of());

    public static final RequirementDefinition CHILDREN_DESIGNS_DEFINITION = hierarchy(
        HierarchyVariant.CHILDREN_DESIGNS, "All descendant components have specifications");

    public static final RequirementDefinition CHILDREN_IMPLEMENTATIONS_DEFINITION = hierarchy(
        HierarchyVariant.CHILDREN_IMPLEMENTATIONS, "All descendant components are implemented");

    public static final RequirementDefinition CHILDREN_TESTS_DEFINITION = hierarchy(
        HierarchyVariant.CHILDREN_TESTS, "All descendant components have test files");

    public static final RequirementDefinition CHILDREN_COMPLETE_DEFINITION = hierarchy(
        HierarchyVariant.CHILDREN_COMPLETE, "All descendant components satisfy all their requirements");

    private RequirementDefinitions() {
        // Utility class
    }

    /**
     * Returns the spec validity definition for a document type.
     *
     * @param documentType document type the specification is validated against
     * @return spec_valid definition
     */
    public static RequirementDefinition specValid(String documentType) {
        return definition(SPEC_VALID, CheckerKind.DOCUMENT_VALIDITY, ArtifactType.SPECIFICATION,
            "Specification follows the " + documentType + " document structure",
            Map.of(RequirementDefinition.DOCUMENT_TYPE, documentType));
    }

    public static List<RequirementDefinition> defaultRequirements() {
        return List.of(
            SPEC_FILE_DEFINITION,
            specValid("spec"),
            TEST_FILE_DEFINITION,
            IMPLEMENTATION_FILE_DEFINITION,
            TESTS_PASSING_DEFINITION
        );
    }

    public static List<RequirementDefinition> contextRequirements() {
        return List.of(
            SPEC_FILE_DEFINITION,
            specValid("context_spec"),
            CHILDREN_DESIGNS_DEFINITION,
            REVIEW_FILE_DEFINITION,
            CHILDREN_IMPLEMENTATIONS_DEFINITION,
            CHILDREN_TESTS_DEFINITION,
            DEPENDENCIES_SATISFIED_DEFINITION,
            IMPLEMENTATION_FILE_DEFINITION,
            TEST_FILE_DEFINITION,
            TESTS_PASSING_DEFINITION
        );
    }

    public static List<RequirementDefinition> schemaRequirements() {
        return List.of(
            SPEC_FILE_DEFINITION,
            specValid("schema"),
            IMPLEMENTATION_FILE_DEFINITION
        );
    }

    public static List<RequirementDefinition> behaviourRequirements() {
        return List.of(
            SPEC_FILE_DEFINITION,
            specValid("spec"),
            IMPLEMENTATION_FILE_DEFINITION
        );
    }

    /**
     * Looks up a built-in definition by name.
     *
     * @param name requirement name
     * @return the definition, or null when no built-in definition has that name
     */
    public static RequirementDefinition builtIn(String name) {
        return switch (name) {
            case SPEC_FILE -> SPEC_FILE_DEFINITION;
            case SPEC_VALID -> specValid("spec");
            case IMPLEMENTATION_FILE -> IMPLEMENTATION_FILE_DEFINITION;
            case TEST_FILE -> TEST_FILE_DEFINITION;
            case REVIEW_FILE -> REVIEW_FILE_DEFINITION;
            case TESTS_PASSING -> TESTS_PASSING_DEFINITION;
            case DEPENDENCIES_SATISFIED -> DEPENDENCIES_SATISFIED_DEFINITION;
            case "children_designs" -> CHILDREN_DESIGNS_DEFINITION;
            case "children_implementations" -> CHILDREN_IMPLEMENTATIONS_DEFINITION;
            case "children_tests" -> CHILDREN_TESTS_DEFINITION;
            case "children_complete" -> CHILDREN_COMPLETE_DEFINITION;
            default -> null;
        };
    }

    private static RequirementDefinition definition(
            String name, CheckerKind checker, ArtifactType artifactType,
            String description, Map<String, Object> config) {
        return new RequirementDefinition(name, checker, artifactType, description,
            RequirementDefinition.DEFAULT_THRESHOLD, config);
    }

    private static RequirementDefinition hierarchy(HierarchyVariant variant, String description) {
        return new RequirementDefinition(variant.requirementName(), CheckerKind.HIERARCHICAL,
            ArtifactType.HIERARCHY, description, RequirementDefinition.DEFAULT_THRESHOLD, Map.of());
    }
}
