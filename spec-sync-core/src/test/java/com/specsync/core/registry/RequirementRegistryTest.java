package com.specsync.core.registry;

import com.specsync.core.model.ComponentType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link RequirementRegistry}.
 */
class RequirementRegistryTest {

    private final RequirementRegistry registry = RequirementRegistry.builtIn();

    @Test
    void builtIn_coversEveryKnownType() {
        for (ComponentType type : ComponentType.values()) {
            assertThat(registry.definitionsFor(type)).as(type.tag()).isNotEmpty();
        }
    }

    @Test
    void definitionsFor_context_keepsCatalogueOrder() {
        assertThat(names(registry.definitionsFor(ComponentType.CONTEXT))).containsExactly(
            "spec_file", "spec_valid", "children_designs", "review_file", "children_implementations",
            "children_tests", "dependencies_satisfied", "implementation_file", "test_file", "tests_passing");
    }

    @Test
    void definitionsFor_schema_isSpecAndImplementationOnly() {
        assertThat(names(registry.definitionsFor(ComponentType.SCHEMA)))
            .containsExactly("spec_file", "spec_valid", "implementation_file");
    }

    @Test
    void definitionsFor_unknownType_usesDefaultList() {
        assertThat(names(registry.definitionsFor(ComponentType.UNKNOWN)))
            .containsExactly("spec_file", "spec_valid", "test_file", "implementation_file", "tests_passing");
        assertThat(registry.typeDefinition(ComponentType.UNKNOWN).displayName()).isEqualTo("Unknown");
    }

    @Test
    void localAndRelationalDefinitions_partitionTheCatalogue() {
        List<RequirementDefinition> local = registry.localDefinitionsFor(ComponentType.CONTEXT);
        List<RequirementDefinition> relational = registry.relationalDefinitionsFor(ComponentType.CONTEXT);

        assertThat(local).noneMatch(RequirementDefinition::isRelational);
        assertThat(names(relational)).containsExactly(
            "children_designs", "children_implementations", "children_tests", "dependencies_satisfied");
        assertThat(local.size() + relational.size()).isEqualTo(registry.definitionsFor(ComponentType.CONTEXT).size());
    }

    @Test
    void orderIndex_withUnknownName_sortsLast() {
        assertThat(registry.orderIndex(ComponentType.CONTEXT, "spec_file")).isZero();
        assertThat(registry.orderIndex(ComponentType.CONTEXT, "tests_passing")).isEqualTo(9);
        assertThat(registry.orderIndex(ComponentType.CONTEXT, "legacy")).isEqualTo(RequirementRegistry.UNKNOWN_ORDER);
    }

    @Test
    void definitionsFor_withFilter_includesOrExcludesByName() {
        assertThat(names(registry.definitionsFor(ComponentType.SCHEMA, DefinitionFilter.include(Set.of("spec_file")))))
            .containsExactly("spec_file");
        assertThat(names(registry.definitionsFor(ComponentType.SCHEMA, DefinitionFilter.exclude(Set.of("spec_file")))))
            .containsExactly("spec_valid", "implementation_file");
        assertThat(registry.definitionsFor(ComponentType.SCHEMA, DefinitionFilter.all())).hasSize(3);
    }

    @Test
    void withType_replacesOneCatalogueOnly() {
        RequirementRegistry custom = registry.withType(ComponentType.SCHEMA,
            new TypeDefinition("Schema", "", List.of(RequirementDefinitions.SPEC_FILE_DEFINITION)));

        assertThat(names(custom.definitionsFor(ComponentType.SCHEMA))).containsExactly("spec_file");
        assertThat(names(registry.definitionsFor(ComponentType.SCHEMA))).hasSize(3);
    }

    @Test
    void typeDefinition_withDuplicateNames_throwsException() {
        assertThatThrownBy(() -> new TypeDefinition("Schema", "", List.of(
            RequirementDefinitions.SPEC_FILE_DEFINITION, RequirementDefinitions.SPEC_FILE_DEFINITION)))
            .isInstanceOf(RequirementDefinitionException.class)
            .hasMessageContaining("Duplicate requirement 'spec_file'");
    }

    @Test
    void specValid_carriesDocumentType() {
        assertThat(registry.definitionsFor(ComponentType.CONTEXT).get(1)
            .configString(RequirementDefinition.DOCUMENT_TYPE)).contains("context_spec");
        assertThat(RequirementDefinitions.builtIn("nope")).isNull();
    }

    private static List<String> names(List<RequirementDefinition> definitions) {
        return definitions.stream().map(RequirementDefinition::name).toList();
    }
}
