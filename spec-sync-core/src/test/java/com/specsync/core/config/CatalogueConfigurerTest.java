package com.specsync.core.config;

import com.specsync.core.model.CheckerKind;
import com.specsync.core.model.ComponentType;
import com.specsync.core.registry.RequirementDefinition;
import com.specsync.core.registry.RequirementDefinitionException;
import com.specsync.core.registry.RequirementRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link CatalogueConfigurer}.
 */
class CatalogueConfigurerTest {

    private final RequirementRegistry base = RequirementRegistry.builtIn();

    @Test
    void apply_withEmptySettings_keepsBuiltInCatalogue() {
        RequirementRegistry registry = CatalogueConfigurer.apply(base, SpecSyncConfig.CatalogueSettings.empty());

        assertThat(registry.definitionsFor(ComponentType.SCHEMA)).isEqualTo(base.definitionsFor(ComponentType.SCHEMA));
    }

    @Test
    void apply_withCustomDefinition_replacesTypeCatalogueInOrder() {
        SpecSyncConfig.CatalogueSettings settings = new SpecSyncConfig.CatalogueSettings(
            List.of(new SpecSyncConfig.DefinitionSettings("design_doc", "file_existence", "specification",
                "Design document exists", null, Map.of("file_kind", "design"))),
            Map.of("schema", List.of("spec_file", "design_doc", "spec_valid", "children_complete")));

        RequirementRegistry registry = CatalogueConfigurer.apply(base, settings);

        List<RequirementDefinition> schema = registry.definitionsFor(ComponentType.SCHEMA);
        assertThat(schema).extracting(RequirementDefinition::name)
            .containsExactly("spec_file", "design_doc", "spec_valid", "children_complete");
        assertThat(schema.get(2).configString(RequirementDefinition.DOCUMENT_TYPE)).contains("schema");
        assertThat(schema.get(3).checker()).isEqualTo(CheckerKind.HIERARCHICAL);
        assertThat(registry.definitionsFor(ComponentType.MODULE)).hasSize(5);
    }

    @Test
    void apply_withUnknownRequirementName_throwsException() {
        SpecSyncConfig.CatalogueSettings settings = new SpecSyncConfig.CatalogueSettings(
            List.of(), Map.of("schema", List.of("spec_file", "magic")));

        assertThatThrownBy(() -> CatalogueConfigurer.apply(base, settings))
            .isInstanceOf(RequirementDefinitionException.class)
            .hasMessageContaining("Unknown requirement in catalogue: magic");
    }

    @Test
    void apply_withUnknownType_throwsException() {
        SpecSyncConfig.CatalogueSettings settings = new SpecSyncConfig.CatalogueSettings(
            List.of(), Map.of("widget", List.of("spec_file")));

        assertThatThrownBy(() -> CatalogueConfigurer.apply(base, settings))
            .isInstanceOf(RequirementDefinitionException.class)
            .hasMessageContaining("widget");
    }

    @Test
    void apply_withDuplicateCustomDefinitions_throwsException() {
        SpecSyncConfig.DefinitionSettings definition = new SpecSyncConfig.DefinitionSettings(
            "design_doc", "file_existence", "specification", "", null, null);
        SpecSyncConfig.CatalogueSettings settings = new SpecSyncConfig.CatalogueSettings(
            List.of(definition, definition), Map.of());

        assertThatThrownBy(() -> CatalogueConfigurer.apply(base, settings))
            .isInstanceOf(RequirementDefinitionException.class)
            .hasMessageContaining("Duplicate custom requirement");
    }

    @Test
    void apply_withThresholdOutOfRange_throwsException() {
        SpecSyncConfig.CatalogueSettings settings = new SpecSyncConfig.CatalogueSettings(
            List.of(new SpecSyncConfig.DefinitionSettings("coverage", "test_status", "tests", "", 1.5, null)),
            Map.of());

        assertThatThrownBy(() -> CatalogueConfigurer.apply(base, settings))
            .isInstanceOf(RequirementDefinitionException.class)
            .hasMessageContaining("threshold");
    }
}
