package com.specsync.core.checker;

import com.specsync.core.SyncFixtures;
import com.specsync.core.environment.InMemoryEnvironment;
import com.specsync.core.graph.ComponentGraph;
import com.specsync.core.model.ArtifactType;
import com.specsync.core.model.CheckerKind;
import com.specsync.core.model.Component;
import com.specsync.core.model.ComponentType;
import com.specsync.core.registry.RequirementDefinition;
import com.specsync.core.registry.RequirementDefinitions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DocumentValidityChecker}.
 */
class DocumentValidityCheckerTest {

    private static final String SPEC_PATH = "docs/spec/shop/accounts/user.spec.md";

    private final DocumentValidityChecker checker = new DocumentValidityChecker();
    private final Component user = Component.of("u", "Shop.Accounts.User", ComponentType.SCHEMA, null);

    @Test
    void check_withValidSchemaSpec_isSatisfied() {
        InMemoryEnvironment environment = new InMemoryEnvironment()
            .addFile(SPEC_PATH, SyncFixtures.schemaSpec("Shop.Accounts.User"));

        CheckResult result = checker.check(context(environment), RequirementDefinitions.specValid("schema"),
            user, Map.of());

        assertThat(result.satisfied()).isTrue();
        assertThat(result.details())
            .containsEntry("status", "Document is valid")
            .containsEntry("document_type", "schema");
    }

    @Test
    void check_withMissingSection_reportsValidationError() {
        InMemoryEnvironment environment = new InMemoryEnvironment()
            .addFile(SPEC_PATH, "# Shop.Accounts.User\n\n## Functions\n\n- none\n");

        CheckResult result = checker.check(context(environment), RequirementDefinitions.specValid("schema"),
            user, Map.of());

        assertThat(result.satisfied()).isFalse();
        assertThat(result.details()).containsEntry("reason", "Document validation failed");
        assertThat((String) result.details().get("error")).contains("Missing required section: fields");
    }

    @Test
    void check_withUnreadableSpec_reportsReadFailure() {
        CheckResult result = checker.check(context(new InMemoryEnvironment()), RequirementDefinitions.specValid("schema"),
            user, Map.of());

        assertThat(result.satisfied()).isFalse();
        assertThat((String) result.details().get("reason")).startsWith("Failed to read spec file: ");
        assertThat(result.details()).containsEntry("path", SPEC_PATH);
    }

    @Test
    void check_withoutDocumentTypeConfig_usesComponentTypeDefault() {
        RequirementDefinition plain = new RequirementDefinition("spec_valid", CheckerKind.DOCUMENT_VALIDITY,
            ArtifactType.SPECIFICATION, "", 1.0, Map.of());
        InMemoryEnvironment environment = new InMemoryEnvironment()
            .addFile(SPEC_PATH, SyncFixtures.schemaSpec("Shop.Accounts.User"));

        CheckResult result = checker.check(context(environment), plain, user, Map.of());

        assertThat(result.details()).containsEntry("document_type", "schema");
        assertThat(result.satisfied()).isTrue();
    }

    private CheckContext context(InMemoryEnvironment environment) {
        return SyncFixtures.context(environment, ComponentGraph.of(List.of(user)));
    }
}
