package com.specsync.core.checker;

import com.specsync.core.SyncFixtures;
import com.specsync.core.environment.InMemoryEnvironment;
import com.specsync.core.graph.ComponentGraph;
import com.specsync.core.model.ArtifactType;
import com.specsync.core.model.CheckerKind;
import com.specsync.core.model.Component;
import com.specsync.core.model.ComponentType;
import com.specsync.core.model.Requirement;
import com.specsync.core.registry.RequirementDefinition;
import com.specsync.core.registry.RequirementDefinitions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link CheckerDispatcher}.
 */
class CheckerDispatcherTest {

    private final Component accounts = Component.of("a", "Shop.Accounts", ComponentType.CONTEXT, null);
    private final CheckContext context = SyncFixtures.context(
        new InMemoryEnvironment().addFile("docs/spec/shop/accounts.spec.md", "x"),
        ComponentGraph.of(List.of(accounts)));

    @Test
    void evaluate_buildsRequirementFromDefinitionAndResult() {
        CheckerDispatcher dispatcher = CheckerDispatcher.withDefaultCheckers(SyncFixtures.CLOCK);

        Requirement requirement = dispatcher.evaluate(context, RequirementDefinitions.SPEC_FILE_DEFINITION,
            accounts, Map.of());

        assertThat(requirement.name()).isEqualTo("spec_file");
        assertThat(requirement.componentId()).isEqualTo("a");
        assertThat(requirement.checker()).isEqualTo(CheckerKind.FILE_EXISTENCE);
        assertThat(requirement.satisfied()).isTrue();
        assertThat(requirement.checkedAt()).isEqualTo(SyncFixtures.NOW);
    }

    @Test
    void evaluate_appliesDefinitionThresholdToScore() {
        CheckerDispatcher dispatcher = new CheckerDispatcher(List.of(
            fixedScore(CheckerKind.FILE_EXISTENCE, 0.69),
            fixedScore(CheckerKind.DOCUMENT_VALIDITY, 0.70),
            new TestStatusChecker(), new DependencyChecker(), new HierarchicalChecker()), SyncFixtures.CLOCK);

        Requirement below = dispatcher.evaluate(context, definition("coverage_a", CheckerKind.FILE_EXISTENCE, 0.7),
            accounts, Map.of());
        Requirement at = dispatcher.evaluate(context, definition("coverage_b", CheckerKind.DOCUMENT_VALIDITY, 0.7),
            accounts, Map.of());

        assertThat(below.satisfied()).isFalse();
        assertThat(below.score()).isEqualTo(0.69);
        assertThat(at.satisfied()).isTrue();
    }

    @Test
    void evaluate_withThrowingChecker_recordsFailure() {
        RequirementChecker broken = new RequirementChecker() {
            @Override
            public CheckerKind kind() {
                return CheckerKind.TEST_STATUS;
            }

            @Override
            public CheckResult check(CheckContext ctx, RequirementDefinition definition, Component component,
                                     Map<String, Object> options) {
                throw new IllegalStateException("boom");
            }
        };
        CheckerDispatcher dispatcher = new CheckerDispatcher(List.of(new FileExistenceChecker(),
            new DocumentValidityChecker(), broken, new DependencyChecker(), new HierarchicalChecker()), SyncFixtures.CLOCK);

        Requirement requirement = dispatcher.evaluate(context, RequirementDefinitions.TESTS_PASSING_DEFINITION,
            accounts, Map.of());

        assertThat(requirement.satisfied()).isFalse();
        assertThat(requirement.details()).containsEntry("reason", "Checker failed").containsEntry("error", "boom");
    }

    @Test
    void constructor_withMissingChecker_throwsException() {
        assertThatThrownBy(() -> new CheckerDispatcher(List.of(new FileExistenceChecker()), SyncFixtures.CLOCK))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("No checker registered for document_validity");
    }

    private static RequirementDefinition definition(String name, CheckerKind kind, double threshold) {
        return new RequirementDefinition(name, kind, ArtifactType.TESTS, "", threshold, Map.of());
    }

    private static RequirementChecker fixedScore(CheckerKind kind, double score) {
        return new RequirementChecker() {
            @Override
            public CheckerKind kind() {
                return kind;
            }

            @Override
            public CheckResult check(CheckContext ctx, RequirementDefinition definition, Component component,
                                     Map<String, Object> options) {
                return new CheckResult(score >= 1.0, score, Map.of("status", "scored"));
            }
        };
    }
}
