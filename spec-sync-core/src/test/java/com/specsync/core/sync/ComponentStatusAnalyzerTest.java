package com.specsync.core.sync;

import com.specsync.core.SyncFixtures;
import com.specsync.core.layout.ConventionalFileLayout;
import com.specsync.core.model.Component;
import com.specsync.core.model.ComponentStatus;
import com.specsync.core.model.ComponentType;
import com.specsync.core.model.FileKind;
import com.specsync.core.model.TestFailure;
import com.specsync.core.model.TestRun;
import com.specsync.core.model.TestStatus;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ComponentStatusAnalyzer}.
 */
class ComponentStatusAnalyzerTest {

    private static final String TEST_FILE = "test/shop/mailer_test.exs";

    private final ComponentStatusAnalyzer analyzer = new ComponentStatusAnalyzer(new ConventionalFileLayout(), SyncFixtures.CLOCK);
    private final Component mailer = Component.of("m", "Shop.Mailer", ComponentType.MODULE, null);

    @Test
    void analyze_reportsExistingFilesAndExpectedPaths() {
        Set<String> files = Set.of("docs/spec/shop/mailer.spec.md", "lib/shop/mailer.ex");

        ComponentStatus status = analyzer.analyze(mailer, SyncFixtures.PROJECT, files::contains, TestRun.none());

        assertThat(status.specExists()).isTrue();
        assertThat(status.codeExists()).isTrue();
        assertThat(status.testExists()).isFalse();
        assertThat(status.expectedFile(FileKind.TEST)).isEqualTo(TEST_FILE);
        assertThat(status.expectedFile(FileKind.REVIEW)).isNull();
        assertThat(status.testStatus()).isEqualTo(TestStatus.NOT_RUN);
        assertThat(status.computedAt()).isEqualTo(SyncFixtures.NOW);
    }

    @Test
    void analyze_withFailuresInOwnTestFile_isFailing() {
        TestRun run = TestRun.of(SyncFixtures.NOW, List.of(
            new TestFailure("sends welcome email", TEST_FILE),
            new TestFailure("other", "test/shop/orders_test.exs")));

        ComponentStatus status = analyzer.analyze(mailer, SyncFixtures.PROJECT, Set.of(TEST_FILE)::contains, run);

        assertThat(status.testStatus()).isEqualTo(TestStatus.FAILING);
        assertThat(status.failingTests()).containsExactly("sends welcome email");
    }

    @Test
    void analyze_withRunAndNoOwnFailures_isPassing() {
        TestRun run = TestRun.of(SyncFixtures.NOW, List.of(new TestFailure("other", "test/shop/orders_test.exs")));

        ComponentStatus status = analyzer.analyze(mailer, SyncFixtures.PROJECT, Set.of(TEST_FILE)::contains, run);

        assertThat(status.testStatus()).isEqualTo(TestStatus.PASSING);
    }

    @Test
    void analyze_withoutTestFile_isNotRunEvenWhenRunExecuted() {
        ComponentStatus status = analyzer.analyze(mailer, SyncFixtures.PROJECT, path -> false,
            TestRun.of(SyncFixtures.NOW, List.of()));

        assertThat(status.testStatus()).isEqualTo(TestStatus.NOT_RUN);
    }
}
