package com.specsync.core.sync;

import com.specsync.core.layout.FileLayoutResolver;
import com.specsync.core.model.Component;
import com.specsync.core.model.ComponentStatus;
import com.specsync.core.model.FileKind;
import com.specsync.core.model.ProjectInfo;
import com.specsync.core.model.TestFailure;
import com.specsync.core.model.TestRun;
import com.specsync.core.model.TestStatus;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Derives a {@link ComponentStatus} from the project's files and the latest test run.
 *
 * <p>Failures are attributed to a component when the failure's file equals the
 * component's expected test file.
 */
public class ComponentStatusAnalyzer {

    private final FileLayoutResolver layout;
    private final Clock clock;

    public ComponentStatusAnalyzer(FileLayoutResolver layout, Clock clock) {
        this.layout = Objects.requireNonNull(layout, "layout must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Computes the status of one component.
     *
     * @param component component
     * @param project owning project
     * @param fileExists file existence test over relative paths
     * @param testRun latest test run
     * @return fresh status
     */
    public ComponentStatus analyze(Component component, ProjectInfo project,
                                   Predicate<String> fileExists, TestRun testRun) {
        Map<FileKind, String> expected = layout.expectedFiles(component, project);

        boolean specExists = exists(expected, FileKind.SPEC, fileExists);
        boolean codeExists = exists(expected, FileKind.CODE, fileExists);
        boolean testExists = exists(expected, FileKind.TEST, fileExists);
        boolean reviewExists = exists(expected, FileKind.REVIEW, fileExists);
        boolean designExists = exists(expected, FileKind.DESIGN, fileExists);

        List<String> failingTests = testRun.failuresFor(expected.get(FileKind.TEST)).stream()
            .map(TestFailure::title)
            .toList();

        return new ComponentStatus(specExists, codeExists, testExists, reviewExists, designExists,
            testStatus(testExists, testRun, failingTests), expected, failingTests, clock.instant());
    }

    private static TestStatus testStatus(boolean testExists, TestRun testRun, List<String> failingTests) {
        if (!testExists || !testRun.executed()) {
            return TestStatus.NOT_RUN;
        }
        return failingTests.isEmpty() ? TestStatus.PASSING : TestStatus.FAILING;
    }

    private static boolean exists(Map<FileKind, String> expected, FileKind kind, Predicate<String> fileExists) {
        String path = expected.get(kind);
        return path != null && fileExists.test(path);
    }
}
