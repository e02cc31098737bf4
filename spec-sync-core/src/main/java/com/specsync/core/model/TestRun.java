package com.specsync.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Result of the most recent test run over the project.
 *
 * <p>A run that never happened is represented by {@link #none()}; every component
 * with a test file then reports {@link TestStatus#NOT_RUN}.
 *
 * @param executed whether a run took place
 * @param executedAt when the run finished, null when not executed
 * @param failures failing tests, empty when all passed
 */
public record TestRun(boolean executed, Instant executedAt, List<TestFailure> failures) {

    public TestRun {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static TestRun none() {
        return new TestRun(false, null, List.of());
    }

    public static TestRun of(Instant executedAt, List<TestFailure> failures) {
        return new TestRun(true, executedAt, failures);
    }

    /**
     * Returns the failures attributed to the given test file.
     *
     * @param testFile expected test file path
     * @return failures whose file equals {@code testFile}
     */
    public List<TestFailure> failuresFor(String testFile) {
        if (testFile == null) {
            return List.of();
        }
        return failures.stream()
            .filter(failure -> testFile.equals(failure.file()))
            .toList();
    }
}
