package com.specsync.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Derived snapshot of a component's files and test outcome.
 *
 * <p>Recomputed for every component on every sync; never persisted as a source of truth.
 *
 * @param specExists whether the specification file exists
 * @param codeExists whether the implementation file exists
 * @param testExists whether the test file exists
 * @param reviewExists whether the design review file exists
 * @param designExists whether the design document exists
 * @param testStatus outcome of the latest test run for this component
 * @param expectedFiles expected path per file kind
 * @param failingTests titles of failing tests attributed to this component
 * @param computedAt when the snapshot was taken
 */
public record ComponentStatus(
    boolean specExists,
    boolean codeExists,
    boolean testExists,
    boolean reviewExists,
    boolean designExists,
    TestStatus testStatus,
    Map<FileKind, String> expectedFiles,
    List<String> failingTests,
    Instant computedAt
) {

    public ComponentStatus {
        Objects.requireNonNull(testStatus, "testStatus must not be null");
        expectedFiles = expectedFiles == null ? Map.of() : Map.copyOf(expectedFiles);
        failingTests = failingTests == null ? List.of() : List.copyOf(failingTests);
    }

    /**
     * Status of a component nothing is known about yet.
     *
     * @return status with every flag false and tests not run
     */
    public static ComponentStatus unknown() {
        return new ComponentStatus(false, false, false, false, false,
            TestStatus.NOT_RUN, Map.of(), List.of(), null);
    }

    /**
     * Returns false for {@link #unknown()} and any snapshot never produced by an analysis.
     *
     * @return whether the snapshot carries a computation time
     */
    public boolean computed() {
        return computedAt != null;
    }

    public String expectedFile(FileKind kind) {
        return expectedFiles.get(kind);
    }

    /**
     * Returns true when the specification, implementation and tests all exist and tests pass.
     *
     * @return whether the component needs no further work
     */
    public boolean fullySatisfied() {
        return specExists && codeExists && testExists && testStatus == TestStatus.PASSING;
    }

    /**
     * Returns true when the next development step can start.
     *
     * @return whether work is possible on this component
     */
    public boolean readyForWork() {
        if (!specExists) {
            return true;
        }
        if (!codeExists || !testExists) {
            return true;
        }
        return testStatus == TestStatus.FAILING;
    }

    public NextAction nextAction() {
        if (!specExists) {
            return NextAction.CREATE_SPEC;
        }
        if (!codeExists) {
            return NextAction.IMPLEMENT_CODE;
        }
        if (!testExists) {
            return NextAction.WRITE_TESTS;
        }
        if (testStatus == TestStatus.FAILING) {
            return NextAction.FIX_TESTS;
        }
        return NextAction.COMPLETE;
    }
}
