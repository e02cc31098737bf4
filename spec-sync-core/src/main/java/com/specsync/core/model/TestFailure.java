package com.specsync.core.model;

import java.util.Objects;

/**
 * A single failing test.
 *
 * @param title test title as reported by the runner
 * @param file test source file the failure is attributed to, relative to the project root
 */
public record TestFailure(String title, String file) {

    public TestFailure {
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(file, "file must not be null");
    }
}
