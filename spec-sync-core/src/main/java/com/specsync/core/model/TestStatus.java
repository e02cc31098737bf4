package com.specsync.core.model;

/**
 * Outcome of the most recent test run for a single component.
 */
public enum TestStatus {
    PASSING,
    FAILING,
    NOT_RUN
}
