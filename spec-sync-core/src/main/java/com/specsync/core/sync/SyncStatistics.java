package com.specsync.core.sync;

/**
 * Counters collected during a sync pass.
 *
 * @param componentCount components in the request
 * @param affectedCount components whose local requirements were recomputed
 * @param localChecks local checks evaluated
 * @param relationalChecks relational checks evaluated
 * @param persistenceFailures requirements dropped because the store rejected them
 * @param durationMillis wall time of the pass
 */
public record SyncStatistics(
    int componentCount,
    int affectedCount,
    int localChecks,
    int relationalChecks,
    int persistenceFailures,
    long durationMillis
) {
}
