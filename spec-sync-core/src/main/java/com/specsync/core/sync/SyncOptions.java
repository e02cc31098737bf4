package com.specsync.core.sync;

import java.util.Objects;

/**
 * Options for a single sync pass.
 *
 * @param force recompute every requirement regardless of the changed set
 * @param persist write clears and creates through to the store
 * @param propagation affected-set propagation mode
 */
public record SyncOptions(boolean force, boolean persist, PropagationMode propagation) {

    public SyncOptions {
        Objects.requireNonNull(propagation, "propagation must not be null");
    }

    public static SyncOptions defaults() {
        return new SyncOptions(false, true, PropagationMode.TRANSITIVE);
    }

    public SyncOptions withForce(boolean newForce) {
        return new SyncOptions(newForce, persist, propagation);
    }

    public SyncOptions withPersist(boolean newPersist) {
        return new SyncOptions(force, newPersist, propagation);
    }
}
