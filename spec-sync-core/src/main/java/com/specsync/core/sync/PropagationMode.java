package com.specsync.core.sync;

/**
 * How far a change propagates when computing the affected set.
 */
public enum PropagationMode {
    /**
     * One ordered pass over the components. Whether an indirect neighbour is picked up
     * depends on the order components are visited in.
     */
    SINGLE_PASS,
    /**
     * Repeats the pass until the affected set stops growing.
     */
    TRANSITIVE
}
