package com.specsync.core.model;

/**
 * The next piece of work a component needs, derived from its {@link ComponentStatus}.
 */
public enum NextAction {
    CREATE_SPEC,
    IMPLEMENT_CODE,
    WRITE_TESTS,
    FIX_TESTS,
    COMPLETE
}
