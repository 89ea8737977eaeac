package com.vidnyan.eaf.domain.engine;

/**
 * How a merge treats annotations that overlap within one tier.
 * Only {@link #FAIL} is implemented; the other strategies are rejected.
 */
public enum OverlapStrategy {
    /** Report overlapping annotations as an error. */
    FAIL,
    JOIN,
    DISCARD_FIRST,
    DISCARD_LAST,
    PRIORITIZE_FIRST,
    PRIORITIZE_LAST;

    public boolean implemented() {
        return this == FAIL;
    }
}
