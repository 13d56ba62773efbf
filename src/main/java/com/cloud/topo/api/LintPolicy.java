package com.cloud.topo.api;

/**
 * How a non-structural finding is treated.
 */
public enum LintPolicy {
    /** Dropped silently. */
    IGNORE,
    /** Logged and kept in the finalized graph's warning list. */
    WARN,
    /** Promoted to an error. */
    REJECT
}
