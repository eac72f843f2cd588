package com.gaming.rewire.api;

/** How thoroughly a {@link ReachabilityChecker} explores the graph. */
public enum CheckMode {
    /** First-reach traversal; stops as soon as no new area can be reached. */
    PARTIAL,
    /** Keeps relaxing distances until none improves. */
    FULL,
    /** Like FULL, but only records in-edges that do not lead backwards in distance. */
    FULL_FORWARD
}
