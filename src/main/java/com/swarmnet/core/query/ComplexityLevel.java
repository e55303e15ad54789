package com.swarmnet.core.query;

/**
 * Ordinal complexity of a query: BASIC &lt; INTERMEDIATE &lt; ADVANCED &lt; RESEARCH.
 *
 * Drives the execution strategy and whether the Analysis role is pulled in.
 */
public enum ComplexityLevel {
    BASIC,
    INTERMEDIATE,
    ADVANCED,
    RESEARCH;

    public boolean isAtLeast(ComplexityLevel other) {
        return compareTo(other) >= 0;
    }
}
