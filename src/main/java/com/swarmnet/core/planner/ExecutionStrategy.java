package com.swarmnet.core.planner;

import com.swarmnet.core.query.ComplexityLevel;

/**
 * Concurrency shape of the EXECUTING phase. A pure function of complexity:
 *
 *   BASIC        → SEQUENTIAL          one task at a time, ascending priority
 *   INTERMEDIATE → PARALLEL            peers fan out, joined, then MASTER alone
 *   ADVANCED     → HIERARCHICAL        SEARCH → {INNOVATION, ANALYSIS} → MASTER
 *   RESEARCH     → FULL_ORCHESTRATION  one batch on the shared pool; falls back
 *                                      to HIERARCHICAL if the pool fails
 */
public enum ExecutionStrategy {
    SEQUENTIAL,
    PARALLEL,
    HIERARCHICAL,
    FULL_ORCHESTRATION;

    public static ExecutionStrategy forComplexity(ComplexityLevel complexity) {
        return switch (complexity) {
            case BASIC        -> SEQUENTIAL;
            case INTERMEDIATE -> PARALLEL;
            case ADVANCED     -> HIERARCHICAL;
            case RESEARCH     -> FULL_ORCHESTRATION;
        };
    }
}
