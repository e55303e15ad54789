package com.swarmnet.core.state;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one query.
 *
 * QUEUED → PLANNING → DISTRIBUTING → EXECUTING → SYNTHESIZING → VALIDATING → COMPLETED
 *
 * FAILED     - from PLANNING (malformed query), DISTRIBUTING / EXECUTING (MASTER
 *              failure) or SYNTHESIZING / VALIDATING (internal invariant)
 * CANCELLED  - from any non-terminal state, on request
 *
 * COMPLETED, FAILED and CANCELLED are terminal: nothing leaves them.
 */
public enum QueryState {
    QUEUED,
    PLANNING,
    DISTRIBUTING,
    EXECUTING,
    SYNTHESIZING,
    VALIDATING,
    COMPLETED,
    FAILED,
    CANCELLED;

    private static final Set<QueryState> TERMINAL = EnumSet.of(COMPLETED, FAILED, CANCELLED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean canTransitionTo(QueryState next) {
        if (isTerminal()) return false;
        if (next == CANCELLED) return true;

        return switch (this) {
            case QUEUED       -> next == PLANNING;
            case PLANNING     -> next == DISTRIBUTING || next == FAILED;
            case DISTRIBUTING -> next == EXECUTING    || next == FAILED;
            case EXECUTING    -> next == SYNTHESIZING || next == FAILED;
            case SYNTHESIZING -> next == VALIDATING   || next == FAILED;
            case VALIDATING   -> next == COMPLETED    || next == FAILED;
            default           -> false;
        };
    }
}
