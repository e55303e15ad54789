package com.swarmnet.core.error;

/**
 * Root of the checked error taxonomy for one query's lifecycle.
 *
 *   PlanningException        - malformed query; query ends FAILED
 *   RoleUnavailableException - collaborator missing or not initialised
 *   RoleTimeoutException     - per-invocation timeout expired
 *   RoleExecutionException   - collaborator raised an error
 *   SynthesisException       - internal invariant violated while merging
 *   QueryCancelledException  - cooperative cancellation observed
 *
 * Role failures are absorbed into degraded results for every role except
 * MASTER. Nothing in this hierarchy ever reaches the caller of
 * SwarmOrchestrator.submitQuery(); it is turned into a SwarmResult status.
 */
public class SwarmException extends Exception {

    public SwarmException(String message) {
        super(message);
    }

    public SwarmException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Short machine-readable tag carried in degraded-result metadata. */
    public String getErrorType() {
        return getClass().getSimpleName();
    }
}
