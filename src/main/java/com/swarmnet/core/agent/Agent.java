package com.swarmnet.core.agent;

import com.swarmnet.core.error.RoleExecutionException;
import com.swarmnet.core.error.RoleUnavailableException;
import com.swarmnet.core.query.Query;

/**
 * Collaborator contract - one implementation per Role.
 *
 * How an agent produces its content is opaque to the orchestration core. The
 * core only relies on:
 *   - initialize() being safe to call more than once (the orchestrator makes a
 *     single best-effort re-attempt for an uninitialised MASTER)
 *   - processQuery() returning a result for getRole(), or throwing
 *     RoleExecutionException; timeouts are enforced by AgentExecutor
 */
public interface Agent {

    String getAgentId();

    Role getRole();

    default void initialize() throws RoleUnavailableException {
    }

    default boolean isInitialized() {
        return true;
    }

    AgentResult processQuery(Query query, AgentContext context) throws RoleExecutionException;
}
