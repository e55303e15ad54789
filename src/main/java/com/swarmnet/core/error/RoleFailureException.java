package com.swarmnet.core.error;

import com.swarmnet.core.agent.Role;

/**
 * Base for failures attributable to a single role's collaborator.
 */
public abstract class RoleFailureException extends SwarmException {

    private final Role role;

    protected RoleFailureException(Role role, String message, Throwable cause) {
        super(role + ": " + message, cause);
        this.role = role;
    }

    public Role getRole() {
        return role;
    }
}
