package com.swarmnet.core.error;

import com.swarmnet.core.agent.Role;

/** The collaborator for a role could not be found or initialised. */
public class RoleUnavailableException extends RoleFailureException {

    public RoleUnavailableException(Role role, String message) {
        super(role, message, null);
    }

    public RoleUnavailableException(Role role, String message, Throwable cause) {
        super(role, message, cause);
    }
}
