package com.swarmnet.core.error;

import com.swarmnet.core.agent.Role;

/** A collaborator invocation raised an error or returned an unusable result. */
public class RoleExecutionException extends RoleFailureException {

    public RoleExecutionException(Role role, String message) {
        super(role, message, null);
    }

    public RoleExecutionException(Role role, String message, Throwable cause) {
        super(role, message, cause);
    }
}
