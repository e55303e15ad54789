package com.swarmnet.core.error;

import com.swarmnet.core.agent.Role;

import java.time.Duration;

public class RoleTimeoutException extends RoleFailureException {

    private final Duration timeout;

    public RoleTimeoutException(Role role, Duration timeout) {
        super(role, "no result within " + timeout.toMillis() + " ms", null);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
