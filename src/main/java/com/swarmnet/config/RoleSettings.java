package com.swarmnet.config;

import com.swarmnet.core.agent.Role;

import java.time.Duration;

/**
 * Immutable per-role collaborator configuration resolved by SwarmSettings.
 *
 * timeout       - enforced by AgentExecutor around every invocation
 * temperature   - sampling temperature handed to the LLMClient
 * maxTokens     - generation budget handed to the LLMClient
 * retryAttempts - collaborator-level retries (LlmRoleAgent); the core never retries
 */
public final class RoleSettings {

    private final Role     role;
    private final Duration timeout;
    private final double   temperature;
    private final int      maxTokens;
    private final int      retryAttempts;

    public RoleSettings(Role role, Duration timeout, double temperature, int maxTokens, int retryAttempts) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout for " + role + " must be positive");
        }
        if (retryAttempts < 1) {
            throw new IllegalArgumentException("Retry attempts for " + role + " must be at least 1, got " + retryAttempts);
        }
        this.role          = role;
        this.timeout       = timeout;
        this.temperature   = temperature;
        this.maxTokens     = maxTokens;
        this.retryAttempts = retryAttempts;
    }

    public Role     getRole()          { return role; }
    public Duration getTimeout()       { return timeout; }
    public double   getTemperature()   { return temperature; }
    public int      getMaxTokens()     { return maxTokens; }
    public int      getRetryAttempts() { return retryAttempts; }

    public RoleSettings withTimeout(Duration newTimeout) {
        return new RoleSettings(role, newTimeout, temperature, maxTokens, retryAttempts);
    }

    @Override
    public String toString() {
        return String.format("RoleSettings{%s, timeout=%ds, temperature=%.1f, maxTokens=%d, retries=%d}",
                role, timeout.toSeconds(), temperature, maxTokens, retryAttempts);
    }
}
