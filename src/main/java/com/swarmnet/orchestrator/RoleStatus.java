package com.swarmnet.orchestrator;

import com.swarmnet.core.agent.Role;

/** Registry view of one role, as reported by SwarmOrchestrator.getStatus(). */
public final class RoleStatus {

    private final Role    role;
    private final String  agentId;
    private final boolean registered;
    private final boolean available;
    private final String  lastError;

    public RoleStatus(Role role, String agentId, boolean registered, boolean available, String lastError) {
        this.role       = role;
        this.agentId    = agentId;
        this.registered = registered;
        this.available  = available;
        this.lastError  = lastError;
    }

    public Role    getRole()       { return role; }
    public String  getAgentId()    { return agentId; }
    public boolean isRegistered()  { return registered; }
    public boolean isAvailable()   { return available; }
    public String  getLastError()  { return lastError; }
}
