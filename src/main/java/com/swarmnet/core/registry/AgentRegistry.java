package com.swarmnet.core.registry;

import com.swarmnet.core.agent.Agent;
import com.swarmnet.core.agent.Role;
import com.swarmnet.core.error.RoleUnavailableException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * AgentRegistry - capability table keyed by Role.
 *
 * Spring injects every Agent bean; at most one agent may claim each role.
 * Agents are initialised once the application is ready. A failed
 * initialisation is recorded, not rethrown: the role simply reports as
 * unavailable and AgentExecutor substitutes a degraded result (or, for
 * MASTER, the orchestrator makes one re-attempt before failing the query).
 */
@Component
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final Map<Role, Agent>  agentsByRole;
    private final Map<Role, String> initErrors = new ConcurrentHashMap<>();

    public AgentRegistry(List<Agent> agents) {
        Map<Role, Agent> byRole = new EnumMap<>(Role.class);
        for (Agent agent : agents) {
            Agent previous = byRole.putIfAbsent(agent.getRole(), agent);
            if (previous != null) {
                throw new IllegalStateException("Role " + agent.getRole() + " claimed by both "
                        + previous.getAgentId() + " and " + agent.getAgentId());
            }
        }
        this.agentsByRole = Collections.unmodifiableMap(byRole);
        log.info("[Registry] Registered agents for roles {}", agentsByRole.keySet());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void initializeAll() {
        for (Role role : agentsByRole.keySet()) {
            try {
                initialize(role);
            } catch (RoleUnavailableException e) {
                log.warn("[Registry] {} unavailable after startup: {}", role, e.getMessage());
            }
        }
    }

    /**
     * Initialise (or re-initialise) the agent for a role.
     *
     * @throws RoleUnavailableException if no agent is registered or initialize() fails
     */
    public void initialize(Role role) throws RoleUnavailableException {
        Agent agent = agentsByRole.get(role);
        if (agent == null) {
            throw new RoleUnavailableException(role, "no agent registered");
        }
        try {
            agent.initialize();
            initErrors.remove(role);
            log.info("[Registry] Initialized {} ({})", role, agent.getAgentId());
        } catch (RoleUnavailableException e) {
            initErrors.put(role, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            initErrors.put(role, String.valueOf(e.getMessage()));
            throw new RoleUnavailableException(role, "initialization failed: " + e.getMessage(), e);
        }
    }

    /**
     * The initialised agent for a role.
     *
     * @throws RoleUnavailableException if the role has no agent or it is not initialised
     */
    public Agent requireAvailable(Role role) throws RoleUnavailableException {
        Agent agent = agentsByRole.get(role);
        if (agent == null) {
            throw new RoleUnavailableException(role, "no agent registered");
        }
        if (!agent.isInitialized()) {
            String reason = initErrors.getOrDefault(role, "agent not initialized");
            throw new RoleUnavailableException(role, reason);
        }
        return agent;
    }

    public boolean isAvailable(Role role) {
        Agent agent = agentsByRole.get(role);
        return agent != null && agent.isInitialized();
    }

    public Optional<Agent> find(Role role) {
        return Optional.ofNullable(agentsByRole.get(role));
    }

    public Optional<String> lastInitError(Role role) {
        return Optional.ofNullable(initErrors.get(role));
    }

    public Map<Role, Agent> getAllAgents() {
        return agentsByRole;
    }
}
