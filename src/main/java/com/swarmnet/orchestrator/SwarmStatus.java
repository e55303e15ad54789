package com.swarmnet.orchestrator;

import com.swarmnet.core.agent.Role;
import com.swarmnet.core.state.QueryMetrics;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Point-in-time snapshot returned by SwarmOrchestrator.getStatus(). */
public final class SwarmStatus {

    private final Map<Role, RoleStatus> roles;
    private final int                   activeQueries;
    private final int                   totalProcessed;
    private final double                averageProcessingMillis;
    private final List<QueryMetrics>    metrics;

    public SwarmStatus(Map<Role, RoleStatus> roles, int activeQueries, int totalProcessed,
                       double averageProcessingMillis, List<QueryMetrics> metrics) {
        this.roles                   = Collections.unmodifiableMap(new EnumMap<>(roles));
        this.activeQueries           = activeQueries;
        this.totalProcessed          = totalProcessed;
        this.averageProcessingMillis = averageProcessingMillis;
        this.metrics                 = List.copyOf(metrics);
    }

    public Map<Role, RoleStatus> getRoles()                   { return roles; }
    public int                   getActiveQueries()           { return activeQueries; }
    public int                   getTotalProcessed()          { return totalProcessed; }
    public double                getAverageProcessingMillis() { return averageProcessingMillis; }
    public List<QueryMetrics>    getMetrics()                 { return metrics; }
}
