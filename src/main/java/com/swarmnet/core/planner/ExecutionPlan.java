package com.swarmnet.core.planner;

import com.swarmnet.core.agent.Role;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * ExecutionPlan - QueryPlanner's decision for one query.
 *
 * INVARIANT: requiredRoles always contains Role.MASTER and at least one other role.
 */
public final class ExecutionPlan {

    private final String            queryType;
    private final Set<String>       complexityFactors;
    private final Set<Role>         requiredRoles;
    private final ExecutionStrategy strategy;
    private final SuccessCriteria   successCriteria;
    private final int               estimatedSeconds;

    public ExecutionPlan(
            String            queryType,
            Set<String>       complexityFactors,
            Set<Role>         requiredRoles,
            ExecutionStrategy strategy,
            SuccessCriteria   successCriteria,
            int               estimatedSeconds
    ) {
        if (!requiredRoles.contains(Role.MASTER)) {
            throw new IllegalArgumentException("An execution plan must include MASTER");
        }
        this.queryType         = queryType;
        this.complexityFactors = Collections.unmodifiableSet(new LinkedHashSet<>(complexityFactors));
        this.requiredRoles     = Collections.unmodifiableSet(EnumSet.copyOf(requiredRoles));
        this.strategy          = strategy;
        this.successCriteria   = successCriteria;
        this.estimatedSeconds  = estimatedSeconds;
    }

    public String            getQueryType()         { return queryType; }
    public Set<String>       getComplexityFactors() { return complexityFactors; }
    public Set<Role>         getRequiredRoles()     { return requiredRoles; }
    public ExecutionStrategy getStrategy()          { return strategy; }
    public SuccessCriteria   getSuccessCriteria()   { return successCriteria; }
    public int               getEstimatedSeconds()  { return estimatedSeconds; }

    public boolean requires(Role role) {
        return requiredRoles.contains(role);
    }

    @Override
    public String toString() {
        return "ExecutionPlan{type=" + queryType + ", roles=" + requiredRoles + ", strategy=" + strategy
                + ", factors=" + complexityFactors + "}";
    }
}
