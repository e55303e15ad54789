package com.swarmnet.core.task;

import com.swarmnet.core.agent.Role;
import com.swarmnet.core.planner.ExecutionPlan;
import com.swarmnet.core.query.Query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * TaskDistributor - turns a plan into one AgentTask per required role,
 * ordered by ascending priority (MASTER=1 … ANALYSIS=4).
 *
 * Pure: no I/O, cannot fail.
 */
@Component
public class TaskDistributor {

    private static final Logger log = LoggerFactory.getLogger(TaskDistributor.class);

    public List<AgentTask> distribute(Query query, ExecutionPlan plan) {

        List<AgentTask> tasks = new ArrayList<>();

        for (Role role : plan.getRequiredRoles()) {
            tasks.add(new AgentTask(role, role.getPriority(), role.getTaskType(), hintsFor(role, query, plan)));
        }

        tasks.sort(Comparator.comparingInt(AgentTask::getPriority));
        log.info("[Distributor] Query {} → {} tasks {}", query.getId(), tasks.size(), tasks);
        return List.copyOf(tasks);
    }

    private Map<String, String> hintsFor(Role role, Query query, ExecutionPlan plan) {
        Map<String, String> hints = new LinkedHashMap<>(role.getDefaultHints());

        if (role.isMaster()) {
            hints.put("query_type",         plan.getQueryType());
            hints.put("execution_strategy", plan.getStrategy().name());
            hints.put("complexity_factors", String.join(",", plan.getComplexityFactors()));
            hints.put("required_roles",     plan.getRequiredRoles().toString());
        }

        if (!query.getContext().isBlank()) {
            hints.put("query_context", query.getContext());
        }
        return hints;
    }
}
