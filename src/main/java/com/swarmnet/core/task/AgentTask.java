package com.swarmnet.core.task;

import com.swarmnet.core.agent.Role;

import java.util.Map;
import java.util.Objects;

/**
 * Immutable task descriptor for one role: priority, task type tag and the
 * role-specific context hints its Agent receives.
 */
public final class AgentTask {

    private final Role                role;
    private final int                 priority;
    private final String              taskType;
    private final Map<String, String> contextHints;

    public AgentTask(Role role, int priority, String taskType, Map<String, String> contextHints) {
        this.role         = Objects.requireNonNull(role, "role");
        this.priority     = priority;
        this.taskType     = taskType;
        this.contextHints = contextHints != null ? Map.copyOf(contextHints) : Map.of();
    }

    public Role                getRole()         { return role; }
    public int                 getPriority()     { return priority; }
    public String              getTaskType()     { return taskType; }
    public Map<String, String> getContextHints() { return contextHints; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AgentTask)) return false;
        AgentTask that = (AgentTask) o;
        return priority == that.priority
                && role == that.role
                && Objects.equals(taskType, that.taskType)
                && contextHints.equals(that.contextHints);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, priority, taskType, contextHints);
    }

    @Override
    public String toString() {
        return "AgentTask{" + role + ", priority=" + priority + ", type=" + taskType + "}";
    }
}
