package com.swarmnet.core.agent;

import java.util.Map;

/**
 * Role - closed set of responder specialisations in the swarm.
 *
 * Each constant carries its dispatch priority (lower runs first under the
 * sequential strategy), its task type tag and the context hints every task
 * for that role starts from.
 *
 *   MASTER     1  orchestration  - final verdict; mandatory in every plan
 *   SEARCH     2  research       - evidence and sources
 *   INNOVATION 3  innovation     - first-principles, novel angles
 *   ANALYSIS   4  analysis       - critical inquiry, raised questions
 */
public enum Role {

    MASTER(1, "orchestration", Map.of()),
    SEARCH(2, "research", Map.of("focus", "academic_sources")),
    INNOVATION(3, "innovation", Map.of("approach", "first_principles")),
    ANALYSIS(4, "analysis", Map.of("depth", "critical_inquiry"));

    private final int                 priority;
    private final String              taskType;
    private final Map<String, String> defaultHints;

    Role(int priority, String taskType, Map<String, String> defaultHints) {
        this.priority     = priority;
        this.taskType     = taskType;
        this.defaultHints = defaultHints;
    }

    public int getPriority() {
        return priority;
    }

    public String getTaskType() {
        return taskType;
    }

    public Map<String, String> getDefaultHints() {
        return defaultHints;
    }

    public boolean isMaster() {
        return this == MASTER;
    }
}
