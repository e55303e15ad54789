package com.swarmnet.llm;

import com.swarmnet.core.agent.Role;

/**
 * LLMClient - single interface for all model calls made by role agents.
 *
 * Implementations own the role → system prompt mapping. Agents only supply the
 * task-specific prompt body and the sampling budget from their RoleSettings.
 */
public interface LLMClient {

    /**
     * @param role        role the call is made for; selects the system prompt
     * @param userPrompt  task-specific prompt body
     * @param temperature sampling temperature
     * @param maxTokens   generation budget
     * @return raw model text, never null
     * @throws LlmCallException if the backend could not be reached or answered garbage
     */
    String generateWithRole(Role role, String userPrompt, double temperature, int maxTokens);

    /** Cheap reachability probe used when an agent initialises. */
    default boolean healthCheck() {
        return true;
    }
}
