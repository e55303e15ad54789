package com.swarmnet.core.agent;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Read-only input handed to an Agent alongside the query: the task's context
 * hints and, depending on the execution strategy, the results of roles that
 * already finished (hierarchical phases 2 and 3).
 */
public final class AgentContext {

    private final Map<String, String>    hints;
    private final Map<Role, AgentResult> peerResults;

    public AgentContext(Map<String, String> hints, Map<Role, AgentResult> peerResults) {
        this.hints       = hints != null ? Map.copyOf(hints) : Map.of();
        this.peerResults = peerResults == null || peerResults.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(peerResults));
    }

    public static AgentContext empty() {
        return new AgentContext(Map.of(), Map.of());
    }

    public Map<String, String>    getHints()       { return hints; }
    public Map<Role, AgentResult> getPeerResults() { return peerResults; }

    public String hint(String key) {
        return hints.get(key);
    }

    public boolean hasPeerResults() {
        return !peerResults.isEmpty();
    }
}
