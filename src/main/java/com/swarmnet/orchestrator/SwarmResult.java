package com.swarmnet.orchestrator;

import com.swarmnet.core.agent.AgentResult;
import com.swarmnet.core.agent.ConfidenceLevel;
import com.swarmnet.core.agent.Role;
import com.swarmnet.core.query.Query;
import com.swarmnet.core.state.QueryState;
import com.swarmnet.core.synthesis.Synthesis;
import com.swarmnet.core.validation.ValidationReport;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * SwarmResult - terminal artifact of one query, returned by
 * SwarmOrchestrator.submitQuery() for every outcome.
 *
 * status is COMPLETED, FAILED or CANCELLED. FAILED and CANCELLED results still
 * carry a master result (orchestrator-authored, degraded), an empty Synthesis
 * and LOW confidence, so callers never have to null-check.
 */
public final class SwarmResult {

    private final Query                  query;
    private final AgentResult            masterResult;
    private final Map<Role, AgentResult> results;
    private final Synthesis              synthesis;
    private final ConfidenceLevel        confidence;
    private final double                 confidenceScore;
    private final ValidationReport       validation;
    private final long                   durationMillis;
    private final Instant                timestamp;
    private final QueryState             status;
    private final String                 failureReason;

    public SwarmResult(
            Query                  query,
            AgentResult            masterResult,
            Map<Role, AgentResult> results,
            Synthesis              synthesis,
            ValidationReport       validation,
            long                   durationMillis,
            QueryState             status,
            String                 failureReason
    ) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("SwarmResult status must be terminal, got " + status);
        }
        this.query           = query;
        this.masterResult    = masterResult;
        this.results         = results.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(results));
        this.synthesis       = synthesis;
        this.confidence      = validation.getLevel();
        this.confidenceScore = validation.getScore();
        this.validation      = validation;
        this.durationMillis  = durationMillis;
        this.timestamp       = Instant.now();
        this.status          = status;
        this.failureReason   = failureReason;
    }

    public Query                  getQuery()           { return query; }
    public AgentResult            getMasterResult()    { return masterResult; }
    public Map<Role, AgentResult> getResults()         { return results; }
    public Synthesis              getSynthesis()       { return synthesis; }
    public ConfidenceLevel        getConfidence()      { return confidence; }
    public double                 getConfidenceScore() { return confidenceScore; }
    public ValidationReport       getValidation()      { return validation; }
    public long                   getDurationMillis()  { return durationMillis; }
    public Instant                getTimestamp()       { return timestamp; }
    public QueryState             getStatus()          { return status; }
    public String                 getFailureReason()   { return failureReason; }

    public boolean isCompleted() {
        return status == QueryState.COMPLETED;
    }

    @Override
    public String toString() {
        return "SwarmResult{query=" + (query != null ? query.getId() : null) + ", status=" + status
                + ", confidence=" + confidence + ", roles=" + results.keySet() + ", duration=" + durationMillis + "ms}";
    }
}
