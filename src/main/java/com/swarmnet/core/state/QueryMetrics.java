package com.swarmnet.core.state;

import com.swarmnet.core.agent.ConfidenceLevel;
import com.swarmnet.core.agent.Role;
import com.swarmnet.core.query.ComplexityLevel;

import java.time.Instant;
import java.util.Set;

/** One finished query's entry in PerformanceMetricsStore. */
public final class QueryMetrics {

    private final String          queryId;
    private final ComplexityLevel complexity;
    private final long            processingMillis;
    private final Set<Role>       rolesUsed;
    private final int             sourcesFound;
    private final ConfidenceLevel confidence;
    private final QueryState      state;
    private final Instant         timestamp;

    public QueryMetrics(
            String          queryId,
            ComplexityLevel complexity,
            long            processingMillis,
            Set<Role>       rolesUsed,
            int             sourcesFound,
            ConfidenceLevel confidence,
            QueryState      state,
            Instant         timestamp
    ) {
        this.queryId          = queryId;
        this.complexity       = complexity;
        this.processingMillis = processingMillis;
        this.rolesUsed        = Set.copyOf(rolesUsed);
        this.sourcesFound     = sourcesFound;
        this.confidence       = confidence;
        this.state            = state;
        this.timestamp        = timestamp;
    }

    public String          getQueryId()          { return queryId; }
    public ComplexityLevel getComplexity()       { return complexity; }
    public long            getProcessingMillis() { return processingMillis; }
    public Set<Role>       getRolesUsed()        { return rolesUsed; }
    public int             getSourcesFound()     { return sourcesFound; }
    public ConfidenceLevel getConfidence()       { return confidence; }
    public QueryState      getState()            { return state; }
    public Instant         getTimestamp()        { return timestamp; }
}
