package com.swarmnet.core.agent;

import com.swarmnet.core.error.SwarmException;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * AgentResult - immutable output of one role for one query.
 *
 * Produced exactly once per role per query, either by the role's Agent or by
 * AgentExecutor's degraded path (see degraded()). Never mutated afterwards.
 *
 * Confidence is stored as a score in [0, 1] (clamped); getConfidenceLevel()
 * derives the ordinal via ConfidenceLevel.fromScore().
 *
 * METADATA KEYS written by this codebase:
 *   error       - message of the failure that produced a degraded result
 *   error_type  - SwarmException.getErrorType() of that failure
 *   degraded    - Boolean.TRUE on degraded results
 *   output_format - "json" or "text", set by RoleResponseParser
 */
public final class AgentResult {

    public static final String META_ERROR         = "error";
    public static final String META_ERROR_TYPE    = "error_type";
    public static final String META_DEGRADED      = "degraded";
    public static final String META_OUTPUT_FORMAT = "output_format";

    private final Role                role;
    private final String              content;
    private final double              confidence;
    private final List<SourceRecord>  sources;
    private final String              reasoning;
    private final List<String>        questionsRaised;
    private final Map<String, Object> metadata;
    private final long                processingMillis;
    private final Instant             timestamp;
    private final boolean             degraded;

    private AgentResult(Builder b) {
        this.role             = b.role;
        this.content          = b.content != null ? b.content : "";
        this.confidence       = SourceRecord.clamp(b.confidence);
        this.sources          = b.sources != null ? List.copyOf(b.sources) : List.of();
        this.reasoning        = b.reasoning != null ? b.reasoning : "";
        this.questionsRaised  = b.questionsRaised != null ? List.copyOf(b.questionsRaised) : List.of();
        this.metadata         = b.metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata))
                : Map.of();
        this.processingMillis = Math.max(0, b.processingMillis);
        this.timestamp        = b.timestamp != null ? b.timestamp : Instant.now();
        this.degraded         = b.degraded;
    }

    // =========================================================================
    // Static factories
    // =========================================================================

    public static Builder builder(Role role) {
        if (role == null) {
            throw new IllegalArgumentException("AgentResult role cannot be null");
        }
        return new Builder(role);
    }

    /**
     * The single substitute shape used whenever a role could not deliver:
     * LOW confidence (score 0.0), error summary as content, no sources,
     * failure recorded in metadata.
     */
    public static AgentResult degraded(Role role, SwarmException error, long processingMillis) {
        String message = error.getMessage() != null ? error.getMessage() : error.getErrorType();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(META_ERROR,      message);
        metadata.put(META_ERROR_TYPE, error.getErrorType());
        metadata.put(META_DEGRADED,   Boolean.TRUE);

        return builder(role)
                .content("Role " + role + " could not complete: " + message)
                .confidence(0.0)
                .reasoning("Degraded result substituted after " + error.getErrorType())
                .metadata(metadata)
                .processingMillis(processingMillis)
                .degraded(true)
                .build();
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    public Role                getRole()             { return role; }
    public String              getContent()          { return content; }
    public double              getConfidence()       { return confidence; }
    public List<SourceRecord>  getSources()          { return sources; }
    public String              getReasoning()        { return reasoning; }
    public List<String>        getQuestionsRaised()  { return questionsRaised; }
    public Map<String, Object> getMetadata()         { return metadata; }
    public long                getProcessingMillis() { return processingMillis; }
    public Instant             getTimestamp()        { return timestamp; }
    public boolean             isDegraded()          { return degraded; }

    public ConfidenceLevel getConfidenceLevel() {
        return ConfidenceLevel.fromScore(confidence);
    }

    @Override
    public String toString() {
        return String.format("AgentResult{role=%s, confidence=%.2f (%s), sources=%d, degraded=%b}",
                role, confidence, getConfidenceLevel(), sources.size(), degraded);
    }

    // =========================================================================
    // Builder
    // =========================================================================

    public static final class Builder {
        private final Role          role;
        private String              content;
        private double              confidence;
        private List<SourceRecord>  sources;
        private String              reasoning;
        private List<String>        questionsRaised;
        private Map<String, Object> metadata;
        private long                processingMillis;
        private Instant             timestamp;
        private boolean             degraded;

        private Builder(Role role) {
            this.role = role;
        }

        public Builder content(String v)                  { this.content = v;          return this; }
        public Builder confidence(double v)               { this.confidence = v;       return this; }
        public Builder sources(List<SourceRecord> v)      { this.sources = v;          return this; }
        public Builder reasoning(String v)                { this.reasoning = v;        return this; }
        public Builder questionsRaised(List<String> v)    { this.questionsRaised = v;  return this; }
        public Builder metadata(Map<String, Object> v)    { this.metadata = v;         return this; }
        public Builder processingMillis(long v)           { this.processingMillis = v; return this; }
        public Builder timestamp(Instant v)               { this.timestamp = v;        return this; }
        public Builder degraded(boolean v)                { this.degraded = v;         return this; }

        public AgentResult build() { return new AgentResult(this); }
    }
}
