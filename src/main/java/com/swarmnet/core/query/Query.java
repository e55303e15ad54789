package com.swarmnet.core.query;

import com.swarmnet.core.agent.ConfidenceLevel;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Query - immutable question submitted to the swarm.
 *
 * Construct via Query.builder(question). The builder applies defaults but does
 * NOT validate: a structurally invalid query (blank question, missing
 * complexity) is rejected by QueryPlanner with a PlanningException so that the
 * failure is reported through the normal FAILED lifecycle.
 *
 * Defaults:
 *   id                 random UUID
 *   context            ""
 *   complexity         INTERMEDIATE
 *   requiredConfidence MEDIUM
 *   timeLimitSeconds   180
 */
public final class Query {

    public static final int DEFAULT_TIME_LIMIT_SECONDS = 180;

    private final String          id;
    private final String          question;
    private final String          context;
    private final ComplexityLevel complexity;
    private final ConfidenceLevel requiredConfidence;
    private final int             timeLimitSeconds;
    private final String          userId;
    private final List<String>    tags;
    private final Instant         submittedAt;

    private Query(Builder b) {
        this.id                 = b.id != null ? b.id : UUID.randomUUID().toString();
        this.question           = b.question;
        this.context            = b.context != null ? b.context : "";
        this.complexity         = b.complexity;
        this.requiredConfidence = b.requiredConfidence != null ? b.requiredConfidence : ConfidenceLevel.MEDIUM;
        this.timeLimitSeconds   = b.timeLimitSeconds;
        this.userId             = b.userId;
        this.tags               = b.tags != null ? List.copyOf(b.tags) : List.of();
        this.submittedAt        = b.submittedAt != null ? b.submittedAt : Instant.now();
    }

    public static Builder builder(String question) {
        return new Builder(question);
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    public String          getId()                 { return id; }
    public String          getQuestion()           { return question; }
    public String          getContext()            { return context; }
    public ComplexityLevel getComplexity()         { return complexity; }
    public ConfidenceLevel getRequiredConfidence() { return requiredConfidence; }
    public int             getTimeLimitSeconds()   { return timeLimitSeconds; }
    public String          getUserId()             { return userId; }
    public List<String>    getTags()               { return tags; }
    public Instant         getSubmittedAt()        { return submittedAt; }

    @Override
    public String toString() {
        String preview = question == null ? "null"
                : question.length() > 60 ? question.substring(0, 60) + "..." : question;
        return "Query{id=" + id + ", complexity=" + complexity + ", question='" + preview + "'}";
    }

    // =========================================================================
    // Builder
    // =========================================================================

    public static final class Builder {
        private final String    question;
        private String          id;
        private String          context;
        private ComplexityLevel complexity         = ComplexityLevel.INTERMEDIATE;
        private ConfidenceLevel requiredConfidence = ConfidenceLevel.MEDIUM;
        private int             timeLimitSeconds   = DEFAULT_TIME_LIMIT_SECONDS;
        private String          userId;
        private List<String>    tags;
        private Instant         submittedAt;

        private Builder(String question) {
            this.question = question;
        }

        public Builder id(String v)                          { this.id = v;                 return this; }
        public Builder context(String v)                     { this.context = v;            return this; }
        public Builder complexity(ComplexityLevel v)         { this.complexity = v;         return this; }
        public Builder requiredConfidence(ConfidenceLevel v) { this.requiredConfidence = v; return this; }
        public Builder timeLimitSeconds(int v)               { this.timeLimitSeconds = v;   return this; }
        public Builder userId(String v)                      { this.userId = v;             return this; }
        public Builder tags(List<String> v)                  { this.tags = v;               return this; }
        public Builder submittedAt(Instant v)                { this.submittedAt = v;        return this; }

        public Query build() { return new Query(this); }
    }
}
