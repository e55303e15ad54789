package com.swarmnet.core.synthesis;

import com.swarmnet.core.agent.ConfidenceLevel;
import com.swarmnet.core.agent.Role;

import java.util.List;
import java.util.Objects;

/** Per-role digest inside a Synthesis. */
public final class RoleSummary {

    private final Role            role;
    private final int             contentLength;
    private final int             sourceCount;
    private final double          confidence;
    private final ConfidenceLevel confidenceLevel;
    private final long            processingMillis;
    private final boolean         degraded;
    private final List<String>    keyPoints;

    public RoleSummary(
            Role            role,
            int             contentLength,
            int             sourceCount,
            double          confidence,
            ConfidenceLevel confidenceLevel,
            long            processingMillis,
            boolean         degraded,
            List<String>    keyPoints
    ) {
        this.role             = role;
        this.contentLength    = contentLength;
        this.sourceCount      = sourceCount;
        this.confidence       = confidence;
        this.confidenceLevel  = confidenceLevel;
        this.processingMillis = processingMillis;
        this.degraded         = degraded;
        this.keyPoints        = List.copyOf(keyPoints);
    }

    public Role            getRole()             { return role; }
    public int             getContentLength()    { return contentLength; }
    public int             getSourceCount()      { return sourceCount; }
    public double          getConfidence()       { return confidence; }
    public ConfidenceLevel getConfidenceLevel()  { return confidenceLevel; }
    public long            getProcessingMillis() { return processingMillis; }
    public boolean         isDegraded()          { return degraded; }
    public List<String>    getKeyPoints()        { return keyPoints; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RoleSummary)) return false;
        RoleSummary that = (RoleSummary) o;
        return contentLength == that.contentLength
                && sourceCount == that.sourceCount
                && Double.compare(confidence, that.confidence) == 0
                && processingMillis == that.processingMillis
                && degraded == that.degraded
                && role == that.role
                && confidenceLevel == that.confidenceLevel
                && keyPoints.equals(that.keyPoints);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, contentLength, sourceCount, confidence, confidenceLevel,
                processingMillis, degraded, keyPoints);
    }

    @Override
    public String toString() {
        return "RoleSummary{" + role + ", sources=" + sourceCount + ", level=" + confidenceLevel
                + ", degraded=" + degraded + "}";
    }
}
