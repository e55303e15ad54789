package com.swarmnet.core.planner;

import com.swarmnet.core.agent.ConfidenceLevel;

/**
 * Thresholds a finished query is checked against by ConfidenceValidator.
 * They shape the validation report; they never change the computed level.
 */
public final class SuccessCriteria {

    private final int             minSources;
    private final ConfidenceLevel minConfidence;
    private final int             requiredPerspectives;

    public SuccessCriteria(int minSources, ConfidenceLevel minConfidence, int requiredPerspectives) {
        this.minSources           = minSources;
        this.minConfidence        = minConfidence;
        this.requiredPerspectives = requiredPerspectives;
    }

    public int             getMinSources()           { return minSources; }
    public ConfidenceLevel getMinConfidence()        { return minConfidence; }
    public int             getRequiredPerspectives() { return requiredPerspectives; }

    @Override
    public String toString() {
        return "SuccessCriteria{minSources=" + minSources + ", minConfidence=" + minConfidence
                + ", requiredPerspectives=" + requiredPerspectives + "}";
    }
}
