package com.swarmnet.core.validation;

import com.swarmnet.core.agent.ConfidenceLevel;

import java.util.List;

/**
 * Outcome of ConfidenceValidator. The level is authoritative for the query;
 * strengths and issues are diagnostics against the plan's success criteria.
 */
public final class ValidationReport {

    private final double          score;
    private final ConfidenceLevel level;
    private final List<String>    strengths;
    private final List<String>    issues;
    private final boolean         criteriaMet;

    public ValidationReport(double score, ConfidenceLevel level, List<String> strengths, List<String> issues,
                            boolean criteriaMet) {
        this.score       = score;
        this.level       = level;
        this.strengths   = List.copyOf(strengths);
        this.issues      = List.copyOf(issues);
        this.criteriaMet = criteriaMet;
    }

    /** Report for a query that never reached validation. */
    public static ValidationReport notValidated(String reason) {
        return new ValidationReport(0.0, ConfidenceLevel.LOW, List.of(), List.of(reason), false);
    }

    public double          getScore()       { return score; }
    public ConfidenceLevel getLevel()       { return level; }
    public List<String>    getStrengths()   { return strengths; }
    public List<String>    getIssues()      { return issues; }
    public boolean         isCriteriaMet()  { return criteriaMet; }

    @Override
    public String toString() {
        return String.format("ValidationReport{score=%.3f, level=%s, criteriaMet=%b, issues=%s}",
                score, level, criteriaMet, issues);
    }
}
