package com.swarmnet.core.validation;

import com.swarmnet.core.agent.AgentResult;
import com.swarmnet.core.agent.ConfidenceLevel;
import com.swarmnet.core.agent.Role;
import com.swarmnet.core.agent.SourceRecord;
import com.swarmnet.core.planner.SuccessCriteria;
import com.swarmnet.core.synthesis.Synthesis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * ConfidenceValidator - computes the query's overall confidence.
 *
 *   score = 0.3 · avg(unified source credibility, 0 if none)
 *         + 0.3 · (roles at MEDIUM or better / total roles)
 *         + 0.2 · max(0, 1 − 0.2 · |gaps|)
 *         − 0.1 · |contradictions|
 *
 * The level comes from ConfidenceLevel.fromScore(score) and may differ from
 * what any single role reported about itself.
 */
@Component
public class ConfidenceValidator {

    private static final Logger log = LoggerFactory.getLogger(ConfidenceValidator.class);

    static final double SOURCE_WEIGHT        = 0.3;
    static final double AGREEMENT_WEIGHT     = 0.3;
    static final double COMPLETENESS_WEIGHT  = 0.2;
    static final double GAP_PENALTY          = 0.2;
    static final double CONTRADICTION_WEIGHT = 0.1;

    public ValidationReport validate(Map<Role, AgentResult> results, Synthesis synthesis, SuccessCriteria criteria) {

        double score = score(results, synthesis);
        ConfidenceLevel level = ConfidenceLevel.fromScore(score);

        List<String> strengths = new ArrayList<>();
        List<String> issues    = new ArrayList<>();

        int sourceCount = synthesis.getUnifiedSources().size();
        if (sourceCount >= criteria.getMinSources()) {
            strengths.add(sourceCount + " unified sources (minimum " + criteria.getMinSources() + ")");
        } else {
            issues.add("Only " + sourceCount + " unified sources, expected " + criteria.getMinSources());
        }

        long perspectives = results.values().stream().filter(r -> !r.isDegraded()).count();
        if (perspectives >= criteria.getRequiredPerspectives()) {
            strengths.add(perspectives + " independent perspectives");
        } else {
            issues.add("Only " + perspectives + " non-degraded perspectives, expected "
                    + criteria.getRequiredPerspectives());
        }

        if (level.isAtLeast(criteria.getMinConfidence())) {
            strengths.add("Overall confidence " + level + " meets " + criteria.getMinConfidence());
        } else {
            issues.add("Overall confidence " + level + " below required " + criteria.getMinConfidence());
        }

        if (!synthesis.getContradictions().isEmpty()) {
            issues.add(synthesis.getContradictions().size() + " potential contradictions");
        }
        if (!synthesis.getGaps().isEmpty()) {
            issues.add("Gaps: " + String.join(", ", synthesis.getGaps()));
        }

        ValidationReport report = new ValidationReport(score, level, strengths, issues, issues.isEmpty());
        log.info("[Validator] {}", report);
        return report;
    }

    double score(Map<Role, AgentResult> results, Synthesis synthesis) {
        List<SourceRecord> sources = synthesis.getUnifiedSources();

        double avgCredibility = sources.stream()
                .mapToDouble(SourceRecord::getCredibility)
                .average()
                .orElse(0.0);

        long confident = results.values().stream()
                .filter(r -> r.getConfidenceLevel().isAtLeast(ConfidenceLevel.MEDIUM))
                .count();
        double agreement = results.isEmpty() ? 0.0 : (double) confident / results.size();

        double completeness = Math.max(0.0, 1.0 - GAP_PENALTY * synthesis.getGaps().size());

        return SOURCE_WEIGHT * avgCredibility
                + AGREEMENT_WEIGHT * agreement
                + COMPLETENESS_WEIGHT * completeness
                - CONTRADICTION_WEIGHT * synthesis.getContradictions().size();
    }
}
