package com.swarmnet.core.validation;

import com.swarmnet.core.agent.AgentResult;
import com.swarmnet.core.agent.ConfidenceLevel;
import com.swarmnet.core.agent.Role;
import com.swarmnet.core.agent.SourceRecord;
import com.swarmnet.core.error.SynthesisException;
import com.swarmnet.core.planner.SuccessCriteria;
import com.swarmnet.core.query.Query;
import com.swarmnet.core.synthesis.ResultSynthesizer;
import com.swarmnet.core.synthesis.Synthesis;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfidenceValidatorTest {

    private final ConfidenceValidator validator   = new ConfidenceValidator();
    private final ResultSynthesizer   synthesizer = new ResultSynthesizer();
    private final SuccessCriteria     criteria    = new SuccessCriteria(3, ConfidenceLevel.MEDIUM, 2);

    private static AgentResult result(Role role, double confidence, SourceRecord... sources) {
        return AgentResult.builder(role)
                .content(role + " answer")
                .confidence(confidence)
                .sources(List.of(sources))
                .build();
    }

    private static Synthesis synthesisOf(List<SourceRecord> sources, List<String> contradictions, List<String> gaps) {
        return new Synthesis(sources, Map.of(), contradictions, gaps, Map.of(), List.of());
    }

    @Test
    void testWeightedScore() {
        Map<Role, AgentResult> results = new EnumMap<>(Role.class);
        results.put(Role.MASTER, result(Role.MASTER, 0.9));
        results.put(Role.SEARCH, result(Role.SEARCH, 0.7));

        Synthesis synthesis = synthesisOf(
                List.of(SourceRecord.of("https://a.org", 0.9), SourceRecord.of("https://b.org", 0.7)),
                List.of(), List.of());

        ValidationReport report = validator.validate(results, synthesis, criteria);

        // 0.3·0.8 + 0.3·1.0 + 0.2·1.0
        assertEquals(0.74, report.getScore(), 1e-9);
        assertEquals(ConfidenceLevel.MEDIUM, report.getLevel());
    }

    @Test
    void testPerfectInputsReachHigh() {
        Map<Role, AgentResult> results = new EnumMap<>(Role.class);
        results.put(Role.MASTER, result(Role.MASTER, 0.9));

        ValidationReport report = validator.validate(results,
                synthesisOf(List.of(SourceRecord.of("https://a.org", 1.0)), List.of(), List.of()), criteria);

        assertEquals(0.8, report.getScore(), 1e-9);
        assertEquals(ConfidenceLevel.HIGH, report.getLevel());
    }

    @Test
    void testGapsAndContradictionsLowerScore() {
        Map<Role, AgentResult> results = new EnumMap<>(Role.class);
        results.put(Role.MASTER, result(Role.MASTER, 0.9));

        ValidationReport report = validator.validate(results, synthesisOf(
                List.of(),
                List.of("Potential contradiction found regarding true/false"),
                List.of("Missing mechanism explanation", "Missing causation explanation")), criteria);

        // 0 + 0.3 + 0.2·0.6 − 0.1
        assertEquals(0.32, report.getScore(), 1e-9);
        assertEquals(ConfidenceLevel.LOW, report.getLevel());
        assertFalse(report.isCriteriaMet());
        assertTrue(report.getIssues().stream().anyMatch(issue -> issue.contains("contradiction")));
    }

    @Test
    void testCompletenessNeverGoesNegative() {
        Map<Role, AgentResult> results = new EnumMap<>(Role.class);
        results.put(Role.MASTER, result(Role.MASTER, 0.2));

        List<String> gaps = List.of("g1", "g2", "g3", "g4", "g5", "g6", "g7");
        assertEquals(0.0, validator.score(results, synthesisOf(List.of(), List.of(), gaps)), 1e-9);
    }

    /**
     * Adding a role at MEDIUM or better whose sources are at least as credible
     * as the current unified average, and whose content adds no antonym pair,
     * can only raise each term of the score.
     */
    @ParameterizedTest(name = "master={0}/{1} search={2}/{3} + innovation={4} delta={5} shared={6}")
    @CsvSource({
            "0.9, 1.0, -1,  -1,  0.9,  0.0,  false",
            "0.9, 1.0, -1,  -1,  0.6,  0.0,  false",
            "0.7, 0.8, 0.3, 0.6, 0.6,  0.0,  false",
            "0.7, 0.8, 0.3, 0.6, 0.75, 0.1,  true",
            "0.5, 0.4, 0.2, 0.5, 0.9,  0.3,  false",
            "0.9, 0.9, 0.8, 0.7, 0.6,  0.05, true",
            "0.3, 0.0, -1,  -1,  0.8,  0.0,  false",
            "0.2, 0.6, 0.9, 0.9, 0.95, 0.0,  true"
    })
    void testAddingConfidentRoleWithCredibleSourcesNeverLowersLevel(
            double masterConfidence, double masterCredibility,
            double searchConfidence, double searchCredibility,
            double addedConfidence, double credibilityDelta, boolean sharedUrl) throws SynthesisException {

        Query query = Query.builder("Describe the effect").build();

        Map<Role, AgentResult> before = new EnumMap<>(Role.class);
        before.put(Role.MASTER, result(Role.MASTER, masterConfidence, SourceRecord.of("https://a.org", masterCredibility)));
        if (searchConfidence >= 0) {
            before.put(Role.SEARCH, result(Role.SEARCH, searchConfidence, SourceRecord.of("https://b.org", searchCredibility)));
        }
        Synthesis synthesisBefore = synthesizer.synthesize(query, before);

        double average = synthesisBefore.getUnifiedSources().stream()
                .mapToDouble(SourceRecord::getCredibility).average().orElse(0.0);
        String url = sharedUrl && searchConfidence >= 0 ? "https://b.org" : "https://c.org";

        Map<Role, AgentResult> after = new EnumMap<>(before);
        after.put(Role.INNOVATION, result(Role.INNOVATION, addedConfidence,
                SourceRecord.of(url, Math.min(1.0, average + credibilityDelta))));
        Synthesis synthesisAfter = synthesizer.synthesize(query, after);

        assertTrue(synthesisAfter.getContradictions().size() <= synthesisBefore.getContradictions().size());

        ValidationReport reportBefore = validator.validate(before, synthesisBefore, criteria);
        ValidationReport reportAfter  = validator.validate(after, synthesisAfter, criteria);

        assertTrue(reportAfter.getScore() >= reportBefore.getScore() - 1e-9,
                reportBefore.getScore() + " → " + reportAfter.getScore());
        assertTrue(reportAfter.getLevel().isAtLeast(reportBefore.getLevel()),
                reportBefore.getLevel() + " → " + reportAfter.getLevel());
    }

    @Test
    void testSourceBelowAverageCredibilityCanLowerLevel() throws SynthesisException {
        Query query = Query.builder("Describe the effect").build();

        Map<Role, AgentResult> before = new EnumMap<>(Role.class);
        before.put(Role.MASTER, result(Role.MASTER, 0.9, SourceRecord.of("https://a.org", 1.0)));

        Map<Role, AgentResult> after = new EnumMap<>(before);
        after.put(Role.SEARCH, result(Role.SEARCH, 0.9, SourceRecord.of("https://b.org", 0.5)));

        ValidationReport reportBefore = validator.validate(before, synthesizer.synthesize(query, before), criteria);
        ValidationReport reportAfter  = validator.validate(after, synthesizer.synthesize(query, after), criteria);

        // 0.3·1.0 + 0.3 + 0.2 versus 0.3·0.75 + 0.3 + 0.2
        assertEquals(0.8, reportBefore.getScore(), 1e-9);
        assertEquals(0.725, reportAfter.getScore(), 1e-9);
        assertEquals(ConfidenceLevel.HIGH, reportBefore.getLevel());
        assertEquals(ConfidenceLevel.MEDIUM, reportAfter.getLevel());
    }

    @Test
    void testDiagnosticsAgainstCriteria() {
        Map<Role, AgentResult> results = new EnumMap<>(Role.class);
        results.put(Role.MASTER, result(Role.MASTER, 0.9));
        results.put(Role.SEARCH, AgentResult.builder(Role.SEARCH).confidence(0.0).degraded(true).build());

        ValidationReport report = validator.validate(results,
                synthesisOf(List.of(SourceRecord.of("https://a.org", 0.9)), List.of(), List.of()), criteria);

        assertTrue(report.getIssues().stream().anyMatch(issue -> issue.contains("unified sources")));
        assertTrue(report.getIssues().stream().anyMatch(issue -> issue.contains("non-degraded perspectives")));
        assertFalse(report.isCriteriaMet());
    }
}
