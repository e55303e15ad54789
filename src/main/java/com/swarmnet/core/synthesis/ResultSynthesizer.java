package com.swarmnet.core.synthesis;

import com.swarmnet.core.agent.AgentResult;
import com.swarmnet.core.agent.Role;
import com.swarmnet.core.agent.SourceRecord;
import com.swarmnet.core.error.SynthesisException;
import com.swarmnet.core.query.Query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * ResultSynthesizer - merges the per-role results of one query.
 *
 * Pure: the output depends only on the question and the result map. Roles are
 * always visited in enum order, so the input map's iteration order never leaks
 * into the Synthesis.
 *
 * Detection is deliberately shallow and auditable:
 *   contradictions - antonym pairs co-occurring anywhere in the combined
 *                    content of all roles (corpus wide, not per role pair)
 *   gaps           - aspects implied by the question's interrogatives that
 *                    no role's content mentions
 */
@Component
public class ResultSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(ResultSynthesizer.class);

    static final int MAX_INSIGHTS_PER_ROLE = 5;
    static final int MAX_KEY_POINTS        = 5;
    static final int MIN_KEY_POINT_LENGTH  = 20;

    private static final Map<Role, List<String>> INSIGHT_KEYWORDS = Map.of(
            Role.INNOVATION, List.of("novel", "innovative", "breakthrough", "paradigm", "revolutionary"),
            Role.ANALYSIS,   List.of("question", "analysis", "implication", "consequence", "deeper"),
            Role.SEARCH,     List.of("research", "study", "findings", "evidence", "data")
    );

    private static final List<String[]> ANTONYM_PAIRS = List.of(
            new String[] {"true",     "false"},
            new String[] {"correct",  "incorrect"},
            new String[] {"possible", "impossible"},
            new String[] {"proven",   "unproven"},
            new String[] {"always",   "never"}
    );

    // interrogative → aspect the answer is expected to cover
    private static final Map<String, String> EXPECTED_ASPECTS = orderedAspects();

    private static final List<String> KEY_POINT_MARKERS =
            List.of("important", "key", "significant", "crucial", "fundamental");

    public Synthesis synthesize(Query query, Map<Role, AgentResult> results) throws SynthesisException {

        if (results == null || results.isEmpty()) {
            throw new SynthesisException("No role results to synthesize");
        }

        Map<Role, AgentResult> byRole = new EnumMap<>(results);
        String question = query != null && query.getQuestion() != null ? query.getQuestion() : "";
        String corpus   = combinedContent(byRole);

        Synthesis synthesis = new Synthesis(
                unifySources(byRole),
                extractInsights(byRole),
                detectContradictions(corpus),
                identifyGaps(question, corpus),
                summarize(byRole),
                unifyQuestions(byRole)
        );

        log.info("[Synthesizer] {}", synthesis);
        return synthesis;
    }

    // =========================================================================
    // Sources
    // =========================================================================

    List<SourceRecord> unifySources(Map<Role, AgentResult> byRole) {
        Map<String, SourceRecord> best = new LinkedHashMap<>();

        for (AgentResult result : byRole.values()) {
            for (SourceRecord source : result.getSources()) {
                SourceRecord current = best.get(source.getUrl());
                if (current == null || source.getCredibility() > current.getCredibility()) {
                    best.put(source.getUrl(), source);
                }
            }
        }

        List<SourceRecord> unified = new ArrayList<>(best.values());
        unified.sort(Comparator.comparingDouble(SourceRecord::getCredibility).reversed()
                .thenComparing(SourceRecord::getUrl));
        return unified;
    }

    // =========================================================================
    // Insights and summaries
    // =========================================================================

    private Map<Role, List<String>> extractInsights(Map<Role, AgentResult> byRole) {
        Map<Role, List<String>> insights = new EnumMap<>(Role.class);

        for (Map.Entry<Role, AgentResult> entry : byRole.entrySet()) {
            List<String> keywords = INSIGHT_KEYWORDS.get(entry.getKey());
            if (keywords == null) continue;
            insights.put(entry.getKey(),
                    pickSentences(entry.getValue().getContent(), keywords, 0, MAX_INSIGHTS_PER_ROLE));
        }
        return insights;
    }

    private Map<Role, RoleSummary> summarize(Map<Role, AgentResult> byRole) {
        Map<Role, RoleSummary> summaries = new EnumMap<>(Role.class);

        for (AgentResult result : byRole.values()) {
            summaries.put(result.getRole(), new RoleSummary(
                    result.getRole(),
                    result.getContent().length(),
                    result.getSources().size(),
                    result.getConfidence(),
                    result.getConfidenceLevel(),
                    result.getProcessingMillis(),
                    result.isDegraded(),
                    pickSentences(result.getContent(), KEY_POINT_MARKERS, MIN_KEY_POINT_LENGTH, MAX_KEY_POINTS)
            ));
        }
        return summaries;
    }

    private static List<String> pickSentences(String content, List<String> keywords, int minLength, int cap) {
        List<String> picked = new ArrayList<>();

        for (String raw : content.split("\\.")) {
            String sentence = raw.trim();
            if (sentence.isEmpty() || sentence.length() <= minLength) continue;

            String lower = sentence.toLowerCase();
            for (String keyword : keywords) {
                if (lower.contains(keyword)) {
                    picked.add(sentence);
                    break;
                }
            }
            if (picked.size() == cap) break;
        }
        return picked;
    }

    private List<String> unifyQuestions(Map<Role, AgentResult> byRole) {
        Set<String> questions = new LinkedHashSet<>();
        for (AgentResult result : byRole.values()) {
            for (String q : result.getQuestionsRaised()) {
                if (q != null && !q.isBlank()) questions.add(q.trim());
            }
        }
        return new ArrayList<>(questions);
    }

    // =========================================================================
    // Contradictions and gaps
    // =========================================================================

    List<String> detectContradictions(String corpus) {
        List<String> contradictions = new ArrayList<>();
        for (String[] pair : ANTONYM_PAIRS) {
            if (containsWord(corpus, pair[0]) && containsWord(corpus, pair[1])) {
                contradictions.add("Potential contradiction found regarding " + pair[0] + "/" + pair[1]);
            }
        }
        return contradictions;
    }

    List<String> identifyGaps(String question, String corpus) {
        String lowerQuestion = question.toLowerCase();
        List<String> gaps = new ArrayList<>();

        for (Map.Entry<String, String> entry : EXPECTED_ASPECTS.entrySet()) {
            String aspect = entry.getValue();
            if (containsWord(lowerQuestion, entry.getKey()) && !corpus.contains(aspect)) {
                gaps.add("Missing " + aspect + " explanation");
            }
        }
        return gaps;
    }

    private static String combinedContent(Map<Role, AgentResult> byRole) {
        StringBuilder corpus = new StringBuilder();
        for (AgentResult result : byRole.values()) {
            corpus.append(result.getContent().toLowerCase()).append('\n');
        }
        return corpus.toString();
    }

    private static boolean containsWord(String text, String word) {
        return Pattern.compile("\\b" + Pattern.quote(word) + "\\b").matcher(text).find();
    }

    private static Map<String, String> orderedAspects() {
        Map<String, String> aspects = new LinkedHashMap<>();
        aspects.put("how",  "mechanism");
        aspects.put("why",  "causation");
        aspects.put("what", "definition");
        return aspects;
    }
}
