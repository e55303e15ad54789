package com.swarmnet.core.planner;

import com.swarmnet.core.agent.ConfidenceLevel;
import com.swarmnet.core.agent.Role;
import com.swarmnet.core.error.PlanningException;
import com.swarmnet.core.query.ComplexityLevel;
import com.swarmnet.core.query.Query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * QueryPlanner - classifies a query and decides which roles run under which strategy.
 *
 * Keyword matching is plain substring matching on the lower-cased question.
 *
 * QUERY TYPE: the first rule in TYPE_RULES whose keywords match wins. The order
 * is the tie-break ("how does X explain Y" is an explanation, not a mechanism)
 * and must not be re-sorted.
 *
 * ROLES: MASTER always. SEARCH on evidentiary language, INNOVATION on novelty
 * language, ANALYSIS whenever complexity ≥ ADVANCED. If none of the three
 * optional roles triggered, all three are added, so MASTER never runs alone.
 */
@Component
public class QueryPlanner {

    private static final Logger log = LoggerFactory.getLogger(QueryPlanner.class);

    public static final String DEFAULT_QUERY_TYPE = "general_inquiry";

    private static final List<KeywordRule> TYPE_RULES = List.of(
            new KeywordRule("explanation",           List.of("what is", "define", "explain")),
            new KeywordRule("mechanism",             List.of("how", "mechanism", "process")),
            new KeywordRule("causation",             List.of("why", "reason", "cause")),
            new KeywordRule("calculation",           List.of("calculate", "solve", "find", "compute")),
            new KeywordRule("hypothesis_generation", List.of("hypothesis", "theory", "propose", "novel")),
            new KeywordRule("research",              List.of("research", "latest", "current", "recent"))
    );

    private static final List<KeywordRule> FACTOR_RULES = List.of(
            new KeywordRule("advanced_physics",    List.of("quantum", "relativistic", "field theory"), 30),
            new KeywordRule("interdisciplinary",   List.of("interdisciplinary", "multiple", "complex"), 20),
            new KeywordRule("innovative_thinking", List.of("novel", "breakthrough", "innovative"), 25)
    );

    private static final int BASE_ESTIMATE_SECONDS = 15;

    private static final List<String> SEARCH_TRIGGERS =
            List.of("research", "latest", "current", "recent", "study", "evidence", "experimental");

    private static final List<String> INNOVATION_TRIGGERS =
            List.of("novel", "innovative", "breakthrough", "first principles");

    // =========================================================================
    // Planning
    // =========================================================================

    public ExecutionPlan plan(Query query) throws PlanningException {

        validate(query);

        String question = query.getQuestion().toLowerCase();

        String            type     = classifyQueryType(question);
        Set<String>       factors  = new LinkedHashSet<>();
        int               estimate = assessComplexity(question, factors);
        Set<Role>         roles    = determineRequiredRoles(question, query.getComplexity());
        ExecutionStrategy strategy = ExecutionStrategy.forComplexity(query.getComplexity());
        SuccessCriteria   criteria = defineSuccessCriteria(query);

        ExecutionPlan plan = new ExecutionPlan(type, factors, roles, strategy, criteria, estimate);
        log.info("[Planner] Query {} → {}", query.getId(), plan);
        return plan;
    }

    private void validate(Query query) throws PlanningException {
        if (query == null) {
            throw new PlanningException("Query cannot be null");
        }
        if (query.getQuestion() == null || query.getQuestion().isBlank()) {
            throw new PlanningException("Query " + query.getId() + " has an empty question");
        }
        if (query.getComplexity() == null) {
            throw new PlanningException("Query " + query.getId() + " has no complexity level");
        }
        if (query.getTimeLimitSeconds() <= 0) {
            throw new PlanningException("Query " + query.getId() + " has a non-positive time limit");
        }
    }

    String classifyQueryType(String question) {
        for (KeywordRule rule : TYPE_RULES) {
            if (rule.matches(question)) return rule.tag;
        }
        return DEFAULT_QUERY_TYPE;
    }

    private int assessComplexity(String question, Set<String> factors) {
        int estimate = BASE_ESTIMATE_SECONDS;
        for (KeywordRule rule : FACTOR_RULES) {
            if (rule.matches(question)) {
                factors.add(rule.tag);
                estimate += rule.weight;
            }
        }
        return estimate;
    }

    Set<Role> determineRequiredRoles(String question, ComplexityLevel complexity) {
        Set<Role> roles = EnumSet.of(Role.MASTER);

        if (containsAny(question, SEARCH_TRIGGERS))     roles.add(Role.SEARCH);
        if (containsAny(question, INNOVATION_TRIGGERS)) roles.add(Role.INNOVATION);
        if (complexity.isAtLeast(ComplexityLevel.ADVANCED)) roles.add(Role.ANALYSIS);

        if (roles.size() == 1) {
            roles.addAll(EnumSet.of(Role.SEARCH, Role.INNOVATION, Role.ANALYSIS));
        }
        return roles;
    }

    private SuccessCriteria defineSuccessCriteria(Query query) {
        boolean research = query.getComplexity() == ComplexityLevel.RESEARCH;

        ConfidenceLevel minConfidence = query.getRequiredConfidence().isAtLeast(ConfidenceLevel.MEDIUM)
                ? query.getRequiredConfidence()
                : ConfidenceLevel.MEDIUM;

        return new SuccessCriteria(research ? 5 : 3, minConfidence, research ? 3 : 2);
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) return true;
        }
        return false;
    }

    // =========================================================================
    // Rule table entry
    // =========================================================================

    private static final class KeywordRule {
        private final String       tag;
        private final List<String> keywords;
        private final int          weight;

        KeywordRule(String tag, List<String> keywords) {
            this(tag, keywords, 0);
        }

        KeywordRule(String tag, List<String> keywords, int weight) {
            this.tag      = tag;
            this.keywords = keywords;
            this.weight   = weight;
        }

        boolean matches(String text) {
            return containsAny(text, keywords);
        }
    }
}
