package com.swarmnet.core.planner;

import com.swarmnet.core.agent.ConfidenceLevel;
import com.swarmnet.core.agent.Role;
import com.swarmnet.core.error.PlanningException;
import com.swarmnet.core.query.ComplexityLevel;
import com.swarmnet.core.query.Query;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class QueryPlannerTest {

    private final QueryPlanner planner = new QueryPlanner();

    @Test
    void testNoTriggerFallsBackToAllRoles() throws PlanningException {
        Query query = Query.builder("What is Newton's first law of motion?")
                .complexity(ComplexityLevel.BASIC)
                .build();

        ExecutionPlan plan = planner.plan(query);

        assertEquals(EnumSet.allOf(Role.class), plan.getRequiredRoles());
        assertEquals(ExecutionStrategy.SEQUENTIAL, plan.getStrategy());
        assertEquals("explanation", plan.getQueryType());
    }

    @Test
    void testEvidentiaryLanguageAndAdvancedComplexity() throws PlanningException {
        Query query = Query.builder("What are the latest experimental results on dark matter?")
                .complexity(ComplexityLevel.ADVANCED)
                .build();

        ExecutionPlan plan = planner.plan(query);

        assertTrue(plan.requires(Role.MASTER));
        assertTrue(plan.requires(Role.SEARCH));
        assertTrue(plan.requires(Role.ANALYSIS));
        assertFalse(plan.requires(Role.INNOVATION));
        assertEquals(ExecutionStrategy.HIERARCHICAL, plan.getStrategy());
        assertEquals("research", plan.getQueryType());
    }

    @Test
    void testStrategyIsAFunctionOfComplexity() throws PlanningException {
        assertEquals(ExecutionStrategy.SEQUENTIAL,         strategyFor(ComplexityLevel.BASIC));
        assertEquals(ExecutionStrategy.PARALLEL,           strategyFor(ComplexityLevel.INTERMEDIATE));
        assertEquals(ExecutionStrategy.HIERARCHICAL,       strategyFor(ComplexityLevel.ADVANCED));
        assertEquals(ExecutionStrategy.FULL_ORCHESTRATION, strategyFor(ComplexityLevel.RESEARCH));
    }

    private ExecutionStrategy strategyFor(ComplexityLevel complexity) throws PlanningException {
        return planner.plan(Query.builder("Describe entropy").complexity(complexity).build()).getStrategy();
    }

    @Test
    void testFirstMatchingTypeRuleWins() {
        // "explain" and "how" both match; explanation is listed first
        assertEquals("explanation", planner.classifyQueryType("how does inflation explain flatness?"));
        assertEquals("mechanism",   planner.classifyQueryType("how do tides form?"));
        assertEquals("causation",   planner.classifyQueryType("why is the sky blue?"));
        assertEquals("calculation", planner.classifyQueryType("compute the escape velocity of mars"));
        assertEquals("hypothesis_generation", planner.classifyQueryType("propose a new dark energy model"));
        assertEquals(QueryPlanner.DEFAULT_QUERY_TYPE, planner.classifyQueryType("entropy and information"));
    }

    @Test
    void testNoveltyTriggersInnovationOnly() {
        Set<Role> roles = planner.determineRequiredRoles(
                "a novel approach to room temperature superconductors", ComplexityLevel.INTERMEDIATE);

        assertEquals(EnumSet.of(Role.MASTER, Role.INNOVATION), roles);
    }

    @Test
    void testComplexityFactorsAndEstimate() throws PlanningException {
        Query query = Query.builder("A novel quantum field theory of gravity")
                .complexity(ComplexityLevel.RESEARCH)
                .build();

        ExecutionPlan plan = planner.plan(query);

        assertTrue(plan.getComplexityFactors().contains("advanced_physics"));
        assertTrue(plan.getComplexityFactors().contains("innovative_thinking"));
        assertFalse(plan.getComplexityFactors().contains("interdisciplinary"));
        assertEquals(15 + 30 + 25, plan.getEstimatedSeconds());
    }

    @Test
    void testResearchRaisesSuccessCriteria() throws PlanningException {
        SuccessCriteria standard = planner.plan(Query.builder("Describe entropy").build()).getSuccessCriteria();
        assertEquals(3, standard.getMinSources());
        assertEquals(2, standard.getRequiredPerspectives());
        assertEquals(ConfidenceLevel.MEDIUM, standard.getMinConfidence());

        SuccessCriteria research = planner.plan(Query.builder("Describe entropy")
                .complexity(ComplexityLevel.RESEARCH)
                .requiredConfidence(ConfidenceLevel.HIGH)
                .build()).getSuccessCriteria();
        assertEquals(5, research.getMinSources());
        assertEquals(3, research.getRequiredPerspectives());
        assertEquals(ConfidenceLevel.HIGH, research.getMinConfidence());
    }

    @Test
    void testLowConfidenceFloorDoesNotRelaxCriteria() throws PlanningException {
        SuccessCriteria criteria = planner.plan(Query.builder("Describe entropy")
                .requiredConfidence(ConfidenceLevel.LOW)
                .build()).getSuccessCriteria();

        assertEquals(ConfidenceLevel.MEDIUM, criteria.getMinConfidence());
    }

    @Test
    void testMalformedQueriesAreRejected() {
        assertThrows(PlanningException.class, () -> planner.plan(null));
        assertThrows(PlanningException.class, () -> planner.plan(Query.builder("   ").build()));
        assertThrows(PlanningException.class, () -> planner.plan(Query.builder(null).build()));
        assertThrows(PlanningException.class, () -> planner.plan(Query.builder("x").complexity(null).build()));
        assertThrows(PlanningException.class, () -> planner.plan(Query.builder("x").timeLimitSeconds(0).build()));
    }
}
