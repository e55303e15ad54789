package com.swarmnet.orchestrator;

import com.swarmnet.config.SwarmSettings;
import com.swarmnet.core.agent.Agent;
import com.swarmnet.core.agent.AgentResult;
import com.swarmnet.core.agent.ConfidenceLevel;
import com.swarmnet.core.agent.Role;
import com.swarmnet.core.agent.SourceRecord;
import com.swarmnet.core.executor.AgentExecutor;
import com.swarmnet.core.planner.QueryPlanner;
import com.swarmnet.core.query.ComplexityLevel;
import com.swarmnet.core.query.Query;
import com.swarmnet.core.registry.AgentRegistry;
import com.swarmnet.core.state.PerformanceMetricsStore;
import com.swarmnet.core.state.QueryState;
import com.swarmnet.core.state.QueryTracker;
import com.swarmnet.core.synthesis.ResultSynthesizer;
import com.swarmnet.core.task.TaskDistributor;
import com.swarmnet.core.validation.ConfidenceValidator;
import com.swarmnet.support.StubAgent;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SwarmOrchestrator wired by hand around stub agents, so each test controls
 * exactly how every role behaves.
 */
class SwarmOrchestratorTest {

    private static final String QUESTION = "What is Newton's first law of motion?";

    private ExecutorService workerPool;
    private ExecutorService orchestrationPool;

    @BeforeEach
    void setUp() {
        workerPool        = Executors.newCachedThreadPool();
        orchestrationPool = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        workerPool.shutdownNow();
        orchestrationPool.shutdownNow();
    }

    private SwarmOrchestrator orchestratorFor(Agent... agents) {
        AgentRegistry registry = new AgentRegistry(List.of(agents));
        registry.initializeAll();

        return new SwarmOrchestrator(
                new QueryPlanner(),
                new TaskDistributor(),
                new AgentExecutor(registry, SwarmSettings.withUniformTimeout(Duration.ofSeconds(5)),
                        workerPool, orchestrationPool),
                new ResultSynthesizer(),
                new ConfidenceValidator(),
                registry,
                new QueryTracker(),
                new PerformanceMetricsStore()
        );
    }

    private static List<Agent> healthySwarm() {
        List<Agent> agents = new ArrayList<>();
        agents.add(StubAgent.answering(Role.MASTER,
                "The definition: a body keeps its state of motion unless a net force acts.", 0.9,
                SourceRecord.of("https://physics.org/newton", 0.7)));
        agents.add(StubAgent.answering(Role.SEARCH, "Every study confirms inertia.", 0.8,
                SourceRecord.of("https://physics.org/newton", 0.9),
                SourceRecord.of("https://physics.org/galileo", 0.8)));
        agents.add(StubAgent.answering(Role.INNOVATION, "A novel view links inertia to symmetry.", 0.7));
        agents.add(StubAgent.answering(Role.ANALYSIS, "The implication is frame dependence.", 0.75));
        return agents;
    }

    // =========================================================================
    // COMPLETED
    // =========================================================================

    @Test
    void testEveryComplexityCompletes() {
        SwarmOrchestrator orchestrator = orchestratorFor(healthySwarm().toArray(new Agent[0]));

        for (ComplexityLevel complexity : ComplexityLevel.values()) {
            SwarmResult result = orchestrator.submitQuery(Query.builder(QUESTION).complexity(complexity).build());

            assertEquals(QueryState.COMPLETED, result.getStatus(), complexity.name());
            assertNotNull(result.getConfidence());
            assertSame(result.getResults().get(Role.MASTER), result.getMasterResult());
            assertTrue(result.getResults().size() >= 2);

            Set<String> urls = new HashSet<>();
            for (SourceRecord source : result.getSynthesis().getUnifiedSources()) {
                assertTrue(urls.add(source.getUrl()), "duplicate url " + source.getUrl());
            }
            assertFalse(urls.isEmpty());
        }

        SwarmStatus status = orchestrator.getStatus();
        assertEquals(ComplexityLevel.values().length, status.getTotalProcessed());
        assertEquals(0, status.getActiveQueries());
        assertTrue(status.getRoles().get(Role.MASTER).isAvailable());
        assertEquals("stub-master", status.getRoles().get(Role.MASTER).getAgentId());
    }

    @Test
    void testBasicQueryUsesEveryRoleAndMergesSources() {
        SwarmOrchestrator orchestrator = orchestratorFor(healthySwarm().toArray(new Agent[0]));

        SwarmResult result = orchestrator.submitQuery(
                Query.builder(QUESTION).complexity(ComplexityLevel.BASIC).build());

        assertEquals(4, result.getResults().size());
        assertEquals(2, result.getSynthesis().getUnifiedSources().size());
        assertEquals(0.9, result.getSynthesis().getUnifiedSources().get(0).getCredibility(), 1e-9);
        assertTrue(result.getSynthesis().getGaps().isEmpty());
        // 0.3·0.85 + 0.3·1.0 + 0.2·1.0
        assertEquals(0.755, result.getConfidenceScore(), 1e-9);
        assertEquals(ConfidenceLevel.MEDIUM, result.getConfidence());
    }

    @Test
    void testFailingPeerStillCompletes() {
        StubAgent innovation = StubAgent.answering(Role.INNOVATION, "A novel view links inertia to symmetry.", 0.7);

        SwarmOrchestrator orchestrator = orchestratorFor(
                StubAgent.answering(Role.MASTER, "The definition is simple.", 0.9),
                StubAgent.failing(Role.SEARCH, "search backend down"),
                innovation,
                StubAgent.answering(Role.ANALYSIS, "The implication is frame dependence.", 0.75));

        SwarmResult result = orchestrator.submitQuery(
                Query.builder(QUESTION).complexity(ComplexityLevel.INTERMEDIATE).build());

        assertEquals(QueryState.COMPLETED, result.getStatus());

        AgentResult search = result.getResults().get(Role.SEARCH);
        assertTrue(search.isDegraded());
        assertEquals(ConfidenceLevel.LOW, search.getConfidenceLevel());

        assertEquals("A novel view links inertia to symmetry.", result.getResults().get(Role.INNOVATION).getContent());
        assertFalse(result.getResults().get(Role.INNOVATION).isDegraded());
        assertTrue(result.getSynthesis().getRoleSummaries().get(Role.SEARCH).isDegraded());
    }

    @Test
    void testMasterIsReinitializedOnce() {
        StubAgent master = StubAgent.flakyInit(Role.MASTER, 1, "The definition is simple.", 0.9);

        SwarmOrchestrator orchestrator = orchestratorFor(master,
                StubAgent.answering(Role.SEARCH, "Evidence.", 0.8));

        SwarmResult result = orchestrator.submitQuery(Query.builder(QUESTION).build());

        assertEquals(QueryState.COMPLETED, result.getStatus());
        assertEquals(2, master.getInitAttempts());
    }

    // =========================================================================
    // FAILED
    // =========================================================================

    @Test
    void testMasterThatNeverInitializesFailsTheQuery() {
        StubAgent master = StubAgent.flakyInit(Role.MASTER, 10, "unused", 0.9);

        SwarmOrchestrator orchestrator = orchestratorFor(master,
                StubAgent.answering(Role.SEARCH, "Evidence.", 0.8));

        Query query = Query.builder(QUESTION).build();
        SwarmResult result = orchestrator.submitQuery(query);

        assertEquals(QueryState.FAILED, result.getStatus());
        assertEquals(ConfidenceLevel.LOW, result.getConfidence());
        assertEquals("RoleUnavailableException",
                result.getMasterResult().getMetadata().get(AgentResult.META_ERROR_TYPE));
        assertTrue(result.getSynthesis().getUnifiedSources().isEmpty());
        assertEquals(2, master.getInitAttempts());
        assertEquals(QueryState.FAILED, orchestrator.getQueryState(query.getId()).orElseThrow());
    }

    @Test
    void testMasterExecutionErrorFailsTheQuery() {
        SwarmOrchestrator orchestrator = orchestratorFor(
                StubAgent.failing(Role.MASTER, "model crashed"),
                StubAgent.answering(Role.SEARCH, "Evidence.", 0.8));

        SwarmResult result = orchestrator.submitQuery(Query.builder(QUESTION).build());

        assertEquals(QueryState.FAILED, result.getStatus());
        assertTrue(result.getFailureReason().contains("model crashed"));
        assertEquals(0.0, result.getMasterResult().getConfidence(), 1e-9);
    }

    @Test
    void testMalformedQueryFailsInPlanning() {
        SwarmOrchestrator orchestrator = orchestratorFor(healthySwarm().toArray(new Agent[0]));

        SwarmResult result = orchestrator.submitQuery(Query.builder("  ").build());

        assertEquals(QueryState.FAILED, result.getStatus());
        assertEquals("PlanningException", result.getMasterResult().getMetadata().get(AgentResult.META_ERROR_TYPE));
        assertEquals(1, orchestrator.getStatus().getTotalProcessed());
    }

    // =========================================================================
    // CANCELLED
    // =========================================================================

    @Test
    void testCancellationDuringExecutionDiscardsResults() {
        AtomicReference<SwarmOrchestrator> self = new AtomicReference<>();

        StubAgent search = new StubAgent(Role.SEARCH, (query, context) -> {
            assertTrue(self.get().cancel(query.getId()));
            return StubAgent.result(Role.SEARCH, "Evidence.", 0.8);
        });

        List<Agent> agents = new ArrayList<>(healthySwarm());
        agents.set(1, search);
        SwarmOrchestrator orchestrator = orchestratorFor(agents.toArray(new Agent[0]));
        self.set(orchestrator);

        Query query = Query.builder(QUESTION).complexity(ComplexityLevel.BASIC).build();
        SwarmResult result = orchestrator.submitQuery(query);

        assertEquals(QueryState.CANCELLED, result.getStatus());
        assertEquals(1, search.getInvocations());
        // SEQUENTIAL: MASTER ran before SEARCH, nothing was started after the cancel
        assertEquals(1, ((StubAgent) agents.get(0)).getInvocations());
        assertEquals(0, ((StubAgent) agents.get(2)).getInvocations());
        assertEquals(0, ((StubAgent) agents.get(3)).getInvocations());
        assertEquals(List.of(Role.MASTER), new ArrayList<>(result.getResults().keySet()));
        assertEquals("QueryCancelledException",
                result.getMasterResult().getMetadata().get(AgentResult.META_ERROR_TYPE));
        assertEquals(QueryState.CANCELLED, orchestrator.getQueryState(query.getId()).orElseThrow());
        assertFalse(orchestrator.cancel(query.getId()));
    }

    @Test
    void testCancelUnknownQuery() {
        SwarmOrchestrator orchestrator = orchestratorFor(healthySwarm().toArray(new Agent[0]));

        assertFalse(orchestrator.cancel("nope"));
        assertTrue(orchestrator.getQueryState("nope").isEmpty());
    }

    @Test
    void testShutdownCancelsQueriesInFlight() {
        AtomicReference<SwarmOrchestrator> self = new AtomicReference<>();

        StubAgent search = new StubAgent(Role.SEARCH, (query, context) -> {
            self.get().shutdown();
            return StubAgent.result(Role.SEARCH, "Evidence.", 0.8);
        });

        List<Agent> agents = new ArrayList<>(healthySwarm());
        agents.set(1, search);
        SwarmOrchestrator orchestrator = orchestratorFor(agents.toArray(new Agent[0]));
        self.set(orchestrator);

        // PARALLEL: the peers are already running, MASTER is never started
        Query query = Query.builder(QUESTION).complexity(ComplexityLevel.INTERMEDIATE).build();
        SwarmResult result = orchestrator.submitQuery(query);

        assertEquals(QueryState.CANCELLED, result.getStatus());
        assertEquals(0, ((StubAgent) agents.get(0)).getInvocations());
        assertEquals(0, orchestrator.getStatus().getActiveQueries());
    }

    // =========================================================================
    // Duplicate ids
    // =========================================================================

    @Test
    void testDuplicateInFlightIdIsRejectedAsPlanningError() {
        AtomicReference<SwarmOrchestrator> self      = new AtomicReference<>();
        AtomicReference<SwarmResult>       duplicate = new AtomicReference<>();

        StubAgent search = new StubAgent(Role.SEARCH, (query, context) -> {
            duplicate.set(self.get().submitQuery(query));
            return StubAgent.result(Role.SEARCH, "Evidence.", 0.8);
        });

        List<Agent> agents = new ArrayList<>(healthySwarm());
        agents.set(1, search);
        SwarmOrchestrator orchestrator = orchestratorFor(agents.toArray(new Agent[0]));
        self.set(orchestrator);

        Query query = Query.builder(QUESTION).complexity(ComplexityLevel.BASIC).build();
        SwarmResult result = orchestrator.submitQuery(query);

        assertEquals(QueryState.COMPLETED, result.getStatus());
        assertEquals(QueryState.FAILED, duplicate.get().getStatus());
        assertEquals("PlanningException",
                duplicate.get().getMasterResult().getMetadata().get(AgentResult.META_ERROR_TYPE));
        assertTrue(duplicate.get().getFailureReason().contains("already in flight"));
        assertEquals(1, search.getInvocations());
    }
}
