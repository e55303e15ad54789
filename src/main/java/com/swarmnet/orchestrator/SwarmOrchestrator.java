package com.swarmnet.orchestrator;

import com.swarmnet.core.agent.Agent;
import com.swarmnet.core.agent.AgentResult;
import com.swarmnet.core.agent.Role;
import com.swarmnet.core.error.PlanningException;
import com.swarmnet.core.error.QueryCancelledException;
import com.swarmnet.core.error.RoleExecutionException;
import com.swarmnet.core.error.SwarmException;
import com.swarmnet.core.executor.AgentExecutor;
import com.swarmnet.core.planner.ExecutionPlan;
import com.swarmnet.core.planner.QueryPlanner;
import com.swarmnet.core.query.Query;
import com.swarmnet.core.registry.AgentRegistry;
import com.swarmnet.core.state.PerformanceMetricsStore;
import com.swarmnet.core.state.QueryMetrics;
import com.swarmnet.core.state.QueryState;
import com.swarmnet.core.state.QueryTracker;
import com.swarmnet.core.synthesis.ResultSynthesizer;
import com.swarmnet.core.synthesis.Synthesis;
import com.swarmnet.core.task.AgentTask;
import com.swarmnet.core.task.TaskDistributor;
import com.swarmnet.core.validation.ConfidenceValidator;
import com.swarmnet.core.validation.ValidationReport;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * SwarmOrchestrator - top-level state machine for one query.
 *
 * Phase flow:
 *   QUEUED → PLANNING → DISTRIBUTING → EXECUTING → SYNTHESIZING → VALIDATING → COMPLETED
 *
 * Every phase change goes through QueryTracker.transition(). A rejected
 * transition means cancel() won the race, so the run stops with CANCELLED and
 * whatever the executor returned is discarded. The executor polls the tracker
 * and starts no further role call once the query has left flight. Calls
 * already running are not interrupted; they finish on their own and their
 * results go nowhere.
 *
 * FAILED is reached through a SwarmException: a malformed query, a MASTER
 * failure, or an empty result set at synthesis. Non-MASTER role failures never
 * get here; AgentExecutor has already degraded them.
 *
 * submitQuery() never throws for a non-null query.
 */
@Component
public class SwarmOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SwarmOrchestrator.class);

    private final QueryPlanner            planner;
    private final TaskDistributor         distributor;
    private final AgentExecutor           executor;
    private final ResultSynthesizer       synthesizer;
    private final ConfidenceValidator     validator;
    private final AgentRegistry           registry;
    private final QueryTracker            tracker;
    private final PerformanceMetricsStore metricsStore;

    public SwarmOrchestrator(
            QueryPlanner            planner,
            TaskDistributor         distributor,
            AgentExecutor           executor,
            ResultSynthesizer       synthesizer,
            ConfidenceValidator     validator,
            AgentRegistry           registry,
            QueryTracker            tracker,
            PerformanceMetricsStore metricsStore
    ) {
        this.planner      = planner;
        this.distributor  = distributor;
        this.executor     = executor;
        this.synthesizer  = synthesizer;
        this.validator    = validator;
        this.registry     = registry;
        this.tracker      = tracker;
        this.metricsStore = metricsStore;
    }

    // =========================================================================
    // MAIN ENTRY POINT
    // =========================================================================

    public SwarmResult submitQuery(Query query) {

        Objects.requireNonNull(query, "query");

        String queryId   = query.getId();
        long   startTime = System.currentTimeMillis();

        log.info("========== SWARM QUERY {} START ==========", queryId);

        try {
            tracker.register(queryId, Instant.ofEpochMilli(startTime));
        } catch (IllegalStateException e) {
            log.error("[Orchestrator] {}", e.getMessage());
            return finish(query, null, failedResult(query, new PlanningException(e.getMessage()),
                    startTime, QueryState.FAILED));
        }

        ExecutionPlan plan = null;

        try {
            advance(queryId, QueryState.PLANNING);
            plan = planner.plan(query);
            tracker.attachPlan(queryId, plan);

            advance(queryId, QueryState.DISTRIBUTING);
            ensureMasterAvailable();
            List<AgentTask> tasks = distributor.distribute(query, plan);

            advance(queryId, QueryState.EXECUTING);
            Map<Role, AgentResult> results = executor.execute(plan.getStrategy(), tasks, query,
                    () -> !tracker.isInFlight(queryId));

            advance(queryId, QueryState.SYNTHESIZING);
            Synthesis synthesis = synthesizer.synthesize(query, results);

            advance(queryId, QueryState.VALIDATING);
            ValidationReport report = validator.validate(results, synthesis, plan.getSuccessCriteria());

            advance(queryId, QueryState.COMPLETED);

            SwarmResult result = new SwarmResult(
                    query,
                    results.get(Role.MASTER),
                    results,
                    synthesis,
                    report,
                    System.currentTimeMillis() - startTime,
                    QueryState.COMPLETED,
                    null
            );
            log.info("[Orchestrator] Query {} COMPLETED with {} confidence ({})",
                    queryId, result.getConfidence(), String.format("%.3f", result.getConfidenceScore()));
            return finish(query, plan, result);

        } catch (QueryCancelledException e) {
            log.warn("[Orchestrator] Query {} cancelled; in-flight results discarded", queryId);
            return finish(query, plan, failedResult(query, e, startTime, QueryState.CANCELLED));

        } catch (SwarmException e) {
            return finish(query, plan, fail(query, e, startTime));

        } catch (RuntimeException e) {
            log.error("[Orchestrator] Unexpected error on query {}", queryId, e);
            SwarmException wrapped = new RoleExecutionException(Role.MASTER,
                    "unexpected " + e.getClass().getSimpleName() + ": " + e.getMessage(), e);
            return finish(query, plan, fail(query, wrapped, startTime));
        }
    }

    /**
     * Request cooperative cancellation.
     *
     * @return true if the query was in flight and is now CANCELLED
     */
    public boolean cancel(String queryId) {
        return tracker.cancel(queryId);
    }

    /** Marks every in-flight query CANCELLED so late role results are discarded. */
    @PreDestroy
    public void shutdown() {
        int cancelled = tracker.cancelAll();
        log.info("[Orchestrator] Shutdown: {} in-flight queries cancelled", cancelled);
    }

    public Optional<QueryState> getQueryState(String queryId) {
        return tracker.stateOf(queryId);
    }

    public SwarmStatus getStatus() {
        Map<Role, RoleStatus> roles = new EnumMap<>(Role.class);

        for (Role role : Role.values()) {
            Optional<Agent> agent = registry.find(role);
            roles.put(role, new RoleStatus(
                    role,
                    agent.map(Agent::getAgentId).orElse(null),
                    agent.isPresent(),
                    registry.isAvailable(role),
                    registry.lastInitError(role).orElse(null)
            ));
        }

        return new SwarmStatus(
                roles,
                tracker.activeCount(),
                metricsStore.totalProcessed(),
                metricsStore.averageProcessingMillis(),
                metricsStore.snapshot()
        );
    }

    // =========================================================================
    // Phase helpers
    // =========================================================================

    private void advance(String queryId, QueryState next) throws QueryCancelledException {
        if (!tracker.transition(queryId, next)) {
            throw new QueryCancelledException(queryId);
        }
        log.info("[Orchestrator] Query {} → {}", queryId, next);
    }

    /** One best-effort re-initialisation of MASTER per query. */
    private void ensureMasterAvailable() throws SwarmException {
        if (registry.isAvailable(Role.MASTER)) return;

        log.warn("[Orchestrator] MASTER not initialized, re-attempting initialization");
        registry.initialize(Role.MASTER);
    }

    private SwarmResult fail(Query query, SwarmException error, long startTime) {
        if (!tracker.transition(query.getId(), QueryState.FAILED)) {
            // cancel() got there first
            return failedResult(query, new QueryCancelledException(query.getId()), startTime, QueryState.CANCELLED);
        }
        log.error("[Orchestrator] Query {} FAILED: {}", query.getId(), error.getMessage());
        return failedResult(query, error, startTime, QueryState.FAILED);
    }

    private SwarmResult failedResult(Query query, SwarmException error, long startTime, QueryState status) {
        long        elapsed = System.currentTimeMillis() - startTime;
        AgentResult master  = AgentResult.degraded(Role.MASTER, error, elapsed);

        return new SwarmResult(
                query,
                master,
                Map.of(Role.MASTER, master),
                Synthesis.empty(),
                ValidationReport.notValidated(error.getMessage()),
                elapsed,
                status,
                error.getMessage()
        );
    }

    private SwarmResult finish(Query query, ExecutionPlan plan, SwarmResult result) {
        QueryMetrics metrics = new QueryMetrics(
                query.getId(),
                query.getComplexity(),
                result.getDurationMillis(),
                plan != null ? plan.getRequiredRoles() : result.getResults().keySet(),
                result.getSynthesis().getUnifiedSources().size(),
                result.getConfidence(),
                result.getStatus(),
                result.getTimestamp()
        );
        metricsStore.record(metrics);
        logMetrics(metrics);

        log.info("========== SWARM QUERY {} END ({}) ==========", query.getId(), result.getStatus());
        return result;
    }

    private void logMetrics(QueryMetrics m) {
        String json = String.format(
                "{\"query_id\":\"%s\",\"complexity\":\"%s\",\"processing_ms\":%d,\"roles\":\"%s\"," +
                "\"sources\":%d,\"confidence\":\"%s\",\"status\":\"%s\",\"timestamp\":\"%s\"}",
                m.getQueryId(), m.getComplexity(), m.getProcessingMillis(), m.getRolesUsed(),
                m.getSourcesFound(), m.getConfidence(), m.getState(), m.getTimestamp()
        );
        log.info("[Metrics] {}", json);
    }
}
