package com.swarmnet.core.executor;

import com.swarmnet.config.SwarmSettings;
import com.swarmnet.core.agent.Agent;
import com.swarmnet.core.agent.AgentContext;
import com.swarmnet.core.agent.AgentResult;
import com.swarmnet.core.agent.Role;
import com.swarmnet.core.error.RoleExecutionException;
import com.swarmnet.core.error.RoleFailureException;
import com.swarmnet.core.error.RoleTimeoutException;
import com.swarmnet.core.error.RoleUnavailableException;
import com.swarmnet.core.planner.ExecutionStrategy;
import com.swarmnet.core.query.Query;
import com.swarmnet.core.registry.AgentRegistry;
import com.swarmnet.core.task.AgentTask;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

/**
 * AgentExecutor - runs one query's tasks under the plan's strategy.
 *
 * FAILURE CONTAINMENT:
 *   Every invocation is bounded by min(role timeout, query time limit).
 *   A non-MASTER role that is unavailable, times out or throws is replaced by
 *   AgentResult.degraded(); the rest of the batch carries on. The same
 *   failure on MASTER is rethrown, because there is no verdict without it.
 *
 * TOPOLOGY:
 *   SEQUENTIAL         ascending priority, one at a time
 *   PARALLEL           peers fan out on roleWorkerPool, join, then MASTER alone
 *   HIERARCHICAL       SEARCH → {INNOVATION, ANALYSIS} with SEARCH's result →
 *                      MASTER with every peer result
 *   FULL_ORCHESTRATION all tasks as one invokeAll batch on orchestrationPool;
 *                      a rejected batch falls back to HIERARCHICAL
 *
 * CANCELLATION:
 *   The cancellation check is polled before every task under SEQUENTIAL and
 *   before every phase under the other strategies. Once it reports true no
 *   further invocation is started and the results gathered so far are
 *   returned; calls already running are left to finish.
 */
@Component
public class AgentExecutor {

    private static final Logger log = LoggerFactory.getLogger(AgentExecutor.class);

    private final AgentRegistry   registry;
    private final SwarmSettings   settings;
    private final ExecutorService workerPool;
    private final ExecutorService orchestrationPool;

    @Autowired
    public AgentExecutor(
            AgentRegistry registry,
            SwarmSettings settings,
            @Qualifier("roleWorkerPool")    ThreadPoolTaskExecutor workerPool,
            @Qualifier("orchestrationPool") ThreadPoolTaskExecutor orchestrationPool
    ) {
        this(registry, settings, workerPool.getThreadPoolExecutor(), orchestrationPool.getThreadPoolExecutor());
    }

    public AgentExecutor(
            AgentRegistry   registry,
            SwarmSettings   settings,
            ExecutorService workerPool,
            ExecutorService orchestrationPool
    ) {
        this.registry          = registry;
        this.settings          = settings;
        this.workerPool        = workerPool;
        this.orchestrationPool = orchestrationPool;
    }

    public Map<Role, AgentResult> execute(ExecutionStrategy strategy, List<AgentTask> tasks, Query query)
            throws RoleFailureException {
        return execute(strategy, tasks, query, () -> false);
    }

    /**
     * Execute the tasks and return exactly one result per task role, or fewer
     * if {@code cancelled} turned true before every task was started.
     *
     * @throws RoleFailureException only for MASTER (unavailable, timed out or failed)
     */
    public Map<Role, AgentResult> execute(ExecutionStrategy strategy, List<AgentTask> tasks, Query query,
                                          BooleanSupplier cancelled) throws RoleFailureException {

        List<AgentTask> ordered = new ArrayList<>(tasks);
        ordered.sort(Comparator.comparingInt(AgentTask::getPriority));

        if (ordered.stream().noneMatch(t -> t.getRole().isMaster())) {
            throw new RoleUnavailableException(Role.MASTER, "no MASTER task scheduled");
        }

        log.info("[Executor] Query {} running {} tasks with {}", query.getId(), ordered.size(), strategy);

        Map<Role, AgentResult> results = switch (strategy) {
            case SEQUENTIAL         -> runSequential(ordered, query, cancelled);
            case PARALLEL           -> runParallel(ordered, query, cancelled);
            case HIERARCHICAL       -> runHierarchical(ordered, query, cancelled);
            case FULL_ORCHESTRATION -> runFullOrchestration(ordered, query, cancelled);
        };

        log.info("[Executor] Query {} finished: {}", query.getId(), results.values());
        return results;
    }

    // =========================================================================
    // Strategies
    // =========================================================================

    private Map<Role, AgentResult> runSequential(List<AgentTask> tasks, Query query, BooleanSupplier cancelled)
            throws RoleFailureException {
        Map<Role, AgentResult> results = new EnumMap<>(Role.class);
        for (AgentTask task : tasks) {
            if (stopped(cancelled, query, task.getRole().name())) break;
            results.put(task.getRole(), runOne(task, query, Map.of()));
        }
        return results;
    }

    private Map<Role, AgentResult> runParallel(List<AgentTask> tasks, Query query, BooleanSupplier cancelled)
            throws RoleFailureException {
        Map<Role, AgentResult> results = new EnumMap<>(Role.class);

        if (stopped(cancelled, query, "peer fan-out")) return results;
        results.putAll(runConcurrently(peersOf(tasks), query, Map.of()));

        if (stopped(cancelled, query, "MASTER")) return results;
        AgentTask master = taskFor(tasks, Role.MASTER);
        results.put(Role.MASTER, runOne(master, query, Map.of()));
        return results;
    }

    private Map<Role, AgentResult> runHierarchical(List<AgentTask> tasks, Query query, BooleanSupplier cancelled)
            throws RoleFailureException {
        Map<Role, AgentResult> results = new EnumMap<>(Role.class);

        // Phase 1: evidence
        if (stopped(cancelled, query, "phase 1")) return results;
        AgentTask search = taskFor(tasks, Role.SEARCH);
        if (search != null) {
            results.put(Role.SEARCH, runOne(search, query, Map.of()));
        }

        // Phase 2: innovation and analysis, reading the evidence
        List<AgentTask> phaseTwo = new ArrayList<>();
        for (AgentTask task : tasks) {
            if (task.getRole() == Role.INNOVATION || task.getRole() == Role.ANALYSIS) {
                phaseTwo.add(task);
            }
        }
        if (stopped(cancelled, query, "phase 2")) return results;
        results.putAll(runConcurrently(phaseTwo, query, Map.copyOf(results)));

        // Phase 3: verdict over every peer result
        if (stopped(cancelled, query, "phase 3")) return results;
        AgentTask master = taskFor(tasks, Role.MASTER);
        results.put(Role.MASTER, runOne(master, query, results));
        return results;
    }

    private Map<Role, AgentResult> runFullOrchestration(List<AgentTask> tasks, Query query, BooleanSupplier cancelled)
            throws RoleFailureException {

        if (stopped(cancelled, query, "orchestration batch")) return new EnumMap<>(Role.class);

        List<Callable<AgentResult>> batch = new ArrayList<>();
        for (AgentTask task : tasks) {
            batch.add(() -> runOne(task, query, Map.of()));
        }

        List<Future<AgentResult>> futures;
        try {
            futures = orchestrationPool.invokeAll(batch);
        } catch (RejectedExecutionException e) {
            log.warn("[Executor] Query {} batch rejected by orchestration pool ({}), falling back to HIERARCHICAL",
                    query.getId(), e.getMessage());
            return runHierarchical(tasks, query, cancelled);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RoleExecutionException(Role.MASTER, "interrupted while running the orchestration batch", e);
        }

        Map<Role, AgentResult> results = new EnumMap<>(Role.class);
        for (int i = 0; i < tasks.size(); i++) {
            Role role = tasks.get(i).getRole();
            try {
                results.put(role, futures.get(i).get());
            } catch (ExecutionException e) {
                throw asRoleFailure(role, e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RoleExecutionException(role, "interrupted while collecting the orchestration batch", e);
            }
        }
        return results;
    }

    // =========================================================================
    // Fan-out / join
    // =========================================================================

    private Map<Role, AgentResult> runConcurrently(List<AgentTask> tasks, Query query, Map<Role, AgentResult> peers)
            throws RoleFailureException {

        long startedAt = System.currentTimeMillis();

        Map<AgentTask, Future<AgentResult>> pending = new LinkedHashMap<>();
        for (AgentTask task : tasks) {
            pending.put(task, dispatch(task, query, peers));
        }

        Map<Role, AgentResult> results = new EnumMap<>(Role.class);
        for (Map.Entry<AgentTask, Future<AgentResult>> entry : pending.entrySet()) {
            Role role = entry.getKey().getRole();
            results.put(role, await(role, entry.getValue(), startedAt, query));
        }
        return results;
    }

    private AgentResult runOne(AgentTask task, Query query, Map<Role, AgentResult> peers)
            throws RoleFailureException {
        long startedAt = System.currentTimeMillis();
        return await(task.getRole(), dispatch(task, query, peers), startedAt, query);
    }

    private Future<AgentResult> dispatch(AgentTask task, Query query, Map<Role, AgentResult> peers) {
        Role         role    = task.getRole();
        AgentContext context = new AgentContext(task.getContextHints(), peers);
        try {
            return workerPool.submit(() -> invoke(role, query, context));
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(
                    new RoleExecutionException(role, "worker pool rejected the invocation", e));
        }
    }

    private AgentResult invoke(Role role, Query query, AgentContext context) throws RoleFailureException {
        Agent agent = registry.requireAvailable(role);

        AgentResult result;
        try {
            result = agent.processQuery(query, context);
        } catch (RuntimeException e) {
            throw new RoleExecutionException(role, "unexpected error: " + e.getMessage(), e);
        }

        if (result == null) {
            throw new RoleExecutionException(role, "collaborator returned no result");
        }
        if (result.getRole() != role) {
            throw new RoleExecutionException(role, "collaborator returned a result for " + result.getRole());
        }
        return result;
    }

    private AgentResult await(Role role, Future<AgentResult> future, long startedAt, Query query)
            throws RoleFailureException {

        Duration timeout   = effectiveTimeout(role, query);
        long     remaining = startedAt + timeout.toMillis() - System.currentTimeMillis();

        try {
            return future.get(Math.max(0, remaining), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return absorb(role, new RoleTimeoutException(role, timeout), startedAt);
        } catch (ExecutionException e) {
            return absorb(role, asRoleFailure(role, e.getCause()), startedAt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return absorb(role, new RoleExecutionException(role, "interrupted while waiting for result", e), startedAt);
        }
    }

    /** Degrade a non-MASTER failure; rethrow it for MASTER. */
    private AgentResult absorb(Role role, RoleFailureException failure, long startedAt) throws RoleFailureException {
        if (role.isMaster()) {
            log.error("[Executor] MASTER failed: {}", failure.getMessage());
            throw failure;
        }
        long elapsed = System.currentTimeMillis() - startedAt;
        log.warn("[Executor] {} degraded after {} ms: {}", role, elapsed, failure.getMessage());
        return AgentResult.degraded(role, failure, elapsed);
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private static boolean stopped(BooleanSupplier cancelled, Query query, String next) {
        if (!cancelled.getAsBoolean()) return false;
        log.info("[Executor] Query {} cancelled, not starting {}", query.getId(), next);
        return true;
    }

    Duration effectiveTimeout(Role role, Query query) {
        Duration roleTimeout  = settings.forRole(role).getTimeout();
        Duration queryTimeout = Duration.ofSeconds(query.getTimeLimitSeconds());
        return roleTimeout.compareTo(queryTimeout) <= 0 ? roleTimeout : queryTimeout;
    }

    private static RoleFailureException asRoleFailure(Role role, Throwable cause) {
        if (cause instanceof RoleFailureException) {
            return (RoleFailureException) cause;
        }
        return new RoleExecutionException(role, String.valueOf(cause != null ? cause.getMessage() : null), cause);
    }

    private static List<AgentTask> peersOf(List<AgentTask> tasks) {
        List<AgentTask> peers = new ArrayList<>();
        for (AgentTask task : tasks) {
            if (!task.getRole().isMaster()) peers.add(task);
        }
        return peers;
    }

    private static AgentTask taskFor(List<AgentTask> tasks, Role role) {
        for (AgentTask task : tasks) {
            if (task.getRole() == role) return task;
        }
        return null;
    }
}
