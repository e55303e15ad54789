package com.swarmnet.core.state;

import com.swarmnet.core.planner.ExecutionPlan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * QueryTracker - orchestrator-owned table of query id → TrackedQuery.
 *
 * Every state change goes through ConcurrentHashMap.compute(), so a
 * transition and a concurrent cancel() for the same id can never interleave:
 * whichever lands second sees the other's state and is validated against it.
 *
 * Finished queries (COMPLETED, FAILED, CANCELLED) stay queryable until more
 * than swarmnet.tracker.max-finished of them have accumulated; the oldest
 * finished entry is then dropped. In-flight entries are never evicted.
 */
@Component
public class QueryTracker {

    private static final Logger log = LoggerFactory.getLogger(QueryTracker.class);

    public static final int DEFAULT_MAX_FINISHED = 1000;

    private final Map<String, TrackedQuery> queries       = new ConcurrentHashMap<>();
    private final Queue<String>             finished      = new ConcurrentLinkedQueue<>();
    private final AtomicInteger             finishedCount = new AtomicInteger();
    private final int                       maxFinished;

    public QueryTracker() {
        this(DEFAULT_MAX_FINISHED);
    }

    @Autowired
    public QueryTracker(@Value("${swarmnet.tracker.max-finished:" + DEFAULT_MAX_FINISHED + "}") int maxFinished) {
        this.maxFinished = Math.max(0, maxFinished);
    }

    /**
     * Start tracking a query in QUEUED.
     *
     * @throws IllegalStateException if a query with the same id is still in flight
     */
    public void register(String queryId, Instant startedAt) {
        queries.compute(queryId, (id, existing) -> {
            if (existing != null && !existing.getState().isTerminal()) {
                throw new IllegalStateException("Query " + id + " is already in flight");
            }
            return new TrackedQuery(id, startedAt, QueryState.QUEUED, null);
        });
    }

    /**
     * Move a query to the next state.
     *
     * @return false if the query is unknown or the transition is not allowed
     *         from its current state (typically because it was cancelled)
     */
    public boolean transition(String queryId, QueryState next) {
        boolean[] applied = {false};

        queries.computeIfPresent(queryId, (id, current) -> {
            if (!current.getState().canTransitionTo(next)) {
                return current;
            }
            applied[0] = true;
            return current.withState(next);
        });

        if (applied[0]) {
            log.debug("[Tracker] {} → {}", queryId, next);
            if (next.isTerminal()) {
                retire(queryId);
            }
        }
        return applied[0];
    }

    public void attachPlan(String queryId, ExecutionPlan plan) {
        queries.computeIfPresent(queryId, (id, current) -> current.withPlan(plan));
    }

    /** Cooperative cancellation: true if the query was in flight and is now CANCELLED. */
    public boolean cancel(String queryId) {
        boolean cancelled = transition(queryId, QueryState.CANCELLED);
        if (cancelled) {
            log.info("[Tracker] Query {} cancelled", queryId);
        }
        return cancelled;
    }

    /** Cancel every query still in flight; returns how many were cancelled. */
    public int cancelAll() {
        int cancelled = 0;
        for (String queryId : queries.keySet()) {
            if (cancel(queryId)) cancelled++;
        }
        return cancelled;
    }

    public Optional<QueryState> stateOf(String queryId) {
        TrackedQuery tracked = queries.get(queryId);
        return tracked == null ? Optional.empty() : Optional.of(tracked.getState());
    }

    public Optional<TrackedQuery> find(String queryId) {
        return Optional.ofNullable(queries.get(queryId));
    }

    public boolean isCancelled(String queryId) {
        return stateOf(queryId).orElse(null) == QueryState.CANCELLED;
    }

    /** True while the query is tracked and has not reached a terminal state. */
    public boolean isInFlight(String queryId) {
        return stateOf(queryId).map(state -> !state.isTerminal()).orElse(false);
    }

    public int activeCount() {
        int active = 0;
        for (TrackedQuery tracked : queries.values()) {
            if (!tracked.getState().isTerminal()) active++;
        }
        return active;
    }

    public int trackedCount() {
        return queries.size();
    }

    private void retire(String queryId) {
        finished.add(queryId);
        if (finishedCount.incrementAndGet() <= maxFinished) return;

        String oldest = finished.poll();
        finishedCount.decrementAndGet();
        if (oldest == null) return;

        // a re-registered id is back in flight and must stay
        queries.computeIfPresent(oldest, (id, tracked) -> tracked.getState().isTerminal() ? null : tracked);
        log.debug("[Tracker] Evicted finished query {}", oldest);
    }
}
