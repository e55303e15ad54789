package com.swarmnet.core.state;

import com.swarmnet.core.planner.ExecutionPlan;

import java.time.Instant;

/** Immutable snapshot of one query inside QueryTracker: start time, state, plan. */
public final class TrackedQuery {

    private final String        queryId;
    private final Instant       startedAt;
    private final QueryState    state;
    private final ExecutionPlan plan;

    public TrackedQuery(String queryId, Instant startedAt, QueryState state, ExecutionPlan plan) {
        this.queryId   = queryId;
        this.startedAt = startedAt;
        this.state     = state;
        this.plan      = plan;
    }

    public TrackedQuery withState(QueryState newState) {
        return new TrackedQuery(queryId, startedAt, newState, plan);
    }

    public TrackedQuery withPlan(ExecutionPlan newPlan) {
        return new TrackedQuery(queryId, startedAt, state, newPlan);
    }

    public String        getQueryId()   { return queryId; }
    public Instant       getStartedAt() { return startedAt; }
    public QueryState    getState()     { return state; }
    public ExecutionPlan getPlan()      { return plan; }

    @Override
    public String toString() {
        return "TrackedQuery{" + queryId + ", state=" + state + "}";
    }
}
