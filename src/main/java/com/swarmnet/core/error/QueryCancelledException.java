package com.swarmnet.core.error;

public class QueryCancelledException extends SwarmException {

    private final String queryId;

    public QueryCancelledException(String queryId) {
        super("Query " + queryId + " was cancelled");
        this.queryId = queryId;
    }

    public String getQueryId() {
        return queryId;
    }
}
