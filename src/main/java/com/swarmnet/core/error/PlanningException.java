package com.swarmnet.core.error;

public class PlanningException extends SwarmException {

    public PlanningException(String message) {
        super(message);
    }
}
