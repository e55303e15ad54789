package com.swarmnet.core.error;

public class SynthesisException extends SwarmException {

    public SynthesisException(String message) {
        super(message);
    }
}
