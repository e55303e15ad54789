package com.swarmnet.llm;

/** Transport or protocol failure talking to an LLM backend. */
public class LlmCallException extends RuntimeException {

    public LlmCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
