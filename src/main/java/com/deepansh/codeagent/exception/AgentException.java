package com.deepansh.codeagent.exception;

/**
 * Base runtime exception for the agent engine.
 * Mapped to a 500 response by {@link GlobalExceptionHandler}.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
