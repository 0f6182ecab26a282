package com.deepansh.codeagent.exception;

/**
 * Thrown by a tool handler to report a failure the model should see.
 * The sandbox gate turns it into an error tool result.
 */
public class ToolExecutionException extends AgentException {

    public ToolExecutionException(String message) {
        super(message);
    }

    public ToolExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
