package com.deepansh.codeagent.exception;

/**
 * Raised while wiring tools: duplicate names, bad subagent bindings,
 * malformed external tool definitions. Always fails fast at startup.
 */
public class ToolConfigurationException extends AgentException {

    public ToolConfigurationException(String message) {
        super(message);
    }
}
