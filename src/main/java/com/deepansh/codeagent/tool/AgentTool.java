package com.deepansh.codeagent.tool;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * Contract for built-in tools discovered as Spring beans.
 *
 * The {@link #getInputSchema()} return value is a JSON Schema (as a Map);
 * it is sent to the model and used to validate arguments before execution.
 */
public interface AgentTool extends ToolHandler {

    /** Unique snake_case name the model uses to invoke this tool */
    String getName();

    /**
     * Human-readable description. This is the primary signal the model uses
     * to decide when to call this tool.
     */
    String getDescription();

    Map<String, Object> getInputSchema();

    /** Mutating tools are subject to sandbox mode and approval policy */
    default boolean isMutating() {
        return false;
    }

    /** Arguments holding filesystem paths, checked against the workspace root */
    default Set<String> getPathArguments() {
        return Set.of();
    }

    /** Null means the session default */
    default Duration getTimeout() {
        return null;
    }
}
