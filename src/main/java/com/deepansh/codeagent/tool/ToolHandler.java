package com.deepansh.codeagent.tool;

import java.time.Duration;
import java.util.Map;

/**
 * Executable capability behind a tool name.
 *
 * Handlers only run after the sandbox gate has validated arguments and
 * cleared sandbox and approval checks. Report failures by throwing; the
 * gate converts any exception into an error tool result.
 */
@FunctionalInterface
public interface ToolHandler {

    String execute(Map<String, Object> arguments, ToolContext context) throws Exception;

    /**
     * Whether this particular call needs a fresh confirmation even though the
     * tool was already approved in this session (e.g. destructive variants).
     */
    default boolean requiresConfirmation(Map<String, Object> arguments) {
        return false;
    }

    /** Timeout for this call; handlers with their own timeout argument widen it here */
    default Duration timeoutFor(Map<String, Object> arguments, Duration declared) {
        return declared;
    }
}
