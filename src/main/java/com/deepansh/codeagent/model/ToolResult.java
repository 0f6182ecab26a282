package com.deepansh.codeagent.model;

/**
 * Outcome of one sandbox gate invocation.
 * {@code errorKind} is null for successful results.
 */
public record ToolResult(
        String toolCallId,
        String toolName,
        String output,
        boolean error,
        ToolErrorKind errorKind
) {

    public static ToolResult success(ToolCall call, String output) {
        return new ToolResult(call.getId(), call.getToolName(), output == null ? "" : output, false, null);
    }

    public static ToolResult failure(ToolCall call, ToolErrorKind kind, String message) {
        return new ToolResult(call.getId(), call.getToolName(), "ERROR: " + message, true, kind);
    }
}
