package com.deepansh.codeagent.model;

/**
 * Machine-readable classification of tool failures.
 * All of these are reported to the model as a tool result, never thrown out of the loop.
 */
public enum ToolErrorKind {

    UNKNOWN_TOOL,

    SCHEMA_INVALID,

    SANDBOX_DENIED,

    /** A required confirmation was declined */
    APPROVAL_DENIED,

    TIMEOUT,

    /** The handler itself failed (exception, non-zero exit of an external tool, ...) */
    HANDLER_FAILURE,

    CANCELLED
}
