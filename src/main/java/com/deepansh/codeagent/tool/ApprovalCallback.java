package com.deepansh.codeagent.tool;

/**
 * Human confirmation capability supplied by whoever drives the session
 * (console prompt, pre-approved tool list on the HTTP surface, tests).
 */
@FunctionalInterface
public interface ApprovalCallback {

    /**
     * @param toolName the mutating tool about to run
     * @param preview  rendered arguments, truncated for display
     * @return true to let the call proceed
     */
    boolean approve(String toolName, String preview);

    ApprovalCallback DENY_ALL = (toolName, preview) -> false;
}
