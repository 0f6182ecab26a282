package com.deepansh.codeagent.core;

public enum LoopPhase {
    AWAITING_MODEL,
    AWAITING_TOOL_RESULTS,
    TERMINATED
}
