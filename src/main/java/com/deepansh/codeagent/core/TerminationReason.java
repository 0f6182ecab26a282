package com.deepansh.codeagent.core;

/**
 * Why a loop stopped. Every reason except DONE leaves a partial transcript
 * that is still returned to the caller.
 */
public enum TerminationReason {

    /** The model answered without tool calls */
    DONE,

    /** The step budget ran out after a tool turn */
    MAX_STEPS_EXCEEDED,

    /** A provider failure escaped the retry layer */
    ERROR,

    CANCELLED
}
