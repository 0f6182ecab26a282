package com.deepansh.codeagent.exception;

/**
 * A run was requested under a session id that is still running.
 */
public class SessionConflictException extends AgentException {

    public SessionConflictException(String sessionId) {
        super("session '" + sessionId + "' is already running");
    }
}
