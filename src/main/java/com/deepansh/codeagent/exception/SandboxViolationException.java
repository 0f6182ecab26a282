package com.deepansh.codeagent.exception;

public class SandboxViolationException extends ToolExecutionException {

    public SandboxViolationException(String message) {
        super(message);
    }
}
