package com.deepansh.codeagent.exception;

import lombok.Getter;

@Getter
public class ProviderException extends AgentException {

    private final ProviderErrorKind kind;
    private final String provider;

    public ProviderException(String provider, ProviderErrorKind kind, String message) {
        super(provider + " " + kind.name().toLowerCase() + ": " + message);
        this.provider = provider;
        this.kind = kind;
    }

    public ProviderException(String provider, ProviderErrorKind kind, String message, Throwable cause) {
        super(provider + " " + kind.name().toLowerCase() + ": " + message, cause);
        this.provider = provider;
        this.kind = kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
