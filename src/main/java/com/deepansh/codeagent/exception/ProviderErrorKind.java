package com.deepansh.codeagent.exception;

/**
 * Failure classes for model provider calls.
 * Only {@link #NETWORK} and {@link #RATE_LIMIT} are worth retrying.
 */
public enum ProviderErrorKind {

    /** Invalid or missing API key, forbidden model */
    AUTH(false),

    RATE_LIMIT(true),

    /** Connection failures, timeouts, 5xx and overload responses */
    NETWORK(true),

    /** Unparseable or structurally wrong response, or a rejected request */
    INVALID_RESPONSE(false);

    private final boolean retryable;

    ProviderErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
