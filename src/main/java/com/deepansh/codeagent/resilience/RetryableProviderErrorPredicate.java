package com.deepansh.codeagent.resilience;

import com.deepansh.codeagent.exception.ProviderException;

import java.util.function.Predicate;

/**
 * Retry only transient provider failures (NETWORK, RATE_LIMIT).
 * AUTH and INVALID_RESPONSE fail fast: repeating the call cannot change them.
 *
 * Referenced by name from application.yml
 * ({@code resilience4j.retry.instances.modelAdapter.retry-exception-predicate}).
 */
public class RetryableProviderErrorPredicate implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        return throwable instanceof ProviderException pe && pe.isRetryable();
    }
}
