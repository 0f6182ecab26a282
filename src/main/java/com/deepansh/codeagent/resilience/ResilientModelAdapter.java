package com.deepansh.codeagent.resilience;

import com.deepansh.codeagent.exception.ProviderException;
import com.deepansh.codeagent.llm.ModelProtocolAdapter;
import com.deepansh.codeagent.model.Message;
import com.deepansh.codeagent.tool.ToolSpec;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decorator around the provider adapter that adds retry with exponential backoff.
 *
 * Retry config (in application.yml, instance "modelAdapter"):
 * - 4 attempts, exponential backoff 1s → 2s → 4s, capped at 20s
 * - only NETWORK and RATE_LIMIT are retried, see {@link RetryableProviderErrorPredicate}
 *
 * When attempts run out the last {@link ProviderException} propagates unchanged;
 * the loop turns it into an ERROR termination.
 */
@Component
@Primary
@Slf4j
public class ResilientModelAdapter implements ModelProtocolAdapter {

    static final String RETRY_NAME = "modelAdapter";

    private final ModelProtocolAdapter delegate;
    private final Retry retry;

    @Autowired
    public ResilientModelAdapter(@Qualifier("providerModelAdapter") ModelProtocolAdapter delegate,
                                 RetryRegistry retryRegistry) {
        this(delegate, retryRegistry.retry(RETRY_NAME));
    }

    public ResilientModelAdapter(ModelProtocolAdapter delegate, Retry retry) {
        this.delegate = delegate;
        this.retry = retry;
        this.retry.getEventPublisher()
                .onRetry(event -> log.warn("{} call failed (attempt {}), retrying in {}ms: {}",
                        delegate.provider(), event.getNumberOfRetryAttempts(),
                        event.getWaitInterval().toMillis(),
                        event.getLastThrowable() == null ? "-" : event.getLastThrowable().getMessage()))
                .onError(event -> log.error("{} call failed after {} attempt(s): {}",
                        delegate.provider(), event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() == null ? "-" : event.getLastThrowable().getMessage()));
    }

    @Override
    public Message send(List<Message> history, List<ToolSpec> tools) {
        return Retry.decorateSupplier(retry, () -> delegate.send(history, tools)).get();
    }

    @Override
    public String provider() {
        return delegate.provider();
    }
}
