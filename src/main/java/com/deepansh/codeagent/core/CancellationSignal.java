package com.deepansh.codeagent.core;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Session-level cancellation flag that in-flight work can subscribe to.
 *
 * Model calls cancel their future, tool executions cancel their handler,
 * and spawned processes destroy themselves. Listeners registered after
 * cancellation run immediately on the registering thread.
 */
@Slf4j
public class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        for (Runnable listener : listeners) {
            runQuietly(listener);
        }
        listeners.clear();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Register a callback for cancellation. Close the returned subscription
     * once the guarded work has finished.
     */
    public Subscription onCancel(Runnable listener) {
        listeners.add(listener);
        if (cancelled.get() && listeners.remove(listener)) {
            runQuietly(listener);
        }
        return () -> listeners.remove(listener);
    }

    private void runQuietly(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation listener failed: {}", e.getMessage());
        }
    }

    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
