package io.cadence4j.core;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owner side of a {@link CancellationToken}.
 */
public class CancellationSource {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CancellationToken token = cancelled::get;

    public CancellationToken token() {
        return token;
    }

    /**
     * @return true if this call moved the source into the cancelled state
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
