package io.cadence4j.core;

import java.util.concurrent.CancellationException;

/**
 * Read side of a cooperative cancellation signal.
 */
public interface CancellationToken {

    CancellationToken NONE = () -> false;

    boolean isCancellationRequested();

    default void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new CancellationException("Cancellation requested");
        }
    }
}
