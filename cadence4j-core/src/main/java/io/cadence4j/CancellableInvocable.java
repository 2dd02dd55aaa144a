package io.cadence4j;

import io.cadence4j.core.CancellationToken;

/**
 * An {@link Invocable} that wants the scheduler's cancellation signal.
 *
 * <p>The token is set right before {@link #invoke()} is called. Reacting to it is up to the
 * implementation.
 */
public interface CancellableInvocable extends Invocable {

    void setCancellationToken(CancellationToken token);
}
