package io.cadence4j.core;

import java.time.Duration;

/**
 * Keyed lock used by schedulers to keep overlapping events from running at the same time.
 */
public interface Mutex {

    /**
     * Try to take the lock for {@code key}. A lock that was never released expires after
     * {@code timeout}.
     *
     * @return true if the lock was taken
     */
    boolean tryGetLock(String key, Duration timeout);

    void release(String key);
}
