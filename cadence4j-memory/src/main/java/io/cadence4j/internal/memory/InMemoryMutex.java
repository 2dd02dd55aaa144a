package io.cadence4j.internal.memory;

import io.cadence4j.core.Mutex;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local {@link Mutex}. Locks expire so a lost release cannot block a key forever.
 */
public class InMemoryMutex implements Mutex {

    private final ConcurrentHashMap<String, Instant> lockedUntil = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryMutex() {
        this(Clock.systemUTC());
    }

    public InMemoryMutex(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public boolean tryGetLock(String key, Duration timeout) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be a positive duration");
        }

        Instant now = clock.instant();
        AtomicBoolean acquired = new AtomicBoolean(false);
        lockedUntil.compute(key, (k, until) -> {
            if (until == null || !until.isAfter(now)) {
                acquired.set(true);
                return now.plus(timeout);
            }
            return until;
        });
        return acquired.get();
    }

    @Override
    public void release(String key) {
        Objects.requireNonNull(key, "key must not be null");
        lockedUntil.remove(key);
    }

    public boolean isLocked(String key) {
        Instant until = lockedUntil.get(key);
        return until != null && until.isAfter(clock.instant());
    }
}
