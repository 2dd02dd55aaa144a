package io.cadence4j.core;

/**
 * Removal capability handed to a scheduled event by the scheduler that owns it.
 */
@FunctionalInterface
public interface Unscheduler {

    /**
     * Removes the events carrying this identifier. Idempotent.
     *
     * @return true if at least one event was removed
     */
    boolean tryUnschedule(String uniqueIdentifier);
}
