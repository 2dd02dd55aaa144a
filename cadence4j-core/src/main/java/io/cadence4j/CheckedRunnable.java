package io.cadence4j;

/**
 * Inline scheduled action that may throw.
 */
@FunctionalInterface
public interface CheckedRunnable {

    void run() throws Exception;
}
