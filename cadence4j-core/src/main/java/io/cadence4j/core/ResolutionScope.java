package io.cadence4j.core;

/**
 * Short-lived handle from which invocable instances are produced.
 *
 * <p>Closing the scope releases every instance it produced.
 */
public interface ResolutionScope extends AutoCloseable {

    /**
     * Resolve an instance of {@code type}.
     *
     * @param parameters constructor arguments bound at configuration time; empty for default resolution
     * @throws InstanceResolutionException if no instance can be produced
     */
    <T> T resolve(Class<T> type, Object[] parameters);

    @Override
    void close();
}
