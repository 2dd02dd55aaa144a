package io.cadence4j.core;

/**
 * The {@link InstanceResolver} could not produce an instance of the requested type.
 */
public class InstanceResolutionException extends RuntimeException {

    public InstanceResolutionException(String message) {
        super(message);
    }

    public InstanceResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
