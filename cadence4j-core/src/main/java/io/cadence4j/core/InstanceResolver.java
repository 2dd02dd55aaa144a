package io.cadence4j.core;

/**
 * Produces instances of invocable types on behalf of the scheduler.
 *
 * <p>Each invocation opens its own {@link ResolutionScope} and closes it once the work has
 * finished, whether it succeeded or threw.
 */
public interface InstanceResolver {

    ResolutionScope createScope();
}
