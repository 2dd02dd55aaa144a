package io.cadence4j;

/**
 * Unit of scheduled work resolved by type through an {@link io.cadence4j.core.InstanceResolver}.
 */
public interface Invocable {

    void invoke() throws Exception;
}
