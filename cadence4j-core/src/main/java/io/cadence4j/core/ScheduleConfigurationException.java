package io.cadence4j.core;

/**
 * Raised while configuring a scheduled event, never during a scheduler tick.
 */
public class ScheduleConfigurationException extends IllegalArgumentException {

    public ScheduleConfigurationException(String message) {
        super(message);
    }

    public ScheduleConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
