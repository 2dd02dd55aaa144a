package io.cadence4j.core;

/**
 * A cron string that does not parse into valid five-field syntax.
 */
public class CronFormatException extends ScheduleConfigurationException {

    public CronFormatException(String message) {
        super(message);
    }
}
