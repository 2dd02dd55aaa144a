package io.cadence4j;

import java.time.Duration;

/**
 * First step of configuring a scheduled event: choose when it is due.
 *
 * <p>Cron-based selections are evaluated once per minute (at second 0). Second-based selections
 * are evaluated on every scheduler tick.
 */
public interface ScheduleInterval {

    /**
     * Every day at midnight ({@code 00 00 * * *}).
     */
    ScheduledEventConfiguration daily();

    ScheduledEventConfiguration dailyAtHour(int hour);

    ScheduledEventConfiguration dailyAt(int hour, int minute);

    /**
     * Every hour at minute 0 ({@code 00 * * * *}).
     */
    ScheduledEventConfiguration hourly();

    ScheduledEventConfiguration hourlyAt(int minute);

    ScheduledEventConfiguration everyMinute();

    ScheduledEventConfiguration everyFiveMinutes();

    ScheduledEventConfiguration everyTenMinutes();

    ScheduledEventConfiguration everyFifteenMinutes();

    ScheduledEventConfiguration everyThirtyMinutes();

    /**
     * Mondays at midnight ({@code 00 00 * * 1}).
     */
    ScheduledEventConfiguration weekly();

    /**
     * First day of the month at midnight ({@code 00 00 1 * *}).
     */
    ScheduledEventConfiguration monthly();

    /**
     * Arbitrary five-field cron expression.
     *
     * @throws io.cadence4j.core.CronFormatException if the expression does not parse
     */
    ScheduledEventConfiguration cron(String cronExpression);

    ScheduledEventConfiguration everySecond();

    ScheduledEventConfiguration everyFiveSeconds();

    ScheduledEventConfiguration everyTenSeconds();

    ScheduledEventConfiguration everyFifteenSeconds();

    ScheduledEventConfiguration everyThirtySeconds();

    /**
     * Due whenever the second of the minute is a multiple of {@code seconds}, and at the top of
     * every minute.
     *
     * @param seconds 1 to 59
     */
    ScheduledEventConfiguration everySeconds(int seconds);

    /**
     * Same as {@link #everySeconds(int)} for a whole number of seconds between 1 and 59.
     */
    ScheduledEventConfiguration everyInterval(Duration interval);
}
