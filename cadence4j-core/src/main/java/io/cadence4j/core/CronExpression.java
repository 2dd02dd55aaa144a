package io.cadence4j.core;

import java.time.DayOfWeek;
import java.time.ZonedDateTime;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Five-field cron rule: minute, hour, day-of-month, month, day-of-week.
 *
 * <p>All fields must match for a point in time to be due. Day-of-week uses
 * {@code 0-7} where both {@code 0} and {@code 7} mean Sunday.
 *
 * <p>Weekdays appended through {@link #appendWeekday(DayOfWeek)} are unioned into the
 * day-of-week field. When that field is {@code *}, the first appended day replaces the wildcard.
 */
public final class CronExpression {

    private static final int SUNDAY_ALIAS = 7;

    private final String expression;
    private final CronField minutes;
    private final CronField hours;
    private final CronField daysOfMonth;
    private final CronField months;
    private volatile CronField weekdays;

    public CronExpression(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new CronFormatException("Cron expression must not be empty");
        }
        String[] parts = expression.trim().split("\\s+");
        if (parts.length != 5) {
            throw new CronFormatException(
                    "Cron expression must have 5 fields (minute hour day-of-month month day-of-week): " + expression);
        }

        this.expression = expression.trim();
        this.minutes = CronField.parse("minute", parts[0], 0, 59);
        this.hours = CronField.parse("hour", parts[1], 0, 23);
        this.daysOfMonth = CronField.parse("day-of-month", parts[2], 1, 31);
        this.months = CronField.parse("month", parts[3], 1, 12);
        this.weekdays = CronField.parse("day-of-week", parts[4], 0, SUNDAY_ALIAS);
    }

    public boolean isDue(ZonedDateTime time) {
        return minutes.matches(time.getMinute())
                && hours.matches(time.getHour())
                && daysOfMonth.matches(time.getDayOfMonth())
                && months.matches(time.getMonthValue())
                && isWeekdayDue(time);
    }

    /**
     * Matches only the day-of-week field, ignoring every other field.
     */
    public boolean isWeekdayDue(ZonedDateTime time) {
        int day = toCronWeekday(time.getDayOfWeek());
        CronField field = weekdays;
        return field.matches(day) || (day == 0 && field.matches(SUNDAY_ALIAS) && !field.isWildcard());
    }

    public synchronized CronExpression appendWeekday(DayOfWeek day) {
        int value = toCronWeekday(day);
        SortedSet<Integer> days = new TreeSet<>();
        if (!weekdays.isWildcard()) {
            days.addAll(weekdays.expand());
        }
        days.add(value);
        this.weekdays = CronField.of("day-of-week", days, 0, SUNDAY_ALIAS);
        return this;
    }

    public CronField minutes() {
        return minutes;
    }

    public CronField hours() {
        return hours;
    }

    public CronField daysOfMonth() {
        return daysOfMonth;
    }

    public CronField months() {
        return months;
    }

    public CronField weekdays() {
        return weekdays;
    }

    /**
     * The expression as originally parsed, without appended weekdays.
     */
    public String expression() {
        return expression;
    }

    /**
     * Cron day-of-week number: Sunday = 0 ... Saturday = 6.
     */
    public static int toCronWeekday(DayOfWeek day) {
        return day.getValue() % 7;
    }

    @Override
    public String toString() {
        return String.join(" ",
                minutes.toString(),
                hours.toString(),
                daysOfMonth.toString(),
                months.toString(),
                weekdays.toString());
    }
}
