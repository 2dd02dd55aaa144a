package io.cadence4j.utils;

import io.cadence4j.core.CronExpression;
import io.cadence4j.core.CronField;

import java.text.ParseException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TimeZone;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Computes upcoming occurrences of a {@link CronExpression} with Quartz.
 * <p>
 * The five-field rule is translated into a Quartz expression:
 * <ul>
 *   <li>seconds are fixed to {@code 0}</li>
 *   <li>day-of-week is shifted to Quartz numbering (Sunday = 1)</li>
 *   <li>{@code ?} is used for whichever day field is unconstrained</li>
 * </ul>
 * <p>
 * Note: Quartz cannot require both day-of-month and day-of-week to match. When both are
 * constrained, Quartz candidates for the day-of-month are filtered by the weekday rule.
 */
public final class CronOccurrences {
    private static final int MAX_CANDIDATES = 10_000;

    private CronOccurrences() {
    }

    /**
     * First instant strictly after {@code from} matching the rule in the given zone.
     *
     * @return empty if the rule can never match (e.g. {@code 0 0 31 2 *})
     */
    public static Optional<Instant> nextAfter(CronExpression expression, ZoneId zone, Instant from) {
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(zone, "zone must not be null");
        Objects.requireNonNull(from, "from must not be null");

        org.quartz.CronExpression quartz = toQuartz(expression, zone);
        boolean filterWeekdays = !expression.daysOfMonth().isWildcard() && !expression.weekdays().isWildcard();

        Date cursor = Date.from(from);
        for (int i = 0; i < MAX_CANDIDATES; i++) {
            Date next = quartz.getNextValidTimeAfter(cursor);
            if (next == null) {
                return Optional.empty();
            }
            ZonedDateTime candidate = ZonedDateTime.ofInstant(next.toInstant(), zone);
            if (!filterWeekdays || expression.isWeekdayDue(candidate)) {
                return Optional.of(candidate.toInstant());
            }
            // skip the rest of a day whose weekday is excluded
            cursor = Date.from(candidate.toLocalDate().plusDays(1).atStartOfDay(zone).minusSeconds(1).toInstant());
        }
        return Optional.empty();
    }

    /**
     * Quartz (six-field, seconds first) form of the rule.
     */
    public static String toQuartzExpression(CronExpression expression) {
        Objects.requireNonNull(expression, "expression must not be null");

        String dom = join(expression.daysOfMonth());
        String dow = quartzWeekdays(expression.weekdays());

        if ("*".equals(dow)) {
            dow = "?";
        } else if ("*".equals(dom)) {
            dom = "?";
        } else {
            dow = "?";
        }

        return String.join(" ",
                "0",
                join(expression.minutes()),
                join(expression.hours()),
                dom,
                join(expression.months()),
                dow);
    }

    /* ================= helper ================= */

    private static org.quartz.CronExpression toQuartz(CronExpression expression, ZoneId zone) {
        String quartzExpression = toQuartzExpression(expression);
        try {
            org.quartz.CronExpression exp = new org.quartz.CronExpression(quartzExpression);
            exp.setTimeZone(TimeZone.getTimeZone(zone));
            return exp;
        } catch (ParseException ex) {
            throw new IllegalStateException("Cannot translate cron expression '" + expression
                    + "' to Quartz: " + quartzExpression, ex);
        }
    }

    private static String join(CronField field) {
        if (field.isWildcard()) {
            return "*";
        }
        return field.expand().stream()
                .map(String::valueOf)
                .collect(Collectors.joining(","));
    }

    private static String quartzWeekdays(CronField field) {
        if (field.isWildcard()) {
            return "*";
        }
        SortedSet<Integer> days = new TreeSet<>();
        for (Integer day : field.expand()) {
            days.add((day % 7) + 1);
        }
        if (days.size() == 7) {
            return "*";
        }
        return days.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(","));
    }
}
