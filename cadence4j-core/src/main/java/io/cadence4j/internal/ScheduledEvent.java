package io.cadence4j.internal;

import io.cadence4j.CancellableInvocable;
import io.cadence4j.CheckedRunnable;
import io.cadence4j.Invocable;
import io.cadence4j.ScheduleInterval;
import io.cadence4j.ScheduledEventConfiguration;
import io.cadence4j.core.CancellationToken;
import io.cadence4j.core.CronExpression;
import io.cadence4j.core.InstanceResolver;
import io.cadence4j.core.ResolutionScope;
import io.cadence4j.core.ScheduleConfigurationException;
import io.cadence4j.core.Unscheduler;
import io.cadence4j.utils.CronOccurrences;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * A single schedule entry: knows when it is due and how to run its work.
 *
 * <p>Configured through {@link ScheduleInterval} and then {@link ScheduledEventConfiguration};
 * the remaining public methods are what the owning scheduler calls on each tick.
 *
 * <p>The event does no locking of its own. The scheduler must serialize invocations of events
 * for which {@link #shouldPreventOverlapping()} is true, keyed by
 * {@link #overlappingUniqueIdentifier()}.
 */
public class ScheduledEvent implements ScheduleInterval, ScheduledEventConfiguration {
    private static final Logger log = LoggerFactory.getLogger(ScheduledEvent.class);

    private static final int ONE_MINUTE_AS_SECONDS = 60;
    private static final int MAX_DAYS_TO_SCAN = 8;

    private final InstanceResolver resolver;
    private final Unscheduler unscheduler;

    private final ActionOrAsyncTask scheduledAction;
    private final Class<?> invocableType;
    private final Object[] constructorParameters;

    private volatile CronExpression expression;
    private volatile Duration interval;
    private volatile ZoneId zone = ZoneOffset.UTC;
    private volatile Supplier<? extends CompletionStage<Boolean>> whenPredicate;
    private volatile String eventUniqueId = UUID.randomUUID().toString();
    private volatile boolean preventOverlapping;
    private volatile boolean runOnceAtStart;
    private volatile boolean runOnce;
    private volatile boolean wasPreviouslyRun;
    private volatile boolean invocationStarted;

    private ScheduledEvent(ActionOrAsyncTask scheduledAction,
                           Class<?> invocableType,
                           Object[] constructorParameters,
                           InstanceResolver resolver,
                           Unscheduler unscheduler) {
        this.scheduledAction = scheduledAction;
        this.invocableType = invocableType;
        this.constructorParameters = constructorParameters;
        this.resolver = resolver;
        this.unscheduler = Objects.requireNonNull(unscheduler, "unscheduler must not be null");
    }

    public static ScheduledEvent withAction(CheckedRunnable action, Unscheduler unscheduler) {
        return new ScheduledEvent(ActionOrAsyncTask.of(action), null, null, null, unscheduler);
    }

    public static ScheduledEvent withAsyncTask(Supplier<? extends CompletionStage<?>> asyncTask, Unscheduler unscheduler) {
        return new ScheduledEvent(ActionOrAsyncTask.ofAsync(asyncTask), null, null, null, unscheduler);
    }

    public static ScheduledEvent withInvocable(Class<? extends Invocable> invocableType,
                                               InstanceResolver resolver,
                                               Unscheduler unscheduler) {
        return withInvocableAndParams(invocableType, null, resolver, unscheduler);
    }

    /**
     * @throws ScheduleConfigurationException if {@code invocableType} does not implement {@link Invocable}
     */
    public static ScheduledEvent withInvocableAndParams(Class<?> invocableType,
                                                        Object[] parameters,
                                                        InstanceResolver resolver,
                                                        Unscheduler unscheduler) {
        Objects.requireNonNull(invocableType, "invocableType must not be null");
        Objects.requireNonNull(resolver, "resolver must not be null");
        if (!Invocable.class.isAssignableFrom(invocableType)) {
            throw new ScheduleConfigurationException(
                    "Scheduled type must implement " + Invocable.class.getName() + ": " + invocableType.getName());
        }
        Object[] params = (parameters == null || parameters.length == 0) ? null : parameters.clone();
        return new ScheduledEvent(null, invocableType, params, resolver, unscheduler);
    }

    /* ================= runtime ================= */

    public boolean isDue(Instant utcNow) {
        CronExpression exp = this.expression;
        if (exp == null) {
            return false;
        }

        ZonedDateTime zonedNow = ZonedDateTime.ofInstant(utcNow, zone);

        if (interval != null) {
            return isSecondsDue(zonedNow) && exp.isWeekdayDue(zonedNow);
        }
        return exp.isDue(zonedNow);
    }

    /**
     * Run the event once: predicate, work, then lifecycle bookkeeping.
     *
     * <p>Exceptions from the predicate, from resolution or from the work itself propagate and
     * leave the lifecycle untouched, so a failed {@link #once()} event stays scheduled.
     */
    public void invoke(CancellationToken cancellationToken) throws Exception {
        invocationStarted = true;
        if (whenPredicateFails()) {
            log.debug("Scheduled event skipped by predicate id={}", eventUniqueId);
        } else if (invocableType == null) {
            scheduledAction.invoke();
        } else {
            try (ResolutionScope scope = resolver.createScope()) {
                Invocable invocable = (Invocable) scope.resolve(invocableType, constructorParameters);
                if (invocable instanceof CancellableInvocable cancellable) {
                    cancellable.setCancellationToken(
                            cancellationToken != null ? cancellationToken : CancellationToken.NONE);
                }
                invocable.invoke();
            }
        }

        markAsExecutedOnce();
        unscheduleIfWarranted();
    }

    public boolean shouldPreventOverlapping() {
        return preventOverlapping;
    }

    public String overlappingUniqueIdentifier() {
        return eventUniqueId;
    }

    public boolean isScheduledCronBasedTask() {
        return interval == null;
    }

    public boolean shouldRunOnceAtStart() {
        return runOnceAtStart;
    }

    public boolean hasRunAtLeastOnce() {
        return wasPreviouslyRun;
    }

    public Optional<Class<?>> invocableType() {
        return Optional.ofNullable(invocableType);
    }

    /**
     * First instant strictly after {@code from} at which this event is due.
     */
    public Optional<Instant> nextDueAfter(Instant from) {
        CronExpression exp = this.expression;
        if (exp == null) {
            return Optional.empty();
        }
        if (interval == null) {
            return CronOccurrences.nextAfter(exp, zone, from);
        }

        ZonedDateTime candidate = ZonedDateTime.ofInstant(from, zone)
                .truncatedTo(ChronoUnit.SECONDS)
                .plusSeconds(1);
        ZonedDateTime limit = candidate.plusDays(MAX_DAYS_TO_SCAN);
        while (candidate.isBefore(limit)) {
            if (!exp.isWeekdayDue(candidate)) {
                candidate = candidate.toLocalDate().plusDays(1).atStartOfDay(zone);
                continue;
            }
            if (isSecondsDue(candidate)) {
                return Optional.of(candidate.toInstant());
            }
            candidate = candidate.plusSeconds(1);
        }
        return Optional.empty();
    }

    /* ================= time spec ================= */

    @Override
    public ScheduledEventConfiguration daily() {
        return useCron("00 00 * * *");
    }

    @Override
    public ScheduledEventConfiguration dailyAtHour(int hour) {
        return useCron("00 " + checkHour(hour) + " * * *");
    }

    @Override
    public ScheduledEventConfiguration dailyAt(int hour, int minute) {
        return useCron(checkMinute(minute) + " " + checkHour(hour) + " * * *");
    }

    @Override
    public ScheduledEventConfiguration hourly() {
        return useCron("00 * * * *");
    }

    @Override
    public ScheduledEventConfiguration hourlyAt(int minute) {
        return useCron(checkMinute(minute) + " * * * *");
    }

    @Override
    public ScheduledEventConfiguration everyMinute() {
        return useCron("* * * * *");
    }

    @Override
    public ScheduledEventConfiguration everyFiveMinutes() {
        return useCron("*/5 * * * *");
    }

    @Override
    public ScheduledEventConfiguration everyTenMinutes() {
        return useCron("*/10 * * * *");
    }

    @Override
    public ScheduledEventConfiguration everyFifteenMinutes() {
        return useCron("*/15 * * * *");
    }

    @Override
    public ScheduledEventConfiguration everyThirtyMinutes() {
        return useCron("*/30 * * * *");
    }

    @Override
    public ScheduledEventConfiguration weekly() {
        return useCron("00 00 * * 1");
    }

    @Override
    public ScheduledEventConfiguration monthly() {
        return useCron("00 00 1 * *");
    }

    @Override
    public ScheduledEventConfiguration cron(String cronExpression) {
        return useCron(cronExpression);
    }

    @Override
    public ScheduledEventConfiguration everySecond() {
        return everySeconds(1);
    }

    @Override
    public ScheduledEventConfiguration everyFiveSeconds() {
        return everySeconds(5);
    }

    @Override
    public ScheduledEventConfiguration everyTenSeconds() {
        return everySeconds(10);
    }

    @Override
    public ScheduledEventConfiguration everyFifteenSeconds() {
        return everySeconds(15);
    }

    @Override
    public ScheduledEventConfiguration everyThirtySeconds() {
        return everySeconds(30);
    }

    @Override
    public ScheduledEventConfiguration everySeconds(int seconds) {
        if (seconds < 1 || seconds >= ONE_MINUTE_AS_SECONDS) {
            throw new ScheduleConfigurationException("Interval seconds must be between 1 and 59: " + seconds);
        }
        return everyInterval(Duration.ofSeconds(seconds));
    }

    @Override
    public ScheduledEventConfiguration everyInterval(Duration interval) {
        Objects.requireNonNull(interval, "interval must not be null");
        if (interval.getNano() != 0) {
            throw new ScheduleConfigurationException("Interval must be a whole number of seconds: " + interval);
        }
        long seconds = interval.getSeconds();
        if (seconds < 1 || seconds >= ONE_MINUTE_AS_SECONDS) {
            throw new ScheduleConfigurationException("Interval must be between 1 and 59 seconds: " + interval);
        }

        this.expression = new CronExpression("* * * * *");
        this.interval = interval;
        return this;
    }

    /* ================= restrictions & lifecycle ================= */

    @Override
    public ScheduledEventConfiguration monday() {
        return appendWeekday(DayOfWeek.MONDAY);
    }

    @Override
    public ScheduledEventConfiguration tuesday() {
        return appendWeekday(DayOfWeek.TUESDAY);
    }

    @Override
    public ScheduledEventConfiguration wednesday() {
        return appendWeekday(DayOfWeek.WEDNESDAY);
    }

    @Override
    public ScheduledEventConfiguration thursday() {
        return appendWeekday(DayOfWeek.THURSDAY);
    }

    @Override
    public ScheduledEventConfiguration friday() {
        return appendWeekday(DayOfWeek.FRIDAY);
    }

    @Override
    public ScheduledEventConfiguration saturday() {
        return appendWeekday(DayOfWeek.SATURDAY);
    }

    @Override
    public ScheduledEventConfiguration sunday() {
        return appendWeekday(DayOfWeek.SUNDAY);
    }

    @Override
    public ScheduledEventConfiguration weekday() {
        return this.monday()
                .tuesday()
                .wednesday()
                .thursday()
                .friday();
    }

    @Override
    public ScheduledEventConfiguration weekend() {
        return this.saturday()
                .sunday();
    }

    @Override
    public ScheduledEventConfiguration zoned(ZoneId zone) {
        if (zone == null) {
            throw new ScheduleConfigurationException("zone must not be null");
        }
        this.zone = zone;
        return this;
    }

    @Override
    public ScheduledEventConfiguration when(BooleanSupplier predicate) {
        if (predicate == null) {
            throw new ScheduleConfigurationException("predicate must not be null");
        }
        this.whenPredicate = () -> CompletableFuture.completedFuture(predicate.getAsBoolean());
        return this;
    }

    @Override
    public ScheduledEventConfiguration whenAsync(Supplier<? extends CompletionStage<Boolean>> predicate) {
        if (predicate == null) {
            throw new ScheduleConfigurationException("predicate must not be null");
        }
        this.whenPredicate = predicate;
        return this;
    }

    @Override
    public ScheduledEventConfiguration preventOverlapping(String uniqueIdentifier) {
        assignUniqueIdentifier(uniqueIdentifier);
        this.preventOverlapping = true;
        return this;
    }

    @Override
    public ScheduledEventConfiguration assignUniqueIdentifier(String uniqueIdentifier) {
        if (uniqueIdentifier == null || uniqueIdentifier.isBlank()) {
            throw new ScheduleConfigurationException("uniqueIdentifier must not be blank");
        }
        if (invocationStarted) {
            throw new ScheduleConfigurationException(
                    "uniqueIdentifier cannot change once the event has run: " + eventUniqueId);
        }
        this.eventUniqueId = uniqueIdentifier;
        return this;
    }

    @Override
    public ScheduledEventConfiguration runOnceAtStart() {
        this.runOnceAtStart = true;
        return this;
    }

    @Override
    public ScheduledEventConfiguration once() {
        this.runOnce = true;
        return this;
    }

    @Override
    public String toString() {
        CronExpression exp = this.expression;
        String spec = exp == null ? "unscheduled"
                : interval != null ? "every " + interval.getSeconds() + "s (" + exp.weekdays() + ")"
                : exp.toString();
        return "ScheduledEvent{id=" + eventUniqueId + ", schedule=" + spec + ", zone=" + zone + "}";
    }

    /* ================= helper ================= */

    private ScheduledEventConfiguration useCron(String cronExpression) {
        this.expression = new CronExpression(cronExpression);
        this.interval = null;
        return this;
    }

    private ScheduledEventConfiguration appendWeekday(DayOfWeek day) {
        CronExpression exp = this.expression;
        if (exp == null) {
            throw new ScheduleConfigurationException("Choose a schedule before restricting weekdays");
        }
        exp.appendWeekday(day);
        return this;
    }

    private boolean isSecondsDue(ZonedDateTime zonedNow) {
        Duration period = this.interval;
        if (period == null) {
            return false;
        }

        long seconds = period.getSeconds();
        if (zonedNow.getSecond() == 0) {
            return true;
        }
        return seconds != 0 && zonedNow.getSecond() % seconds == 0;
    }

    private boolean whenPredicateFails() throws Exception {
        Supplier<? extends CompletionStage<Boolean>> predicate = this.whenPredicate;
        if (predicate == null) {
            return false;
        }
        Boolean result = ActionOrAsyncTask.await(predicate.get());
        return !Boolean.TRUE.equals(result);
    }

    private void markAsExecutedOnce() {
        this.wasPreviouslyRun = true;
    }

    private void unscheduleIfWarranted() {
        if (runOnce && wasPreviouslyRun) {
            boolean removed = unscheduler.tryUnschedule(eventUniqueId);
            log.info("Scheduled event ran once and was unscheduled id={} removed={}", eventUniqueId, removed);
        }
    }

    private static int checkHour(int hour) {
        if (hour < 0 || hour > 23) {
            throw new ScheduleConfigurationException("hour must be between 0 and 23: " + hour);
        }
        return hour;
    }

    private static int checkMinute(int minute) {
        if (minute < 0 || minute > 59) {
            throw new ScheduleConfigurationException("minute must be between 0 and 59: " + minute);
        }
        return minute;
    }
}
