package io.cadence4j;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Main scheduler API.
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.schedule(() -> cleanup())
 *          .everyFiveMinutes()
 *          .weekday();
 *
 * scheduler.schedule(SendReportInvocable.class)
 *          .dailyAt(6, 30)
 *          .zoned(ZoneId.of("Asia/Taipei"))
 *          .preventOverlapping("send-report");
 *
 * scheduler.start();
 * }</pre>
 */
public interface Scheduler {

    void start();

    void stop();

    ScheduleInterval schedule(CheckedRunnable action);

    ScheduleInterval scheduleAsync(Supplier<? extends CompletionStage<?>> asyncTask);

    /**
     * Schedule work resolved by type on each invocation.
     */
    ScheduleInterval schedule(Class<? extends Invocable> invocableType);

    /**
     * Schedule work resolved by type, constructed with the given parameters.
     *
     * @throws io.cadence4j.core.ScheduleConfigurationException if {@code invocableType} is not an {@link Invocable}
     */
    ScheduleInterval scheduleWithParams(Class<?> invocableType, Object... parameters);

    /**
     * Remove every scheduled event carrying this identifier. Safe to call more than once.
     *
     * @return true if at least one event was removed
     */
    boolean tryUnschedule(String uniqueIdentifier);

    /**
     * Called with any exception thrown by a scheduled event.
     */
    Scheduler onError(Consumer<Throwable> errorHandler);

    /**
     * Next instant the identified event is due, if it is still scheduled.
     */
    Optional<Instant> nextDueAt(String uniqueIdentifier);
}
