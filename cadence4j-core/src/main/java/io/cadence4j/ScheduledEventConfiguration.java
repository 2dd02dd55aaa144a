package io.cadence4j;

import java.time.ZoneId;
import java.util.concurrent.CompletionStage;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Second step of configuring a scheduled event: restrictions and lifecycle options.
 *
 * <p>Every call mutates the event and returns it for chaining.
 */
public interface ScheduledEventConfiguration {

    ScheduledEventConfiguration monday();

    ScheduledEventConfiguration tuesday();

    ScheduledEventConfiguration wednesday();

    ScheduledEventConfiguration thursday();

    ScheduledEventConfiguration friday();

    ScheduledEventConfiguration saturday();

    ScheduledEventConfiguration sunday();

    /**
     * Monday to Friday.
     */
    ScheduledEventConfiguration weekday();

    /**
     * Saturday and Sunday.
     */
    ScheduledEventConfiguration weekend();

    /**
     * Evaluate due-ness in this zone instead of UTC.
     */
    ScheduledEventConfiguration zoned(ZoneId zone);

    /**
     * Skip the work whenever the predicate returns false.
     */
    ScheduledEventConfiguration when(BooleanSupplier predicate);

    ScheduledEventConfiguration whenAsync(Supplier<? extends CompletionStage<Boolean>> predicate);

    /**
     * Never run two events carrying {@code uniqueIdentifier} at the same time.
     */
    ScheduledEventConfiguration preventOverlapping(String uniqueIdentifier);

    /**
     * Name the event without enabling overlap prevention. The identifier is what
     * {@link Scheduler#tryUnschedule(String)} matches on.
     */
    ScheduledEventConfiguration assignUniqueIdentifier(String uniqueIdentifier);

    /**
     * Also run the event on the scheduler's first tick, regardless of its schedule.
     */
    ScheduledEventConfiguration runOnceAtStart();

    /**
     * Unschedule the event after its first completed invocation.
     */
    ScheduledEventConfiguration once();
}
