package io.cadence4j.internal.memory;

import io.cadence4j.CheckedRunnable;
import io.cadence4j.Invocable;
import io.cadence4j.ScheduleInterval;
import io.cadence4j.Scheduler;
import io.cadence4j.config.SchedulerProperties;
import io.cadence4j.core.CancellationSource;
import io.cadence4j.core.InstanceResolver;
import io.cadence4j.core.Mutex;
import io.cadence4j.core.Unscheduler;
import io.cadence4j.internal.ScheduledEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * In-process scheduler that polls its events once per tick.
 *
 * <p>Each tick:
 * <ul>
 *   <li>On the first tick, runs every event marked {@code runOnceAtStart()}</li>
 *   <li>Evaluates second-based events every tick, cron-based events only at second 0</li>
 *   <li>Dispatches due events to a worker pool, serializing events that prevent overlapping</li>
 *   <li>Logs failures and hands them to the error handler; other events are unaffected</li>
 * </ul>
 *
 * <p>Typical usage:
 * <pre>{@code
 * InMemoryScheduler scheduler = new InMemoryScheduler(new SchedulerProperties(), resolver);
 * scheduler.schedule(() -> purgeExpiredSessions()).everyFiveMinutes();
 * scheduler.start();
 * ...
 * scheduler.stop();
 * }</pre>
 */
public class InMemoryScheduler implements Scheduler, Unscheduler {
    private static final Logger log = LoggerFactory.getLogger(InMemoryScheduler.class);
    private static final Duration MAX_TICK_INTERVAL = Duration.ofMinutes(1);
    private static final long MAX_CATCH_UP_SECONDS = 120;

    private final SchedulerProperties props;
    private final InstanceResolver resolver;
    private final Mutex mutex;

    private final ConcurrentHashMap<String, ScheduledEvent> events = new ConcurrentHashMap<>();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean firstTick = new AtomicBoolean(true);

    private ExecutorService workerPool;
    private boolean stopped;
    private Thread tickerThread;

    private volatile CancellationSource cancellation = new CancellationSource();
    private volatile Consumer<Throwable> errorHandler;
    private volatile Instant lastTickAt;

    public InMemoryScheduler(SchedulerProperties props, InstanceResolver resolver) {
        this(props, resolver, new InMemoryMutex());
    }

    public InMemoryScheduler(SchedulerProperties props, InstanceResolver resolver, Mutex mutex) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.mutex = Objects.requireNonNull(mutex, "mutex must not be null");
    }

    /**
     * Start ticking. Idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        Duration tick = Objects.requireNonNull(props.getTickInterval(), "cadence.tickInterval must not be null");
        if (tick.isZero() || tick.isNegative() || tick.compareTo(MAX_TICK_INTERVAL) > 0) {
            started.set(false);
            throw new IllegalArgumentException("cadence.tickInterval must be positive and at most " + MAX_TICK_INTERVAL
                    + ": " + tick);
        }

        log.info("Scheduler starting with tickInterval={}, maxConcurrency={}, overlapLockTimeout={}, events={}",
                props.getTickInterval(),
                props.getMaxConcurrency(),
                props.getOverlapLockTimeout(),
                events.size());

        if (cancellation.isCancelled()) {
            cancellation = new CancellationSource();
        }
        synchronized (this) {
            stopped = false;
        }
        lastTickAt = null;
        ensureWorkerPool();

        if (tickerThread == null) {
            tickerThread = new Thread(this::tickerLoop);
            tickerThread.setName("cadence.ticker");
            tickerThread.setDaemon(true);
            tickerThread.start();
        }

        Instant now = nowInstant();
        for (ScheduledEvent event : events.values()) {
            log.info("Scheduled event registered {} nextDueAt={}", event, event.nextDueAfter(now).orElse(null));
        }
        log.info("Scheduler started successfully.");
    }

    /**
     * Stop ticking, signal cancellation to running work and wait for it up to
     * {@code shutdownTimeout}. Idempotent.
     */
    @Override
    public void stop() {
        boolean wasStarted = started.compareAndSet(true, false);
        ExecutorService pool;
        synchronized (this) {
            stopped = true;
            pool = workerPool;
            workerPool = null;
        }
        // ticks driven through runAt(...) own a pool without start()
        if (!wasStarted && pool == null) {
            return;
        }

        log.info("Scheduler stopping...");
        cancellation.cancel();

        if (tickerThread != null) {
            tickerThread.interrupt();
            tickerThread = null;
        }

        if (pool != null) {
            pool.shutdown();
            try {
                if (!pool.awaitTermination(props.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Scheduled events still running after {}; interrupting", props.getShutdownTimeout());
                    pool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pool.shutdownNow();
            }
        }
        log.info("Scheduler stopped successfully.");
    }

    @Override
    public ScheduleInterval schedule(CheckedRunnable action) {
        return register(ScheduledEvent.withAction(action, this));
    }

    @Override
    public ScheduleInterval scheduleAsync(Supplier<? extends CompletionStage<?>> asyncTask) {
        return register(ScheduledEvent.withAsyncTask(asyncTask, this));
    }

    @Override
    public ScheduleInterval schedule(Class<? extends Invocable> invocableType) {
        return register(ScheduledEvent.withInvocable(invocableType, resolver, this));
    }

    @Override
    public ScheduleInterval scheduleWithParams(Class<?> invocableType, Object... parameters) {
        return register(ScheduledEvent.withInvocableAndParams(invocableType, parameters, resolver, this));
    }

    @Override
    public boolean tryUnschedule(String uniqueIdentifier) {
        if (uniqueIdentifier == null) {
            return false;
        }
        boolean removed = events.values().removeIf(e -> uniqueIdentifier.equals(e.overlappingUniqueIdentifier()));
        if (removed) {
            log.info("Scheduled event unscheduled id={}", uniqueIdentifier);
        }
        return removed;
    }

    @Override
    public Scheduler onError(Consumer<Throwable> errorHandler) {
        this.errorHandler = errorHandler;
        return this;
    }

    @Override
    public Optional<Instant> nextDueAt(String uniqueIdentifier) {
        Instant now = nowInstant();
        return events.values().stream()
                .filter(e -> e.overlappingUniqueIdentifier().equals(uniqueIdentifier))
                .map(e -> e.nextDueAfter(now))
                .flatMap(Optional::stream)
                .min(Instant::compareTo);
    }

    public int scheduledEventCount() {
        return events.size();
    }

    /**
     * Run one tick as if the current time were {@code utcNow}. After {@link #stop()} due events
     * are no longer dispatched.
     *
     * @return completes once every event dispatched by this tick has finished
     */
    public CompletableFuture<Void> runAt(Instant utcNow) {
        Objects.requireNonNull(utcNow, "utcNow must not be null");

        boolean isFirstTick = firstTick.compareAndSet(true, false);
        boolean isTopOfMinute = utcNow.getEpochSecond() % 60 == 0;

        List<ScheduledEvent> due = new ArrayList<>();
        for (ScheduledEvent event : events.values()) {
            if (isFirstTick && event.shouldRunOnceAtStart()) {
                due.add(event);
            } else if ((isTopOfMinute || !event.isScheduledCronBasedTask()) && event.isDue(utcNow)) {
                due.add(event);
            }
        }

        log.debug("Scheduler tick at={} due={} scheduled={}", utcNow, due.size(), events.size());

        List<CompletableFuture<Void>> running = new ArrayList<>(due.size());
        for (ScheduledEvent event : due) {
            running.add(dispatch(event));
        }
        return CompletableFuture.allOf(running.toArray(new CompletableFuture[0]));
    }

    /**
     * Run one tick for every whole second after the previous call up to {@code utcNow}, so that
     * tick intervals longer than a second do not skip due seconds. The first call runs
     * {@code utcNow} only. At most the last {@value #MAX_CATCH_UP_SECONDS} seconds are caught up.
     *
     * @return completes once every event dispatched by these ticks has finished
     */
    public CompletableFuture<Void> catchUpTo(Instant utcNow) {
        Instant tickAt = Objects.requireNonNull(utcNow, "utcNow must not be null").truncatedTo(ChronoUnit.SECONDS);
        Instant previous = lastTickAt;
        if (previous != null && !tickAt.isAfter(previous)) {
            return CompletableFuture.completedFuture(null);
        }
        lastTickAt = tickAt;

        Instant from = previous == null ? tickAt : previous.plusSeconds(1);
        Instant earliest = tickAt.minusSeconds(MAX_CATCH_UP_SECONDS - 1);
        if (from.isBefore(earliest)) {
            log.warn("Scheduler fell behind, skipping ticks from={} to={}", from, earliest.minusSeconds(1));
            from = earliest;
        }

        List<CompletableFuture<Void>> ticks = new ArrayList<>();
        for (Instant second = from; !second.isAfter(tickAt); second = second.plusSeconds(1)) {
            ticks.add(runAt(second));
        }
        return CompletableFuture.allOf(ticks.toArray(new CompletableFuture[0]));
    }

    /**
     * Utility: current scheduler time source (useful for tests).
     */
    protected Instant nowInstant() {
        return Instant.now();
    }

    private ScheduleInterval register(ScheduledEvent event) {
        events.put(UUID.randomUUID().toString(), event);
        return event;
    }

    /**
     * @return the worker pool, or {@code null} once the scheduler has been stopped
     */
    private synchronized ExecutorService ensureWorkerPool() {
        if (stopped) {
            return null;
        }
        if (workerPool == null) {
            workerPool = Executors.newFixedThreadPool(Math.max(1, props.getMaxConcurrency()), r -> {
                Thread t = new Thread(r);
                t.setName("cadence.workerPool");
                t.setDaemon(true);
                return t;
            });
        }
        return workerPool;
    }

    private CompletableFuture<Void> dispatch(ScheduledEvent event) {
        ExecutorService pool = ensureWorkerPool();
        if (pool == null) {
            return notDispatched(event);
        }
        try {
            return CompletableFuture.runAsync(() -> invokeEvent(event), pool);
        } catch (RejectedExecutionException e) {
            return notDispatched(event);
        }
    }

    private CompletableFuture<Void> notDispatched(ScheduledEvent event) {
        log.warn("Scheduled event not dispatched, scheduler is shutting down id={}", event.overlappingUniqueIdentifier());
        return CompletableFuture.completedFuture(null);
    }

    private void invokeEvent(ScheduledEvent event) {
        if (!event.shouldPreventOverlapping()) {
            invokeAndReport(event);
            return;
        }

        String key = event.overlappingUniqueIdentifier();
        if (!mutex.tryGetLock(key, props.getOverlapLockTimeout())) {
            log.debug("Scheduled event skipped, previous run still in progress id={}", key);
            return;
        }
        try {
            invokeAndReport(event);
        } finally {
            mutex.release(key);
        }
    }

    private void invokeAndReport(ScheduledEvent event) {
        String id = event.overlappingUniqueIdentifier();
        try {
            Instant startedAt = Instant.now();
            if (props.isLogTaskProgress()) {
                log.info("Scheduled event started id={} invocable={}", id, event.invocableType().map(Class::getName).orElse("-"));
            }
            event.invoke(cancellation.token());
            if (props.isLogTaskProgress()) {
                log.info("Scheduled event succeeded id={} took={}ms", id, Duration.between(startedAt, Instant.now()).toMillis());
            }
        } catch (VirtualMachineError e) {
            log.error("Scheduled event failed id={} msg={}", id, e.getMessage(), e);
            throw e;
        } catch (Throwable e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.error("Scheduled event failed id={} msg={}", id, e.getMessage(), e);
            notifyErrorHandler(id, e);
        }
    }

    private void notifyErrorHandler(String id, Throwable failure) {
        Consumer<Throwable> handler = this.errorHandler;
        if (handler == null) {
            return;
        }
        try {
            handler.accept(failure);
        } catch (RuntimeException handlerEx) {
            log.error("Scheduler error handler failed id={} msg={}", id, handlerEx.getMessage(), handlerEx);
        }
    }

    private void tickerLoop() {
        long tickMillis = props.getTickInterval().toMillis();
        while (started.get()) {
            Instant now = nowInstant();
            try {
                catchUpTo(now);
            } catch (Exception e) {
                log.error("Scheduler tick failed at={} msg={}", now, e.getMessage(), e);
            }

            if (!started.get()) {
                break;
            }

            try {
                Thread.sleep(Math.max(1L, tickMillis - (nowInstant().toEpochMilli() % tickMillis)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }
}
