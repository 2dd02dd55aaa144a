package io.cadence4j.config;

import io.cadence4j.Scheduler;
import org.springframework.context.SmartLifecycle;

import java.util.List;

/**
 * Bridges Scheduler start/stop lifecycle with the Spring container lifecycle.
 */
public class CadenceLifecycle implements SmartLifecycle {
    private final Scheduler scheduler;
    private final List<SchedulerConfigurer> configurers;
    private volatile boolean running = false;
    private boolean configured = false;

    public CadenceLifecycle(Scheduler scheduler, List<SchedulerConfigurer> configurers) {
        this.scheduler = scheduler;
        this.configurers = List.copyOf(configurers);
    }

    @Override
    public void start() {
        synchronized (this) {
            if (!configured) {
                configurers.forEach(c -> c.configure(scheduler));
                configured = true;
            }
        }
        scheduler.start();
        running = true;
    }

    @Override
    public void stop() {
        scheduler.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
