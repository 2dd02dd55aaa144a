package io.cadence4j.config;

import io.cadence4j.Scheduler;

/**
 * Callback for registering scheduled events from Spring beans. All configurers run once,
 * before the scheduler starts ticking.
 *
 * <pre>{@code
 * @Bean
 * SchedulerConfigurer reports() {
 *     return scheduler -> scheduler.schedule(SendReportInvocable.class).dailyAt(6, 30);
 * }
 * }</pre>
 */
@FunctionalInterface
public interface SchedulerConfigurer {

    void configure(Scheduler scheduler);
}
