package io.cadence4j.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for the in-memory scheduler.
 */
@ConfigurationProperties(prefix = "cadence")
public class SchedulerProperties {
    private Duration tickInterval = Duration.ofSeconds(1);
    private int maxConcurrency = 20; // worker threads
    private Duration overlapLockTimeout = Duration.ofHours(24);
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private boolean logTaskProgress = false;

    public Duration getTickInterval() {
        return tickInterval;
    }

    public void setTickInterval(Duration tickInterval) {
        this.tickInterval = tickInterval;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public Duration getOverlapLockTimeout() {
        return overlapLockTimeout;
    }

    public void setOverlapLockTimeout(Duration overlapLockTimeout) {
        this.overlapLockTimeout = overlapLockTimeout;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public boolean isLogTaskProgress() {
        return logTaskProgress;
    }

    public void setLogTaskProgress(boolean logTaskProgress) {
        this.logTaskProgress = logTaskProgress;
    }
}
