package com.z254.sentinel.correlation.maintenance;

import com.z254.sentinel.correlation.config.CorrelationProperties;
import com.z254.sentinel.correlation.observability.CorrelationMetrics;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs {@link GroupMaintenance} on a single background thread at a fixed interval.
 * <p>
 * Stopping clears the running flag, which the tick checks between groups, then waits for the
 * executor, so a tick in progress finishes its current group before the scheduler exits.
 */
@Slf4j
public class MaintenanceScheduler implements SmartLifecycle {

    private final GroupMaintenance maintenance;
    private final CorrelationProperties.Maintenance settings;
    private final CorrelationMetrics metrics;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final AtomicReference<MaintenanceReport> lastReport = new AtomicReference<>();
    private final AtomicReference<Instant> lastSuccessAt = new AtomicReference<>();
    private ScheduledExecutorService executorService;

    public MaintenanceScheduler(GroupMaintenance maintenance,
                                CorrelationProperties.Maintenance settings,
                                CorrelationMetrics metrics) {
        this.maintenance = maintenance;
        this.settings = settings;
        this.metrics = metrics;
    }

    // ==================== Lifecycle ====================

    @Override
    public synchronized void start() {
        if (!settings.isEnabled()) {
            log.info("Correlation maintenance disabled");
            return;
        }
        if (running.get()) {
            return;
        }
        executorService = Executors.newSingleThreadScheduledExecutor(this::createThread);
        running.set(true);
        long intervalMs = settings.getInterval().toMillis();
        executorService.scheduleWithFixedDelay(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Correlation maintenance started, interval {}", settings.getInterval());
    }

    @Override
    public synchronized void stop() {
        if (!running.getAndSet(false)) {
            return;
        }
        shutdownExecutor();
        log.info("Correlation maintenance stopped");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // stop before the beans the tick depends on
        return Integer.MAX_VALUE - 100;
    }

    private Thread createThread(Runnable runnable) {
        Thread thread = new Thread(runnable, "correlation-maintenance");
        thread.setDaemon(true);
        return thread;
    }

    private void shutdownExecutor() {
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(settings.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Forcing shutdown of correlation maintenance");
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executorService.shutdownNow();
        }
    }

    // ==================== Tick ====================

    /**
     * Run one tick. Failures are logged and counted; the next tick retries.
     */
    void tick() {
        if (!running.get()) {
            return;
        }
        Timer.Sample sample = metrics.startMaintenanceTimer();
        try {
            MaintenanceReport report = maintenance.runMaintenance(running::get);
            metrics.recordMaintenanceCompleted(sample);
            lastReport.set(report);
            lastSuccessAt.set(Instant.now());
            consecutiveFailures.set(0);
        } catch (Exception e) {
            metrics.recordMaintenanceFailed(sample);
            int failures = consecutiveFailures.incrementAndGet();
            log.error("Correlation maintenance tick failed ({} in a row), retrying next tick", failures, e);
        }
    }

    // ==================== Monitoring ====================

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public Optional<MaintenanceReport> getLastReport() {
        return Optional.ofNullable(lastReport.get());
    }

    public Optional<Instant> getLastSuccessAt() {
        return Optional.ofNullable(lastSuccessAt.get());
    }

    public boolean isEnabled() {
        return settings.isEnabled();
    }
}
