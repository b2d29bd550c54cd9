package com.z254.sentinel.correlation.maintenance;

import com.z254.sentinel.correlation.config.CorrelationProperties;
import com.z254.sentinel.correlation.observability.CorrelationMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MaintenanceSchedulerTest {

    @Mock
    private GroupMaintenance maintenance;

    private CorrelationProperties.Maintenance settings;
    private CorrelationMetrics metrics;
    private MaintenanceScheduler scheduler;

    @BeforeEach
    void setUp() {
        settings = new CorrelationProperties.Maintenance();
        settings.setInterval(Duration.ofHours(1));
        settings.setShutdownTimeout(Duration.ofSeconds(5));
        metrics = new CorrelationMetrics(new SimpleMeterRegistry());
        scheduler = new MaintenanceScheduler(maintenance, settings, metrics);
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    private static MaintenanceReport emptyReport() {
        return MaintenanceReport.builder().duration(Duration.ZERO).build();
    }

    @Test
    void disabledSchedulerNeverStarts() {
        settings.setEnabled(false);

        scheduler.start();

        assertThat(scheduler.isRunning()).isFalse();
        assertThat(scheduler.isEnabled()).isFalse();
    }

    @Test
    void tickIsIgnoredWhenNotRunning() {
        scheduler.tick();

        verify(maintenance, never()).runMaintenance(any(BooleanSupplier.class));
    }

    @Test
    void successfulTickRecordsReport() {
        MaintenanceReport report = emptyReport();
        when(maintenance.runMaintenance(any(BooleanSupplier.class))).thenReturn(report);
        scheduler.start();

        scheduler.tick();

        assertThat(scheduler.getLastReport()).contains(report);
        assertThat(scheduler.getLastSuccessAt()).isPresent();
        assertThat(scheduler.getConsecutiveFailures()).isZero();
        assertThat(metrics.getMaintenanceFailures().count()).isZero();
    }

    @Test
    void failuresAreCountedUntilNextSuccess() {
        when(maintenance.runMaintenance(any(BooleanSupplier.class)))
                .thenThrow(new IllegalStateException("store unavailable"))
                .thenThrow(new IllegalStateException("store unavailable"))
                .thenReturn(emptyReport());
        scheduler.start();

        scheduler.tick();
        scheduler.tick();
        assertThat(scheduler.getConsecutiveFailures()).isEqualTo(2);
        assertThat(metrics.getMaintenanceFailures().count()).isEqualTo(2.0);
        assertThat(scheduler.getLastSuccessAt()).isEmpty();

        scheduler.tick();
        assertThat(scheduler.getConsecutiveFailures()).isZero();
    }

    @Test
    void scheduledTicksStopAfterShutdown() throws InterruptedException {
        settings.setInterval(Duration.ofMillis(10));
        CountDownLatch ticked = new CountDownLatch(2);
        AtomicInteger ticks = new AtomicInteger();
        AtomicReference<BooleanSupplier> keepRunning = new AtomicReference<>();
        when(maintenance.runMaintenance(any(BooleanSupplier.class))).thenAnswer(invocation -> {
            keepRunning.set(invocation.getArgument(0));
            ticks.incrementAndGet();
            ticked.countDown();
            return emptyReport();
        });

        scheduler.start();
        assertThat(ticked.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(keepRunning.get().getAsBoolean()).isTrue();

        scheduler.stop();
        int afterStop = ticks.get();
        Thread.sleep(100);

        assertThat(scheduler.isRunning()).isFalse();
        assertThat(keepRunning.get().getAsBoolean()).isFalse();
        assertThat(ticks.get()).isEqualTo(afterStop);
    }

    @Test
    void startIsIdempotent() {
        scheduler.start();
        scheduler.start();

        assertThat(scheduler.isRunning()).isTrue();
        scheduler.stop();
        assertThat(scheduler.isRunning()).isFalse();
    }
}
