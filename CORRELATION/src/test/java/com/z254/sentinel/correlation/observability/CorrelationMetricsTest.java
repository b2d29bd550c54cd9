package com.z254.sentinel.correlation.observability;

import com.z254.sentinel.correlation.domain.model.CorrelationType;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CorrelationMetricsTest {

    private SimpleMeterRegistry registry;
    private CorrelationMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new CorrelationMetrics(registry);
    }

    @Test
    void recordsAreCountedPerType() {
        metrics.recordCorrelation(CorrelationType.TEMPORAL);
        metrics.recordCorrelation(CorrelationType.TEMPORAL);
        metrics.recordCorrelation(CorrelationType.COMBINED);

        assertThat(metrics.correlationCount(CorrelationType.TEMPORAL)).isEqualTo(2.0);
        assertThat(metrics.correlationCount(CorrelationType.PATTERN)).isZero();
        assertThat(registry.get("sentinel.correlation.records.created")
                .tag("type", "COMBINED").counter().count()).isEqualTo(1.0);
    }

    @Test
    void analysisTimerCountsIncidents() {
        Timer.Sample sample = metrics.startAnalysisTimer();
        metrics.recordAnalysisCompleted(sample);

        assertThat(metrics.getIncidentsAnalyzed().count()).isEqualTo(1.0);
        assertThat(registry.get("sentinel.correlation.analysis.latency").timer().count()).isEqualTo(1);
    }

    @Test
    void groupCountersAreIndependent() {
        metrics.recordGroupCreated();
        metrics.recordGroupCreated();
        metrics.recordGroupMerged();
        metrics.recordGroupFull();
        metrics.recordDuplicate();

        assertThat(metrics.getGroupsCreated().count()).isEqualTo(2.0);
        assertThat(metrics.getGroupsMerged().count()).isEqualTo(1.0);
        assertThat(metrics.getGroupsFull().count()).isEqualTo(1.0);
        assertThat(metrics.getGroupsResolved().count()).isZero();
        assertThat(metrics.getDuplicates().count()).isEqualTo(1.0);
    }

    @Test
    void failedMaintenanceIsTimedAndCounted() {
        metrics.recordMaintenanceFailed(metrics.startMaintenanceTimer());
        metrics.recordMaintenanceCompleted(metrics.startMaintenanceTimer());

        assertThat(metrics.getMaintenanceFailures().count()).isEqualTo(1.0);
        assertThat(registry.get("sentinel.correlation.maintenance.duration").timer().count()).isEqualTo(2);
    }

    @Test
    void sizeGaugesFollowLiveState() {
        AtomicInteger groups = new AtomicInteger(1);
        metrics.bindSizes(groups::get, () -> 4, () -> 2, () -> 3);

        groups.set(5);

        assertThat(registry.get("sentinel.correlation.groups.size").gauge().value()).isEqualTo(5.0);
        assertThat(registry.get("sentinel.correlation.records.size").gauge().value()).isEqualTo(4.0);
        assertThat(registry.get("sentinel.correlation.dedup.size").gauge().value()).isEqualTo(2.0);
        assertThat(registry.get("sentinel.correlation.incidents.mapped").gauge().value()).isEqualTo(3.0);
    }
}
