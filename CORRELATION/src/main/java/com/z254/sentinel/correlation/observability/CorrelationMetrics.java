package com.z254.sentinel.correlation.observability;

import com.z254.sentinel.correlation.domain.model.CorrelationType;
import io.micrometer.core.instrument.*;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Centralized metrics for the correlation engine.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Analysis throughput and latency</li>
 *     <li>Deduplication hits</li>
 *     <li>Correlation records by type</li>
 *     <li>Group lifecycle (created, merged, full, resolved, archived)</li>
 *     <li>Maintenance duration and failures</li>
 * </ul>
 */
@Component
public class CorrelationMetrics {

    private final MeterRegistry meterRegistry;

    @Getter
    private final Counter incidentsAnalyzed;
    @Getter
    private final Counter duplicates;
    private final Timer analysisLatency;
    private final Map<CorrelationType, Counter> recordsByType = new EnumMap<>(CorrelationType.class);

    @Getter
    private final Counter groupsCreated;
    @Getter
    private final Counter groupsMerged;
    @Getter
    private final Counter groupsFull;
    @Getter
    private final Counter groupsResolved;
    @Getter
    private final Counter groupsArchived;

    @Getter
    private final Counter maintenanceFailures;
    private final Timer maintenanceDuration;

    public CorrelationMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.incidentsAnalyzed = Counter.builder("sentinel.correlation.incidents.analyzed")
                .description("Incidents submitted for analysis")
                .register(meterRegistry);
        this.duplicates = Counter.builder("sentinel.correlation.dedup.duplicates")
                .description("Incidents recognised as duplicates")
                .register(meterRegistry);
        this.analysisLatency = Timer.builder("sentinel.correlation.analysis.latency")
                .description("Per-incident analysis latency")
                .publishPercentiles(0.5, 0.75, 0.95, 0.99)
                .register(meterRegistry);
        for (CorrelationType type : CorrelationType.values()) {
            recordsByType.put(type, Counter.builder("sentinel.correlation.records.created")
                    .description("Correlation records created")
                    .tag("type", type.name())
                    .register(meterRegistry));
        }

        this.groupsCreated = Counter.builder("sentinel.correlation.groups.created")
                .description("Correlation groups created")
                .register(meterRegistry);
        this.groupsMerged = Counter.builder("sentinel.correlation.groups.merged")
                .description("Correlation groups absorbed by a merge")
                .register(meterRegistry);
        this.groupsFull = Counter.builder("sentinel.correlation.groups.full")
                .description("Additions or merges rejected by the group size cap")
                .register(meterRegistry);
        this.groupsResolved = Counter.builder("sentinel.correlation.groups.resolved")
                .description("Correlation groups resolved")
                .register(meterRegistry);
        this.groupsArchived = Counter.builder("sentinel.correlation.groups.archived")
                .description("Correlation groups archived")
                .register(meterRegistry);

        this.maintenanceFailures = Counter.builder("sentinel.correlation.maintenance.failures")
                .description("Failed maintenance ticks")
                .register(meterRegistry);
        this.maintenanceDuration = Timer.builder("sentinel.correlation.maintenance.duration")
                .description("Maintenance tick duration")
                .publishPercentiles(0.5, 0.95)
                .register(meterRegistry);
    }

    // ========== Analysis ==========

    public Timer.Sample startAnalysisTimer() {
        incidentsAnalyzed.increment();
        return Timer.start(meterRegistry);
    }

    public void recordAnalysisCompleted(Timer.Sample sample) {
        sample.stop(analysisLatency);
    }

    public void recordDuplicate() {
        duplicates.increment();
    }

    public void recordCorrelation(CorrelationType type) {
        recordsByType.get(type).increment();
    }

    public double correlationCount(CorrelationType type) {
        return recordsByType.get(type).count();
    }

    // ========== Groups ==========

    public void recordGroupCreated() {
        groupsCreated.increment();
    }

    public void recordGroupMerged() {
        groupsMerged.increment();
    }

    public void recordGroupFull() {
        groupsFull.increment();
    }

    public void recordGroupResolved() {
        groupsResolved.increment();
    }

    public void recordGroupArchived() {
        groupsArchived.increment();
    }

    // ========== Maintenance ==========

    public Timer.Sample startMaintenanceTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordMaintenanceCompleted(Timer.Sample sample) {
        sample.stop(maintenanceDuration);
    }

    public void recordMaintenanceFailed(Timer.Sample sample) {
        sample.stop(maintenanceDuration);
        maintenanceFailures.increment();
    }

    /**
     * Register size gauges backed by the engine's live state.
     */
    public void bindSizes(Supplier<Number> groups, Supplier<Number> records,
                          Supplier<Number> dedupEntries, Supplier<Number> mappedIncidents) {
        Gauge.builder("sentinel.correlation.groups.size", groups)
                .description("Correlation groups held in memory")
                .register(meterRegistry);
        Gauge.builder("sentinel.correlation.records.size", records)
                .description("Live correlation records")
                .register(meterRegistry);
        Gauge.builder("sentinel.correlation.dedup.size", dedupEntries)
                .description("Deduplication index entries")
                .register(meterRegistry);
        Gauge.builder("sentinel.correlation.incidents.mapped", mappedIncidents)
                .description("Incidents attached to a non-archived group")
                .register(meterRegistry);
    }
}
