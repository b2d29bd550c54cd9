package com.z254.sentinel.correlation.health;

import com.z254.sentinel.correlation.config.CorrelationProperties;
import com.z254.sentinel.correlation.engine.CorrelationEngine;
import com.z254.sentinel.correlation.engine.CorrelationStats;
import com.z254.sentinel.correlation.maintenance.MaintenanceScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Health indicator for the correlation engine.
 * <p>
 * Reports on:
 * <ul>
 *     <li>Group, record and dedup index sizes</li>
 *     <li>Maintenance scheduler state and consecutive failures</li>
 * </ul>
 * Goes DOWN once maintenance has failed the configured number of ticks in a row.
 */
@Slf4j
@Component
public class CorrelationHealthIndicator implements ReactiveHealthIndicator {

    private final CorrelationEngine engine;
    private final MaintenanceScheduler scheduler;
    private final CorrelationProperties properties;

    public CorrelationHealthIndicator(CorrelationEngine engine,
                                      MaintenanceScheduler scheduler,
                                      CorrelationProperties properties) {
        this.engine = engine;
        this.scheduler = scheduler;
        this.properties = properties;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::checkHealth);
    }

    private Health checkHealth() {
        Map<String, Object> details = new HashMap<>();
        boolean healthy = true;

        try {
            CorrelationStats stats = engine.getStats();
            details.put("groups.total", stats.totalGroups());
            details.put("groups.active", stats.activeGroups());
            details.put("groups.stable", stats.stableGroups());
            details.put("groups.resolved", stats.resolvedGroups());
            details.put("groups.archived", stats.archivedGroups());
            details.put("correlations", stats.totalCorrelations());
            details.put("mappedIncidents", stats.mappedIncidents());
            details.put("dedupEntries", stats.dedupEntries());
        } catch (Exception e) {
            healthy = false;
            details.put("engine.error", "Failed to read engine stats: " + e.getMessage());
            log.error("Health check failed reading correlation stats", e);
        }

        int failures = scheduler.getConsecutiveFailures();
        int maxFailures = properties.getHealth().getMaxConsecutiveFailures();
        details.put("maintenance.enabled", scheduler.isEnabled());
        details.put("maintenance.running", scheduler.isRunning());
        details.put("maintenance.consecutiveFailures", failures);
        scheduler.getLastSuccessAt().ifPresent(at -> details.put("maintenance.lastSuccessAt", at.toString()));
        if (failures >= maxFailures) {
            healthy = false;
            details.put("maintenance.error", "Maintenance failed " + failures + " ticks in a row");
        }

        details.put("correlationEnabled", properties.isEnabled());
        details.put("dedupEnabled", properties.getDedup().isEnabled());

        if (healthy) {
            return Health.up()
                    .withDetails(details)
                    .build();
        } else {
            return Health.down()
                    .withDetails(details)
                    .build();
        }
    }
}
