package com.z254.sentinel.correlation.engine;

/**
 * Point-in-time engine counters.
 */
public record CorrelationStats(
        long totalGroups,
        long activeGroups,
        long stableGroups,
        long resolvedGroups,
        long archivedGroups,
        long totalCorrelations,
        long mappedIncidents,
        long dedupEntries
) {
}
