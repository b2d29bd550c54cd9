package com.z254.sentinel.correlation.maintenance;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Counts of what one maintenance tick changed.
 */
@Value
@Builder
public class MaintenanceReport {
    int groupsScanned;
    int membersPruned;
    int stabilized;
    int resolved;
    int archived;
    int purged;
    int merged;
    int recordsPruned;
    int dedupEntriesPruned;
    int dedupEntriesEvicted;

    /** Tick stopped early because shutdown was requested */
    boolean interrupted;

    Duration duration;

    public int totalChanges() {
        return membersPruned + stabilized + resolved + archived + purged + merged + recordsPruned
                + dedupEntriesPruned + dedupEntriesEvicted;
    }
}
