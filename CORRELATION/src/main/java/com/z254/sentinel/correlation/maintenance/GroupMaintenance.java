package com.z254.sentinel.correlation.maintenance;

import com.z254.sentinel.correlation.config.CorrelationProperties;
import com.z254.sentinel.correlation.dedup.DeduplicationIndex;
import com.z254.sentinel.correlation.domain.model.CorrelationGroup.GroupMember;
import com.z254.sentinel.correlation.domain.model.GroupStatus;
import com.z254.sentinel.correlation.domain.model.Incident;
import com.z254.sentinel.correlation.domain.repository.IncidentStore;
import com.z254.sentinel.correlation.group.CorrelationGroupManager;
import com.z254.sentinel.correlation.group.CorrelationGroupManager.LifecycleStep;
import com.z254.sentinel.correlation.group.CorrelationGroupSummary;
import com.z254.sentinel.correlation.group.CorrelationRecordStore;
import com.z254.sentinel.correlation.group.GroupMutationResult;
import com.z254.sentinel.correlation.strategy.CombinedScorer;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.BooleanSupplier;
import java.util.function.Predicate;

/**
 * One maintenance pass over all groups.
 * <p>
 * Group ids are snapshotted first and each group is then handled under its own lock, so
 * analysis keeps running while a tick is in progress. The keep-running signal is checked
 * between groups, never inside a mutation.
 */
@Slf4j
public class GroupMaintenance {

    private final CorrelationGroupManager groupManager;
    private final CorrelationRecordStore records;
    private final DeduplicationIndex dedupIndex;
    private final IncidentStore incidentStore;
    private final CombinedScorer scorer;
    private final CorrelationProperties properties;
    private final Clock clock;

    public GroupMaintenance(CorrelationGroupManager groupManager,
                            CorrelationRecordStore records,
                            DeduplicationIndex dedupIndex,
                            IncidentStore incidentStore,
                            CombinedScorer scorer,
                            CorrelationProperties properties,
                            Clock clock) {
        this.groupManager = groupManager;
        this.records = records;
        this.dedupIndex = dedupIndex;
        this.incidentStore = incidentStore;
        this.scorer = scorer;
        this.properties = properties;
        this.clock = clock;
    }

    public MaintenanceReport runMaintenance() {
        return runMaintenance(() -> true);
    }

    public MaintenanceReport runMaintenance(BooleanSupplier keepRunning) {
        Instant started = clock.instant();
        MaintenanceReport.MaintenanceReportBuilder report = MaintenanceReport.builder();

        List<String> groupIds = groupManager.getIndex().groupIds();
        report.groupsScanned(groupIds.size());

        int membersPruned = 0;
        int stabilized = 0;
        int resolved = 0;
        int archived = 0;
        int purged = 0;
        Predicate<String> missing = id -> !incidentStore.exists(id);
        Predicate<String> incidentResolved = this::isIncidentResolved;
        for (String groupId : groupIds) {
            if (!keepRunning.getAsBoolean()) {
                return interrupted(report.membersPruned(membersPruned), started);
            }
            // deleted incidents leave their group first so the rest can still resolve
            membersPruned += groupManager.pruneMembers(groupId, missing, this::memberOf);
            LifecycleStep step = groupManager.advanceLifecycle(groupId, started, incidentResolved);
            switch (step) {
                case STABILIZED -> stabilized++;
                case RESOLVED -> resolved++;
                case ARCHIVED -> archived++;
                case PURGED -> purged++;
                default -> {
                }
            }
        }
        report.membersPruned(membersPruned).stabilized(stabilized).resolved(resolved).archived(archived).purged(purged);

        if (properties.isAutoMergeGroups()) {
            Optional<Integer> merged = autoMerge(keepRunning);
            if (merged.isEmpty()) {
                return interrupted(report, started);
            }
            report.merged(merged.get());
        }

        report.recordsPruned(records.pruneIncidents(missing));
        report.dedupEntriesPruned(dedupIndex.pruneIncidents(missing));
        report.dedupEntriesEvicted(dedupIndex.evictExpired(started));

        MaintenanceReport result = report.duration(Duration.between(started, clock.instant())).build();
        if (result.totalChanges() > 0) {
            log.info("Maintenance tick completed: {}", result);
        } else {
            log.debug("Maintenance tick completed with no changes");
        }
        return result;
    }

    /**
     * Pairwise merge of open groups.
     *
     * @return number of merges, empty when interrupted
     */
    Optional<Integer> autoMerge(BooleanSupplier keepRunning) {
        List<CorrelationGroupSummary> open = groupManager.summaries(EnumSet.of(GroupStatus.ACTIVE, GroupStatus.STABLE));
        Set<String> absorbed = new HashSet<>();
        int merged = 0;

        for (int i = 0; i < open.size(); i++) {
            CorrelationGroupSummary a = open.get(i);
            if (absorbed.contains(a.id())) {
                continue;
            }
            for (int j = i + 1; j < open.size(); j++) {
                if (!keepRunning.getAsBoolean()) {
                    return Optional.empty();
                }
                CorrelationGroupSummary b = open.get(j);
                if (absorbed.contains(b.id())) {
                    continue;
                }
                // cheap upper bound before scoring the primaries
                if ((1.0 + a.aggregateScore() + b.aggregateScore()) / 3.0 < properties.getMergeThreshold()) {
                    continue;
                }
                double bridge = primaryScore(a.primaryIncidentId(), b.primaryIncidentId());
                Optional<GroupMutationResult> result = groupManager.mergeGroups(a.id(), b.id(), bridge);
                if (result.isPresent() && result.get().outcome() == GroupMutationResult.Outcome.MERGED) {
                    merged++;
                    absorbed.add(result.get().absorbedGroupId());
                    if (absorbed.contains(a.id())) {
                        break;
                    }
                }
            }
        }
        return Optional.of(merged);
    }

    private double primaryScore(String incidentA, String incidentB) {
        Optional<Incident> a = incidentStore.getIncident(incidentA);
        Optional<Incident> b = incidentStore.getIncident(incidentB);
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        return scorer.evaluate(a.get(), b.get()).combined().orElse(0.0);
    }

    private GroupMember memberOf(String incidentId) {
        return incidentStore.getIncident(incidentId).map(GroupMember::of).orElseGet(() -> GroupMember.unknown(incidentId));
    }

    private boolean isIncidentResolved(String incidentId) {
        return incidentStore.getIncident(incidentId).map(Incident::isResolved).orElse(false);
    }

    private MaintenanceReport interrupted(MaintenanceReport.MaintenanceReportBuilder report, Instant started) {
        log.info("Maintenance tick interrupted by shutdown");
        return report.interrupted(true).duration(Duration.between(started, clock.instant())).build();
    }
}
