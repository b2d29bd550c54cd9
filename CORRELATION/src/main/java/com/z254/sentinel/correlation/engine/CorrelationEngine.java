package com.z254.sentinel.correlation.engine;

import com.z254.sentinel.correlation.config.CorrelationProperties;
import com.z254.sentinel.correlation.dedup.DedupResult;
import com.z254.sentinel.correlation.dedup.DeduplicationIndex;
import com.z254.sentinel.correlation.domain.model.CorrelationGroup.GroupMember;
import com.z254.sentinel.correlation.domain.model.CorrelationRecord;
import com.z254.sentinel.correlation.domain.model.CorrelationType;
import com.z254.sentinel.correlation.domain.model.GroupStatus;
import com.z254.sentinel.correlation.domain.model.Incident;
import com.z254.sentinel.correlation.domain.repository.IncidentFilter;
import com.z254.sentinel.correlation.domain.repository.IncidentStore;
import com.z254.sentinel.correlation.exception.IncidentNotFoundException;
import com.z254.sentinel.correlation.fingerprint.FingerprintGenerator;
import com.z254.sentinel.correlation.group.CorrelationGroupManager;
import com.z254.sentinel.correlation.group.CorrelationGroupSummary;
import com.z254.sentinel.correlation.group.CorrelationGroupView;
import com.z254.sentinel.correlation.group.CorrelationRecordStore;
import com.z254.sentinel.correlation.group.GroupIndex;
import com.z254.sentinel.correlation.group.GroupMutationResult;
import com.z254.sentinel.correlation.maintenance.GroupMaintenance;
import com.z254.sentinel.correlation.maintenance.MaintenanceReport;
import com.z254.sentinel.correlation.observability.CorrelationMetrics;
import com.z254.sentinel.correlation.observability.CorrelationStructuredLogger;
import com.z254.sentinel.correlation.strategy.CombinedScorer;
import com.z254.sentinel.correlation.strategy.CorrelationStrategy;
import com.z254.sentinel.correlation.strategy.ScoringContext;
import com.z254.sentinel.correlation.topology.TopologyProvider;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point of the correlation engine.
 * <p>
 * Holds the configuration, deduplication index, record store and group index for the
 * lifetime of the service. {@link #analyze(Incident)} may be called from any number of threads.
 * Incidents are expected to be persisted in the {@link IncidentStore} before they are analyzed,
 * since maintenance prunes state for incidents the store no longer knows.
 */
@Slf4j
public class CorrelationEngine {

    static final String DEFAULT_MANUAL_REASON = "Manual correlation";

    private final CorrelationProperties properties;
    private final IncidentStore incidentStore;
    private final Clock clock;
    private final CorrelationMetrics metrics;
    private final CorrelationStructuredLogger structuredLogger;

    private final CombinedScorer scorer;
    private final DeduplicationIndex dedupIndex;
    private final CorrelationRecordStore records;
    private final CorrelationGroupManager groupManager;
    private final GroupMaintenance maintenance;

    public CorrelationEngine(CorrelationProperties properties,
                             IncidentStore incidentStore,
                             TopologyProvider topologyProvider,
                             Clock clock,
                             CorrelationMetrics metrics,
                             CorrelationStructuredLogger structuredLogger) {
        properties.validate();
        this.properties = properties;
        this.incidentStore = Objects.requireNonNull(incidentStore, "incidentStore");
        this.clock = clock;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;

        this.scorer = new CombinedScorer(new ScoringContext(properties, topologyProvider));
        this.dedupIndex = new DeduplicationIndex(incidentStore, clock,
                Duration.ofSeconds(properties.getDedup().getWindowSecs()), properties.getDedup().isEnabled());
        this.records = new CorrelationRecordStore();
        GroupIndex index = new GroupIndex();
        this.groupManager = new CorrelationGroupManager(index, records, properties, clock, metrics, structuredLogger);
        this.maintenance = new GroupMaintenance(groupManager, records, dedupIndex, incidentStore, scorer,
                properties, clock);

        metrics.bindSizes(index::groupCount, records::size, dedupIndex::size, index::mappedIncidentCount);
        log.info("Correlation engine initialized: enabled={}, temporalWindow={}s, minScore={}, maxGroupSize={}, dedupWindow={}s",
                properties.isEnabled(), properties.getTemporalWindowSecs(), properties.getMinCorrelationScore(),
                properties.getMaxGroupSize(), properties.getDedup().getWindowSecs());
    }

    /**
     * Deduplicate and correlate one incident.
     */
    public AnalysisResult analyze(Incident incident) {
        Objects.requireNonNull(incident, "incident");
        Objects.requireNonNull(incident.getId(), "incident.id");

        Timer.Sample sample = metrics.startAnalysisTimer();
        try (var scope = structuredLogger.withIncidentId(incident.getId())) {
            return structuredLogger.timed("correlation.analyze", () -> doAnalyze(incident));
        } finally {
            metrics.recordAnalysisCompleted(sample);
        }
    }

    private AnalysisResult doAnalyze(Incident incident) {
        if (incident.getFingerprint() == null || incident.getFingerprint().isBlank()) {
            incident.setFingerprint(FingerprintGenerator.fingerprint(incident));
        }

        DedupResult dedup = dedupIndex.checkAndRecord(incident);
        if (dedup instanceof DedupResult.Duplicate duplicate) {
            metrics.recordDuplicate();
            structuredLogger.logDuplicate(incident.getId(), duplicate.existingIncidentId(),
                    duplicate.fingerprint(), duplicate.occurrences());
            String groupId = groupManager.getIndex().groupIdOf(duplicate.existingIncidentId()).orElse(null);
            return new AnalysisResult(dedup, List.of(), groupId, List.of());
        }

        if (!properties.isEnabled()) {
            return new AnalysisResult(dedup, List.of(), currentGroup(incident.getId()), List.of());
        }

        List<CorrelationRecord> emitted = new ArrayList<>();
        List<GroupMutationResult> mutations = new ArrayList<>();
        GroupMember member = GroupMember.of(incident);

        for (Incident candidate : candidates(incident)) {
            Incident other = withFingerprint(candidate);
            CombinedScorer.Evaluation evaluation = scorer.evaluate(incident, other);
            if (!evaluation.hasSignal()) {
                continue;
            }
            Instant now = clock.instant();

            for (Map.Entry<CorrelationStrategy, Double> signal : evaluation.signals().entrySet()) {
                CorrelationStrategy strategy = signal.getKey();
                double score = signal.getValue();
                if (score >= scorer.getContext().minScoreOf(strategy)) {
                    emitted.add(store(CorrelationRecord.of(incident.getId(), other.getId(), strategy.type(),
                            score, strategy.describe(incident, other, score), now)));
                }
            }

            double combined = evaluation.combined().getAsDouble();
            if (combined >= properties.getMinCorrelationScore()) {
                CorrelationRecord record = store(CorrelationRecord.of(incident.getId(), other.getId(),
                        CorrelationType.COMBINED, combined, evaluation.describe(), now));
                emitted.add(record);
                mutations.add(groupManager.ingest(record, member, GroupMember.of(other), false));
            }
        }

        String groupId = currentGroup(incident.getId());
        if (!emitted.isEmpty()) {
            log.debug("Incident {} produced {} correlations, group {}", incident.getId(), emitted.size(), groupId);
        }
        return new AnalysisResult(dedup, emitted, groupId, mutations);
    }

    /**
     * Correlate incidents by hand. The first id is the anchor; a record with score 1.0 links it
     * to each other id. Thresholds are bypassed but the group size cap still applies.
     *
     * @return the record linking the anchor to the second id
     * @throws IncidentNotFoundException when any id is unknown; nothing is changed
     */
    public CorrelationRecord manualCorrelate(List<String> incidentIds, String reason) {
        Set<String> distinct = new LinkedHashSet<>(Objects.requireNonNull(incidentIds, "incidentIds"));
        distinct.remove(null);
        if (distinct.size() < 2) {
            throw new IllegalArgumentException("Manual correlation needs at least two distinct incidents");
        }

        Map<String, Incident> incidents = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        for (String id : distinct) {
            incidentStore.getIncident(id).ifPresentOrElse(i -> incidents.put(id, i), () -> missing.add(id));
        }
        if (!missing.isEmpty()) {
            throw new IncidentNotFoundException(missing);
        }

        String why = reason == null || reason.isBlank() ? DEFAULT_MANUAL_REASON : reason;
        List<Incident> ordered = new ArrayList<>(incidents.values());
        Incident anchor = ordered.get(0);
        CorrelationRecord first = null;
        for (Incident other : ordered.subList(1, ordered.size())) {
            CorrelationRecord record = store(CorrelationRecord.of(anchor.getId(), other.getId(),
                    CorrelationType.MANUAL, 1.0, why, clock.instant()));
            GroupMutationResult result = groupManager.ingest(record, GroupMember.of(anchor), GroupMember.of(other), true);
            if (result.outcome() == GroupMutationResult.Outcome.GROUP_FULL
                    || result.outcome() == GroupMutationResult.Outcome.GROUP_CLOSED) {
                log.warn("Manual correlation of {} and {} not applied to groups: {}",
                        anchor.getId(), other.getId(), result.outcome());
            }
            if (first == null) {
                first = record;
            }
        }
        return first;
    }

    public Optional<CorrelationGroupView> getGroup(String incidentId) {
        return groupManager.viewForIncident(incidentId);
    }

    public Optional<CorrelationGroupView> getGroupById(String groupId) {
        return groupManager.view(groupId);
    }

    public List<CorrelationGroupSummary> listGroups(Set<GroupStatus> statusFilter) {
        return groupManager.summaries(statusFilter);
    }

    /**
     * Resolve a group by hand. Resolving an already resolved group does nothing.
     */
    public void resolveGroup(String groupId) {
        groupManager.resolve(groupId);
    }

    public List<CorrelationRecord> getCorrelations(String incidentId) {
        return records.forIncident(incidentId);
    }

    public CorrelationStats getStats() {
        GroupIndex index = groupManager.getIndex();
        return new CorrelationStats(
                index.groupCount(),
                index.countByStatus(GroupStatus.ACTIVE),
                index.countByStatus(GroupStatus.STABLE),
                index.countByStatus(GroupStatus.RESOLVED),
                index.countByStatus(GroupStatus.ARCHIVED),
                records.size(),
                index.mappedIncidentCount(),
                dedupIndex.size());
    }

    /**
     * Run a maintenance pass on the calling thread.
     */
    public MaintenanceReport runMaintenance() {
        return maintenance.runMaintenance();
    }

    public GroupMaintenance getMaintenance() {
        return maintenance;
    }

    public DeduplicationIndex getDedupIndex() {
        return dedupIndex;
    }

    public CorrelationProperties getProperties() {
        return properties;
    }

    // ========== Internals ==========

    List<Incident> candidates(Incident incident) {
        Instant reference = incident.getCreatedAt() != null ? incident.getCreatedAt() : clock.instant();
        long lookbackSecs = properties.getTemporalWindowSecs();
        if (properties.getStrategies().getTopology().isEnabled()) {
            lookbackSecs = Math.max(lookbackSecs, properties.getTopology().getLookbackSecs());
        }

        IncidentFilter.IncidentFilterBuilder filter = IncidentFilter.builder()
                .excludeId(incident.getId())
                .limit(properties.getCandidates().getMaxResults());
        if (properties.getCandidates().isSameSourceOrCategoryOnly()) {
            filter.source(incident.getSource()).category(incident.getCategory());
        }
        return incidentStore.listRecent(filter.build(), reference.minusSeconds(lookbackSecs));
    }

    private CorrelationRecord store(CorrelationRecord record) {
        records.put(record);
        metrics.recordCorrelation(record.type());
        structuredLogger.logCorrelation(record.id(), record.incidentA(), record.incidentB(),
                record.type().name(), record.score());
        return record;
    }

    private String currentGroup(String incidentId) {
        return groupManager.getIndex().groupIdOf(incidentId).orElse(null);
    }

    private static Incident withFingerprint(Incident incident) {
        if (incident.getFingerprint() != null && !incident.getFingerprint().isBlank()) {
            return incident;
        }
        return incident.toBuilder().fingerprint(FingerprintGenerator.fingerprint(incident)).build();
    }
}
