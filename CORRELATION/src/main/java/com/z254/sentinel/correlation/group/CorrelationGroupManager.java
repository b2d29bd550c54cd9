package com.z254.sentinel.correlation.group;

import com.z254.sentinel.correlation.config.CorrelationProperties;
import com.z254.sentinel.correlation.domain.model.CorrelationGroup;
import com.z254.sentinel.correlation.domain.model.CorrelationGroup.GroupMember;
import com.z254.sentinel.correlation.domain.model.CorrelationRecord;
import com.z254.sentinel.correlation.domain.model.GroupStatus;
import com.z254.sentinel.correlation.exception.GroupNotFoundException;
import com.z254.sentinel.correlation.exception.IllegalGroupTransitionException;
import com.z254.sentinel.correlation.group.GroupMutationResult.Outcome;
import com.z254.sentinel.correlation.observability.CorrelationMetrics;
import com.z254.sentinel.correlation.observability.CorrelationStructuredLogger;
import com.z254.sentinel.correlation.observability.CorrelationStructuredLogger.GroupEventType;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Owns the incident to group mapping and folds correlation records into groups.
 * <p>
 * Every mutation locks the incidents' stripes and the groups involved in global order, then
 * re-reads the reverse index. If a concurrent merge moved one of the incidents in between,
 * the locks are dropped and the operation retried, so contention never surfaces to callers.
 */
@Slf4j
public class CorrelationGroupManager {

    private final GroupIndex index;
    private final CorrelationRecordStore records;
    private final CorrelationProperties properties;
    private final Clock clock;
    private final CorrelationMetrics metrics;
    private final CorrelationStructuredLogger structuredLogger;

    public CorrelationGroupManager(GroupIndex index,
                                   CorrelationRecordStore records,
                                   CorrelationProperties properties,
                                   Clock clock,
                                   CorrelationMetrics metrics,
                                   CorrelationStructuredLogger structuredLogger) {
        this.index = index;
        this.records = records;
        this.properties = properties;
        this.clock = clock;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
    }

    /**
     * Fold a correlation record into the groups of its two incidents.
     *
     * @param first               member facts for one incident of the record
     * @param second              member facts for the other incident
     * @param bypassMergeThreshold merge regardless of compatibility (manual correlation); the
     *                             size cap still applies
     */
    public GroupMutationResult ingest(CorrelationRecord record, GroupMember first, GroupMember second,
                                      boolean bypassMergeThreshold) {
        GroupMember memberA = first.incidentId().equals(record.incidentA()) ? first : second;
        GroupMember memberB = memberA == first ? second : first;
        if (!memberA.incidentId().equals(record.incidentA()) || !memberB.incidentId().equals(record.incidentB())) {
            throw new IllegalArgumentException("Members do not match record " + record.id());
        }

        while (true) {
            String groupA = index.groupIdOf(record.incidentA()).orElse(null);
            String groupB = index.groupIdOf(record.incidentB()).orElse(null);
            List<String> groupIds = Stream.of(groupA, groupB)
                    .filter(Objects::nonNull)
                    .distinct()
                    .collect(Collectors.toList());

            try (GroupIndex.LockSet locks = index.lock(List.of(record.incidentA(), record.incidentB()), groupIds)) {
                if (!Objects.equals(groupA, index.groupIdOf(record.incidentA()).orElse(null))
                        || !Objects.equals(groupB, index.groupIdOf(record.incidentB()).orElse(null))) {
                    log.debug("Group mapping changed while locking {}, retrying", record.slotKey());
                    continue;
                }
                return apply(record, memberA, memberB, groupA, groupB, bypassMergeThreshold);
            }
        }
    }

    /**
     * Union two groups if they are compatible. Used by maintenance auto-merge.
     *
     * @param bridgeScore correlation score between the two groups' primary incidents
     * @return empty when either group no longer exists
     */
    public Optional<GroupMutationResult> mergeGroups(String groupIdA, String groupIdB, double bridgeScore) {
        if (groupIdA.equals(groupIdB)) {
            return Optional.empty();
        }
        try (GroupIndex.LockSet locks = index.lock(List.of(), List.of(groupIdA, groupIdB))) {
            Optional<CorrelationGroup> a = index.group(groupIdA);
            Optional<CorrelationGroup> b = index.group(groupIdB);
            if (a.isEmpty() || b.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(merge(a.get(), b.get(), null, bridgeScore, false, clock.instant()));
        }
    }

    /**
     * Move a group to RESOLVED.
     *
     * @return false when the group was already resolved
     */
    public boolean resolve(String groupId) {
        try (GroupIndex.LockSet locks = index.lockGroup(groupId)) {
            CorrelationGroup group = index.group(groupId)
                    .orElseThrow(() -> new GroupNotFoundException(groupId));
            if (group.getStatus() == GroupStatus.RESOLVED) {
                return false;
            }
            if (!group.getStatus().canTransitionTo(GroupStatus.RESOLVED)) {
                throw new IllegalGroupTransitionException(groupId, group.getStatus(), GroupStatus.RESOLVED);
            }
            markResolved(group, clock.instant(), "manual");
            return true;
        }
    }

    /**
     * Advance a group one lifecycle step if it is due.
     *
     * @param incidentResolved tells whether a member incident has been resolved
     */
    public LifecycleStep advanceLifecycle(String groupId, Instant now, Predicate<String> incidentResolved) {
        CorrelationProperties.Maintenance maintenance = properties.getMaintenance();
        try (GroupIndex.LockSet locks = index.lockGroup(groupId)) {
            Optional<CorrelationGroup> found = index.group(groupId);
            if (found.isEmpty()) {
                return LifecycleStep.NONE;
            }
            CorrelationGroup group = found.get();

            switch (group.getStatus()) {
                case ARCHIVED -> {
                    if (isDue(group.getArchivedAt(), maintenance.getRetention(), now)) {
                        index.release(group);
                        index.discard(groupId);
                        structuredLogger.logGroupEvent(groupId, GroupEventType.PURGED, "Correlation group purged");
                        return LifecycleStep.PURGED;
                    }
                }
                case RESOLVED -> {
                    if (isDue(group.getResolvedAt(), maintenance.getArchiveAfter(), now)) {
                        group.transitionTo(GroupStatus.ARCHIVED, now);
                        int released = index.release(group);
                        metrics.recordGroupArchived();
                        structuredLogger.logGroupEvent(groupId, GroupEventType.ARCHIVED,
                                "Correlation group archived", Map.of("releasedIncidents", released));
                        return LifecycleStep.ARCHIVED;
                    }
                }
                case ACTIVE, STABLE -> {
                    if (group.getMembers().stream().allMatch(incidentResolved)) {
                        markResolved(group, now, "all members resolved");
                        return LifecycleStep.RESOLVED;
                    }
                    if (group.getStatus() == GroupStatus.ACTIVE
                            && isDue(group.getLastMemberAddedAt(), maintenance.getStabilizeAfter(), now)) {
                        group.transitionTo(GroupStatus.STABLE, now);
                        structuredLogger.logGroupEvent(groupId, GroupEventType.STABILIZED,
                                "Correlation group stabilized");
                        return LifecycleStep.STABILIZED;
                    }
                }
            }
            return LifecycleStep.NONE;
        }
    }

    /**
     * Remove members whose incidents no longer exist, releasing their reverse-index entries.
     * A group left without members is discarded. Archived groups are left to retention.
     *
     * @param memberLookup member facts for re-electing the primary
     * @return number of members removed
     */
    public int pruneMembers(String groupId, Predicate<String> incidentMissing,
                            Function<String, GroupMember> memberLookup) {
        try (GroupIndex.LockSet locks = index.lockGroup(groupId)) {
            Optional<CorrelationGroup> found = index.group(groupId);
            if (found.isEmpty() || found.get().getStatus() == GroupStatus.ARCHIVED) {
                return 0;
            }
            CorrelationGroup group = found.get();
            List<String> gone = group.getMembers().stream()
                    .filter(incidentMissing)
                    .collect(Collectors.toList());
            if (gone.isEmpty()) {
                return 0;
            }

            Instant now = clock.instant();
            for (String incidentId : gone) {
                group.removeMember(incidentId, memberLookup, now);
                index.unmap(incidentId, groupId);
            }
            structuredLogger.logGroupEvent(groupId, GroupEventType.MEMBER_REMOVED,
                    "Deleted incidents removed from correlation group",
                    details("removed", gone, "members", group.size()));
            if (group.size() == 0) {
                index.discard(groupId);
                structuredLogger.logGroupEvent(groupId, GroupEventType.PURGED, "Empty correlation group discarded");
            }
            return gone.size();
        }
    }

    // ========== Reads ==========

    public Optional<CorrelationGroupView> view(String groupId) {
        try (GroupIndex.LockSet locks = index.lockGroup(groupId)) {
            return index.group(groupId).map(this::snapshot);
        }
    }

    public Optional<CorrelationGroupView> viewForIncident(String incidentId) {
        while (true) {
            Optional<String> groupId = index.groupIdOf(incidentId);
            if (groupId.isEmpty()) {
                return Optional.empty();
            }
            try (GroupIndex.LockSet locks = index.lockGroup(groupId.get())) {
                if (!groupId.equals(index.groupIdOf(incidentId))) {
                    continue;
                }
                return index.group(groupId.get()).map(this::snapshot);
            }
        }
    }

    /**
     * Summaries of the groups in the given states, oldest first. An empty filter matches all.
     */
    public List<CorrelationGroupSummary> summaries(Set<GroupStatus> statusFilter) {
        List<CorrelationGroupSummary> result = new ArrayList<>();
        for (String groupId : index.groupIds()) {
            try (GroupIndex.LockSet locks = index.lockGroup(groupId)) {
                index.group(groupId)
                        .filter(g -> statusFilter == null || statusFilter.isEmpty()
                                || statusFilter.contains(g.getStatus()))
                        .map(CorrelationGroupSummary::of)
                        .ifPresent(result::add);
            }
        }
        result.sort(Comparator.comparing(CorrelationGroupSummary::createdAt)
                .thenComparing(CorrelationGroupSummary::id));
        return result;
    }

    public GroupIndex getIndex() {
        return index;
    }

    // ========== Mutations, locks held ==========

    private GroupMutationResult apply(CorrelationRecord record, GroupMember memberA, GroupMember memberB,
                                      String groupIdA, String groupIdB, boolean bypassMergeThreshold) {
        Instant now = clock.instant();

        if (groupIdA == null && groupIdB == null) {
            return create(record, memberA, memberB, now);
        }
        if (groupIdA == null || groupIdB == null) {
            CorrelationGroup target = requireGroup(groupIdA != null ? groupIdA : groupIdB);
            GroupMember joining = groupIdA == null ? memberA : memberB;
            return addTo(target, joining, record, now);
        }
        if (groupIdA.equals(groupIdB)) {
            return update(requireGroup(groupIdA), record, now);
        }
        return merge(requireGroup(groupIdA), requireGroup(groupIdB), record, record.score(),
                bypassMergeThreshold, now);
    }

    private GroupMutationResult create(CorrelationRecord record, GroupMember memberA, GroupMember memberB,
                                       Instant now) {
        if (properties.getMaxGroupSize() < 2) {
            return rejectFull(null, record, 2);
        }
        CorrelationGroup group = new CorrelationGroup(UUID.randomUUID().toString(), memberA, now);
        group.addMember(memberB, now);
        group.recordScore(record, now);
        index.register(group);

        metrics.recordGroupCreated();
        structuredLogger.logGroupEvent(group.getId(), GroupEventType.CREATED, "Correlation group created",
                details("primaryIncidentId", group.getPrimaryIncidentId(),
                        "members", group.size(),
                        "score", record.score(),
                        "type", record.type().name()));
        return GroupMutationResult.of(Outcome.CREATED, group.getId(), record);
    }

    private GroupMutationResult addTo(CorrelationGroup group, GroupMember joining, CorrelationRecord record,
                                      Instant now) {
        if (!group.getStatus().isOpen()) {
            return closed(group, record);
        }
        if (group.size() >= properties.getMaxGroupSize()) {
            return rejectFull(group.getId(), record, group.size() + 1);
        }
        reopenIfStable(group, now);
        group.addMember(joining, now);
        group.recordScore(record, now);
        index.map(joining.incidentId(), group.getId());

        structuredLogger.logGroupEvent(group.getId(), GroupEventType.MEMBER_ADDED, "Incident joined correlation group",
                details("incidentId", joining.incidentId(),
                        "members", group.size(),
                        "score", record.score(),
                        "aggregateScore", group.getAggregateScore()));
        return GroupMutationResult.of(Outcome.ADDED, group.getId(), record);
    }

    private GroupMutationResult update(CorrelationGroup group, CorrelationRecord record, Instant now) {
        if (!group.getStatus().isOpen()) {
            return closed(group, record);
        }
        reopenIfStable(group, now);
        group.recordScore(record, now);
        return GroupMutationResult.of(Outcome.UPDATED, group.getId(), record);
    }

    private GroupMutationResult merge(CorrelationGroup a, CorrelationGroup b, CorrelationRecord bridge,
                                      double bridgeScore, boolean bypassMergeThreshold, Instant now) {
        if (!a.getStatus().isOpen()) {
            return closed(a, bridge);
        }
        if (!b.getStatus().isOpen()) {
            return closed(b, bridge);
        }

        double compatibility = (bridgeScore + a.getAggregateScore() + b.getAggregateScore()) / 3.0;
        if (!bypassMergeThreshold && compatibility < properties.getMergeThreshold()) {
            structuredLogger.logGroupEvent(a.getId(), GroupEventType.MERGE_REJECTED,
                    "Correlation group merge rejected",
                    details("otherGroupId", b.getId(),
                            "compatibility", compatibility,
                            "mergeThreshold", properties.getMergeThreshold()));
            return new GroupMutationResult(Outcome.MERGE_REJECTED, a.getId(), b.getId(), bridge);
        }
        int mergedSize = a.size() + b.size();
        if (mergedSize > properties.getMaxGroupSize()) {
            return rejectFull(a.getId(), bridge, mergedSize);
        }

        CorrelationGroup canonical = isCanonical(a, b) ? a : b;
        CorrelationGroup absorbed = canonical == a ? b : a;

        canonical.absorb(absorbed, now);
        for (String member : absorbed.getMembers()) {
            index.map(member, canonical.getId());
        }
        index.discard(absorbed.getId());
        if (bridge != null) {
            canonical.recordScore(bridge, now);
        }
        reopenIfStable(canonical, now);

        metrics.recordGroupMerged();
        structuredLogger.logGroupEvent(canonical.getId(), GroupEventType.MERGED, "Correlation groups merged",
                details("absorbedGroupId", absorbed.getId(),
                        "members", canonical.size(),
                        "compatibility", compatibility,
                        "manual", bypassMergeThreshold));
        return new GroupMutationResult(Outcome.MERGED, canonical.getId(), absorbed.getId(), bridge);
    }

    private void markResolved(CorrelationGroup group, Instant now, String reason) {
        group.transitionTo(GroupStatus.RESOLVED, now);
        metrics.recordGroupResolved();
        structuredLogger.logGroupEvent(group.getId(), GroupEventType.RESOLVED, "Correlation group resolved",
                details("reason", reason, "members", group.size()));
    }

    private void reopenIfStable(CorrelationGroup group, Instant now) {
        if (group.getStatus() == GroupStatus.STABLE) {
            group.transitionTo(GroupStatus.ACTIVE, now);
            structuredLogger.logGroupEvent(group.getId(), GroupEventType.REOPENED,
                    "Stable correlation group reopened by new correlation");
        }
    }

    private GroupMutationResult rejectFull(String groupId, CorrelationRecord record, int attemptedSize) {
        metrics.recordGroupFull();
        structuredLogger.logGroupEvent(groupId != null ? groupId : "none", GroupEventType.GROUP_FULL,
                "Correlation group size cap reached, change rejected",
                details("attemptedSize", attemptedSize,
                        "maxGroupSize", properties.getMaxGroupSize(),
                        "recordId", record != null ? record.id() : null));
        return GroupMutationResult.of(Outcome.GROUP_FULL, groupId, record);
    }

    private GroupMutationResult closed(CorrelationGroup group, CorrelationRecord record) {
        log.debug("Correlation group {} is {}, record {} not applied", group.getId(), group.getStatus(),
                record != null ? record.id() : "-");
        return GroupMutationResult.of(Outcome.GROUP_CLOSED, group.getId(), record);
    }

    private CorrelationGroup requireGroup(String groupId) {
        return index.group(groupId)
                .orElseThrow(() -> new IllegalStateException("Reverse index points at missing group " + groupId));
    }

    private CorrelationGroupView snapshot(CorrelationGroup group) {
        return CorrelationGroupView.of(group, records.within(group.getMembers()));
    }

    /**
     * The earlier-created group survives a merge; ties go to the smaller id.
     */
    static boolean isCanonical(CorrelationGroup candidate, CorrelationGroup other) {
        int cmp = candidate.getCreatedAt().compareTo(other.getCreatedAt());
        return cmp < 0 || (cmp == 0 && candidate.getId().compareTo(other.getId()) < 0);
    }

    private static boolean isDue(Instant since, Duration after, Instant now) {
        return since != null && !now.isBefore(since.plus(after));
    }

    private static Map<String, Object> details(Object... keyValues) {
        Map<String, Object> details = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            details.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return details;
    }

    public enum LifecycleStep {
        NONE, STABILIZED, RESOLVED, ARCHIVED, PURGED
    }
}
