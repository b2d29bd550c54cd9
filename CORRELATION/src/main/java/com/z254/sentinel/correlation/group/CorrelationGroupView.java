package com.z254.sentinel.correlation.group;

import com.z254.sentinel.correlation.domain.model.CorrelationGroup;
import com.z254.sentinel.correlation.domain.model.CorrelationRecord;
import com.z254.sentinel.correlation.domain.model.GroupStatus;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of a correlation group, taken under its lock.
 */
public record CorrelationGroupView(
        String id,
        String title,
        String primaryIncidentId,
        List<String> members,
        List<CorrelationRecord> correlations,
        GroupStatus status,
        double aggregateScore,
        Instant createdAt,
        Instant updatedAt,
        Instant lastMemberAddedAt,
        Instant resolvedAt,
        Instant archivedAt
) {

    static CorrelationGroupView of(CorrelationGroup group, List<CorrelationRecord> correlations) {
        return new CorrelationGroupView(
                group.getId(),
                group.getTitle(),
                group.getPrimaryIncidentId(),
                List.copyOf(group.getMembers()),
                List.copyOf(correlations),
                group.getStatus(),
                group.getAggregateScore(),
                group.getCreatedAt(),
                group.getUpdatedAt(),
                group.getLastMemberAddedAt(),
                group.getResolvedAt(),
                group.getArchivedAt());
    }

    public int size() {
        return members.size();
    }

    public boolean contains(String incidentId) {
        return members.contains(incidentId);
    }
}
