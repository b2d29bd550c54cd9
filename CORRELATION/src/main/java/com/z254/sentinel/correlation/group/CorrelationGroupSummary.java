package com.z254.sentinel.correlation.group;

import com.z254.sentinel.correlation.domain.model.CorrelationGroup;
import com.z254.sentinel.correlation.domain.model.GroupStatus;

import java.time.Instant;

public record CorrelationGroupSummary(
        String id,
        String title,
        String primaryIncidentId,
        GroupStatus status,
        int size,
        double aggregateScore,
        Instant createdAt,
        Instant updatedAt
) {

    static CorrelationGroupSummary of(CorrelationGroup group) {
        return new CorrelationGroupSummary(
                group.getId(),
                group.getTitle(),
                group.getPrimaryIncidentId(),
                group.getStatus(),
                group.size(),
                group.getAggregateScore(),
                group.getCreatedAt(),
                group.getUpdatedAt());
    }
}
