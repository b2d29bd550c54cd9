package com.z254.sentinel.correlation.engine;

import com.z254.sentinel.correlation.dedup.DedupResult;
import com.z254.sentinel.correlation.domain.model.CorrelationRecord;
import com.z254.sentinel.correlation.domain.model.CorrelationType;
import com.z254.sentinel.correlation.group.GroupMutationResult;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of analyzing one incident.
 *
 * @param correlations records emitted for the incident, per-strategy and combined
 * @param groupId      group the incident belongs to afterwards, null when ungrouped
 * @param mutations    group changes caused by the combined records
 */
public record AnalysisResult(
        DedupResult dedup,
        List<CorrelationRecord> correlations,
        String groupId,
        List<GroupMutationResult> mutations
) {

    public AnalysisResult {
        correlations = List.copyOf(correlations);
        mutations = List.copyOf(mutations);
    }

    public Optional<String> group() {
        return Optional.ofNullable(groupId);
    }

    public boolean isDuplicate() {
        return dedup.isDuplicate();
    }

    public List<CorrelationRecord> correlationsOfType(CorrelationType type) {
        return correlations.stream().filter(r -> r.type() == type).toList();
    }
}
