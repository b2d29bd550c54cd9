package com.z254.sentinel.correlation.group;

import com.z254.sentinel.correlation.domain.model.CorrelationRecord;

/**
 * Effect of ingesting one correlation record into the group index.
 *
 * @param groupId         group holding the pair afterwards, null when nothing changed
 * @param absorbedGroupId group folded into {@code groupId} by a merge
 */
public record GroupMutationResult(Outcome outcome, String groupId, String absorbedGroupId, CorrelationRecord record) {

    public enum Outcome {
        /** Neither incident was grouped; a new group holds both */
        CREATED,
        /** One incident joined the other's group */
        ADDED,
        /** Two groups were unioned */
        MERGED,
        /** Both incidents already shared a group; its score was updated */
        UPDATED,
        /** The size cap rejected the addition or merge */
        GROUP_FULL,
        /** Two groups were not compatible enough to merge */
        MERGE_REJECTED,
        /** The target group is resolved and accepts no new members */
        GROUP_CLOSED
    }

    public static GroupMutationResult of(Outcome outcome, String groupId, CorrelationRecord record) {
        return new GroupMutationResult(outcome, groupId, null, record);
    }

    public boolean changedMembership() {
        return outcome == Outcome.CREATED || outcome == Outcome.ADDED || outcome == Outcome.MERGED;
    }
}
