package com.z254.sentinel.correlation.domain.model;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Cluster of incidents believed to share a root cause.
 * <p>
 * Holds incident ids only; the incident to group direction lives in the group index.
 * Instances are mutable and must only be touched while holding the group's lock.
 */
@Getter
@ToString
public class CorrelationGroup {

    private static final String TITLE_PREFIX = "Correlated: ";

    private final String id;
    private String title;
    private String primaryIncidentId;
    private Instant primaryCreatedAt;
    private String primaryTitle;
    private final Set<String> members = new LinkedHashSet<>();
    // live intra-group records by (pair, type) slot
    @Getter(AccessLevel.NONE)
    private final Map<String, CorrelationRecord> records = new LinkedHashMap<>();
    private GroupStatus status = GroupStatus.ACTIVE;
    private final Instant createdAt;
    private Instant updatedAt;
    private Instant lastMemberAddedAt;
    private Instant resolvedAt;
    private Instant archivedAt;

    public CorrelationGroup(String id, GroupMember primary, Instant now) {
        this.id = id;
        this.createdAt = now;
        this.updatedAt = now;
        this.lastMemberAddedAt = now;
        members.add(primary.incidentId());
        assignPrimary(primary);
    }

    public int size() {
        return members.size();
    }

    public boolean contains(String incidentId) {
        return members.contains(incidentId);
    }

    /**
     * Mean score of the live intra-group records, one per (pair, type) slot.
     */
    public double getAggregateScore() {
        return records.values().stream().mapToDouble(CorrelationRecord::score).average().orElse(0.0);
    }

    public Set<String> getMembers() {
        return Collections.unmodifiableSet(members);
    }

    public List<String> getRecordIds() {
        List<String> ids = new ArrayList<>(records.size());
        for (CorrelationRecord record : records.values()) {
            ids.add(record.id());
        }
        return Collections.unmodifiableList(ids);
    }

    /**
     * Add a member, re-electing the primary when the newcomer is older.
     */
    public void addMember(GroupMember member, Instant now) {
        if (members.add(member.incidentId())) {
            lastMemberAddedAt = now;
            if (isEarlierThanPrimary(member)) {
                assignPrimary(member);
            }
        }
        touch(now);
    }

    /**
     * Fold a correlation record into the aggregate. A record for an already scored slot
     * replaces the earlier one.
     */
    public void recordScore(CorrelationRecord record, Instant now) {
        records.put(record.slotKey(), record);
        touch(now);
    }

    /**
     * Drop a member and every record involving it. The primary is re-elected among the
     * remaining members when it was the one removed.
     *
     * @param memberLookup member facts for the remaining incidents
     * @return false when the incident was not a member
     */
    public boolean removeMember(String incidentId, Function<String, GroupMember> memberLookup, Instant now) {
        if (!members.remove(incidentId)) {
            return false;
        }
        records.values().removeIf(record -> record.involves(incidentId));
        if (incidentId.equals(primaryIncidentId) && !members.isEmpty()) {
            GroupMember elected = null;
            for (String member : members) {
                GroupMember candidate = memberLookup.apply(member);
                if (elected == null || isEarlier(candidate, elected)) {
                    elected = candidate;
                }
            }
            assignPrimary(elected);
        }
        touch(now);
        return true;
    }

    /**
     * Absorb another group's members and scores. The other group is left untouched and is
     * expected to be discarded by the caller.
     */
    public void absorb(CorrelationGroup other, Instant now) {
        members.addAll(other.members);
        records.putAll(other.records);
        GroupMember otherPrimary = new GroupMember(other.primaryIncidentId, other.primaryCreatedAt, other.primaryTitle);
        if (isEarlierThanPrimary(otherPrimary)) {
            assignPrimary(otherPrimary);
        }
        lastMemberAddedAt = now;
        touch(now);
    }

    public void transitionTo(GroupStatus target, Instant now) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException("Group " + id + " cannot move from " + status + " to " + target);
        }
        status = target;
        if (target == GroupStatus.RESOLVED) {
            resolvedAt = now;
        } else if (target == GroupStatus.ARCHIVED) {
            archivedAt = now;
        }
        touch(now);
    }

    private boolean isEarlierThanPrimary(GroupMember candidate) {
        return isEarlier(candidate, new GroupMember(primaryIncidentId, primaryCreatedAt, primaryTitle));
    }

    private static boolean isEarlier(GroupMember candidate, GroupMember current) {
        // unknown creation times sort after every known one
        Instant candidateAt = candidate.createdAt() != null ? candidate.createdAt() : Instant.MAX;
        Instant currentAt = current.createdAt() != null ? current.createdAt() : Instant.MAX;
        int cmp = candidateAt.compareTo(currentAt);
        return cmp < 0 || (cmp == 0 && candidate.incidentId().compareTo(current.incidentId()) < 0);
    }

    private void assignPrimary(GroupMember member) {
        this.primaryIncidentId = member.incidentId();
        this.primaryCreatedAt = member.createdAt();
        this.primaryTitle = member.title();
        this.title = TITLE_PREFIX + (member.title() != null ? member.title() : member.incidentId());
    }

    private void touch(Instant now) {
        this.updatedAt = now;
    }

    /**
     * Minimal member facts needed to elect the primary incident.
     */
    public record GroupMember(String incidentId, Instant createdAt, String title) {

        public static GroupMember of(Incident incident) {
            return new GroupMember(incident.getId(), incident.getCreatedAt(), incident.getTitle());
        }

        public static GroupMember unknown(String incidentId) {
            return new GroupMember(incidentId, null, null);
        }
    }
}
