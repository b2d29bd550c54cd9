package com.z254.sentinel.correlation.group;

import com.z254.sentinel.correlation.domain.model.CorrelationGroup;
import com.z254.sentinel.correlation.domain.model.GroupStatus;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Groups, the incident to group reverse index, and the locks guarding them.
 * <p>
 * Lock order is global: incident stripes by ascending index, then group locks by ascending
 * group id. Every path that takes more than one lock goes through {@link #lock}.
 * A group and the reverse-index entries pointing at it are only changed while its lock is held.
 * Group ids are never reused, so the lock of a group that no longer exists is dropped on release.
 */
public class GroupIndex {

    private static final int DEFAULT_STRIPES = 64;

    private final Map<String, CorrelationGroup> groups = new ConcurrentHashMap<>();
    private final Map<String, String> incidentToGroup = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> groupLocks = new ConcurrentHashMap<>();
    private final ReentrantLock[] incidentStripes;

    public GroupIndex() {
        this(DEFAULT_STRIPES);
    }

    public GroupIndex(int stripes) {
        this.incidentStripes = new ReentrantLock[stripes];
        for (int i = 0; i < stripes; i++) {
            incidentStripes[i] = new ReentrantLock();
        }
    }

    public Optional<String> groupIdOf(String incidentId) {
        return Optional.ofNullable(incidentToGroup.get(incidentId));
    }

    public Optional<CorrelationGroup> group(String groupId) {
        return Optional.ofNullable(groups.get(groupId));
    }

    public List<String> groupIds() {
        return new ArrayList<>(groups.keySet());
    }

    public Collection<CorrelationGroup> groups() {
        return groups.values();
    }

    public int groupCount() {
        return groups.size();
    }

    public int mappedIncidentCount() {
        return incidentToGroup.size();
    }

    public long countByStatus(GroupStatus status) {
        return groups.values().stream().filter(g -> g.getStatus() == status).count();
    }

    // ========== Mutations, caller holds the group lock ==========

    void register(CorrelationGroup group) {
        groups.put(group.getId(), group);
        for (String member : group.getMembers()) {
            incidentToGroup.put(member, group.getId());
        }
    }

    void map(String incidentId, String groupId) {
        incidentToGroup.put(incidentId, groupId);
    }

    boolean unmap(String incidentId, String groupId) {
        return incidentToGroup.remove(incidentId, groupId);
    }

    /**
     * Remove a group absorbed by a merge; its members must already point at the survivor.
     */
    void discard(String groupId) {
        groups.remove(groupId);
        groupLocks.remove(groupId);
    }

    /**
     * Release reverse-index entries still pointing at the group.
     */
    int release(CorrelationGroup group) {
        int released = 0;
        for (String member : group.getMembers()) {
            if (incidentToGroup.remove(member, group.getId())) {
                released++;
            }
        }
        return released;
    }

    // ========== Locking ==========

    /**
     * Acquire the stripes for the given incidents and the locks for the given groups in global order.
     */
    public LockSet lock(Collection<String> incidentIds, Collection<String> groupIds) {
        TreeSet<Integer> stripes = new TreeSet<>();
        for (String incidentId : incidentIds) {
            stripes.add(Math.floorMod(incidentId.hashCode(), incidentStripes.length));
        }
        TreeSet<String> sortedGroups = new TreeSet<>(groupIds);

        List<ReentrantLock> acquired = new ArrayList<>(stripes.size() + sortedGroups.size());
        Map<String, ReentrantLock> heldGroupLocks = new LinkedHashMap<>();
        try {
            for (int stripe : stripes) {
                ReentrantLock lock = incidentStripes[stripe];
                lock.lock();
                acquired.add(lock);
            }
            for (String groupId : sortedGroups) {
                ReentrantLock lock = groupLocks.computeIfAbsent(groupId, id -> new ReentrantLock());
                lock.lock();
                acquired.add(lock);
                heldGroupLocks.put(groupId, lock);
            }
        } catch (RuntimeException e) {
            new LockSet(acquired, heldGroupLocks).close();
            throw e;
        }
        return new LockSet(acquired, heldGroupLocks);
    }

    public LockSet lockGroup(String groupId) {
        return lock(List.of(), List.of(groupId));
    }

    int groupLockCount() {
        return groupLocks.size();
    }

    /**
     * Held locks, released in reverse acquisition order.
     */
    public final class LockSet implements AutoCloseable {
        private final List<ReentrantLock> locks;
        private final Map<String, ReentrantLock> heldGroupLocks;

        private LockSet(List<ReentrantLock> locks, Map<String, ReentrantLock> heldGroupLocks) {
            this.locks = locks;
            this.heldGroupLocks = heldGroupLocks;
        }

        @Override
        public void close() {
            heldGroupLocks.forEach((groupId, lock) -> {
                if (!groups.containsKey(groupId)) {
                    groupLocks.remove(groupId, lock);
                }
            });
            for (int i = locks.size() - 1; i >= 0; i--) {
                locks.get(i).unlock();
            }
        }
    }
}
