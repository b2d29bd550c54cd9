package com.z254.sentinel.correlation.group;

import com.z254.sentinel.correlation.domain.model.CorrelationRecord;
import com.z254.sentinel.correlation.domain.model.CorrelationType;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Live correlation records, one per (pair, type) slot. A newer record for a slot supersedes
 * the older one.
 */
public class CorrelationRecordStore {

    private final Map<String, CorrelationRecord> bySlot = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> slotsByIncident = new ConcurrentHashMap<>();

    /**
     * Store a record.
     *
     * @return the record it superseded, if any
     */
    public Optional<CorrelationRecord> put(CorrelationRecord record) {
        String slot = record.slotKey();
        CorrelationRecord previous = bySlot.put(slot, record);
        slotsByIncident.computeIfAbsent(record.incidentA(), k -> ConcurrentHashMap.newKeySet()).add(slot);
        slotsByIncident.computeIfAbsent(record.incidentB(), k -> ConcurrentHashMap.newKeySet()).add(slot);
        return Optional.ofNullable(previous);
    }

    public Optional<CorrelationRecord> find(String incidentA, String incidentB, CorrelationType type) {
        boolean ordered = incidentA.compareTo(incidentB) < 0;
        String slot = (ordered ? incidentA : incidentB) + "|" + (ordered ? incidentB : incidentA) + "|" + type.name();
        return Optional.ofNullable(bySlot.get(slot));
    }

    /**
     * Live records involving the incident, newest first.
     */
    public List<CorrelationRecord> forIncident(String incidentId) {
        Set<String> slots = slotsByIncident.get(incidentId);
        if (slots == null) {
            return List.of();
        }
        return slots.stream()
                .map(bySlot::get)
                .filter(r -> r != null)
                .sorted(Comparator.comparing(CorrelationRecord::detectedAt).reversed())
                .collect(Collectors.toList());
    }

    /**
     * Live records whose two incidents are both in the given set.
     */
    public List<CorrelationRecord> within(Collection<String> incidentIds) {
        Set<String> members = Set.copyOf(incidentIds);
        return members.stream()
                .flatMap(id -> forIncident(id).stream())
                .filter(r -> members.contains(r.incidentA()) && members.contains(r.incidentB()))
                .distinct()
                .sorted(Comparator.comparing(CorrelationRecord::detectedAt))
                .collect(Collectors.toList());
    }

    /**
     * Drop every record involving an incident matching the predicate.
     *
     * @return number of records removed
     */
    public int pruneIncidents(Predicate<String> incidentIdFilter) {
        int removed = 0;
        for (String incidentId : List.copyOf(slotsByIncident.keySet())) {
            if (!incidentIdFilter.test(incidentId)) {
                continue;
            }
            Set<String> slots = slotsByIncident.remove(incidentId);
            if (slots == null) {
                continue;
            }
            for (String slot : slots) {
                CorrelationRecord record = bySlot.remove(slot);
                if (record != null) {
                    removed++;
                    String other = record.other(incidentId);
                    Set<String> otherSlots = slotsByIncident.get(other);
                    if (otherSlots != null) {
                        otherSlots.remove(slot);
                    }
                }
            }
        }
        return removed;
    }

    public Set<String> incidentIds() {
        return Set.copyOf(slotsByIncident.keySet());
    }

    public int size() {
        return bySlot.size();
    }
}
