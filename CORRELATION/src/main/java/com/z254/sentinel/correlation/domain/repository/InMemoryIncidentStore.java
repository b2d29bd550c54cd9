package com.z254.sentinel.correlation.domain.repository;

import com.z254.sentinel.correlation.domain.model.Incident;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory incident store used when no incident management backend is wired up,
 * and by tests.
 */
@Slf4j
public class InMemoryIncidentStore implements IncidentStore {

    private final Map<String, Incident> store = new ConcurrentHashMap<>();

    public Incident save(Incident incident) {
        store.put(incident.getId(), incident);
        return incident;
    }

    public void delete(String id) {
        store.remove(id);
    }

    public int size() {
        return store.size();
    }

    @Override
    public Optional<Incident> getIncident(String id) {
        return Optional.ofNullable(store.get(id));
    }

    @Override
    public List<Incident> listRecent(IncidentFilter filter, Instant since) {
        return store.values().stream()
                .filter(incident -> incident.getCreatedAt() != null && !incident.getCreatedAt().isBefore(since))
                .filter(filter::matches)
                .sorted(Comparator.comparing(Incident::getCreatedAt).reversed())
                .limit(filter.getLimit())
                .collect(Collectors.toList());
    }

    @Override
    public boolean exists(String id) {
        return store.containsKey(id);
    }

    @Override
    public boolean appendTimelineEvent(String incidentId, Incident.TimelineEvent event) {
        Incident updated = store.computeIfPresent(incidentId, (id, incident) -> {
            synchronized (incident) {
                incident.addTimelineEvent(event);
            }
            return incident;
        });
        if (updated == null) {
            log.debug("Timeline event dropped, incident {} not found", incidentId);
            return false;
        }
        return true;
    }
}
