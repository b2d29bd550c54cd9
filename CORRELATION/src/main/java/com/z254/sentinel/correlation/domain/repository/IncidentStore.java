package com.z254.sentinel.correlation.domain.repository;

import com.z254.sentinel.correlation.domain.model.Incident;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read access to incidents owned by the incident management service, plus the single
 * write the correlation engine performs: appending timeline events.
 */
public interface IncidentStore {

    Optional<Incident> getIncident(String id);

    /**
     * Incidents created at or after {@code since}, newest first, narrowed by the filter.
     */
    List<Incident> listRecent(IncidentFilter filter, Instant since);

    default boolean exists(String id) {
        return getIncident(id).isPresent();
    }

    /**
     * Append an event to an incident timeline.
     *
     * @return false when the incident does not exist
     */
    boolean appendTimelineEvent(String incidentId, Incident.TimelineEvent event);
}
