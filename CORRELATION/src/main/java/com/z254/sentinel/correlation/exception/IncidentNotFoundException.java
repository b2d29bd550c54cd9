package com.z254.sentinel.correlation.exception;

import java.util.List;

/**
 * Thrown when an operation references incidents unknown to the incident store.
 */
public class IncidentNotFoundException extends CorrelationException {

    private final List<String> incidentIds;

    public IncidentNotFoundException(List<String> incidentIds) {
        super("Incidents not found: " + incidentIds, "INCIDENT_NOT_FOUND");
        this.incidentIds = List.copyOf(incidentIds);
    }

    public List<String> getIncidentIds() {
        return incidentIds;
    }
}
