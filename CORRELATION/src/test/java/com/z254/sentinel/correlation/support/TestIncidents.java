package com.z254.sentinel.correlation.support;

import com.z254.sentinel.correlation.domain.model.Incident;
import com.z254.sentinel.correlation.domain.model.Resource;
import com.z254.sentinel.correlation.domain.model.Severity;

import java.time.Instant;

/**
 * Incident fixtures.
 */
public final class TestIncidents {

    public static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private TestIncidents() {
    }

    public static Incident.IncidentBuilder incident(String id) {
        return Incident.builder()
                .id(id)
                .title("Incident " + id)
                .description("details for " + id)
                .severity(Severity.P3)
                .category("general")
                .source("source-" + id)
                .resource(Resource.of("service", "resource-" + id))
                .createdAt(T0);
    }

    /**
     * Incident that correlates with nothing except other incidents sharing its source.
     */
    public static Incident sourced(String id, String source, Instant createdAt) {
        return incident(id).source(source).createdAt(createdAt).build();
    }
}
