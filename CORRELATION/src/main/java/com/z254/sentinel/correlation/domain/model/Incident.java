package com.z254.sentinel.correlation.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Incident as seen by the correlation engine.
 * <p>
 * Incidents are owned by the incident store. Apart from {@code resolvedAt} and the
 * timeline, the fields are fixed when the incident is created.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Incident {

    /** Unique incident identifier */
    private String id;

    /** Deduplication fingerprint, computed by the engine when absent */
    private String fingerprint;

    /** Incident title/summary */
    private String title;

    /** Detailed description */
    private String description;

    /** Severity (P0 = most urgent) */
    private Severity severity;

    /** Incident category, e.g. infrastructure, performance */
    private String category;

    /** Originating monitoring system */
    private String source;

    /** Affected resource */
    private Resource resource;

    /** Free-form labels */
    @Builder.Default
    private Map<String, String> labels = new HashMap<>();

    /** Creation timestamp */
    private Instant createdAt;

    /** Resolution timestamp, null while open */
    private Instant resolvedAt;

    /** Incident timeline */
    @Builder.Default
    private List<TimelineEvent> timeline = new ArrayList<>();

    public boolean isResolved() {
        return resolvedAt != null;
    }

    /**
     * Add a timeline event.
     */
    public void addTimelineEvent(TimelineEvent event) {
        timeline.add(event);
    }

    /**
     * Timeline event types written by the correlation engine.
     */
    public enum TimelineEventType {
        CREATED,
        DUPLICATE_MERGED,
        CORRELATED,
        RESOLVED,
        COMMENT
    }

    /**
     * Timeline event record.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TimelineEvent {
        private Instant timestamp;
        private TimelineEventType type;
        private String description;
        private String actor;
        private Map<String, String> details;
    }
}
