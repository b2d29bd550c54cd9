package com.z254.sentinel.correlation.observability;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Structured logging utility for the correlation engine.
 * <p>
 * Provides consistent, machine-readable log output with:
 * <ul>
 *     <li>MDC context management for incident, group and correlation IDs</li>
 *     <li>Group lifecycle and deduplication logging methods</li>
 *     <li>Performance timing utilities</li>
 * </ul>
 */
@Slf4j
@Component
public class CorrelationStructuredLogger {

    // MDC keys
    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_INCIDENT_ID = "incidentId";
    public static final String MDC_GROUP_ID = "groupId";

    private static final long SLOW_OPERATION_MS = 1000;

    /**
     * Log a group lifecycle event.
     */
    public void logGroupEvent(String groupId, GroupEventType eventType, String message) {
        logGroupEvent(groupId, eventType, message, null);
    }

    /**
     * Log a group lifecycle event with details.
     */
    public void logGroupEvent(String groupId, GroupEventType eventType,
                              String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_GROUP_ID, groupId))) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put("groupId", groupId);

            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case GROUP_FULL ->
                        log.warn("{} | data={}", message, formatLogData(logData));
                case MERGE_REJECTED, STABILIZED, ARCHIVED, PURGED ->
                        log.debug("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a deduplication hit.
     */
    public void logDuplicate(String incidentId, String existingIncidentId, String fingerprint, long occurrences) {
        try (var scope = withContext(Map.of(MDC_INCIDENT_ID, incidentId != null ? incidentId : ""))) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", "DUPLICATE");
            logData.put("existingIncidentId", existingIncidentId);
            logData.put("fingerprint", fingerprint);
            logData.put("occurrences", occurrences);
            log.info("Duplicate incident folded into {} | data={}", existingIncidentId, formatLogData(logData));
        }
    }

    /**
     * Log a correlation record.
     */
    public void logCorrelation(String correlationId, String incidentA, String incidentB,
                               String type, double score) {
        try (var scope = withCorrelationId(correlationId)) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", "CORRELATED");
            logData.put("incidentA", incidentA);
            logData.put("incidentB", incidentB);
            logData.put("type", type);
            logData.put("score", score);
            log.debug("Incidents correlated | data={}", formatLogData(logData));
        }
    }

    /**
     * Log a performance metric.
     */
    public void logPerformance(String operation, Duration duration, boolean success,
                               Map<String, Object> details) {
        Map<String, Object> logData = new HashMap<>();
        logData.put("event", "PERFORMANCE");
        logData.put("operation", operation);
        logData.put("durationMs", duration.toMillis());
        logData.put("success", success);

        if (details != null) {
            logData.putAll(details);
        }

        if (duration.toMillis() > SLOW_OPERATION_MS) {
            log.warn("Slow operation: {} took {}ms | data={}",
                    operation, duration.toMillis(), formatLogData(logData));
        } else {
            log.debug("Performance: {} completed in {}ms | data={}",
                    operation, duration.toMillis(), formatLogData(logData));
        }
    }

    /**
     * Execute a timed operation with logging.
     */
    public <T> T timed(String operation, Supplier<T> action) {
        Instant start = Instant.now();
        boolean success = false;
        try {
            T result = action.get();
            success = true;
            return result;
        } finally {
            logPerformance(operation, Duration.between(start, Instant.now()), success, null);
        }
    }

    /**
     * Set MDC context. Closing the scope restores whatever the keys held before.
     */
    public MDCScope withContext(Map<String, String> context) {
        MDCScope scope = new MDCScope(context.keySet());
        context.forEach(MDC::put);
        return scope;
    }

    public MDCScope withIncidentId(String incidentId) {
        return withContext(Map.of(MDC_INCIDENT_ID, incidentId));
    }

    public MDCScope withCorrelationId(String correlationId) {
        return withContext(Map.of(MDC_CORRELATION_ID, correlationId));
    }

    String formatLogData(Map<String, Object> data) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (!first) sb.append(", ");
            first = false;

            sb.append("\"").append(entry.getKey()).append("\": ");
            Object value = entry.getValue();
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else {
                sb.append("\"").append(escapeJson(value.toString())).append("\"");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    private String escapeJson(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    public enum GroupEventType {
        CREATED, MEMBER_ADDED, MEMBER_REMOVED, MERGED, MERGE_REJECTED, GROUP_FULL,
        STABILIZED, REOPENED, RESOLVED, ARCHIVED, PURGED
    }

    /**
     * Auto-closeable MDC scope for cleanup.
     */
    public static class MDCScope implements AutoCloseable {
        private final Map<String, String> previous = new HashMap<>();

        public MDCScope(Collection<String> keys) {
            for (String key : keys) {
                previous.put(key, MDC.get(key));
            }
        }

        @Override
        public void close() {
            previous.forEach((key, value) -> {
                if (value == null) {
                    MDC.remove(key);
                } else {
                    MDC.put(key, value);
                }
            });
        }
    }
}
