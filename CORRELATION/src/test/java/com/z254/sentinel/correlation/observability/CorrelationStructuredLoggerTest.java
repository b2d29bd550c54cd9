package com.z254.sentinel.correlation.observability;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CorrelationStructuredLoggerTest {

    private final CorrelationStructuredLogger logger = new CorrelationStructuredLogger();

    @Test
    void formatsLogDataAsJson() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("incidentId", "inc-\"1\"");
        data.put("score", 0.75);
        data.put("duplicate", true);
        data.put("groupId", null);

        assertThat(logger.formatLogData(data))
                .isEqualTo("{\"incidentId\": \"inc-\\\"1\\\"\", \"score\": 0.75, \"duplicate\": true, \"groupId\": null}");
    }

    @Test
    void incidentScopeClearsMdc() {
        try (CorrelationStructuredLogger.MDCScope scope = logger.withIncidentId("inc-1")) {
            assertThat(MDC.get(CorrelationStructuredLogger.MDC_INCIDENT_ID)).isEqualTo("inc-1");
        }
        assertThat(MDC.get(CorrelationStructuredLogger.MDC_INCIDENT_ID)).isNull();
    }

    @Test
    void timedPropagatesFailure() {
        assertThatThrownBy(() -> logger.timed("analyze", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void nestedScopeRestoresOuterValue() {
        try (CorrelationStructuredLogger.MDCScope outer = logger.withIncidentId("inc-outer")) {
            try (CorrelationStructuredLogger.MDCScope inner = logger.withIncidentId("inc-inner")) {
                assertThat(MDC.get(CorrelationStructuredLogger.MDC_INCIDENT_ID)).isEqualTo("inc-inner");
            }
            assertThat(MDC.get(CorrelationStructuredLogger.MDC_INCIDENT_ID)).isEqualTo("inc-outer");
        }
        assertThat(MDC.get(CorrelationStructuredLogger.MDC_INCIDENT_ID)).isNull();
    }

    @Test
    void duplicateLoggingKeepsCallerIncidentContext() {
        try (CorrelationStructuredLogger.MDCScope scope = logger.withIncidentId("inc-2")) {
            logger.logDuplicate("inc-2", "inc-1", "abc123", 2);
            logger.logGroupEvent("group-1", CorrelationStructuredLogger.GroupEventType.MERGE_REJECTED,
                    "Correlation group merge rejected");

            assertThat(MDC.get(CorrelationStructuredLogger.MDC_INCIDENT_ID)).isEqualTo("inc-2");
            assertThat(MDC.get(CorrelationStructuredLogger.MDC_GROUP_ID)).isNull();
        }
    }
}
