package com.z254.sentinel.correlation.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Evidence that two incidents are related.
 * <p>
 * The pair is unordered and stored canonically with {@code incidentA < incidentB}.
 * Records are immutable; re-scoring a pair produces a new record that supersedes the old one.
 *
 * @param id         record identifier
 * @param incidentA  lexicographically smaller incident id
 * @param incidentB  lexicographically larger incident id
 * @param type       strategy that produced the record
 * @param score      correlation score in [0, 1]
 * @param reason     human readable explanation
 * @param detectedAt detection time
 */
public record CorrelationRecord(
        String id,
        String incidentA,
        String incidentB,
        CorrelationType type,
        double score,
        String reason,
        Instant detectedAt
) {

    public CorrelationRecord {
        Objects.requireNonNull(incidentA, "incidentA");
        Objects.requireNonNull(incidentB, "incidentB");
        Objects.requireNonNull(type, "type");
        if (incidentA.compareTo(incidentB) >= 0) {
            throw new IllegalArgumentException(
                    "Record pair must be canonical and distinct: " + incidentA + ", " + incidentB);
        }
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Correlation score out of range: " + score);
        }
    }

    /**
     * Create a record for an unordered pair, canonicalizing the order.
     */
    public static CorrelationRecord of(String first, String second, CorrelationType type,
                                       double score, String reason, Instant detectedAt) {
        if (Objects.equals(first, second)) {
            throw new IllegalArgumentException("Cannot correlate an incident with itself: " + first);
        }
        boolean ordered = first.compareTo(second) < 0;
        return new CorrelationRecord(
                UUID.randomUUID().toString(),
                ordered ? first : second,
                ordered ? second : first,
                type,
                score,
                reason,
                detectedAt);
    }

    public boolean involves(String incidentId) {
        return incidentA.equals(incidentId) || incidentB.equals(incidentId);
    }

    public String other(String incidentId) {
        if (incidentA.equals(incidentId)) {
            return incidentB;
        }
        if (incidentB.equals(incidentId)) {
            return incidentA;
        }
        throw new IllegalArgumentException("Incident " + incidentId + " not part of record " + id);
    }

    /**
     * Key identifying the (pair, type) slot this record occupies; a newer record with the
     * same key supersedes this one.
     */
    public String slotKey() {
        return incidentA + "|" + incidentB + "|" + type.name();
    }
}
