package com.z254.sentinel.correlation.domain.model;

/**
 * Kind of evidence a {@link CorrelationRecord} carries.
 */
public enum CorrelationType {
    /** Incidents close in time */
    TEMPORAL,
    /** Similar title and description */
    PATTERN,
    /** Same originating source system */
    SOURCE,
    /** Identical fingerprint outside the dedup window */
    FINGERPRINT,
    /** Related resources in the dependency graph */
    TOPOLOGY,
    /** Weighted aggregate of several signals */
    COMBINED,
    /** Linked by an operator */
    MANUAL
}
