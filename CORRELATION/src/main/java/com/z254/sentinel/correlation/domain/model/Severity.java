package com.z254.sentinel.correlation.domain.model;

/**
 * Incident severity, ordered from most (P0) to least (P4) urgent.
 */
public enum Severity {
    P0,
    P1,
    P2,
    P3,
    P4;

    public boolean isMoreSevereThan(Severity other) {
        return other != null && ordinal() < other.ordinal();
    }
}
