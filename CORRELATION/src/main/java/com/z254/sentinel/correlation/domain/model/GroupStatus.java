package com.z254.sentinel.correlation.domain.model;

/**
 * Lifecycle of a correlation group.
 * <p>
 * {@code ACTIVE <-> STABLE -> RESOLVED -> ARCHIVED}. STABLE to ACTIVE is the only
 * backward edge and ARCHIVED is terminal.
 */
public enum GroupStatus {
    ACTIVE,
    STABLE,
    RESOLVED,
    ARCHIVED;

    public boolean canTransitionTo(GroupStatus target) {
        return switch (this) {
            case ACTIVE -> target == STABLE || target == RESOLVED;
            case STABLE -> target == ACTIVE || target == RESOLVED;
            case RESOLVED -> target == ARCHIVED;
            case ARCHIVED -> false;
        };
    }

    /**
     * Open groups still accept new members and merges.
     */
    public boolean isOpen() {
        return this == ACTIVE || this == STABLE;
    }
}
