package com.z254.sentinel.correlation.dedup;

/**
 * Outcome of a deduplication check.
 */
public sealed interface DedupResult permits DedupResult.New, DedupResult.Duplicate {

    String fingerprint();

    default boolean isDuplicate() {
        return this instanceof Duplicate;
    }

    /**
     * First sighting of the fingerprint inside the window.
     */
    record New(String fingerprint) implements DedupResult {
    }

    /**
     * Repeat of an incident already seen inside the window.
     *
     * @param existingIncidentId incident the repeat was folded into
     * @param occurrences        repeats recorded so far, excluding the first sighting
     */
    record Duplicate(String fingerprint, String existingIncidentId, long occurrences) implements DedupResult {
    }
}
