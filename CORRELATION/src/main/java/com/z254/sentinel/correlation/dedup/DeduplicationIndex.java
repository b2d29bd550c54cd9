package com.z254.sentinel.correlation.dedup;

import com.z254.sentinel.correlation.domain.model.Incident;
import com.z254.sentinel.correlation.domain.repository.IncidentStore;
import com.z254.sentinel.correlation.fingerprint.FingerprintGenerator;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Rolling time-window index from fingerprint to the most recent incident carrying it.
 * <p>
 * The check-and-update for a fingerprint is a single atomic {@link ConcurrentHashMap#compute},
 * so concurrent submissions of the same alert yield exactly one {@link DedupResult.New}.
 * Expired entries are overwritten lazily on the next write and swept by maintenance.
 */
@Slf4j
public class DeduplicationIndex {

    static final String ACTOR = "deduplication-engine";

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final IncidentStore incidentStore;
    private final Clock clock;
    private final Duration window;
    private final boolean enabled;

    public DeduplicationIndex(IncidentStore incidentStore, Clock clock, Duration window, boolean enabled) {
        this.incidentStore = incidentStore;
        this.clock = clock;
        this.window = window;
        this.enabled = enabled;
    }

    /**
     * Check whether the incident repeats one seen inside the window and record the sighting.
     */
    public DedupResult checkAndRecord(Incident incident) {
        String fingerprint = FingerprintGenerator.resolve(incident);
        if (!enabled) {
            return new DedupResult.New(fingerprint);
        }

        Instant now = clock.instant();
        Entry current = entries.compute(fingerprint, (key, existing) -> {
            if (existing != null && !isExpired(existing, now)) {
                return existing.seenAgain(now);
            }
            return new Entry(incident.getId(), now, now, 0);
        });

        if (current.occurrences() == 0) {
            return new DedupResult.New(fingerprint);
        }

        appendOccurrence(current, incident, now);
        return new DedupResult.Duplicate(fingerprint, current.incidentId(), current.occurrences());
    }

    public Optional<Entry> find(String fingerprint) {
        return Optional.ofNullable(entries.get(fingerprint));
    }

    /**
     * Drop entries whose window has lapsed.
     *
     * @return number of entries removed
     */
    public int evictExpired(Instant now) {
        int before = entries.size();
        entries.values().removeIf(entry -> isExpired(entry, now));
        return Math.max(0, before - entries.size());
    }

    /**
     * Drop entries pointing at incidents matching the predicate.
     *
     * @return number of entries removed
     */
    public int pruneIncidents(Predicate<String> incidentIdFilter) {
        int before = entries.size();
        entries.values().removeIf(entry -> incidentIdFilter.test(entry.incidentId()));
        return Math.max(0, before - entries.size());
    }

    public int size() {
        return entries.size();
    }

    public boolean isEnabled() {
        return enabled;
    }

    private boolean isExpired(Entry entry, Instant now) {
        return Duration.between(entry.lastSeenAt(), now).compareTo(window) > 0;
    }

    private void appendOccurrence(Entry entry, Incident duplicate, Instant now) {
        Incident.TimelineEvent event = Incident.TimelineEvent.builder()
                .timestamp(now)
                .type(Incident.TimelineEventType.DUPLICATE_MERGED)
                .description("Duplicate alert received (occurrence " + (entry.occurrences() + 1) + ")")
                .actor(ACTOR)
                .details(duplicate.getId() != null
                        ? Map.of("duplicateIncidentId", duplicate.getId())
                        : Map.of())
                .build();
        try {
            if (!incidentStore.appendTimelineEvent(entry.incidentId(), event)) {
                log.warn("Incident {} missing, occurrence not recorded on its timeline", entry.incidentId());
            }
        } catch (RuntimeException e) {
            log.warn("Failed to append occurrence to incident {}: {}", entry.incidentId(), e.getMessage(), e);
        }
    }

    /**
     * Index entry.
     *
     * @param occurrences repeats seen after the first sighting
     */
    public record Entry(String incidentId, Instant firstSeenAt, Instant lastSeenAt, long occurrences) {

        Entry seenAgain(Instant now) {
            return new Entry(incidentId, firstSeenAt, now, occurrences + 1);
        }
    }
}
