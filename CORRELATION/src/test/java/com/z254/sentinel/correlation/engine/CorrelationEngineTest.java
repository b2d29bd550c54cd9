package com.z254.sentinel.correlation.engine;

import com.z254.sentinel.correlation.config.CorrelationProperties;
import com.z254.sentinel.correlation.dedup.DedupResult;
import com.z254.sentinel.correlation.domain.model.CorrelationRecord;
import com.z254.sentinel.correlation.domain.model.CorrelationType;
import com.z254.sentinel.correlation.domain.model.GroupStatus;
import com.z254.sentinel.correlation.domain.model.Incident;
import com.z254.sentinel.correlation.domain.model.Resource;
import com.z254.sentinel.correlation.domain.repository.InMemoryIncidentStore;
import com.z254.sentinel.correlation.exception.GroupNotFoundException;
import com.z254.sentinel.correlation.exception.IncidentNotFoundException;
import com.z254.sentinel.correlation.exception.InvalidConfigException;
import com.z254.sentinel.correlation.group.CorrelationGroupSummary;
import com.z254.sentinel.correlation.group.CorrelationGroupView;
import com.z254.sentinel.correlation.group.GroupMutationResult;
import com.z254.sentinel.correlation.observability.CorrelationMetrics;
import com.z254.sentinel.correlation.observability.CorrelationStructuredLogger;
import com.z254.sentinel.correlation.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.z254.sentinel.correlation.support.TestIncidents.T0;
import static com.z254.sentinel.correlation.support.TestIncidents.incident;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CorrelationEngineTest {

    private CorrelationProperties properties;
    private InMemoryIncidentStore store;
    private MutableClock clock;
    private SimpleMeterRegistry registry;
    private CorrelationEngine engine;

    @BeforeEach
    void setUp() {
        properties = new CorrelationProperties();
        store = new InMemoryIncidentStore();
        clock = new MutableClock(T0);
        registry = new SimpleMeterRegistry();
        engine = newEngine();
    }

    private CorrelationEngine newEngine() {
        return new CorrelationEngine(properties, store, null, clock,
                new CorrelationMetrics(registry), new CorrelationStructuredLogger());
    }

    private AnalysisResult submit(Incident incident) {
        store.save(incident);
        return engine.analyze(incident);
    }

    @Nested
    @DisplayName("analyze")
    class Analyze {

        @Test
        @DisplayName("connection pool incidents 15s apart from one source end up grouped")
        void databaseConnectionPoolScenario() {
            Instant nine = Instant.parse("2026-03-01T09:00:00Z");
            clock.set(nine);
            Incident a = incident("db-a").title("Database connection pool exhausted")
                    .source("datadog").createdAt(nine).build();
            Incident b = incident("db-b").title("Database connection pool full")
                    .source("datadog").createdAt(nine.plusSeconds(15)).build();

            submit(a);
            clock.set(nine.plusSeconds(15));
            AnalysisResult result = submit(b);

            List<CorrelationRecord> combined = result.correlationsOfType(CorrelationType.COMBINED);
            assertThat(combined).hasSize(1);
            assertThat(combined.get(0).score()).isGreaterThanOrEqualTo(0.5);
            assertThat(result.correlationsOfType(CorrelationType.TEMPORAL)).hasSize(1);
            assertThat(result.correlationsOfType(CorrelationType.SOURCE)).hasSize(1);

            CorrelationGroupView group = engine.getGroup("db-a").orElseThrow();
            assertThat(result.groupId()).isEqualTo(group.id());
            assertThat(group.members()).containsExactlyInAnyOrder("db-a", "db-b");
            assertThat(group.aggregateScore()).isGreaterThanOrEqualTo(0.5);
            assertThat(group.correlations()).isNotEmpty();
        }

        @Test
        @DisplayName("incidents twenty minutes apart do not correlate temporally")
        void temporalOutOfWindowScenario() {
            Incident first = incident("early").createdAt(T0).resolvedAt(T0.plus(Duration.ofMinutes(10))).build();
            Incident second = incident("late").createdAt(T0.plus(Duration.ofMinutes(20)))
                    .resolvedAt(T0.plus(Duration.ofMinutes(25))).build();

            submit(first);
            clock.advance(Duration.ofMinutes(20));
            AnalysisResult result = submit(second);

            assertThat(result.correlationsOfType(CorrelationType.TEMPORAL)).isEmpty();
            assertThat(engine.getCorrelations("early")).noneMatch(r -> r.type() == CorrelationType.TEMPORAL);
        }

        @Test
        void missingFingerprintIsComputed() {
            Incident incident = incident("fp").build();

            AnalysisResult result = submit(incident);

            assertThat(incident.getFingerprint()).isNotBlank();
            assertThat(result.dedup().fingerprint()).isEqualTo(incident.getFingerprint());
        }

        @Test
        void perStrategyMinimumFiltersIndividualRecordsOnly() {
            properties.getStrategies().getSource().setMinScore(0.999);
            engine = newEngine();

            submit(incident("s-1").source("datadog").createdAt(T0).build());
            AnalysisResult result = submit(incident("s-2").source("datadog").createdAt(T0.plusSeconds(15)).build());

            assertThat(result.correlationsOfType(CorrelationType.SOURCE)).isEmpty();
            assertThat(result.correlationsOfType(CorrelationType.COMBINED)).hasSize(1);
        }

        @Test
        void candidatesCanBeNarrowedToSourceOrCategory() {
            properties.getCandidates().setSameSourceOrCategoryOnly(true);
            engine = newEngine();

            submit(incident("n-1").source("s1").category("c1").createdAt(T0).build());
            AnalysisResult result = submit(incident("n-2").source("s2").category("c2")
                    .createdAt(T0.plusSeconds(5)).build());

            assertThat(result.correlations()).isEmpty();
            assertThat(result.group()).isEmpty();
        }

        @Test
        void disabledCorrelationStillDeduplicates() {
            properties.setEnabled(false);
            engine = newEngine();
            Incident alert = incident("d-1").title("Disk full").build();

            submit(alert);
            AnalysisResult close = submit(incident("d-2").title("Disk full").resource(alert.getResource())
                    .source(alert.getSource()).createdAt(T0.plusSeconds(1)).build());
            AnalysisResult other = submit(incident("d-3").createdAt(T0.plusSeconds(1)).build());

            assertThat(close.isDuplicate()).isTrue();
            assertThat(other.correlations()).isEmpty();
            assertThat(engine.getStats().totalGroups()).isZero();
        }

        @Test
        void analyzedIncidentsAreCounted() {
            submit(incident("m-1").build());

            assertThat(registry.get("sentinel.correlation.incidents.analyzed").counter().count()).isEqualTo(1.0);
            assertThat(registry.get("sentinel.correlation.analysis.latency").timer().count()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("deduplication")
    class Deduplication {

        private Incident alert(String id) {
            return incident(id).title("Replica lag high").source("prometheus")
                    .resource(Resource.of("database", "replica-1")).createdAt(clock.instant()).build();
        }

        @Test
        @DisplayName("N submissions inside the window yield one incident with N-1 occurrences")
        void repeatedAlertIsFolded() {
            Incident original = alert("r-1");
            AnalysisResult first = submit(original);
            assertThat(first.isDuplicate()).isFalse();

            AnalysisResult last = null;
            for (int i = 2; i <= 4; i++) {
                clock.advance(Duration.ofSeconds(60));
                last = engine.analyze(alert("r-" + i));
            }

            assertThat(last.dedup()).isInstanceOfSatisfying(DedupResult.Duplicate.class, d -> {
                assertThat(d.existingIncidentId()).isEqualTo("r-1");
                assertThat(d.occurrences()).isEqualTo(3);
            });
            assertThat(last.correlations()).isEmpty();
            assertThat(store.getIncident("r-1").orElseThrow().getTimeline())
                    .filteredOn(e -> e.getType() == Incident.TimelineEventType.DUPLICATE_MERGED)
                    .hasSize(3);
            assertThat(registry.get("sentinel.correlation.dedup.duplicates").counter().count()).isEqualTo(3.0);
        }

        @Test
        void submissionAfterWindowIsNew() {
            submit(alert("r-1"));
            clock.advance(Duration.ofSeconds(properties.getDedup().getWindowSecs() + 1));

            AnalysisResult later = submit(alert("r-2"));

            assertThat(later.isDuplicate()).isFalse();
        }
    }

    @Nested
    @DisplayName("manualCorrelate")
    class ManualCorrelate {

        @Test
        void linksDistantIncidentsWithFullScore() {
            store.save(incident("m-a").createdAt(T0).build());
            store.save(incident("m-b").createdAt(T0.plus(Duration.ofDays(3))).build());

            CorrelationRecord record = engine.manualCorrelate(List.of("m-a", "m-b"), "same outage");

            assertThat(record.type()).isEqualTo(CorrelationType.MANUAL);
            assertThat(record.score()).isEqualTo(1.0);
            assertThat(record.reason()).isEqualTo("same outage");
            assertThat(engine.getGroup("m-a").orElseThrow().members()).containsExactlyInAnyOrder("m-a", "m-b");
        }

        @Test
        void anchorsEveryIdToTheFirst() {
            for (String id : List.of("x", "y", "z")) {
                store.save(incident(id).build());
            }

            CorrelationRecord record = engine.manualCorrelate(List.of("x", "y", "z", "y"), null);

            assertThat(record.involves("x")).isTrue();
            assertThat(record.involves("y")).isTrue();
            assertThat(record.reason()).isEqualTo(CorrelationEngine.DEFAULT_MANUAL_REASON);
            assertThat(engine.getGroup("z").orElseThrow().size()).isEqualTo(3);
            assertThat(engine.getCorrelations("x")).hasSize(2);
        }

        @Test
        void unknownIncidentFailsWithoutMutation() {
            store.save(incident("known").build());

            assertThatThrownBy(() -> engine.manualCorrelate(List.of("known", "ghost"), "r"))
                    .isInstanceOfSatisfying(IncidentNotFoundException.class,
                            e -> assertThat(e.getIncidentIds()).containsExactly("ghost"));
            assertThat(engine.getStats().totalGroups()).isZero();
            assertThat(engine.getCorrelations("known")).isEmpty();
        }

        @Test
        void needsTwoDistinctIncidents() {
            store.save(incident("solo").build());

            assertThatThrownBy(() -> engine.manualCorrelate(List.of("solo", "solo"), "r"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("groups and stats")
    class GroupsAndStats {

        @Test
        void resolveAndListGroups() {
            store.save(incident("g-1").build());
            store.save(incident("g-2").build());
            engine.manualCorrelate(List.of("g-1", "g-2"), "r");
            String groupId = engine.getGroup("g-1").orElseThrow().id();

            engine.resolveGroup(groupId);
            engine.resolveGroup(groupId);

            assertThat(engine.getGroupById(groupId)).get()
                    .extracting(CorrelationGroupView::status).isEqualTo(GroupStatus.RESOLVED);
            assertThat(engine.listGroups(Set.of(GroupStatus.ACTIVE))).isEmpty();
            assertThat(engine.listGroups(Set.of())).extracting(CorrelationGroupSummary::id).containsExactly(groupId);
            assertThatThrownBy(() -> engine.resolveGroup("nope")).isInstanceOf(GroupNotFoundException.class);
        }

        @Test
        void statsReflectEngineState() {
            submit(incident("st-1").source("datadog").createdAt(T0).build());
            submit(incident("st-2").source("datadog").createdAt(T0.plusSeconds(10)).build());

            CorrelationStats stats = engine.getStats();

            assertThat(stats.totalGroups()).isEqualTo(1);
            assertThat(stats.activeGroups()).isEqualTo(1);
            assertThat(stats.mappedIncidents()).isEqualTo(2);
            assertThat(stats.totalCorrelations()).isGreaterThanOrEqualTo(1);
            assertThat(stats.dedupEntries()).isEqualTo(2);
        }
    }

    @Test
    void invalidConfigurationFailsConstruction() {
        properties.setMaxGroupSize(0);

        assertThatThrownBy(this::newEngine).isInstanceOf(InvalidConfigException.class);
    }

    @Test
    @DisplayName("concurrent analysis of unrelated pairs builds one group per pair")
    void concurrentAnalysisOnDisjointPairs() throws Exception {
        int pairs = 20;
        List<Incident> incidents = new ArrayList<>();
        for (int p = 0; p < pairs; p++) {
            Instant at = T0.plus(Duration.ofHours(p));
            incidents.add(store.save(incident("p" + p + "-a").source("src-" + p).createdAt(at).build()));
            incidents.add(store.save(incident("p" + p + "-b").source("src-" + p).createdAt(at.plusSeconds(10)).build()));
        }

        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<AnalysisResult>> futures = new ArrayList<>();
        try {
            for (Incident incident : incidents) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return engine.analyze(incident);
                }));
            }
            start.countDown();
            for (Future<AnalysisResult> future : futures) {
                assertThat(future.get(10, TimeUnit.SECONDS).mutations())
                        .noneMatch(m -> m.outcome() == GroupMutationResult.Outcome.GROUP_FULL);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(engine.getStats().totalGroups()).isEqualTo(pairs);
        for (int p = 0; p < pairs; p++) {
            assertThat(engine.getGroup("p" + p + "-a").orElseThrow().members())
                    .containsExactlyInAnyOrder("p" + p + "-a", "p" + p + "-b");
        }
    }
}
