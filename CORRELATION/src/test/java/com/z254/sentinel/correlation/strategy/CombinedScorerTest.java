package com.z254.sentinel.correlation.strategy;

import com.z254.sentinel.correlation.config.CorrelationProperties;
import com.z254.sentinel.correlation.domain.model.Incident;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static com.z254.sentinel.correlation.support.TestIncidents.T0;
import static com.z254.sentinel.correlation.support.TestIncidents.incident;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CombinedScorerTest {

    private CorrelationProperties properties;
    private CombinedScorer scorer;

    @BeforeEach
    void setUp() {
        properties = new CorrelationProperties();
        scorer = new CombinedScorer(new ScoringContext(properties, null));
    }

    @Test
    void singleSignalIsNotBoosted() {
        Map<CorrelationStrategy, Double> signals = new EnumMap<>(CorrelationStrategy.class);
        signals.put(CorrelationStrategy.TEMPORAL, 0.4);

        assertThat(scorer.combine(signals).getAsDouble()).isCloseTo(0.4, within(1e-9));
    }

    @Test
    void weightsAreRenormalizedOverPresentSignals() {
        Map<CorrelationStrategy, Double> signals = new EnumMap<>(CorrelationStrategy.class);
        signals.put(CorrelationStrategy.TEMPORAL, 0.5);
        signals.put(CorrelationStrategy.SOURCE, 0.25);

        // (0.3 * 0.5 + 0.2 * 0.25) / 0.5 = 0.4, boosted by 1.2
        assertThat(scorer.combine(signals).getAsDouble()).isCloseTo(0.48, within(1e-9));
    }

    @Test
    void boostedScoreIsClampedToOne() {
        Map<CorrelationStrategy, Double> signals = new EnumMap<>(CorrelationStrategy.class);
        signals.put(CorrelationStrategy.TEMPORAL, 1.0);
        signals.put(CorrelationStrategy.FINGERPRINT, 1.0);
        signals.put(CorrelationStrategy.SOURCE, 0.95);

        assertThat(scorer.combine(signals).getAsDouble()).isEqualTo(1.0);
    }

    @Test
    void noSignalIsEmpty() {
        assertThat(scorer.combine(new EnumMap<>(CorrelationStrategy.class))).isEmpty();
    }

    @Test
    void disabledStrategiesDoNotContribute() {
        properties.getStrategies().getTemporal().setEnabled(false);
        Incident a = incident("a").source("datadog").createdAt(T0).build();
        Incident b = incident("b").source("datadog").createdAt(T0.plusSeconds(10)).build();

        CombinedScorer.Evaluation evaluation = scorer.evaluate(a, b);

        assertThat(evaluation.signals()).containsOnlyKeys(CorrelationStrategy.SOURCE);
    }

    @Test
    void evaluationDescribesSignals() {
        Incident a = incident("a").source("datadog").createdAt(T0).build();
        Incident b = incident("b").source("datadog").createdAt(T0.plusSeconds(15)).build();

        CombinedScorer.Evaluation evaluation = scorer.evaluate(a, b);

        assertThat(evaluation.signals()).containsOnlyKeys(CorrelationStrategy.TEMPORAL, CorrelationStrategy.SOURCE);
        assertThat(evaluation.combined().getAsDouble()).isEqualTo(1.0);
        assertThat(evaluation.describe()).startsWith("Combined[").contains("temporal=").contains("source=");
    }
}
