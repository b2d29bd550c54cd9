package com.z254.sentinel.correlation.strategy;

import com.z254.sentinel.correlation.domain.model.Incident;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * Runs every enabled strategy over a pair and folds the present signals into one score.
 * <p>
 * The combined score is the weight-renormalized mean of the present signals, boosted when
 * more than one strategy fired, and clamped to [0, 1].
 */
public class CombinedScorer {

    private final ScoringContext context;

    public CombinedScorer(ScoringContext context) {
        this.context = context;
    }

    public Evaluation evaluate(Incident a, Incident b) {
        Map<CorrelationStrategy, Double> signals = new EnumMap<>(CorrelationStrategy.class);
        for (CorrelationStrategy strategy : CorrelationStrategy.values()) {
            if (!context.isEnabled(strategy)) {
                continue;
            }
            OptionalDouble score = strategy.score(a, b, context);
            if (score.isPresent()) {
                signals.put(strategy, score.getAsDouble());
            }
        }
        return new Evaluation(Collections.unmodifiableMap(signals), combine(signals));
    }

    OptionalDouble combine(Map<CorrelationStrategy, Double> signals) {
        if (signals.isEmpty()) {
            return OptionalDouble.empty();
        }
        double weighted = 0.0;
        double totalWeight = 0.0;
        for (Map.Entry<CorrelationStrategy, Double> signal : signals.entrySet()) {
            double weight = context.weightOf(signal.getKey());
            weighted += weight * signal.getValue();
            totalWeight += weight;
        }
        double score;
        if (totalWeight > 0.0) {
            score = weighted / totalWeight;
        } else {
            // all present signals carry zero weight: fall back to a plain mean
            score = signals.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        }
        if (signals.size() > 1) {
            score *= context.getProperties().getMultiSignalBoost();
        }
        return OptionalDouble.of(CorrelationStrategy.clamp(score));
    }

    public ScoringContext getContext() {
        return context;
    }

    /**
     * Per-strategy signals and the combined score for one pair.
     */
    public record Evaluation(Map<CorrelationStrategy, Double> signals, OptionalDouble combined) {

        public boolean hasSignal() {
            return combined.isPresent();
        }

        public String describe() {
            return signals.entrySet().stream()
                    .map(e -> e.getKey().name().toLowerCase() + "=" + String.format("%.2f", e.getValue()))
                    .collect(Collectors.joining(", ", "Combined[", "]"));
        }
    }
}
