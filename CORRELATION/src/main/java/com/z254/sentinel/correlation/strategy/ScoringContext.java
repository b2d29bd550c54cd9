package com.z254.sentinel.correlation.strategy;

import com.z254.sentinel.correlation.config.CorrelationProperties;
import com.z254.sentinel.correlation.topology.TopologyProvider;
import lombok.Getter;

import java.util.Optional;

/**
 * Validated settings and collaborators shared by all strategies. Decay rates are derived once.
 */
@Getter
public class ScoringContext {

    private final CorrelationProperties properties;
    private final TopologyProvider topologyProvider;
    private final double temporalDecay;
    private final double sourceDecay;

    public ScoringContext(CorrelationProperties properties, TopologyProvider topologyProvider) {
        this.properties = properties;
        this.topologyProvider = topologyProvider;
        this.temporalDecay = -Math.log(properties.getTemporalFloor()) / properties.getTemporalWindowSecs();
        this.sourceDecay = -Math.log(properties.getSource().getFloor())
                / properties.getSource().getDecayWindowSecs();
    }

    public Optional<TopologyProvider> topology() {
        return Optional.ofNullable(topologyProvider);
    }

    public CorrelationProperties.Strategy settingsFor(CorrelationStrategy strategy) {
        CorrelationProperties.Strategies strategies = properties.getStrategies();
        return switch (strategy) {
            case TEMPORAL -> strategies.getTemporal();
            case PATTERN -> strategies.getPattern();
            case SOURCE -> strategies.getSource();
            case FINGERPRINT -> strategies.getFingerprint();
            case TOPOLOGY -> strategies.getTopology();
        };
    }

    public boolean isEnabled(CorrelationStrategy strategy) {
        return settingsFor(strategy).isEnabled();
    }

    public double weightOf(CorrelationStrategy strategy) {
        return settingsFor(strategy).getWeight();
    }

    public double minScoreOf(CorrelationStrategy strategy) {
        return properties.minScoreFor(settingsFor(strategy));
    }
}
