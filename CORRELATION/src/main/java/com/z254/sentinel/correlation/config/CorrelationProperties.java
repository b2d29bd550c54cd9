package com.z254.sentinel.correlation.config;

import com.z254.sentinel.correlation.exception.InvalidConfigException;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the correlation engine.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>Correlation thresholds and group limits</li>
 *     <li>Per-strategy toggles, minimum scores and combined weights</li>
 *     <li>Deduplication window</li>
 *     <li>Maintenance schedule and group retention</li>
 * </ul>
 * Range checks are performed by {@link #validate()} when the engine is built.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "correlation")
public class CorrelationProperties {

    /** Master switch for correlation analysis (deduplication is controlled separately) */
    private boolean enabled = true;

    /** Time window for temporal correlation */
    private long temporalWindowSecs = 300;

    /** Temporal score at the window boundary; fixes the exponential decay rate */
    private double temporalFloor = 0.05;

    /** Minimum score for incidents to be considered correlated */
    private double minCorrelationScore = 0.5;

    /** Maximum incidents per group */
    private int maxGroupSize = 100;

    /** Pattern prefilter: title and description similarity both below this skip the pair */
    private double patternSimilarityThreshold = 0.7;

    /** Union existing groups when compatible */
    private boolean autoMergeGroups = true;

    /** Minimum compatibility to union two groups */
    private double mergeThreshold = 0.8;

    /** Multiplier applied when more than one strategy signals */
    private double multiSignalBoost = 1.2;

    @NotNull
    private final Strategies strategies = new Strategies();
    @NotNull
    private final Pattern pattern = new Pattern();
    @NotNull
    private final Source source = new Source();
    @NotNull
    private final Topology topology = new Topology();
    @NotNull
    private final Dedup dedup = new Dedup();
    @NotNull
    private final Candidates candidates = new Candidates();
    @NotNull
    private final Maintenance maintenance = new Maintenance();
    @NotNull
    private final Health health = new Health();

    /**
     * Per-strategy settings.
     */
    @Data
    public static class Strategies {
        private final Strategy temporal = new Strategy(true, 0.3);
        private final Strategy pattern = new Strategy(true, 0.3);
        private final Strategy source = new Strategy(true, 0.2);
        private final Strategy fingerprint = new Strategy(true, 0.2);
        private final Strategy topology = new Strategy(false, 0.2);
    }

    @Data
    public static class Strategy {
        private boolean enabled;

        /** Minimum score for a record of this strategy; falls back to the global minimum when unset */
        private Double minScore;

        /** Weight in the combined score */
        private double weight;

        public Strategy() {
        }

        public Strategy(boolean enabled, double weight) {
            this.enabled = enabled;
            this.weight = weight;
        }
    }

    /**
     * Pattern strategy tuning.
     */
    @Data
    public static class Pattern {
        private double titleWeight = 0.6;
        private double descriptionWeight = 0.3;
        private double severityBonus = 0.05;
        private double categoryBonus = 0.05;

        /** Jaccard values in [ambiguityLow, ambiguityHigh) are refined with Levenshtein similarity */
        private double ambiguityLow = 0.3;
        private double ambiguityHigh = 0.7;
    }

    /**
     * Source strategy tuning.
     */
    @Data
    public static class Source {
        private double matchWeight = 1.0;
        private long decayWindowSecs = 3600;
        private double floor = 0.05;
    }

    /**
     * Topology strategy tuning and the static dependency map.
     */
    @Data
    public static class Topology {
        private int maxHops = 3;
        private double hopDecay = 0.7;

        /** How far back candidates are fetched for topology correlation */
        private long lookbackSecs = 300;

        /** Undirected dependency edges: resource id to neighbouring resource ids */
        private Map<String, List<String>> edges = new HashMap<>();
    }

    /**
     * Deduplication settings.
     */
    @Data
    public static class Dedup {
        private boolean enabled = true;

        /** Window in which a repeated fingerprint is a duplicate */
        private long windowSecs = 300;
    }

    /**
     * Candidate set bounds.
     */
    @Data
    public static class Candidates {
        private int maxResults = 500;

        /** Only consider candidates sharing the source or category of the analyzed incident */
        private boolean sameSourceOrCategoryOnly = false;
    }

    /**
     * Group maintenance schedule.
     */
    @Data
    public static class Maintenance {
        private boolean enabled = true;
        private Duration interval = Duration.ofSeconds(60);
        private Duration stabilizeAfter = Duration.ofHours(1);
        private Duration archiveAfter = Duration.ofDays(7);
        private Duration retention = Duration.ofDays(30);
        private Duration shutdownTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Health {
        private int maxConsecutiveFailures = 3;
    }

    /**
     * Fail fast on values the engine cannot work with.
     *
     * @throws InvalidConfigException listing every violation
     */
    public void validate() {
        List<String> violations = new ArrayList<>();

        requireUnit(violations, "min-correlation-score", minCorrelationScore);
        requireUnit(violations, "pattern-similarity-threshold", patternSimilarityThreshold);
        requireUnit(violations, "merge-threshold", mergeThreshold);
        requireOpenUnit(violations, "temporal-floor", temporalFloor);
        requireOpenUnit(violations, "source.floor", source.getFloor());
        requireUnit(violations, "source.match-weight", source.getMatchWeight());
        requireUnit(violations, "pattern.severity-bonus", pattern.getSeverityBonus());
        requireUnit(violations, "pattern.category-bonus", pattern.getCategoryBonus());
        requireUnit(violations, "pattern.ambiguity-low", pattern.getAmbiguityLow());
        requireUnit(violations, "pattern.ambiguity-high", pattern.getAmbiguityHigh());
        requireUnit(violations, "topology.hop-decay", topology.getHopDecay());

        requireStrategy(violations, "temporal", strategies.getTemporal());
        requireStrategy(violations, "pattern", strategies.getPattern());
        requireStrategy(violations, "source", strategies.getSource());
        requireStrategy(violations, "fingerprint", strategies.getFingerprint());
        requireStrategy(violations, "topology", strategies.getTopology());

        if (maxGroupSize <= 0) {
            violations.add("max-group-size must be positive, was " + maxGroupSize);
        }
        if (temporalWindowSecs <= 0) {
            violations.add("temporal-window-secs must be positive, was " + temporalWindowSecs);
        }
        if (source.getDecayWindowSecs() <= 0) {
            violations.add("source.decay-window-secs must be positive, was " + source.getDecayWindowSecs());
        }
        if (dedup.getWindowSecs() < 0) {
            violations.add("dedup.window-secs must not be negative, was " + dedup.getWindowSecs());
        }
        if (pattern.getAmbiguityLow() > pattern.getAmbiguityHigh()) {
            violations.add("pattern.ambiguity-low must not exceed pattern.ambiguity-high, was "
                    + pattern.getAmbiguityLow() + " > " + pattern.getAmbiguityHigh());
        }
        if (multiSignalBoost < 1.0) {
            violations.add("multi-signal-boost must be at least 1.0, was " + multiSignalBoost);
        }
        if (topology.getMaxHops() < 0) {
            violations.add("topology.max-hops must not be negative, was " + topology.getMaxHops());
        }
        if (candidates.getMaxResults() <= 0) {
            violations.add("candidates.max-results must be positive, was " + candidates.getMaxResults());
        }
        if (maintenance.getInterval() == null || maintenance.getInterval().isNegative()
                || maintenance.getInterval().isZero()) {
            violations.add("maintenance.interval must be positive");
        }

        if (!violations.isEmpty()) {
            throw new InvalidConfigException(violations);
        }
    }

    /**
     * Effective minimum score for a strategy record.
     */
    public double minScoreFor(Strategy strategy) {
        return strategy.getMinScore() != null ? strategy.getMinScore() : minCorrelationScore;
    }

    private static void requireStrategy(List<String> violations, String name, Strategy strategy) {
        if (strategy.getMinScore() != null) {
            requireUnit(violations, "strategies." + name + ".min-score", strategy.getMinScore());
        }
        if (strategy.getWeight() < 0.0) {
            violations.add("strategies." + name + ".weight must not be negative, was " + strategy.getWeight());
        }
    }

    private static void requireUnit(List<String> violations, String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            violations.add(name + " must be within [0, 1], was " + value);
        }
    }

    private static void requireOpenUnit(List<String> violations, String name, double value) {
        if (Double.isNaN(value) || value <= 0.0 || value >= 1.0) {
            violations.add(name + " must be within (0, 1), was " + value);
        }
    }
}
