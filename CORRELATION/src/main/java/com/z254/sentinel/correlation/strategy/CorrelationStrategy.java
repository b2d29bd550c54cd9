package com.z254.sentinel.correlation.strategy;

import com.z254.sentinel.correlation.config.CorrelationProperties;
import com.z254.sentinel.correlation.domain.model.CorrelationType;
import com.z254.sentinel.correlation.domain.model.Incident;
import com.z254.sentinel.correlation.domain.model.Resource;
import com.z254.sentinel.correlation.topology.TopologyProvider;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Pairwise correlation scorers, evaluated in declaration order.
 * <p>
 * An empty result means the pair is out of the strategy's scope, which is distinct from a
 * score of zero. Present scores always lie in [0, 1].
 */
@Slf4j
public enum CorrelationStrategy {

    /**
     * Exponential decay over the creation-time gap, empty outside the temporal window.
     */
    TEMPORAL(CorrelationType.TEMPORAL) {
        @Override
        public OptionalDouble score(Incident a, Incident b, ScoringContext ctx) {
            OptionalDouble dt = secondsBetween(a.getCreatedAt(), b.getCreatedAt());
            if (dt.isEmpty() || dt.getAsDouble() > ctx.getProperties().getTemporalWindowSecs()) {
                return OptionalDouble.empty();
            }
            return OptionalDouble.of(clamp(Math.exp(-ctx.getTemporalDecay() * dt.getAsDouble())));
        }

        @Override
        public String describe(Incident a, Incident b, double score) {
            return String.format("Created %.0fs apart", secondsBetween(a.getCreatedAt(), b.getCreatedAt()).orElse(0));
        }
    },

    /**
     * Title and description similarity with small bonuses for equal severity and category.
     */
    PATTERN(CorrelationType.PATTERN) {
        @Override
        public OptionalDouble score(Incident a, Incident b, ScoringContext ctx) {
            CorrelationProperties props = ctx.getProperties();
            CorrelationProperties.Pattern pattern = props.getPattern();

            double titleSim = titleSimilarity(a.getTitle(), b.getTitle(), pattern);
            double descSim = TextSimilarity.jaccard(a.getDescription(), b.getDescription());
            double threshold = props.getPatternSimilarityThreshold();
            if (titleSim < threshold && descSim < threshold) {
                return OptionalDouble.empty();
            }

            double score = pattern.getTitleWeight() * titleSim + pattern.getDescriptionWeight() * descSim;
            if (a.getSeverity() != null && a.getSeverity() == b.getSeverity()) {
                score += pattern.getSeverityBonus();
            }
            if (a.getCategory() != null && a.getCategory().equals(b.getCategory())) {
                score += pattern.getCategoryBonus();
            }
            return OptionalDouble.of(clamp(score));
        }

        @Override
        public String describe(Incident a, Incident b, double score) {
            return String.format("Similar title and description (%.2f)", score);
        }
    },

    /**
     * Same originating source, decaying with the creation-time gap.
     */
    SOURCE(CorrelationType.SOURCE) {
        @Override
        public OptionalDouble score(Incident a, Incident b, ScoringContext ctx) {
            if (a.getSource() == null || !a.getSource().equals(b.getSource())) {
                return OptionalDouble.empty();
            }
            OptionalDouble dt = secondsBetween(a.getCreatedAt(), b.getCreatedAt());
            if (dt.isEmpty()) {
                return OptionalDouble.empty();
            }
            double weight = ctx.getProperties().getSource().getMatchWeight();
            return OptionalDouble.of(clamp(weight * Math.exp(-ctx.getSourceDecay() * dt.getAsDouble())));
        }

        @Override
        public String describe(Incident a, Incident b, double score) {
            return "Same source: " + a.getSource();
        }
    },

    /**
     * Identical fingerprints, typically a recurrence after the dedup window lapsed.
     */
    FINGERPRINT(CorrelationType.FINGERPRINT) {
        @Override
        public OptionalDouble score(Incident a, Incident b, ScoringContext ctx) {
            if (a.getFingerprint() == null || !a.getFingerprint().equals(b.getFingerprint())) {
                return OptionalDouble.empty();
            }
            return OptionalDouble.of(1.0);
        }

        @Override
        public String describe(Incident a, Incident b, double score) {
            return "Identical fingerprint";
        }
    },

    /**
     * Dependency distance between the affected resources.
     */
    TOPOLOGY(CorrelationType.TOPOLOGY) {
        @Override
        public OptionalDouble score(Incident a, Incident b, ScoringContext ctx) {
            Optional<TopologyProvider> provider = ctx.topology();
            String resourceA = resourceId(a);
            String resourceB = resourceId(b);
            if (provider.isEmpty() || resourceA == null || resourceB == null) {
                return OptionalDouble.empty();
            }

            Optional<Integer> hops;
            try {
                hops = provider.get().hops(resourceA, resourceB);
            } catch (RuntimeException e) {
                log.warn("Topology lookup failed for {} -> {}, skipping topology correlation: {}",
                        resourceA, resourceB, e.getMessage());
                return OptionalDouble.empty();
            }

            CorrelationProperties.Topology topology = ctx.getProperties().getTopology();
            if (hops == null || hops.isEmpty() || hops.get() < 0 || hops.get() > topology.getMaxHops()) {
                return OptionalDouble.empty();
            }
            return OptionalDouble.of(clamp(Math.pow(topology.getHopDecay(), hops.get())));
        }

        @Override
        public String describe(Incident a, Incident b, double score) {
            return "Dependent resources " + resourceId(a) + " and " + resourceId(b);
        }
    };

    private final CorrelationType type;

    CorrelationStrategy(CorrelationType type) {
        this.type = type;
    }

    public CorrelationType type() {
        return type;
    }

    public abstract OptionalDouble score(Incident a, Incident b, ScoringContext ctx);

    /**
     * Human readable reason for a record produced by this strategy.
     */
    public abstract String describe(Incident a, Incident b, double score);

    static double titleSimilarity(String a, String b, CorrelationProperties.Pattern pattern) {
        double jaccard = TextSimilarity.jaccard(a, b);
        if (jaccard >= pattern.getAmbiguityLow() && jaccard < pattern.getAmbiguityHigh()) {
            return (jaccard + TextSimilarity.levenshteinSimilarity(a, b)) / 2.0;
        }
        return jaccard;
    }

    static OptionalDouble secondsBetween(Instant a, Instant b) {
        if (a == null || b == null) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Math.abs(Duration.between(a, b).toMillis()) / 1000.0);
    }

    static double clamp(double score) {
        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    private static String resourceId(Incident incident) {
        Resource resource = incident.getResource();
        return resource != null && resource.id() != null && !resource.id().isBlank()
                ? resource.id()
                : null;
    }
}
