package com.z254.sentinel.correlation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * SENTINEL Correlation - incident deduplication and correlation engine.
 *
 * <p>For every incoming incident the engine decides:
 * <ul>
 *   <li>Deduplication - whether it repeats an incident seen inside the dedup window</li>
 *   <li>Correlation - which recent incidents it relates to, and by which signals</li>
 *   <li>Grouping - which correlation group it joins, unioning groups when they converge</li>
 * </ul>
 *
 * <p>A background maintenance task ages groups through ACTIVE, STABLE, RESOLVED and ARCHIVED.
 * Transports (REST, messaging) call {@link com.z254.sentinel.correlation.engine.CorrelationEngine}
 * directly and are not part of this service.
 */
@SpringBootApplication
public class CorrelationApplication {

    public static void main(String[] args) {
        SpringApplication.run(CorrelationApplication.class, args);
    }
}
