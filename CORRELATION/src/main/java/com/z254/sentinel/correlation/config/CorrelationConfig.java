package com.z254.sentinel.correlation.config;

import com.z254.sentinel.correlation.domain.repository.InMemoryIncidentStore;
import com.z254.sentinel.correlation.domain.repository.IncidentStore;
import com.z254.sentinel.correlation.engine.CorrelationEngine;
import com.z254.sentinel.correlation.maintenance.MaintenanceScheduler;
import com.z254.sentinel.correlation.observability.CorrelationMetrics;
import com.z254.sentinel.correlation.observability.CorrelationStructuredLogger;
import com.z254.sentinel.correlation.topology.StaticTopologyProvider;
import com.z254.sentinel.correlation.topology.TopologyProvider;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the correlation engine and its collaborators.
 * <p>
 * The incident store and topology provider fall back to in-memory implementations when
 * no other bean is supplied.
 */
@Configuration
@EnableConfigurationProperties(CorrelationProperties.class)
public class CorrelationConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock correlationClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(IncidentStore.class)
    public InMemoryIncidentStore incidentStore() {
        return new InMemoryIncidentStore();
    }

    @Bean
    @ConditionalOnMissingBean(TopologyProvider.class)
    public TopologyProvider topologyProvider(CorrelationProperties properties) {
        CorrelationProperties.Topology topology = properties.getTopology();
        return new StaticTopologyProvider(topology.getEdges(), topology.getMaxHops());
    }

    @Bean
    public CorrelationEngine correlationEngine(CorrelationProperties properties,
                                               IncidentStore incidentStore,
                                               ObjectProvider<TopologyProvider> topologyProvider,
                                               Clock clock,
                                               CorrelationMetrics metrics,
                                               CorrelationStructuredLogger structuredLogger) {
        return new CorrelationEngine(properties, incidentStore, topologyProvider.getIfAvailable(), clock,
                metrics, structuredLogger);
    }

    @Bean
    public MaintenanceScheduler maintenanceScheduler(CorrelationEngine engine,
                                                     CorrelationProperties properties,
                                                     CorrelationMetrics metrics) {
        return new MaintenanceScheduler(engine.getMaintenance(), properties.getMaintenance(), metrics);
    }
}
