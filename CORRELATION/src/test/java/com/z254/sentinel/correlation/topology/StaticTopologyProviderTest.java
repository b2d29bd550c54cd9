package com.z254.sentinel.correlation.topology;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StaticTopologyProviderTest {

    private final StaticTopologyProvider provider = new StaticTopologyProvider(Map.of(
            "lb", List.of("api"),
            "api", List.of("orders", "users"),
            "orders", List.of("orders-db"),
            "orders-db", List.of("backup")), 3);

    @Test
    void edgesAreUndirected() {
        assertThat(provider.hops("api", "lb")).contains(1);
        assertThat(provider.hops("lb", "api")).contains(1);
    }

    @Test
    void findsShortestDistance() {
        assertThat(provider.hops("users", "orders")).contains(2);
        assertThat(provider.hops("lb", "orders-db")).contains(3);
    }

    @Test
    void searchIsBoundedByMaxDepth() {
        assertThat(provider.hops("lb", "backup")).isEmpty();
    }

    @Test
    void sameResourceIsZeroHops() {
        assertThat(provider.hops("orders", "orders")).contains(0);
    }

    @Test
    void unknownOrMissingResourcesAreUnreachable() {
        assertThat(provider.hops("orders", "billing")).isEmpty();
        assertThat(provider.hops(null, "orders")).isEmpty();
        assertThat(StaticTopologyProvider.empty().hops("a", "b")).isEmpty();
        assertThat(provider.resourceCount()).isEqualTo(6);
    }
}
