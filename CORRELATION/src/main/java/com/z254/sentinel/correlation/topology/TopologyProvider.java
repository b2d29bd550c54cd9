package com.z254.sentinel.correlation.topology;

import java.util.Optional;

/**
 * Source of resource dependency distances.
 */
@FunctionalInterface
public interface TopologyProvider {

    /**
     * Number of dependency hops between two resources.
     *
     * @return empty when the resources are not connected or unknown
     */
    Optional<Integer> hops(String resourceA, String resourceB);
}
