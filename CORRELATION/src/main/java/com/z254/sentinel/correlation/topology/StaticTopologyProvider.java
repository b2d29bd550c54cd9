package com.z254.sentinel.correlation.topology;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Topology provider backed by a fixed, undirected dependency map.
 * <p>
 * Distances are found by breadth-first search, bounded by {@code maxDepth}.
 */
public class StaticTopologyProvider implements TopologyProvider {

    private final Map<String, Set<String>> adjacency = new HashMap<>();
    private final int maxDepth;

    public StaticTopologyProvider(Map<String, List<String>> edges, int maxDepth) {
        this.maxDepth = maxDepth;
        if (edges != null) {
            edges.forEach((from, targets) -> {
                if (targets == null) {
                    return;
                }
                for (String to : targets) {
                    link(from, to);
                }
            });
        }
    }

    public static StaticTopologyProvider empty() {
        return new StaticTopologyProvider(Collections.emptyMap(), 0);
    }

    @Override
    public Optional<Integer> hops(String resourceA, String resourceB) {
        if (resourceA == null || resourceB == null) {
            return Optional.empty();
        }
        if (resourceA.equals(resourceB)) {
            return Optional.of(0);
        }
        if (!adjacency.containsKey(resourceA) || !adjacency.containsKey(resourceB)) {
            return Optional.empty();
        }

        Set<String> visited = new HashSet<>();
        Deque<String> frontier = new ArrayDeque<>();
        frontier.add(resourceA);
        visited.add(resourceA);
        int depth = 0;

        while (!frontier.isEmpty() && depth < maxDepth) {
            depth++;
            int levelSize = frontier.size();
            for (int i = 0; i < levelSize; i++) {
                String current = frontier.poll();
                for (String neighbour : adjacency.getOrDefault(current, Collections.emptySet())) {
                    if (neighbour.equals(resourceB)) {
                        return Optional.of(depth);
                    }
                    if (visited.add(neighbour)) {
                        frontier.add(neighbour);
                    }
                }
            }
        }
        return Optional.empty();
    }

    public int resourceCount() {
        return adjacency.size();
    }

    private void link(String a, String b) {
        adjacency.computeIfAbsent(a, k -> new HashSet<>()).add(b);
        adjacency.computeIfAbsent(b, k -> new HashSet<>()).add(a);
    }
}
