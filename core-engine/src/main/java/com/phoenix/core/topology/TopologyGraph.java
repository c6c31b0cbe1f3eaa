package com.phoenix.core.topology;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable downstream adjacency derived from a topology's edges.
 *
 * <p>
 * Only outgoing edges are indexed. Neighbour order follows edge declaration
 * order.
 * </p>
 *
 * @since 1.0.0
 */
public final class TopologyGraph {

    private final Map<String, List<String>> downstream;

    private TopologyGraph(Map<String, List<String>> downstream) {
        this.downstream = downstream;
    }

    /**
     * @param topology a validated topology
     * @return the downstream adjacency of {@code topology}
     */
    public static TopologyGraph of(Topology topology) {
        Objects.requireNonNull(topology, "topology must not be null");
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        for (TopologyEdge edge : topology.getEdges()) {
            adjacency.computeIfAbsent(edge.getFrom(), k -> new ArrayList<>()).add(edge.getTo());
        }
        Map<String, List<String>> frozen = new LinkedHashMap<>();
        adjacency.forEach((node, next) -> frozen.put(node, Collections.unmodifiableList(next)));
        return new TopologyGraph(Collections.unmodifiableMap(frozen));
    }

    /**
     * @param component node id
     * @return nodes directly fed by {@code component}; empty for leaves and unknown ids
     */
    public List<String> downstreamOf(String component) {
        return downstream.getOrDefault(component, Collections.emptyList());
    }

    @Override
    public String toString() {
        return "TopologyGraph" + downstream;
    }
}
