package com.phoenix.core.topology;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Parsed topology: component nodes and the directed edges between them.
 *
 * <p>
 * Expected JSON structure:
 * </p>
 *
 * <pre>
 * {
 *   "nodes": [ { "id": "router-edge" }, { "id": "payment-service", "critical": true } ],
 *   "edges": [ { "from": "router-edge", "to": "payment-service" } ]
 * }
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading. The decision engine assumes a
 * validated topology and never re-checks it.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Topology implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<TopologyNode> nodes;
    private List<TopologyEdge> edges;

    /** No-arg constructor required by Jackson. */
    public Topology() {
    }

    public Topology(List<TopologyNode> nodes, List<TopologyEdge> edges) {
        setNodes(nodes);
        setEdges(edges);
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Check that nodes and edges are present, node ids are unique and
     * non-blank, and every edge references declared nodes.
     *
     * <p>
     * All problems are collected and reported in a single exception.
     * </p>
     *
     * @throws IllegalStateException if the topology is malformed
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (nodes == null) {
            errors.add("Topology 'nodes' is required");
        }
        if (edges == null) {
            errors.add("Topology 'edges' is required");
        }

        Set<String> ids = new HashSet<>();
        if (nodes != null) {
            for (int i = 0; i < nodes.size(); i++) {
                TopologyNode node = nodes.get(i);
                if (node == null || node.getId() == null || node.getId().isBlank()) {
                    errors.add("Node at index " + i + " requires 'id'");
                } else if (!ids.add(node.getId())) {
                    errors.add("Duplicate node id: '" + node.getId() + "'");
                }
            }
        }

        if (edges != null) {
            for (int i = 0; i < edges.size(); i++) {
                TopologyEdge edge = edges.get(i);
                if (edge == null) {
                    errors.add("Edge at index " + i + " is null");
                    continue;
                }
                checkEndpoint(errors, i, "from", edge.getFrom(), ids);
                checkEndpoint(errors, i, "to", edge.getTo(), ids);
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid topology: " + String.join("; ", errors));
        }
    }

    private static void checkEndpoint(List<String> errors, int index, String side,
            String nodeId, Set<String> ids) {
        if (nodeId == null || nodeId.isBlank()) {
            errors.add("Edge at index " + index + " requires '" + side + "'");
        } else if (!ids.contains(nodeId)) {
            errors.add("Edge at index " + index + " references unknown node '" + nodeId + "'");
        }
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    /**
     * @return ids of nodes flagged critical, in declaration order
     */
    public Set<String> criticalComponents() {
        Set<String> critical = new LinkedHashSet<>();
        for (TopologyNode node : getNodes()) {
            if (node.isCritical()) {
                critical.add(node.getId());
            }
        }
        return Collections.unmodifiableSet(critical);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    /**
     * @return unmodifiable list of nodes; empty if none were set
     */
    public List<TopologyNode> getNodes() {
        return nodes != null ? Collections.unmodifiableList(nodes) : Collections.emptyList();
    }

    public void setNodes(List<TopologyNode> nodes) {
        this.nodes = nodes != null ? new ArrayList<>(nodes) : null;
    }

    /**
     * @return unmodifiable list of edges in declaration order; empty if none were set
     */
    public List<TopologyEdge> getEdges() {
        return edges != null ? Collections.unmodifiableList(edges) : Collections.emptyList();
    }

    public void setEdges(List<TopologyEdge> edges) {
        this.edges = edges != null ? new ArrayList<>(edges) : null;
    }

    @Override
    public String toString() {
        return "Topology{nodes=" + nodes + ", edges=" + edges + '}';
    }
}
