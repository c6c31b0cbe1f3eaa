package com.phoenix.core.correlation;

import com.phoenix.core.model.CorrelationGroup;
import com.phoenix.core.model.Deviation;
import com.phoenix.core.topology.Topology;
import com.phoenix.core.topology.TopologyGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Groups recent deviations that are linked through the topology.
 *
 * <p>
 * Deviations are buffered per component with the time at which they were
 * recorded. {@link #correlate()} looks at every buffered deviation no older
 * than the time window and walks the topology <strong>downstream only</strong>
 * from each one: a group seeded at component {@code X} collects the active
 * deviations of {@code X} and of every node transitively reachable from
 * {@code X} along outgoing edges. Traversal continues through nodes that
 * have no active deviation of their own. A component joins at most one group
 * per call.
 * </p>
 *
 * <p>
 * Groups that span fewer than {@value #MIN_GROUP_COMPONENTS} distinct
 * components are dropped.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * The buffer is append-only: deviations are never removed, they simply stop
 * taking part once they age out of the window. {@link #bufferedDeviations()}
 * reports its size.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * {@link #recordDeviation(Deviation)} and {@link #correlate()} synchronize on
 * the instance, so a correlation pass never interleaves with a recording.
 * </p>
 *
 * @since 1.0.0
 */
public class Correlator {

    private static final Logger LOG = LoggerFactory.getLogger(Correlator.class);

    /** Minimum number of distinct components for a group to be reported. */
    static final int MIN_GROUP_COMPONENTS = 2;

    private final TopologyGraph graph;
    private final Duration timeWindow;
    private final Clock clock;

    /** Recorded deviations per component, components in first-seen order. */
    private final Map<String, List<Deviation>> recentDeviations = new LinkedHashMap<>();

    /**
     * @param topology   validated topology
     * @param timeWindow maximum age of a deviation that still correlates
     * @param clock      time source for record and correlation times
     * @throws IllegalArgumentException if {@code timeWindow} is zero or negative
     */
    public Correlator(Topology topology, Duration timeWindow, Clock clock) {
        Objects.requireNonNull(topology, "topology must not be null");
        this.timeWindow = Objects.requireNonNull(timeWindow, "timeWindow must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (timeWindow.isZero() || timeWindow.isNegative()) {
            throw new IllegalArgumentException("timeWindow must be positive, got: " + timeWindow);
        }
        this.graph = TopologyGraph.of(topology);
    }

    /**
     * Buffer a deviation for later correlation, stamped with the current time.
     *
     * @param deviation the deviation to record
     */
    public synchronized void recordDeviation(Deviation deviation) {
        Objects.requireNonNull(deviation, "deviation must not be null");
        Deviation recorded = deviation.withTimestamp(clock.instant());
        recentDeviations.computeIfAbsent(recorded.getComponent(), k -> new ArrayList<>()).add(recorded);
    }

    /**
     * Group the deviations currently inside the time window by downstream
     * reachability.
     *
     * @return groups spanning at least two components; empty if none
     */
    public synchronized List<CorrelationGroup> correlate() {
        Instant now = clock.instant();
        List<Deviation> active = activeDeviations(now);

        List<CorrelationGroup> groups = new ArrayList<>();
        Set<String> visited = new HashSet<>();

        for (Deviation deviation : active) {
            if (visited.contains(deviation.getComponent())) {
                continue;
            }
            List<Deviation> collected = collectDownstream(deviation.getComponent(), active, visited);
            CorrelationGroup group = new CorrelationGroup(collected);
            if (group.components().size() >= MIN_GROUP_COMPONENTS) {
                LOG.debug("Correlated {} deviation(s) across {}", group.size(), group.components());
                groups.add(group);
            }
        }
        return groups;
    }

    /**
     * @return total number of deviations ever recorded
     */
    public synchronized int bufferedDeviations() {
        int total = 0;
        for (List<Deviation> deviations : recentDeviations.values()) {
            total += deviations.size();
        }
        return total;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private List<Deviation> activeDeviations(Instant now) {
        List<Deviation> active = new ArrayList<>();
        for (List<Deviation> deviations : recentDeviations.values()) {
            for (Deviation d : deviations) {
                if (Duration.between(d.getTimestamp(), now).compareTo(timeWindow) <= 0) {
                    active.add(d);
                }
            }
        }
        return active;
    }

    /**
     * Depth-first walk along outgoing edges from {@code start}, collecting
     * the active deviations of every node reached. Marks nodes in
     * {@code visited}, which is shared across the whole correlation pass.
     */
    private List<Deviation> collectDownstream(String start, List<Deviation> active, Set<String> visited) {
        Deque<String> stack = new ArrayDeque<>();
        stack.push(start);
        List<Deviation> group = new ArrayList<>();

        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (!visited.add(current)) {
                continue;
            }
            for (Deviation d : active) {
                if (d.getComponent().equals(current)) {
                    group.add(d);
                }
            }
            for (String next : graph.downstreamOf(current)) {
                stack.push(next);
            }
        }
        return group;
    }
}
