package com.phoenix.core.correlation;

import com.phoenix.core.model.CorrelationGroup;
import com.phoenix.core.model.Deviation;
import com.phoenix.core.model.DeviationLevel;
import com.phoenix.core.support.MutableClock;
import com.phoenix.core.topology.Topology;
import com.phoenix.core.topology.TopologyEdge;
import com.phoenix.core.topology.TopologyNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link Correlator}.
 */
class CorrelatorTest {

    private static final Instant START = Instant.parse("2024-03-01T12:00:00Z");

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at(START);
    }

    @Test
    @DisplayName("Deviations on a direct downstream edge should share a group")
    void directEdgeShouldCorrelate() {
        Correlator correlator = correlator(chain("a", "b"));

        correlator.recordDeviation(deviation("a"));
        correlator.recordDeviation(deviation("b"));

        List<CorrelationGroup> groups = correlator.correlate();
        assertThat(groups).hasSize(1);
        assertThat(groups.get(0).components()).containsExactly("a", "b");
    }

    @Test
    @DisplayName("Components without a directed path should never share a group")
    void unrelatedComponentsShouldNotCorrelate() {
        Topology topology = topology(List.of("a", "b", "c"),
                List.of(TopologyEdge.of("a", "c"), TopologyEdge.of("b", "c")));
        Correlator correlator = correlator(topology);

        correlator.recordDeviation(deviation("a"));
        correlator.recordDeviation(deviation("b"));

        assertThat(correlator.correlate()).isEmpty();
    }

    @Test
    @DisplayName("Traversal should pass through nodes that have no deviation")
    void shouldReachTransitively() {
        Correlator correlator = correlator(chain("a", "b", "c"));

        correlator.recordDeviation(deviation("a"));
        correlator.recordDeviation(deviation("c"));

        List<CorrelationGroup> groups = correlator.correlate();
        assertThat(groups).hasSize(1);
        assertThat(groups.get(0).components()).containsExactly("a", "c");
    }

    @Test
    @DisplayName("A component consumed by an earlier seed should not be walked again")
    void visitedComponentsShouldNotBeRegrouped() {
        Correlator correlator = correlator(chain("a", "b"));

        // b is seeded first and only walks downstream, so it is consumed alone
        correlator.recordDeviation(deviation("b"));
        correlator.recordDeviation(deviation("a"));

        assertThat(correlator.correlate()).isEmpty();
    }

    @Test
    @DisplayName("A single deviation should never form a group")
    void singleDeviationShouldNotFormGroup() {
        Correlator correlator = correlator(chain("a", "b"));

        correlator.recordDeviation(deviation("a"));

        assertThat(correlator.correlate()).isEmpty();
    }

    @Test
    @DisplayName("Several deviations on one component should not form a group")
    void oneComponentShouldNotFormGroup() {
        Correlator correlator = correlator(chain("a", "b"));

        correlator.recordDeviation(deviation("a"));
        correlator.recordDeviation(deviation("a"));

        assertThat(correlator.correlate()).isEmpty();
    }

    @Test
    @DisplayName("Deviations older than the window should be excluded")
    void expiredDeviationsShouldBeExcluded() {
        Correlator correlator = correlator(chain("a", "b"));

        correlator.recordDeviation(deviation("a"));
        clock.advanceSeconds(31);
        correlator.recordDeviation(deviation("b"));

        assertThat(correlator.correlate()).isEmpty();
        assertThat(correlator.bufferedDeviations()).isEqualTo(2);
    }

    @Test
    @DisplayName("A deviation exactly at the window edge should still correlate")
    void windowEdgeShouldBeInclusive() {
        Correlator correlator = correlator(chain("a", "b"));

        correlator.recordDeviation(deviation("a"));
        clock.advanceSeconds(30);
        correlator.recordDeviation(deviation("b"));

        assertThat(correlator.correlate()).hasSize(1);
    }

    @Test
    @DisplayName("Deviations should be stamped with the record time")
    void shouldStampRecordTime() {
        Correlator correlator = correlator(chain("a", "b"));

        correlator.recordDeviation(deviation("a").withTimestamp(START.minusSeconds(3_600)));
        clock.advanceSeconds(5);
        correlator.recordDeviation(deviation("b"));

        List<CorrelationGroup> groups = correlator.correlate();
        assertThat(groups).hasSize(1);
        assertThat(groups.get(0).getDeviations()).extracting(Deviation::getTimestamp)
                .containsExactly(START, START.plusSeconds(5));
    }

    @Test
    @DisplayName("Group should list deviations in traversal order")
    void groupShouldFollowTraversalOrder() {
        Topology topology = topology(List.of("root", "left", "right"),
                List.of(TopologyEdge.of("root", "left"), TopologyEdge.of("root", "right")));
        Correlator correlator = correlator(topology);

        correlator.recordDeviation(deviation("left"));
        correlator.recordDeviation(deviation("root"));
        correlator.recordDeviation(deviation("right"));
        correlator.recordDeviation(deviation("root"));

        // "left" seeds first and is consumed alone; "root" then walks to "right"
        List<CorrelationGroup> groups = correlator.correlate();
        assertThat(groups).hasSize(1);
        assertThat(groups.get(0).getDeviations()).extracting(Deviation::getComponent)
                .containsExactly("root", "root", "right");
    }

    @Test
    @DisplayName("Buffered deviations should be reused by later correlation passes")
    void bufferShouldSurviveCorrelation() {
        Correlator correlator = correlator(chain("a", "b"));

        correlator.recordDeviation(deviation("a"));
        correlator.recordDeviation(deviation("b"));
        assertThat(correlator.correlate()).hasSize(1);

        clock.advanceSeconds(10);
        assertThat(correlator.correlate()).hasSize(1);
        assertThat(correlator.bufferedDeviations()).isEqualTo(2);
    }

    @Test
    @DisplayName("Deviations on components outside the topology should not group")
    void unknownComponentsShouldStandAlone() {
        Correlator correlator = correlator(chain("a", "b"));

        correlator.recordDeviation(deviation("x"));
        correlator.recordDeviation(deviation("y"));

        assertThat(correlator.correlate()).isEmpty();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Correlator correlator(Topology topology) {
        return new Correlator(topology, Duration.ofSeconds(30), clock);
    }

    private static Topology chain(String... ids) {
        List<String> nodes = List.of(ids);
        List<TopologyEdge> edges = new ArrayList<>();
        for (int i = 0; i + 1 < ids.length; i++) {
            edges.add(TopologyEdge.of(ids[i], ids[i + 1]));
        }
        return topology(nodes, edges);
    }

    private static Topology topology(List<String> ids, List<TopologyEdge> edges) {
        Topology topology = new Topology(ids.stream().map(TopologyNode::of).toList(), edges);
        topology.validate();
        return topology;
    }

    private Deviation deviation(String component) {
        return Deviation.builder()
                .component(component)
                .metric("latency_ms")
                .value(100)
                .mean(20)
                .stdDev(2)
                .deviationScore(40)
                .level(DeviationLevel.STRONG)
                .timestamp(clock.instant())
                .build();
    }
}
