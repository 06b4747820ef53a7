package org.Aayush.gridopt.engine;

import org.Aayush.gridopt.topology.NodeRole;
import org.Aayush.gridopt.topology.TopologySnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Grid Statistics Tests")
class GridStatisticsTest {

    private static TopologySnapshot.NodeView node(int id, NodeRole role, double observedDemand, double voltage) {
        return new TopologySnapshot.NodeView(id, "n" + id, "N" + id, role, observedDemand, observedDemand, voltage, 1);
    }

    private static TopologySnapshot.EdgeView edge(int id, double current, double temperature, double flow, double risk) {
        return new TopologySnapshot.EdgeView(id, 0, id + 1, 0.002d, current, temperature, flow, risk, true);
    }

    @Test
    @DisplayName("Aggregates voltage, demand, risk, temperature, flow and current")
    void testAggregates() {
        TopologySnapshot snapshot = new TopologySnapshot(4L,
                List.of(
                        node(0, NodeRole.GENERATOR, 0.0d, 220.0d),
                        node(1, NodeRole.SUBSTATION, 31.0d, 210.0d),
                        node(2, NodeRole.SUBSTATION, 39.0d, 230.0d)
                ),
                List.of(
                        edge(0, 200.0d, 45.0d, 43.0d, 0.2d),
                        edge(1, 300.0d, 55.0d, 67.5d, 0.7d)
                ));

        GridStatistics statistics = GridStatistics.of(snapshot);

        assertEquals(4L, statistics.iteration());
        assertEquals(3, statistics.nodeCount());
        assertEquals(2, statistics.edgeCount());

        assertEquals(220.0d, statistics.voltage().mean(), 1e-9);
        assertEquals(Math.sqrt(200.0d / 3.0d), statistics.voltage().std(), 1e-9);
        assertEquals(210.0d, statistics.voltage().min(), 0.0);
        assertEquals(230.0d, statistics.voltage().max(), 0.0);

        assertEquals(70.0d, statistics.totalDemand(), 1e-9);
        assertEquals(0.0d, statistics.demand().min(), 0.0);
        assertEquals(39.0d, statistics.demand().max(), 0.0);

        assertEquals(0.45d, statistics.risk().mean(), 1e-9);
        assertEquals(0.2d, statistics.risk().min(), 0.0);
        assertEquals(0.7d, statistics.risk().max(), 0.0);
        assertEquals(1, statistics.highRiskEdges());

        assertEquals(50.0d, statistics.temperature().mean(), 1e-9);
        assertEquals(5.0d, statistics.temperature().std(), 1e-9);
        assertEquals(45.0d, statistics.temperature().min(), 0.0);
        assertEquals(55.0d, statistics.temperature().max(), 0.0);

        assertEquals(110.5d, statistics.totalPowerFlow(), 1e-9);
        assertEquals(55.25d, statistics.powerFlow().mean(), 1e-9);
        assertEquals(67.5d, statistics.powerFlow().max(), 0.0);

        assertEquals(250.0d, statistics.current().mean(), 1e-9);
        assertEquals(50.0d, statistics.current().std(), 1e-9);
        assertEquals(200.0d, statistics.current().min(), 0.0);
        assertEquals(300.0d, statistics.current().max(), 0.0);
    }

    @Test
    @DisplayName("Extremes follow the readings below zero")
    void testNegativeReadings() {
        TopologySnapshot snapshot = new TopologySnapshot(1L,
                List.of(node(0, NodeRole.GENERATOR, 0.0d, 220.0d)),
                List.of(
                        edge(0, 150.0d, -10.0d, -4.0d, 0.1d),
                        edge(1, 150.0d, -5.0d, -2.0d, 0.1d)
                ));

        GridStatistics statistics = GridStatistics.of(snapshot);

        assertEquals(-5.0d, statistics.temperature().max(), 0.0);
        assertEquals(-10.0d, statistics.temperature().min(), 0.0);
        assertEquals(-2.0d, statistics.powerFlow().max(), 0.0);
        assertEquals(0.0d, statistics.current().std(), 0.0);
        assertEquals(0, statistics.highRiskEdges());
    }

    @Test
    @DisplayName("Empty snapshot yields zeros")
    void testEmpty() {
        GridStatistics statistics = GridStatistics.of(TopologySnapshot.empty());

        assertEquals(0, statistics.nodeCount());
        assertEquals(GridStatistics.Summary.EMPTY, statistics.voltage());
        assertEquals(GridStatistics.Summary.EMPTY, statistics.risk());
        assertEquals(0.0d, statistics.totalPowerFlow(), 0.0);
    }
}
