package org.Aayush.gridopt.search;

import org.Aayush.gridopt.cost.CostFunction;
import org.Aayush.gridopt.testutil.GridFixtures;
import org.Aayush.gridopt.topology.GridTopology;
import org.Aayush.gridopt.topology.TopologyDefinition;
import org.Aayush.gridopt.topology.UnknownEntityException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Dijkstra Path Finder Tests")
class DijkstraPathFinderTest {

    @Test
    @DisplayName("Risky low-resistance edge loses to a safer detour (9.002 vs 1.01)")
    void testRiskAverseRouting() {
        GridTopology topology = GridFixtures.topology(GridFixtures.riskDetourDefinition());
        topology.updateRisk(topology.edgeBetween(1, 0), 0.9d);
        topology.updateRisk(topology.edgeBetween(1, 2), 0.1d);
        topology.updateRisk(topology.edgeBetween(2, 0), 0.0d);

        GridPath path = new DijkstraPathFinder(new CostFunction(10.0d)).findPath(topology, 1, 0);

        assertEquals(List.of(1, 2, 0), path.nodeList());
        assertEquals(1.01d, path.totalCost(), 1e-12);
        assertEquals(0.010d, path.totalResistance(), 1e-12);
        assertEquals(0.1d, path.totalRisk(), 1e-12);
        assertEquals(2, path.hops());
        assertEquals(1, path.source());
        assertEquals(0, path.target());
    }

    @Test
    @DisplayName("Without risk sensitivity the direct low-resistance edge wins")
    void testResistanceOnlyRouting() {
        GridTopology topology = GridFixtures.topology(GridFixtures.riskDetourDefinition());
        topology.updateRisk(topology.edgeBetween(1, 0), 0.9d);
        topology.updateRisk(topology.edgeBetween(1, 2), 0.1d);

        GridPath path = new DijkstraPathFinder(new CostFunction(0.0d)).findPath(topology, 1, 0);

        assertEquals(List.of(1, 0), path.nodeList());
        assertEquals(0.002d, path.totalCost(), 1e-12);
    }

    @Test
    @DisplayName("Equal-cost routes prefer fewer hops, then the smallest node sequence")
    void testTieBreaks() {
        // 0 is the generator. 4 reaches it directly (cost 2) or via 1 (1 + 1).
        // 5 reaches it via 2 or 3, both 2 hops with equal cost.
        GridTopology topology = GridTopology.fromDefinition(TopologyDefinition.builder()
                .node(TopologyDefinition.NodeSpec.generator(0, "g", "G"))
                .node(TopologyDefinition.NodeSpec.substation(1, "n1", "N1", 1))
                .node(TopologyDefinition.NodeSpec.substation(2, "n2", "N2", 1))
                .node(TopologyDefinition.NodeSpec.substation(3, "n3", "N3", 1))
                .node(TopologyDefinition.NodeSpec.substation(4, "n4", "N4", 1))
                .node(TopologyDefinition.NodeSpec.substation(5, "n5", "N5", 1))
                .edge(new TopologyDefinition.EdgeSpec("n4", "g", 2.0))
                .edge(new TopologyDefinition.EdgeSpec("n4", "n1", 1.0))
                .edge(new TopologyDefinition.EdgeSpec("n1", "g", 1.0))
                .edge(new TopologyDefinition.EdgeSpec("n5", "n3", 1.0))
                .edge(new TopologyDefinition.EdgeSpec("n3", "g", 1.0))
                .edge(new TopologyDefinition.EdgeSpec("n5", "n2", 1.0))
                .edge(new TopologyDefinition.EdgeSpec("n2", "g", 1.0))
                .build());
        GridFixtures.assignUniformRisk(topology, 0.0d);
        DijkstraPathFinder finder = new DijkstraPathFinder(new CostFunction());

        assertEquals(List.of(4, 0), finder.findPath(topology, 4, 0).nodeList());
        assertEquals(List.of(5, 2, 0), finder.findPath(topology, 5, 0).nodeList());
        assertEquals(List.of(0, 2, 5), finder.findPath(topology, 0, 5).nodeList());

        // 0.1 + 0.7 sums to 0.7999999999999999 in doubles; still a tie with the direct 0.8 edge.
        GridTopology rounding = GridTopology.fromDefinition(TopologyDefinition.builder()
                .node(TopologyDefinition.NodeSpec.generator(0, "g", "G"))
                .node(TopologyDefinition.NodeSpec.substation(1, "a", "A", 1))
                .node(TopologyDefinition.NodeSpec.substation(2, "b", "B", 1))
                .edge(new TopologyDefinition.EdgeSpec("a", "g", 0.8))
                .edge(new TopologyDefinition.EdgeSpec("a", "b", 0.1))
                .edge(new TopologyDefinition.EdgeSpec("b", "g", 0.7))
                .build());
        GridFixtures.assignUniformRisk(rounding, 0.0d);

        GridPath direct = finder.findPath(rounding, 1, 0);
        assertEquals(List.of(1, 0), direct.nodeList());
        assertEquals(0.8d, direct.totalCost(), 1e-12);
    }

    @Test
    @DisplayName("Zero-weight edges keep settled labels final")
    void testZeroWeightEdges() {
        GridTopology topology = GridTopology.fromDefinition(TopologyDefinition.builder()
                .node(TopologyDefinition.NodeSpec.generator(0, "g", "G"))
                .node(TopologyDefinition.NodeSpec.substation(1, "a", "A", 1))
                .node(TopologyDefinition.NodeSpec.substation(2, "b", "B", 1))
                .edge(new TopologyDefinition.EdgeSpec("a", "b", 0.0))
                .edge(new TopologyDefinition.EdgeSpec("b", "g", 0.0))
                .edge(new TopologyDefinition.EdgeSpec("a", "g", 0.0))
                .build());
        GridFixtures.assignUniformRisk(topology, 0.0d);

        GridPath path = new DijkstraPathFinder(new CostFunction()).findPath(topology, 1, 0);

        assertEquals(List.of(1, 0), path.nodeList());
        assertEquals(0.0d, path.totalCost(), 0.0);
    }

    @Test
    @DisplayName("Every consecutive pair of a found path is an existing edge")
    void testPathValidity() {
        GridTopology topology = GridFixtures.topology(GridFixtures.branchDefinition());
        GridFixtures.assignUniformRisk(topology, 0.2d);
        DijkstraPathFinder finder = new DijkstraPathFinder(new CostFunction());

        for (int source : topology.substationIds()) {
            ShortestPathTree tree = finder.search(topology, source);
            for (int generator : topology.generatorIds()) {
                int[] nodes = tree.pathTo(generator).nodeIds();
                int[] edges = tree.pathTo(generator).edgeIds();
                assertEquals(source, nodes[0]);
                assertEquals(generator, nodes[nodes.length - 1]);
                for (int i = 0; i + 1 < nodes.length; i++) {
                    assertTrue(topology.hasEdge(nodes[i], nodes[i + 1]));
                    assertEquals(topology.edgeBetween(nodes[i], nodes[i + 1]), edges[i]);
                }
            }
        }
    }

    @Test
    @DisplayName("Repeated searches on identical inputs yield identical paths and loss")
    void testDeterminism() {
        GridTopology topology = GridFixtures.topology(GridFixtures.branchDefinition());
        GridFixtures.assignUniformRisk(topology, 0.35d);
        DijkstraPathFinder finder = new DijkstraPathFinder(new CostFunction());

        GridPath first = finder.findPath(topology, 4, 1);
        GridPath second = finder.findPath(topology, 4, 1);

        assertEquals(first, second);
        assertEquals(
                TransmissionLoss.lossMegawatts(25.0d, first),
                TransmissionLoss.lossMegawatts(25.0d, second),
                0.0
        );
    }

    @Test
    @DisplayName("Out-of-service edges isolate nodes and unreachable targets raise NoPathException")
    void testUnreachableTarget() {
        GridTopology topology = GridFixtures.topology(GridFixtures.branchDefinition());
        GridFixtures.assignUniformRisk(topology, 0.1d);
        topology.setInService(4, 2, false);
        DijkstraPathFinder finder = new DijkstraPathFinder(new CostFunction());

        ShortestPathTree tree = finder.search(topology, 4);
        assertFalse(tree.isReachable(0));
        assertEquals(Double.POSITIVE_INFINITY, tree.costTo(1));
        NoPathException ex = assertThrows(NoPathException.class, () -> tree.pathTo(0));
        assertEquals(NoPathException.REASON_NO_PATH, ex.reasonCode());
        assertEquals(4, ex.sourceNodeId());
        assertEquals(0, ex.targetNodeId());

        topology.setInService(2, 4, true);
        assertTrue(finder.search(topology, 4).isReachable(0));
    }

    @Test
    @DisplayName("Unknown source node is rejected")
    void testUnknownSource() {
        GridTopology topology = GridFixtures.topology(GridFixtures.branchDefinition());
        DijkstraPathFinder finder = new DijkstraPathFinder(new CostFunction());

        assertThrows(UnknownEntityException.class, () -> finder.search(topology, 99));
        assertThrows(IllegalArgumentException.class, () -> finder.search(topology, 2).pathTo(99));
    }
}
