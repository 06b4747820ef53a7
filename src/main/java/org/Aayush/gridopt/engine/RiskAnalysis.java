package org.Aayush.gridopt.engine;

import org.Aayush.gridopt.topology.NodeRole;
import org.Aayush.gridopt.topology.TopologySnapshot;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Risk ranking over one topology snapshot.
 * <p>
 * Every node is scored by the risk of its incident edges; nodes are ranked by average neighbour
 * risk and edges by risk, highest first, ties broken by ascending id.
 * </p>
 */
public record RiskAnalysis(long iteration, List<NodeRisk> nodes, List<EdgeRisk> edges) {

    public RiskAnalysis {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public static RiskAnalysis of(TopologySnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        List<TopologySnapshot.NodeView> nodeViews = snapshot.nodes();
        int slots = 0;
        for (TopologySnapshot.NodeView node : nodeViews) {
            slots = Math.max(slots, node.id() + 1);
        }
        String[] names = new String[slots];
        double[] riskSum = new double[slots];
        double[] riskMax = new double[slots];
        int[] incident = new int[slots];
        for (TopologySnapshot.NodeView node : nodeViews) {
            names[node.id()] = node.name();
        }

        List<EdgeRisk> edges = new ArrayList<>(snapshot.edges().size());
        for (TopologySnapshot.EdgeView edge : snapshot.edges()) {
            for (int end : new int[]{edge.sourceNodeId(), edge.targetNodeId()}) {
                if (end >= 0 && end < slots) {
                    riskSum[end] += edge.risk();
                    riskMax[end] = incident[end] == 0 ? edge.risk() : Math.max(riskMax[end], edge.risk());
                    incident[end]++;
                }
            }
            edges.add(new EdgeRisk(
                    edge.id(),
                    edge.sourceNodeId(),
                    edge.targetNodeId(),
                    nameOf(names, edge.sourceNodeId()),
                    nameOf(names, edge.targetNodeId()),
                    edge.risk(),
                    edge.temperature(),
                    edge.current(),
                    edge.inService()
            ));
        }

        List<NodeRisk> nodes = new ArrayList<>(nodeViews.size());
        for (TopologySnapshot.NodeView node : nodeViews) {
            int count = incident[node.id()];
            nodes.add(new NodeRisk(
                    node.id(),
                    node.name(),
                    node.role(),
                    count == 0 ? 0.0d : riskSum[node.id()] / count,
                    count == 0 ? 0.0d : riskMax[node.id()],
                    node.degree()
            ));
        }

        nodes.sort(Comparator.comparingDouble(NodeRisk::averageNeighborRisk).reversed()
                .thenComparingInt(NodeRisk::nodeId));
        edges.sort(Comparator.comparingDouble(EdgeRisk::risk).reversed()
                .thenComparingInt(EdgeRisk::edgeId));
        return new RiskAnalysis(snapshot.iteration(), nodes, edges);
    }

    private static String nameOf(String[] names, int nodeId) {
        return nodeId >= 0 && nodeId < names.length && names[nodeId] != null ? names[nodeId] : String.valueOf(nodeId);
    }

    /**
     * Risk exposure of one node through its incident edges.
     */
    public record NodeRisk(
            int nodeId,
            String name,
            NodeRole role,
            double averageNeighborRisk,
            double maxNeighborRisk,
            int degree
    ) {
    }

    public record EdgeRisk(
            int edgeId,
            int sourceNodeId,
            int targetNodeId,
            String sourceName,
            String targetName,
            double risk,
            double temperature,
            double current,
            boolean inService
    ) {
    }
}
