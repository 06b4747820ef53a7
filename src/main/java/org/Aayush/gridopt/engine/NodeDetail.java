package org.Aayush.gridopt.engine;

import org.Aayush.gridopt.topology.NodeRole;
import org.Aayush.gridopt.topology.TopologySnapshot;
import org.Aayush.gridopt.topology.UnknownEntityException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One node with the readings of every edge connecting it to a neighbour, in edge-id order.
 */
public record NodeDetail(
        long iteration,
        int nodeId,
        String key,
        String name,
        NodeRole role,
        double demand,
        double observedDemand,
        double voltage,
        int degree,
        List<Neighbor> neighbors
) {

    public NodeDetail {
        neighbors = List.copyOf(neighbors);
    }

    /**
     * @throws UnknownEntityException if the snapshot has no node with this id.
     */
    public static NodeDetail of(TopologySnapshot snapshot, int nodeId) {
        Objects.requireNonNull(snapshot, "snapshot");
        TopologySnapshot.NodeView node = null;
        for (TopologySnapshot.NodeView candidate : snapshot.nodes()) {
            if (candidate.id() == nodeId) {
                node = candidate;
                break;
            }
        }
        if (node == null) {
            throw new UnknownEntityException(
                    UnknownEntityException.REASON_UNKNOWN_NODE, "node id " + nodeId + " is not in the snapshot");
        }

        List<Neighbor> neighbors = new ArrayList<>(node.degree());
        for (TopologySnapshot.EdgeView edge : snapshot.edges()) {
            int other;
            if (edge.sourceNodeId() == nodeId) {
                other = edge.targetNodeId();
            } else if (edge.targetNodeId() == nodeId) {
                other = edge.sourceNodeId();
            } else {
                continue;
            }
            neighbors.add(new Neighbor(
                    other,
                    nameOf(snapshot, other),
                    edge.id(),
                    edge.resistance(),
                    edge.current(),
                    edge.temperature(),
                    edge.risk(),
                    edge.powerFlow(),
                    edge.inService()
            ));
        }
        neighbors.sort((a, b) -> Integer.compare(a.edgeId(), b.edgeId()));

        return new NodeDetail(
                snapshot.iteration(),
                node.id(),
                node.key(),
                node.name(),
                node.role(),
                node.demand(),
                node.observedDemand(),
                node.voltage(),
                node.degree(),
                neighbors
        );
    }

    private static String nameOf(TopologySnapshot snapshot, int nodeId) {
        for (TopologySnapshot.NodeView node : snapshot.nodes()) {
            if (node.id() == nodeId) {
                return node.name();
            }
        }
        return String.valueOf(nodeId);
    }

    /** Readings of the edge to one neighbour. */
    public record Neighbor(
            int nodeId,
            String name,
            int edgeId,
            double resistance,
            double current,
            double temperature,
            double risk,
            double powerFlow,
            boolean inService
    ) {
    }
}
