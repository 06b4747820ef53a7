package org.Aayush.gridopt.topology;

import java.util.List;

/**
 * Immutable copy of the topology published to readers after each episode.
 */
public record TopologySnapshot(long iteration, List<NodeView> nodes, List<EdgeView> edges) {
    public TopologySnapshot {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public static TopologySnapshot empty() {
        return new TopologySnapshot(0L, List.of(), List.of());
    }

    public record NodeView(
            int id,
            String key,
            String name,
            NodeRole role,
            double demand,
            double observedDemand,
            double voltage,
            int degree
    ) {
    }

    public record EdgeView(
            int id,
            int sourceNodeId,
            int targetNodeId,
            double resistance,
            double current,
            double temperature,
            double powerFlow,
            double risk,
            boolean inService
    ) {
    }
}
