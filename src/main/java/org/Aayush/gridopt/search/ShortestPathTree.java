package org.Aayush.gridopt.search;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Result of one single-source search: best label per node plus predecessor links.
 */
public final class ShortestPathTree {
    static final int NO_PREDECESSOR = -1;

    @Getter
    @Accessors(fluent = true)
    private final int source;
    private final double[] cost;
    private final double[] resistance;
    private final double[] risk;
    private final int[] hops;
    private final int[] predecessorNode;
    private final int[] predecessorEdge;
    private final boolean[] reached;

    ShortestPathTree(
            int source,
            double[] cost,
            double[] resistance,
            double[] risk,
            int[] hops,
            int[] predecessorNode,
            int[] predecessorEdge,
            boolean[] reached
    ) {
        this.source = source;
        this.cost = cost;
        this.resistance = resistance;
        this.risk = risk;
        this.hops = hops;
        this.predecessorNode = predecessorNode;
        this.predecessorEdge = predecessorEdge;
        this.reached = reached;
    }

    public boolean isReachable(int target) {
        checkNode(target);
        return reached[target];
    }

    /**
     * @return minimum total cost to {@code target}, or {@code +INF} when unreachable.
     */
    public double costTo(int target) {
        checkNode(target);
        return reached[target] ? cost[target] : Double.POSITIVE_INFINITY;
    }

    /**
     * Reconstructs the selected path to {@code target}.
     *
     * @throws NoPathException when the target was not reached.
     */
    public GridPath pathTo(int target) {
        checkNode(target);
        if (!reached[target]) {
            throw new NoPathException(source, target);
        }
        int length = hops[target];
        int[] nodes = new int[length + 1];
        int[] edges = new int[length];
        int node = target;
        for (int i = length; i > 0; i--) {
            nodes[i] = node;
            edges[i - 1] = predecessorEdge[node];
            node = predecessorNode[node];
        }
        nodes[0] = node;
        return new GridPath(nodes, edges, cost[target], resistance[target], risk[target]);
    }

    private void checkNode(int nodeId) {
        if (nodeId < 0 || nodeId >= reached.length) {
            throw new IllegalArgumentException("node id out of range: " + nodeId + " [0, " + reached.length + ")");
        }
    }
}
