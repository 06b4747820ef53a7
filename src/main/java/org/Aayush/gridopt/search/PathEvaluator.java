package org.Aayush.gridopt.search;

import org.Aayush.gridopt.core.error.GridOptimizationException;
import org.Aayush.gridopt.cost.CostFunction;
import org.Aayush.gridopt.topology.GridEdge;
import org.Aayush.gridopt.topology.GridTopology;

import java.util.Objects;

/**
 * Replays a node path against the current topology and recomputes its totals.
 */
public final class PathEvaluator {
    public static final String REASON_EMPTY_PATH = "GRID_PATH_EMPTY";
    public static final String REASON_BROKEN_PATH = "GRID_PATH_NOT_CONNECTED";

    private final CostFunction costFunction;

    public PathEvaluator(CostFunction costFunction) {
        this.costFunction = Objects.requireNonNull(costFunction, "costFunction");
    }

    /**
     * Validates that every consecutive node pair is joined by an edge and rebuilds the path.
     *
     * @param topology current topology.
     * @param nodePath node ids from source to target.
     * @return replayed path with recomputed cost, resistance and risk.
     * @throws PathEvaluationException when the path is empty or a pair is not adjacent.
     */
    public GridPath evaluate(GridTopology topology, int[] nodePath) {
        Objects.requireNonNull(topology, "topology");
        Objects.requireNonNull(nodePath, "nodePath");
        if (nodePath.length == 0) {
            throw new PathEvaluationException(REASON_EMPTY_PATH, "path has no nodes");
        }
        int[] edgeIds = new int[nodePath.length - 1];
        double totalCost = 0.0d;
        double totalResistance = 0.0d;
        double totalRisk = 0.0d;
        for (int i = 0; i < edgeIds.length; i++) {
            int from = nodePath[i];
            int to = nodePath[i + 1];
            if (!topology.hasEdge(from, to)) {
                throw new PathEvaluationException(
                        REASON_BROKEN_PATH, "nodes " + from + " and " + to + " are not adjacent");
            }
            GridEdge edge = topology.edge(topology.edgeBetween(from, to));
            if (!edge.inService()) {
                throw new PathEvaluationException(
                        REASON_BROKEN_PATH, "edge " + edge.id() + " between " + from + " and " + to + " is out of service");
            }
            edgeIds[i] = edge.id();
            totalCost += costFunction.weight(edge);
            totalResistance += edge.resistance();
            totalRisk += GridEdge.clampRisk(edge.risk());
        }
        return new GridPath(nodePath.clone(), edgeIds, totalCost, totalResistance, totalRisk);
    }

    /**
     * Path replay failure with reason code.
     */
    public static final class PathEvaluationException extends GridOptimizationException {
        PathEvaluationException(String reasonCode, String message) {
            super(reasonCode, message);
        }
    }
}
