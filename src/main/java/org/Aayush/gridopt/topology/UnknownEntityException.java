package org.Aayush.gridopt.topology;

import org.Aayush.gridopt.core.error.GridOptimizationException;

/**
 * Thrown when telemetry or a query references a node or edge outside the initialized topology.
 */
public final class UnknownEntityException extends GridOptimizationException {
    public static final String REASON_UNKNOWN_NODE = "GRID_UNKNOWN_NODE";
    public static final String REASON_UNKNOWN_EDGE = "GRID_UNKNOWN_EDGE";

    public UnknownEntityException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    static UnknownEntityException unknownNode(int nodeId, int nodeCount) {
        return new UnknownEntityException(
                REASON_UNKNOWN_NODE,
                "node id " + nodeId + " is not part of the topology [0, " + nodeCount + ")"
        );
    }

    static UnknownEntityException unknownEdge(int sourceNodeId, int targetNodeId) {
        return new UnknownEntityException(
                REASON_UNKNOWN_EDGE,
                "no edge between nodes " + sourceNodeId + " and " + targetNodeId
        );
    }
}
