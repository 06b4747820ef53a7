package org.Aayush.gridopt.topology;

import org.Aayush.gridopt.core.error.GridOptimizationException;

/**
 * Fatal failure while constructing the initial grid topology.
 */
public final class TopologyBuildException extends GridOptimizationException {
    public static final String REASON_EMPTY_PARTITION = "GRID_TOPOLOGY_EMPTY_PARTITION";
    public static final String REASON_INVALID_NODE = "GRID_TOPOLOGY_INVALID_NODE";
    public static final String REASON_INVALID_EDGE = "GRID_TOPOLOGY_INVALID_EDGE";
    public static final String REASON_DISCONNECTED = "GRID_TOPOLOGY_DISCONNECTED";
    public static final String REASON_SIZE_MISMATCH = "GRID_TOPOLOGY_SIZE_MISMATCH";
    public static final String REASON_LOAD_FAILED = "GRID_TOPOLOGY_LOAD_FAILED";

    public TopologyBuildException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public TopologyBuildException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}
