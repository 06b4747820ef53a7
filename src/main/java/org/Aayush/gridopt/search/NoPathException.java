package org.Aayush.gridopt.search;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.gridopt.core.error.GridOptimizationException;

/**
 * Thrown when no route exists between a substation and a generator.
 */
@Getter
@Accessors(fluent = true)
public final class NoPathException extends GridOptimizationException {
    public static final String REASON_NO_PATH = "GRID_NO_PATH";

    private final int sourceNodeId;
    private final int targetNodeId;

    public NoPathException(int sourceNodeId, int targetNodeId) {
        super(REASON_NO_PATH, "no path from node " + sourceNodeId + " to node " + targetNodeId);
        this.sourceNodeId = sourceNodeId;
        this.targetNodeId = targetNodeId;
    }
}
