package org.Aayush.gridopt.topology;

/**
 * Summary counters for one {@link GridTopology#applyTelemetry} call.
 */
public record TelemetryApplyResult(
        int appliedNodes,
        int appliedEdges,
        int droppedNodes,
        int droppedEdges
) {
    public int dropped() {
        return droppedNodes + droppedEdges;
    }
}
