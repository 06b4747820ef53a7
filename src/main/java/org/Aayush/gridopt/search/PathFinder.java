package org.Aayush.gridopt.search;

import org.Aayush.gridopt.topology.GridTopology;

/**
 * Minimum-cost route search over the current topology weights.
 */
public interface PathFinder {

    /**
     * Runs one single-source search.
     *
     * @param topology topology with current resistance and risk values.
     * @param sourceNodeId search origin.
     * @return best labels for every node reachable from the source.
     */
    ShortestPathTree search(GridTopology topology, int sourceNodeId);

    /**
     * Returns the minimum-cost path between two nodes.
     *
     * @throws NoPathException when the target is unreachable.
     */
    default GridPath findPath(GridTopology topology, int sourceNodeId, int targetNodeId) {
        return search(topology, sourceNodeId).pathTo(targetNodeId);
    }
}
