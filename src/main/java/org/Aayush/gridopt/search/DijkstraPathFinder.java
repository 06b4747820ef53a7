package org.Aayush.gridopt.search;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.gridopt.cost.CostFunction;
import org.Aayush.gridopt.topology.GridEdge;
import org.Aayush.gridopt.topology.GridTopology;

import java.util.Arrays;
import java.util.Objects;
import java.util.PriorityQueue;

/**
 * Deterministic single-source Dijkstra over risk-weighted edge costs.
 * <p>
 * Labels are ordered by {@code (cost, hops, node sequence)}: lower cost wins, then fewer
 * hops, then the lexicographically smallest node-id sequence. Costs are ordered on fixed-point
 * sums ({@value #COST_SCALE} units per cost unit) so mathematically equal route costs tie
 * exactly instead of being split by floating-point rounding. Extending a label always
 * increases it in that order (weights are {@code >= 0} and hops grow by one), so the first
 * label settled for a node is final even when zero-weight edges are present.
 * Out-of-service edges are never relaxed.
 * </p>
 * <p>Not thread-safe with respect to the topology; callers search from the orchestrator context.</p>
 */
@Accessors(fluent = true)
public final class DijkstraPathFinder implements PathFinder {
    static final double COST_SCALE = 1e9d;

    @Getter
    private final CostFunction costFunction;

    public DijkstraPathFinder(CostFunction costFunction) {
        this.costFunction = Objects.requireNonNull(costFunction, "costFunction");
    }

    @Override
    public ShortestPathTree search(GridTopology topology, int sourceNodeId) {
        Objects.requireNonNull(topology, "topology");
        topology.node(sourceNodeId);

        int nodeCount = topology.nodeCount();
        double[] weights = edgeWeights(topology);
        long[] weightUnits = quantize(weights);

        double[] cost = new double[nodeCount];
        double[] resistance = new double[nodeCount];
        double[] risk = new double[nodeCount];
        int[] hops = new int[nodeCount];
        int[] predecessorNode = new int[nodeCount];
        int[] predecessorEdge = new int[nodeCount];
        boolean[] settled = new boolean[nodeCount];
        FrontierState[] bestPending = new FrontierState[nodeCount];
        Arrays.fill(predecessorNode, ShortestPathTree.NO_PREDECESSOR);
        Arrays.fill(predecessorEdge, ShortestPathTree.NO_PREDECESSOR);

        PriorityQueue<FrontierState> frontier = new PriorityQueue<>();
        FrontierState start = new FrontierState(
                sourceNodeId, 0L, 0.0d, 0.0d, 0.0d, new int[]{sourceNodeId},
                ShortestPathTree.NO_PREDECESSOR, ShortestPathTree.NO_PREDECESSOR);
        bestPending[sourceNodeId] = start;
        frontier.add(start);

        GridTopology.IncidentEdgeIterator iterator = topology.iterator();
        while (!frontier.isEmpty()) {
            FrontierState state = frontier.poll();
            int node = state.nodeId();
            if (settled[node]) {
                continue;
            }
            settled[node] = true;
            cost[node] = state.cost();
            resistance[node] = state.resistance();
            risk[node] = state.risk();
            hops[node] = state.hops();
            predecessorNode[node] = state.predecessorNode();
            predecessorEdge[node] = state.predecessorEdge();

            iterator.resetForNode(node);
            while (iterator.hasNext()) {
                int edgeId = iterator.next();
                GridEdge edge = topology.edge(edgeId);
                if (!edge.inService()) {
                    continue;
                }
                int next = edge.otherEnd(node);
                if (settled[next]) {
                    continue;
                }
                double nextCost = state.cost() + weights[edgeId];
                long nextUnits = state.costUnits() + weightUnits[edgeId];
                if (!Double.isFinite(nextCost) || nextUnits < state.costUnits()) {
                    continue;
                }
                FrontierState candidate = state.extend(
                        next,
                        edgeId,
                        nextUnits,
                        nextCost,
                        edge.resistance(),
                        GridEdge.clampRisk(edge.risk())
                );
                FrontierState pending = bestPending[next];
                if (pending == null || candidate.compareTo(pending) < 0) {
                    bestPending[next] = candidate;
                    frontier.add(candidate);
                }
            }
        }

        return new ShortestPathTree(
                sourceNodeId,
                cost,
                resistance,
                risk,
                hops,
                predecessorNode,
                predecessorEdge,
                settled
        );
    }

    private double[] edgeWeights(GridTopology topology) {
        double[] weights = new double[topology.edgeCount()];
        for (int edgeId = 0; edgeId < weights.length; edgeId++) {
            double weight = costFunction.weight(topology.edge(edgeId));
            if (Double.isNaN(weight) || weight < 0.0d) {
                throw new IllegalStateException("edge " + edgeId + " weight must be >= 0, got " + weight);
            }
            weights[edgeId] = weight;
        }
        return weights;
    }

    private static long[] quantize(double[] weights) {
        long[] units = new long[weights.length];
        for (int edgeId = 0; edgeId < weights.length; edgeId++) {
            units[edgeId] = Double.isFinite(weights[edgeId]) ? Math.round(weights[edgeId] * COST_SCALE) : Long.MAX_VALUE;
        }
        return units;
    }

    /**
     * Frontier label carrying the full node sequence for lexicographic tie-breaks.
     * {@code costUnits} orders labels; {@code cost} is the reported floating-point sum.
     */
    private record FrontierState(
            int nodeId,
            long costUnits,
            double cost,
            double resistance,
            double risk,
            int[] path,
            int predecessorNode,
            int predecessorEdge
    ) implements Comparable<FrontierState> {

        int hops() {
            return path.length - 1;
        }

        FrontierState extend(
                int next, int edgeId, long nextUnits, double nextCost, double edgeResistance, double edgeRisk) {
            int[] nextPath = Arrays.copyOf(path, path.length + 1);
            nextPath[path.length] = next;
            return new FrontierState(
                    next,
                    nextUnits,
                    nextCost,
                    resistance + edgeResistance,
                    risk + edgeRisk,
                    nextPath,
                    nodeId,
                    edgeId
            );
        }

        @Override
        public int compareTo(FrontierState other) {
            int byCost = Long.compare(this.costUnits, other.costUnits);
            if (byCost != 0) {
                return byCost;
            }
            int byHops = Integer.compare(this.path.length, other.path.length);
            if (byHops != 0) {
                return byHops;
            }
            return Arrays.compare(this.path, other.path);
        }
    }
}
