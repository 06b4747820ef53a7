package org.Aayush.gridopt.policy;

import org.Aayush.gridopt.search.GridPath;
import org.Aayush.gridopt.search.ShortestPathTree;
import org.Aayush.gridopt.topology.GridEdge;
import org.Aayush.gridopt.topology.GridNode;
import org.Aayush.gridopt.topology.GridTopology;

import java.util.Objects;

/**
 * Turns the current grid state into policy inputs.
 *
 * <p>Context vector (per substation):</p>
 * <pre>
 * 0 demand / 100
 * 1 mean incident edge risk
 * 2 max incident edge risk
 * 3 degree / 10
 * 4 best path resistance to any generator / 0.01
 * 5 risk exposure of that best path
 * 6 mean path resistance over reachable generators / 0.01
 * </pre>
 * <p>Candidate vector (per substation and generator):</p>
 * <pre>
 * 0 path resistance / 0.01
 * 1 path risk exposure
 * 2 hops / 10
 * 3 share of total demand already assigned to the generator this episode
 * </pre>
 */
public final class StateEncoder {
    public static final int CONTEXT_FEATURES = 7;
    public static final int CANDIDATE_FEATURES = 4;

    private static final double DEMAND_SCALE = 100.0d;
    private static final double RESISTANCE_SCALE = 0.01d;
    private static final double HOP_SCALE = 10.0d;

    /**
     * Encodes one substation.
     *
     * @param topology current topology with fresh risk.
     * @param substationIndex position of the substation in {@link GridTopology#substationIds()}.
     * @param searchTree search from the substation.
     * @param assignedDemand demand assigned so far this episode, indexed by generator position.
     */
    public SubstationState encode(
            GridTopology topology,
            int substationIndex,
            ShortestPathTree searchTree,
            double[] assignedDemand
    ) {
        Objects.requireNonNull(topology, "topology");
        Objects.requireNonNull(searchTree, "searchTree");
        int[] generatorIds = topology.generatorIds();
        if (assignedDemand.length != generatorIds.length) {
            throw new IllegalArgumentException(
                    "assignedDemand must have one slot per generator, got " + assignedDemand.length);
        }
        int substationId = searchTree.source();
        GridNode substation = topology.node(substationId);

        double[][] candidates = new double[generatorIds.length][CANDIDATE_FEATURES];
        boolean[] reachable = new boolean[generatorIds.length];
        double bestCost = Double.POSITIVE_INFINITY;
        double bestResistance = 0.0d;
        double bestRisk = 0.0d;
        double resistanceSum = 0.0d;
        int reachableCount = 0;
        double totalDemand = topology.totalDemand();

        for (int g = 0; g < generatorIds.length; g++) {
            if (!searchTree.isReachable(generatorIds[g])) {
                continue;
            }
            GridPath path = searchTree.pathTo(generatorIds[g]);
            reachable[g] = true;
            reachableCount++;
            resistanceSum += path.totalResistance();
            if (path.totalCost() < bestCost) {
                bestCost = path.totalCost();
                bestResistance = path.totalResistance();
                bestRisk = path.totalRisk();
            }
            double[] row = candidates[g];
            row[0] = path.totalResistance() / RESISTANCE_SCALE;
            row[1] = path.totalRisk();
            row[2] = path.hops() / HOP_SCALE;
            row[3] = totalDemand > 0.0d ? assignedDemand[g] / totalDemand : 0.0d;
        }

        double[] incident = incidentRisk(topology, substationId);
        double[] context = new double[CONTEXT_FEATURES];
        context[0] = substation.demand() / DEMAND_SCALE;
        context[1] = incident[0];
        context[2] = incident[1];
        context[3] = topology.degree(substationId) / HOP_SCALE;
        if (reachableCount > 0) {
            context[4] = bestResistance / RESISTANCE_SCALE;
            context[5] = bestRisk;
            context[6] = resistanceSum / reachableCount / RESISTANCE_SCALE;
        }

        return new SubstationState(
                substationIndex,
                substationId,
                substation.demand(),
                generatorIds,
                context,
                candidates,
                reachable,
                searchTree
        );
    }

    private static double[] incidentRisk(GridTopology topology, int nodeId) {
        int[] incident = topology.incidentEdgeIds(nodeId);
        if (incident.length == 0) {
            return new double[]{0.0d, 0.0d};
        }
        double sum = 0.0d;
        double max = 0.0d;
        for (int edgeId : incident) {
            double risk = GridEdge.clampRisk(topology.edge(edgeId).risk());
            sum += risk;
            max = Math.max(max, risk);
        }
        return new double[]{sum / incident.length, max};
    }
}
