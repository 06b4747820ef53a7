package org.Aayush.gridopt.policy;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.gridopt.search.ShortestPathTree;

/**
 * Encoded decision state for one substation in one episode.
 *
 * <p>Candidate rows are indexed by generator position in {@code generatorIds}; unreachable
 * candidates carry an all-zero row and a {@code false} reachability flag.</p>
 */
@Accessors(fluent = true)
public final class SubstationState {
    @Getter
    private final int substationIndex;
    @Getter
    private final int substationId;
    @Getter
    private final double demand;
    private final int[] generatorIds;
    private final double[] context;
    private final double[][] candidates;
    private final boolean[] reachable;
    @Getter
    private final ShortestPathTree searchTree;

    SubstationState(
            int substationIndex,
            int substationId,
            double demand,
            int[] generatorIds,
            double[] context,
            double[][] candidates,
            boolean[] reachable,
            ShortestPathTree searchTree
    ) {
        this.substationIndex = substationIndex;
        this.substationId = substationId;
        this.demand = demand;
        this.generatorIds = generatorIds;
        this.context = context;
        this.candidates = candidates;
        this.reachable = reachable;
        this.searchTree = searchTree;
    }

    public int generatorCount() {
        return generatorIds.length;
    }

    public int generatorId(int generatorIndex) {
        return generatorIds[generatorIndex];
    }

    public boolean isReachable(int generatorIndex) {
        return reachable[generatorIndex];
    }

    /**
     * @return whether at least one generator can be reached.
     */
    public boolean anyReachable() {
        for (boolean flag : reachable) {
            if (flag) {
                return true;
            }
        }
        return false;
    }

    public double[] context() {
        return context.clone();
    }

    public double[] candidate(int generatorIndex) {
        return candidates[generatorIndex].clone();
    }

    double[] contextVector() {
        return context;
    }

    double[] candidateVector(int generatorIndex) {
        return candidates[generatorIndex];
    }
}
