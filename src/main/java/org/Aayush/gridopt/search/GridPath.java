package org.Aayush.gridopt.search;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable substation-to-generator route with its derived totals.
 *
 * <p>{@code nodeIds[0]} is the source and {@code nodeIds[n-1]} the target;
 * {@code edgeIds[i]} joins {@code nodeIds[i]} and {@code nodeIds[i + 1]}.</p>
 */
@Getter
@ToString
@EqualsAndHashCode
@Accessors(fluent = true)
public final class GridPath {
    @Getter(AccessLevel.NONE)
    private final int[] nodeIds;
    @Getter(AccessLevel.NONE)
    private final int[] edgeIds;
    /** Sum of risk-weighted edge costs. */
    private final double totalCost;
    /** Sum of edge resistances. */
    private final double totalResistance;
    /** Sum of edge risks (risk exposure). */
    private final double totalRisk;

    GridPath(int[] nodeIds, int[] edgeIds, double totalCost, double totalResistance, double totalRisk) {
        Objects.requireNonNull(nodeIds, "nodeIds");
        Objects.requireNonNull(edgeIds, "edgeIds");
        if (nodeIds.length == 0 || edgeIds.length != nodeIds.length - 1) {
            throw new IllegalArgumentException(
                    "path needs n nodes and n-1 edges, got " + nodeIds.length + " nodes and " + edgeIds.length + " edges");
        }
        this.nodeIds = nodeIds;
        this.edgeIds = edgeIds;
        this.totalCost = totalCost;
        this.totalResistance = totalResistance;
        this.totalRisk = totalRisk;
    }

    public int source() {
        return nodeIds[0];
    }

    public int target() {
        return nodeIds[nodeIds.length - 1];
    }

    public int hops() {
        return edgeIds.length;
    }

    public int[] nodeIds() {
        return nodeIds.clone();
    }

    public int[] edgeIds() {
        return edgeIds.clone();
    }

    /**
     * Boxed node sequence for result payloads.
     */
    public List<Integer> nodeList() {
        List<Integer> out = new ArrayList<>(nodeIds.length);
        for (int nodeId : nodeIds) {
            out.add(nodeId);
        }
        return Collections.unmodifiableList(out);
    }
}
