package org.Aayush.gridopt.topology;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

/**
 * Mutable undirected edge state owned by {@link GridTopology}.
 * <p>
 * Resistance is always {@code >= 0} and stored risk is always within {@code [0, 1]}.
 * An edge taken out of service stays in the topology but is skipped by path search.
 * </p>
 */
@Getter
@Accessors(fluent = true)
public final class GridEdge {
    private final int id;
    private final int sourceNodeId;
    private final int targetNodeId;
    private final AssetCondition asset;

    private double resistance;
    @Setter(AccessLevel.PACKAGE)
    private double current;
    @Setter(AccessLevel.PACKAGE)
    private double temperature;
    @Setter(AccessLevel.PACKAGE)
    private double powerFlow;
    private double risk;
    private boolean riskAssigned;
    @Setter(AccessLevel.PACKAGE)
    private boolean inService = true;

    GridEdge(int id, int sourceNodeId, int targetNodeId, double resistance, AssetCondition asset) {
        this.id = id;
        this.sourceNodeId = sourceNodeId;
        this.targetNodeId = targetNodeId;
        this.asset = asset;
        resistance(resistance);
    }

    /**
     * Returns the endpoint opposite to {@code nodeId}.
     */
    public int otherEnd(int nodeId) {
        if (nodeId == sourceNodeId) {
            return targetNodeId;
        }
        if (nodeId == targetNodeId) {
            return sourceNodeId;
        }
        throw new IllegalArgumentException("node " + nodeId + " is not an endpoint of edge " + id);
    }

    void resistance(double resistance) {
        if (!Double.isFinite(resistance) || resistance < 0.0d) {
            throw new IllegalArgumentException("resistance must be finite and >= 0, got " + resistance);
        }
        this.resistance = resistance;
    }

    void risk(double risk) {
        this.risk = clampRisk(risk);
        this.riskAssigned = true;
    }

    /**
     * Clamps a risk value into {@code [0, 1]}; NaN is treated as maximum risk.
     */
    public static double clampRisk(double risk) {
        if (Double.isNaN(risk)) {
            return 1.0d;
        }
        return Math.max(0.0d, Math.min(1.0d, risk));
    }
}
