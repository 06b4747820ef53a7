package org.Aayush.gridopt.cost;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.gridopt.topology.GridEdge;
import org.Aayush.gridopt.topology.GridTopology;

import java.util.Objects;

/**
 * Risk-weighted edge cost used by the path search.
 * <p>
 * Canonical edge weight:
 * </p>
 * <pre>
 * clamped_risk = clamp(risk, 0, 1)        (NaN counts as 1)
 * risk_penalty = risk_weight * clamped_risk
 * weight       = resistance + risk_penalty
 * </pre>
 * <p>
 * Larger {@code riskWeight} values make the search avoid risky edges even at the price of
 * higher-resistance routes. The function is pure and never returns a negative weight.
 * </p>
 */
@Accessors(fluent = true)
public final class CostFunction {

    /** Documented default risk sensitivity. */
    public static final double DEFAULT_RISK_WEIGHT = 10.0d;

    @Getter
    private final double riskWeight;

    public CostFunction() {
        this(DEFAULT_RISK_WEIGHT);
    }

    /**
     * @param riskWeight risk sensitivity; must be finite and {@code >= 0}.
     */
    public CostFunction(double riskWeight) {
        if (!Double.isFinite(riskWeight) || riskWeight < 0.0d) {
            throw new IllegalArgumentException("riskWeight must be finite and >= 0, got " + riskWeight);
        }
        this.riskWeight = riskWeight;
    }

    /**
     * Scalar weight from raw edge attributes.
     *
     * @param resistance edge resistance; must be finite and {@code >= 0}.
     * @param risk edge risk; clamped into {@code [0, 1]}.
     */
    public double weight(double resistance, double risk) {
        ensureValidResistance(resistance);
        return resistance + riskWeight * GridEdge.clampRisk(risk);
    }

    public double weight(GridEdge edge) {
        Objects.requireNonNull(edge, "edge");
        return weight(edge.resistance(), edge.risk());
    }

    public double weight(GridTopology topology, int edgeId) {
        return weight(topology.edge(edgeId));
    }

    /**
     * Explainable cost computation for diagnostics.
     */
    public CostBreakdown explain(GridEdge edge) {
        Objects.requireNonNull(edge, "edge");
        double clamped = GridEdge.clampRisk(edge.risk());
        double penalty = riskWeight * clamped;
        ensureValidResistance(edge.resistance());
        return new CostBreakdown(edge.id(), edge.resistance(), edge.risk(), clamped, penalty, edge.resistance() + penalty);
    }

    private static void ensureValidResistance(double resistance) {
        if (!Double.isFinite(resistance) || resistance < 0.0d) {
            throw new IllegalStateException("resistance must be finite and >= 0, got " + resistance);
        }
    }

    /**
     * Immutable explainability payload.
     */
    public record CostBreakdown(
            int edgeId,
            double resistance,
            double rawRisk,
            double clampedRisk,
            double riskPenalty,
            double weight
    ) {
        /**
         * Returns whether the stored risk had to be clamped.
         */
        public boolean riskClamped() {
            return Double.compare(rawRisk, clampedRisk) != 0;
        }
    }
}
