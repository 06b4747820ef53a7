package org.Aayush.gridopt.oracle;

import java.util.Objects;

/**
 * Lightweight weighted-feature scorer used when no trained model is wired in.
 * <pre>
 * risk = 0.3 * load / 100 + 0.4 * temperature / 100 + 0.2 * age / 20 + 0.1 * vibration
 * </pre>
 * capped to {@code [0, 0.95]}.
 */
public final class HeuristicRiskOracle implements RiskOracle {
    static final double MAX_RISK = 0.95d;

    @Override
    public RiskAssessment score(RiskFeatures features) {
        Objects.requireNonNull(features, "features");
        double raw = 0.3d * (features.getLoad() / 100.0d)
                + 0.4d * (features.getTemperature() / 100.0d)
                + 0.2d * (features.getAge() / 20.0d)
                + 0.1d * features.getVibration();
        if (!Double.isFinite(raw)) {
            throw new RiskOracleUnavailableException(
                    RiskOracleUnavailableException.REASON_INVALID_PROBABILITY, "non-finite heuristic risk " + raw);
        }
        double probability = Math.max(0.0d, Math.min(MAX_RISK, raw));
        return RiskAssessment.classify(probability, features);
    }
}
