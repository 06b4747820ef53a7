package org.Aayush.gridopt.oracle;

/**
 * Equipment-failure risk scorer.
 * <p>
 * Implementations must answer quickly (tens of milliseconds); wrap slow scorers in
 * {@link TimeBoundedRiskOracle}.
 * </p>
 */
@FunctionalInterface
public interface RiskOracle {

    /**
     * Scores one asset.
     *
     * @param features sensor and asset features.
     * @return assessment with probability in {@code [0, 1]}.
     * @throws RiskOracleUnavailableException when no score can be produced.
     */
    RiskAssessment score(RiskFeatures features);
}
