package org.Aayush.gridopt.oracle;

import org.Aayush.gridopt.core.error.GridOptimizationException;

/**
 * Thrown when the risk oracle fails, times out or returns an unusable probability.
 */
public final class RiskOracleUnavailableException extends GridOptimizationException {
    public static final String REASON_UNAVAILABLE = "GRID_RISK_ORACLE_UNAVAILABLE";
    public static final String REASON_TIMEOUT = "GRID_RISK_ORACLE_TIMEOUT";
    public static final String REASON_INVALID_PROBABILITY = "GRID_RISK_ORACLE_INVALID_PROBABILITY";

    public RiskOracleUnavailableException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public RiskOracleUnavailableException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}
