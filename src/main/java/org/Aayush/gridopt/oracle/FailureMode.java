package org.Aayush.gridopt.oracle;

/**
 * Coarse failure classification attached to elevated risk scores.
 */
public enum FailureMode {
    THERMAL_OVERLOAD,
    MECHANICAL_FATIGUE,
    ELECTRICAL_DISTURBANCE,
    GENERAL_DEGRADATION
}
