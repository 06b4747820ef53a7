package org.Aayush.gridopt.oracle;

import lombok.Builder;
import lombok.Value;

/**
 * Sensor and asset feature vector scored by a {@link RiskOracle}.
 */
@Value
@Builder
public class RiskFeatures {
    /** Equipment temperature in °C. */
    double temperature;
    /** Loading in percent of rated current. */
    double load;
    /** Vibration in mm/s. */
    double vibration;
    /** Age in years. */
    double age;
    /** Corrosion index in {@code [0, 1]}. */
    double corrosion;
    /** Total harmonic distortion in percent. */
    double harmonicDistortion;
    /** Oil quality in {@code [0, 1]}. */
    double oilQuality;
    /** Protective trip count. */
    int tripCount;
    /** Ambient temperature in °C. */
    double ambientTemperature;
    /** Relative humidity in percent. */
    double humidity;
}
