package org.Aayush.gridopt.topology;

import lombok.Builder;
import lombok.Value;

/**
 * Static condition of the equipment behind one edge, used as risk-oracle input.
 */
@Value
@Builder(toBuilder = true)
public class AssetCondition {
    /** Condition used when a topology definition leaves the asset unspecified. */
    public static final AssetCondition NOMINAL = AssetCondition.builder().build();

    /** Equipment age in years. */
    @Builder.Default
    double ageYears = 10.0d;
    /** Corrosion index in {@code [0, 1]}. */
    @Builder.Default
    double corrosion = 0.25d;
    /** Vibration in mm/s. */
    @Builder.Default
    double vibration = 0.3d;
    /** Total harmonic distortion in percent. */
    @Builder.Default
    double harmonicDistortion = 2.0d;
    /** Insulating oil quality in {@code [0, 1]}, higher is better. */
    @Builder.Default
    double oilQuality = 0.8d;
    /** Number of protective trips recorded. */
    @Builder.Default
    int tripCount = 20;
}
