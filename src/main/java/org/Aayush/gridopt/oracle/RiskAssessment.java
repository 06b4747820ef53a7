package org.Aayush.gridopt.oracle;

import lombok.Value;

import java.util.Optional;

/**
 * Oracle output: failure probability plus optional coarse classification.
 */
@Value
public class RiskAssessment {
    /** Classification is only attached above this probability. */
    static final double CLASSIFICATION_THRESHOLD = 0.3d;

    double probability;
    FailureMode failureMode;
    Severity severity;

    private RiskAssessment(double probability, FailureMode failureMode, Severity severity) {
        this.probability = probability;
        this.failureMode = failureMode;
        this.severity = severity;
    }

    /**
     * Builds an assessment, deriving severity from the probability and the failure mode from
     * the dominant feature when the probability exceeds {@code 0.3}.
     *
     * @throws IllegalArgumentException if {@code probability} is outside {@code [0, 1]}.
     */
    public static RiskAssessment classify(double probability, RiskFeatures features) {
        if (!(probability >= 0.0d && probability <= 1.0d)) {
            throw new IllegalArgumentException("probability must be within [0, 1], got " + probability);
        }
        FailureMode mode = null;
        if (probability > CLASSIFICATION_THRESHOLD && features != null) {
            if (features.getTemperature() > 90.0d) {
                mode = FailureMode.THERMAL_OVERLOAD;
            } else if (features.getVibration() > 1.0d) {
                mode = FailureMode.MECHANICAL_FATIGUE;
            } else if (features.getHarmonicDistortion() > 8.0d) {
                mode = FailureMode.ELECTRICAL_DISTURBANCE;
            } else {
                mode = FailureMode.GENERAL_DEGRADATION;
            }
        }
        return new RiskAssessment(probability, mode, Severity.fromProbability(probability));
    }

    /**
     * Probability-only assessment without failure classification.
     */
    public static RiskAssessment of(double probability) {
        return classify(probability, null);
    }

    public Optional<FailureMode> failureModeIfAny() {
        return Optional.ofNullable(failureMode);
    }
}
