package org.Aayush.gridopt.topology;

/**
 * Per-cycle edge reading keyed by its unordered endpoint pair.
 */
public record EdgeTelemetry(
        int sourceNodeId,
        int targetNodeId,
        double resistance,
        double current,
        double temperature
) {
    public EdgeTelemetry {
        if (!Double.isFinite(resistance) || resistance < 0.0d) {
            throw new IllegalArgumentException("resistance must be finite and >= 0, got " + resistance);
        }
        if (!Double.isFinite(current)) {
            throw new IllegalArgumentException("current must be finite");
        }
        if (!Double.isFinite(temperature)) {
            throw new IllegalArgumentException("temperature must be finite");
        }
    }
}
