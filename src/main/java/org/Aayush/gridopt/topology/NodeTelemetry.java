package org.Aayush.gridopt.topology;

/**
 * Per-cycle node reading. {@code observedDemand} is informational; substation demand stays constant.
 */
public record NodeTelemetry(int nodeId, double voltage, double observedDemand) {
    public NodeTelemetry {
        if (!Double.isFinite(voltage) || voltage < 0.0d) {
            throw new IllegalArgumentException("voltage must be finite and >= 0, got " + voltage);
        }
        if (!Double.isFinite(observedDemand) || observedDemand < 0.0d) {
            throw new IllegalArgumentException("observedDemand must be finite and >= 0, got " + observedDemand);
        }
    }
}
