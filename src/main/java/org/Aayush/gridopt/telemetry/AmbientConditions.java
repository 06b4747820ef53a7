package org.Aayush.gridopt.telemetry;

/**
 * Weather conditions reported alongside a telemetry frame.
 */
public record AmbientConditions(double temperature, double humidity) {
    public static final AmbientConditions STANDARD = new AmbientConditions(25.0d, 60.0d);

    public AmbientConditions {
        if (!Double.isFinite(temperature)) {
            throw new IllegalArgumentException("ambient temperature must be finite");
        }
        if (!Double.isFinite(humidity) || humidity < 0.0d || humidity > 100.0d) {
            throw new IllegalArgumentException("humidity must be within [0, 100], got " + humidity);
        }
    }
}
