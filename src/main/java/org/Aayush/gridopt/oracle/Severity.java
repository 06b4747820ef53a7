package org.Aayush.gridopt.oracle;

/**
 * Severity label derived from failure probability.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Maps a probability to its severity band: {@code > 0.7} critical, {@code > 0.4} high,
     * {@code > 0.2} medium, otherwise low.
     */
    public static Severity fromProbability(double probability) {
        if (probability > 0.7d) {
            return CRITICAL;
        }
        if (probability > 0.4d) {
            return HIGH;
        }
        if (probability > 0.2d) {
            return MEDIUM;
        }
        return LOW;
    }
}
