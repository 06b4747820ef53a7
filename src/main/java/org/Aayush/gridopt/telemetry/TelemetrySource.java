package org.Aayush.gridopt.telemetry;

/**
 * Supplier of per-cycle grid readings.
 */
@FunctionalInterface
public interface TelemetrySource {

    /**
     * Produces the readings for the next cycle.
     */
    TelemetryFrame nextFrame();
}
