package org.Aayush.gridopt.telemetry;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.gridopt.topology.EdgeTelemetry;
import org.Aayush.gridopt.topology.NodeTelemetry;

import java.util.List;

/**
 * One cycle of readings from the telemetry source.
 */
@Value
@Builder
public class TelemetryFrame {
    /** Source-side sequence number. */
    long iteration;
    @Singular
    List<NodeTelemetry> nodeUpdates;
    @Singular
    List<EdgeTelemetry> edgeUpdates;
    @Builder.Default
    AmbientConditions ambient = AmbientConditions.STANDARD;

    /**
     * Frame carrying no updates; the topology keeps its previous readings.
     */
    public static TelemetryFrame empty(long iteration) {
        return TelemetryFrame.builder().iteration(iteration).build();
    }
}
