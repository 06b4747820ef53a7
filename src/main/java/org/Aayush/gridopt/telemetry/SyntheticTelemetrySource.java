package org.Aayush.gridopt.telemetry;

import org.Aayush.gridopt.topology.EdgeTelemetry;
import org.Aayush.gridopt.topology.NodeTelemetry;
import org.Aayush.gridopt.topology.NodeRole;
import org.Aayush.gridopt.topology.TopologySnapshot;

import java.util.Objects;
import java.util.Random;

/**
 * Seeded SCADA-style reading generator for demos and soak runs.
 * <ul>
 * <li>voltage: uniform 210..230 kV per node;</li>
 * <li>observed demand: declared demand ±2 MW, never below 80 % of it;</li>
 * <li>resistance: uniform 0.001..0.005 Ω;</li>
 * <li>current: uniform 100..400 A plus twice the observed demand at both endpoints;</li>
 * <li>temperature: {@code 25 + current / 400 * 40} ±2 °C.</li>
 * </ul>
 */
public final class SyntheticTelemetrySource implements TelemetrySource {

    private final TopologySnapshot layout;
    private final Random random;
    private long iteration;

    public SyntheticTelemetrySource(TopologySnapshot layout, long seed) {
        this.layout = Objects.requireNonNull(layout, "layout");
        this.random = new Random(seed);
    }

    @Override
    public TelemetryFrame nextFrame() {
        iteration++;
        TelemetryFrame.TelemetryFrameBuilder frame = TelemetryFrame.builder().iteration(iteration);

        double[] observedDemand = new double[layout.nodes().size()];
        for (TopologySnapshot.NodeView node : layout.nodes()) {
            double voltage = uniform(210.0d, 230.0d);
            double demand = 0.0d;
            if (node.role() == NodeRole.SUBSTATION) {
                double base = node.demand();
                demand = Math.max(base + uniform(-2.0d, 2.0d), base * 0.8d);
            }
            observedDemand[node.id()] = demand;
            frame.nodeUpdate(new NodeTelemetry(node.id(), voltage, demand));
        }

        for (TopologySnapshot.EdgeView edge : layout.edges()) {
            double resistance = uniform(0.001d, 0.005d);
            double connectedDemand = observedDemand[edge.sourceNodeId()] + observedDemand[edge.targetNodeId()];
            double current = uniform(100.0d, 400.0d) + connectedDemand * 2.0d;
            double temperature = 25.0d + (current / 400.0d) * 40.0d + uniform(-2.0d, 2.0d);
            frame.edgeUpdate(new EdgeTelemetry(edge.sourceNodeId(), edge.targetNodeId(), resistance, current, temperature));
        }

        frame.ambient(new AmbientConditions(uniform(15.0d, 35.0d), uniform(30.0d, 90.0d)));
        return frame.build();
    }

    private double uniform(double low, double high) {
        return low + (high - low) * random.nextDouble();
    }
}
