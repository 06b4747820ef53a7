package org.Aayush.gridopt.engine;

import org.Aayush.gridopt.topology.TopologySnapshot;

import java.util.List;
import java.util.Objects;

/**
 * Aggregate telemetry figures over one topology snapshot.
 * <p>
 * Node figures (voltage, observed demand) cover every node; edge figures (risk, temperature,
 * power flow, current) cover every edge, in service or not. Empty populations report zeros.
 * </p>
 */
public record GridStatistics(
        long iteration,
        int nodeCount,
        int edgeCount,
        Summary voltage,
        Summary demand,
        double totalDemand,
        Summary risk,
        int highRiskEdges,
        Summary temperature,
        Summary powerFlow,
        double totalPowerFlow,
        Summary current
) {
    static final double HIGH_RISK_THRESHOLD = 0.5d;

    public static GridStatistics of(TopologySnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        List<TopologySnapshot.NodeView> nodes = snapshot.nodes();
        List<TopologySnapshot.EdgeView> edges = snapshot.edges();

        double[] voltages = new double[nodes.size()];
        double[] demands = new double[nodes.size()];
        for (int i = 0; i < nodes.size(); i++) {
            voltages[i] = nodes.get(i).voltage();
            demands[i] = nodes.get(i).observedDemand();
        }

        double[] risks = new double[edges.size()];
        double[] temperatures = new double[edges.size()];
        double[] flows = new double[edges.size()];
        double[] currents = new double[edges.size()];
        int highRisk = 0;
        for (int i = 0; i < edges.size(); i++) {
            TopologySnapshot.EdgeView edge = edges.get(i);
            risks[i] = edge.risk();
            temperatures[i] = edge.temperature();
            flows[i] = edge.powerFlow();
            currents[i] = edge.current();
            if (edge.risk() > HIGH_RISK_THRESHOLD) {
                highRisk++;
            }
        }

        return new GridStatistics(
                snapshot.iteration(),
                nodes.size(),
                edges.size(),
                Summary.of(voltages),
                Summary.of(demands),
                sum(demands),
                Summary.of(risks),
                highRisk,
                Summary.of(temperatures),
                Summary.of(flows),
                sum(flows),
                Summary.of(currents)
        );
    }

    private static double sum(double[] values) {
        double total = 0.0d;
        for (double value : values) {
            total += value;
        }
        return total;
    }

    /**
     * Mean, population standard deviation and extremes of one reading.
     */
    public record Summary(double mean, double std, double min, double max) {
        public static final Summary EMPTY = new Summary(0.0d, 0.0d, 0.0d, 0.0d);

        static Summary of(double[] values) {
            if (values.length == 0) {
                return EMPTY;
            }
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            double total = 0.0d;
            for (double value : values) {
                total += value;
                min = Math.min(min, value);
                max = Math.max(max, value);
            }
            double mean = total / values.length;
            double squares = 0.0d;
            for (double value : values) {
                double deviation = value - mean;
                squares += deviation * deviation;
            }
            return new Summary(mean, Math.sqrt(squares / values.length), min, max);
        }
    }
}
