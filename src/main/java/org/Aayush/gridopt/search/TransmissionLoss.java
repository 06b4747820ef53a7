package org.Aayush.gridopt.search;

/**
 * Resistive loss approximation for routed demand.
 * <pre>
 * loss_mw      = demand_mw * total_path_resistance
 * loss_percent = 100 * sum(loss_mw) / sum(demand_mw)
 * </pre>
 * Risk influences routing only, never the loss quantity.
 */
public final class TransmissionLoss {

    private TransmissionLoss() {
    }

    public static double lossMegawatts(double demand, GridPath path) {
        return lossMegawatts(demand, path.totalResistance());
    }

    public static double lossMegawatts(double demand, double totalResistance) {
        if (!Double.isFinite(demand) || demand < 0.0d) {
            throw new IllegalArgumentException("demand must be finite and >= 0, got " + demand);
        }
        if (!Double.isFinite(totalResistance) || totalResistance < 0.0d) {
            throw new IllegalArgumentException("totalResistance must be finite and >= 0, got " + totalResistance);
        }
        return demand * totalResistance;
    }

    /**
     * @return loss as a percentage of demand, {@code 0} when there is no demand.
     */
    public static double lossPercent(double totalLoss, double totalDemand) {
        if (totalDemand <= 0.0d) {
            return 0.0d;
        }
        return 100.0d * totalLoss / totalDemand;
    }
}
