package org.Aayush.gridopt.policy;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Exponential moving-average reward baseline.
 *
 * <pre>
 * baseline' = decay * baseline + (1 - decay) * reward
 * variance' = decay * variance + (1 - decay) * (reward - baseline)^2
 * advantage = clip((reward - baseline) / sqrt(variance'), -clip, clip)
 * </pre>
 * The first reward only seeds the baseline and yields advantage {@code 0}. Normalisation is
 * skipped while the variance is still degenerate.
 */
@Accessors(fluent = true)
public final class AdvantageEstimator {
    private static final double MIN_STD = 1e-9d;

    private final double decay;
    private final boolean normalize;
    private final double clip;

    @Getter
    private double baseline;
    private double variance;
    @Getter
    private boolean warmedUp;

    public AdvantageEstimator(double decay, boolean normalize, double clip) {
        if (!(decay >= 0.0d && decay < 1.0d)) {
            throw new IllegalArgumentException("decay must be within [0, 1), got " + decay);
        }
        if (!(clip > 0.0d)) {
            throw new IllegalArgumentException("clip must be > 0, got " + clip);
        }
        this.decay = decay;
        this.normalize = normalize;
        this.clip = clip;
    }

    /**
     * Folds one episode reward into the baseline and returns its advantage.
     */
    public double advantage(double reward) {
        if (!Double.isFinite(reward)) {
            throw new IllegalArgumentException("reward must be finite, got " + reward);
        }
        if (!warmedUp) {
            baseline = reward;
            variance = 0.0d;
            warmedUp = true;
            return 0.0d;
        }
        double deviation = reward - baseline;
        baseline = decay * baseline + (1.0d - decay) * reward;
        variance = decay * variance + (1.0d - decay) * deviation * deviation;

        double advantage = deviation;
        double std = Math.sqrt(variance);
        if (normalize && std > MIN_STD) {
            advantage = deviation / std;
        }
        return Math.max(-clip, Math.min(clip, advantage));
    }

    public double standardDeviation() {
        return Math.sqrt(variance);
    }
}
