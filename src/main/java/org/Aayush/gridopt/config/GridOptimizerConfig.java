package org.Aayush.gridopt.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Properties;
import java.util.function.Function;

/**
 * Startup-time configuration of the optimizer.
 *
 * <p>Every field can be overridden through a system property named {@code gridopt.<field>},
 * e.g. {@code -Dgridopt.riskWeight=25}. Values are fixed once the optimizer is built.</p>
 */
@Value
@Builder(toBuilder = true)
public class GridOptimizerConfig {
    public static final String PROPERTY_PREFIX = "gridopt.";

    public static final int DEFAULT_NUM_NODES = 8;
    public static final int DEFAULT_NUM_GENERATORS = 2;
    public static final double DEFAULT_RISK_WEIGHT = 10.0d;
    public static final long DEFAULT_REFRESH_INTERVAL_MILLIS = 3_000L;
    public static final int DEFAULT_HISTORY_WINDOW = 100;
    public static final double DEFAULT_REWARD_RISK_WEIGHT = 1.0d;
    public static final double DEFAULT_LEARNING_RATE = 0.05d;
    public static final double DEFAULT_BASELINE_DECAY = 0.9d;
    public static final double DEFAULT_ADVANTAGE_CLIP = 5.0d;
    public static final long DEFAULT_RISK_ORACLE_TIMEOUT_MILLIS = 50L;
    public static final long DEFAULT_RANDOM_SEED = 42L;
    public static final String DEFAULT_TOPOLOGY_RESOURCE = "default-grid.json";

    /** Total node count, generators included. */
    @Builder.Default
    int numNodes = DEFAULT_NUM_NODES;
    @Builder.Default
    int numGenerators = DEFAULT_NUM_GENERATORS;
    /** Path-cost risk sensitivity. */
    @Builder.Default
    double riskWeight = DEFAULT_RISK_WEIGHT;
    @Builder.Default
    long refreshIntervalMillis = DEFAULT_REFRESH_INTERVAL_MILLIS;
    @Builder.Default
    int historyWindow = DEFAULT_HISTORY_WINDOW;
    /** Weight of average risk in the reward, separate from {@link #riskWeight}. */
    @Builder.Default
    double rewardRiskWeight = DEFAULT_REWARD_RISK_WEIGHT;
    @Builder.Default
    double learningRate = DEFAULT_LEARNING_RATE;
    @Builder.Default
    double baselineDecay = DEFAULT_BASELINE_DECAY;
    @Builder.Default
    boolean normalizeAdvantage = true;
    @Builder.Default
    double advantageClip = DEFAULT_ADVANTAGE_CLIP;
    @Builder.Default
    long riskOracleTimeoutMillis = DEFAULT_RISK_ORACLE_TIMEOUT_MILLIS;
    @Builder.Default
    long randomSeed = DEFAULT_RANDOM_SEED;
    /** Classpath topology document; blank selects a random connected topology. */
    @Builder.Default
    String topologyResource = DEFAULT_TOPOLOGY_RESOURCE;

    public static GridOptimizerConfig defaults() {
        return GridOptimizerConfig.builder().build().validate();
    }

    /**
     * Reads overrides from {@link System#getProperties()}.
     */
    public static GridOptimizerConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Reads overrides from {@code properties}; absent or blank keys keep their default.
     *
     * @throws IllegalArgumentException if a value does not parse or is out of range.
     */
    public static GridOptimizerConfig fromProperties(Properties properties) {
        GridOptimizerConfig base = GridOptimizerConfig.builder().build();
        return GridOptimizerConfig.builder()
                .numNodes(read(properties, "numNodes", Integer::parseInt, base.numNodes))
                .numGenerators(read(properties, "numGenerators", Integer::parseInt, base.numGenerators))
                .riskWeight(read(properties, "riskWeight", Double::parseDouble, base.riskWeight))
                .refreshIntervalMillis(read(properties, "refreshIntervalMillis", Long::parseLong, base.refreshIntervalMillis))
                .historyWindow(read(properties, "historyWindow", Integer::parseInt, base.historyWindow))
                .rewardRiskWeight(read(properties, "rewardRiskWeight", Double::parseDouble, base.rewardRiskWeight))
                .learningRate(read(properties, "learningRate", Double::parseDouble, base.learningRate))
                .baselineDecay(read(properties, "baselineDecay", Double::parseDouble, base.baselineDecay))
                .normalizeAdvantage(read(properties, "normalizeAdvantage", GridOptimizerConfig::parseBoolean, base.normalizeAdvantage))
                .advantageClip(read(properties, "advantageClip", Double::parseDouble, base.advantageClip))
                .riskOracleTimeoutMillis(read(properties, "riskOracleTimeoutMillis", Long::parseLong, base.riskOracleTimeoutMillis))
                .randomSeed(read(properties, "randomSeed", Long::parseLong, base.randomSeed))
                .topologyResource(properties.getProperty(PROPERTY_PREFIX + "topologyResource", base.topologyResource).trim())
                .build()
                .validate();
    }

    /**
     * Checks ranges and returns {@code this}.
     *
     * @throws IllegalArgumentException on the first invalid value.
     */
    public GridOptimizerConfig validate() {
        if (numGenerators < 1) {
            throw new IllegalArgumentException("numGenerators must be >= 1, got " + numGenerators);
        }
        if (numNodes <= numGenerators) {
            throw new IllegalArgumentException(
                    "numNodes must exceed numGenerators, got " + numNodes + " <= " + numGenerators);
        }
        requireFiniteNonNegative("riskWeight", riskWeight);
        requireFiniteNonNegative("rewardRiskWeight", rewardRiskWeight);
        requireFiniteNonNegative("learningRate", learningRate);
        if (refreshIntervalMillis <= 0L) {
            throw new IllegalArgumentException("refreshIntervalMillis must be > 0, got " + refreshIntervalMillis);
        }
        if (historyWindow < 1) {
            throw new IllegalArgumentException("historyWindow must be >= 1, got " + historyWindow);
        }
        if (!(baselineDecay >= 0.0d && baselineDecay < 1.0d)) {
            throw new IllegalArgumentException("baselineDecay must be within [0, 1), got " + baselineDecay);
        }
        if (!(advantageClip > 0.0d) || Double.isInfinite(advantageClip)) {
            throw new IllegalArgumentException("advantageClip must be finite and > 0, got " + advantageClip);
        }
        if (riskOracleTimeoutMillis <= 0L) {
            throw new IllegalArgumentException("riskOracleTimeoutMillis must be > 0, got " + riskOracleTimeoutMillis);
        }
        if (topologyResource == null) {
            throw new IllegalArgumentException("topologyResource must not be null; use blank for a random topology");
        }
        return this;
    }

    public Duration refreshInterval() {
        return Duration.ofMillis(refreshIntervalMillis);
    }

    public Duration riskOracleTimeout() {
        return Duration.ofMillis(riskOracleTimeoutMillis);
    }

    public boolean usesRandomTopology() {
        return topologyResource.isBlank();
    }

    private static <T> T read(Properties properties, String field, Function<String, T> parser, T fallback) {
        String raw = properties.getProperty(PROPERTY_PREFIX + field);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return parser.apply(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(
                    "invalid value for " + PROPERTY_PREFIX + field + ": '" + raw + "'", ex);
        }
    }

    private static boolean parseBoolean(String raw) {
        if ("true".equalsIgnoreCase(raw)) {
            return true;
        }
        if ("false".equalsIgnoreCase(raw)) {
            return false;
        }
        throw new NumberFormatException("not a boolean: " + raw);
    }

    private static void requireFiniteNonNegative(String field, double value) {
        if (!Double.isFinite(value) || value < 0.0d) {
            throw new IllegalArgumentException(field + " must be finite and >= 0, got " + value);
        }
    }
}
