package org.Aayush.gridopt.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Grid Optimizer Config Tests")
class GridOptimizerConfigTest {

    private static Properties properties(String... keyValues) {
        Properties properties = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            properties.setProperty(GridOptimizerConfig.PROPERTY_PREFIX + keyValues[i], keyValues[i + 1]);
        }
        return properties;
    }

    @Test
    @DisplayName("Defaults match the documented values")
    void testDefaults() {
        GridOptimizerConfig config = GridOptimizerConfig.defaults();

        assertEquals(8, config.getNumNodes());
        assertEquals(2, config.getNumGenerators());
        assertEquals(10.0d, config.getRiskWeight(), 0.0);
        assertEquals(Duration.ofSeconds(3), config.refreshInterval());
        assertEquals(100, config.getHistoryWindow());
        assertEquals(1.0d, config.getRewardRiskWeight(), 0.0);
        assertTrue(config.isNormalizeAdvantage());
        assertEquals(Duration.ofMillis(50), config.riskOracleTimeout());
        assertFalse(config.usesRandomTopology());
        assertEquals(config, GridOptimizerConfig.fromProperties(new Properties()));
    }

    @Test
    @DisplayName("Prefixed properties override defaults")
    void testOverrides() {
        GridOptimizerConfig config = GridOptimizerConfig.fromProperties(properties(
                "riskWeight", "25",
                "historyWindow", " 20 ",
                "normalizeAdvantage", "FALSE",
                "randomSeed", "7",
                "topologyResource", "   ",
                "numNodes", "12",
                "numGenerators", "3"));

        assertEquals(25.0d, config.getRiskWeight(), 0.0);
        assertEquals(20, config.getHistoryWindow());
        assertFalse(config.isNormalizeAdvantage());
        assertEquals(7L, config.getRandomSeed());
        assertTrue(config.usesRandomTopology());
        assertEquals(12, config.getNumNodes());
        assertEquals(GridOptimizerConfig.DEFAULT_LEARNING_RATE, config.getLearningRate(), 0.0);
    }

    @Test
    @DisplayName("Unparseable and out-of-range values are rejected")
    void testInvalidValues() {
        assertThrows(IllegalArgumentException.class,
                () -> GridOptimizerConfig.fromProperties(properties("riskWeight", "heavy")));
        assertThrows(IllegalArgumentException.class,
                () -> GridOptimizerConfig.fromProperties(properties("normalizeAdvantage", "yes")));
        assertThrows(IllegalArgumentException.class,
                () -> GridOptimizerConfig.fromProperties(properties("riskWeight", "-1")));
        assertThrows(IllegalArgumentException.class,
                () -> GridOptimizerConfig.fromProperties(properties("refreshIntervalMillis", "0")));
        assertThrows(IllegalArgumentException.class,
                () -> GridOptimizerConfig.fromProperties(properties("numNodes", "2")));
        assertThrows(IllegalArgumentException.class,
                () -> GridOptimizerConfig.builder().baselineDecay(1.0d).build().validate());
        assertThrows(IllegalArgumentException.class,
                () -> GridOptimizerConfig.builder().learningRate(Double.NaN).build().validate());
    }
}
