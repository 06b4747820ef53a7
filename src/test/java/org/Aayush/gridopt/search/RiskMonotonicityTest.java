package org.Aayush.gridopt.search;

import org.Aayush.gridopt.cost.CostFunction;
import org.Aayush.gridopt.io.RandomTopologyGenerator;
import org.Aayush.gridopt.topology.GridTopology;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Risk Weight Monotonicity Tests")
class RiskMonotonicityTest {

    private static final double[] RISK_WEIGHTS = {0.0d, 0.5d, 1.0d, 2.0d, 5.0d, 10.0d, 25.0d, 100.0d};

    @Test
    @DisplayName("Raising the risk weight never increases the risk exposure of the chosen path")
    void testRiskExposureNonIncreasing() {
        for (long seed = 1; seed <= 20; seed++) {
            GridTopology topology = GridTopology.fromDefinition(new RandomTopologyGenerator(seed).generate(10, 2));
            Random random = new Random(seed * 31);
            for (int edgeId = 0; edgeId < topology.edgeCount(); edgeId++) {
                topology.updateRisk(edgeId, random.nextDouble());
            }

            for (int source : topology.substationIds()) {
                for (int generator : topology.generatorIds()) {
                    double previousRisk = Double.POSITIVE_INFINITY;
                    double previousResistance = Double.NEGATIVE_INFINITY;
                    for (double riskWeight : RISK_WEIGHTS) {
                        GridPath path = new DijkstraPathFinder(new CostFunction(riskWeight))
                                .findPath(topology, source, generator);
                        assertTrue(path.totalRisk() <= previousRisk + 1e-9,
                                "risk rose at weight " + riskWeight + " for " + source + "->" + generator);
                        assertTrue(path.totalResistance() >= previousResistance - 1e-9,
                                "resistance fell at weight " + riskWeight + " for " + source + "->" + generator);
                        previousRisk = path.totalRisk();
                        previousResistance = path.totalResistance();
                    }
                }
            }
        }
    }
}
