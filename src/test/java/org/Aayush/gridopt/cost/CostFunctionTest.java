package org.Aayush.gridopt.cost;

import org.Aayush.gridopt.testutil.GridFixtures;
import org.Aayush.gridopt.topology.GridTopology;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Cost Function Tests")
class CostFunctionTest {

    @Test
    @DisplayName("Weight is resistance plus risk-weighted penalty")
    void testWeightFormula() {
        CostFunction cost = new CostFunction();

        assertEquals(10.0d, cost.riskWeight(), 0.0);
        assertEquals(9.002d, cost.weight(0.002d, 0.9d), 1e-12);
        assertEquals(1.01d, cost.weight(0.01d, 0.1d), 1e-12);
        assertEquals(0.004d, new CostFunction(0.0d).weight(0.004d, 0.8d), 0.0);
    }

    @Test
    @DisplayName("Out-of-range and NaN risk is clamped, never producing negative weights")
    void testClamping() {
        CostFunction cost = new CostFunction(10.0d);

        assertEquals(0.003d, cost.weight(0.003d, -2.0d), 0.0);
        assertEquals(10.003d, cost.weight(0.003d, 4.0d), 1e-12);
        assertEquals(10.003d, cost.weight(0.003d, Double.NaN), 1e-12);
        for (double risk = -1.0d; risk <= 2.0d; risk += 0.25d) {
            assertTrue(cost.weight(0.0d, risk) >= 0.0d);
        }
    }

    @Test
    @DisplayName("Rejects invalid risk weights and resistances")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> new CostFunction(-0.1d));
        assertThrows(IllegalArgumentException.class, () -> new CostFunction(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> new CostFunction(Double.POSITIVE_INFINITY));
        assertThrows(IllegalStateException.class, () -> new CostFunction().weight(-0.001d, 0.5d));
    }

    @Test
    @DisplayName("Explain exposes the same weight as the scalar path")
    void testExplain() {
        GridTopology topology = GridFixtures.topology(GridFixtures.riskDetourDefinition());
        topology.updateRisk(0, 1.5d);
        CostFunction cost = new CostFunction(10.0d);

        CostFunction.CostBreakdown breakdown = cost.explain(topology.edge(0));

        assertEquals(0, breakdown.edgeId());
        assertEquals(0.002d, breakdown.resistance(), 0.0);
        assertEquals(1.0d, breakdown.rawRisk(), 0.0);
        assertEquals(1.0d, breakdown.clampedRisk(), 0.0);
        assertEquals(10.0d, breakdown.riskPenalty(), 0.0);
        assertEquals(cost.weight(topology, 0), breakdown.weight(), 0.0);
        assertFalse(breakdown.riskClamped());
    }
}
