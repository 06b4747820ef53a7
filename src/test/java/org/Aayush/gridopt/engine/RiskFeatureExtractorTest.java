package org.Aayush.gridopt.engine;

import org.Aayush.gridopt.oracle.RiskFeatures;
import org.Aayush.gridopt.telemetry.AmbientConditions;
import org.Aayush.gridopt.testutil.GridFixtures;
import org.Aayush.gridopt.topology.AssetCondition;
import org.Aayush.gridopt.topology.EdgeTelemetry;
import org.Aayush.gridopt.topology.GridTopology;
import org.Aayush.gridopt.topology.NodeTelemetry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Risk Feature Extractor Tests")
class RiskFeatureExtractorTest {

    @Test
    @DisplayName("Features combine edge telemetry, asset record and ambient conditions")
    void testExtract() {
        GridTopology topology = GridFixtures.topology(GridFixtures.branchDefinition());
        topology.applyTelemetry(
                List.of(new NodeTelemetry(2, 220.0d, 31.0d), new NodeTelemetry(3, 221.0d, 39.0d)),
                List.of(new EdgeTelemetry(2, 3, 0.004d, 250.0d, 52.0d)));
        AmbientConditions ambient = new AmbientConditions(30.0d, 70.0d);

        RiskFeatures features = new RiskFeatureExtractor().extract(topology, topology.edge(3), ambient);

        assertEquals(52.0d, features.getTemperature(), 0.0);
        assertEquals(35.0d, features.getLoad(), 1e-12);
        assertEquals(AssetCondition.NOMINAL.getAgeYears(), features.getAge(), 0.0);
        assertEquals(AssetCondition.NOMINAL.getTripCount(), features.getTripCount());
        assertEquals(30.0d, features.getAmbientTemperature(), 0.0);
        assertEquals(70.0d, features.getHumidity(), 0.0);
    }

    @Test
    @DisplayName("Generator endpoints count at nominal load")
    void testGeneratorLoad() {
        GridTopology topology = GridFixtures.topology(GridFixtures.branchDefinition());

        RiskFeatures between = new RiskFeatureExtractor().extract(topology, topology.edge(0), AmbientConditions.STANDARD);
        RiskFeatures mixed = new RiskFeatureExtractor().extract(topology, topology.edge(1), AmbientConditions.STANDARD);

        assertEquals(RiskFeatureExtractor.GENERATOR_NOMINAL_LOAD, between.getLoad(), 0.0);
        assertEquals((RiskFeatureExtractor.GENERATOR_NOMINAL_LOAD + 30.0d) / 2.0d, mixed.getLoad(), 1e-12);
    }
}
