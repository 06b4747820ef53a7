package org.Aayush.gridopt.engine;

import org.Aayush.gridopt.oracle.RiskFeatures;
import org.Aayush.gridopt.telemetry.AmbientConditions;
import org.Aayush.gridopt.topology.AssetCondition;
import org.Aayush.gridopt.topology.GridEdge;
import org.Aayush.gridopt.topology.GridNode;
import org.Aayush.gridopt.topology.GridTopology;

/**
 * Builds the oracle feature vector of one edge from its telemetry, asset record and the
 * frame's ambient conditions. Load is the mean endpoint demand, with generators counted at
 * {@value #GENERATOR_NOMINAL_LOAD} MW.
 */
final class RiskFeatureExtractor {
    static final double GENERATOR_NOMINAL_LOAD = 50.0d;

    RiskFeatures extract(GridTopology topology, GridEdge edge, AmbientConditions ambient) {
        AssetCondition asset = edge.asset();
        double load = (endpointLoad(topology.node(edge.sourceNodeId()))
                + endpointLoad(topology.node(edge.targetNodeId()))) / 2.0d;
        return RiskFeatures.builder()
                .temperature(edge.temperature())
                .load(load)
                .vibration(asset.getVibration())
                .age(asset.getAgeYears())
                .corrosion(asset.getCorrosion())
                .harmonicDistortion(asset.getHarmonicDistortion())
                .oilQuality(asset.getOilQuality())
                .tripCount(asset.getTripCount())
                .ambientTemperature(ambient.temperature())
                .humidity(ambient.humidity())
                .build();
    }

    private static double endpointLoad(GridNode node) {
        return node.isGenerator() ? GENERATOR_NOMINAL_LOAD : node.observedDemand();
    }
}
