package org.Aayush.gridopt.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.Aayush.gridopt.topology.AssetCondition;
import org.Aayush.gridopt.topology.NodeRole;
import org.Aayush.gridopt.topology.TopologyBuildException;
import org.Aayush.gridopt.topology.TopologyDefinition;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads topology definitions from JSON.
 *
 * <pre>
 * {
 *   "name": "...",
 *   "nodes": [{"id": 0, "key": "north-plant", "name": "...", "role": "generator"}, ...],
 *   "edges": [{"source": "north-plant", "target": "downtown", "resistance": 0.002,
 *              "asset": {"ageYears": 12, ...}}, ...]
 * }
 * </pre>
 * Structural validation is left to {@link org.Aayush.gridopt.topology.GridTopology#fromDefinition}.
 */
public final class TopologyLoader {
    private static final Logger log = LogManager.getLogger(TopologyLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TopologyLoader() {
    }

    /**
     * Loads a definition from the classpath.
     *
     * @throws TopologyBuildException if the resource is missing or malformed.
     */
    public static TopologyDefinition fromResource(String resource) {
        ClassLoader loader = TopologyLoader.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new TopologyBuildException(
                        TopologyBuildException.REASON_LOAD_FAILED, "topology resource not found: " + resource);
            }
            TopologyDefinition definition = parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            log.info("Loaded topology {} ({} nodes, {} edges)",
                    resource, definition.getNodes().size(), definition.getEdges().size());
            return definition;
        } catch (IOException e) {
            throw new TopologyBuildException(
                    TopologyBuildException.REASON_LOAD_FAILED, "cannot read topology resource " + resource, e);
        }
    }

    /**
     * Loads a definition from a file.
     *
     * @throws TopologyBuildException if the file cannot be read or is malformed.
     */
    public static TopologyDefinition fromPath(Path path) {
        try {
            return parse(Files.readString(path));
        } catch (IOException e) {
            throw new TopologyBuildException(
                    TopologyBuildException.REASON_LOAD_FAILED, "cannot read topology file " + path, e);
        }
    }

    /**
     * Parses a JSON document.
     *
     * @throws TopologyBuildException if the document is malformed or incomplete.
     */
    public static TopologyDefinition parse(String json) {
        GridDocument document;
        try {
            document = MAPPER.readValue(json, GridDocument.class);
        } catch (JsonProcessingException e) {
            throw new TopologyBuildException(
                    TopologyBuildException.REASON_LOAD_FAILED, "malformed topology JSON: " + e.getOriginalMessage(), e);
        }
        if (document == null || document.getNodes() == null || document.getEdges() == null) {
            throw new TopologyBuildException(
                    TopologyBuildException.REASON_LOAD_FAILED, "topology JSON needs 'nodes' and 'edges' arrays");
        }
        return toDefinition(document);
    }

    static TopologyDefinition toDefinition(GridDocument document) {
        TopologyDefinition.TopologyDefinitionBuilder builder = TopologyDefinition.builder();
        for (GridDocument.NodeDef node : document.getNodes()) {
            NodeRole role = parseRole(node);
            String name = node.getName() == null || node.getName().isBlank() ? node.getKey() : node.getName();
            builder.node(new TopologyDefinition.NodeSpec(node.getId(), node.getKey(), name, role, node.getDemand()));
        }
        for (GridDocument.EdgeDef edge : document.getEdges()) {
            if (edge.getResistance() == null) {
                throw new TopologyBuildException(
                        TopologyBuildException.REASON_INVALID_EDGE,
                        "edge " + edge.getSource() + "-" + edge.getTarget() + " has no resistance");
            }
            builder.edge(new TopologyDefinition.EdgeSpec(
                    edge.getSource(), edge.getTarget(), edge.getResistance(), toAsset(edge.getAsset())));
        }
        return builder.build();
    }

    private static NodeRole parseRole(GridDocument.NodeDef node) {
        if (node.getRole() == null) {
            throw new TopologyBuildException(
                    TopologyBuildException.REASON_INVALID_NODE, "node " + node.getKey() + " has no role");
        }
        try {
            return NodeRole.valueOf(node.getRole().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new TopologyBuildException(
                    TopologyBuildException.REASON_INVALID_NODE,
                    "node " + node.getKey() + " has unknown role '" + node.getRole() + "'",
                    e
            );
        }
    }

    private static AssetCondition toAsset(GridDocument.AssetDef asset) {
        if (asset == null) {
            return AssetCondition.NOMINAL;
        }
        AssetCondition.AssetConditionBuilder builder = AssetCondition.NOMINAL.toBuilder();
        if (asset.getAgeYears() != null) {
            builder.ageYears(asset.getAgeYears());
        }
        if (asset.getCorrosion() != null) {
            builder.corrosion(asset.getCorrosion());
        }
        if (asset.getVibration() != null) {
            builder.vibration(asset.getVibration());
        }
        if (asset.getHarmonicDistortion() != null) {
            builder.harmonicDistortion(asset.getHarmonicDistortion());
        }
        if (asset.getOilQuality() != null) {
            builder.oilQuality(asset.getOilQuality());
        }
        if (asset.getTripCount() != null) {
            builder.tripCount(asset.getTripCount());
        }
        return builder.build();
    }
}
