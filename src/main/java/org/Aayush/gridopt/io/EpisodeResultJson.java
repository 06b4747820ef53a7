package org.Aayush.gridopt.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.Aayush.gridopt.engine.EpisodeResult;
import org.Aayush.gridopt.engine.HistoryEntry;
import org.Aayush.gridopt.engine.LossMetrics;
import org.Aayush.gridopt.engine.SubstationAssignment;

import java.io.UncheckedIOException;

/**
 * snake_case JSON views of published results for API consumers.
 *
 * <p>Unresolved substations are emitted with {@code "resolved": false}, an empty path and a
 * {@code null} loss. Non-finite numbers are written as {@code null}.</p>
 */
public final class EpisodeResultJson {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private EpisodeResultJson() {
    }

    public static ObjectNode toTree(EpisodeResult result) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("episode", result.getEpisode());
        ArrayNode paths = root.putArray("paths");
        for (SubstationAssignment assignment : result.getAssignments()) {
            ObjectNode path = paths.addObject();
            path.put("substation_id", assignment.getSubstationId());
            path.put("substation_name", assignment.getSubstationName());
            path.put("generator_id", assignment.getGeneratorId());
            path.put("generator_name", assignment.getGeneratorName());
            ArrayNode nodes = path.putArray("path");
            for (Integer nodeId : assignment.getPath()) {
                nodes.add(nodeId);
            }
            putNumber(path, "demand", assignment.getDemand());
            if (assignment.isResolved()) {
                putNumber(path, "loss", assignment.getLoss());
            } else {
                path.putNull("loss");
            }
            path.put("resolved", assignment.isResolved());
        }
        putNumber(root, "loss_percent", result.getLossPercent());
        putNumber(root, "avg_risk", result.getAvgRisk());
        putNumber(root, "total_demand", result.getTotalDemand());
        putNumber(root, "reward", result.getReward());
        return root;
    }

    public static ObjectNode toTree(LossMetrics metrics) {
        ObjectNode root = MAPPER.createObjectNode();
        ArrayNode history = root.putArray("history");
        for (HistoryEntry entry : metrics.getHistory()) {
            ObjectNode sample = history.addObject();
            putNumber(sample, "loss_percent", entry.lossPercent());
            putNumber(sample, "avg_risk", entry.avgRisk());
        }
        putNumber(root, "best_loss", metrics.getBestLoss());
        putNumber(root, "worst_loss", metrics.getWorstLoss());
        root.put("episodes_trained", metrics.getEpisodesTrained());
        putNumber(root, "current_loss_percent", metrics.getCurrentLossPercent());
        putNumber(root, "current_avg_risk", metrics.getCurrentAvgRisk());
        return root;
    }

    public static String write(EpisodeResult result) {
        return writeTree(toTree(result));
    }

    public static String write(LossMetrics metrics) {
        return writeTree(toTree(metrics));
    }

    private static String writeTree(ObjectNode tree) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void putNumber(ObjectNode node, String field, double value) {
        if (Double.isFinite(value)) {
            node.put(field, value);
        } else {
            node.putNull(field);
        }
    }
}
