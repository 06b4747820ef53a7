package org.Aayush.gridopt.topology;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Declarative description of the initial grid: node partition and undirected edges.
 *
 * <p>Edges reference nodes by key. Validation happens in {@link GridTopology#fromDefinition}.</p>
 */
@Value
@Builder
public class TopologyDefinition {
    @Singular
    List<NodeSpec> nodes;
    @Singular
    List<EdgeSpec> edges;

    /**
     * One declared node. {@code demand} must be {@code 0} for generators.
     */
    public record NodeSpec(int id, String key, String name, NodeRole role, double demand) {
        public static NodeSpec generator(int id, String key, String name) {
            return new NodeSpec(id, key, name, NodeRole.GENERATOR, 0.0d);
        }

        public static NodeSpec substation(int id, String key, String name, double demand) {
            return new NodeSpec(id, key, name, NodeRole.SUBSTATION, demand);
        }
    }

    /**
     * One declared undirected edge with its initial resistance.
     */
    public record EdgeSpec(String sourceKey, String targetKey, double resistance, AssetCondition asset) {
        public EdgeSpec(String sourceKey, String targetKey, double resistance) {
            this(sourceKey, targetKey, resistance, AssetCondition.NOMINAL);
        }
    }

    /**
     * Counts declared generators.
     */
    public int generatorCount() {
        int count = 0;
        for (NodeSpec node : nodes) {
            if (node.role() == NodeRole.GENERATOR) {
                count++;
            }
        }
        return count;
    }
}
