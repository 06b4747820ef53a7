package org.Aayush.gridopt.io;

import org.Aayush.gridopt.topology.AssetCondition;
import org.Aayush.gridopt.topology.TopologyBuildException;
import org.Aayush.gridopt.topology.TopologyDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Seeded Erdős–Rényi topology generator.
 *
 * <p>Nodes {@code 0..generators-1} are generators named {@code Generator N}, the rest are
 * substations named {@code Substation N} with demand drawn from 20..60 MW. Each node pair is
 * joined with probability {@value #EDGE_PROBABILITY}; graphs are redrawn until connected.
 * Edge resistance is drawn from 0.001..0.005 Ω and asset condition from plausible ranges.</p>
 */
public final class RandomTopologyGenerator {
    static final double EDGE_PROBABILITY = 0.5d;
    static final int MAX_ATTEMPTS = 1_000;

    private final Random random;

    public RandomTopologyGenerator(long seed) {
        this.random = new Random(seed);
    }

    /**
     * @throws TopologyBuildException if no connected graph is drawn within the attempt limit.
     */
    public TopologyDefinition generate(int nodeCount, int generatorCount) {
        if (generatorCount < 1 || nodeCount <= generatorCount) {
            throw new TopologyBuildException(
                    TopologyBuildException.REASON_EMPTY_PARTITION,
                    "need at least one generator and one substation, got "
                            + generatorCount + " generators of " + nodeCount + " nodes"
            );
        }
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            List<int[]> pairs = drawPairs(nodeCount);
            if (isConnected(nodeCount, pairs)) {
                return build(nodeCount, generatorCount, pairs);
            }
        }
        throw new TopologyBuildException(
                TopologyBuildException.REASON_DISCONNECTED,
                "no connected graph with " + nodeCount + " nodes after " + MAX_ATTEMPTS + " attempts");
    }

    private List<int[]> drawPairs(int nodeCount) {
        List<int[]> pairs = new ArrayList<>();
        for (int u = 0; u < nodeCount; u++) {
            for (int v = u + 1; v < nodeCount; v++) {
                if (random.nextDouble() < EDGE_PROBABILITY) {
                    pairs.add(new int[]{u, v});
                }
            }
        }
        return pairs;
    }

    private static boolean isConnected(int nodeCount, List<int[]> pairs) {
        int[] parent = new int[nodeCount];
        for (int i = 0; i < nodeCount; i++) {
            parent[i] = i;
        }
        int components = nodeCount;
        for (int[] pair : pairs) {
            int a = find(parent, pair[0]);
            int b = find(parent, pair[1]);
            if (a != b) {
                parent[a] = b;
                components--;
            }
        }
        return components == 1;
    }

    private static int find(int[] parent, int node) {
        while (parent[node] != node) {
            parent[node] = parent[parent[node]];
            node = parent[node];
        }
        return node;
    }

    private TopologyDefinition build(int nodeCount, int generatorCount, List<int[]> pairs) {
        TopologyDefinition.TopologyDefinitionBuilder builder = TopologyDefinition.builder();
        for (int id = 0; id < nodeCount; id++) {
            if (id < generatorCount) {
                builder.node(TopologyDefinition.NodeSpec.generator(id, key(id), "Generator " + id));
            } else {
                double demand = 20 + random.nextInt(41);
                builder.node(TopologyDefinition.NodeSpec.substation(id, key(id), "Substation " + id, demand));
            }
        }
        for (int[] pair : pairs) {
            AssetCondition asset = AssetCondition.builder()
                    .ageYears(random.nextDouble() * 20.0d)
                    .corrosion(random.nextDouble() * 0.5d)
                    .vibration(random.nextDouble())
                    .harmonicDistortion(1.0d + random.nextDouble() * 4.0d)
                    .oilQuality(0.6d + random.nextDouble() * 0.4d)
                    .tripCount(random.nextInt(50))
                    .build();
            double resistance = 0.001d + random.nextDouble() * 0.004d;
            builder.edge(new TopologyDefinition.EdgeSpec(key(pair[0]), key(pair[1]), resistance, asset));
        }
        return builder.build();
    }

    private static String key(int id) {
        return "node-" + id;
    }
}
