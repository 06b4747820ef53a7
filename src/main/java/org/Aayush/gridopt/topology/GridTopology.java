package org.Aayush.gridopt.topology;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.gridopt.core.id.FastUtilIDMapper;
import org.Aayush.gridopt.core.id.IDMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * In-memory grid topology store.
 * <p>
 * Layout:
 * </p>
 * <ul>
 * <li>Dense node ids {@code [0, nodeCount)} and dense edge ids {@code [0, edgeCount)}.</li>
 * <li>CSR incidence index: {@code firstIncident[node]..firstIncident[node + 1]} slices
 *     {@code incidentEdges} for O(1) neighbor access.</li>
 * <li>Unordered endpoint pair to edge id lookup for telemetry keyed by pair.</li>
 * </ul>
 * <p>
 * The node/edge set is frozen after {@link #fromDefinition(TopologyDefinition)}; only telemetry
 * and risk fields change. Not thread-safe: callers mutate it from the single orchestrator
 * context and publish {@link #snapshot(long)} copies to readers.
 * </p>
 */
public final class GridTopology {
    private static final Logger log = LogManager.getLogger(GridTopology.class);
    private static final int NO_EDGE = -1;

    private final GridNode[] nodes;
    private final GridEdge[] edges;
    private final int[] firstIncident;
    private final int[] incidentEdges;
    private final Long2IntOpenHashMap pairIndex;
    private final IDMapper nodeKeys;
    private final int[] generatorIds;
    private final int[] substationIds;

    @Getter
    @Accessors(fluent = true)
    private final double totalDemand;

    private GridTopology(
            GridNode[] nodes,
            GridEdge[] edges,
            int[] firstIncident,
            int[] incidentEdges,
            Long2IntOpenHashMap pairIndex,
            IDMapper nodeKeys
    ) {
        this.nodes = nodes;
        this.edges = edges;
        this.firstIncident = firstIncident;
        this.incidentEdges = incidentEdges;
        this.pairIndex = pairIndex;
        this.nodeKeys = nodeKeys;

        IntArrayList generators = new IntArrayList();
        IntArrayList substations = new IntArrayList();
        double demand = 0.0d;
        for (GridNode node : nodes) {
            if (node.isGenerator()) {
                generators.add(node.id());
            } else {
                substations.add(node.id());
                demand += node.demand();
            }
        }
        this.generatorIds = generators.toIntArray();
        this.substationIds = substations.toIntArray();
        this.totalDemand = demand;
    }

    /**
     * Builds and validates a topology.
     *
     * @param definition declared nodes and edges.
     * @return frozen topology.
     * @throws TopologyBuildException when the partition is empty, a node/edge is malformed,
     * or the graph is disconnected.
     */
    public static GridTopology fromDefinition(TopologyDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        int nodeCount = definition.getNodes().size();
        GridNode[] nodes = new GridNode[nodeCount];
        Map<String, Integer> keyMappings = new HashMap<>(nodeCount);

        for (TopologyDefinition.NodeSpec spec : definition.getNodes()) {
            validateNodeSpec(spec, nodeCount);
            if (nodes[spec.id()] != null) {
                throw new TopologyBuildException(
                        TopologyBuildException.REASON_INVALID_NODE, "duplicate node id " + spec.id());
            }
            if (keyMappings.put(spec.key(), spec.id()) != null) {
                throw new TopologyBuildException(
                        TopologyBuildException.REASON_INVALID_NODE, "duplicate node key " + spec.key());
            }
            nodes[spec.id()] = new GridNode(spec.id(), spec.key(), spec.name(), spec.role(), spec.demand());
        }
        IDMapper nodeKeys = IDMapper.createImmutable(keyMappings);

        int generators = definition.generatorCount();
        if (generators == 0 || generators == nodeCount) {
            throw new TopologyBuildException(
                    TopologyBuildException.REASON_EMPTY_PARTITION,
                    "topology needs at least one generator and one substation, got "
                            + generators + " generators of " + nodeCount + " nodes"
            );
        }

        int edgeCount = definition.getEdges().size();
        GridEdge[] edges = new GridEdge[edgeCount];
        Long2IntOpenHashMap pairIndex = new Long2IntOpenHashMap(edgeCount);
        pairIndex.defaultReturnValue(NO_EDGE);
        int[] degree = new int[nodeCount];

        for (int edgeId = 0; edgeId < edgeCount; edgeId++) {
            TopologyDefinition.EdgeSpec spec = definition.getEdges().get(edgeId);
            int u = resolveEndpoint(nodeKeys, spec.sourceKey());
            int v = resolveEndpoint(nodeKeys, spec.targetKey());
            if (u == v) {
                throw new TopologyBuildException(
                        TopologyBuildException.REASON_INVALID_EDGE, "self loop on node " + spec.sourceKey());
            }
            if (!Double.isFinite(spec.resistance()) || spec.resistance() < 0.0d) {
                throw new TopologyBuildException(
                        TopologyBuildException.REASON_INVALID_EDGE,
                        "edge " + spec.sourceKey() + "-" + spec.targetKey()
                                + " resistance must be finite and >= 0, got " + spec.resistance()
                );
            }
            long pairKey = pairKey(u, v);
            if (pairIndex.containsKey(pairKey)) {
                throw new TopologyBuildException(
                        TopologyBuildException.REASON_INVALID_EDGE,
                        "duplicate edge " + spec.sourceKey() + "-" + spec.targetKey()
                );
            }
            pairIndex.put(pairKey, edgeId);
            AssetCondition asset = spec.asset() == null ? AssetCondition.NOMINAL : spec.asset();
            edges[edgeId] = new GridEdge(edgeId, u, v, spec.resistance(), asset);
            degree[u]++;
            degree[v]++;
        }
        pairIndex.trim();

        int[] firstIncident = new int[nodeCount + 1];
        for (int node = 0; node < nodeCount; node++) {
            firstIncident[node + 1] = firstIncident[node] + degree[node];
        }
        int[] incidentEdges = new int[firstIncident[nodeCount]];
        int[] cursor = new int[nodeCount];
        for (GridEdge edge : edges) {
            int u = edge.sourceNodeId();
            int v = edge.targetNodeId();
            incidentEdges[firstIncident[u] + cursor[u]++] = edge.id();
            incidentEdges[firstIncident[v] + cursor[v]++] = edge.id();
        }

        GridTopology topology = new GridTopology(nodes, edges, firstIncident, incidentEdges, pairIndex, nodeKeys);
        topology.ensureConnected();
        return topology;
    }

    private static void validateNodeSpec(TopologyDefinition.NodeSpec spec, int nodeCount) {
        if (spec == null) {
            throw new TopologyBuildException(TopologyBuildException.REASON_INVALID_NODE, "null node spec");
        }
        if (spec.id() < 0 || spec.id() >= nodeCount) {
            throw new TopologyBuildException(
                    TopologyBuildException.REASON_INVALID_NODE,
                    "node ids must be dense and 0-indexed, got " + spec.id() + " for " + nodeCount + " nodes"
            );
        }
        if (spec.key() == null || spec.key().isBlank()) {
            throw new TopologyBuildException(
                    TopologyBuildException.REASON_INVALID_NODE, "node " + spec.id() + " has no key");
        }
        if (spec.role() == null) {
            throw new TopologyBuildException(
                    TopologyBuildException.REASON_INVALID_NODE, "node " + spec.key() + " has no role");
        }
        if (!Double.isFinite(spec.demand()) || spec.demand() < 0.0d) {
            throw new TopologyBuildException(
                    TopologyBuildException.REASON_INVALID_NODE,
                    "node " + spec.key() + " demand must be finite and >= 0, got " + spec.demand()
            );
        }
        if (spec.role() == NodeRole.GENERATOR && spec.demand() != 0.0d) {
            throw new TopologyBuildException(
                    TopologyBuildException.REASON_INVALID_NODE,
                    "generator " + spec.key() + " must not declare demand"
            );
        }
    }

    private static int resolveEndpoint(IDMapper nodeKeys, String key) {
        try {
            return nodeKeys.toInternal(key);
        } catch (IDMapper.UnknownKeyException e) {
            throw new TopologyBuildException(
                    TopologyBuildException.REASON_INVALID_EDGE, "edge references unknown node key " + key, e);
        }
    }

    private static long pairKey(int u, int v) {
        int low = Math.min(u, v);
        int high = Math.max(u, v);
        return ((long) low << 32) | (high & 0xFFFFFFFFL);
    }

    private void ensureConnected() {
        boolean[] seen = new boolean[nodes.length];
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        queue.enqueue(0);
        seen[0] = true;
        int visited = 1;
        while (!queue.isEmpty()) {
            int node = queue.dequeueInt();
            for (int i = firstIncident[node]; i < firstIncident[node + 1]; i++) {
                int next = edges[incidentEdges[i]].otherEnd(node);
                if (!seen[next]) {
                    seen[next] = true;
                    visited++;
                    queue.enqueue(next);
                }
            }
        }
        if (visited != nodes.length) {
            throw new TopologyBuildException(
                    TopologyBuildException.REASON_DISCONNECTED,
                    "initial topology is disconnected: reached " + visited + " of " + nodes.length + " nodes"
            );
        }
    }

    // ========================================================================
    // TELEMETRY
    // ========================================================================

    /**
     * Applies one telemetry batch. Updates for unknown ids are dropped and logged; all
     * remaining updates still apply. Power flow is recomputed for every edge afterwards.
     *
     * @param nodeUpdates node readings.
     * @param edgeUpdates edge readings keyed by endpoint pair.
     * @return applied/dropped counters.
     */
    public TelemetryApplyResult applyTelemetry(
            Collection<NodeTelemetry> nodeUpdates,
            Collection<EdgeTelemetry> edgeUpdates
    ) {
        Objects.requireNonNull(nodeUpdates, "nodeUpdates");
        Objects.requireNonNull(edgeUpdates, "edgeUpdates");
        int appliedNodes = 0;
        int droppedNodes = 0;
        for (NodeTelemetry update : nodeUpdates) {
            try {
                applyNodeTelemetry(update);
                appliedNodes++;
            } catch (UnknownEntityException e) {
                droppedNodes++;
                log.warn("Dropping node telemetry: {}", e.getMessage());
            }
        }

        int appliedEdges = 0;
        int droppedEdges = 0;
        for (EdgeTelemetry update : edgeUpdates) {
            try {
                applyEdgeTelemetry(update);
                appliedEdges++;
            } catch (UnknownEntityException e) {
                droppedEdges++;
                log.warn("Dropping edge telemetry: {}", e.getMessage());
            }
        }
        recomputePowerFlow();
        return new TelemetryApplyResult(appliedNodes, appliedEdges, droppedNodes, droppedEdges);
    }

    /**
     * Applies a single node reading. Substation demand is never changed.
     *
     * @throws UnknownEntityException if the node id is not part of this topology.
     */
    public void applyNodeTelemetry(NodeTelemetry update) {
        Objects.requireNonNull(update, "update");
        GridNode node = node(update.nodeId());
        node.voltage(update.voltage());
        node.observedDemand(node.isGenerator() ? 0.0d : update.observedDemand());
    }

    /**
     * Applies a single edge reading.
     *
     * @throws UnknownEntityException if no edge joins the two endpoints.
     */
    public void applyEdgeTelemetry(EdgeTelemetry update) {
        Objects.requireNonNull(update, "update");
        int edgeId = edgeBetween(update.sourceNodeId(), update.targetNodeId());
        GridEdge edge = edges[edgeId];
        edge.resistance(update.resistance());
        edge.current(update.current());
        edge.temperature(update.temperature());
    }

    /**
     * Stores a risk score for one edge, clamped into {@code [0, 1]}.
     */
    public void updateRisk(int edgeId, double risk) {
        edge(edgeId).risk(risk);
    }

    /**
     * Returns whether a risk score was ever stored for the edge.
     */
    public boolean hasRisk(int edgeId) {
        return edge(edgeId).riskAssigned();
    }

    /**
     * Opens or closes the edge joining two nodes. Out-of-service edges keep their telemetry
     * but are not traversable; the initial connectivity check is not repeated.
     *
     * @throws UnknownEntityException if no edge joins the two endpoints.
     */
    public void setInService(int u, int v, boolean inService) {
        GridEdge edge = edges[edgeBetween(u, v)];
        if (edge.inService() != inService) {
            log.info("Edge {} ({}-{}) {}", edge.id(), u, v, inService ? "restored" : "taken out of service");
        }
        edge.inService(inService);
    }

    private void recomputePowerFlow() {
        for (GridEdge edge : edges) {
            double averageVoltage = (nodes[edge.sourceNodeId()].voltage() + nodes[edge.targetNodeId()].voltage()) / 2.0d;
            edge.powerFlow(averageVoltage * edge.current() / 1_000.0d);
        }
    }

    // ========================================================================
    // ACCESSORS
    // ========================================================================

    public int nodeCount() {
        return nodes.length;
    }

    public int edgeCount() {
        return edges.length;
    }

    /**
     * @throws UnknownEntityException if the id is outside the topology.
     */
    public GridNode node(int nodeId) {
        if (nodeId < 0 || nodeId >= nodes.length) {
            throw UnknownEntityException.unknownNode(nodeId, nodes.length);
        }
        return nodes[nodeId];
    }

    /**
     * @throws UnknownEntityException if the id is outside the topology.
     */
    public GridEdge edge(int edgeId) {
        if (edgeId < 0 || edgeId >= edges.length) {
            throw new UnknownEntityException(
                    UnknownEntityException.REASON_UNKNOWN_EDGE,
                    "edge id " + edgeId + " is not part of the topology [0, " + edges.length + ")"
            );
        }
        return edges[edgeId];
    }

    /**
     * Resolves the edge joining two nodes in either direction.
     *
     * @throws UnknownEntityException if either node is unknown or the nodes are not adjacent.
     */
    public int edgeBetween(int u, int v) {
        node(u);
        node(v);
        int edgeId = pairIndex.get(pairKey(u, v));
        if (edgeId == NO_EDGE) {
            throw UnknownEntityException.unknownEdge(u, v);
        }
        return edgeId;
    }

    public boolean hasEdge(int u, int v) {
        if (u < 0 || u >= nodes.length || v < 0 || v >= nodes.length) {
            return false;
        }
        return pairIndex.get(pairKey(u, v)) != NO_EDGE;
    }

    /**
     * Resolves a node key.
     *
     * @throws UnknownEntityException if the key is not mapped.
     */
    public int nodeIdOf(String key) {
        try {
            return nodeKeys.toInternal(key);
        } catch (IDMapper.UnknownKeyException e) {
            throw new UnknownEntityException(UnknownEntityException.REASON_UNKNOWN_NODE, "unknown node key " + key);
        }
    }

    public int degree(int nodeId) {
        node(nodeId);
        return firstIncident[nodeId + 1] - firstIncident[nodeId];
    }

    /**
     * Returns the ids of edges incident to a node.
     */
    public int[] incidentEdgeIds(int nodeId) {
        node(nodeId);
        int start = firstIncident[nodeId];
        int end = firstIncident[nodeId + 1];
        int[] out = new int[end - start];
        System.arraycopy(incidentEdges, start, out, 0, out.length);
        return out;
    }

    /**
     * Allocation-free incident-edge iterator for search hot paths.
     */
    public IncidentEdgeIterator iterator() {
        return new IncidentEdgeIterator();
    }

    public int[] generatorIds() {
        return generatorIds.clone();
    }

    public int[] substationIds() {
        return substationIds.clone();
    }

    public int generatorCount() {
        return generatorIds.length;
    }

    public int substationCount() {
        return substationIds.length;
    }

    /**
     * Copies the current node and edge state into an immutable snapshot.
     */
    public TopologySnapshot snapshot(long iteration) {
        List<TopologySnapshot.NodeView> nodeViews = new ArrayList<>(nodes.length);
        for (GridNode node : nodes) {
            nodeViews.add(new TopologySnapshot.NodeView(
                    node.id(),
                    node.key(),
                    node.name(),
                    node.role(),
                    node.demand(),
                    node.observedDemand(),
                    node.voltage(),
                    degree(node.id())
            ));
        }
        List<TopologySnapshot.EdgeView> edgeViews = new ArrayList<>(edges.length);
        for (GridEdge edge : edges) {
            edgeViews.add(new TopologySnapshot.EdgeView(
                    edge.id(),
                    edge.sourceNodeId(),
                    edge.targetNodeId(),
                    edge.resistance(),
                    edge.current(),
                    edge.temperature(),
                    edge.powerFlow(),
                    edge.risk(),
                    edge.inService()
            ));
        }
        return new TopologySnapshot(iteration, nodeViews, edgeViews);
    }

    /**
     * Reusable cursor over the incident edges of one node.
     */
    public final class IncidentEdgeIterator {
        private int cursor;
        private int end;

        private IncidentEdgeIterator() {
        }

        public void resetForNode(int nodeId) {
            node(nodeId);
            cursor = firstIncident[nodeId];
            end = firstIncident[nodeId + 1];
        }

        public boolean hasNext() {
            return cursor < end;
        }

        public int next() {
            if (cursor >= end) {
                throw new NoSuchElementException();
            }
            return incidentEdges[cursor++];
        }
    }
}
