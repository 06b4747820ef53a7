package org.Aayush.gridopt.engine;

import org.Aayush.gridopt.config.GridOptimizerConfig;
import org.Aayush.gridopt.cost.CostFunction;
import org.Aayush.gridopt.io.RandomTopologyGenerator;
import org.Aayush.gridopt.io.TopologyLoader;
import org.Aayush.gridopt.oracle.HeuristicRiskOracle;
import org.Aayush.gridopt.oracle.TimeBoundedRiskOracle;
import org.Aayush.gridopt.policy.AdvantageEstimator;
import org.Aayush.gridopt.policy.AssignmentPolicy;
import org.Aayush.gridopt.policy.PolicyParameters;
import org.Aayush.gridopt.search.DijkstraPathFinder;
import org.Aayush.gridopt.telemetry.SyntheticTelemetrySource;
import org.Aayush.gridopt.topology.GridTopology;
import org.Aayush.gridopt.topology.TopologyBuildException;
import org.Aayush.gridopt.topology.TopologyDefinition;
import org.Aayush.gridopt.topology.TopologySnapshot;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for callers: owns the orchestrator, the state guard and the periodic loop.
 *
 * <p>Reader methods are safe from any thread and return immutable values. {@link #optimizeNow()}
 * runs an extra cycle on the calling thread, serialized with the background loop.</p>
 */
public final class GridOptimizer implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(GridOptimizer.class);

    private final EpisodeOrchestrator orchestrator;
    private final GridStateGuard guard;
    private final OptimizationScheduler scheduler;
    private final List<AutoCloseable> ownedResources;

    public GridOptimizer(EpisodeOrchestrator orchestrator, int historyWindow, Duration refreshInterval) {
        this(orchestrator, historyWindow, refreshInterval, List.of());
    }

    private GridOptimizer(
            EpisodeOrchestrator orchestrator,
            int historyWindow,
            Duration refreshInterval,
            List<AutoCloseable> ownedResources
    ) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        long completed = orchestrator.episodeCounter();
        this.guard = new GridStateGuard(historyWindow, orchestrator.topology().snapshot(completed), completed);
        this.scheduler = new OptimizationScheduler(() -> guard.runCycle(orchestrator), refreshInterval);
        this.ownedResources = List.copyOf(ownedResources);
    }

    /**
     * Wires the bundled collaborators from configuration: topology resource (or a random
     * topology), synthetic telemetry and the heuristic oracle behind the configured timeout.
     *
     * @throws TopologyBuildException if the topology cannot be loaded, is invalid, or does not
     * match the configured node and generator counts.
     */
    public static GridOptimizer create(GridOptimizerConfig config) {
        config.validate();
        TopologyDefinition definition = config.usesRandomTopology()
                ? new RandomTopologyGenerator(config.getRandomSeed()).generate(config.getNumNodes(), config.getNumGenerators())
                : TopologyLoader.fromResource(config.getTopologyResource());
        GridTopology topology = GridTopology.fromDefinition(definition);
        if (topology.nodeCount() != config.getNumNodes() || topology.generatorCount() != config.getNumGenerators()) {
            throw new TopologyBuildException(
                    TopologyBuildException.REASON_SIZE_MISMATCH,
                    "topology has " + topology.nodeCount() + " nodes and " + topology.generatorCount()
                            + " generators, configured " + config.getNumNodes() + " and " + config.getNumGenerators()
            );
        }

        TimeBoundedRiskOracle oracle = new TimeBoundedRiskOracle(new HeuristicRiskOracle(), config.riskOracleTimeout());
        EpisodeOrchestrator orchestrator = EpisodeOrchestrator.builder()
                .topology(topology)
                .telemetrySource(new SyntheticTelemetrySource(topology.snapshot(0L), config.getRandomSeed()))
                .riskOracle(oracle)
                .pathFinder(new DijkstraPathFinder(new CostFunction(config.getRiskWeight())))
                .policy(new AssignmentPolicy(
                        PolicyParameters.zeros(topology.substationCount(), topology.generatorCount()),
                        config.getRandomSeed()))
                .advantageEstimator(new AdvantageEstimator(
                        config.getBaselineDecay(), config.isNormalizeAdvantage(), config.getAdvantageClip()))
                .learningRate(config.getLearningRate())
                .rewardRiskWeight(config.getRewardRiskWeight())
                .build();
        log.info("Grid optimizer ready: {} nodes, {} edges, {} generators, risk weight {}",
                topology.nodeCount(), topology.edgeCount(), topology.generatorCount(), config.getRiskWeight());
        return new GridOptimizer(orchestrator, config.getHistoryWindow(), config.refreshInterval(), List.of(oracle));
    }

    public void start() {
        scheduler.start();
    }

    public void stop() {
        scheduler.stop();
    }

    /**
     * Runs one cycle now; waits for a running background cycle first.
     */
    public EpisodeResult optimizeNow() {
        return guard.runCycle(orchestrator);
    }

    public boolean isRunning() {
        return scheduler.isRunning();
    }

    public Optional<EpisodeResult> latestResult() {
        return guard.latestResult();
    }

    public List<HistoryEntry> history() {
        return guard.history();
    }

    public LossMetrics lossMetrics() {
        return guard.lossMetrics();
    }

    public long episodesTrained() {
        return guard.episodesTrained();
    }

    public double bestLoss() {
        return guard.bestLoss();
    }

    public TopologySnapshot topologySnapshot() {
        return guard.topologySnapshot();
    }

    public GridStatistics statistics() {
        return GridStatistics.of(guard.topologySnapshot());
    }

    /**
     * Nodes and edges of the latest published snapshot ranked by risk.
     */
    public RiskAnalysis riskAnalysis() {
        return RiskAnalysis.of(guard.topologySnapshot());
    }

    /**
     * @throws org.Aayush.gridopt.topology.UnknownEntityException if the node does not exist.
     */
    public NodeDetail nodeDetail(int nodeId) {
        return NodeDetail.of(guard.topologySnapshot(), nodeId);
    }

    OptimizationScheduler scheduler() {
        return scheduler;
    }

    @Override
    public void close() {
        stop();
        for (AutoCloseable resource : ownedResources) {
            try {
                resource.close();
            } catch (Exception e) {
                log.warn("Failed to release {}", resource, e);
            }
        }
    }
}
