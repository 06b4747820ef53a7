package org.Aayush.gridopt.engine;

import it.unimi.dsi.fastutil.ints.IntLinkedOpenHashSet;
import lombok.Builder;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.gridopt.config.GridOptimizerConfig;
import org.Aayush.gridopt.cost.CostFunction;
import org.Aayush.gridopt.oracle.RiskAssessment;
import org.Aayush.gridopt.oracle.RiskOracle;
import org.Aayush.gridopt.oracle.RiskOracleUnavailableException;
import org.Aayush.gridopt.oracle.Severity;
import org.Aayush.gridopt.policy.AdvantageEstimator;
import org.Aayush.gridopt.policy.AssignmentPolicy;
import org.Aayush.gridopt.policy.PolicyGradient;
import org.Aayush.gridopt.policy.PolicyParameters;
import org.Aayush.gridopt.policy.SampledAction;
import org.Aayush.gridopt.policy.StateEncoder;
import org.Aayush.gridopt.policy.SubstationState;
import org.Aayush.gridopt.search.DijkstraPathFinder;
import org.Aayush.gridopt.search.GridPath;
import org.Aayush.gridopt.search.NoPathException;
import org.Aayush.gridopt.search.PathFinder;
import org.Aayush.gridopt.search.ShortestPathTree;
import org.Aayush.gridopt.search.TransmissionLoss;
import org.Aayush.gridopt.telemetry.AmbientConditions;
import org.Aayush.gridopt.telemetry.TelemetryFrame;
import org.Aayush.gridopt.telemetry.TelemetrySource;
import org.Aayush.gridopt.topology.GridEdge;
import org.Aayush.gridopt.topology.GridNode;
import org.Aayush.gridopt.topology.GridTopology;
import org.Aayush.gridopt.topology.TelemetryApplyResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs one optimization cycle end to end.
 * <ol>
 * <li>pull a telemetry frame and apply it to the topology;</li>
 * <li>score every edge with the risk oracle, falling back to the last known risk (or 1.0);</li>
 * <li>per substation, in ascending id order: search, encode, sample a generator;</li>
 * <li>read the path to the sampled generator; no path leaves the substation unresolved;</li>
 * <li>aggregate loss and risk over resolved substations;</li>
 * <li>compute reward and advantage, replace the policy parameters;</li>
 * <li>build the result and the topology snapshot;</li>
 * <li>advance the episode counter.</li>
 * </ol>
 * <p>
 * Owns the topology and the policy. Not thread-safe: {@link GridStateGuard#runCycle} serializes
 * every call to {@link #runEpisode()}.
 * </p>
 */
@Accessors(fluent = true)
public final class EpisodeOrchestrator {
    private static final Logger log = LogManager.getLogger(EpisodeOrchestrator.class);
    private static final double FALLBACK_RISK = 1.0d;
    private static final int SUMMARY_INTERVAL = 10;

    @Getter
    private final GridTopology topology;
    private final TelemetrySource telemetrySource;
    private final RiskOracle riskOracle;
    private final PathFinder pathFinder;
    private final StateEncoder stateEncoder;
    @Getter
    private final AssignmentPolicy policy;
    private final AdvantageEstimator advantageEstimator;
    private final RiskFeatureExtractor featureExtractor;
    private final double learningRate;
    private final double rewardRiskWeight;
    private final Clock clock;

    @Getter
    private long episodeCounter;
    private AmbientConditions lastAmbient = AmbientConditions.STANDARD;

    /**
     * @param topology grid to optimize; required.
     * @param telemetrySource frame supplier; required.
     * @param riskOracle edge risk scorer; required.
     * @param pathFinder defaults to Dijkstra with the default risk weight.
     * @param policy defaults to a zero-initialised policy seeded with the default seed.
     * @param advantageEstimator defaults to the configured baseline decay, normalisation and clip.
     * @param learningRate defaults to {@link GridOptimizerConfig#DEFAULT_LEARNING_RATE}.
     * @param rewardRiskWeight defaults to {@link GridOptimizerConfig#DEFAULT_REWARD_RISK_WEIGHT}.
     * @param clock publish timestamp source, defaults to UTC.
     */
    @Builder
    private EpisodeOrchestrator(
            GridTopology topology,
            TelemetrySource telemetrySource,
            RiskOracle riskOracle,
            PathFinder pathFinder,
            AssignmentPolicy policy,
            AdvantageEstimator advantageEstimator,
            Double learningRate,
            Double rewardRiskWeight,
            Clock clock
    ) {
        this.topology = Objects.requireNonNull(topology, "topology");
        this.telemetrySource = Objects.requireNonNull(telemetrySource, "telemetrySource");
        this.riskOracle = Objects.requireNonNull(riskOracle, "riskOracle");
        this.pathFinder = pathFinder != null ? pathFinder : new DijkstraPathFinder(new CostFunction());
        this.policy = policy != null
                ? policy
                : new AssignmentPolicy(
                PolicyParameters.zeros(topology.substationCount(), topology.generatorCount()),
                GridOptimizerConfig.DEFAULT_RANDOM_SEED);
        this.advantageEstimator = advantageEstimator != null
                ? advantageEstimator
                : new AdvantageEstimator(
                GridOptimizerConfig.DEFAULT_BASELINE_DECAY, true, GridOptimizerConfig.DEFAULT_ADVANTAGE_CLIP);
        this.learningRate = learningRate != null ? learningRate : GridOptimizerConfig.DEFAULT_LEARNING_RATE;
        this.rewardRiskWeight = rewardRiskWeight != null
                ? rewardRiskWeight
                : GridOptimizerConfig.DEFAULT_REWARD_RISK_WEIGHT;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.stateEncoder = new StateEncoder();
        this.featureExtractor = new RiskFeatureExtractor();

        if (this.policy.parameters().substationCount() != topology.substationCount()
                || this.policy.parameters().generatorCount() != topology.generatorCount()) {
            throw new IllegalArgumentException("policy shape " + this.policy.parameters()
                    + " does not match topology with " + topology.substationCount() + " substations and "
                    + topology.generatorCount() + " generators");
        }
        if (!Double.isFinite(this.learningRate) || this.learningRate < 0.0d) {
            throw new IllegalArgumentException("learningRate must be finite and >= 0, got " + this.learningRate);
        }
        if (!Double.isFinite(this.rewardRiskWeight) || this.rewardRiskWeight < 0.0d) {
            throw new IllegalArgumentException(
                    "rewardRiskWeight must be finite and >= 0, got " + this.rewardRiskWeight);
        }
    }

    /**
     * Executes one full cycle.
     *
     * @return result and snapshot to publish.
     */
    public EpisodeOutcome runEpisode() {
        long episode = episodeCounter + 1;
        int droppedTelemetry = refreshTelemetry();
        EpisodeResult.EpisodeResultBuilder result = EpisodeResult.builder().episode(episode);
        int riskFallbacks = scoreRisk(result);

        int[] substationIds = topology.substationIds();
        int[] generatorIds = topology.generatorIds();
        double[] assignedDemand = new double[generatorIds.length];
        List<SampledAction> resolvedActions = new ArrayList<>(substationIds.length);
        IntLinkedOpenHashSet usedEdges = new IntLinkedOpenHashSet();
        double totalLoss = 0.0d;
        double resolvedDemand = 0.0d;

        for (int s = 0; s < substationIds.length; s++) {
            GridNode substation = topology.node(substationIds[s]);
            ShortestPathTree tree = pathFinder.search(topology, substation.id());
            SubstationState state = stateEncoder.encode(topology, s, tree, assignedDemand);
            SampledAction action = policy.sample(state);
            GridNode generator = topology.node(action.generatorId());

            SubstationAssignment.SubstationAssignmentBuilder assignment = SubstationAssignment.builder()
                    .substationId(substation.id())
                    .substationName(substation.name())
                    .generatorId(generator.id())
                    .generatorName(generator.name())
                    .demand(substation.demand())
                    .probability(action.probability());
            try {
                GridPath path = tree.pathTo(generator.id());
                double loss = TransmissionLoss.lossMegawatts(substation.demand(), path);
                totalLoss += loss;
                resolvedDemand += substation.demand();
                assignedDemand[action.generatorIndex()] += substation.demand();
                for (int edgeId : path.edgeIds()) {
                    usedEdges.add(edgeId);
                }
                resolvedActions.add(action);
                assignment.path(path.nodeList()).loss(loss).pathRisk(path.totalRisk()).resolved(true);
            } catch (NoPathException e) {
                log.warn("Episode {}: substation {} unresolved: {}", episode, substation.name(), e.getMessage());
                assignment.resolved(false);
            }
            result.assignment(assignment.build());
        }

        double avgRisk = averageRisk(usedEdges);
        double lossPercent = TransmissionLoss.lossPercent(totalLoss, resolvedDemand);
        double reward = -(lossPercent + rewardRiskWeight * avgRisk);
        double advantage = 0.0d;
        boolean trained = !resolvedActions.isEmpty();
        if (trained) {
            advantage = advantageEstimator.advantage(reward);
            PolicyParameters next = PolicyGradient.update(policy.parameters(), resolvedActions, advantage, learningRate);
            policy.replaceParameters(next);
        } else {
            log.warn("Episode {}: no substation could be routed, policy left unchanged", episode);
        }

        EpisodeResult built = result
                .totalLoss(totalLoss)
                .lossPercent(lossPercent)
                .avgRisk(avgRisk)
                .totalDemand(topology.totalDemand())
                .resolvedDemand(resolvedDemand)
                .reward(reward)
                .advantage(advantage)
                .trained(trained)
                .droppedTelemetry(droppedTelemetry)
                .riskFallbacks(riskFallbacks)
                .publishedAt(clock.instant())
                .build();
        EpisodeOutcome outcome = new EpisodeOutcome(built, topology.snapshot(episode), trained);

        episodeCounter = episode;
        if (episode % SUMMARY_INTERVAL == 0) {
            log.info("Episode {}: loss {}% avg risk {} reward {} ({} of {} substations routed)",
                    episode,
                    String.format("%.4f", lossPercent),
                    String.format("%.3f", avgRisk),
                    String.format("%.4f", reward),
                    built.resolvedCount(),
                    substationIds.length);
        }
        return outcome;
    }

    private int refreshTelemetry() {
        TelemetryFrame frame;
        try {
            frame = telemetrySource.nextFrame();
        } catch (RuntimeException e) {
            log.warn("Telemetry source failed, keeping previous readings: {}", e.getMessage(), e);
            return 0;
        }
        if (frame == null) {
            return 0;
        }
        lastAmbient = frame.getAmbient() == null ? lastAmbient : frame.getAmbient();
        TelemetryApplyResult applied = topology.applyTelemetry(frame.getNodeUpdates(), frame.getEdgeUpdates());
        return applied.dropped();
    }

    private int scoreRisk(EpisodeResult.EpisodeResultBuilder result) {
        int fallbacks = 0;
        for (int edgeId = 0; edgeId < topology.edgeCount(); edgeId++) {
            GridEdge edge = topology.edge(edgeId);
            RiskAssessment assessment;
            try {
                assessment = riskOracle.score(featureExtractor.extract(topology, edge, lastAmbient));
            } catch (RiskOracleUnavailableException e) {
                fallbacks++;
                applyFallbackRisk(edge, e.getMessage());
                continue;
            } catch (RuntimeException e) {
                fallbacks++;
                applyFallbackRisk(edge, e.toString());
                continue;
            }
            if (assessment == null) {
                fallbacks++;
                applyFallbackRisk(edge, "oracle returned no assessment");
                continue;
            }
            topology.updateRisk(edgeId, assessment.getProbability());
            if (assessment.getSeverity().compareTo(Severity.HIGH) >= 0) {
                result.alert(new EdgeAlert(
                        edgeId,
                        edge.sourceNodeId(),
                        edge.targetNodeId(),
                        assessment.getProbability(),
                        assessment.getFailureMode(),
                        assessment.getSeverity()
                ));
            }
        }
        return fallbacks;
    }

    private void applyFallbackRisk(GridEdge edge, String reason) {
        if (topology.hasRisk(edge.id())) {
            log.warn("Risk oracle unavailable for edge {}, keeping last risk {}: {}", edge.id(), edge.risk(), reason);
        } else {
            topology.updateRisk(edge.id(), FALLBACK_RISK);
            log.warn("Risk oracle unavailable for edge {}, assuming risk {}: {}", edge.id(), FALLBACK_RISK, reason);
        }
    }

    private double averageRisk(IntLinkedOpenHashSet usedEdges) {
        if (usedEdges.isEmpty()) {
            return 0.0d;
        }
        double sum = 0.0d;
        for (int edgeId : usedEdges) {
            sum += topology.edge(edgeId).risk();
        }
        return sum / usedEdges.size();
    }
}
