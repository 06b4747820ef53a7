package org.Aayush.gridopt.engine;

import org.Aayush.gridopt.config.GridOptimizerConfig;
import org.Aayush.gridopt.testutil.GridFixtures;
import org.Aayush.gridopt.topology.GridTopology;
import org.Aayush.gridopt.topology.TopologyBuildException;
import org.Aayush.gridopt.topology.UnknownEntityException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Grid Optimizer Tests")
class GridOptimizerTest {

    @Test
    @DisplayName("Defaults load the bundled grid and run manual cycles")
    void testCreateFromDefaults() {
        try (GridOptimizer optimizer = GridOptimizer.create(GridOptimizerConfig.defaults())) {
            assertTrue(optimizer.latestResult().isEmpty());
            assertEquals(8, optimizer.topologySnapshot().nodes().size());

            for (int i = 0; i < 5; i++) {
                optimizer.optimizeNow();
            }

            assertEquals(5L, optimizer.episodesTrained());
            EpisodeResult latest = optimizer.latestResult().orElseThrow();
            assertEquals(5L, latest.getEpisode());
            assertEquals(6, latest.getAssignments().size());
            assertEquals(5L, optimizer.topologySnapshot().iteration());
            assertEquals(5, optimizer.history().size());
            assertFalse(Double.isNaN(optimizer.bestLoss()));
            assertEquals(optimizer.bestLoss(), optimizer.lossMetrics().getBestLoss(), 0.0);

            GridStatistics statistics = optimizer.statistics();
            assertEquals(8, statistics.nodeCount());
            assertEquals(13, statistics.edgeCount());
            assertEquals(5L, statistics.iteration());
            assertTrue(statistics.voltage().mean() >= 210.0d && statistics.voltage().mean() <= 230.0d);
            assertTrue(statistics.voltage().min() >= 210.0d && statistics.voltage().max() <= 230.0d);

            RiskAnalysis analysis = optimizer.riskAnalysis();
            assertEquals(8, analysis.nodes().size());
            assertEquals(13, analysis.edges().size());
            assertTrue(analysis.edges().get(0).risk() >= analysis.edges().get(12).risk());

            NodeDetail detail = optimizer.nodeDetail(0);
            assertEquals(detail.degree(), detail.neighbors().size());
            assertThrows(UnknownEntityException.class, () -> optimizer.nodeDetail(99));
        }
    }

    @Test
    @DisplayName("Random topology honours the configured counts")
    void testRandomTopology() {
        GridOptimizerConfig config = GridOptimizerConfig.builder()
                .topologyResource("")
                .numNodes(12)
                .numGenerators(3)
                .build();
        try (GridOptimizer optimizer = GridOptimizer.create(config)) {
            EpisodeResult result = optimizer.optimizeNow();
            assertEquals(9, result.getAssignments().size());
            assertEquals(9, result.resolvedCount());
        }
    }

    @Test
    @DisplayName("Configured counts must match the loaded topology")
    void testSizeMismatch() {
        GridOptimizerConfig config = GridOptimizerConfig.builder().numNodes(10).build();

        TopologyBuildException ex = assertThrows(TopologyBuildException.class, () -> GridOptimizer.create(config));
        assertEquals(TopologyBuildException.REASON_SIZE_MISMATCH, ex.reasonCode());
    }

    @Test
    @Timeout(20)
    @DisplayName("Background loop publishes episodes until stopped")
    void testBackgroundLoop() throws InterruptedException {
        GridTopology topology = GridFixtures.topology(GridFixtures.branchDefinition());
        EpisodeOrchestrator orchestrator = GridFixtures.orchestrator(topology, GridFixtures.constantOracle(0.1d), 8L);
        try (GridOptimizer optimizer = new GridOptimizer(orchestrator, 50, Duration.ofMillis(5))) {
            optimizer.start();
            assertTrue(optimizer.isRunning());
            while (optimizer.episodesTrained() < 3) {
                Thread.sleep(5);
            }
            EpisodeResult manual = optimizer.optimizeNow();
            optimizer.stop();

            assertFalse(optimizer.isRunning());
            long published = optimizer.episodesTrained();
            assertTrue(published >= manual.getEpisode());
            assertEquals(published, optimizer.scheduler().completedCycles() + 1);
            assertEquals(0L, optimizer.scheduler().failedCycles());
        }
    }

    @Test
    @DisplayName("Wrapping an orchestrator that already ran continues its episode numbering")
    void testResumesFromOrchestratorCounter() {
        GridTopology topology = GridFixtures.topology(GridFixtures.branchDefinition());
        EpisodeOrchestrator orchestrator = GridFixtures.orchestrator(topology, GridFixtures.constantOracle(0.1d), 3L);
        orchestrator.runEpisode();

        try (GridOptimizer optimizer = new GridOptimizer(orchestrator, 10, Duration.ofSeconds(5))) {
            assertEquals(1L, optimizer.episodesTrained());
            assertEquals(1L, optimizer.topologySnapshot().iteration());

            EpisodeResult result = optimizer.optimizeNow();

            assertEquals(2L, result.getEpisode());
            assertEquals(2L, optimizer.episodesTrained());
            assertEquals(2L, orchestrator.episodeCounter());
            assertEquals(1, optimizer.history().size());
        }
    }
}
