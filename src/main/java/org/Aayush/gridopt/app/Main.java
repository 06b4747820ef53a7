package org.Aayush.gridopt.app;

import org.Aayush.gridopt.config.GridOptimizerConfig;
import org.Aayush.gridopt.engine.GridOptimizer;
import org.Aayush.gridopt.io.EpisodeResultJson;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.PrintStream;
import java.util.concurrent.CountDownLatch;

/**
 * Command-line entry point.
 * <ul>
 * <li>no arguments: run the periodic optimization loop until the JVM is stopped;</li>
 * <li>{@code --episodes N}: run {@code N} cycles synchronously, then print the latest episode
 *     and the loss metrics as JSON.</li>
 * </ul>
 * Configuration comes from {@code -Dgridopt.*} system properties.
 */
public class Main {
    private static final Logger log = LogManager.getLogger(Main.class);

    /**
     * Launches the optimizer.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) throws InterruptedException {
        int episodes = parseEpisodes(args);
        GridOptimizerConfig config = GridOptimizerConfig.fromSystemProperties();
        if (episodes > 0) {
            runEpisodes(config, episodes, System.out);
            return;
        }

        GridOptimizer optimizer = GridOptimizer.create(config);
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            optimizer.close();
            stopped.countDown();
        }, "grid-optimizer-shutdown"));
        optimizer.start();
        stopped.await();
    }

    /**
     * Runs a fixed number of cycles and prints the outcome.
     */
    static void runEpisodes(GridOptimizerConfig config, int episodes, PrintStream out) {
        try (GridOptimizer optimizer = GridOptimizer.create(config)) {
            for (int i = 0; i < episodes; i++) {
                optimizer.optimizeNow();
            }
            optimizer.latestResult().ifPresent(result -> out.println(EpisodeResultJson.write(result)));
            out.println(EpisodeResultJson.write(optimizer.lossMetrics()));
            log.info("Finished {} episodes, best loss {}%", optimizer.episodesTrained(), optimizer.bestLoss());
        }
    }

    static int parseEpisodes(String[] args) {
        if (args.length == 0) {
            return 0;
        }
        if (args.length != 2 || !"--episodes".equals(args[0])) {
            throw new IllegalArgumentException("usage: Main [--episodes N]");
        }
        int episodes;
        try {
            episodes = Integer.parseInt(args[1]);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("episode count must be an integer, got " + args[1], e);
        }
        if (episodes < 1) {
            throw new IllegalArgumentException("episode count must be >= 1, got " + episodes);
        }
        return episodes;
    }
}
