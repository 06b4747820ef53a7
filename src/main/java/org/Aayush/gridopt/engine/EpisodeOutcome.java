package org.Aayush.gridopt.engine;

import org.Aayush.gridopt.topology.TopologySnapshot;

/**
 * Everything one cycle hands to the state guard for publication.
 *
 * @param result episode result.
 * @param snapshot topology state after the cycle.
 * @param recordInHistory whether the episode enters the loss history.
 */
public record EpisodeOutcome(EpisodeResult result, TopologySnapshot snapshot, boolean recordInHistory) {
}
