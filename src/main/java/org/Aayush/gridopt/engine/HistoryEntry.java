package org.Aayush.gridopt.engine;

/**
 * One bounded-history sample.
 */
public record HistoryEntry(long episode, double lossPercent, double avgRisk) {
}
