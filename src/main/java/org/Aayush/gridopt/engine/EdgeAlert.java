package org.Aayush.gridopt.engine;

import org.Aayush.gridopt.oracle.FailureMode;
import org.Aayush.gridopt.oracle.Severity;

/**
 * High or critical risk classification raised for one edge during an episode.
 */
public record EdgeAlert(
        int edgeId,
        int sourceNodeId,
        int targetNodeId,
        double probability,
        FailureMode failureMode,
        Severity severity
) {
}
