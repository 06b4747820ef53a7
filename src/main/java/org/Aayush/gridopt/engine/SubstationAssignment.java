package org.Aayush.gridopt.engine;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Per-substation record of one episode.
 *
 * <p>An unresolved substation keeps the generator that was sampled for it but has an empty
 * path and zero loss; callers tell it apart through {@link #isResolved()}.</p>
 */
@Value
@Builder
public class SubstationAssignment {
    int substationId;
    String substationName;
    int generatorId;
    String generatorName;
    @Builder.Default
    List<Integer> path = List.of();
    double demand;
    double loss;
    /** Summed edge risk along the path. */
    double pathRisk;
    /** Probability the policy gave the chosen generator. */
    double probability;
    boolean resolved;
}
