package org.Aayush.gridopt.policy;

import java.util.Arrays;

/**
 * Immutable weights of the assignment policy.
 * <ul>
 * <li>{@code contextWeights[g][k]}: per-generator weights over the substation context vector.</li>
 * <li>{@code candidateWeights[f]}: weights over per-candidate features, shared by all generators.</li>
 * <li>{@code preferenceBias[s][g]}: learned preference of substation {@code s} for generator {@code g}.</li>
 * </ul>
 * New values are produced by {@link PolicyGradient#update}; instances are never mutated.
 */
public final class PolicyParameters {
    private final double[][] contextWeights;
    private final double[] candidateWeights;
    private final double[][] preferenceBias;

    PolicyParameters(double[][] contextWeights, double[] candidateWeights, double[][] preferenceBias) {
        this.contextWeights = contextWeights;
        this.candidateWeights = candidateWeights;
        this.preferenceBias = preferenceBias;
    }

    /**
     * Zero-initialised parameters, i.e. a uniform policy.
     *
     * @param substationCount number of substations the policy assigns.
     * @param generatorCount number of candidate generators.
     */
    public static PolicyParameters zeros(int substationCount, int generatorCount) {
        if (substationCount <= 0 || generatorCount <= 0) {
            throw new IllegalArgumentException(
                    "policy needs substations and generators, got " + substationCount + "x" + generatorCount);
        }
        return new PolicyParameters(
                new double[generatorCount][StateEncoder.CONTEXT_FEATURES],
                new double[StateEncoder.CANDIDATE_FEATURES],
                new double[substationCount][generatorCount]
        );
    }

    public int substationCount() {
        return preferenceBias.length;
    }

    public int generatorCount() {
        return contextWeights.length;
    }

    public double contextWeight(int generatorIndex, int feature) {
        return contextWeights[generatorIndex][feature];
    }

    public double candidateWeight(int feature) {
        return candidateWeights[feature];
    }

    public double preferenceBias(int substationIndex, int generatorIndex) {
        return preferenceBias[substationIndex][generatorIndex];
    }

    /**
     * Unnormalised score of one generator for one encoded substation.
     */
    double logit(SubstationState state, int generatorIndex) {
        double[] context = state.contextVector();
        double[] candidate = state.candidateVector(generatorIndex);
        double[] weights = contextWeights[generatorIndex];
        double logit = preferenceBias[state.substationIndex()][generatorIndex];
        for (int k = 0; k < context.length; k++) {
            logit += weights[k] * context[k];
        }
        for (int f = 0; f < candidate.length; f++) {
            logit += candidateWeights[f] * candidate[f];
        }
        return logit;
    }

    double[][] copyContextWeights() {
        return deepCopy(contextWeights);
    }

    double[] copyCandidateWeights() {
        return candidateWeights.clone();
    }

    double[][] copyPreferenceBias() {
        return deepCopy(preferenceBias);
    }

    private static double[][] deepCopy(double[][] source) {
        double[][] out = new double[source.length][];
        for (int i = 0; i < source.length; i++) {
            out[i] = source[i].clone();
        }
        return out;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PolicyParameters that)) {
            return false;
        }
        return Arrays.deepEquals(contextWeights, that.contextWeights)
                && Arrays.equals(candidateWeights, that.candidateWeights)
                && Arrays.deepEquals(preferenceBias, that.preferenceBias);
    }

    @Override
    public int hashCode() {
        int result = Arrays.deepHashCode(contextWeights);
        result = 31 * result + Arrays.hashCode(candidateWeights);
        result = 31 * result + Arrays.deepHashCode(preferenceBias);
        return result;
    }

    @Override
    public String toString() {
        return "PolicyParameters{generators=" + generatorCount()
                + ", substations=" + substationCount()
                + ", candidateWeights=" + Arrays.toString(candidateWeights) + "}";
    }
}
