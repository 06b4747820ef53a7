package org.Aayush.gridopt.policy;

import java.util.List;
import java.util.Objects;

/**
 * REINFORCE step for {@link AssignmentPolicy}.
 *
 * <p>For a softmax policy the score function with respect to the logits is
 * {@code onehot(a) - p}. Each logit is linear in the parameters, so per sampled action:</p>
 * <pre>
 * dW[g][k]  = (1[a = g] - p[g]) * context[k]
 * dtheta[f] = sum_g (1[a = g] - p[g]) * candidate[g][f]
 * dB[s][g]  = (1[a = g] - p[g])
 * </pre>
 * <p>The new parameters are {@code old + learningRate * advantage * sum(d)}.</p>
 */
public final class PolicyGradient {

    private PolicyGradient() {
    }

    /**
     * Pure gradient-ascent step.
     *
     * @param parameters parameters the actions were sampled with; not modified.
     * @param actions actions whose outcome produced {@code advantage}.
     * @param advantage centred, possibly normalised episode reward.
     * @param learningRate step size, finite and {@code >= 0}.
     * @return new parameters.
     */
    public static PolicyParameters update(
            PolicyParameters parameters,
            List<SampledAction> actions,
            double advantage,
            double learningRate
    ) {
        Objects.requireNonNull(parameters, "parameters");
        Objects.requireNonNull(actions, "actions");
        if (!Double.isFinite(advantage)) {
            throw new IllegalArgumentException("advantage must be finite, got " + advantage);
        }
        if (!Double.isFinite(learningRate) || learningRate < 0.0d) {
            throw new IllegalArgumentException("learningRate must be finite and >= 0, got " + learningRate);
        }

        double[][] contextWeights = parameters.copyContextWeights();
        double[] candidateWeights = parameters.copyCandidateWeights();
        double[][] preferenceBias = parameters.copyPreferenceBias();
        double step = learningRate * advantage;
        if (step == 0.0d || actions.isEmpty()) {
            return new PolicyParameters(contextWeights, candidateWeights, preferenceBias);
        }

        for (SampledAction action : actions) {
            SubstationState state = action.state();
            double[] probabilities = action.probabilities();
            double[] context = state.contextVector();
            int s = state.substationIndex();
            for (int g = 0; g < probabilities.length; g++) {
                double score = (g == action.generatorIndex() ? 1.0d : 0.0d) - probabilities[g];
                if (score == 0.0d) {
                    continue;
                }
                double scaled = step * score;
                for (int k = 0; k < context.length; k++) {
                    contextWeights[g][k] += scaled * context[k];
                }
                double[] candidate = state.candidateVector(g);
                for (int f = 0; f < candidate.length; f++) {
                    candidateWeights[f] += scaled * candidate[f];
                }
                preferenceBias[s][g] += scaled;
            }
        }
        return new PolicyParameters(contextWeights, candidateWeights, preferenceBias);
    }
}
