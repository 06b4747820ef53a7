package org.Aayush.gridopt.policy;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;
import java.util.Random;

/**
 * Stochastic softmax policy choosing a generator per substation.
 *
 * <pre>
 * logit[g] = W[g] . context + theta . candidate[g] + B[s][g]
 * p[g]     = softmax(logit)[g] over reachable generators
 * </pre>
 * <p>
 * Unreachable generators get probability {@code 0}. When no generator is reachable the
 * unmasked distribution is used, so the sampled assignment fails later during path lookup.
 * Parameters are replaced wholesale once per episode by the orchestrator.
 * </p>
 */
@Accessors(fluent = true)
public final class AssignmentPolicy {
    private final Random random;
    @Getter
    private volatile PolicyParameters parameters;

    public AssignmentPolicy(PolicyParameters initial, long seed) {
        this.parameters = Objects.requireNonNull(initial, "initial");
        this.random = new Random(seed);
    }

    /**
     * Current distribution over the state's generators.
     */
    public double[] probabilities(SubstationState state) {
        return distribution(parameters, state);
    }

    /**
     * Draws one generator from the current distribution.
     */
    public SampledAction sample(SubstationState state) {
        double[] probabilities = probabilities(state);
        double draw = random.nextDouble();
        double cumulative = 0.0d;
        int chosen = -1;
        for (int g = 0; g < probabilities.length; g++) {
            if (probabilities[g] <= 0.0d) {
                continue;
            }
            chosen = g;
            cumulative += probabilities[g];
            if (draw < cumulative) {
                break;
            }
        }
        return new SampledAction(state, chosen, probabilities);
    }

    /**
     * Installs the parameters produced by the latest update.
     */
    public void replaceParameters(PolicyParameters next) {
        Objects.requireNonNull(next, "next");
        if (next.generatorCount() != parameters.generatorCount()
                || next.substationCount() != parameters.substationCount()) {
            throw new IllegalArgumentException("parameter shape changed: " + parameters + " -> " + next);
        }
        this.parameters = next;
    }

    /**
     * Masked softmax of the policy logits for one state.
     */
    public static double[] distribution(PolicyParameters parameters, SubstationState state) {
        int generators = state.generatorCount();
        if (generators != parameters.generatorCount()) {
            throw new IllegalArgumentException(
                    "state has " + generators + " generators, parameters expect " + parameters.generatorCount());
        }
        boolean masked = state.anyReachable();
        double[] logits = new double[generators];
        double max = Double.NEGATIVE_INFINITY;
        for (int g = 0; g < generators; g++) {
            if (masked && !state.isReachable(g)) {
                continue;
            }
            logits[g] = parameters.logit(state, g);
            max = Math.max(max, logits[g]);
        }

        double[] probabilities = new double[generators];
        double sum = 0.0d;
        for (int g = 0; g < generators; g++) {
            if (masked && !state.isReachable(g)) {
                continue;
            }
            probabilities[g] = Math.exp(logits[g] - max);
            sum += probabilities[g];
        }
        for (int g = 0; g < generators; g++) {
            probabilities[g] /= sum;
        }
        return probabilities;
    }
}
