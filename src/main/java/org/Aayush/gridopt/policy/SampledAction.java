package org.Aayush.gridopt.policy;

/**
 * One generator choice drawn during an episode together with the distribution it came from.
 *
 * @param state encoded state the choice was made in.
 * @param generatorIndex chosen position in the state's generator list.
 * @param probabilities full distribution at sampling time.
 */
public record SampledAction(SubstationState state, int generatorIndex, double[] probabilities) {

    public int generatorId() {
        return state.generatorId(generatorIndex);
    }

    public double probability() {
        return probabilities[generatorIndex];
    }
}
