package org.Aayush.gridopt.policy;

/**
 * Hand-built encoded states for policy unit tests.
 */
final class PolicyTestStates {
    static final double[] CONTEXT = {0.45d, 0.2d, 0.3d, 0.2d, 0.1d, 0.2d, 0.3d};
    static final double[] CANDIDATE_NEAR = {0.1d, 0.2d, 0.1d, 0.0d};
    static final double[] CANDIDATE_FAR = {0.5d, 0.2d, 0.1d, 0.25d};

    private PolicyTestStates() {
    }

    static SubstationState twoGenerators(int substationIndex, boolean firstReachable, boolean secondReachable) {
        return new SubstationState(
                substationIndex,
                2 + substationIndex,
                45.0d,
                new int[]{0, 1},
                CONTEXT.clone(),
                new double[][]{
                        firstReachable ? CANDIDATE_NEAR.clone() : new double[StateEncoder.CANDIDATE_FEATURES],
                        secondReachable ? CANDIDATE_FAR.clone() : new double[StateEncoder.CANDIDATE_FEATURES]
                },
                new boolean[]{firstReachable, secondReachable},
                null
        );
    }
}
