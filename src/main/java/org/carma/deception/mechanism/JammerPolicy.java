package org.carma.deception.mechanism;

import org.carma.deception.model.*;

/**
 * Strategy an attacker uses to turn the visible state into a power allocation.
 *
 * Implementations see only the active set and the current allocations, and return a
 * full row of length N. The row sums to the attacker's budget unless no channel is
 * eligible, in which case it is all zero.
 *
 * Eligible channels are the active ones, narrowed to real channels when the attacker
 * plays the oracle objective.
 */
public interface JammerPolicy {

    /**
     * Produce a candidate allocation for attacker m.
     *
     * @param m      attacker index
     * @param x      current defender allocation, x[d][i]
     * @param y      current attacker allocation, y[m][i] (read-only here)
     * @param active channels visible to jammers
     */
    double[] allocate(int m, double[][] x, double[][] y, ActiveSet active);

    JammerStrategy getStrategy();

    /**
     * Build the policy selected by the run configuration.
     */
    static JammerPolicy forStrategy(SinrModel model) {
        EquilibriumParams params = model.getParams();
        switch (params.getJammerStrategy()) {
            case UNIFORM:
                return new UniformJammerPolicy(params);
            case TOP_K:
                return new TopKJammerPolicy(params);
            case GRADIENT:
                return new GradientJammerPolicy(model);
            default:
                throw new IllegalArgumentException("Unsupported jammer strategy: " + params.getJammerStrategy());
        }
    }
}
