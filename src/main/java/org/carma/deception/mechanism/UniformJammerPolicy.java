package org.carma.deception.mechanism;

import org.carma.deception.model.*;

import java.util.List;

/**
 * J1: the same power on every eligible active channel.
 *
 * The per-channel share is first computed over the whole active set and then
 * renormalized over the eligible channels, which gives an even split of the full budget.
 */
public class UniformJammerPolicy implements JammerPolicy {

    private final EquilibriumParams params;

    public UniformJammerPolicy(EquilibriumParams params) {
        this.params = params;
    }

    @Override
    public double[] allocate(int m, double[][] x, double[][] y, ActiveSet active) {
        double[] out = new double[params.getNumChannels()];
        if (active.isEmpty()) return out;

        double budget = params.getAttackerBudget(m);
        double share = budget / active.size();
        List<Integer> eligible = active.eligible(params);
        for (int i : eligible) {
            out[i] = share;
        }

        double sum = 0;
        for (double v : out) sum += v;
        if (sum > 0) {
            for (int i = 0; i < out.length; i++) {
                out[i] = out[i] / sum * budget;
            }
        }
        return out;
    }

    @Override
    public JammerStrategy getStrategy() {
        return JammerStrategy.UNIFORM;
    }
}
