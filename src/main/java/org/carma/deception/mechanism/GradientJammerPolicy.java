package org.carma.deception.mechanism;

import org.carma.deception.model.*;

import java.util.List;

/**
 * J3: allocate in proportion to the attacker's own utility gradient.
 *
 * Negative components are dropped. When nothing is left (for example every eligible
 * channel is unfunded) the budget is split evenly over the eligible channels instead.
 */
public class GradientJammerPolicy implements JammerPolicy {

    private final SinrModel model;
    private final EquilibriumParams params;

    public GradientJammerPolicy(SinrModel model) {
        this.model = model;
        this.params = model.getParams();
    }

    @Override
    public double[] allocate(int m, double[][] x, double[][] y, ActiveSet active) {
        int n = params.getNumChannels();
        double[] out = new double[n];
        if (active.isEmpty()) return out;

        double budget = params.getAttackerBudget(m);
        double[] grad = model.attackerGradient(m, x, y, active);
        double gradSum = 0;
        for (double g : grad) gradSum += Math.max(0, g);

        if (gradSum > 0) {
            for (int i = 0; i < n; i++) {
                out[i] = Math.max(0, grad[i]) / gradSum * budget;
            }
            return out;
        }

        List<Integer> eligible = active.eligible(params);
        double share = budget / Math.max(1, eligible.size());
        for (int i : eligible) {
            out[i] = share;
        }
        return out;
    }

    @Override
    public JammerStrategy getStrategy() {
        return JammerStrategy.GRADIENT;
    }
}
