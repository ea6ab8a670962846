package org.carma.deception.mechanism;

import org.carma.deception.model.*;

import java.util.*;

/**
 * Starting defender allocation for the best-response loop.
 *
 * Deterministic start: every decoy gets min(τ, remaining / decoyCount), in channel
 * order, and whatever is left is split over the real channels, evenly or in
 * proportion to the defender's gain h. Random start: weights drawn from the seeded
 * generator over all owned non-inactive channels, normalized to the budget.
 *
 * A defender that owns no usable channel starts at all zeros.
 */
public class AllocationInitializer {

    private final EquilibriumParams params;

    public AllocationInitializer(EquilibriumParams params) {
        this.params = params;
    }

    public double[][] initialDefenderAllocation() {
        LinearCongruentialRandom random = params.getSeed()
            .map(LinearCongruentialRandom::new)
            .orElseGet(LinearCongruentialRandom::unseeded);

        int n = params.getNumChannels();
        double[][] x = new double[params.getNumDefenders()][n];

        for (int d = 0; d < params.getNumDefenders(); d++) {
            List<Integer> owned = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                ChannelConfig c = params.getChannel(i);
                if (c.getOwner() == d && !c.isInactive()) owned.add(i);
            }
            if (owned.isEmpty()) continue;

            if (params.isRandomInit()) {
                seedRandom(x[d], owned, params.getDefenderBudget(d), random);
            } else {
                seedDeterministic(d, x[d], owned);
            }
        }
        return x;
    }

    private void seedRandom(double[] row, List<Integer> owned, double budget,
                            LinearCongruentialRandom random) {
        double[] weights = new double[owned.size()];
        double sum = 0;
        for (int k = 0; k < weights.length; k++) {
            weights[k] = random.nextDouble();
            sum += weights[k];
        }
        for (int k = 0; k < weights.length; k++) {
            row[owned.get(k)] = sum > 0 ? weights[k] / sum * budget : budget / weights.length;
        }
    }

    private void seedDeterministic(int d, double[] row, List<Integer> owned) {
        double remaining = params.getDefenderBudget(d);
        double tau = params.getSensingThreshold();

        List<Integer> real = new ArrayList<>();
        List<Integer> decoys = new ArrayList<>();
        for (int i : owned) {
            if (params.getChannel(i).isReal()) real.add(i);
            else decoys.add(i);
        }

        for (int i : decoys) {
            row[i] = Math.min(tau, remaining / Math.max(1, decoys.size()));
            remaining -= row[i];
        }

        if (real.isEmpty()) return;

        double gainSum = 0;
        for (int i : real) gainSum += params.getDefenderGain(d, i);

        for (int i : real) {
            if (params.isGainWeightedInit() && gainSum > 0) {
                row[i] = remaining * params.getDefenderGain(d, i) / gainSum;
            } else {
                row[i] = remaining / real.size();
            }
        }
    }
}
