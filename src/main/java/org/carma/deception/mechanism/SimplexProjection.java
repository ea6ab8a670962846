package org.carma.deception.mechanism;

/**
 * Maps an arbitrary vector onto the non-negative vectors summing to a budget.
 *
 * Clamp-then-rescale: negatives go to zero, the rest is scaled proportionally to hit the
 * budget exactly, and an all-non-positive input falls back to an even split over every
 * slot. This is not the Euclidean projection onto the simplex, and solver trajectories
 * depend on it.
 */
public final class SimplexProjection {

    private SimplexProjection() {}

    public static double[] project(double[] v, double budget) {
        int n = v.length;
        double[] out = new double[n];
        if (n == 0) return out;

        double sum = 0;
        for (int i = 0; i < n; i++) {
            out[i] = Math.max(0, v[i]);
            sum += out[i];
        }

        if (sum <= 0) {
            double share = budget / n;
            for (int i = 0; i < n; i++) out[i] = share;
            return out;
        }

        for (int i = 0; i < n; i++) {
            out[i] = out[i] / sum * budget;
        }
        return out;
    }
}
