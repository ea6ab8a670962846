package org.carma.deception.mechanism;

import org.carma.deception.model.*;

import java.util.*;

/**
 * Turns a terminal allocation into per-channel rows and aggregate metrics.
 */
public class EquilibriumMetricsBuilder {

    /** Symmetry tolerance, as a multiple of ε on the total L1 distance. */
    static final double SYMMETRY_TOLERANCE_FACTOR = 10.0;

    private final EquilibriumParams params;
    private final SinrModel model;

    public EquilibriumMetricsBuilder(SinrModel model) {
        this.model = model;
        this.params = model.getParams();
    }

    public List<ChannelSummary> channelSummary(double[][] x, double[][] y, ActiveSet active) {
        int n = params.getNumChannels();
        int numAttackers = params.getNumAttackers();
        List<ChannelSummary> rows = new ArrayList<>(n);

        for (int i = 0; i < n; i++) {
            ChannelConfig config = params.getChannel(i);
            int owner = config.getOwner();
            double defenderPower = x[owner][i];

            double attackerPower = 0;
            double gainSum = 0;
            for (int m = 0; m < numAttackers; m++) {
                attackerPower += y[m][i];
                gainSum += params.getAttackerGain(m, i);
            }

            double sinr = 0;
            double rate = 0;
            if (defenderPower > 0) {
                sinr = model.sinr(i, x, y);
                rate = log2(1 + sinr);
            }

            rows.add(new ChannelSummary(i, owner, config.getType(), defenderPower, attackerPower,
                sinr, rate, params.getDefenderGain(owner, i), gainSum / numAttackers,
                active.contains(i)));
        }
        return rows;
    }

    /**
     * Aggregate metrics. Decoy channels never count toward throughput; the comparison
     * fields are left at zero.
     */
    public EquilibriumMetrics metrics(double[][] x, double[][] y, ActiveSet active) {
        double totalRealThroughput = 0;
        double totalDecoyPower = 0;
        double jammerOnDecoys = 0;
        double totalJammerPower = 0;
        int realChannelCount = 0;

        for (int i = 0; i < params.getNumChannels(); i++) {
            ChannelConfig config = params.getChannel(i);
            double defenderPower = x[config.getOwner()][i];

            double jamPower = 0;
            for (int m = 0; m < params.getNumAttackers(); m++) {
                jamPower += y[m][i];
            }
            totalJammerPower += jamPower;

            if (config.isReal()) {
                realChannelCount++;
                if (defenderPower > 0) {
                    totalRealThroughput += log2(1 + model.sinr(i, x, y));
                }
            } else if (config.isDecoy()) {
                totalDecoyPower += defenderPower;
                jammerOnDecoys += jamPower;
            }
        }

        int activeCount = active.size();
        double dilution = realChannelCount > 0 ? (double) activeCount / realChannelCount : 1.0;
        double waste = totalJammerPower > 0 ? jammerOnDecoys / totalJammerPower : 0.0;

        return new EquilibriumMetrics(waste, dilution, 0.0, 0.0,
            totalRealThroughput, totalDecoyPower, activeCount, realChannelCount,
            isSymmetric(x));
    }

    /**
     * Degenerate-outcome detector: every defender row lies within 10ε (L1) of
     * defender 0's row. A single defender is never reported as symmetric.
     */
    boolean isSymmetric(double[][] x) {
        if (x.length <= 1) return false;
        double tolerance = params.getEpsilon() * SYMMETRY_TOLERANCE_FACTOR;
        double[] first = x[0];
        for (int d = 1; d < x.length; d++) {
            double diff = 0;
            for (int i = 0; i < first.length; i++) {
                diff += Math.abs(x[d][i] - first[i]);
            }
            if (diff > tolerance) return false;
        }
        return true;
    }

    private static double log2(double v) {
        return Math.log(v) / Math.log(2);
    }
}
