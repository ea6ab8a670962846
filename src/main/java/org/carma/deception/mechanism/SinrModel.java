package org.carma.deception.mechanism;

import org.carma.deception.model.*;

/**
 * Utilities and local gradients of the jamming game.
 *
 * Per channel i owned by defender d:
 *
 *   I_i    = σ² + Σ_m y[m][i]·g[m][i]
 *   SINR_i = x[d][i]·h[d][i] / I_i
 *
 * Defender utility is Σ ln(1 + SINR_i) over its channels. Attacker utility is the
 * negated sum of all defender utilities, taken over real channels only for an oracle
 * attacker and over every non-inactive channel for a deception attacker. The second
 * form is what makes decoys pay off: a deceived attacker counts decoy "throughput" as
 * something worth suppressing.
 *
 * σ² &gt; 0 is guaranteed by validation, so I_i never reaches zero.
 */
public class SinrModel {

    /** Gradient pushing an unfunded decoy up to the sensing threshold. */
    static final double DECOY_GRADIENT_BELOW_THRESHOLD = 0.1;
    /** Gradient keeping an active decoy minimally funded. */
    static final double DECOY_GRADIENT_ACTIVE = 0.01;

    private final EquilibriumParams params;

    public SinrModel(EquilibriumParams params) {
        this.params = params;
    }

    public EquilibriumParams getParams() {
        return params;
    }

    /**
     * Noise plus summed jammer interference on a channel.
     */
    public double interference(int channel, double[][] y) {
        double total = params.getNoisePower();
        for (int m = 0; m < params.getNumAttackers(); m++) {
            total += y[m][channel] * params.getAttackerGain(m, channel);
        }
        return total;
    }

    /**
     * SINR seen by the owner of a channel; zero when the owner puts no power there.
     */
    public double sinr(int channel, double[][] x, double[][] y) {
        ChannelConfig config = params.getChannel(channel);
        int owner = config.getOwner();
        double power = x[owner][channel];
        if (power <= 0) return 0;
        return power * params.getDefenderGain(owner, channel) / interference(channel, y);
    }

    // ========================================================================
    // Utilities
    // ========================================================================

    /**
     * Σ ln(1 + SINR) over the defender's own channels.
     *
     * @param onlyReal true to count real channels only, false to count every
     *                 non-inactive channel (real and decoy)
     */
    public double defenderUtility(int d, double[][] x, double[][] y, boolean onlyReal) {
        double utility = 0;
        for (int i = 0; i < params.getNumChannels(); i++) {
            ChannelConfig config = params.getChannel(i);
            if (config.getOwner() != d) continue;
            if (onlyReal && !config.isReal()) continue;
            if (!onlyReal && config.isInactive()) continue;

            double power = x[d][i];
            if (power <= 0) continue;

            double sinr = power * params.getDefenderGain(d, i) / interference(i, y);
            utility += Math.log(1 + sinr);
        }
        return utility;
    }

    /**
     * Negated defender welfare as perceived by the attacker's objective.
     * Identical for every attacker; the index is kept for symmetry with the gradient.
     */
    public double attackerUtility(int m, double[][] x, double[][] y) {
        boolean onlyReal = params.isObjectiveOracle();
        double total = 0;
        for (int d = 0; d < params.getNumDefenders(); d++) {
            total += defenderUtility(d, x, y, onlyReal);
        }
        return -total;
    }

    // ========================================================================
    // Gradients
    // ========================================================================

    /**
     * Ascent direction for defender d.
     *
     * Real channels: ∂u/∂x_i = h / (I_i + x·h). Decoys carry no rate objective and get
     * a small constant instead, larger while they sit below τ. Channels the defender
     * does not own, and inactive ones, get zero.
     */
    public double[] defenderGradient(int d, double[][] x, double[][] y) {
        int n = params.getNumChannels();
        double tau = params.getSensingThreshold();
        double[] grad = new double[n];

        for (int i = 0; i < n; i++) {
            ChannelConfig config = params.getChannel(i);
            if (config.getOwner() != d || config.isInactive()) continue;

            double power = x[d][i];
            if (config.isReal()) {
                double h = params.getDefenderGain(d, i);
                grad[i] = h / (interference(i, y) + power * h);
            } else {
                grad[i] = power < tau ? DECOY_GRADIENT_BELOW_THRESHOLD : DECOY_GRADIENT_ACTIVE;
            }
        }
        return grad;
    }

    /**
     * Ascent direction for attacker m on its negated objective.
     *
     * ∂(−u)/∂y_i = (x·h·g_m) / (I_i·(I_i + x·h)) on active channels with positive
     * owner power; oracle attackers additionally skip everything that is not real.
     */
    public double[] attackerGradient(int m, double[][] x, double[][] y, ActiveSet active) {
        int n = params.getNumChannels();
        boolean oracle = params.isObjectiveOracle();
        double[] grad = new double[n];

        for (int i = 0; i < n; i++) {
            if (!active.contains(i)) continue;
            ChannelConfig config = params.getChannel(i);
            if (oracle && !config.isReal()) continue;

            int owner = config.getOwner();
            double power = x[owner][i];
            if (power <= 0) continue;

            double interference = interference(i, y);
            double signal = power * params.getDefenderGain(owner, i);
            grad[i] = signal * params.getAttackerGain(m, i) / (interference * (interference + signal));
        }
        return grad;
    }
}
