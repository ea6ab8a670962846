package org.carma.deception.config;

import org.carma.deception.mechanism.LinearCongruentialRandom;
import org.carma.deception.model.*;

import java.util.*;

/**
 * Stock scenarios and generators for channel layouts and gain matrices.
 */
public final class DefaultScenarios {

    /** Default budget for every defender and attacker. */
    public static final double DEFAULT_BUDGET = 10.0;

    private DefaultScenarios() {}

    /**
     * Two defenders, two attackers, interleaved ownership (channel i belongs to i % 2).
     * Each defender's first three channels are real, the next two decoys, the rest
     * inactive. Unit gains, budgets of 10, uniform deception jammers.
     */
    public static EquilibriumParams defaultParams(int numChannels) {
        int d = 2;
        int m = 2;
        double[] pt = new double[d];
        double[] pj = new double[m];
        Arrays.fill(pt, DEFAULT_BUDGET);
        Arrays.fill(pj, DEFAULT_BUDGET);

        return new EquilibriumParams.Builder()
            .players(d, m)
            .channels(defaultChannelLayout(numChannels, d))
            .budgets(pt, pj)
            .unitGains()
            .noisePower(1.0)
            .sensingThreshold(0.2)
            .damping(0.3)
            .maxIterations(100)
            .epsilon(0.001)
            .jammerStrategy(JammerStrategy.UNIFORM)
            .jammerObjective(JammerObjective.DECEPTION)
            .attackerMode(AttackerMode.COORDINATED)
            .topK(3)
            .randomInit(false)
            .build();
    }

    public static EquilibriumParams defaultParams() {
        return defaultParams(12);
    }

    /**
     * Interleaved layout: channel i is owned by i % D; per defender, positions 0-2 are
     * real, 3-4 decoy, and everything after that inactive.
     */
    public static List<ChannelConfig> defaultChannelLayout(int numChannels, int numDefenders) {
        List<ChannelConfig> layout = new ArrayList<>(numChannels);
        for (int i = 0; i < numChannels; i++) {
            int owner = i % numDefenders;
            int position = i / numDefenders;
            if (position < 3) {
                layout.add(ChannelConfig.real(owner));
            } else if (position < 5) {
                layout.add(ChannelConfig.decoy(owner));
            } else {
                layout.add(ChannelConfig.inactive(owner));
            }
        }
        return layout;
    }

    // ========================================================================
    // Gains
    // ========================================================================

    /**
     * Defender and attacker gain matrices drawn from a distribution.
     */
    public static final class GainMatrices {
        private final double[][] defenderGains;
        private final double[][] attackerGains;

        GainMatrices(double[][] defenderGains, double[][] attackerGains) {
            this.defenderGains = defenderGains;
            this.attackerGains = attackerGains;
        }

        public double[][] getDefenderGains() { return defenderGains; }
        public double[][] getAttackerGains() { return attackerGains; }
    }

    /**
     * Draw h (D×N) then g (M×N) row by row from one generator.
     * {@link GainDistribution#CUSTOM} has nothing to draw from and is rejected.
     */
    public static GainMatrices randomGains(int numChannels, int numDefenders, int numAttackers,
                                           GainDistribution distribution, Long seed) {
        if (distribution == GainDistribution.CUSTOM) {
            throw new IllegalArgumentException("Custom gains must be supplied explicitly");
        }
        LinearCongruentialRandom random = seed != null
            ? new LinearCongruentialRandom(seed)
            : LinearCongruentialRandom.unseeded();

        double[][] h = new double[numDefenders][numChannels];
        double[][] g = new double[numAttackers][numChannels];
        for (double[] row : h) {
            for (int i = 0; i < numChannels; i++) row[i] = drawGain(distribution, random);
        }
        for (double[] row : g) {
            for (int i = 0; i < numChannels; i++) row[i] = drawGain(distribution, random);
        }
        return new GainMatrices(h, g);
    }

    private static double drawGain(GainDistribution distribution, LinearCongruentialRandom random) {
        double u = random.nextDouble();
        if (distribution == GainDistribution.RAYLEIGH) {
            // u can reach exactly 1.0; keep the log finite
            return Math.sqrt(-2 * Math.log(Math.max(1e-12, 1 - u)));
        }
        return 0.5 + u * 1.5;
    }

    // ========================================================================
    // Layout statistics
    // ========================================================================

    public static Map<ChannelType, Integer> countChannelTypes(List<ChannelConfig> layout) {
        Map<ChannelType, Integer> counts = new EnumMap<>(ChannelType.class);
        for (ChannelType type : ChannelType.values()) {
            counts.put(type, 0);
        }
        for (ChannelConfig c : layout) {
            counts.merge(c.getType(), 1, Integer::sum);
        }
        return counts;
    }

    /** Real channels owned by each defender. */
    public static int[] realChannelsPerDefender(List<ChannelConfig> layout, int numDefenders) {
        return countPerDefender(layout, numDefenders, ChannelType.REAL);
    }

    /** Decoy channels owned by each defender. */
    public static int[] decoyChannelsPerDefender(List<ChannelConfig> layout, int numDefenders) {
        return countPerDefender(layout, numDefenders, ChannelType.DECOY);
    }

    private static int[] countPerDefender(List<ChannelConfig> layout, int numDefenders, ChannelType type) {
        int[] counts = new int[numDefenders];
        for (ChannelConfig c : layout) {
            if (c.getType() == type && c.getOwner() >= 0 && c.getOwner() < numDefenders) {
                counts[c.getOwner()]++;
            }
        }
        return counts;
    }
}
