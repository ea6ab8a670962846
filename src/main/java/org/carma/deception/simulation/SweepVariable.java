package org.carma.deception.simulation;

import org.carma.deception.model.*;

import java.util.*;

/**
 * Parameter a sweep varies, with the rewrite it applies to a base scenario.
 *
 * Every rewrite works on a copy; the base parameters are never touched.
 */
public enum SweepVariable {
    /**
     * Number of decoys: non-real channels are relabeled, the first ⌈ND⌉ as decoys and
     * the rest inactive.
     */
    ND("ND") {
        @Override
        public EquilibriumParams apply(EquilibriumParams base, double value) {
            List<ChannelConfig> layout = base.getChannels();
            int real = 0;
            for (ChannelConfig c : layout) {
                if (c.isReal()) real++;
            }
            // a fractional count rounds up: ND=1.4 still yields a second decoy
            long target = Math.min((long) Math.ceil(value), base.getNumChannels() - real);

            List<ChannelConfig> relabeled = new ArrayList<>(layout.size());
            int decoys = 0;
            for (ChannelConfig c : layout) {
                if (c.isReal()) {
                    relabeled.add(c);
                } else if (decoys < target) {
                    decoys++;
                    relabeled.add(c.withType(ChannelType.DECOY));
                } else {
                    relabeled.add(c.withType(ChannelType.INACTIVE));
                }
            }
            return base.toBuilder().channels(relabeled).build();
        }
    },

    /** Sensing threshold τ. */
    TAU("tau") {
        @Override
        public EquilibriumParams apply(EquilibriumParams base, double value) {
            return base.toBuilder().sensingThreshold(value).build();
        }
    },

    /**
     * Channel count, at least 4. Gains are padded with 1.0 and new channels join as
     * inactive; shrinking truncates.
     */
    N("N") {
        @Override
        public EquilibriumParams apply(EquilibriumParams base, double value) {
            int newN = (int) Math.max(4, Math.round(value));
            if (newN == base.getNumChannels()) {
                return base.toBuilder().build();
            }

            List<ChannelConfig> layout = new ArrayList<>(base.getChannels());
            if (newN > layout.size()) {
                int missing = newN - layout.size();
                for (int k = 0; k < missing; k++) {
                    layout.add(ChannelConfig.inactive(k % base.getNumDefenders()));
                }
            } else {
                layout = layout.subList(0, newN);
            }

            return base.toBuilder()
                .channels(layout)
                .gains(resizeRows(base.getDefenderGains(), newN), resizeRows(base.getAttackerGains(), newN))
                .build();
        }
    },

    /** Attacker count, at least 1. New attackers get budget 10 and unit gains. */
    M("M") {
        @Override
        public EquilibriumParams apply(EquilibriumParams base, double value) {
            int newM = (int) Math.max(1, Math.round(value));
            return base.toBuilder()
                .players(base.getNumDefenders(), newM)
                .budgets(base.getDefenderBudgets(), resizeBudgets(base.getAttackerBudgets(), newM))
                .gains(base.getDefenderGains(), resizePlayers(base.getAttackerGains(), newM, base.getNumChannels()))
                .build();
        }
    },

    /**
     * Defender count, at least 1. New defenders get budget 10 and unit gains; channels
     * whose owner no longer exists are handed to owner % D.
     */
    D("D") {
        @Override
        public EquilibriumParams apply(EquilibriumParams base, double value) {
            int newD = (int) Math.max(1, Math.round(value));
            List<ChannelConfig> layout = new ArrayList<>();
            for (ChannelConfig c : base.getChannels()) {
                layout.add(c.getOwner() >= newD ? c.withOwner(c.getOwner() % newD) : c);
            }
            return base.toBuilder()
                .players(newD, base.getNumAttackers())
                .channels(layout)
                .budgets(resizeBudgets(base.getDefenderBudgets(), newD), base.getAttackerBudgets())
                .gains(resizePlayers(base.getDefenderGains(), newD, base.getNumChannels()), base.getAttackerGains())
                .build();
        }
    },

    /** Total jammer power, spread evenly across attackers. */
    PJ("PJ") {
        @Override
        public EquilibriumParams apply(EquilibriumParams base, double value) {
            double[] budgets = new double[base.getNumAttackers()];
            Arrays.fill(budgets, value / base.getNumAttackers());
            return base.toBuilder()
                .budgets(base.getDefenderBudgets(), budgets)
                .build();
        }
    };

    /** Budget given to players added by a sweep. */
    static final double ADDED_PLAYER_BUDGET = 10.0;

    private final String key;

    SweepVariable(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * Copy of the base scenario with this variable set to the given value.
     */
    public abstract EquilibriumParams apply(EquilibriumParams base, double value);

    public static SweepVariable fromKey(String key) {
        if (key == null) return null;
        for (SweepVariable v : values()) {
            if (v.key.equalsIgnoreCase(key.trim())) return v;
        }
        return null;
    }

    @Override
    public String toString() {
        return key;
    }

    // ========================================================================
    // Resizing helpers
    // ========================================================================

    private static double[][] resizeRows(double[][] matrix, int newN) {
        double[][] out = new double[matrix.length][];
        for (int r = 0; r < matrix.length; r++) {
            double[] row = matrix[r];
            out[r] = Arrays.copyOf(row, newN);
            for (int i = row.length; i < newN; i++) {
                out[r][i] = 1.0;
            }
        }
        return out;
    }

    private static double[][] resizePlayers(double[][] matrix, int newCount, int numChannels) {
        double[][] out = new double[newCount][];
        for (int r = 0; r < newCount; r++) {
            if (r < matrix.length) {
                out[r] = matrix[r].clone();
            } else {
                out[r] = new double[numChannels];
                Arrays.fill(out[r], 1.0);
            }
        }
        return out;
    }

    private static double[] resizeBudgets(double[] budgets, int newCount) {
        double[] out = Arrays.copyOf(budgets, newCount);
        for (int k = budgets.length; k < newCount; k++) {
            out[k] = ADDED_PLAYER_BUDGET;
        }
        return out;
    }
}
