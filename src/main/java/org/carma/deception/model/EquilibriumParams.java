package org.carma.deception.model;

import java.util.*;

/**
 * Complete, immutable input to one equilibrium run.
 *
 * Holds the channel layout, the per-player budgets and gain matrices, and the solver
 * settings. Every array is copied on the way in and on the way out, so a run (or a
 * parallel sweep task) can never alias another run's model.
 *
 * Instances are not validated on construction; pass them through
 * {@link org.carma.deception.safety.ParameterValidator} before solving.
 *
 * Usage:
 * <pre>
 * EquilibriumParams params = new EquilibriumParams.Builder()
 *     .players(1, 1)
 *     .budgets(new double[]{10}, new double[]{10})
 *     .channels(List.of(ChannelConfig.real(0), ChannelConfig.decoy(0)))
 *     .unitGains()
 *     .build();
 * </pre>
 */
public final class EquilibriumParams {

    private final int numChannels;
    private final int numDefenders;
    private final int numAttackers;
    private final double[] defenderBudgets;
    private final double[] attackerBudgets;
    private final double noisePower;
    private final double sensingThreshold;
    private final double[][] defenderGains;
    private final double[][] attackerGains;
    private final double damping;
    private final int maxIterations;
    private final double epsilon;
    private final List<ChannelConfig> channels;
    private final JammerStrategy jammerStrategy;
    private final JammerObjective jammerObjective;
    private final AttackerMode attackerMode;
    private final int topK;
    private final boolean randomInit;
    private final boolean gainWeightedInit;
    private final Long seed;

    private EquilibriumParams(Builder b) {
        this.numChannels = b.numChannels;
        this.numDefenders = b.numDefenders;
        this.numAttackers = b.numAttackers;
        this.defenderBudgets = copy(b.defenderBudgets);
        this.attackerBudgets = copy(b.attackerBudgets);
        this.noisePower = b.noisePower;
        this.sensingThreshold = b.sensingThreshold;
        this.defenderGains = copy(b.defenderGains);
        this.attackerGains = copy(b.attackerGains);
        this.damping = b.damping;
        this.maxIterations = b.maxIterations;
        this.epsilon = b.epsilon;
        this.channels = b.channels == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(b.channels));
        this.jammerStrategy = b.jammerStrategy;
        this.jammerObjective = b.jammerObjective;
        this.attackerMode = b.attackerMode;
        this.topK = b.topK;
        this.randomInit = b.randomInit;
        this.gainWeightedInit = b.gainWeightedInit;
        this.seed = b.seed;
    }

    // ========================================================================
    // Sizes and scalars
    // ========================================================================

    /** N: total channel count. */
    public int getNumChannels() { return numChannels; }
    /** D: defender count. */
    public int getNumDefenders() { return numDefenders; }
    /** M: attacker count. */
    public int getNumAttackers() { return numAttackers; }
    /** σ²: receiver noise power. */
    public double getNoisePower() { return noisePower; }
    /** τ: power at or above which a channel becomes visible to jammers. */
    public double getSensingThreshold() { return sensingThreshold; }
    /** α: damping factor blending the previous and proposed allocation. */
    public double getDamping() { return damping; }
    public int getMaxIterations() { return maxIterations; }
    public double getEpsilon() { return epsilon; }
    public JammerStrategy getJammerStrategy() { return jammerStrategy; }
    public JammerObjective getJammerObjective() { return jammerObjective; }
    public AttackerMode getAttackerMode() { return attackerMode; }
    public int getTopK() { return topK; }
    public boolean isRandomInit() { return randomInit; }
    public boolean isGainWeightedInit() { return gainWeightedInit; }
    public Optional<Long> getSeed() { return Optional.ofNullable(seed); }

    // ========================================================================
    // Indexed access (hot path)
    // ========================================================================

    public double getDefenderBudget(int d) { return defenderBudgets[d]; }
    public double getAttackerBudget(int m) { return attackerBudgets[m]; }
    public double getDefenderGain(int d, int i) { return defenderGains[d][i]; }
    public double getAttackerGain(int m, int i) { return attackerGains[m][i]; }
    public ChannelConfig getChannel(int i) { return channels.get(i); }
    public List<ChannelConfig> getChannels() { return channels; }

    public boolean isObjectiveOracle() {
        return jammerObjective == JammerObjective.ORACLE;
    }

    // ========================================================================
    // Copies (validation, sweeps, reporting)
    // ========================================================================

    public double[] getDefenderBudgets() { return copy(defenderBudgets); }
    public double[] getAttackerBudgets() { return copy(attackerBudgets); }
    public double[][] getDefenderGains() { return copy(defenderGains); }
    public double[][] getAttackerGains() { return copy(attackerGains); }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.numChannels = numChannels;
        b.numDefenders = numDefenders;
        b.numAttackers = numAttackers;
        b.defenderBudgets = copy(defenderBudgets);
        b.attackerBudgets = copy(attackerBudgets);
        b.noisePower = noisePower;
        b.sensingThreshold = sensingThreshold;
        b.defenderGains = copy(defenderGains);
        b.attackerGains = copy(attackerGains);
        b.damping = damping;
        b.maxIterations = maxIterations;
        b.epsilon = epsilon;
        b.channels = new ArrayList<>(channels);
        b.jammerStrategy = jammerStrategy;
        b.jammerObjective = jammerObjective;
        b.attackerMode = attackerMode;
        b.topK = topK;
        b.randomInit = randomInit;
        b.gainWeightedInit = gainWeightedInit;
        b.seed = seed;
        return b;
    }

    static double[] copy(double[] src) {
        return src == null ? null : src.clone();
    }

    static double[][] copy(double[][] src) {
        if (src == null) return null;
        double[][] out = new double[src.length][];
        for (int r = 0; r < src.length; r++) {
            out[r] = src[r] == null ? null : src[r].clone();
        }
        return out;
    }

    @Override
    public String toString() {
        return String.format("EquilibriumParams[N=%d, D=%d, M=%d, strategy=%s, objective=%s, mode=%s]",
            numChannels, numDefenders, numAttackers, jammerStrategy, jammerObjective, attackerMode);
    }

    // ========================================================================
    // Builder
    // ========================================================================

    /**
     * Fluent builder. Defaults match the platform's default scenario settings
     * (σ²=1, τ=0.2, α=0.3, 100 iterations, ε=1e-3, uniform/deception/coordinated, K=3).
     */
    public static class Builder {
        private int numChannels;
        private int numDefenders;
        private int numAttackers;
        private double[] defenderBudgets;
        private double[] attackerBudgets;
        private double noisePower = 1.0;
        private double sensingThreshold = 0.2;
        private double[][] defenderGains;
        private double[][] attackerGains;
        private double damping = 0.3;
        private int maxIterations = 100;
        private double epsilon = 1e-3;
        private List<ChannelConfig> channels;
        private JammerStrategy jammerStrategy = JammerStrategy.UNIFORM;
        private JammerObjective jammerObjective = JammerObjective.DECEPTION;
        private AttackerMode attackerMode = AttackerMode.COORDINATED;
        private int topK = 3;
        private boolean randomInit = false;
        private boolean gainWeightedInit = false;
        private Long seed;

        public Builder players(int defenders, int attackers) {
            this.numDefenders = defenders;
            this.numAttackers = attackers;
            return this;
        }

        /** Sets the channel layout; N follows the list size. */
        public Builder channels(List<ChannelConfig> channels) {
            this.channels = channels == null ? null : new ArrayList<>(channels);
            this.numChannels = channels == null ? 0 : channels.size();
            return this;
        }

        /** Overrides N independently of the layout (for malformed-input checks). */
        public Builder numChannels(int n) {
            this.numChannels = n;
            return this;
        }

        public Builder budgets(double[] defenderBudgets, double[] attackerBudgets) {
            this.defenderBudgets = copy(defenderBudgets);
            this.attackerBudgets = copy(attackerBudgets);
            return this;
        }

        public Builder gains(double[][] defenderGains, double[][] attackerGains) {
            this.defenderGains = copy(defenderGains);
            this.attackerGains = copy(attackerGains);
            return this;
        }

        /** All gains 1.0, sized from the current player and channel counts. */
        public Builder unitGains() {
            this.defenderGains = new double[numDefenders][numChannels];
            this.attackerGains = new double[numAttackers][numChannels];
            for (double[] row : defenderGains) Arrays.fill(row, 1.0);
            for (double[] row : attackerGains) Arrays.fill(row, 1.0);
            return this;
        }

        public Builder noisePower(double sigma2) {
            this.noisePower = sigma2;
            return this;
        }

        public Builder sensingThreshold(double tau) {
            this.sensingThreshold = tau;
            return this;
        }

        public Builder damping(double alpha) {
            this.damping = alpha;
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder epsilon(double epsilon) {
            this.epsilon = epsilon;
            return this;
        }

        public Builder jammerStrategy(JammerStrategy strategy) {
            this.jammerStrategy = strategy;
            return this;
        }

        public Builder jammerObjective(JammerObjective objective) {
            this.jammerObjective = objective;
            return this;
        }

        public Builder attackerMode(AttackerMode mode) {
            this.attackerMode = mode;
            return this;
        }

        public Builder topK(int k) {
            this.topK = k;
            return this;
        }

        public Builder randomInit(boolean randomInit) {
            this.randomInit = randomInit;
            return this;
        }

        public Builder gainWeightedInit(boolean gainWeightedInit) {
            this.gainWeightedInit = gainWeightedInit;
            return this;
        }

        public Builder seed(Long seed) {
            this.seed = seed;
            return this;
        }

        public EquilibriumParams build() {
            return new EquilibriumParams(this);
        }
    }
}
