package org.carma.deception.model;

/**
 * One row of the convergence history, recorded after every iteration.
 */
public final class ConvergenceEntry {

    private final int iteration;
    private final double maxChange;
    private final double[] defenderUtilities;
    private final double[] attackerUtilities;
    private final double[] defenderDeltas;
    private final double[] attackerDeltas;

    public ConvergenceEntry(int iteration, double maxChange,
                            double[] defenderUtilities, double[] attackerUtilities,
                            double[] defenderDeltas, double[] attackerDeltas) {
        this.iteration = iteration;
        this.maxChange = maxChange;
        this.defenderUtilities = defenderUtilities.clone();
        this.attackerUtilities = attackerUtilities.clone();
        this.defenderDeltas = defenderDeltas.clone();
        this.attackerDeltas = attackerDeltas.clone();
    }

    /** 1-based iteration index. */
    public int getIteration() { return iteration; }
    /** Largest per-channel change across all players this iteration. */
    public double getMaxChange() { return maxChange; }
    public double[] getDefenderUtilities() { return defenderUtilities.clone(); }
    public double[] getAttackerUtilities() { return attackerUtilities.clone(); }
    /** Per-defender largest per-channel change. */
    public double[] getDefenderDeltas() { return defenderDeltas.clone(); }
    /** Per-attacker largest per-channel change. */
    public double[] getAttackerDeltas() { return attackerDeltas.clone(); }

    @Override
    public String toString() {
        return String.format("Iter[%d, maxChange=%.6f]", iteration, maxChange);
    }
}
