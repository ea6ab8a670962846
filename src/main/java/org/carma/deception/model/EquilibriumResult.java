package org.carma.deception.model;

import java.util.*;

/**
 * Outcome of one equilibrium run.
 *
 * A run that hits its iteration cap is still a complete result: {@link #getStatus()}
 * is {@link Status#EXHAUSTED} and {@link #isConverged()} is false, but allocations,
 * history and metrics are all populated.
 */
public final class EquilibriumResult {

    public enum Status {
        CONVERGED,
        EXHAUSTED
    }

    private final List<PlayerAllocation> defenders;
    private final List<PlayerAllocation> attackers;
    private final Status status;
    private final int iterations;
    private final double maxChange;
    private final List<ConvergenceEntry> convergenceHistory;
    private final List<ChannelSummary> channelSummary;
    private final EquilibriumMetrics metrics;
    private final long computationTimeMs;

    public EquilibriumResult(List<PlayerAllocation> defenders,
                             List<PlayerAllocation> attackers,
                             Status status,
                             int iterations,
                             double maxChange,
                             List<ConvergenceEntry> convergenceHistory,
                             List<ChannelSummary> channelSummary,
                             EquilibriumMetrics metrics,
                             long computationTimeMs) {
        this.defenders = Collections.unmodifiableList(new ArrayList<>(defenders));
        this.attackers = Collections.unmodifiableList(new ArrayList<>(attackers));
        this.status = status;
        this.iterations = iterations;
        this.maxChange = maxChange;
        this.convergenceHistory = Collections.unmodifiableList(new ArrayList<>(convergenceHistory));
        this.channelSummary = Collections.unmodifiableList(new ArrayList<>(channelSummary));
        this.metrics = metrics;
        this.computationTimeMs = computationTimeMs;
    }

    public List<PlayerAllocation> getDefenders() { return defenders; }
    public List<PlayerAllocation> getAttackers() { return attackers; }
    public PlayerAllocation getDefender(int d) { return defenders.get(d); }
    public PlayerAllocation getAttacker(int m) { return attackers.get(m); }
    public Status getStatus() { return status; }
    public boolean isConverged() { return status == Status.CONVERGED; }
    public int getIterations() { return iterations; }
    /** Largest per-channel change of the last iteration. */
    public double getMaxChange() { return maxChange; }
    public List<ConvergenceEntry> getConvergenceHistory() { return convergenceHistory; }
    public List<ChannelSummary> getChannelSummary() { return channelSummary; }
    public EquilibriumMetrics getMetrics() { return metrics; }
    public long getComputationTimeMs() { return computationTimeMs; }

    /** Sum of defender utilities (natural-log rate over real channels). */
    public double getTotalDefenderUtility() {
        return defenders.stream().mapToDouble(PlayerAllocation::getUtility).sum();
    }

    /** Copy of this result carrying replacement metrics. */
    public EquilibriumResult withMetrics(EquilibriumMetrics newMetrics) {
        return new EquilibriumResult(defenders, attackers, status, iterations, maxChange,
            convergenceHistory, channelSummary, newMetrics, computationTimeMs);
    }

    @Override
    public String toString() {
        return String.format("EquilibriumResult[%s after %d iterations, maxChange=%.6f, %s]",
            status, iterations, maxChange, metrics);
    }
}
