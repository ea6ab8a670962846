package org.carma.deception.simulation;

import org.carma.deception.model.*;

import java.util.Optional;

/**
 * One sampled value of a sweep and the headline outcome of its run.
 */
public final class SweepPoint {

    private final double variable;
    private final double realThroughput;
    private final Double oracleThroughput;
    private final double dilutionFactor;
    private final double jammerWaste;
    private final boolean converged;
    private final int iterations;
    private final String error;

    private SweepPoint(double variable, double realThroughput, Double oracleThroughput,
                       double dilutionFactor, double jammerWaste, boolean converged,
                       int iterations, String error) {
        this.variable = variable;
        this.realThroughput = realThroughput;
        this.oracleThroughput = oracleThroughput;
        this.dilutionFactor = dilutionFactor;
        this.jammerWaste = jammerWaste;
        this.converged = converged;
        this.iterations = iterations;
        this.error = error;
    }

    public static SweepPoint of(double variable, EquilibriumResult result) {
        return of(variable, result, null);
    }

    public static SweepPoint of(double variable, EquilibriumResult result, EquilibriumResult oracle) {
        EquilibriumMetrics metrics = result.getMetrics();
        return new SweepPoint(variable,
            metrics.getTotalRealThroughput(),
            oracle != null ? oracle.getMetrics().getTotalRealThroughput() : null,
            metrics.getDilutionFactor(),
            metrics.getJammerWasteOnDecoys(),
            result.isConverged(),
            result.getIterations(),
            null);
    }

    /** Placeholder for a value whose run failed; it never wins the sweep. */
    public static SweepPoint failed(double variable, String error) {
        return new SweepPoint(variable, 0, null, 0, 0, false, 0, error);
    }

    public double getVariable() { return variable; }
    /** U_real: total real throughput at this value. */
    public double getRealThroughput() { return realThroughput; }
    public Optional<Double> getOracleThroughput() { return Optional.ofNullable(oracleThroughput); }
    /** U_real under an oracle jammer minus U_real under the configured one. */
    public Optional<Double> getOracleGap() {
        return oracleThroughput == null ? Optional.empty() : Optional.of(oracleThroughput - realThroughput);
    }
    public double getDilutionFactor() { return dilutionFactor; }
    public double getJammerWaste() { return jammerWaste; }
    public boolean isConverged() { return converged; }
    public int getIterations() { return iterations; }
    public boolean isFailed() { return error != null; }
    public Optional<String> getError() { return Optional.ofNullable(error); }

    @Override
    public String toString() {
        if (error != null) {
            return String.format("SweepPoint[%.3f FAILED: %s]", variable, error);
        }
        return String.format("SweepPoint[%.3f, U_real=%.4f, waste=%.3f, converged=%s]",
            variable, realThroughput, jammerWaste, converged);
    }
}
