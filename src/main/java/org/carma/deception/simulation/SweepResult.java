package org.carma.deception.simulation;

import java.util.*;

/**
 * All points of one sweep, the baseline at the range minimum and the best point
 * by real throughput.
 */
public final class SweepResult {

    private final SweepVariable variable;
    private final List<SweepPoint> points;
    private final SweepPoint baseline;
    private final SweepPoint bestPoint;

    public SweepResult(SweepVariable variable, List<SweepPoint> points,
                       SweepPoint baseline, SweepPoint bestPoint) {
        this.variable = variable;
        this.points = Collections.unmodifiableList(new ArrayList<>(points));
        this.baseline = baseline;
        this.bestPoint = bestPoint;
    }

    public SweepVariable getVariable() { return variable; }
    public List<SweepPoint> getPoints() { return points; }
    public SweepPoint getBaseline() { return baseline; }
    public SweepPoint getBestPoint() { return bestPoint; }

    public long getFailedCount() {
        return points.stream().filter(SweepPoint::isFailed).count();
    }

    /**
     * Text table of the sweep, one row per point.
     */
    public String getSummary() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Sweep over %s (%d points, %d failed)%n", variable, points.size(), getFailedCount()));
        sb.append(String.format("  %10s %10s %10s %10s %10s %6s%n",
            variable, "U_real", "U_oracle", "dilution", "waste", "iters"));
        for (SweepPoint p : points) {
            if (p.isFailed()) {
                sb.append(String.format("  %10.3f  failed: %s%n", p.getVariable(), p.getError().orElse("")));
                continue;
            }
            sb.append(String.format("  %10.3f %10.4f %10s %10.3f %10.3f %6d%s%n",
                p.getVariable(), p.getRealThroughput(),
                p.getOracleThroughput().map(v -> String.format("%.4f", v)).orElse("-"),
                p.getDilutionFactor(), p.getJammerWaste(), p.getIterations(),
                p.isConverged() ? "" : " (not converged)"));
        }
        sb.append(String.format("  Baseline %s=%.3f: U_real=%.4f%n",
            variable, baseline.getVariable(), baseline.getRealThroughput()));
        sb.append(String.format("  Best %s=%.3f: U_real=%.4f%n",
            variable, bestPoint.getVariable(), bestPoint.getRealThroughput()));
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("SweepResult[%s, %d points, best=%.3f]", variable, points.size(), bestPoint.getVariable());
    }
}
