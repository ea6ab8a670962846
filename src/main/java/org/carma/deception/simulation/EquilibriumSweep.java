package org.carma.deception.simulation;

import org.carma.deception.mechanism.EquilibriumEngine;
import org.carma.deception.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.*;

/**
 * Runs one equilibrium per value of a sweep variable.
 *
 * The baseline (range minimum) runs first on the calling thread; a failure there aborts
 * the sweep. The remaining points are independent runs fanned out over a fixed thread
 * pool. A failed point is logged and recorded as an empty, non-converged point so the
 * rest of the sweep still completes.
 *
 * Usage:
 * <pre>
 * EquilibriumSweep sweep = new EquilibriumSweep(new EquilibriumSolver(), 4);
 * SweepResult result = sweep.run(params, SweepVariable.ND, List.of(0.0, 1.0, 2.0));
 * System.out.println(result.getSummary());
 * </pre>
 */
public class EquilibriumSweep {

    private static final Logger log = LoggerFactory.getLogger(EquilibriumSweep.class);

    private final EquilibriumEngine engine;
    private final int threads;
    private boolean includeOracle = false;

    public EquilibriumSweep(EquilibriumEngine engine, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got " + threads);
        }
        this.engine = engine;
        this.threads = threads;
    }

    public EquilibriumSweep(EquilibriumEngine engine) {
        this(engine, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Also run every point against an oracle jammer and record its throughput.
     */
    public EquilibriumSweep includeOracle(boolean includeOracle) {
        this.includeOracle = includeOracle;
        return this;
    }

    public SweepResult run(EquilibriumParams base, SweepVariable variable, List<Double> range) {
        if (range == null || range.isEmpty()) {
            throw new IllegalArgumentException("Sweep range must not be empty");
        }

        double rangeMin = range.stream().mapToDouble(Double::doubleValue).min().getAsDouble();
        log.info("Sweeping {} over {} values on {} threads (baseline {}={})",
            variable, range.size(), threads, variable, rangeMin);

        SweepPoint baseline = evaluate(base, variable, rangeMin);

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, range.size()));
        List<Future<SweepPoint>> futures = new ArrayList<>();
        try {
            for (double value : range) {
                futures.add(executor.submit(() -> evaluate(base, variable, value)));
            }

            List<SweepPoint> points = new ArrayList<>();
            for (int k = 0; k < futures.size(); k++) {
                double value = range.get(k);
                try {
                    points.add(futures.get(k).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.warn("Sweep point {}={} failed: {}", variable, value, cause.getMessage());
                    points.add(SweepPoint.failed(value, cause.getMessage()));
                }
            }

            SweepPoint best = baseline;
            for (SweepPoint point : points) {
                if (!point.isFailed() && point.getRealThroughput() > best.getRealThroughput()) {
                    best = point;
                }
            }

            log.info("Sweep complete: best {}={} with U_real={}",
                variable, best.getVariable(), best.getRealThroughput());
            return new SweepResult(variable, points, baseline, best);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Sweep over " + variable + " interrupted", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private SweepPoint evaluate(EquilibriumParams base, SweepVariable variable, double value) {
        EquilibriumParams params = variable.apply(base, value);
        EquilibriumResult result = engine.solve(params);
        EquilibriumResult oracle = null;
        if (includeOracle) {
            oracle = engine.solve(params.toBuilder().jammerObjective(JammerObjective.ORACLE).build());
        }
        return SweepPoint.of(value, result, oracle);
    }
}
