package org.carma.deception.mechanism;

import org.carma.deception.model.*;
import org.carma.deception.safety.ParameterValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Damped simultaneous best response for the deception-jamming game.
 *
 * Each iteration:
 * 1. Every defender, in index order, takes an ascent step along its gradient,
 *    projects onto its budget and damps: x ← (1-α)·x + α·projected
 * 2. The active set is recomputed from the new defender allocation
 * 3. Every attacker, in index order, asks its jammer policy for a candidate (or, when
 *    independent under the gradient strategy, takes its own ascent step) and damps
 *    the same way
 * 4. The largest per-channel change across all players is recorded
 *
 * The run stops CONVERGED once that change drops below ε, or EXHAUSTED after the
 * iteration cap. Damping is what keeps the coupled non-convex game from oscillating;
 * nothing here proves convergence to a true equilibrium.
 *
 * Attackers update in place, so attacker m already sees the new rows of attackers
 * 0..m-1 in its interference terms. The loop is inherently sequential; parallelism
 * belongs one level up, across independent runs.
 */
public class EquilibriumSolver implements EquilibriumEngine {

    private static final Logger log = LoggerFactory.getLogger(EquilibriumSolver.class);

    /** Fixed ascent step for defender and independent-attacker updates. */
    static final double STEP_SIZE = 0.5;

    private final ParameterValidator validator;

    public EquilibriumSolver(ParameterValidator validator) {
        this.validator = validator;
    }

    public EquilibriumSolver() {
        this(new ParameterValidator());
    }

    @Override
    public EquilibriumResult solve(EquilibriumParams params) {
        validator.validateOrThrow(params);

        long startTime = System.currentTimeMillis();
        int n = params.getNumChannels();
        int numDefenders = params.getNumDefenders();
        int numAttackers = params.getNumAttackers();
        double alpha = params.getDamping();

        log.info("Running equilibrium: D={}, M={}, N={}, strategy={}, objective={}, mode={}",
            numDefenders, numAttackers, n, params.getJammerStrategy(),
            params.getJammerObjective(), params.getAttackerMode());

        SinrModel model = new SinrModel(params);
        JammerPolicy policy = JammerPolicy.forStrategy(model);
        boolean independentAscent = params.getAttackerMode() == AttackerMode.INDEPENDENT
            && params.getJammerStrategy() == JammerStrategy.GRADIENT;

        // Initialization
        double[][] x = new AllocationInitializer(params).initialDefenderAllocation();
        double[][] y = new double[numAttackers][n];
        ActiveSet active = ActiveSet.of(x, params);
        for (int m = 0; m < numAttackers; m++) {
            y[m] = policy.allocate(m, x, y, active);
        }

        List<ConvergenceEntry> history = new ArrayList<>();
        EquilibriumResult.Status status = EquilibriumResult.Status.EXHAUSTED;
        int iterations = 0;
        double maxChange = Double.POSITIVE_INFINITY;

        for (int iter = 0; iter < params.getMaxIterations(); iter++) {
            iterations = iter + 1;
            maxChange = 0;

            double[] defenderDeltas = new double[numDefenders];
            double[] attackerDeltas = new double[numAttackers];

            // Defenders
            for (int d = 0; d < numDefenders; d++) {
                double[] grad = model.defenderGradient(d, x, y);
                double[] step = new double[n];
                for (int i = 0; i < n; i++) {
                    step[i] = x[d][i] + STEP_SIZE * grad[i];
                }
                double[] projected = SimplexProjection.project(step, params.getDefenderBudget(d));
                defenderDeltas[d] = dampInto(x[d], projected, alpha);
                maxChange = Math.max(maxChange, defenderDeltas[d]);
            }

            active = ActiveSet.of(x, params);

            // Attackers
            for (int m = 0; m < numAttackers; m++) {
                double[] candidate;
                if (independentAscent) {
                    double[] grad = model.attackerGradient(m, x, y, active);
                    double[] step = new double[n];
                    for (int i = 0; i < n; i++) {
                        step[i] = y[m][i] + STEP_SIZE * grad[i];
                    }
                    candidate = SimplexProjection.project(step, params.getAttackerBudget(m));
                } else {
                    candidate = policy.allocate(m, x, y, active);
                }
                attackerDeltas[m] = dampInto(y[m], candidate, alpha);
                maxChange = Math.max(maxChange, attackerDeltas[m]);
            }

            history.add(new ConvergenceEntry(iterations, maxChange,
                defenderUtilities(model, x, y), attackerUtilities(model, x, y),
                defenderDeltas, attackerDeltas));

            if (log.isDebugEnabled()) {
                log.debug("Iteration {}: maxChange={}", iterations, maxChange);
            }

            if (maxChange < params.getEpsilon()) {
                status = EquilibriumResult.Status.CONVERGED;
                log.info("Converged at iteration {} with maxChange={}", iterations, maxChange);
                break;
            }
        }

        if (status == EquilibriumResult.Status.EXHAUSTED) {
            log.info("Iteration cap {} reached without convergence, maxChange={}",
                params.getMaxIterations(), maxChange);
        }

        return buildResult(model, x, y, status, iterations, maxChange, history, startTime);
    }

    /**
     * row ← (1-α)·row + α·target, returning the largest absolute change.
     */
    static double dampInto(double[] row, double[] target, double alpha) {
        double largest = 0;
        for (int i = 0; i < row.length; i++) {
            double next = (1 - alpha) * row[i] + alpha * target[i];
            largest = Math.max(largest, Math.abs(next - row[i]));
            row[i] = next;
        }
        return largest;
    }

    private double[] defenderUtilities(SinrModel model, double[][] x, double[][] y) {
        double[] out = new double[x.length];
        for (int d = 0; d < x.length; d++) {
            out[d] = model.defenderUtility(d, x, y, true);
        }
        return out;
    }

    private double[] attackerUtilities(SinrModel model, double[][] x, double[][] y) {
        double[] out = new double[y.length];
        for (int m = 0; m < y.length; m++) {
            out[m] = model.attackerUtility(m, x, y);
        }
        return out;
    }

    private EquilibriumResult buildResult(SinrModel model, double[][] x, double[][] y,
                                          EquilibriumResult.Status status, int iterations,
                                          double maxChange, List<ConvergenceEntry> history,
                                          long startTime) {
        EquilibriumParams params = model.getParams();
        ActiveSet finalActive = ActiveSet.of(x, params);

        List<PlayerAllocation> defenders = new ArrayList<>();
        for (int d = 0; d < params.getNumDefenders(); d++) {
            defenders.add(new PlayerAllocation(d, x[d], model.defenderUtility(d, x, y, true)));
        }
        List<PlayerAllocation> attackers = new ArrayList<>();
        for (int m = 0; m < params.getNumAttackers(); m++) {
            attackers.add(new PlayerAllocation(m, y[m], model.attackerUtility(m, x, y)));
        }

        EquilibriumMetricsBuilder metricsBuilder = new EquilibriumMetricsBuilder(model);
        return new EquilibriumResult(
            defenders,
            attackers,
            status,
            iterations,
            maxChange,
            history,
            metricsBuilder.channelSummary(x, y, finalActive),
            metricsBuilder.metrics(x, y, finalActive),
            System.currentTimeMillis() - startTime
        );
    }

    @Override
    public String toString() {
        return "EquilibriumSolver[step=" + STEP_SIZE + "]";
    }
}
