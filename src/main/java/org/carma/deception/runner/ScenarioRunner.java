package org.carma.deception.runner;

import org.carma.deception.config.ScenarioConfigLoader;
import org.carma.deception.config.ScenarioConfigLoader.*;
import org.carma.deception.mechanism.*;
import org.carma.deception.model.*;
import org.carma.deception.safety.InvalidParametersException;
import org.carma.deception.safety.ParameterValidator.ValidationError;
import org.carma.deception.simulation.*;

import java.io.*;
import java.nio.file.*;
import java.util.*;

/**
 * Executes equilibrium scenarios loaded from configuration files.
 *
 * Key features:
 * - Loads and validates a scenario from YAML
 * - Solves it with the damped best-response engine
 * - Optionally adds the oracle / no-decoy comparison and a parameter sweep
 * - Reports allocations, channel outcomes and convergence
 *
 * Usage:
 * <pre>
 * java ScenarioRunner config/scenarios/two-real-two-decoy
 * java ScenarioRunner scenario.yaml --compare
 * java ScenarioRunner scenario.yaml --sweep ND 0 6 1
 * java ScenarioRunner                      # bundled default scenario
 * </pre>
 */
public class ScenarioRunner {

    static final String DEFAULT_SCENARIO = "scenarios/default/scenario.yaml";
    private static final String SEP = "═".repeat(72);
    private static final int HISTORY_TAIL = 5;

    private final ScenarioConfigLoader loader;
    private final EquilibriumEngine engine;
    private final PrintStream out;

    private boolean verbose = true;

    public ScenarioRunner(EquilibriumEngine engine, PrintStream out) {
        this.loader = new ScenarioConfigLoader();
        this.engine = engine;
        this.out = out;
    }

    public ScenarioRunner() {
        this(new EquilibriumSolver(), System.out);
    }

    public ScenarioRunner verbose(boolean verbose) {
        this.verbose = verbose;
        return this;
    }

    // ========================================================================
    // MAIN EXECUTION
    // ========================================================================

    /**
     * Run a scenario from a YAML file or a directory holding scenario.yaml.
     */
    public ScenarioResult run(Path scenarioPath) throws IOException {
        log("Loading scenario from: " + scenarioPath);
        return run(loader.loadScenario(scenarioPath));
    }

    /**
     * Run the scenario bundled with the application.
     */
    public ScenarioResult runDefault() throws IOException {
        log("Loading bundled scenario: " + DEFAULT_SCENARIO);
        return run(loader.loadResource(DEFAULT_SCENARIO));
    }

    public ScenarioResult run(ScenarioConfig scenario) {
        EquilibriumParams params = scenario.params;
        log("Scenario: " + scenario.name);
        if (scenario.description != null && !scenario.description.isEmpty()) {
            log("Description: " + scenario.description);
        }
        log("Parameters: " + params);
        log("");

        // 1. Solve (with comparison passes when requested)
        EquilibriumResult result;
        OracleComparison.Comparison comparison = null;
        if (scenario.compare) {
            comparison = new OracleComparison(engine).compare(params);
            result = comparison.getResult();
        } else {
            result = engine.solve(params);
        }
        report(result, params);

        if (comparison != null) {
            log("=== COMPARISON ===");
            log(String.format("  U_real (oracle jammer): %.4f", comparison.getOracleResult().getMetrics().getTotalRealThroughput()));
            log(String.format("  U_real (no decoys):     %.4f", comparison.getNoDecoyResult().getMetrics().getTotalRealThroughput()));
            log(String.format("  Oracle gap:             %.4f", result.getMetrics().getOracleGap()));
            log(String.format("  Improvement over ND=0:  %.2f%%", result.getMetrics().getImprovementOverNoDecoys()));
            log("");
        }

        // 2. Sweep
        SweepResult sweep = null;
        if (scenario.sweep != null) {
            SweepConfig sc = scenario.sweep;
            log("=== SWEEP ===");
            sweep = new EquilibriumSweep(engine, Math.max(1, sc.threads))
                .includeOracle(scenario.compare)
                .run(params, sc.variable, sc.range());
            log(sweep.getSummary());
        }

        return new ScenarioResult(scenario.name, params, result, comparison, sweep);
    }

    // ========================================================================
    // REPORTING
    // ========================================================================

    private void report(EquilibriumResult result, EquilibriumParams params) {
        log("=== EQUILIBRIUM ===");
        log(String.format("Status: %s after %d iterations (maxChange=%.6f, ε=%s)",
            result.getStatus(), result.getIterations(), result.getMaxChange(), params.getEpsilon()));
        log("");

        log("Defenders:");
        for (PlayerAllocation d : result.getDefenders()) {
            log(String.format("  D%d utility=%.4f  x=%s", d.getPlayerId(), d.getUtility(), format(d.getAllocation())));
        }
        log("Attackers:");
        for (PlayerAllocation m : result.getAttackers()) {
            log(String.format("  J%d utility=%.4f  y=%s", m.getPlayerId(), m.getUtility(), format(m.getAllocation())));
        }
        log("");

        log("Channels:");
        log(String.format("  %3s %-8s %5s %9s %9s %8s %7s %6s", "ch", "type", "owner", "x", "y", "SINR", "rate", "active"));
        for (ChannelSummary c : result.getChannelSummary()) {
            log(String.format("  %3d %-8s %5d %9.4f %9.4f %8.4f %7.4f %6s",
                c.getChannel(), c.getType(), c.getOwner(), c.getTotalDefenderPower(),
                c.getTotalAttackerPower(), c.getSinr(), c.getRate(), c.isActive() ? "yes" : "no"));
        }
        log("");

        EquilibriumMetrics metrics = result.getMetrics();
        log("Metrics:");
        log(String.format("  Total real throughput: %.4f", metrics.getTotalRealThroughput()));
        log(String.format("  Total decoy power:     %.4f", metrics.getTotalDecoyPower()));
        log(String.format("  Jammer waste on decoys: %.2f%%", metrics.getJammerWasteOnDecoys() * 100));
        log(String.format("  Dilution factor:       %.3f (%d active / %d real)",
            metrics.getDilutionFactor(), metrics.getActiveChannelCount(), metrics.getRealChannelCount()));
        log("  Symmetric equilibrium: " + metrics.isSymmetricEquilibrium());
        log("");

        List<ConvergenceEntry> history = result.getConvergenceHistory();
        if (!history.isEmpty()) {
            log("Convergence (last " + Math.min(HISTORY_TAIL, history.size()) + " iterations):");
            for (ConvergenceEntry e : history.subList(Math.max(0, history.size() - HISTORY_TAIL), history.size())) {
                log(String.format("  iter %4d  maxChange=%.6f  U_def=%s", e.getIteration(), e.getMaxChange(),
                    format(e.getDefenderUtilities())));
            }
            log("");
        }
    }

    // ========================================================================
    // RESULT CLASSES
    // ========================================================================

    /**
     * Everything produced for one scenario.
     */
    public static class ScenarioResult {
        public final String scenarioName;
        public final EquilibriumParams params;
        public final EquilibriumResult result;
        public final OracleComparison.Comparison comparison;
        public final SweepResult sweep;

        public ScenarioResult(String scenarioName, EquilibriumParams params, EquilibriumResult result,
                              OracleComparison.Comparison comparison, SweepResult sweep) {
            this.scenarioName = scenarioName;
            this.params = params;
            this.result = result;
            this.comparison = comparison;
            this.sweep = sweep;
        }

        @Override
        public String toString() {
            return "ScenarioResult[" + scenarioName + ", " + result + "]";
        }
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private void log(String message) {
        if (verbose) {
            out.println(message);
        }
    }

    private static String format(double[] values) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < values.length; i++) {
            if (i > 0) sb.append(", ");
            sb.append(String.format("%.3f", values[i]));
        }
        return sb.append("]").toString();
    }

    // ========================================================================
    // COMMAND LINE
    // ========================================================================

    public static void main(String[] args) {
        List<String> argList = Arrays.asList(args);
        System.out.println(SEP);
        System.out.println("   DECEPTION JAMMING EQUILIBRIUM");
        System.out.println(SEP);
        System.out.println();

        ScenarioRunner runner = new ScenarioRunner();
        try {
            ScenarioConfigLoader loader = new ScenarioConfigLoader();
            // scenario path, when given, comes first
            String path = !argList.isEmpty() && !argList.get(0).startsWith("--") ? argList.get(0) : null;
            int sweepAt = argList.indexOf("--sweep");

            ScenarioConfig scenario = path != null
                ? loader.loadScenario(Paths.get(path))
                : loader.loadResource(DEFAULT_SCENARIO);

            if (argList.contains("--compare")) {
                scenario.compare = true;
            }
            if (sweepAt >= 0) {
                scenario.sweep = parseSweepArgs(argList, sweepAt);
            }
            runner.run(scenario);
        } catch (InvalidParametersException e) {
            System.err.println("Invalid scenario: " + e.getMessage());
            System.exit(2);
        } catch (IOException e) {
            System.err.println("Could not load scenario: " + e.getMessage());
            System.exit(1);
        }
    }

    static SweepConfig parseSweepArgs(List<String> args, int sweepAt) {
        if (args.size() < sweepAt + 5) {
            throw new InvalidParametersException(List.of(
                new ValidationError(
                    "--sweep", "expects VARIABLE MIN MAX STEP")));
        }
        SweepConfig sweep = new SweepConfig();
        sweep.variable = SweepVariable.fromKey(args.get(sweepAt + 1));
        if (sweep.variable == null) {
            throw new InvalidParametersException(List.of(
                new ValidationError(
                    "--sweep", "unknown variable " + args.get(sweepAt + 1) + " (ND, tau, N, M, D, PJ)")));
        }
        try {
            sweep.min = Double.parseDouble(args.get(sweepAt + 2));
            sweep.max = Double.parseDouble(args.get(sweepAt + 3));
            sweep.step = Double.parseDouble(args.get(sweepAt + 4));
        } catch (NumberFormatException e) {
            throw new InvalidParametersException(List.of(
                new ValidationError(
                    "--sweep", "MIN, MAX and STEP must be numbers")));
        }
        if (sweep.step <= 0) {
            throw new InvalidParametersException(List.of(
                new ValidationError("--sweep", "STEP must be positive")));
        }
        return sweep;
    }
}
