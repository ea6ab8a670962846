package org.carma.deception.runner;

import org.carma.deception.config.ScenarioConfigLoader;
import org.carma.deception.config.ScenarioConfigLoader.ScenarioConfig;
import org.carma.deception.config.ScenarioConfigLoader.SweepConfig;
import org.carma.deception.mechanism.EquilibriumSolver;
import org.carma.deception.runner.ScenarioRunner.ScenarioResult;
import org.carma.deception.safety.InvalidParametersException;
import org.carma.deception.simulation.SweepVariable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScenarioRunnerTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final ScenarioRunner runner =
        new ScenarioRunner(new EquilibriumSolver(), new PrintStream(buffer, true, StandardCharsets.UTF_8));

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("bundled scenario runs and reports allocations, channels and metrics")
    void defaultScenario() throws IOException {
        ScenarioResult result = runner.runDefault();

        assertEquals("default", result.scenarioName);
        assertNotNull(result.result);
        assertNull(result.comparison);
        assertNull(result.sweep);

        String out = output();
        assertTrue(out.contains("=== EQUILIBRIUM ==="));
        assertTrue(out.contains("Channels:"));
        assertTrue(out.contains("Total real throughput"));
    }

    @Test
    @DisplayName("scenario directory on disk with an oracle jammer")
    void scenarioFromDirectory(@TempDir Path dir) throws IOException {
        try (InputStream is = getClass().getClassLoader()
                .getResourceAsStream("scenarios/oracle-baseline/scenario.yaml")) {
            assertNotNull(is);
            Files.copy(is, dir.resolve(ScenarioConfigLoader.SCENARIO_FILE));
        }

        ScenarioResult result = runner.run(dir);

        assertEquals("oracle-baseline", result.scenarioName);
        assertTrue(result.params.isObjectiveOracle());
        assertEquals(0.0, result.result.getMetrics().getJammerWasteOnDecoys(), 1e-12);
    }

    @Test
    @DisplayName("comparison and sweep requested by the scenario are both carried out")
    void compareAndSweep() {
        ScenarioConfig scenario = new ScenarioConfigLoader().load(
            "name: combined\n" +
            "D: 1\n" +
            "M: 1\n" +
            "channelConfig:\n" +
            "  - {type: real, owner: 0}\n" +
            "  - {type: real, owner: 0}\n" +
            "  - {type: decoy, owner: 0}\n" +
            "  - {type: decoy, owner: 0}\n" +
            "compare: true\n" +
            "sweep: {variable: ND, min: 0, max: 2, step: 1, threads: 2}\n");

        ScenarioResult result = runner.run(scenario);

        assertNotNull(result.comparison);
        assertEquals(result.comparison.getResult(), result.result);
        assertEquals(3, result.sweep.getPoints().size());
        assertTrue(result.sweep.getPoints().get(0).getOracleThroughput().isPresent());
        assertTrue(output().contains("=== COMPARISON ==="));
        assertTrue(output().contains("=== SWEEP ==="));
    }

    @Test
    void quietRunPrintsNothing() throws IOException {
        runner.verbose(false).runDefault();
        assertEquals("", output());
    }

    @Test
    void missingScenarioFile(@TempDir Path dir) {
        assertThrows(IOException.class, () -> runner.run(dir.resolve("nothing-here")));
    }

    @Test
    @DisplayName("--sweep VARIABLE MIN MAX STEP")
    void sweepArguments() {
        List<String> args = List.of("scenario.yaml", "--sweep", "tau", "0.1", "0.5", "0.2");
        SweepConfig sweep = ScenarioRunner.parseSweepArgs(args, 1);
        assertEquals(SweepVariable.TAU, sweep.variable);
        assertEquals(0.1, sweep.min, 0.0);
        assertEquals(0.5, sweep.max, 0.0);
        assertEquals(0.2, sweep.step, 0.0);
    }

    @Test
    void badSweepArguments() {
        assertThrows(InvalidParametersException.class,
            () -> ScenarioRunner.parseSweepArgs(List.of("--sweep", "tau", "0.1"), 0));
        assertThrows(InvalidParametersException.class,
            () -> ScenarioRunner.parseSweepArgs(List.of("--sweep", "sigma2", "0", "1", "1"), 0));
        assertThrows(InvalidParametersException.class,
            () -> ScenarioRunner.parseSweepArgs(List.of("--sweep", "ND", "zero", "1", "1"), 0));
        assertThrows(InvalidParametersException.class,
            () -> ScenarioRunner.parseSweepArgs(List.of("--sweep", "ND", "0", "1", "0"), 0));
    }
}
