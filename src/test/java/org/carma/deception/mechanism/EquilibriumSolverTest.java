package org.carma.deception.mechanism;

import org.carma.deception.config.DefaultScenarios;
import org.carma.deception.model.*;
import org.carma.deception.safety.InvalidParametersException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EquilibriumSolverTest {

    private static final double EPS = 1e-9;

    private final EquilibriumSolver solver = new EquilibriumSolver();

    /** One defender with two real channels and two decoys facing one uniform jammer. */
    private static EquilibriumParams.Builder twoRealTwoDecoy() {
        return new EquilibriumParams.Builder()
            .players(1, 1)
            .channels(List.of(ChannelConfig.real(0), ChannelConfig.real(0),
                ChannelConfig.decoy(0), ChannelConfig.decoy(0)))
            .budgets(new double[]{10}, new double[]{10})
            .unitGains();
    }

    private static EquilibriumParams.Builder allReal() {
        return new EquilibriumParams.Builder()
            .players(1, 1)
            .channels(List.of(ChannelConfig.real(0), ChannelConfig.real(0),
                ChannelConfig.real(0), ChannelConfig.real(0)))
            .budgets(new double[]{10}, new double[]{10})
            .unitGains();
    }

    private static double sum(double[] v) {
        double s = 0;
        for (double e : v) s += e;
        return s;
    }

    @Nested
    @DisplayName("deception scenarios")
    class DeceptionTests {

        @Test
        @DisplayName("decoys stay visible and soak up half the jammer power")
        void decoysAbsorbJamming() {
            EquilibriumResult result = solver.solve(twoRealTwoDecoy().build());

            assertTrue(result.isConverged());
            assertEquals(1, result.getIterations());
            assertEquals(4, result.getMetrics().getActiveChannelCount());
            assertEquals(0.5, result.getMetrics().getJammerWasteOnDecoys(), 1e-6);
            assertEquals(2.0, result.getMetrics().getDilutionFactor(), EPS);

            double[] x = result.getDefender(0).getAllocation();
            assertTrue(x[2] >= 0.2 && x[2] < 0.21, "decoy held just above τ: " + x[2]);
            assertEquals(2.4913, result.getMetrics().getTotalRealThroughput(), 1e-3);
        }

        @Test
        @DisplayName("an oracle jammer hurts real throughput more than a deceived one")
        void oracleIsWorse() {
            EquilibriumResult deceived = solver.solve(twoRealTwoDecoy().build());
            EquilibriumResult oracle = solver.solve(twoRealTwoDecoy().jammerObjective(JammerObjective.ORACLE).build());

            assertEquals(0.0, oracle.getMetrics().getJammerWasteOnDecoys(), EPS);
            assertArrayEquals(new double[]{5, 5, 0, 0}, oracle.getAttacker(0).getAllocation(), EPS);
            assertEquals(1.6958, oracle.getMetrics().getTotalRealThroughput(), 1e-3);
            assertTrue(deceived.getMetrics().getTotalRealThroughput() > oracle.getMetrics().getTotalRealThroughput());
        }

        @Test
        void noDecoysMeansNoWaste() {
            EquilibriumResult result = solver.solve(allReal().build());
            assertEquals(0.0, result.getMetrics().getJammerWasteOnDecoys(), 0.0);
            assertEquals(0.0, result.getMetrics().getTotalDecoyPower(), 0.0);
        }
    }

    @Nested
    @DisplayName("invariants")
    class InvariantTests {

        @Test
        @DisplayName("allocations stay non-negative and spend exactly the budget")
        void budgetsAreRespected() {
            EquilibriumParams params = DefaultScenarios.defaultParams();
            EquilibriumResult result = solver.solve(params);

            for (PlayerAllocation d : result.getDefenders()) {
                for (double v : d.getAllocation()) assertTrue(v >= 0);
                assertEquals(params.getDefenderBudget(d.getPlayerId()), d.getTotalPower(), 1e-6);
            }
            for (PlayerAllocation m : result.getAttackers()) {
                for (double v : m.getAllocation()) assertTrue(v >= 0);
                assertEquals(params.getAttackerBudget(m.getPlayerId()), m.getTotalPower(), 1e-6);
            }
        }

        @ParameterizedTest(name = "after {0} iterations")
        @ValueSource(ints = {1, 2, 3, 5, 8, 13})
        @DisplayName("budgets hold at every iteration, not just at the end")
        void budgetsHoldAtEveryIterationCap(int cap) {
            for (JammerStrategy strategy : JammerStrategy.values()) {
                EquilibriumParams params = DefaultScenarios.defaultParams().toBuilder()
                    .jammerStrategy(strategy)
                    .maxIterations(cap)
                    .epsilon(1e-7)
                    .build();
                EquilibriumResult result = solver.solve(params);
                assertTrue(result.getIterations() <= cap);

                for (PlayerAllocation d : result.getDefenders()) {
                    for (double v : d.getAllocation()) assertTrue(v >= 0, strategy + ": negative defender power");
                    assertEquals(params.getDefenderBudget(d.getPlayerId()), d.getTotalPower(), 1e-9);
                }
                for (PlayerAllocation m : result.getAttackers()) {
                    for (double v : m.getAllocation()) assertTrue(v >= 0, strategy + ": negative attacker power");
                    assertEquals(params.getAttackerBudget(m.getPlayerId()), m.getTotalPower(), 1e-9);
                }
            }
        }

        @Test
        void inactiveChannelsStayUnfunded() {
            EquilibriumParams params = DefaultScenarios.defaultParams();
            EquilibriumResult result = solver.solve(params);
            for (ChannelSummary c : result.getChannelSummary()) {
                if (c.getType() == ChannelType.INACTIVE) {
                    assertEquals(0.0, c.getTotalDefenderPower(), 0.0);
                    assertEquals(0.0, c.getTotalAttackerPower(), 0.0);
                    assertFalse(c.isActive());
                }
            }
        }

        @Test
        @DisplayName("history has one entry per iteration, numbered from 1")
        void historyMatchesIterations() {
            EquilibriumResult result = solver.solve(DefaultScenarios.defaultParams());
            List<ConvergenceEntry> history = result.getConvergenceHistory();
            assertEquals(result.getIterations(), history.size());
            for (int k = 0; k < history.size(); k++) {
                assertEquals(k + 1, history.get(k).getIteration());
            }
            assertEquals(result.getMaxChange(), history.get(history.size() - 1).getMaxChange(), 0.0);
        }

        @Test
        @DisplayName("a defender with no power stays at zero and draws no jamming")
        void zeroDefenderBudget() {
            EquilibriumResult result = solver.solve(twoRealTwoDecoy().budgets(new double[]{0}, new double[]{10}).build());
            assertEquals(0.0, sum(result.getDefender(0).getAllocation()), 0.0);
            assertEquals(0.0, sum(result.getAttacker(0).getAllocation()), 0.0);
            assertEquals(0.0, result.getMetrics().getTotalRealThroughput(), 0.0);
        }

        @Test
        @DisplayName("iteration cap gives an exhausted but complete result")
        void exhausted() {
            EquilibriumResult result = solver.solve(twoRealTwoDecoy().maxIterations(1).epsilon(1e-7).build());
            assertEquals(EquilibriumResult.Status.EXHAUSTED, result.getStatus());
            assertFalse(result.isConverged());
            assertEquals(1, result.getIterations());
            assertEquals(1, result.getConvergenceHistory().size());
            assertNotNull(result.getMetrics());
        }
    }

    @Nested
    @DisplayName("strategies and modes")
    class StrategyTests {

        @Test
        @DisplayName("top-K covering every channel with equal scores matches uniform")
        void topKMatchesUniform() {
            EquilibriumResult uniform = solver.solve(allReal().build());
            EquilibriumResult topK = solver.solve(allReal().jammerStrategy(JammerStrategy.TOP_K).topK(4).build());
            assertArrayEquals(uniform.getDefender(0).getAllocation(), topK.getDefender(0).getAllocation(), 1e-12);
            assertArrayEquals(uniform.getAttacker(0).getAllocation(), topK.getAttacker(0).getAllocation(), 1e-12);
        }

        @Test
        void gradientStrategySpendsAttackerBudget() {
            EquilibriumResult result = solver.solve(twoRealTwoDecoy().jammerStrategy(JammerStrategy.GRADIENT).build());
            assertEquals(10.0, result.getAttacker(0).getTotalPower(), 1e-6);
        }

        @Test
        @DisplayName("independent gradient attackers ascend their own objective")
        void independentAttackers() {
            EquilibriumParams params = twoRealTwoDecoy()
                .players(1, 2)
                .budgets(new double[]{10}, new double[]{5, 5})
                .unitGains()
                .jammerStrategy(JammerStrategy.GRADIENT)
                .attackerMode(AttackerMode.INDEPENDENT)
                .build();
            EquilibriumResult result = solver.solve(params);
            for (PlayerAllocation m : result.getAttackers()) {
                assertEquals(5.0, m.getTotalPower(), 1e-6);
            }
        }

        @Test
        @DisplayName("seeded random start is reproducible")
        void seededRunsAreDeterministic() {
            EquilibriumParams params = twoRealTwoDecoy().randomInit(true).seed(7L).build();
            EquilibriumResult a = solver.solve(params);
            EquilibriumResult b = solver.solve(params);
            assertArrayEquals(a.getDefender(0).getAllocation(), b.getDefender(0).getAllocation(), 0.0);
            assertEquals(a.getIterations(), b.getIterations());
        }
    }

    @Nested
    @DisplayName("validation")
    class ValidationTests {

        @Test
        void invalidParametersAreRejectedBeforeIterating() {
            InvalidParametersException e = assertThrows(InvalidParametersException.class,
                () -> solver.solve(twoRealTwoDecoy().damping(0).build()));
            assertEquals("alpha", e.getField());
        }

        @Test
        void nullParamsRejected() {
            assertThrows(InvalidParametersException.class, () -> solver.solve(null));
        }
    }

    @Test
    @DisplayName("damping blends toward the target and reports the largest step")
    void dampInto() {
        double[] row = {1, 2};
        double change = EquilibriumSolver.dampInto(row, new double[]{3, 2}, 0.5);
        assertArrayEquals(new double[]{2, 2}, row, EPS);
        assertEquals(1.0, change, EPS);
    }
}
