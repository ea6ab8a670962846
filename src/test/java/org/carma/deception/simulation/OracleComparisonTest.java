package org.carma.deception.simulation;

import org.carma.deception.mechanism.EquilibriumEngine;
import org.carma.deception.mechanism.EquilibriumSolver;
import org.carma.deception.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OracleComparisonTest {

    private static EquilibriumParams twoRealTwoDecoy() {
        return new EquilibriumParams.Builder()
            .players(1, 1)
            .channels(List.of(ChannelConfig.real(0), ChannelConfig.real(0),
                ChannelConfig.decoy(0), ChannelConfig.decoy(0)))
            .budgets(new double[]{10}, new double[]{10})
            .unitGains()
            .build();
    }

    @Test
    @DisplayName("runs as-given, oracle and no-decoy variants and fills the comparison metrics")
    void comparison() {
        List<EquilibriumParams> seen = new ArrayList<>();
        EquilibriumSolver solver = new EquilibriumSolver();
        EquilibriumEngine recording = params -> {
            seen.add(params);
            return solver.solve(params);
        };

        OracleComparison.Comparison c = new OracleComparison(recording).compare(twoRealTwoDecoy());

        assertEquals(3, seen.size());
        assertEquals(JammerObjective.DECEPTION, seen.get(0).getJammerObjective());
        assertEquals(JammerObjective.ORACLE, seen.get(1).getJammerObjective());
        assertTrue(seen.get(2).getChannel(2).isInactive());
        assertTrue(seen.get(2).getChannel(3).isInactive());

        double u = c.getResult().getMetrics().getTotalRealThroughput();
        double oracle = c.getOracleResult().getMetrics().getTotalRealThroughput();
        double noDecoys = c.getNoDecoyResult().getMetrics().getTotalRealThroughput();

        assertEquals(oracle - u, c.getResult().getMetrics().getOracleGap(), 1e-12);
        assertEquals(100 * (u - noDecoys) / Math.abs(noDecoys),
            c.getResult().getMetrics().getImprovementOverNoDecoys(), 1e-9);
        assertTrue(c.getResult().getMetrics().getOracleGap() < 0, "deception beats an oracle jammer here");
        assertTrue(c.getResult().getMetrics().getImprovementOverNoDecoys() > 0, "decoys pay off here");
    }

    @Test
    @DisplayName("improvement is zero when the no-decoy run has no throughput")
    void zeroBaseline() {
        EquilibriumParams params = twoRealTwoDecoy().toBuilder()
            .budgets(new double[]{0}, new double[]{10})
            .build();
        OracleComparison.Comparison c = new OracleComparison(new EquilibriumSolver()).compare(params);
        assertEquals(0.0, c.getResult().getMetrics().getImprovementOverNoDecoys(), 0.0);
    }
}
