package org.carma.deception.simulation;

import org.carma.deception.mechanism.EquilibriumEngine;
import org.carma.deception.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fills the comparison metrics that a single run cannot compute on its own.
 *
 * Runs the scenario as given, again with an oracle jammer, and again with every
 * decoy switched off (ND = 0), then reports on the first run:
 *
 *   oracleGap               = U_real(oracle) − U_real(as given)
 *   improvementOverNoDecoys = 100 · (U_real − U_real(no decoys)) / |U_real(no decoys)|
 *
 * where U_real is total real throughput. The improvement is 0 when the no-decoy
 * throughput is 0.
 */
public class OracleComparison {

    private static final Logger log = LoggerFactory.getLogger(OracleComparison.class);

    /**
     * The three runs behind a comparison.
     */
    public static final class Comparison {
        private final EquilibriumResult result;
        private final EquilibriumResult oracleResult;
        private final EquilibriumResult noDecoyResult;

        Comparison(EquilibriumResult result, EquilibriumResult oracleResult, EquilibriumResult noDecoyResult) {
            this.result = result;
            this.oracleResult = oracleResult;
            this.noDecoyResult = noDecoyResult;
        }

        /** The scenario as given, with comparison metrics filled in. */
        public EquilibriumResult getResult() { return result; }
        public EquilibriumResult getOracleResult() { return oracleResult; }
        public EquilibriumResult getNoDecoyResult() { return noDecoyResult; }
    }

    private final EquilibriumEngine engine;

    public OracleComparison(EquilibriumEngine engine) {
        this.engine = engine;
    }

    public Comparison compare(EquilibriumParams params) {
        EquilibriumResult result = engine.solve(params);
        EquilibriumResult oracle = engine.solve(
            params.toBuilder().jammerObjective(JammerObjective.ORACLE).build());
        EquilibriumResult noDecoys = engine.solve(SweepVariable.ND.apply(params, 0));

        double throughput = result.getMetrics().getTotalRealThroughput();
        double oracleThroughput = oracle.getMetrics().getTotalRealThroughput();
        double baseline = noDecoys.getMetrics().getTotalRealThroughput();

        double oracleGap = oracleThroughput - throughput;
        double improvement = baseline != 0 ? 100.0 * (throughput - baseline) / Math.abs(baseline) : 0.0;

        log.info("Comparison: U_real={}, oracle={}, noDecoys={}, improvement={}%",
            throughput, oracleThroughput, baseline, improvement);

        EquilibriumResult enriched = result.withMetrics(
            result.getMetrics().withComparison(oracleGap, improvement));
        return new Comparison(enriched, oracle, noDecoys);
    }
}
