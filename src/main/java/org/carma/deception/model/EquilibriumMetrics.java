package org.carma.deception.model;

/**
 * Aggregate diagnostics of a terminal allocation.
 *
 * {@code oracleGap} and {@code improvementOverNoDecoys} need extra comparison runs and
 * stay zero unless a caller fills them in with {@link #withComparison(double, double)}.
 */
public final class EquilibriumMetrics {

    private final double jammerWasteOnDecoys;
    private final double dilutionFactor;
    private final double oracleGap;
    private final double improvementOverNoDecoys;
    private final double totalRealThroughput;
    private final double totalDecoyPower;
    private final int activeChannelCount;
    private final int realChannelCount;
    private final boolean symmetricEquilibrium;

    public EquilibriumMetrics(double jammerWasteOnDecoys, double dilutionFactor,
                              double oracleGap, double improvementOverNoDecoys,
                              double totalRealThroughput, double totalDecoyPower,
                              int activeChannelCount, int realChannelCount,
                              boolean symmetricEquilibrium) {
        this.jammerWasteOnDecoys = jammerWasteOnDecoys;
        this.dilutionFactor = dilutionFactor;
        this.oracleGap = oracleGap;
        this.improvementOverNoDecoys = improvementOverNoDecoys;
        this.totalRealThroughput = totalRealThroughput;
        this.totalDecoyPower = totalDecoyPower;
        this.activeChannelCount = activeChannelCount;
        this.realChannelCount = realChannelCount;
        this.symmetricEquilibrium = symmetricEquilibrium;
    }

    /** Fraction of all attacker power that lands on decoy channels. */
    public double getJammerWasteOnDecoys() { return jammerWasteOnDecoys; }
    /** |active| / |real|. */
    public double getDilutionFactor() { return dilutionFactor; }
    public double getOracleGap() { return oracleGap; }
    /** Percent change of throughput versus the same scenario without decoys. */
    public double getImprovementOverNoDecoys() { return improvementOverNoDecoys; }
    /** Sum of log2(1 + SINR) over funded real channels. */
    public double getTotalRealThroughput() { return totalRealThroughput; }
    public double getTotalDecoyPower() { return totalDecoyPower; }
    public int getActiveChannelCount() { return activeChannelCount; }
    public int getRealChannelCount() { return realChannelCount; }
    public boolean isSymmetricEquilibrium() { return symmetricEquilibrium; }

    public EquilibriumMetrics withComparison(double oracleGap, double improvementOverNoDecoys) {
        return new EquilibriumMetrics(jammerWasteOnDecoys, dilutionFactor,
            oracleGap, improvementOverNoDecoys, totalRealThroughput, totalDecoyPower,
            activeChannelCount, realChannelCount, symmetricEquilibrium);
    }

    @Override
    public String toString() {
        return String.format("EquilibriumMetrics[U_real=%.4f, waste=%.3f, dilution=%.2f, active=%d/%d real]",
            totalRealThroughput, jammerWasteOnDecoys, dilutionFactor, activeChannelCount, realChannelCount);
    }
}
