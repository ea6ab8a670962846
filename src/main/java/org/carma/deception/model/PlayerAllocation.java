package org.carma.deception.model;

/**
 * Final allocation row and utility of one defender or attacker.
 */
public final class PlayerAllocation {

    private final int playerId;
    private final double[] allocation;
    private final double utility;

    public PlayerAllocation(int playerId, double[] allocation, double utility) {
        this.playerId = playerId;
        this.allocation = allocation.clone();
        this.utility = utility;
    }

    public int getPlayerId() { return playerId; }
    public double getUtility() { return utility; }

    public double[] getAllocation() {
        return allocation.clone();
    }

    public double getAllocation(int channel) {
        return allocation[channel];
    }

    public double getTotalPower() {
        double sum = 0;
        for (double v : allocation) sum += v;
        return sum;
    }

    @Override
    public String toString() {
        return String.format("Player[%d, power=%.4f, utility=%.4f]", playerId, getTotalPower(), utility);
    }
}
