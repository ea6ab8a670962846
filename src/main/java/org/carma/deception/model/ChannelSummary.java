package org.carma.deception.model;

/**
 * Per-channel outcome at the end of a run.
 */
public final class ChannelSummary {

    private final int channel;
    private final int owner;
    private final ChannelType type;
    private final double totalDefenderPower;
    private final double totalAttackerPower;
    private final double sinr;
    private final double rate;
    private final double defenderGain;
    private final double meanAttackerGain;
    private final boolean active;

    public ChannelSummary(int channel, int owner, ChannelType type,
                          double totalDefenderPower, double totalAttackerPower,
                          double sinr, double rate,
                          double defenderGain, double meanAttackerGain, boolean active) {
        this.channel = channel;
        this.owner = owner;
        this.type = type;
        this.totalDefenderPower = totalDefenderPower;
        this.totalAttackerPower = totalAttackerPower;
        this.sinr = sinr;
        this.rate = rate;
        this.defenderGain = defenderGain;
        this.meanAttackerGain = meanAttackerGain;
        this.active = active;
    }

    public int getChannel() { return channel; }
    public int getOwner() { return owner; }
    public ChannelType getType() { return type; }
    /** Owner's power on this channel. */
    public double getTotalDefenderPower() { return totalDefenderPower; }
    /** Jammer power summed over all attackers. */
    public double getTotalAttackerPower() { return totalAttackerPower; }
    public double getSinr() { return sinr; }
    /** log2(1 + SINR); zero when the owner puts no power here. */
    public double getRate() { return rate; }
    /** Owner's gain h on this channel. */
    public double getDefenderGain() { return defenderGain; }
    /** Attacker gain g averaged over attackers. */
    public double getMeanAttackerGain() { return meanAttackerGain; }
    public boolean isActive() { return active; }

    @Override
    public String toString() {
        return String.format("Channel[%d %s D%d, x=%.4f, y=%.4f, sinr=%.4f, active=%s]",
            channel, type, owner, totalDefenderPower, totalAttackerPower, sinr, active);
    }
}
