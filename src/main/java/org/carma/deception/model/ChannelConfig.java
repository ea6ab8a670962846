package org.carma.deception.model;

import java.util.Objects;

/**
 * Static description of one channel: its type and the defender that owns it.
 */
public final class ChannelConfig {

    private final ChannelType type;
    private final int owner;

    public ChannelConfig(ChannelType type, int owner) {
        this.type = type;
        this.owner = owner;
    }

    public static ChannelConfig real(int owner) {
        return new ChannelConfig(ChannelType.REAL, owner);
    }

    public static ChannelConfig decoy(int owner) {
        return new ChannelConfig(ChannelType.DECOY, owner);
    }

    public static ChannelConfig inactive(int owner) {
        return new ChannelConfig(ChannelType.INACTIVE, owner);
    }

    public ChannelType getType() { return type; }
    public int getOwner() { return owner; }

    public boolean isReal() { return type == ChannelType.REAL; }
    public boolean isDecoy() { return type == ChannelType.DECOY; }
    public boolean isInactive() { return type == ChannelType.INACTIVE; }

    public ChannelConfig withType(ChannelType newType) {
        return new ChannelConfig(newType, owner);
    }

    public ChannelConfig withOwner(int newOwner) {
        return new ChannelConfig(type, newOwner);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChannelConfig)) return false;
        ChannelConfig that = (ChannelConfig) o;
        return owner == that.owner && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, owner);
    }

    @Override
    public String toString() {
        return type + "@D" + owner;
    }
}
