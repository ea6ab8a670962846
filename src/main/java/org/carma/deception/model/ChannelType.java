package org.carma.deception.model;

/**
 * Role a channel plays for its owning defender.
 * Fixed for the duration of a run.
 */
public enum ChannelType {
    REAL("real", "Carries genuine traffic and counts toward throughput"),
    DECOY("decoy", "Mimics a real channel to absorb jammer power"),
    INACTIVE("inactive", "Unused; never funded and never visible to jammers");

    private final String key;
    private final String description;

    ChannelType(String key, String description) {
        this.key = key;
        this.description = description;
    }

    public String getKey() {
        return key;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Resolve a configuration key (case-insensitive).
     *
     * @return the matching type, or null if the key is unknown
     */
    public static ChannelType fromKey(String key) {
        if (key == null) return null;
        for (ChannelType type : values()) {
            if (type.key.equalsIgnoreCase(key.trim()) || type.name().equalsIgnoreCase(key.trim())) {
                return type;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return key;
    }
}
