package org.carma.deception.model;

/**
 * How attackers form their allocation each iteration.
 *
 * Only changes behavior under {@link JammerStrategy#GRADIENT}: an independent attacker
 * then takes its own ascent step instead of asking the strategy for a fresh allocation.
 * Under every other strategy both modes behave identically.
 */
public enum AttackerMode {
    COORDINATED("coordinated"),
    INDEPENDENT("independent");

    private final String key;

    AttackerMode(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static AttackerMode fromKey(String key) {
        if (key == null) return null;
        for (AttackerMode m : values()) {
            if (m.key.equalsIgnoreCase(key.trim())) return m;
        }
        return null;
    }

    @Override
    public String toString() {
        return key;
    }
}
