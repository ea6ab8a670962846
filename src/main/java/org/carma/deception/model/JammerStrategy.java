package org.carma.deception.model;

/**
 * Policy an attacker uses to spread its power over the channels it can see.
 */
public enum JammerStrategy {
    /** J1: equal power on every eligible active channel. */
    UNIFORM("uniform", "J1_uniform"),
    /** J2: concentrate on the top-K channels by perceived value x·g. */
    TOP_K("topK", "J2_topK"),
    /** J3: allocate along the attacker's own utility gradient. */
    GRADIENT("gradient", "J3_optimization");

    private final String key;
    private final String legacyKey;

    JammerStrategy(String key, String legacyKey) {
        this.key = key;
        this.legacyKey = legacyKey;
    }

    public String getKey() {
        return key;
    }

    public static JammerStrategy fromKey(String key) {
        if (key == null) return null;
        String k = key.trim();
        for (JammerStrategy s : values()) {
            if (s.key.equalsIgnoreCase(k) || s.legacyKey.equalsIgnoreCase(k) || s.name().equalsIgnoreCase(k)) {
                return s;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return key;
    }
}
