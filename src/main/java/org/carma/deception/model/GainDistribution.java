package org.carma.deception.model;

/**
 * Distribution used when channel gains are generated rather than given explicitly.
 */
public enum GainDistribution {
    /** Uniform draws in [0.5, 2.0]. */
    UNIFORM("uniform"),
    /** Rayleigh fading, sqrt(-2 ln(1 - u)). */
    RAYLEIGH("rayleigh"),
    /** Gains are supplied by the caller. */
    CUSTOM("custom");

    private final String key;

    GainDistribution(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static GainDistribution fromKey(String key) {
        if (key == null) return null;
        for (GainDistribution d : values()) {
            if (d.key.equalsIgnoreCase(key.trim())) return d;
        }
        return null;
    }

    @Override
    public String toString() {
        return key;
    }
}
