package org.carma.deception.model;

/**
 * What an attacker can observe about channel types.
 *
 * A deception-objective attacker values every active channel and therefore wastes
 * power on decoys; an oracle attacker sees through decoys and serves as the
 * upper-bound baseline.
 */
public enum JammerObjective {
    DECEPTION("deception"),
    ORACLE("oracle");

    private final String key;

    JammerObjective(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static JammerObjective fromKey(String key) {
        if (key == null) return null;
        for (JammerObjective o : values()) {
            if (o.key.equalsIgnoreCase(key.trim())) return o;
        }
        return null;
    }

    @Override
    public String toString() {
        return key;
    }
}
