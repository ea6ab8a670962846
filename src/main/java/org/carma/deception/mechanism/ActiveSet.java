package org.carma.deception.mechanism;

import org.carma.deception.model.*;

import java.util.*;

/**
 * Channels currently visible to jammers.
 *
 * A channel is active iff it is not {@link ChannelType#INACTIVE} and its owner puts at
 * least τ on it. Recomputed from scratch after every defender move; nothing carries
 * over between iterations.
 */
public final class ActiveSet {

    private final boolean[] member;
    private final List<Integer> indices;

    private ActiveSet(boolean[] member) {
        this.member = member;
        List<Integer> list = new ArrayList<>();
        for (int i = 0; i < member.length; i++) {
            if (member[i]) list.add(i);
        }
        this.indices = Collections.unmodifiableList(list);
    }

    /**
     * Apply the activation rule to the current defender allocation.
     */
    public static ActiveSet of(double[][] x, EquilibriumParams params) {
        int n = params.getNumChannels();
        double tau = params.getSensingThreshold();
        boolean[] member = new boolean[n];
        for (int i = 0; i < n; i++) {
            ChannelConfig channel = params.getChannel(i);
            if (channel.isInactive()) continue;
            double ownerPower = x[channel.getOwner()][i];
            member[i] = ownerPower >= tau;
        }
        return new ActiveSet(member);
    }

    public boolean contains(int channel) {
        return channel >= 0 && channel < member.length && member[channel];
    }

    /** Active channel indices in ascending order. */
    public List<Integer> indices() {
        return indices;
    }

    public int size() {
        return indices.size();
    }

    public boolean isEmpty() {
        return indices.isEmpty();
    }

    /**
     * Active channels a jammer with the given objective will target:
     * all of them under deception, only the real ones under oracle.
     */
    public List<Integer> eligible(EquilibriumParams params) {
        if (!params.isObjectiveOracle()) {
            return indices;
        }
        List<Integer> real = new ArrayList<>();
        for (int i : indices) {
            if (params.getChannel(i).isReal()) real.add(i);
        }
        return real;
    }

    @Override
    public String toString() {
        return "ActiveSet" + indices;
    }
}
