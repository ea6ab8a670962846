package org.carma.deception.mechanism;

import org.carma.deception.model.*;

import java.util.*;

/**
 * J2: concentrate on the K eligible channels with the highest perceived value.
 *
 * A channel's score is its owner's power times this attacker's gain, x·g. The top K
 * (ties keep ascending channel order) share the budget in proportion to their scores,
 * or evenly if every selected score is zero.
 */
public class TopKJammerPolicy implements JammerPolicy {

    private final EquilibriumParams params;

    public TopKJammerPolicy(EquilibriumParams params) {
        this.params = params;
    }

    @Override
    public double[] allocate(int m, double[][] x, double[][] y, ActiveSet active) {
        double[] out = new double[params.getNumChannels()];
        if (active.isEmpty()) return out;

        List<ScoredChannel> scored = new ArrayList<>();
        for (int i : active.eligible(params)) {
            int owner = params.getChannel(i).getOwner();
            scored.add(new ScoredChannel(i, x[owner][i] * params.getAttackerGain(m, i)));
        }
        if (scored.isEmpty()) return out;

        // List.sort is stable, so equal scores stay in channel order
        scored.sort((a, b) -> Double.compare(b.score, a.score));
        List<ScoredChannel> targets = scored.subList(0, Math.min(params.getTopK(), scored.size()));

        double budget = params.getAttackerBudget(m);
        double totalScore = 0;
        for (ScoredChannel t : targets) totalScore += t.score;

        for (ScoredChannel t : targets) {
            out[t.channel] = totalScore > 0
                ? t.score / totalScore * budget
                : budget / targets.size();
        }
        return out;
    }

    @Override
    public JammerStrategy getStrategy() {
        return JammerStrategy.TOP_K;
    }

    private static final class ScoredChannel {
        final int channel;
        final double score;

        ScoredChannel(int channel, double score) {
            this.channel = channel;
            this.score = score;
        }
    }
}
