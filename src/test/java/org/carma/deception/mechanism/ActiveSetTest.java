package org.carma.deception.mechanism;

import org.carma.deception.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ActiveSetTest {

    private static EquilibriumParams params(JammerObjective objective) {
        return new EquilibriumParams.Builder()
            .players(1, 1)
            .channels(List.of(ChannelConfig.real(0), ChannelConfig.decoy(0),
                ChannelConfig.inactive(0), ChannelConfig.real(0)))
            .budgets(new double[]{10}, new double[]{10})
            .unitGains()
            .sensingThreshold(0.2)
            .jammerObjective(objective)
            .build();
    }

    @Test
    @DisplayName("active iff non-inactive and owner power at or above τ")
    void activationRule() {
        ActiveSet active = ActiveSet.of(new double[][]{{0.5, 0.2, 5.0, 0.1}}, params(JammerObjective.DECEPTION));

        assertTrue(active.contains(0));
        assertTrue(active.contains(1), "power exactly at τ is visible");
        assertFalse(active.contains(2), "inactive channels are never visible");
        assertFalse(active.contains(3), "below τ stays hidden");
        assertEquals(List.of(0, 1), active.indices());
        assertEquals(2, active.size());
    }

    @Test
    void outOfRangeIndicesAreNotMembers() {
        ActiveSet active = ActiveSet.of(new double[][]{{1, 1, 1, 1}}, params(JammerObjective.DECEPTION));
        assertFalse(active.contains(-1));
        assertFalse(active.contains(4));
    }

    @Test
    @DisplayName("eligible keeps every active channel under deception")
    void eligibleUnderDeception() {
        EquilibriumParams p = params(JammerObjective.DECEPTION);
        ActiveSet active = ActiveSet.of(new double[][]{{1, 1, 0, 1}}, p);
        assertEquals(List.of(0, 1, 3), active.eligible(p));
    }

    @Test
    @DisplayName("eligible keeps only real channels under oracle")
    void eligibleUnderOracle() {
        EquilibriumParams p = params(JammerObjective.ORACLE);
        ActiveSet active = ActiveSet.of(new double[][]{{1, 1, 0, 1}}, p);
        assertEquals(List.of(0, 3), active.eligible(p));
    }

    @Test
    void emptyWhenNothingFunded() {
        ActiveSet active = ActiveSet.of(new double[][]{{0, 0, 0, 0}}, params(JammerObjective.DECEPTION));
        assertTrue(active.isEmpty());
    }
}
