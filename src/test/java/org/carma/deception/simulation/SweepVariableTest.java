package org.carma.deception.simulation;

import org.carma.deception.config.DefaultScenarios;
import org.carma.deception.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SweepVariableTest {

    /** 12 channels, 2 defenders: 6 real, 4 decoy, 2 inactive. */
    private final EquilibriumParams base = DefaultScenarios.defaultParams();

    private static Map<ChannelType, Integer> counts(EquilibriumParams p) {
        return DefaultScenarios.countChannelTypes(p.getChannels());
    }

    @Nested
    @DisplayName("ND")
    class DecoyCountTests {

        @Test
        void zeroDecoysSwitchesAllNonRealChannelsOff() {
            Map<ChannelType, Integer> c = counts(SweepVariable.ND.apply(base, 0));
            assertEquals(6, c.get(ChannelType.REAL));
            assertEquals(0, c.get(ChannelType.DECOY));
            assertEquals(6, c.get(ChannelType.INACTIVE));
        }

        @Test
        void firstNonRealChannelsBecomeDecoys() {
            EquilibriumParams p = SweepVariable.ND.apply(base, 3);
            assertEquals(3, counts(p).get(ChannelType.DECOY));
            assertTrue(p.getChannel(6).isDecoy());
            assertTrue(p.getChannel(8).isDecoy());
            assertTrue(p.getChannel(9).isInactive());
        }

        @Test
        @DisplayName("a fractional decoy count rounds up")
        void fractionalCountRoundsUp() {
            assertEquals(2, counts(SweepVariable.ND.apply(base, 1.4)).get(ChannelType.DECOY));
            assertEquals(1, counts(SweepVariable.ND.apply(base, 0.2)).get(ChannelType.DECOY));
        }

        @Test
        @DisplayName("decoy count is capped by the non-real channels available")
        void capped() {
            assertEquals(6, counts(SweepVariable.ND.apply(base, 50)).get(ChannelType.DECOY));
        }
    }

    @Test
    void tauLeavesBaseUntouched() {
        EquilibriumParams p = SweepVariable.TAU.apply(base, 0.7);
        assertEquals(0.7, p.getSensingThreshold(), 0.0);
        assertEquals(0.2, base.getSensingThreshold(), 0.0);
    }

    @Nested
    @DisplayName("N")
    class ChannelCountTests {

        @Test
        void growPadsWithInactiveChannelsAndUnitGains() {
            EquilibriumParams p = SweepVariable.N.apply(base, 14);
            assertEquals(14, p.getNumChannels());
            assertEquals(ChannelConfig.inactive(0), p.getChannel(12));
            assertEquals(ChannelConfig.inactive(1), p.getChannel(13));
            assertEquals(1.0, p.getDefenderGain(1, 13), 0.0);
            assertEquals(1.0, p.getAttackerGain(0, 13), 0.0);
        }

        @Test
        void shrinkTruncates() {
            EquilibriumParams p = SweepVariable.N.apply(base, 6);
            assertEquals(6, p.getNumChannels());
            assertEquals(6, p.getDefenderGains()[0].length);
            assertEquals(6, counts(p).get(ChannelType.REAL));
        }

        @Test
        void neverBelowFour() {
            assertEquals(4, SweepVariable.N.apply(base, 1).getNumChannels());
        }
    }

    @Test
    @DisplayName("M adds attackers with budget 10 and unit gains")
    void attackers() {
        EquilibriumParams p = SweepVariable.M.apply(base, 3);
        assertEquals(3, p.getNumAttackers());
        assertEquals(10.0, p.getAttackerBudget(2), 0.0);
        assertEquals(1.0, p.getAttackerGain(2, 0), 0.0);
    }

    @Test
    @DisplayName("D remaps channels of removed defenders")
    void defenders() {
        EquilibriumParams p = SweepVariable.D.apply(base, 1);
        assertEquals(1, p.getNumDefenders());
        for (ChannelConfig c : p.getChannels()) {
            assertEquals(0, c.getOwner());
        }
        assertEquals(1, p.getDefenderBudgets().length);

        EquilibriumParams grown = SweepVariable.D.apply(base, 3);
        assertEquals(10.0, grown.getDefenderBudget(2), 0.0);
        assertEquals(3, grown.getDefenderGains().length);
    }

    @Test
    void jammerPowerSplitsEvenly() {
        EquilibriumParams p = SweepVariable.PJ.apply(base, 30);
        assertArrayEquals(new double[]{15, 15}, p.getAttackerBudgets(), 0.0);
    }

    @Test
    void fromKey() {
        assertEquals(SweepVariable.TAU, SweepVariable.fromKey("tau"));
        assertEquals(SweepVariable.ND, SweepVariable.fromKey("nd"));
        assertEquals(SweepVariable.PJ, SweepVariable.fromKey(" PJ "));
        assertNull(SweepVariable.fromKey("sigma2"));
        assertNull(SweepVariable.fromKey(null));
    }
}
