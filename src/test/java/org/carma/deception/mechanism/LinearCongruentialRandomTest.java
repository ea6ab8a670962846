package org.carma.deception.mechanism;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LinearCongruentialRandomTest {

    @Test
    void firstDrawFromSeedOne() {
        // (1 · 1103515245 + 12345) & 0x7fffffff = 1103527590
        assertEquals(1103527590.0 / 0x7fffffff, new LinearCongruentialRandom(1).nextDouble(), 1e-15);
    }

    @Test
    void sameSeedSameSequence() {
        LinearCongruentialRandom a = new LinearCongruentialRandom(12345);
        LinearCongruentialRandom b = new LinearCongruentialRandom(12345);
        for (int k = 0; k < 1000; k++) {
            assertEquals(a.nextDouble(), b.nextDouble(), 0.0);
        }
    }

    @Test
    void drawsStayInUnitInterval() {
        LinearCongruentialRandom random = new LinearCongruentialRandom(7);
        for (int k = 0; k < 10_000; k++) {
            double v = random.nextDouble();
            assertTrue(v >= 0 && v <= 1, "draw " + k + " out of range: " + v);
        }
    }

    @Test
    void seedsWiderThan31BitsWrapInsteadOfSaturating() {
        LinearCongruentialRandom random = new LinearCongruentialRandom(10_000_000_000L);
        // product reduced modulo 2^32: state 1082671104
        assertEquals(1082671104.0 / 0x7fffffff, random.nextDouble(), 1e-15);
        assertEquals(0.9805736546314199, random.nextDouble(), 1e-15);
    }

    @Test
    void lowBitsMatchForBothConversionPaths() {
        double large = 10_000_000_000.0 * 1103515245.0 + 12345;
        assertEquals(1082671104L, LinearCongruentialRandom.lowBits(large) & 0x7fffffffL);
        assertEquals(1103527590L, LinearCongruentialRandom.lowBits(1103527590.0));
    }
}
