package org.carma.deception.mechanism;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Small reproducible generator shared by random initialization and gain generation.
 *
 * state = (state · 1103515245 + 12345) &amp; 0x7fffffff, returning state / 0x7fffffff.
 * The product is formed in double precision and reduced modulo 2^32 before the low 31
 * bits are kept, so long runs of draws match the scenario tooling that produced
 * existing seeds, including seeds wider than 31 bits.
 *
 * Not thread-safe; each run creates its own instance.
 */
public class LinearCongruentialRandom {

    private static final double MULTIPLIER = 1103515245.0;
    private static final long INCREMENT = 12345L;
    private static final long MASK = 0x7fffffffL;
    private static final BigInteger MODULUS = BigInteger.ONE.shiftLeft(32);
    /** Products below this magnitude convert to long exactly. */
    private static final double EXACT_LONG_LIMIT = 0x1p62;

    private long state;

    public LinearCongruentialRandom(long seed) {
        this.state = seed;
    }

    /**
     * Generator seeded from the clock, for runs that did not ask for a seed.
     */
    public static LinearCongruentialRandom unseeded() {
        return new LinearCongruentialRandom(System.nanoTime() & MASK);
    }

    /** Next value in [0, 1]. */
    public double nextDouble() {
        double product = state * MULTIPLIER + INCREMENT;
        state = lowBits(product) & MASK;
        return (double) state / MASK;
    }

    /**
     * Integer part of the product with its low 32 bits exact. A plain long cast saturates once the
     * product passes Long.MAX_VALUE, which only happens for seeds wider than 31 bits.
     */
    static long lowBits(double product) {
        if (Math.abs(product) < EXACT_LONG_LIMIT) {
            return (long) product;
        }
        return new BigDecimal(product).toBigInteger().mod(MODULUS).longValue();
    }
}
