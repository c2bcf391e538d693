package io.vindex.ledger.consensus;

/**
 * seed = index * 1103515245 + 12345, normalised as (seed mod 2^31-1) / (2^31-1).
 */
public final class LinearCongruentialSeed implements SeedFunction {
    private static final long MULTIPLIER = 1_103_515_245L;
    private static final long INCREMENT = 12_345L;
    private static final long MODULUS = 2_147_483_647L;

    @Override
    public double unitInterval(long blockIndex) {
        long seed = blockIndex * MULTIPLIER + INCREMENT;
        return Math.floorMod(seed, MODULUS) / (double) MODULUS;
    }
}
