package io.vindex.ledger.swap;

import io.vindex.ledger.protocol.Amounts;

/**
 * Two-asset constant-product pool. Owned by {@link SwapBook}; accessors hand out copies.
 */
public final class SwapPair {
    public static final int DEFAULT_FEE_BPS = 30;

    private final String tokenA;
    private final String tokenB;
    private long reserveA;
    private long reserveB;
    private final int feeBps;
    private final long totalLiquidity;

    SwapPair(String tokenA, String tokenB, long reserveA, long reserveB, int feeBps, long totalLiquidity) {
        this.tokenA = tokenA;
        this.tokenB = tokenB;
        this.reserveA = reserveA;
        this.reserveB = reserveB;
        this.feeBps = feeBps;
        this.totalLiquidity = totalLiquidity;
    }

    public String tokenA() { return tokenA; }
    public String tokenB() { return tokenB; }
    public long reserveA() { return reserveA; }
    public long reserveB() { return reserveB; }
    public int feeBps() { return feeBps; }
    public double feeRate() { return feeBps / (double) Amounts.BPS_DENOMINATOR; }
    public long totalLiquidity() { return totalLiquidity; }
    public String key() { return SwapBook.pairKey(tokenA, tokenB); }

    public boolean contains(String token) {
        return tokenA.equals(token) || tokenB.equals(token);
    }

    public long reserveOf(String token) {
        if (tokenA.equals(token)) return reserveA;
        if (tokenB.equals(token)) return reserveB;
        throw new IllegalArgumentException(token + " is not part of pair " + key());
    }

    void move(String tokenIn, long amountIn, long amountOut) {
        if (tokenA.equals(tokenIn)) {
            reserveA = Math.addExact(reserveA, amountIn);
            reserveB = Math.subtractExact(reserveB, amountOut);
        } else {
            reserveB = Math.addExact(reserveB, amountIn);
            reserveA = Math.subtractExact(reserveA, amountOut);
        }
    }

    SwapPair copy() {
        return new SwapPair(tokenA, tokenB, reserveA, reserveB, feeBps, totalLiquidity);
    }

    @Override public String toString() {
        return "SwapPair{" + tokenA + "=" + reserveA + ", " + tokenB + "=" + reserveB + "}";
    }
}
