package io.vindex.ledger.swap;

import io.vindex.ledger.protocol.Amounts;
import io.vindex.ledger.protocol.SwapOrder;
import io.vindex.ledger.state.Ledger;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Registry of swap pairs and the constant-product trade rule. Independent of staking.
 * Not thread-safe; the owning chain serializes access.
 */
public final class SwapBook {

    private final Map<String, SwapPair> pairs = new LinkedHashMap<>();

    /** Order-independent key: the two symbols sorted and joined with '-'. */
    public static String pairKey(String tokenA, String tokenB) {
        return tokenA.compareTo(tokenB) <= 0 ? tokenA + "-" + tokenB : tokenB + "-" + tokenA;
    }

    /** Returns false if the pair exists already, names one token twice, or has a non-positive reserve. */
    public boolean createPair(String tokenA, String tokenB, long reserveA, long reserveB) {
        if (tokenA == null || tokenA.isBlank() || tokenB == null || tokenB.isBlank() || tokenA.equals(tokenB)) {
            return false;
        }
        if (reserveA <= 0 || reserveB <= 0) {
            return false;
        }
        String key = pairKey(tokenA, tokenB);
        if (pairs.containsKey(key)) {
            return false;
        }
        long liquidity = BigInteger.valueOf(reserveA).multiply(BigInteger.valueOf(reserveB)).sqrt().longValueExact();
        pairs.put(key, new SwapPair(tokenA, tokenB, reserveA, reserveB, SwapPair.DEFAULT_FEE_BPS, liquidity));
        return true;
    }

    public Optional<SwapPair> getPair(String tokenA, String tokenB) {
        SwapPair pair = pairs.get(pairKey(tokenA, tokenB));
        return pair == null ? Optional.empty() : Optional.of(pair.copy());
    }

    public boolean hasPair(String tokenA, String tokenB) {
        return pairs.containsKey(pairKey(tokenA, tokenB));
    }

    public List<SwapPair> pairs() {
        List<SwapPair> out = new ArrayList<>(pairs.size());
        for (SwapPair p : pairs.values()) out.add(p.copy());
        return out;
    }

    /**
     * Output for {@code amountIn} of {@code tokenIn}: the input is reduced by the pair fee, then
     * {@code out = reserveOut * in / (reserveIn + in)}, floored.
     */
    public static long quote(SwapPair pair, String tokenIn, long amountIn) {
        String tokenOut = pair.tokenA().equals(tokenIn) ? pair.tokenB() : pair.tokenA();
        BigInteger reserveIn = BigInteger.valueOf(pair.reserveOf(tokenIn));
        BigInteger reserveOut = BigInteger.valueOf(pair.reserveOf(tokenOut));
        BigInteger inWithFee = BigInteger.valueOf(amountIn)
                .multiply(BigInteger.valueOf(Amounts.BPS_DENOMINATOR - pair.feeBps()))
                .divide(BigInteger.valueOf(Amounts.BPS_DENOMINATOR));
        BigInteger denominator = reserveIn.add(inWithFee);
        if (denominator.signum() == 0) {
            return 0L;
        }
        return reserveOut.multiply(inWithFee).divide(denominator).longValueExact();
    }

    /**
     * Executes a trade for {@code trader}: debits the input (spendable balance for VDX, token holdings
     * otherwise) plus the VDX fee, credits the output the same way and moves the reserves.
     * All checks happen before any mutation.
     *
     * @return the amount received, or empty if the trade is not possible (nothing changed)
     */
    public OptionalLong execute(Ledger ledger, String trader, SwapOrder order, long amountIn, long feeMinor) {
        SwapPair pair = pairs.get(pairKey(order.tokenIn(), order.tokenOut()));
        if (pair == null || !pair.contains(order.tokenIn()) || !pair.contains(order.tokenOut())) {
            return OptionalLong.empty();
        }
        if (amountIn <= 0 || feeMinor < 0 || !ledger.exists(trader)) {
            return OptionalLong.empty();
        }
        long amountOut = quote(pair, order.tokenIn(), amountIn);
        if (amountOut <= 0 || amountOut < order.minAmountOut() || amountOut >= pair.reserveOf(order.tokenOut())) {
            return OptionalLong.empty();
        }

        boolean nativeIn = Amounts.NATIVE_SYMBOL.equals(order.tokenIn());
        if (nativeIn) {
            if (ledger.getBalance(trader) < Math.addExact(amountIn, feeMinor)) {
                return OptionalLong.empty();
            }
            ledger.adjustBalance(trader, -Math.addExact(amountIn, feeMinor));
        } else {
            if (ledger.getTokenBalance(trader, order.tokenIn()) < amountIn || ledger.getBalance(trader) < feeMinor) {
                return OptionalLong.empty();
            }
            ledger.adjustTokenBalance(trader, order.tokenIn(), -amountIn);
            ledger.adjustBalance(trader, -feeMinor);
        }

        if (Amounts.NATIVE_SYMBOL.equals(order.tokenOut())) {
            ledger.adjustBalance(trader, amountOut);
        } else {
            ledger.adjustTokenBalance(trader, order.tokenOut(), amountOut);
        }
        pair.move(order.tokenIn(), amountIn, amountOut);
        return OptionalLong.of(amountOut);
    }
}
