package io.vindex.ledger.protocol;

import java.nio.ByteBuffer;

/**
 * Swap parameters. The input amount is the transaction amount;
 * minAmountOut is the slippage floor.
 */
public record SwapOrder(String tokenIn, String tokenOut, long minAmountOut) implements TxPayload {

    public SwapOrder {
        if (tokenIn == null || tokenIn.isBlank()) throw new IllegalArgumentException("Missing tokenIn");
        if (tokenOut == null || tokenOut.isBlank()) throw new IllegalArgumentException("Missing tokenOut");
        if (tokenIn.equals(tokenOut)) throw new IllegalArgumentException("tokenIn == tokenOut");
        if (minAmountOut < 0) throw new IllegalArgumentException("minAmountOut must be >= 0");
    }

    @Override
    public byte tag() { return TAG_SWAP; }

    @Override
    public byte[] encode() {
        ByteBuffer buf = ByteBuffer.allocate(1 + TxPayload.stringSize(tokenIn) + TxPayload.stringSize(tokenOut) + 8);
        buf.put(TAG_SWAP);
        TxPayload.putString(buf, tokenIn);
        TxPayload.putString(buf, tokenOut);
        buf.putLong(minAmountOut);
        return buf.array();
    }
}
