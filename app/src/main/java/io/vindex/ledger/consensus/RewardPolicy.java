package io.vindex.ledger.consensus;

import io.vindex.ledger.protocol.Amounts;

/**
 * Block issuance: a base reward halving every {@value #HALVING_INTERVAL} blocks, plus 0.1 VDX per
 * included transaction capped at 5 VDX, plus the block's fees. Empty blocks earn nothing.
 */
public final class RewardPolicy {

    public static final long BASE_REWARD = Amounts.coins(10);
    public static final long HALVING_INTERVAL = 210_000L;
    public static final long PER_TX_BONUS = Amounts.COIN / 10;
    public static final long MAX_TX_BONUS = Amounts.coins(5);

    public long rewardFor(long blockIndex, int transactionCount, long totalFees) {
        if (transactionCount <= 0) {
            return 0L;
        }
        return Math.addExact(issuanceFor(blockIndex, transactionCount), Math.max(0L, totalFees));
    }

    /** The newly minted part of the reward (everything except fees). */
    public long issuanceFor(long blockIndex, int transactionCount) {
        if (transactionCount <= 0) {
            return 0L;
        }
        long halvings = Math.max(0L, blockIndex) / HALVING_INTERVAL;
        long base = halvings >= 63 ? 0L : BASE_REWARD >> halvings;
        long bonus = Math.min(Math.multiplyExact((long) transactionCount, PER_TX_BONUS), MAX_TX_BONUS);
        return base + bonus;
    }
}
