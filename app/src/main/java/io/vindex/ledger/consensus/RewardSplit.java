package io.vindex.ledger.consensus;

import java.util.Map;

/**
 * Outcome of one reward distribution. {@code commission + sum(delegatorShares) == blockReward}.
 */
public record RewardSplit(String validator, long blockReward, long commission, Map<String, Long> delegatorShares) {

    public RewardSplit {
        delegatorShares = Map.copyOf(delegatorShares);
    }

    public static RewardSplit none(String validator) {
        return new RewardSplit(validator, 0L, 0L, Map.of());
    }

    public long distributed() {
        long total = commission;
        for (long share : delegatorShares.values()) total = Math.addExact(total, share);
        return total;
    }
}
