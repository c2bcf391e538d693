package io.vindex.ledger.consensus;

import java.time.Duration;

public record StakingStats(int totalValidators,
                           int activeValidators,
                           long totalStaked,
                           int totalAccounts,
                           long minStakeAmount,
                           int maxValidators,
                           double stakingRewardRate,
                           Duration unstakingPeriod) {
}
