package io.vindex.ledger.consensus;

import io.vindex.ledger.protocol.Amounts;

import java.time.Duration;
import java.util.Objects;

/**
 * Staking configuration.
 *
 * @param minStakeAmount       minimum single stake, and the total stake a validator needs to be active
 * @param maxValidators        cap on validator records (active or not)
 * @param unstakingPeriod      delay between an unstake request and the funds becoming spendable
 * @param stakingRewardRate    annual rate echoed in statistics; per-block rewards come from the reward policy
 * @param defaultCommissionBps commission for validators created by self-nomination
 */
public record StakingParams(long minStakeAmount,
                            int maxValidators,
                            Duration unstakingPeriod,
                            double stakingRewardRate,
                            int defaultCommissionBps) {

    public StakingParams {
        Objects.requireNonNull(unstakingPeriod, "unstakingPeriod");
        if (minStakeAmount <= 0) throw new IllegalArgumentException("minStakeAmount must be > 0");
        if (maxValidators <= 0) throw new IllegalArgumentException("maxValidators must be > 0");
        if (unstakingPeriod.isNegative()) throw new IllegalArgumentException("unstakingPeriod must be >= 0");
        if (defaultCommissionBps < 0 || defaultCommissionBps >= Amounts.BPS_DENOMINATOR) {
            throw new IllegalArgumentException("defaultCommissionBps must be in [0, 10000)");
        }
    }

    public static StakingParams defaults() {
        return new StakingParams(
                Amounts.coins(100),   // 100 VDX
                21,
                Duration.ofDays(7),
                0.08,
                500                   // 5%
        );
    }

    public StakingParams withUnstakingPeriod(Duration period) {
        return new StakingParams(minStakeAmount, maxValidators, period, stakingRewardRate, defaultCommissionBps);
    }

    public StakingParams withMaxValidators(int max) {
        return new StakingParams(minStakeAmount, max, unstakingPeriod, stakingRewardRate, defaultCommissionBps);
    }
}
