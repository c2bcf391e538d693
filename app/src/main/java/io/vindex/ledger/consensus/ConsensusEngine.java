package io.vindex.ledger.consensus;

import io.vindex.ledger.protocol.Amounts;
import io.vindex.ledger.state.Ledger;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Stake-weighted producer rotation and block reward distribution over a {@link StakingRegistry}.
 */
public final class ConsensusEngine {

    private final StakingRegistry registry;
    private final SeedFunction seed;

    public ConsensusEngine(StakingRegistry registry, SeedFunction seed) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.seed = Objects.requireNonNull(seed, "seed");
    }

    public ConsensusEngine(StakingRegistry registry) {
        this(registry, new LinearCongruentialSeed());
    }

    /**
     * Deterministic stake-weighted pick among active validators: a target in [0, totalStake) is
     * derived from the block index, then validators are walked in registration order until the
     * running stake reaches the target.
     *
     * @throws IllegalStateException if there are no active validators
     */
    public String selectValidator(long blockIndex) {
        if (blockIndex < 0) {
            throw new IllegalArgumentException("blockIndex must be >= 0");
        }
        long minStake = registry.params().minStakeAmount();
        List<Validator> active = new ArrayList<>();
        long totalStake = 0L;
        for (Validator v : registry.validatorRecords()) {
            if (v.isActive() && v.totalStake() >= minStake) {
                active.add(v);
                totalStake = Math.addExact(totalStake, v.totalStake());
            }
        }
        if (active.isEmpty()) {
            throw new IllegalStateException("No active validators available");
        }

        double target = seed.unitInterval(blockIndex) * totalStake;
        long cumulative = 0L;
        for (Validator v : active) {
            cumulative += v.totalStake();
            if (cumulative >= target) {
                return v.address();
            }
        }
        return active.get(0).address();
    }

    public void updateValidatorAfterBlock(String validatorAddress, long blockIndex) {
        Validator v = registry.validatorRecord(validatorAddress);
        if (v != null) {
            v.recordBlock(blockIndex);
        }
    }

    /**
     * Splits a block reward: the validator keeps its commission, the rest goes pro rata to every
     * delegation pointing at it (the validator's own self-stake included). Shares are floored;
     * the rounding remainder is added to the commission so the parts sum to {@code blockReward}.
     * Unknown validators and non-positive rewards are a no-op.
     */
    public RewardSplit distributeStakingRewards(long blockReward, String validatorAddress) {
        Validator validator = registry.validatorRecord(validatorAddress);
        if (validator == null || blockReward <= 0) {
            return RewardSplit.none(validatorAddress);
        }
        Ledger ledger = registry.ledger();

        long commission = BigInteger.valueOf(blockReward)
                .multiply(BigInteger.valueOf(validator.commissionBps()))
                .divide(BigInteger.valueOf(Amounts.BPS_DENOMINATOR))
                .longValueExact();
        long delegatorPool = blockReward - commission;

        Map<String, Long> shares = new LinkedHashMap<>();
        long paid = 0L;
        long totalStake = validator.totalStake();
        if (totalStake > 0) {
            for (Delegation record : registry.recordsFor(validatorAddress)) {
                if (record.stakedAmount() <= 0) continue;
                long share = BigInteger.valueOf(delegatorPool)
                        .multiply(BigInteger.valueOf(record.stakedAmount()))
                        .divide(BigInteger.valueOf(totalStake))
                        .longValueExact();
                if (share == 0L) continue;
                record.addRewards(share);
                ledger.addRewards(record.delegator(), share);
                shares.merge(record.delegator(), share, Long::sum);
                paid += share;
            }
        }
        commission += delegatorPool - paid;
        ledger.addRewards(validatorAddress, commission);
        return new RewardSplit(validatorAddress, blockReward, commission, shares);
    }
}
