package io.vindex.ledger.consensus;

import io.vindex.ledger.protocol.Amounts;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RewardPolicyTest {

    private final RewardPolicy policy = new RewardPolicy();

    @Test
    void emptyBlockEarnsNothing() {
        assertEquals(0L, policy.rewardFor(5, 0, 0));
        assertEquals(0L, policy.issuanceFor(5, 0));
    }

    @Test
    void baseRewardPlusBonusPlusFees() {
        // 10 VDX + 3 x 0.1 VDX + fees
        assertEquals(Amounts.coins(10) + 30_000_000L + 600_000L, policy.rewardFor(1, 3, 600_000L));
        assertEquals(Amounts.coins(10) + 30_000_000L, policy.issuanceFor(1, 3));
    }

    @Test
    void bonusIsCappedAtFiveVdx() {
        assertEquals(Amounts.coins(15), policy.issuanceFor(1, 1_000));
    }

    @Test
    void baseHalvesEveryInterval() {
        assertEquals(Amounts.coins(5) + Amounts.COIN / 10, policy.issuanceFor(RewardPolicy.HALVING_INTERVAL, 1));
        assertEquals(Amounts.coins(10) + Amounts.COIN / 10, policy.issuanceFor(RewardPolicy.HALVING_INTERVAL - 1, 1));
    }
}
