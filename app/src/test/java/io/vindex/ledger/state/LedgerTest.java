package io.vindex.ledger.state;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LedgerTest {

    @Test
    void createAccountRejectsDuplicatesAndNegativeBalance() {
        Ledger ledger = new Ledger();
        Account created = ledger.createAccount("alice", 500);
        assertEquals(500, created.balance());
        assertEquals(0, created.nonce());

        assertThrows(IllegalArgumentException.class, () -> ledger.createAccount("alice"));
        assertThrows(IllegalArgumentException.class, () -> ledger.createAccount("bob", -1));
        assertFalse(ledger.exists("bob"));
    }

    @Test
    void adjustBalanceGuardsAgainstOverdraft() {
        Ledger ledger = new Ledger();
        ledger.createAccount("alice", 100);

        assertTrue(ledger.adjustBalance("alice", -40));
        assertEquals(60, ledger.getBalance("alice"));

        assertFalse(ledger.adjustBalance("alice", -61));
        assertEquals(60, ledger.getBalance("alice"));

        assertFalse(ledger.adjustBalance("ghost", 10));
        assertFalse(ledger.exists("ghost"));
        assertEquals(0, ledger.getBalance("ghost"));
    }

    @Test
    void snapshotsAreDetached() {
        Ledger ledger = new Ledger();
        ledger.createAccount("alice", 100);
        Account before = ledger.getAccount("alice").orElseThrow();

        ledger.adjustBalance("alice", 50);
        ledger.incrementNonce("alice");

        assertEquals(100, before.balance());
        assertEquals(0, before.nonce());
        Account after = ledger.getAccount("alice").orElseThrow();
        assertEquals(150, after.balance());
        assertEquals(1, after.nonce());
    }

    @Test
    void tokenHoldingsUseTheSameGuard() {
        Ledger ledger = new Ledger();
        ledger.createAccount("alice");

        assertTrue(ledger.adjustTokenBalance("alice", "USDV", 30));
        assertFalse(ledger.adjustTokenBalance("alice", "USDV", -31));
        assertEquals(30, ledger.getTokenBalance("alice", "USDV"));
        assertEquals(0, ledger.getTokenBalance("alice", "OTHER"));
    }

    @Test
    void stakedNeverGoesNegative() {
        Ledger ledger = new Ledger();
        ledger.createAccount("alice");
        ledger.adjustStaked("alice", 10);
        assertThrows(IllegalStateException.class, () -> ledger.adjustStaked("alice", -11));
        assertEquals(10, ledger.getAccount("alice").orElseThrow().staked());
    }

    @Test
    void rewardsCreateMissingAccounts() {
        Ledger ledger = new Ledger();
        ledger.addRewards("validator", 25);
        Account account = ledger.getAccount("validator").orElseThrow();
        assertEquals(25, account.stakingRewards());
        assertEquals(0, account.balance());
    }

    @Test
    void digestTracksState() {
        Ledger ledger = new Ledger();
        ledger.createAccount("alice", 1);
        byte[] d1 = ledger.stateDigest();
        assertArrayEquals(d1, ledger.stateDigest());

        ledger.adjustBalance("alice", 1);
        assertFalse(java.util.Arrays.equals(d1, ledger.stateDigest()));
    }

    @Test
    void totalsSumAccounts() {
        Ledger ledger = new Ledger();
        ledger.createAccount("alice", 10);
        ledger.createAccount("bob", 32);
        assertEquals(2, ledger.accountCount());
        assertEquals(42, ledger.totalBalance());
    }
}
