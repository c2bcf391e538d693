package io.vindex.ledger.node;

import io.vindex.ledger.MutableClock;
import io.vindex.ledger.consensus.Delegation;
import io.vindex.ledger.consensus.StakingException;
import io.vindex.ledger.consensus.Validator;
import io.vindex.ledger.protocol.Amounts;
import io.vindex.ledger.protocol.Block;
import io.vindex.ledger.protocol.RejectReason;
import io.vindex.ledger.protocol.SwapOrder;
import io.vindex.ledger.protocol.Transaction;
import io.vindex.ledger.protocol.TransactionType;
import io.vindex.ledger.protocol.ValidatorTarget;
import io.vindex.ledger.state.Account;
import io.vindex.ledger.wallet.Wallet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ChainTest {

    private static final long VDX = Amounts.COIN;
    private static final String TREASURY = "vindex_treasury";
    private static final String V1 = "vindex_genesis_validator_1";
    private static final String V2 = "vindex_genesis_validator_2";

    private MutableClock clock;
    private Chain chain;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T00:00:00Z"));
        chain = new Chain(ChainConfig.defaultLocal(), clock);
    }

    @Test
    void genesisState() {
        List<Validator> validators = chain.getValidators();
        assertEquals(3, validators.size());
        long total = 0;
        for (Validator v : validators) {
            assertTrue(v.isActive());
            total += v.totalStake();
        }
        assertEquals(2_400_000 * VDX, total);

        assertEquals(1, chain.getChainLength());
        Block genesis = chain.getLatestBlock();
        assertEquals(0, genesis.index());
        assertEquals("0", genesis.previousHash());
        assertEquals("genesis", genesis.validator());
        assertTrue(genesis.transactions().isEmpty());
        assertTrue(chain.isChainValid());

        assertEquals(200_000_000 * VDX, chain.getBalance(TREASURY));
        assertEquals(410_000_000 * VDX, chain.getBalance("vindex_reserve"));
        assertEquals(100_000_000 * VDX, chain.getBalance(V1));
        assertEquals(1_000_000 * VDX, chain.getAccount(V1).orElseThrow().staked());
        assertEquals(0.05, chain.getValidator(V1).orElseThrow().commissionRate(), 1e-9);

        NetworkStats stats = chain.getNetworkStats();
        assertEquals(1_000_000_000 * VDX, stats.totalSupply());
        assertEquals(590_000_000 * VDX, stats.circulatingSupply());
        assertEquals(3, stats.activeValidators());
        assertEquals(7, stats.totalAccounts());
    }

    @Test
    void miningEmptyPoolProducesNothing() {
        assertTrue(chain.mineBlock().isEmpty());
        assertEquals(1, chain.getChainLength());
    }

    @Test
    void miningIncludesAllPendingTransfers() {
        for (int i = 1; i <= 5; i++) {
            assertTrue(chain.addTransaction(transfer(TREASURY, "user_" + i, 100 * VDX)));
        }
        assertEquals(5, chain.getPendingTransactions().size());

        Block block = chain.mineBlock().orElseThrow();

        assertEquals(5, block.transactions().size());
        assertEquals(1, block.index());
        assertEquals(V2, block.validator());
        assertEquals(5 * 1_100_000L, block.totalFees());
        assertEquals(1_050_000_000L + 5 * 1_100_000L, block.reward());
        assertEquals(2, chain.getChainLength());
        assertTrue(chain.getPendingTransactions().isEmpty());
        assertTrue(chain.isChainValid());

        assertEquals(100 * VDX, chain.getBalance("user_3"));
        Account treasury = chain.getAccount(TREASURY).orElseThrow();
        assertEquals(200_000_000 * VDX - 5 * (100 * VDX + 1_100_000L), treasury.balance());
        assertEquals(5, treasury.nonce());

        Account v2 = chain.getAccount(V2).orElseThrow();
        assertEquals(block.reward(), v2.stakingRewards());
        assertEquals(1, chain.getValidator(V2).orElseThrow().blocksProduced());
        assertEquals(590_000_000 * VDX + 1_050_000_000L, chain.getNetworkStats().circulatingSupply());
        assertEquals(1_050_000_000L, chain.getNetworkStats().mintedTokens());
    }

    @Test
    void rotationAcrossBlocks() {
        chain.addTransaction(transfer(TREASURY, "a", VDX));
        assertEquals(V2, chain.mineBlock().orElseThrow().validator());
        chain.addTransaction(transfer(TREASURY, "b", VDX));
        assertEquals(V1, chain.mineBlock().orElseThrow().validator());
        assertTrue(chain.isChainValid());
        assertEquals(chain.getBlock(1).orElseThrow().hash(), chain.getBlock(2).orElseThrow().previousHash());
    }

    @Test
    void overspendingTransactionIsDropped() {
        chain.createAccount("alice", VDX);
        assertTrue(chain.addTransaction(transfer("alice", "bob", 60_000_000L)));
        assertTrue(chain.addTransaction(transfer("alice", "carol", 60_000_000L)));

        Block block = chain.mineBlock().orElseThrow();

        assertEquals(1, block.transactions().size());
        assertEquals("bob", block.transactions().get(0).to());
        assertTrue(chain.getPendingTransactions().isEmpty());
        assertEquals(0, chain.getBalance("carol"));
    }

    @Test
    void noBlockWhenEverythingIsDropped() {
        chain.createAccount("alice", 200 * VDX);
        assertTrue(chain.addTransaction(transfer("alice", "bob", 150 * VDX)));
        chain.stake("alice", V1, 100 * VDX);

        assertTrue(chain.mineBlock().isEmpty());
        assertEquals(1, chain.getChainLength());
        assertTrue(chain.getPendingTransactions().isEmpty());
        assertEquals(100 * VDX, chain.getBalance("alice"));
    }

    @Test
    void stakeTransactionCreatesDelegation() {
        Transaction stake = Transaction.builder()
                .type(TransactionType.STAKE)
                .from(TREASURY)
                .to(V1)
                .amountMinor(1_000 * VDX)
                .payload(new ValidatorTarget(V1))
                .timestamp(clock.millis())
                .build();
        assertTrue(chain.submit(stake).isOk());
        chain.mineBlock().orElseThrow();

        List<Delegation> delegations = chain.getDelegations(TREASURY);
        assertEquals(1, delegations.size());
        assertEquals(1_000 * VDX, delegations.get(0).stakedAmount());
        assertEquals(1_001_000 * VDX, chain.getValidator(V1).orElseThrow().totalStake());
        assertEquals(1_000 * VDX, chain.getAccount(TREASURY).orElseThrow().staked());
    }

    @Test
    void unstakeMaturityThroughChain() {
        chain.createAccount("carol", 1_000 * VDX);
        chain.stake("carol", "carol", 500 * VDX);
        assertEquals(4, chain.getActiveValidators().size());

        chain.unstake("carol", "carol", 500 * VDX);
        assertEquals(3, chain.getActiveValidators().size());
        assertEquals(0, chain.completeUnstaking("carol"));

        clock.advance(Duration.ofDays(8));
        assertEquals(500 * VDX, chain.completeUnstaking("carol"));
        assertEquals(1_000 * VDX, chain.getBalance("carol"));
        assertThrows(StakingException.class, () -> chain.completeUnstaking("ghost"));
    }

    @Test
    void submitReportsRejectReason() {
        assertEquals(RejectReason.UNKNOWN_SENDER, chain.submit(transfer("ghost", "bob", VDX)).error);
        assertFalse(chain.addTransaction(transfer("ghost", "bob", VDX)));
        assertTrue(chain.getPendingTransactions().isEmpty());
    }

    @Test
    void transactionLookupCoversPoolAndChain() {
        Transaction tx = transfer(TREASURY, "dora", 3 * VDX);
        chain.addTransaction(tx);
        assertEquals(tx, chain.getTransaction(tx.id()).orElseThrow());

        Block block = chain.mineBlock().orElseThrow();
        assertEquals(tx, chain.getTransaction(tx.id()).orElseThrow());
        assertEquals(block, chain.getBlockByHash(block.hash()).orElseThrow());
        assertTrue(chain.getTransaction("unknown").isEmpty());

        assertEquals(RejectReason.DUPLICATE, chain.submit(tx).error);
    }

    @Test
    void signedTransfersWhenSignaturesRequired() {
        Chain strict = new Chain(ChainConfig.defaultLocal().withRequireSignatures(true), clock);
        Wallet wallet = Wallet.generate();
        strict.createAccount(wallet.getAddress(), 10 * VDX);

        assertFalse(strict.addTransaction(transfer(wallet.getAddress(), "bob", VDX)));
        Transaction signed = wallet.signTransaction(transfer(wallet.getAddress(), "bob", VDX));
        assertTrue(strict.addTransaction(signed));
        assertTrue(strict.mineBlock().isPresent());
        assertEquals(VDX, strict.getBalance("bob"));
    }

    @Test
    void swapTransactionTradesAgainstPool() {
        assertTrue(chain.createSwapPair("VDX", "USDV", 1_000_000 * VDX, 1_000_000 * VDX));
        assertFalse(chain.createSwapPair("USDV", "VDX", VDX, VDX));

        Transaction swap = Transaction.builder()
                .type(TransactionType.SWAP)
                .from(TREASURY)
                .to("swap-pool")
                .amountMinor(1_000 * VDX)
                .payload(new SwapOrder("VDX", "USDV", 1))
                .timestamp(clock.millis())
                .build();
        assertTrue(chain.addTransaction(swap));
        chain.mineBlock().orElseThrow();

        long received = chain.getAccount(TREASURY).orElseThrow().tokenBalance("USDV");
        assertTrue(received > 0 && received < 1_000 * VDX);
        assertEquals(1_000_000 * VDX - received, chain.getSwapPair("VDX", "USDV").orElseThrow().reserveOf("USDV"));
    }

    @Test
    void tokenInputSwapSpendsMintedHoldings() {
        assertFalse(chain.mintToken(TREASURY, "VDX", VDX));
        assertFalse(chain.mintToken(TREASURY, "USDV", 0));
        assertTrue(chain.mintToken(TREASURY, "USDV", 500 * VDX));
        chain.createSwapPair("VDX", "USDV", 1_000_000 * VDX, 1_000_000 * VDX);

        Transaction tooMuch = swapUsdv(600 * VDX);
        assertEquals(RejectReason.INSUFFICIENT_BALANCE, chain.submit(tooMuch).error);

        long vdxBefore = chain.getBalance(TREASURY);
        Transaction swap = swapUsdv(200 * VDX);
        assertTrue(chain.addTransaction(swap));
        chain.mineBlock().orElseThrow();

        assertEquals(300 * VDX, chain.getAccount(TREASURY).orElseThrow().tokenBalance("USDV"));
        assertTrue(chain.getBalance(TREASURY) > vdxBefore - swap.feeMinor());
        assertEquals(1_000_200 * VDX, chain.getSwapPair("USDV", "VDX").orElseThrow().reserveOf("USDV"));
    }

    @Test
    void burnAdjustsSupply() {
        assertFalse(chain.burnTokens(0));
        assertFalse(chain.burnTokens(-5));
        assertFalse(chain.burnTokens(590_000_000 * VDX + 1));
        assertTrue(chain.burnTokens(1_000 * VDX));

        NetworkStats stats = chain.getNetworkStats();
        assertEquals(1_000 * VDX, stats.burnedTokens());
        assertEquals(590_000_000 * VDX - 1_000 * VDX, stats.circulatingSupply());
    }

    @Test
    void mineIfDueWaitsForBlockTime() {
        chain.addTransaction(transfer(TREASURY, "erin", VDX));
        assertTrue(chain.mineIfDue().isEmpty());

        clock.advance(Duration.ofMillis(ChainConfig.defaultLocal().blockTimeMillis));
        Optional<Block> block = chain.mineIfDue();
        assertTrue(block.isPresent());
        assertEquals(2, chain.getChainLength());
        assertTrue(chain.mineIfDue().isEmpty());
    }

    @Test
    void mineIfDueFiresOnFullPool() {
        Chain small = new Chain(ChainConfig.defaultLocal().withMaxTransactionsPerBlock(2), clock);
        small.addTransaction(transfer(TREASURY, "f1", VDX));
        assertTrue(small.mineIfDue().isEmpty());
        small.addTransaction(transfer(TREASURY, "f2", VDX));
        small.addTransaction(transfer(TREASURY, "f3", VDX));

        Block block = small.mineIfDue().orElseThrow();
        assertEquals(2, block.transactions().size());
        assertEquals(1, small.getPendingTransactions().size());
    }

    @Test
    void networkStatsMeasureBlockTime() {
        chain.addTransaction(transfer(TREASURY, "g1", VDX));
        clock.advance(Duration.ofSeconds(10));
        chain.mineBlock().orElseThrow();

        NetworkStats stats = chain.getNetworkStats();
        assertEquals(2, stats.chainLength());
        assertEquals(10_000.0, stats.averageBlockTimeMillis(), 1e-9);
        assertEquals(0.1, stats.tps(), 1e-9);
    }

    private Transaction swapUsdv(long amount) {
        return Transaction.builder()
                .type(TransactionType.SWAP)
                .from(TREASURY)
                .to("swap-pool")
                .amountMinor(amount)
                .payload(new SwapOrder("USDV", "VDX", 1))
                .timestamp(clock.millis())
                .build();
    }

    private Transaction transfer(String from, String to, long amount) {
        return Transaction.builder().from(from).to(to).amountMinor(amount).timestamp(clock.millis()).build();
    }
}
