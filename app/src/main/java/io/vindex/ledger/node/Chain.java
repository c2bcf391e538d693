package io.vindex.ledger.node;

import io.vindex.ledger.consensus.ConsensusEngine;
import io.vindex.ledger.consensus.ConsensusRules;
import io.vindex.ledger.consensus.Delegation;
import io.vindex.ledger.consensus.RewardPolicy;
import io.vindex.ledger.consensus.RewardSplit;
import io.vindex.ledger.consensus.StakingException;
import io.vindex.ledger.consensus.StakingRegistry;
import io.vindex.ledger.consensus.StakingStats;
import io.vindex.ledger.consensus.Validator;
import io.vindex.ledger.mempool.TransactionPool;
import io.vindex.ledger.mempool.TxValidator;
import io.vindex.ledger.metrics.BlockMetrics;
import io.vindex.ledger.protocol.Amounts;
import io.vindex.ledger.protocol.Block;
import io.vindex.ledger.protocol.BlockHeader;
import io.vindex.ledger.protocol.BlockSigner;
import io.vindex.ledger.protocol.Hashes;
import io.vindex.ledger.protocol.HmacBlockSigner;
import io.vindex.ledger.protocol.Merkle;
import io.vindex.ledger.protocol.Transaction;
import io.vindex.ledger.protocol.ValidationResult;
import io.vindex.ledger.state.Account;
import io.vindex.ledger.state.Ledger;
import io.vindex.ledger.storage.ChainStore;
import io.vindex.ledger.storage.InMemoryChainStore;
import io.vindex.ledger.swap.SwapBook;
import io.vindex.ledger.swap.SwapPair;

import java.nio.ByteBuffer;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wires ledger, staking, consensus, pool, swap book and block storage behind one lock.
 * Every public operation is synchronized on the chain, so the timer-driven miner and callers
 * never observe or mutate a half-applied block.
 */
public final class Chain {
    private static final Logger LOG = Logger.getLogger(Chain.class.getName());

    private final ChainConfig config;
    private final Clock clock;
    private final Ledger ledger;
    private final StakingRegistry staking;
    private final ConsensusEngine consensus;
    private final RewardPolicy rewards;
    private final TransactionPool pool;
    private final TxValidator validator;
    private final SwapBook swaps;
    private final ChainStore blocks;
    private final BlockSigner signer;

    private long circulatingSupply;
    private long burnedTokens;
    private long mintedTokens;

    public Chain(ChainConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.ledger = new Ledger();
        this.staking = new StakingRegistry(ledger, config.stakingParams, clock);
        this.consensus = new ConsensusEngine(staking);
        this.rewards = new RewardPolicy();
        this.pool = new TransactionPool();
        this.swaps = new SwapBook();
        this.blocks = new InMemoryChainStore();
        this.signer = new HmacBlockSigner(config.nodeSecret);
        this.validator = new TxValidator(ledger, staking, swaps, config.requireSignatures, clock,
                blocks::containsTransaction);

        this.circulatingSupply = GenesisBuilder.seedBalances(ledger, config);
        GenesisBuilder.seedValidators(staking, config);
        Block genesis = GenesisBuilder.buildGenesis(computeStateRoot(), clock.millis(), signer);
        blocks.append(genesis);
        LOG.info("Genesis created: " + genesis.hash() + " with " + staking.getActiveValidators().size()
                + " active validators");
    }

    /** Convenience factory for a local chain on the system clock. */
    public static Chain inMemory(ChainConfig config) {
        return new Chain(config, Clock.systemUTC());
    }

    // -------------------- transactions --------------------

    /** Admission with the reason for a rejection. */
    public synchronized ValidationResult submit(Transaction tx) {
        ValidationResult result = validator.check(tx, pool);
        if (!result.isOk()) {
            BlockMetrics.incrementRejected(result.error);
            LOG.fine(() -> "Rejected tx: " + result);
            return result;
        }
        pool.add(tx);
        BlockMetrics.incrementAdmitted();
        LOG.fine(() -> "Admitted " + tx);
        return result;
    }

    public synchronized boolean addTransaction(Transaction tx) {
        return submit(tx).isOk();
    }

    // -------------------- mining --------------------

    /**
     * Produces the next block from the pool head, or empty if nothing could be included.
     * Transactions that no longer apply against the current state are dropped from the pool.
     */
    public synchronized Optional<Block> mineBlock() {
        if (pool.isEmpty()) {
            return Optional.empty();
        }
        List<Transaction> batch = pool.getBatch(config.maxTransactionsPerBlock);
        Block parent = getLatestBlock();
        long index = parent.index() + 1;
        String producer = consensus.selectValidator(index);

        List<Transaction> included = new ArrayList<>(batch.size());
        List<Transaction> dropped = new ArrayList<>();
        for (Transaction tx : batch) {
            if (apply(tx)) {
                included.add(tx);
            } else {
                dropped.add(tx);
            }
        }
        pool.removeAll(batch);
        if (!dropped.isEmpty()) {
            BlockMetrics.incrementDropped(dropped.size());
            LOG.warning("Dropped " + dropped.size() + " transaction(s) that no longer apply");
        }
        if (included.isEmpty()) {
            return Optional.empty();
        }

        long fees = 0L;
        for (Transaction tx : included) fees = Math.addExact(fees, tx.feeMinor());
        long reward = rewards.rewardFor(index, included.size(), fees);
        RewardSplit split = consensus.distributeStakingRewards(reward, producer);
        long issued = rewards.issuanceFor(index, included.size());
        circulatingSupply = Math.addExact(circulatingSupply, issued);
        mintedTokens = Math.addExact(mintedTokens, issued);
        consensus.updateValidatorAfterBlock(producer, index);

        long timestamp = Math.max(clock.millis(), parent.timestamp());
        BlockHeader header = new BlockHeader(
                index,
                timestamp,
                parent.hash(),
                Merkle.rootOfTransactions(included),
                computeStateRoot(),
                producer,
                0L,
                included.size(),
                fees,
                reward
        );
        Block block = Block.seal(header, included, signer);
        blocks.append(block);
        BlockMetrics.incrementBlocks();
        BlockMetrics.recordReward(reward);
        LOG.info("Block " + index + " mined by " + producer + " with " + included.size()
                + " tx(s), reward " + reward + " (" + split.delegatorShares().size() + " delegator shares)");
        return Optional.of(block);
    }

    /** Mines when the pool is full or the block time has elapsed with something pending. */
    public synchronized Optional<Block> mineIfDue() {
        if (pool.isEmpty()) {
            return Optional.empty();
        }
        boolean full = pool.size() >= config.maxTransactionsPerBlock;
        boolean elapsed = clock.millis() - getLatestBlock().timestamp() >= config.blockTimeMillis;
        return full || elapsed ? mineBlock() : Optional.empty();
    }

    /** Applies one transaction atomically; false (nothing changed) if it no longer fits the state. */
    private boolean apply(Transaction tx) {
        try {
            switch (tx.type()) {
                case TRANSFER:
                    if (ledger.getBalance(tx.from()) < tx.totalCostMinor()) return false;
                    ledger.adjustBalance(tx.from(), -tx.totalCostMinor());
                    ledger.ensureAccount(tx.to());
                    ledger.adjustBalance(tx.to(), tx.amountMinor());
                    break;
                case STAKE:
                    if (ledger.getBalance(tx.from()) < tx.totalCostMinor()) return false;
                    staking.stake(tx.from(), tx.targetValidator(), tx.amountMinor());
                    ledger.adjustBalance(tx.from(), -tx.feeMinor());
                    break;
                case UNSTAKE:
                    if (ledger.getBalance(tx.from()) < tx.feeMinor()) return false;
                    staking.unstake(tx.from(), tx.targetValidator(), tx.amountMinor());
                    ledger.adjustBalance(tx.from(), -tx.feeMinor());
                    break;
                case SWAP:
                    OptionalLong out = swaps.execute(ledger, tx.from(), tx.swapOrder(), tx.amountMinor(), tx.feeMinor());
                    if (out.isEmpty()) return false;
                    break;
                default:
                    return false;
            }
        } catch (StakingException e) {
            LOG.log(Level.FINE, "Staking rejected " + tx.id() + ": " + e.getMessage());
            return false;
        }
        ledger.incrementNonce(tx.from());
        return true;
    }

    private String computeStateRoot() {
        byte[] ledgerDigest = ledger.stateDigest();
        byte[] registryDigest = staking.stateDigest();
        ByteBuffer buf = ByteBuffer.allocate(ledgerDigest.length + registryDigest.length);
        buf.put(ledgerDigest).put(registryDigest);
        return Hashes.sha256Hex(buf.array());
    }

    // -------------------- staking passthroughs --------------------

    public synchronized Delegation stake(String delegator, String validatorAddress, long amount) {
        return staking.stake(delegator, validatorAddress, amount);
    }

    public synchronized Delegation unstake(String delegator, String validatorAddress, long amount) {
        return staking.unstake(delegator, validatorAddress, amount);
    }

    public synchronized long completeUnstaking(String delegator) {
        return staking.completeUnstaking(delegator);
    }

    // -------------------- token economics --------------------

    public synchronized boolean burnTokens(long amount) {
        if (amount <= 0 || amount > circulatingSupply) {
            return false;
        }
        burnedTokens += amount;
        circulatingSupply -= amount;
        LOG.info("Burned " + amount + " minor units");
        return true;
    }

    public synchronized boolean createSwapPair(String tokenA, String tokenB, long reserveA, long reserveB) {
        boolean created = swaps.createPair(tokenA, tokenB, reserveA, reserveB);
        if (created) {
            LOG.info("Swap pair created: " + SwapBook.pairKey(tokenA, tokenB));
        }
        return created;
    }

    public synchronized Optional<SwapPair> getSwapPair(String tokenA, String tokenB) {
        return swaps.getPair(tokenA, tokenB);
    }

    /** Credit non-native token holdings, creating the account if needed. */
    public synchronized boolean mintToken(String address, String symbol, long amount) {
        if (amount <= 0 || Amounts.NATIVE_SYMBOL.equals(symbol)) return false;
        ledger.ensureAccount(address);
        return ledger.adjustTokenBalance(address, symbol, amount);
    }

    // -------------------- reads --------------------

    public synchronized long getBalance(String address) {
        return ledger.getBalance(address);
    }

    public synchronized Optional<Account> getAccount(String address) {
        return ledger.getAccount(address);
    }

    public synchronized Account createAccount(String address, long initialBalance) {
        return ledger.createAccount(address, initialBalance);
    }

    public synchronized Optional<Block> getBlock(long index) {
        return blocks.get(index);
    }

    public synchronized Optional<Block> getBlockByHash(String hash) {
        return blocks.getByHash(hash);
    }

    /** Looks in the pool first, then the chain. */
    public synchronized Optional<Transaction> getTransaction(String id) {
        Optional<Transaction> pending = pool.get(id);
        return pending.isPresent() ? pending : blocks.findTransaction(id);
    }

    public synchronized List<Transaction> getPendingTransactions() {
        return pool.snapshot();
    }

    public synchronized int getChainLength() {
        return blocks.size();
    }

    public synchronized Block getLatestBlock() {
        return blocks.latest().orElseThrow(() -> new IllegalStateException("Chain has no genesis"));
    }

    /** Structural rules plus each block's validator signature. Never throws. */
    public synchronized boolean isChainValid() {
        List<Block> all = blocks.blocks();
        if (!ConsensusRules.isChainValid(all)) {
            return false;
        }
        for (Block block : all) {
            if (!signer.verify(block.validator(), block.hash(), block.signature())) {
                return false;
            }
        }
        return true;
    }

    public synchronized Optional<Validator> getValidator(String address) {
        return staking.getValidator(address);
    }

    public synchronized List<Validator> getValidators() {
        return staking.getValidators();
    }

    public synchronized List<Validator> getActiveValidators() {
        return staking.getActiveValidators();
    }

    public synchronized List<Delegation> getDelegations(String delegator) {
        return staking.getDelegations(delegator);
    }

    public synchronized StakingStats getStakingStats() {
        return staking.getNetworkStats();
    }

    public synchronized NetworkStats getNetworkStats() {
        List<Block> all = blocks.blocks();
        Block first = all.get(0);
        Block last = all.get(all.size() - 1);
        long totalTime = all.size() > 1 ? last.timestamp() - first.timestamp() : 0L;
        double averageBlockTime = all.size() > 1 ? totalTime / (double) (all.size() - 1) : 0d;
        long txCount = 0L;
        for (Block b : all) txCount += b.transactionCount();
        double tps = totalTime > 0 ? txCount * 1000d / totalTime : 0d;
        StakingStats stakingStats = staking.getNetworkStats();
        return new NetworkStats(
                config.totalSupply,
                circulatingSupply,
                burnedTokens,
                mintedTokens,
                stakingStats.totalStaked(),
                stakingStats.totalValidators(),
                stakingStats.activeValidators(),
                stakingStats.totalAccounts(),
                all.size(),
                pool.size(),
                averageBlockTime,
                tps);
    }

    public synchronized ChainSnapshot exportChain() {
        return new ChainSnapshot(
                blocks.blocks(),
                pool.snapshot(),
                config.totalSupply,
                circulatingSupply,
                burnedTokens,
                swaps.pairs());
    }

    public ChainConfig config() {
        return config;
    }
}
