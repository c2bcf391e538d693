package io.vindex.ledger.node;

import io.vindex.ledger.consensus.StakingParams;
import io.vindex.ledger.protocol.Amounts;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Config holder for a local chain. */
public final class ChainConfig {
    public static final String RESERVE_ADDRESS = "vindex_reserve";

    public final int maxTransactionsPerBlock;
    public final long blockTimeMillis;
    public final boolean requireSignatures;
    public final String nodeSecret;
    public final StakingParams stakingParams;
    public final long totalSupply;
    public final Map<String, Long> genesisAllocations;
    public final List<GenesisValidator> genesisValidators;
    public final String reserveAddress;

    public ChainConfig(int maxTransactionsPerBlock,
                       long blockTimeMillis,
                       boolean requireSignatures,
                       String nodeSecret,
                       StakingParams stakingParams,
                       long totalSupply,
                       Map<String, Long> genesisAllocations,
                       List<GenesisValidator> genesisValidators,
                       String reserveAddress) {
        if (maxTransactionsPerBlock <= 0) {
            throw new IllegalArgumentException("maxTransactionsPerBlock must be > 0");
        }
        if (blockTimeMillis <= 0) {
            throw new IllegalArgumentException("blockTimeMillis must be > 0");
        }
        if (nodeSecret == null || nodeSecret.isBlank()) {
            throw new IllegalArgumentException("nodeSecret required");
        }
        this.maxTransactionsPerBlock = maxTransactionsPerBlock;
        this.blockTimeMillis = blockTimeMillis;
        this.requireSignatures = requireSignatures;
        this.nodeSecret = nodeSecret;
        this.stakingParams = stakingParams;
        this.totalSupply = totalSupply;
        this.genesisAllocations = Collections.unmodifiableMap(new LinkedHashMap<>(genesisAllocations));
        this.genesisValidators = List.copyOf(genesisValidators);
        this.reserveAddress = reserveAddress;
    }

    public static ChainConfig defaultLocal() {
        Map<String, Long> alloc = new LinkedHashMap<>();
        alloc.put("vindex_genesis_validator_1", Amounts.coins(100_000_000L));
        alloc.put("vindex_genesis_validator_2", Amounts.coins(80_000_000L));
        alloc.put("vindex_genesis_validator_3", Amounts.coins(60_000_000L));
        alloc.put("vindex_treasury", Amounts.coins(200_000_000L));
        alloc.put("vindex_community_fund", Amounts.coins(100_000_000L));
        alloc.put("vindex_development_fund", Amounts.coins(50_000_000L));
        List<GenesisValidator> validators = List.of(
                new GenesisValidator("vindex_genesis_validator_1", Amounts.coins(1_000_000L), 500),
                new GenesisValidator("vindex_genesis_validator_2", Amounts.coins(800_000L), 400),
                new GenesisValidator("vindex_genesis_validator_3", Amounts.coins(600_000L), 600));
        return new ChainConfig(
                1000,            // tx per block cap
                10_000L,         // block time
                false,           // unsigned txs accepted locally
                "vindex-local-node-secret",
                StakingParams.defaults(),
                Amounts.coins(1_000_000_000L),
                alloc,
                validators,
                RESERVE_ADDRESS
        );
    }

    public ChainConfig withBlockTime(long blockTimeMillis) {
        return new ChainConfig(maxTransactionsPerBlock, blockTimeMillis, requireSignatures, nodeSecret,
                stakingParams, totalSupply, genesisAllocations, genesisValidators, reserveAddress);
    }

    public ChainConfig withMaxTransactionsPerBlock(int maxTransactionsPerBlock) {
        return new ChainConfig(maxTransactionsPerBlock, blockTimeMillis, requireSignatures, nodeSecret,
                stakingParams, totalSupply, genesisAllocations, genesisValidators, reserveAddress);
    }

    public ChainConfig withRequireSignatures(boolean requireSignatures) {
        return new ChainConfig(maxTransactionsPerBlock, blockTimeMillis, requireSignatures, nodeSecret,
                stakingParams, totalSupply, genesisAllocations, genesisValidators, reserveAddress);
    }

    public ChainConfig withNodeSecret(String nodeSecret) {
        return new ChainConfig(maxTransactionsPerBlock, blockTimeMillis, requireSignatures, nodeSecret,
                stakingParams, totalSupply, genesisAllocations, genesisValidators, reserveAddress);
    }

    public ChainConfig withStakingParams(StakingParams stakingParams) {
        return new ChainConfig(maxTransactionsPerBlock, blockTimeMillis, requireSignatures, nodeSecret,
                stakingParams, totalSupply, genesisAllocations, genesisValidators, reserveAddress);
    }

    public ChainConfig withGenesisAllocations(Map<String, Long> genesisAllocations) {
        return new ChainConfig(maxTransactionsPerBlock, blockTimeMillis, requireSignatures, nodeSecret,
                stakingParams, totalSupply, genesisAllocations, genesisValidators, reserveAddress);
    }
}
