package io.vindex.ledger.node;

import io.vindex.ledger.consensus.ConsensusRules;
import io.vindex.ledger.consensus.StakingRegistry;
import io.vindex.ledger.protocol.Block;
import io.vindex.ledger.protocol.BlockHeader;
import io.vindex.ledger.protocol.BlockSigner;
import io.vindex.ledger.protocol.Merkle;
import io.vindex.ledger.protocol.Transaction;
import io.vindex.ledger.state.Ledger;

import java.util.Collections;
import java.util.Map;

/**
 * Creates the genesis block and seeds initial balances and validators.
 * - index = 0
 * - previousHash = "0"
 * - validator = "genesis", no transactions, no reward
 * - the reserve account holds whatever the allocations leave of the total supply
 */
public final class GenesisBuilder {
    public static final String GENESIS_VALIDATOR = "genesis";

    private GenesisBuilder(){}

    /**
     * Credit allocations and the reserve into the ledger.
     *
     * @return circulating supply at genesis (the allocations, reserve excluded)
     */
    public static long seedBalances(Ledger ledger, ChainConfig config) {
        long circulating = 0L;
        for (Map.Entry<String, Long> e : config.genesisAllocations.entrySet()) {
            long amount = e.getValue() == null ? 0L : e.getValue();
            ledger.createAccount(e.getKey(), amount);
            circulating = Math.addExact(circulating, amount);
        }
        long reserve = config.totalSupply - circulating;
        if (reserve < 0) {
            throw new IllegalStateException("Genesis allocations exceed total supply");
        }
        ledger.createAccount(config.reserveAddress, reserve);
        return circulating;
    }

    /** Register every configured genesis validator (self-stake not debited from the balance). */
    public static void seedValidators(StakingRegistry registry, ChainConfig config) {
        for (GenesisValidator v : config.genesisValidators) {
            registry.registerGenesisValidator(v.address(), v.selfStake(), v.commissionBps());
        }
    }

    /** Build the genesis block over the seeded state. */
    public static Block buildGenesis(String stateRoot, long timestamp, BlockSigner signer) {
        BlockHeader hdr = new BlockHeader(
                0L,
                timestamp,
                ConsensusRules.GENESIS_PREVIOUS_HASH,
                Merkle.rootOfTransactions(Collections.<Transaction>emptyList()),
                stateRoot,
                GENESIS_VALIDATOR,
                0L,
                0,
                0L,
                0L
        );
        return Block.seal(hdr, Collections.<Transaction>emptyList(), signer);
    }
}
