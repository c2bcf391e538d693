package io.vindex.ledger.consensus;

import io.vindex.ledger.protocol.Block;
import io.vindex.ledger.protocol.BlockHeader;

import java.util.List;

public final class ConsensusRules {
    public static final String GENESIS_PREVIOUS_HASH = "0";

    private ConsensusRules() {}

    public static void validateGenesis(Block genesis) throws IllegalArgumentException {
        BlockHeader hdr = genesis.header();
        if (hdr.index() != 0) {
            throw new IllegalArgumentException("Genesis index must be 0, got " + hdr.index());
        }
        if (!GENESIS_PREVIOUS_HASH.equals(hdr.previousHash())) {
            throw new IllegalArgumentException("Genesis previousHash must be \"0\"");
        }
        validateStructure(genesis);
    }

    public static void validateBlock(Block block, Block parent) throws IllegalArgumentException {
        BlockHeader hdr = block.header();

        // 1) Index follows the parent
        long expectedIndex = parent.index() + 1;
        if (hdr.index() != expectedIndex) {
            throw new IllegalArgumentException("Bad block index: expected " + expectedIndex + ", got " + hdr.index());
        }

        // 2) Linked to the parent's stored hash
        if (!parent.hash().equals(hdr.previousHash())) {
            throw new IllegalArgumentException("previousHash mismatch at index " + hdr.index());
        }

        // 3) Timestamps never go backwards
        if (hdr.timestamp() < parent.timestamp()) {
            throw new IllegalArgumentException("Timestamp before parent at index " + hdr.index());
        }

        validateStructure(block);
    }

    /** Walks the whole chain; any rule violation makes it invalid. Never throws. */
    public static boolean isChainValid(List<Block> blocks) {
        if (blocks == null || blocks.isEmpty()) {
            return false;
        }
        try {
            validateGenesis(blocks.get(0));
            for (int i = 1; i < blocks.size(); i++) {
                validateBlock(blocks.get(i), blocks.get(i - 1));
            }
            return true;
        } catch (RuntimeException e) {
            return false;
        }
    }

    private static void validateStructure(Block block) {
        BlockHeader hdr = block.header();
        if (!block.hash().equals(hdr.hash())) {
            throw new IllegalArgumentException("Stored hash does not match header at index " + hdr.index());
        }
        if (!hdr.merkleRoot().equals(block.computeMerkleRoot())) {
            throw new IllegalArgumentException("Merkle mismatch at index " + hdr.index());
        }
        if (hdr.transactionCount() != block.transactions().size()) {
            throw new IllegalArgumentException("Transaction count mismatch at index " + hdr.index());
        }
        if (hdr.totalFees() != block.computeTotalFees()) {
            throw new IllegalArgumentException("Fee total mismatch at index " + hdr.index());
        }
    }
}
