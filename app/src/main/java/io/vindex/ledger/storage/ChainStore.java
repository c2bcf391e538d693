package io.vindex.ledger.storage;

import io.vindex.ledger.protocol.Block;
import io.vindex.ledger.protocol.Transaction;

import java.util.List;
import java.util.Optional;

/**
 * Append-only block store for a single linear chain.
 *
 * Notes:
 * - Block "hash" = SHA-256 of the BlockHeader serialization, hex (see BlockHeader#hash()).
 * - Index equals position; {@link #append} refuses anything but the next index.
 */
public interface ChainStore {

    /** Append the next block. Throws if its index is not {@link #size()}. */
    void append(Block block);

    Optional<Block> get(long index);

    Optional<Block> getByHash(String hash);

    /** The tip, or empty before genesis. */
    Optional<Block> latest();

    int size();

    /** All blocks in index order. */
    List<Block> blocks();

    /** Locate a mined transaction by id. */
    default Optional<Transaction> findTransaction(String txId) {
        for (Block block : blocks()) {
            for (Transaction tx : block.transactions()) {
                if (tx.id().equals(txId)) {
                    return Optional.of(tx);
                }
            }
        }
        return Optional.empty();
    }

    default boolean containsTransaction(String txId) {
        return findTransaction(txId).isPresent();
    }
}
