package io.vindex.ledger.storage;

import io.vindex.ledger.protocol.Block;
import io.vindex.ledger.protocol.Transaction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory chain store. Blocks are kept in index order with hash and transaction-id indexes
 * on the side, so lookups by hash or tx id don't scan the chain.
 */
public final class InMemoryChainStore implements ChainStore {

    private final List<Block> blocks = new ArrayList<>();

    /** Map: blockHash -> index */
    private final Map<String, Integer> byHash = new HashMap<>();

    /** Map: txId -> index of the block holding it */
    private final Map<String, Integer> txIndex = new HashMap<>();

    @Override
    public synchronized void append(Block block) {
        if (block == null) throw new IllegalArgumentException("Block required");
        if (block.index() != blocks.size()) {
            throw new IllegalArgumentException("Expected block index " + blocks.size() + ", got " + block.index());
        }
        if (byHash.containsKey(block.hash())) {
            throw new IllegalArgumentException("Block already stored: " + block.hash());
        }
        int position = blocks.size();
        blocks.add(block);
        byHash.put(block.hash(), position);
        for (Transaction tx : block.transactions()) {
            txIndex.put(tx.id(), position);
        }
    }

    @Override
    public synchronized Optional<Block> get(long index) {
        if (index < 0 || index >= blocks.size()) return Optional.empty();
        return Optional.of(blocks.get((int) index));
    }

    @Override
    public synchronized Optional<Block> getByHash(String hash) {
        if (hash == null) return Optional.empty();
        Integer position = byHash.get(hash);
        return position == null ? Optional.empty() : Optional.of(blocks.get(position));
    }

    @Override
    public synchronized Optional<Block> latest() {
        if (blocks.isEmpty()) return Optional.empty();
        return Optional.of(blocks.get(blocks.size() - 1));
    }

    @Override
    public synchronized int size() {
        return blocks.size();
    }

    @Override
    public synchronized List<Block> blocks() {
        return Collections.unmodifiableList(new ArrayList<>(blocks));
    }

    @Override
    public synchronized Optional<Transaction> findTransaction(String txId) {
        Integer position = txIndex.get(txId);
        if (position == null) return Optional.empty();
        for (Transaction tx : blocks.get(position).transactions()) {
            if (tx.id().equals(txId)) return Optional.of(tx);
        }
        return Optional.empty();
    }

    @Override
    public synchronized boolean containsTransaction(String txId) {
        return txIndex.containsKey(txId);
    }
}
