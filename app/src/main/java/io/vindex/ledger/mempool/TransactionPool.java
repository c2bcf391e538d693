package io.vindex.ledger.mempool;

import io.vindex.ledger.protocol.ProtocolLimits;
import io.vindex.ledger.protocol.Transaction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pending transactions keyed by id, iterated in FIFO (admission) order.
 * Admission checks live in {@link TxValidator}; the pool only stores.
 * Not thread-safe; the owning chain serializes access.
 */
public final class TransactionPool {

    private final Map<String, Transaction> pending = new LinkedHashMap<>();

    /** Adds a transaction; returns false if one with the same id is already pending. */
    public boolean add(Transaction tx) {
        if (tx == null) {
            throw new IllegalArgumentException("Transaction required");
        }
        return pending.putIfAbsent(tx.id(), tx) == null;
    }

    /** Up to {@code max} transactions in FIFO order. Does not remove them. */
    public List<Transaction> getBatch(int max) {
        List<Transaction> out = new ArrayList<>(Math.min(Math.max(max, 0), pending.size()));
        for (Transaction tx : pending.values()) {
            if (out.size() >= max) break;
            out.add(tx);
        }
        return out;
    }

    /** Remove included (or dropped) txs by id. */
    public void removeAll(Collection<Transaction> txs) {
        for (Transaction tx : txs) {
            pending.remove(tx.id());
        }
    }

    public Optional<Transaction> get(String id) {
        return Optional.ofNullable(pending.get(id));
    }

    public boolean contains(String id) {
        return pending.containsKey(id);
    }

    /**
     * A pending transaction with the same sender, recipient and amount whose timestamp lies
     * within {@link ProtocolLimits#DUPLICATE_WINDOW_MILLIS} of {@code tx}'s.
     */
    public Optional<Transaction> findRecentDuplicate(Transaction tx) {
        for (Transaction other : pending.values()) {
            if (other.from().equals(tx.from())
                    && other.to().equals(tx.to())
                    && other.amountMinor() == tx.amountMinor()
                    && Math.abs(other.timestamp() - tx.timestamp()) < ProtocolLimits.DUPLICATE_WINDOW_MILLIS) {
                return Optional.of(other);
            }
        }
        return Optional.empty();
    }

    public List<Transaction> snapshot() {
        return new ArrayList<>(pending.values());
    }

    public int size() { return pending.size(); }

    public boolean isEmpty() { return pending.isEmpty(); }
}
