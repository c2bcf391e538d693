package io.vindex.ledger.mempool;

import io.vindex.ledger.protocol.Transaction;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TransactionPoolTest {

    @Test
    void batchesInAdmissionOrderWithoutRemoving() {
        TransactionPool pool = new TransactionPool();
        Transaction a = tx("alice", 1, 1_000L);
        Transaction b = tx("bob", 2, 2_000L);
        Transaction c = tx("carol", 3, 3_000L);
        pool.add(a);
        pool.add(b);
        pool.add(c);

        assertEquals(List.of(a, b), pool.getBatch(2));
        assertEquals(3, pool.size());

        pool.removeAll(List.of(a, b));
        assertEquals(List.of(c), pool.snapshot());
    }

    @Test
    void sameIdIsStoredOnce() {
        TransactionPool pool = new TransactionPool();
        Transaction a = tx("alice", 1, 1_000L);
        assertTrue(pool.add(a));
        assertFalse(pool.add(a));
        assertEquals(1, pool.size());
        assertTrue(pool.contains(a.id()));
        assertEquals(a, pool.get(a.id()).orElseThrow());
    }

    @Test
    void recentDuplicateUsesSixtySecondWindow() {
        TransactionPool pool = new TransactionPool();
        pool.add(tx("alice", 5, 100_000L));

        assertTrue(pool.findRecentDuplicate(tx("alice", 5, 159_000L)).isPresent());
        assertTrue(pool.findRecentDuplicate(tx("alice", 5, 160_000L)).isEmpty());
        assertTrue(pool.findRecentDuplicate(tx("alice", 6, 100_500L)).isEmpty());
    }

    private static Transaction tx(String from, long amount, long ts) {
        return Transaction.builder().from(from).to("dest").amountMinor(amount).timestamp(ts).build();
    }
}
