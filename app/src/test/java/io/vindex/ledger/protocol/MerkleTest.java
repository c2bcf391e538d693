package io.vindex.ledger.protocol;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MerkleTest {

    @Test
    void emptyRootIsZeros() {
        assertArrayEquals(new byte[32], Merkle.rootOf(List.of()));
        assertEquals("0".repeat(64), Merkle.rootOfTransactions(List.of()));
    }

    @Test
    void singleLeafIsItsOwnRoot() {
        byte[] leaf = Hashes.sha256("a".getBytes());
        assertArrayEquals(leaf, Merkle.rootOf(List.of(leaf)));
    }

    @Test
    void oddLevelDuplicatesLastLeaf() {
        byte[] a = Hashes.sha256("a".getBytes());
        byte[] b = Hashes.sha256("b".getBytes());
        byte[] c = Hashes.sha256("c".getBytes());

        byte[] ab = Hashes.sha256(concat(a, b));
        byte[] cc = Hashes.sha256(concat(c, c));
        byte[] expected = Hashes.sha256(concat(ab, cc));

        assertArrayEquals(expected, Merkle.rootOf(List.of(a, b, c)));
    }

    @Test
    void orderMatters() {
        Transaction t1 = Transaction.builder().from("alice").to("bob").amountMinor(1).timestamp(1L).build();
        Transaction t2 = Transaction.builder().from("alice").to("bob").amountMinor(2).timestamp(1L).build();
        assertNotEquals(Merkle.rootOfTransactions(List.of(t1, t2)), Merkle.rootOfTransactions(List.of(t2, t1)));
    }

    private static byte[] concat(byte[] x, byte[] y) {
        byte[] out = new byte[x.length + y.length];
        System.arraycopy(x, 0, out, 0, x.length);
        System.arraycopy(y, 0, out, x.length, y.length);
        return out;
    }
}
