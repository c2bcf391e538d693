package io.vindex.ledger.swap;

import io.vindex.ledger.protocol.SwapOrder;
import io.vindex.ledger.state.Ledger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

class SwapBookTest {

    private SwapBook book;
    private Ledger ledger;

    @BeforeEach
    void setUp() {
        book = new SwapBook();
        ledger = new Ledger();
        ledger.createAccount("alice", 100_000);
        assertTrue(book.createPair("VDX", "USDV", 1_000_000, 1_000_000));
    }

    @Test
    void pairKeyIsOrderIndependent() {
        assertEquals("USDV-VDX", SwapBook.pairKey("VDX", "USDV"));
        assertEquals("USDV-VDX", SwapBook.pairKey("USDV", "VDX"));
        assertTrue(book.getPair("USDV", "VDX").isPresent());
    }

    @Test
    void createPairRejectsDuplicatesAndBadInput() {
        assertFalse(book.createPair("USDV", "VDX", 5, 5));
        assertFalse(book.createPair("ABC", "ABC", 5, 5));
        assertFalse(book.createPair("ABC", "XYZ", 0, 5));
        assertTrue(book.createPair("ABC", "XYZ", 1_000_000, 4_000_000));
        assertEquals(2_000_000L, book.getPair("ABC", "XYZ").orElseThrow().totalLiquidity());
        assertEquals(2, book.pairs().size());
    }

    @Test
    void quoteAppliesFeeThenConstantProduct() {
        SwapPair pair = book.getPair("VDX", "USDV").orElseThrow();
        assertEquals(9_871L, SwapBook.quote(pair, "VDX", 10_000));
        assertEquals(30, pair.feeBps());
    }

    @Test
    void nativeInputSwapMovesBalancesAndReserves() {
        OptionalLong out = book.execute(ledger, "alice", new SwapOrder("VDX", "USDV", 9_000), 10_000, 100);

        assertEquals(9_871L, out.orElseThrow());
        assertEquals(89_900L, ledger.getBalance("alice"));
        assertEquals(9_871L, ledger.getTokenBalance("alice", "USDV"));
        SwapPair pair = book.getPair("VDX", "USDV").orElseThrow();
        assertEquals(1_010_000L, pair.reserveOf("VDX"));
        assertEquals(990_129L, pair.reserveOf("USDV"));
    }

    @Test
    void tokenInputSwapPaysFeeInNative() {
        book.execute(ledger, "alice", new SwapOrder("VDX", "USDV", 0), 10_000, 100);

        OptionalLong out = book.execute(ledger, "alice", new SwapOrder("USDV", "VDX", 0), 5_000, 100);

        assertEquals(5_059L, out.orElseThrow());
        assertEquals(4_871L, ledger.getTokenBalance("alice", "USDV"));
        assertEquals(89_900L - 100 + 5_059L, ledger.getBalance("alice"));
    }

    @Test
    void slippageGuardLeavesStateUntouched() {
        OptionalLong out = book.execute(ledger, "alice", new SwapOrder("VDX", "USDV", 9_872), 10_000, 100);

        assertTrue(out.isEmpty());
        assertEquals(100_000L, ledger.getBalance("alice"));
        assertEquals(0L, ledger.getTokenBalance("alice", "USDV"));
        assertEquals(1_000_000L, book.getPair("VDX", "USDV").orElseThrow().reserveA());
    }

    @Test
    void failsOnUnknownPairOrShortFunds() {
        assertTrue(book.execute(ledger, "alice", new SwapOrder("VDX", "BTC", 0), 10, 1).isEmpty());
        assertTrue(book.execute(ledger, "alice", new SwapOrder("VDX", "USDV", 0), 100_000, 1).isEmpty());
        assertTrue(book.execute(ledger, "alice", new SwapOrder("USDV", "VDX", 0), 10, 1).isEmpty());
        assertEquals(100_000L, ledger.getBalance("alice"));
    }
}
