package io.vindex.ledger.node;

import io.vindex.ledger.protocol.Block;
import io.vindex.ledger.protocol.Transaction;
import io.vindex.ledger.swap.SwapPair;

import java.util.List;

/** Everything {@link Chain#exportChain()} hands out; rendered to JSON by {@link ChainExporter}. */
public record ChainSnapshot(List<Block> chain,
                            List<Transaction> pendingTransactions,
                            long totalSupply,
                            long circulatingSupply,
                            long burnedTokens,
                            List<SwapPair> swapPairs) {
    public ChainSnapshot {
        chain = List.copyOf(chain);
        pendingTransactions = List.copyOf(pendingTransactions);
        swapPairs = List.copyOf(swapPairs);
    }
}
