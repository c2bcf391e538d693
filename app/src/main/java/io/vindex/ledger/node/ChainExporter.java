package io.vindex.ledger.node;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vindex.ledger.protocol.Block;
import io.vindex.ledger.protocol.BlockHeader;
import io.vindex.ledger.protocol.Hashes;
import io.vindex.ledger.protocol.SwapOrder;
import io.vindex.ledger.protocol.Transaction;
import io.vindex.ledger.swap.SwapPair;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Renders a {@link ChainSnapshot} as JSON. */
public final class ChainExporter {
    private static final ObjectMapper JSON = new ObjectMapper();

    private ChainExporter() {}

    public static ObjectNode toJson(ChainSnapshot snapshot) {
        ObjectNode root = JSON.createObjectNode();
        ArrayNode chain = root.putArray("chain");
        for (Block block : snapshot.chain()) {
            chain.add(blockJson(block));
        }
        ArrayNode pending = root.putArray("pendingTransactions");
        for (Transaction tx : snapshot.pendingTransactions()) {
            pending.add(txJson(tx));
        }
        root.put("totalSupply", snapshot.totalSupply());
        root.put("circulatingSupply", snapshot.circulatingSupply());
        root.put("burnedTokens", snapshot.burnedTokens());
        ArrayNode pairs = root.putArray("swapPairs");
        for (SwapPair pair : snapshot.swapPairs()) {
            ObjectNode p = pairs.addObject();
            p.put("key", pair.key());
            p.put("tokenA", pair.tokenA());
            p.put("tokenB", pair.tokenB());
            p.put("reserveA", pair.reserveA());
            p.put("reserveB", pair.reserveB());
            p.put("feeBps", pair.feeBps());
            p.put("totalLiquidity", pair.totalLiquidity());
        }
        return root;
    }

    public static String toJsonString(ChainSnapshot snapshot) {
        try {
            return JSON.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(snapshot));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to render chain export", e);
        }
    }

    public static void writeTo(ChainSnapshot snapshot, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            JSON.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), toJson(snapshot));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write chain export to " + path, e);
        }
    }

    private static ObjectNode blockJson(Block block) {
        BlockHeader hdr = block.header();
        ObjectNode b = JSON.createObjectNode();
        b.put("index", hdr.index());
        b.put("timestamp", hdr.timestamp());
        b.put("previousHash", hdr.previousHash());
        b.put("hash", block.hash());
        b.put("nonce", hdr.nonce());
        b.put("validator", hdr.validator());
        b.put("signature", Hashes.toHex(block.signature()));
        b.put("merkleRoot", hdr.merkleRoot());
        b.put("stateRoot", hdr.stateRoot());
        b.put("transactionCount", hdr.transactionCount());
        b.put("totalFees", hdr.totalFees());
        b.put("blockReward", hdr.reward());
        ArrayNode txs = b.putArray("transactions");
        for (Transaction tx : block.transactions()) {
            txs.add(txJson(tx));
        }
        return b;
    }

    private static ObjectNode txJson(Transaction tx) {
        ObjectNode t = JSON.createObjectNode();
        t.put("id", tx.id());
        t.put("type", tx.type().wireName());
        t.put("from", tx.from());
        t.put("to", tx.to());
        t.put("amount", tx.amountMinor());
        t.put("fee", tx.feeMinor());
        t.put("timestamp", tx.timestamp());
        t.put("signature", Hashes.toHex(tx.signature()));
        SwapOrder order = tx.swapOrder();
        if (order != null) {
            ObjectNode data = t.putObject("data");
            data.put("tokenIn", order.tokenIn());
            data.put("tokenOut", order.tokenOut());
            data.put("minAmountOut", order.minAmountOut());
        } else if (tx.type().allowsSelfTarget()) {
            t.putObject("data").put("validator", tx.targetValidator());
        }
        return t;
    }
}
