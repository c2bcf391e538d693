package io.vindex.ledger.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vindex.ledger.MutableClock;
import io.vindex.ledger.protocol.Amounts;
import io.vindex.ledger.protocol.Transaction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ChainExporterTest {

    private MutableClock clock;
    private Chain chain;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T00:00:00Z"));
        chain = new Chain(ChainConfig.defaultLocal(), clock);
        chain.addTransaction(transfer("mined_to"));
        chain.mineBlock().orElseThrow();
        chain.addTransaction(transfer("pending_to"));
        chain.createSwapPair("VDX", "USDV", Amounts.coins(1_000), Amounts.coins(2_000));
    }

    @Test
    void exportCarriesChainPoolAndSupply() {
        JsonNode json = ChainExporter.toJson(chain.exportChain());

        assertEquals(2, json.get("chain").size());
        JsonNode block = json.get("chain").get(1);
        assertEquals(1, block.get("index").asLong());
        assertEquals(json.get("chain").get(0).get("hash").asText(), block.get("previousHash").asText());
        assertEquals("vindex_genesis_validator_2", block.get("validator").asText());
        assertEquals(1, block.get("transactionCount").asInt());
        assertFalse(block.get("signature").asText().isEmpty());
        assertEquals("mined_to", block.get("transactions").get(0).get("to").asText());
        assertEquals("transfer", block.get("transactions").get(0).get("type").asText());

        assertEquals(1, json.get("pendingTransactions").size());
        assertEquals("pending_to", json.get("pendingTransactions").get(0).get("to").asText());

        assertEquals(Amounts.coins(1_000_000_000L), json.get("totalSupply").asLong());
        assertEquals(chain.getNetworkStats().circulatingSupply(), json.get("circulatingSupply").asLong());
        assertEquals(0L, json.get("burnedTokens").asLong());
        assertEquals("USDV-VDX", json.get("swapPairs").get(0).get("key").asText());
    }

    @Test
    void writesFile(@TempDir Path tmp) throws Exception {
        Path out = tmp.resolve("exports/chain.json");
        ChainExporter.writeTo(chain.exportChain(), out);

        assertTrue(Files.exists(out));
        JsonNode read = new ObjectMapper().readTree(out.toFile());
        assertEquals(2, read.get("chain").size());
    }

    private Transaction transfer(String to) {
        return Transaction.builder()
                .from("vindex_treasury")
                .to(to)
                .amountMinor(Amounts.coins(5))
                .timestamp(clock.millis())
                .build();
    }
}
