package io.vindex.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vindex.ledger.metrics.BlockMetrics;
import io.vindex.ledger.node.AutoMiner;
import io.vindex.ledger.node.Chain;
import io.vindex.ledger.node.ChainConfig;
import io.vindex.ledger.node.ChainExporter;
import io.vindex.ledger.node.NetworkStats;
import io.vindex.ledger.protocol.Amounts;
import io.vindex.ledger.protocol.SwapOrder;
import io.vindex.ledger.protocol.Transaction;
import io.vindex.ledger.protocol.TransactionType;
import io.vindex.ledger.protocol.ValidationResult;
import io.vindex.ledger.protocol.ValidatorTarget;
import io.vindex.ledger.wallet.Wallet;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper();

    public static void main(String[] args) throws Exception {
        configureLogging();
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        ChainConfig config = ChainConfig.defaultLocal();
        if (options.configFile() != null) {
            config = applyConfigFile(config, options.configFile());
        }
        if (options.blockTimeMillis() > 0) {
            config = config.withBlockTime(options.blockTimeMillis());
        }
        if (options.requireSignatures()) {
            config = config.withRequireSignatures(true);
        }

        Chain chain = Chain.inMemory(config);
        AutoMiner miner = null;
        CountDownLatch shutdownLatch = null;
        try {
            if (options.demo()) {
                runDemoFlow(chain);
            } else {
                LOG.info("Demo flow disabled (--no-demo)");
            }

            if (options.keepAlive()) {
                shutdownLatch = new CountDownLatch(1);
                CountDownLatch latchRef = shutdownLatch;
                Runtime.getRuntime().addShutdownHook(new Thread(latchRef::countDown, "vindex-shutdown"));
                miner = AutoMiner.start(chain, Math.min(1_000L, config.blockTimeMillis));
                LOG.info("Node running. Press CTRL+C to exit.");
                shutdownLatch.await();
            } else if (options.demoDurationMillis() > 0) {
                try {
                    Thread.sleep(options.demoDurationMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        } finally {
            if (miner != null) {
                miner.close();
            }
            if (options.exportPath() != null) {
                ChainExporter.writeTo(chain.exportChain(), options.exportPath());
                LOG.info("Blockchain exported with " + chain.getChainLength() + " blocks to " + options.exportPath());
            }
        }
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Could not load logging.properties: " + e.getMessage());
        }
    }

    static ChainConfig applyConfigFile(ChainConfig base, Path file) {
        JsonNode root;
        try {
            root = JSON.readTree(file.toFile());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config from " + file, e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Config file must hold a JSON object: " + file);
        }
        ChainConfig config = base;
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> e = fields.next();
            JsonNode v = e.getValue();
            switch (e.getKey()) {
                case "maxTransactionsPerBlock":
                    config = config.withMaxTransactionsPerBlock(v.asInt());
                    break;
                case "blockTimeMillis":
                    config = config.withBlockTime(v.asLong());
                    break;
                case "requireSignatures":
                    config = config.withRequireSignatures(v.asBoolean());
                    break;
                case "nodeSecret":
                    config = config.withNodeSecret(v.asText());
                    break;
                case "maxValidators":
                    config = config.withStakingParams(config.stakingParams.withMaxValidators(v.asInt()));
                    break;
                case "unstakingPeriodSeconds":
                    config = config.withStakingParams(
                            config.stakingParams.withUnstakingPeriod(Duration.ofSeconds(v.asLong())));
                    break;
                default:
                    throw new IllegalArgumentException("Unknown config key '" + e.getKey() + "' in " + file);
            }
        }
        LOG.info("Loaded config overrides from " + file);
        return config;
    }

    private static void runDemoFlow(Chain chain) {
        Wallet alice = Wallet.generate();
        Wallet bob = Wallet.generate();
        chain.createAccount(alice.getAddress(), Amounts.coins(10_000));
        LOG.info("Alice addr=" + alice.getAddress());
        LOG.info("Bob   addr=" + bob.getAddress());

        String validator = chain.getActiveValidators().get(0).address();
        submit(chain, alice.signTransaction(Transaction.builder()
                .from(alice.getAddress())
                .to(bob.getAddress())
                .amountMinor(Amounts.coins(250))
                .build()));
        submit(chain, alice.signTransaction(Transaction.builder()
                .type(TransactionType.STAKE)
                .from(alice.getAddress())
                .to(validator)
                .amountMinor(Amounts.coins(500))
                .payload(new ValidatorTarget(validator))
                .build()));
        BlockMetrics.recordMining(chain::mineBlock)
                .ifPresent(b -> LOG.info("Block mined at index " + b.index() + " by " + b.validator()));

        if (chain.createSwapPair(Amounts.NATIVE_SYMBOL, "USDV", Amounts.coins(1_000_000), Amounts.coins(500_000))) {
            submit(chain, alice.signTransaction(Transaction.builder()
                    .type(TransactionType.SWAP)
                    .from(alice.getAddress())
                    .to("swap:" + Amounts.NATIVE_SYMBOL + "-USDV")
                    .amountMinor(Amounts.coins(100))
                    .payload(new SwapOrder(Amounts.NATIVE_SYMBOL, "USDV", 0L))
                    .build()));
            BlockMetrics.recordMining(chain::mineBlock)
                    .ifPresent(b -> LOG.info("Block mined at index " + b.index() + " by " + b.validator()));
        }

        LOG.info("Alice balance=" + Amounts.format(chain.getBalance(alice.getAddress())));
        LOG.info("Bob   balance=" + Amounts.format(chain.getBalance(bob.getAddress())));
        NetworkStats stats = chain.getNetworkStats();
        LOG.info("Chain length=" + stats.chainLength() + ", valid=" + chain.isChainValid()
                + ", circulating=" + Amounts.format(stats.circulatingSupply()));
        LOG.info("=== Metrics ===\n" + BlockMetrics.scrapeMetrics());
    }

    private static void submit(Chain chain, Transaction tx) {
        ValidationResult result = chain.submit(tx);
        if (result.isOk()) {
            LOG.info("Tx " + tx.type().wireName() + " added to pool");
        } else {
            LOG.warning("Tx rejected: " + result);
        }
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path configFile,
            boolean keepAlive,
            boolean demo,
            long demoDurationMillis,
            long blockTimeMillis,
            Path exportPath,
            boolean requireSignatures
    ) {
        static CliOptions parse(String[] args) {
            Path configFile = envPath("VINDEX_CONFIG", null);
            boolean keepAlive = "true".equalsIgnoreCase(System.getenv("VINDEX_KEEP_ALIVE"));
            boolean demo = true;
            long demoDurationMillis = 0L;
            long blockTimeMillis = -1L;
            Path exportPath = envPath("VINDEX_EXPORT_PATH", null);
            boolean requireSignatures = "true".equalsIgnoreCase(System.getenv("VINDEX_REQUIRE_SIGNATURES"));
            boolean showHelp = false;
            String error = null;

            String blockTimeEnv = System.getenv("VINDEX_BLOCK_TIME_MS");
            if (blockTimeEnv != null && !blockTimeEnv.isBlank()) {
                try {
                    blockTimeMillis = parsePositiveLong(blockTimeEnv, "VINDEX_BLOCK_TIME_MS");
                } catch (IllegalArgumentException ex) {
                    showHelp = true;
                    error = ex.getMessage();
                }
            }

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    if ("--help".equals(arg) || "-h".equals(arg)) {
                        showHelp = true;
                    } else if (arg.startsWith("--config=")) {
                        configFile = Path.of(arg.substring("--config=".length()));
                    } else if (arg.equals("--keep-alive")) {
                        keepAlive = true;
                    } else if (arg.equals("--demo")) {
                        demo = true;
                    } else if (arg.equals("--no-demo")) {
                        demo = false;
                    } else if (arg.startsWith("--demo-duration-ms=")) {
                        try {
                            demoDurationMillis = parsePositiveLong(arg.substring("--demo-duration-ms=".length()), "--demo-duration-ms");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--block-time-ms=")) {
                        try {
                            blockTimeMillis = parsePositiveLong(arg.substring("--block-time-ms=".length()), "--block-time-ms");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--export=")) {
                        exportPath = Path.of(arg.substring("--export=".length()));
                    } else if (arg.equals("--require-signatures")) {
                        requireSignatures = true;
                    } else if (error == null) {
                        showHelp = true;
                        error = "Unknown option: " + arg;
                    }
                }
            }

            if (configFile != null && !Files.exists(configFile) && error == null) {
                showHelp = true;
                error = "Config file not found: " + configFile;
            }

            return new CliOptions(
                    showHelp,
                    error,
                    configFile,
                    keepAlive,
                    demo,
                    demoDurationMillis,
                    blockTimeMillis,
                    exportPath,
                    requireSignatures
            );
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: vindex-ledger [options]

Options:
  --help, -h                 Show this help message and exit
  --config=<file>            JSON file with config overrides
  --keep-alive               Keep the node running (auto-mining) until interrupted
  --demo / --no-demo         Enable (default) or disable the demo transaction flow
  --demo-duration-ms=<ms>    How long to keep the JVM alive when not using --keep-alive (default 0)
  --block-time-ms=<ms>       Target block time for auto-mining (default 10000)
  --export=<file>            Write a JSON chain export on shutdown
  --require-signatures       Reject unsigned transactions

Environment overrides:
  VINDEX_CONFIG              Override --config
  VINDEX_KEEP_ALIVE          Set to "true" to force keep-alive mode
  VINDEX_BLOCK_TIME_MS       Override the block time
  VINDEX_EXPORT_PATH         Override --export
  VINDEX_REQUIRE_SIGNATURES  Set to "true" to reject unsigned transactions
""");
        }

        private static Path envPath(String key, Path fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }

        private static long parsePositiveLong(String value, String flag) {
            try {
                long parsed = Long.parseLong(value);
                if (parsed <= 0) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }
    }
}
