package io.vindex.ledger;

import io.vindex.ledger.node.ChainConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MainCliOptionsTest {

    @TempDir
    Path tmp;

    @Test
    void parsesDefaults() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {});
        assertFalse(options.showHelp());
        assertNull(options.errorMessage());
        assertTrue(options.demo());
        assertEquals(0L, options.demoDurationMillis());
    }

    @Test
    void parsesFlags() throws Exception {
        Path config = Files.writeString(tmp.resolve("node.json"), "{}");
        Main.CliOptions options = Main.CliOptions.parse(new String[] {
                "--config=" + config,
                "--no-demo",
                "--keep-alive",
                "--block-time-ms=2500",
                "--demo-duration-ms=1000",
                "--export=" + tmp.resolve("out.json"),
                "--require-signatures"
        });
        assertFalse(options.showHelp());
        assertNull(options.errorMessage());
        assertEquals(config, options.configFile());
        assertFalse(options.demo());
        assertTrue(options.keepAlive());
        assertEquals(2500L, options.blockTimeMillis());
        assertEquals(1000L, options.demoDurationMillis());
        assertEquals(tmp.resolve("out.json"), options.exportPath());
        assertTrue(options.requireSignatures());
    }

    @Test
    void helpFlag() {
        assertTrue(Main.CliOptions.parse(new String[] {"-h"}).showHelp());
        assertTrue(Main.CliOptions.parse(new String[] {"--help"}).showHelp());
    }

    @Test
    void invalidDemoDurationSetsError() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--demo-duration-ms=-1"});
        assertTrue(options.showHelp());
        assertNotNull(options.errorMessage());
        assertTrue(options.errorMessage().contains("--demo-duration-ms"));
    }

    @Test
    void invalidBlockTimeSetsError() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--block-time-ms=soon"});
        assertTrue(options.showHelp());
        assertTrue(options.errorMessage().contains("--block-time-ms"));
    }

    @Test
    void unknownFlagTriggersHelp() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--unknown-flag"});
        assertTrue(options.showHelp());
        assertEquals("Unknown option: --unknown-flag", options.errorMessage());
    }

    @Test
    void missingConfigFileTriggersHelp() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--config=" + tmp.resolve("absent.json")});
        assertTrue(options.showHelp());
        assertTrue(options.errorMessage().startsWith("Config file not found"));
    }

    @Test
    void configFileOverridesDefaults() throws Exception {
        Path file = Files.writeString(tmp.resolve("node.json"),
                "{\"maxTransactionsPerBlock\": 50, \"blockTimeMillis\": 2000, \"requireSignatures\": true,"
                        + " \"nodeSecret\": \"other\", \"maxValidators\": 5, \"unstakingPeriodSeconds\": 60}");

        ChainConfig config = Main.applyConfigFile(ChainConfig.defaultLocal(), file);

        assertEquals(50, config.maxTransactionsPerBlock);
        assertEquals(2000L, config.blockTimeMillis);
        assertTrue(config.requireSignatures);
        assertEquals("other", config.nodeSecret);
        assertEquals(5, config.stakingParams.maxValidators());
        assertEquals(Duration.ofSeconds(60), config.stakingParams.unstakingPeriod());
    }

    @Test
    void configFileRejectsUnknownKey() throws Exception {
        Path file = Files.writeString(tmp.resolve("bad.json"), "{\"difficulty\": 4}");
        assertThrows(IllegalArgumentException.class, () -> Main.applyConfigFile(ChainConfig.defaultLocal(), file));
    }
}
