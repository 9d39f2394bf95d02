package io.validator.core;

import io.validator.core.node.SchedulerMode;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainCliOptionsTest {

    @Test
    void parsesDefaults() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {});
        assertFalse(options.showHelp());
        assertNull(options.errorMessage());
        assertFalse(options.inMemory());
        assertFalse(options.applySettlementDeltas());
        assertTrue(options.demo());
        assertEquals(4, options.readerThreads());
        assertEquals(100_000, options.maxCachedAccounts());
    }

    @Test
    void parsesSchedulerAndMetricsFlags() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {
                "--scheduler=naive",
                "--reader-threads=8",
                "--max-cached-accounts=16",
                "--apply-settlement-deltas",
                "--in-memory",
                "--no-demo",
                "--enable-metrics",
                "--metrics-bind=0.0.0.0",
                "--metrics-port=9300",
                "--data-dir=/tmp/validator-test"
        });
        assertFalse(options.showHelp());
        assertEquals(SchedulerMode.NAIVE, options.mode());
        assertEquals(8, options.readerThreads());
        assertEquals(16, options.maxCachedAccounts());
        assertTrue(options.applySettlementDeltas());
        assertTrue(options.inMemory());
        assertFalse(options.demo());
        assertTrue(options.enableMetrics());
        assertTrue(options.keepAlive());
        assertEquals("0.0.0.0", options.metricsBind());
        assertEquals(9300, options.metricsPort());
        assertEquals(Path.of("/tmp/validator-test"), options.dataDir());
    }

    @Test
    void invalidReaderThreadsSetsError() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--reader-threads=0"});
        assertTrue(options.showHelp());
        assertNotNull(options.errorMessage());
        assertTrue(options.errorMessage().contains("--reader-threads"));
    }

    @Test
    void unknownSchedulerSetsError() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--scheduler=lazy"});
        assertTrue(options.showHelp());
        assertEquals("Unknown scheduler mode: lazy", options.errorMessage());
    }

    @Test
    void unknownFlagTriggersHelp() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--unknown-flag"});
        assertTrue(options.showHelp());
        assertEquals("Unknown option: --unknown-flag", options.errorMessage());
    }
}
