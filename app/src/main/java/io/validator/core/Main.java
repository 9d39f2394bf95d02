package io.validator.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.validator.core.execution.PendingCertificate;
import io.validator.core.execution.WithdrawCertificate;
import io.validator.core.metrics.SchedulerMetrics;
import io.validator.core.node.AccumulatorGenesis;
import io.validator.core.node.SchedulerConfig;
import io.validator.core.node.SchedulerMode;
import io.validator.core.node.ValidatorNode;
import io.validator.core.protocol.BalanceSettlement;
import io.validator.core.protocol.BalanceWithdraw;
import io.validator.core.protocol.ObjectId;
import io.validator.core.protocol.TxDigest;
import io.validator.core.rpc.MetricsServer;
import io.validator.core.state.InsufficientFundsException;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;
import java.util.stream.Stream;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper();

    public static void main(String[] args) throws Exception {
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        SchedulerConfig config = SchedulerConfig.defaultLocal()
                .withMode(options.mode())
                .withReaderThreads(options.readerThreads())
                .withMaxCachedAccounts(options.maxCachedAccounts())
                .withSettlementDeltas(options.applySettlementDeltas());

        ValidatorNode node;
        if (options.inMemory()) {
            node = ValidatorNode.inMemory(config);
        } else {
            Path dataPath = options.dataDir().toAbsolutePath().normalize();
            if (options.resetState()) {
                resetState(dataPath);
            }
            Files.createDirectories(dataPath);

            Path allocFile = dataPath.resolve("genesis-alloc.json");
            Map<String, Long> allocations = loadAllocations(allocFile);
            if (allocations == null) {
                allocations = config.genesisAllocations;
                saveAllocations(allocFile, allocations);
            }
            config = config.withGenesisAllocations(allocations);
            node = ValidatorNode.rocks(config, dataPath.resolve("accumulators").toString());
        }

        MetricsServer metricsServer = null;
        try {
            node.start();

            if (options.enableMetrics()) {
                metricsServer = new MetricsServer(options.metricsBind(), options.metricsPort());
                metricsServer.start();
            }

            if (options.demo()) {
                runDemoFlow(node);
            } else {
                LOG.info("Demo flow disabled (--no-demo)");
            }

            if (options.keepAlive()) {
                CountDownLatch shutdownLatch = new CountDownLatch(1);
                Runtime.getRuntime().addShutdownHook(new Thread(shutdownLatch::countDown, "java-validator-shutdown"));
                LOG.info("Node running. Press CTRL+C to exit.");
                shutdownLatch.await();
            }
        } finally {
            if (metricsServer != null) {
                metricsServer.stop();
            }
            node.close();
        }
    }

    private static void runDemoFlow(ValidatorNode node) throws Exception {
        String coin = "0x2::sui::SUI";
        ObjectId alice = ObjectId.forBalance("alice", coin);
        ObjectId bob = ObjectId.forBalance("bob", coin);
        long version = node.store().rootVersion();

        BalanceWithdraw big = BalanceWithdraw.builder().txDigest(demoDigest("alice-700k")).atMost(alice, 700_000L).build();
        BalanceWithdraw second = BalanceWithdraw.builder().txDigest(demoDigest("alice-400k")).atMost(alice, 400_000L).build();
        BalanceWithdraw sweep = BalanceWithdraw.builder().txDigest(demoDigest("bob-sweep")).entireBalance(bob).build();

        for (BalanceWithdraw withdraw : List.of(big, second, sweep)) {
            try {
                node.validator().validate(withdraw);
            } catch (InsufficientFundsException e) {
                LOG.warning("Signing-time check rejected " + withdraw.txDigest() + ": " + e.getMessage());
            }
        }

        node.executionScheduler().scheduleBalanceWithdraws(List.of(
                new WithdrawCertificate(big, version),
                new WithdrawCertificate(second, version),
                new WithdrawCertificate(sweep, version)
        )).get(5, TimeUnit.SECONDS);
        drainReady(node);

        TreeMap<ObjectId, BigInteger> changes = new TreeMap<>();
        changes.put(alice, BigInteger.valueOf(-700_000L));
        changes.put(bob, node.store().latestAccountAmount(bob).balance().negate());
        node.settle(new BalanceSettlement(version + 1, changes));
        LOG.info("Settled accumulator to version " + node.store().rootVersion()
                + ": alice=" + node.store().latestAccountAmount(alice).balance()
                + " bob=" + node.store().latestAccountAmount(bob).balance());

        BalanceWithdraw late = BalanceWithdraw.builder().txDigest(demoDigest("alice-late")).atMost(alice, 1L).build();
        node.executionScheduler().scheduleBalanceWithdraws(List.of(new WithdrawCertificate(late, version)))
                .get(5, TimeUnit.SECONDS);
        drainReady(node);

        LOG.info("=== Metrics ===\n" + SchedulerMetrics.scrapeMetrics());
    }

    private static void drainReady(ValidatorNode node) {
        PendingCertificate pending;
        while ((pending = node.readyCertificates().poll()) != null) {
            LOG.info("Ready for execution: " + pending);
        }
    }

    private static TxDigest demoDigest(String label) {
        return TxDigest.of(label.getBytes(StandardCharsets.UTF_8));
    }

    private static Map<String, Long> loadAllocations(Path path) {
        if (!Files.exists(path)) {
            return null;
        }
        try {
            Map<String, Long> allocations = JSON.readValue(path.toFile(), new TypeReference<Map<String, Long>>() {});
            for (String key : allocations.keySet()) {
                AccumulatorGenesis.accountId(key);
            }
            return allocations;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read genesis allocations from " + path, e);
        }
    }

    private static void saveAllocations(Path path, Map<String, Long> allocations) {
        try {
            Files.createDirectories(path.getParent());
            JSON.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), allocations);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to persist genesis allocations to " + path, e);
        }
    }

    private static void resetState(Path dataPath) {
        if (!Files.exists(dataPath)) {
            return;
        }
        Path allocFile = dataPath.resolve("genesis-alloc.json").normalize();
        try (Stream<Path> stream = Files.walk(dataPath)) {
            stream.sorted(Comparator.reverseOrder())
                    .filter(path -> !path.equals(dataPath))
                    .filter(path -> !path.normalize().equals(allocFile))
                    .forEach(path -> {
                        try {
                            Files.deleteIfExists(path);
                        } catch (IOException e) {
                            throw new IllegalStateException("Failed to delete " + path, e);
                        }
                    });
        } catch (IOException e) {
            throw new IllegalStateException("Failed to reset accumulator data in " + dataPath, e);
        }
        LOG.info("Cleared accumulator data under " + dataPath + " (genesis allocations preserved).");
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path dataDir,
            boolean inMemory,
            boolean resetState,
            SchedulerMode mode,
            int readerThreads,
            int maxCachedAccounts,
            boolean applySettlementDeltas,
            boolean keepAlive,
            boolean demo,
            boolean enableMetrics,
            String metricsBind,
            int metricsPort
    ) {
        static CliOptions parse(String[] args) {
            SchedulerConfig defaults = SchedulerConfig.defaultLocal();
            Path dataDir = envPath("JAVA_VALIDATOR_DATA_DIR", Path.of("./data/validator"));
            boolean inMemory = false;
            boolean reset = false;
            SchedulerMode mode = defaults.mode;
            int readerThreads = defaults.readerThreads;
            int maxCachedAccounts = defaults.maxCachedAccounts;
            boolean deltas = defaults.applySettlementDeltas;
            boolean keepAlive = "true".equalsIgnoreCase(System.getenv("JAVA_VALIDATOR_KEEP_ALIVE"));
            boolean demo = true;
            boolean enableMetrics = "true".equalsIgnoreCase(System.getenv("JAVA_VALIDATOR_ENABLE_METRICS"));
            String metricsBind = envOrDefault("JAVA_VALIDATOR_METRICS_BIND", "127.0.0.1");
            int metricsPort = 9184;
            boolean showHelp = false;
            String error = null;

            try {
                metricsPort = envPort("JAVA_VALIDATOR_METRICS_PORT", metricsPort);
                String modeEnv = System.getenv("JAVA_VALIDATOR_SCHEDULER");
                if (modeEnv != null && !modeEnv.isBlank()) {
                    mode = SchedulerMode.parse(modeEnv);
                }
            } catch (IllegalArgumentException ex) {
                showHelp = true;
                error = ex.getMessage();
            }

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    try {
                        if ("--help".equals(arg) || "-h".equals(arg)) {
                            showHelp = true;
                        } else if (arg.startsWith("--data-dir=")) {
                            dataDir = Path.of(arg.substring("--data-dir=".length()));
                        } else if (arg.equals("--in-memory")) {
                            inMemory = true;
                        } else if (arg.equals("--reset-state")) {
                            reset = true;
                        } else if (arg.startsWith("--scheduler=")) {
                            mode = SchedulerMode.parse(arg.substring("--scheduler=".length()));
                        } else if (arg.startsWith("--reader-threads=")) {
                            readerThreads = parsePositiveInt(arg.substring("--reader-threads=".length()), "--reader-threads");
                        } else if (arg.startsWith("--max-cached-accounts=")) {
                            maxCachedAccounts = parsePositiveInt(arg.substring("--max-cached-accounts=".length()), "--max-cached-accounts");
                        } else if (arg.equals("--apply-settlement-deltas")) {
                            deltas = true;
                        } else if (arg.equals("--keep-alive")) {
                            keepAlive = true;
                        } else if (arg.equals("--demo")) {
                            demo = true;
                        } else if (arg.equals("--no-demo")) {
                            demo = false;
                        } else if (arg.equals("--enable-metrics")) {
                            enableMetrics = true;
                        } else if (arg.startsWith("--metrics-bind=")) {
                            metricsBind = arg.substring("--metrics-bind=".length());
                        } else if (arg.startsWith("--metrics-port=")) {
                            metricsPort = parsePort(arg.substring("--metrics-port=".length()), "--metrics-port");
                        } else if (!arg.startsWith("--")) {
                            dataDir = Path.of(arg);
                        } else if (error == null) {
                            showHelp = true;
                            error = "Unknown option: " + arg;
                        }
                    } catch (IllegalArgumentException ex) {
                        showHelp = true;
                        if (error == null) {
                            error = ex.getMessage();
                        }
                    }
                }
            }

            keepAlive = keepAlive || enableMetrics;

            return new CliOptions(
                    showHelp,
                    error,
                    dataDir,
                    inMemory,
                    reset,
                    mode,
                    readerThreads,
                    maxCachedAccounts,
                    deltas,
                    keepAlive,
                    demo,
                    enableMetrics,
                    metricsBind,
                    metricsPort
            );
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: java-validator [options]

Options:
  --help, -h                   Show this help message and exit
  --data-dir=<path>            Path for accumulator data (default ./data/validator)
  --in-memory                  Keep accumulator balances in memory only
  --reset-state                Delete accumulator data (genesis allocations are preserved)
  --scheduler=<naive|eager>    Balance withdraw scheduler (default eager)
  --reader-threads=<n>         Threads reading balances from storage (default 4)
  --max-cached-accounts=<n>    Accounts the eager scheduler keeps across settlements (default 100000)
  --apply-settlement-deltas    Eager scheduler adds settlement deltas instead of re-reading storage
  --keep-alive                 Keep the node running until interrupted
  --demo / --no-demo           Enable (default) or disable the demo withdraw flow
  --enable-metrics             Serve metrics at /metrics (default bind 127.0.0.1:9184)
  --metrics-bind=<host>        Bind address for the metrics endpoint
  --metrics-port=<port>        Port for the metrics endpoint (default 9184)

Environment overrides:
  JAVA_VALIDATOR_DATA_DIR        Override --data-dir
  JAVA_VALIDATOR_SCHEDULER       Scheduler mode when --scheduler is not supplied
  JAVA_VALIDATOR_ENABLE_METRICS  Set to "true" to enable metrics without CLI flag
  JAVA_VALIDATOR_METRICS_BIND    Bind address for the metrics endpoint
  JAVA_VALIDATOR_METRICS_PORT    Port for the metrics endpoint
  JAVA_VALIDATOR_KEEP_ALIVE      Set to "true" to force keep-alive mode
""");
        }

        private static Path envPath(String key, Path fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }

        private static String envOrDefault(String key, String fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : value;
        }

        private static int envPort(String key, int fallback) {
            String value = System.getenv(key);
            if (value == null || value.isBlank()) {
                return fallback;
            }
            return parsePort(value, key);
        }

        private static int parsePort(String value, String flag) {
            try {
                int port = Integer.parseInt(value);
                if (port < 0 || port > 65_535) {
                    throw new NumberFormatException();
                }
                return port;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port for " + flag + ": " + value);
            }
        }

        private static int parsePositiveInt(String value, String flag) {
            try {
                int parsed = Integer.parseInt(value);
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
