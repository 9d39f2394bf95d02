package io.validator.core.node;

import io.validator.core.execution.ExecutionScheduler;
import io.validator.core.execution.PendingCertificate;
import io.validator.core.mempool.TxValidator;
import io.validator.core.protocol.BalanceSettlement;
import io.validator.core.state.AccumulatorStore;
import io.validator.core.state.FundsReader;
import io.validator.core.state.InMemoryAccumulatorStore;
import io.validator.core.state.RocksDBAccumulatorStore;
import io.validator.core.withdraw.BalanceWithdrawScheduler;
import io.validator.core.withdraw.EagerBalanceWithdrawScheduler;
import io.validator.core.withdraw.NaiveBalanceWithdrawScheduler;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wires the accumulator store, the withdraw scheduler, the execution driver
 * and the signing-time validator. Certificates whose balance check resolved
 * land in {@link #readyCertificates()}.
 */
public final class ValidatorNode {
    private static final Logger LOG = Logger.getLogger(ValidatorNode.class.getName());

    private final AccumulatorStore store;
    private final SchedulerConfig config;
    private final BalanceWithdrawScheduler withdrawScheduler;
    private final ExecutionScheduler executionScheduler;
    private final TxValidator validator;
    private final BlockingQueue<PendingCertificate> ready = new LinkedBlockingQueue<>();

    public ValidatorNode(AccumulatorStore store, SchedulerConfig config) {
        this.store = store;
        this.config = config;
        this.withdrawScheduler = newScheduler(config, store, store.rootVersion());
        this.executionScheduler = new ExecutionScheduler(withdrawScheduler, ready::add);
        this.validator = new TxValidator(store);
    }

    /** Convenience factory for an in-memory local node. */
    public static ValidatorNode inMemory(SchedulerConfig config) {
        return new ValidatorNode(new InMemoryAccumulatorStore(), config);
    }

    /** Convenience factory for a RocksDB-backed node. */
    public static ValidatorNode rocks(SchedulerConfig config, String dataDir) {
        return new ValidatorNode(RocksDBAccumulatorStore.open(dataDir), config);
    }

    public static BalanceWithdrawScheduler newScheduler(SchedulerConfig config, FundsReader reader, long startingVersion) {
        switch (config.mode) {
            case NAIVE:
                return new NaiveBalanceWithdrawScheduler(reader, startingVersion, config.readerThreads);
            case EAGER:
                return new EagerBalanceWithdrawScheduler(reader, startingVersion, config.readerThreads,
                        config.maxCachedAccounts, config.applySettlementDeltas);
            default:
                throw new IllegalArgumentException("Unsupported scheduler mode " + config.mode);
        }
    }

    /** Seed genesis balances if the store is empty. Safe to call multiple times. */
    public void start() {
        if (AccumulatorGenesis.initIfNeeded(store, config.genesisAllocations)) {
            LOG.info("Seeded " + config.genesisAllocations.size() + " genesis accumulator balances");
        }
        LOG.info("Validator node started (" + config.mode + " scheduler, accumulator version " + store.rootVersion() + ")");
    }

    /** Commit a settlement to storage, then let the scheduler advance. */
    public void settle(BalanceSettlement settlement) {
        store.applyBalanceChanges(settlement);
        executionScheduler.settleBalances(settlement);
    }

    /** Stop the scheduler and close underlying resources if any (e.g., RocksDB). */
    public void close() {
        withdrawScheduler.close();
        try {
            if (store instanceof AutoCloseable) {
                ((AutoCloseable) store).close();
            }
        } catch (Exception e) {
            LOG.log(Level.WARNING, "Failed to close accumulator store", e);
        }
    }

    public AccumulatorStore store() { return store; }
    public BalanceWithdrawScheduler withdrawScheduler() { return withdrawScheduler; }
    public ExecutionScheduler executionScheduler() { return executionScheduler; }
    public TxValidator validator() { return validator; }
    public BlockingQueue<PendingCertificate> readyCertificates() { return ready; }
    public SchedulerConfig config() { return config; }
}
