package io.validator.core.withdraw;

import io.validator.core.metrics.SchedulerMetrics;
import io.validator.core.protocol.BalanceSettlement;
import io.validator.core.protocol.BalanceWithdraw;
import io.validator.core.protocol.ObjectId;
import io.validator.core.state.AccountAmount;
import io.validator.core.state.FundsReadException;
import io.validator.core.state.FundsReader;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides, per transaction, whether its balance withdrawals are guaranteed to
 * be funded at the accumulator version the transaction was assigned.
 *
 * <p>Withdrawals arrive in batches tagged with an accumulator version and are
 * admitted once the scheduler has settled up to that version. Batches for
 * older versions resolve to {@link ScheduleStatus#ALREADY_EXECUTED}; batches
 * for newer versions wait for the settlement that reaches them.
 *
 * <p>Admission of a batch runs in two steps. When the batch is accepted it
 * takes a turn on every account it references and starts the storage reads
 * it needs; no scheduler-wide lock is held while those reads are pending.
 * Once its reads are done and every earlier batch on the same accounts has
 * finished, the batch reserves in memory. Batches on the same account are
 * therefore decided in submission order while batches on unrelated accounts
 * never wait for each other.
 *
 * <p>The in-memory reservation step holds the read side of a scheduler-wide
 * lock and locks each transaction's accounts in {@link ObjectId} order.
 * Settlements read storage first and then take the write side only to update
 * cached state, so they never interleave with a transaction's reservation. A
 * batch whose version was settled past while its reads were pending resolves
 * to {@link ScheduleStatus#ALREADY_EXECUTED}. Result futures are completed
 * after all locks are released.
 *
 * <p>Subclasses decide where {@link AccountState}s come from and how a
 * settlement updates them.
 */
public abstract class BalanceWithdrawScheduler implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(BalanceWithdrawScheduler.class.getName());

    private final String name;
    private final FundsReader reader;
    private final ExecutorService readerPool;
    private final ExecutorService admissionPool;
    private final Executor admissionExecutor;
    private final ReentrantReadWriteLock settlementLock = new ReentrantReadWriteLock(true);
    private final ReentrantLock settlementOrder = new ReentrantLock();

    /** version -> batches waiting for the scheduler to reach it; guarded by itself */
    private final TreeMap<Long, List<PendingBatch>> parked = new TreeMap<>();
    /** account -> turn of the last batch sequenced on it; guarded by itself */
    private final Map<ObjectId, CompletableFuture<Void>> turns = new HashMap<>();
    private final Set<PendingBatch> inFlight = ConcurrentHashMap.newKeySet();

    private volatile long accumulatorVersion;
    private volatile boolean closed;

    protected BalanceWithdrawScheduler(String name, FundsReader reader, long startingVersion, int readerThreads) {
        if (reader == null) {
            throw new IllegalArgumentException("FundsReader required");
        }
        if (readerThreads <= 0) {
            throw new IllegalArgumentException("readerThreads must be > 0");
        }
        if (startingVersion < 0) {
            throw new IllegalArgumentException("startingVersion must be >= 0");
        }
        this.name = name;
        this.reader = reader;
        this.accumulatorVersion = startingVersion;
        this.readerPool = Executors.newFixedThreadPool(readerThreads, daemonThreads("reader"));
        this.admissionPool = Executors.newCachedThreadPool(daemonThreads("admission"));
        this.admissionExecutor = task -> {
            try {
                admissionPool.execute(task);
            } catch (RejectedExecutionException stopped) {
                // after close(): the task only observes the closed flag
                task.run();
            }
        };
        LOG.info(() -> "Created " + name + " balance withdraw scheduler at accumulator version " + startingVersion);
    }

    private ThreadFactory daemonThreads(String role) {
        AtomicInteger threadIds = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "withdraw-" + name + "-" + role + "-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Schedule the withdrawals of transactions assigned accumulator version {@code version}.
     * Never waits for storage; the returned futures complete once the batch is decided.
     *
     * @return one future per withdraw, in the same order
     */
    public List<CompletableFuture<ScheduleResult>> scheduleWithdraws(long version, List<BalanceWithdraw> withdraws) {
        if (withdraws == null) {
            throw new IllegalArgumentException("withdraws required");
        }
        List<CompletableFuture<ScheduleResult>> futures = new ArrayList<>(withdraws.size());
        for (BalanceWithdraw withdraw : withdraws) {
            if (withdraw == null) {
                throw new IllegalArgumentException("null withdraw in batch");
            }
            futures.add(new CompletableFuture<>());
        }
        PendingBatch batch = new PendingBatch(version, withdraws, futures);

        List<Completion> done = new ArrayList<>();
        List<PendingBatch> ready = new ArrayList<>(1);
        settlementLock.readLock().lock();
        try {
            long current = accumulatorVersion;
            if (closed) {
                failAll(futures, done);
            } else if (version < current) {
                resolveAlreadyExecuted(batch, done);
            } else if (version == current) {
                sequence(batch);
                ready.add(batch);
            } else {
                synchronized (parked) {
                    parked.computeIfAbsent(version, v -> new ArrayList<>()).add(batch);
                }
                LOG.fine(() -> name + ": parked " + withdraws.size() + " withdraws for version " + version
                        + " (settled up to " + current + ")");
            }
        } finally {
            settlementLock.readLock().unlock();
        }
        complete(done);
        startAdmissions(ready);
        return Collections.unmodifiableList(futures);
    }

    /**
     * Advance to {@code settlement.nextAccumulatorVersion()}. Settlements that do
     * not advance the version are ignored, so redelivery is harmless.
     */
    public void settleBalances(BalanceSettlement settlement) {
        if (settlement == null) {
            throw new IllegalArgumentException("settlement required");
        }
        List<Completion> done = new ArrayList<>();
        List<PendingBatch> ready = new ArrayList<>();
        settlementOrder.lock();
        try {
            long previous = accumulatorVersion;
            long next = settlement.nextAccumulatorVersion();
            if (closed) {
                LOG.warning(name + ": ignoring " + settlement + " after shutdown");
                return;
            }
            if (next <= previous) {
                SchedulerMetrics.settlementIgnored(name);
                LOG.warning(name + ": ignoring stale " + settlement + " (settled up to " + previous + ")");
                return;
            }
            Map<ObjectId, BigInteger> rederived = rederive(settlement);

            settlementLock.writeLock().lock();
            try {
                if (closed) {
                    return;
                }
                onSettlement(previous, settlement, rederived);
                accumulatorVersion = next;
                SchedulerMetrics.settlementApplied(name);
                LOG.fine(() -> name + ": settled accumulator " + previous + " -> " + next);

                List<PendingBatch> reached;
                synchronized (parked) {
                    NavigableMap<Long, List<PendingBatch>> skipped = parked.headMap(next, false);
                    for (List<PendingBatch> batches : skipped.values()) {
                        for (PendingBatch batch : batches) {
                            resolveAlreadyExecuted(batch, done);
                        }
                    }
                    skipped.clear();
                    reached = parked.remove(next);
                }
                if (reached != null) {
                    // sequenced before the lock is released, so ahead of any batch submitted at this version later
                    for (PendingBatch batch : reached) {
                        sequence(batch);
                        ready.add(batch);
                    }
                }
            } finally {
                settlementLock.writeLock().unlock();
            }
        } finally {
            settlementOrder.unlock();
            complete(done);
        }
        startAdmissions(ready);
    }

    /** The accumulator version this scheduler has settled up to. */
    public long accumulatorVersion() {
        return accumulatorVersion;
    }

    public String name() {
        return name;
    }

    /** Fails every parked or undecided withdraw and rejects later submissions. */
    @Override
    public void close() {
        List<Completion> done = new ArrayList<>();
        settlementLock.writeLock().lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            synchronized (parked) {
                for (List<PendingBatch> batches : parked.values()) {
                    for (PendingBatch batch : batches) {
                        failAll(batch.futures, done);
                    }
                }
                parked.clear();
            }
            for (PendingBatch batch : inFlight) {
                failAll(batch.futures, done);
            }
            inFlight.clear();
        } finally {
            settlementLock.writeLock().unlock();
            complete(done);
        }
        readerPool.shutdownNow();
        admissionPool.shutdown();
        LOG.info(() -> "Stopped " + name + " balance withdraw scheduler at version " + accumulatorVersion);
    }

    // -------------------- subclass hooks --------------------

    /**
     * Start whatever storage read {@code account} needs before a batch can be
     * admitted, or return {@code null} if its state is already at hand. Called
     * while the batch is sequenced; must not block.
     */
    protected abstract CompletableFuture<AccountAmount> fetch(ObjectId account);

    /**
     * The state to reserve against, given the result of {@link #fetch}
     * ({@code null} if nothing was fetched). Called under the shared lock with
     * the scheduler still at the batch's version.
     */
    protected abstract AccountState resolve(ObjectId account, AccountAmount fetched);

    /**
     * Storage reads a settlement needs, keyed by account. Issued before the
     * exclusive lock is taken; the default needs none.
     */
    protected Map<ObjectId, CompletableFuture<BigInteger>> prepareSettlement(BalanceSettlement settlement) {
        return Collections.emptyMap();
    }

    /**
     * Bring cached state in line with a settlement; called under the exclusive
     * lock. {@code rederived} holds the successful reads from
     * {@link #prepareSettlement}; failed reads are absent.
     */
    protected abstract void onSettlement(long previousVersion, BalanceSettlement settlement,
                                         Map<ObjectId, BigInteger> rederived);

    protected final CompletableFuture<AccountAmount> readLatest(ObjectId account) {
        return CompletableFuture.supplyAsync(() -> reader.latestAccountAmount(account), readerPool);
    }

    protected final CompletableFuture<BigInteger> readAtVersion(ObjectId account, long version) {
        return CompletableFuture.supplyAsync(() -> reader.accountAmountAtVersion(account, version), readerPool);
    }

    protected static <T> T await(ObjectId account, CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof FundsReadException) {
                throw (FundsReadException) cause;
            }
            throw new FundsReadException("Failed to read balance of " + account, cause);
        }
    }

    // -------------------- settlement --------------------

    private Map<ObjectId, BigInteger> rederive(BalanceSettlement settlement) {
        Map<ObjectId, CompletableFuture<BigInteger>> reads = prepareSettlement(settlement);
        Map<ObjectId, BigInteger> out = new HashMap<>();
        for (Map.Entry<ObjectId, CompletableFuture<BigInteger>> e : reads.entrySet()) {
            try {
                out.put(e.getKey(), await(e.getKey(), e.getValue()));
            } catch (FundsReadException ex) {
                LOG.log(Level.WARNING, name + ": could not re-derive " + e.getKey()
                        + " at version " + settlement.nextAccumulatorVersion(), ex);
            }
        }
        return out;
    }

    // -------------------- admission --------------------

    /** Takes the batch's turn on each of its accounts and starts its reads. Called under the scheduler lock. */
    private void sequence(PendingBatch batch) {
        SortedSet<ObjectId> accounts = new TreeSet<>();
        for (BalanceWithdraw withdraw : batch.withdraws) {
            accounts.addAll(withdraw.reservations().keySet());
        }
        List<CompletableFuture<?>> waits = new ArrayList<>();
        synchronized (turns) {
            for (ObjectId account : accounts) {
                CompletableFuture<Void> previous = turns.put(account, batch.turn);
                if (previous != null) {
                    waits.add(previous);
                }
            }
        }
        for (ObjectId account : accounts) {
            CompletableFuture<AccountAmount> read = fetch(account);
            batch.fetches.put(account, read);
            if (read != null) {
                waits.add(read.handle((amount, error) -> null));
            }
        }
        batch.accounts = accounts;
        batch.ready = CompletableFuture.allOf(waits.toArray(new CompletableFuture[0]));
        inFlight.add(batch);
    }

    private void startAdmissions(List<PendingBatch> batches) {
        for (PendingBatch batch : batches) {
            batch.ready.whenCompleteAsync((ignored, error) -> admit(batch), admissionExecutor);
        }
    }

    private void admit(PendingBatch batch) {
        List<Completion> done = new ArrayList<>();
        try {
            Map<ObjectId, AccountAmount> amounts = new HashMap<>();
            Map<ObjectId, FundsReadException> failures = new HashMap<>();
            for (Map.Entry<ObjectId, CompletableFuture<AccountAmount>> e : batch.fetches.entrySet()) {
                if (e.getValue() == null) {
                    continue;
                }
                try {
                    amounts.put(e.getKey(), await(e.getKey(), e.getValue()));
                } catch (FundsReadException ex) {
                    failures.put(e.getKey(), ex);
                }
            }

            settlementLock.readLock().lock();
            try {
                if (closed) {
                    failAll(batch.futures, done);
                } else if (accumulatorVersion != batch.version) {
                    LOG.fine(() -> name + ": version " + batch.version + " settled while batch was loading");
                    resolveAlreadyExecuted(batch, done);
                } else {
                    SchedulerMetrics.recordAdmission(name, () -> reserveBatch(batch, amounts, failures, done));
                }
            } finally {
                settlementLock.readLock().unlock();
            }
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, name + ": admission of batch at version " + batch.version + " failed", e);
            for (CompletableFuture<ScheduleResult> future : batch.futures) {
                done.add(Completion.failure(future, e));
            }
        } finally {
            inFlight.remove(batch);
            releaseTurn(batch);
        }
        complete(done);
    }

    private void releaseTurn(PendingBatch batch) {
        synchronized (turns) {
            for (ObjectId account : batch.accounts) {
                turns.remove(account, batch.turn);
            }
        }
        batch.turn.complete(null);
    }

    private void reserveBatch(PendingBatch batch,
                              Map<ObjectId, AccountAmount> amounts,
                              Map<ObjectId, FundsReadException> failures,
                              List<Completion> done) {
        Map<ObjectId, AccountState> states = new LinkedHashMap<>();
        for (ObjectId account : batch.accounts) {
            if (!failures.containsKey(account)) {
                states.put(account, resolve(account, amounts.get(account)));
            }
        }

        for (int i = 0; i < batch.withdraws.size(); i++) {
            BalanceWithdraw withdraw = batch.withdraws.get(i);
            CompletableFuture<ScheduleResult> future = batch.futures.get(i);
            FundsReadException failure = null;
            SortedMap<ObjectId, AccountState> txStates = new TreeMap<>();
            for (ObjectId account : withdraw.reservations().keySet()) {
                if (failures.containsKey(account)) {
                    failure = failures.get(account);
                    break;
                }
                txStates.put(account, states.get(account));
            }
            if (failure != null) {
                LOG.log(Level.WARNING, name + ": could not resolve balances for " + withdraw.txDigest(), failure);
                done.add(Completion.failure(future, failure));
                continue;
            }
            ScheduleStatus status = reserveAll(batch.version, txStates, withdraw);
            SchedulerMetrics.recordResult(name, status);
            LOG.fine(() -> name + ": " + withdraw.txDigest() + " -> " + status + " at version " + batch.version);
            done.add(Completion.success(future, new ScheduleResult(withdraw.txDigest(), status)));
        }
    }

    /**
     * All-or-nothing reservation for one transaction. Accounts are locked in id
     * order; the version check happens before anything is reserved.
     */
    private static ScheduleStatus reserveAll(long version,
                                             SortedMap<ObjectId, AccountState> txStates,
                                             BalanceWithdraw withdraw) {
        List<AccountState> locked = new ArrayList<>(txStates.size());
        try {
            for (AccountState state : txStates.values()) {
                state.lock();
                locked.add(state);
            }
            for (AccountState state : locked) {
                if (state.committedVersion() > version) {
                    return ScheduleStatus.ALREADY_EXECUTED;
                }
            }
            List<AccountState.Snapshot> snapshots = new ArrayList<>(locked.size());
            for (Map.Entry<ObjectId, AccountState> e : txStates.entrySet()) {
                AccountState state = e.getValue();
                snapshots.add(state.snapshot());
                if (!state.tryReserve(withdraw.reservations().get(e.getKey()))) {
                    for (int i = 0; i < snapshots.size(); i++) {
                        locked.get(i).restore(snapshots.get(i));
                    }
                    return ScheduleStatus.INSUFFICIENT_BALANCE;
                }
            }
            return ScheduleStatus.SUFFICIENT_BALANCE;
        } finally {
            for (int i = locked.size() - 1; i >= 0; i--) {
                locked.get(i).unlock();
            }
        }
    }

    private void resolveAlreadyExecuted(PendingBatch batch, List<Completion> done) {
        for (int i = 0; i < batch.withdraws.size(); i++) {
            SchedulerMetrics.recordResult(name, ScheduleStatus.ALREADY_EXECUTED);
            done.add(Completion.success(batch.futures.get(i),
                    new ScheduleResult(batch.withdraws.get(i).txDigest(), ScheduleStatus.ALREADY_EXECUTED)));
        }
    }

    private void failAll(List<CompletableFuture<ScheduleResult>> futures, List<Completion> done) {
        WithdrawSchedulerStoppedException stopped =
                new WithdrawSchedulerStoppedException("Withdraw scheduler " + name + " stopped");
        for (CompletableFuture<ScheduleResult> future : futures) {
            done.add(Completion.failure(future, stopped));
        }
    }

    private static void complete(List<Completion> done) {
        for (Completion completion : done) {
            if (completion.error != null) {
                completion.future.completeExceptionally(completion.error);
            } else {
                completion.future.complete(completion.result);
            }
        }
    }

    private static final class PendingBatch {
        final long version;
        final List<BalanceWithdraw> withdraws;
        final List<CompletableFuture<ScheduleResult>> futures;
        final CompletableFuture<Void> turn = new CompletableFuture<>();
        final Map<ObjectId, CompletableFuture<AccountAmount>> fetches = new LinkedHashMap<>();
        SortedSet<ObjectId> accounts = Collections.emptySortedSet();
        CompletableFuture<Void> ready;

        PendingBatch(long version, List<BalanceWithdraw> withdraws, List<CompletableFuture<ScheduleResult>> futures) {
            this.version = version;
            this.withdraws = List.copyOf(withdraws);
            this.futures = futures;
        }
    }

    private static final class Completion {
        final CompletableFuture<ScheduleResult> future;
        final ScheduleResult result;
        final Throwable error;

        private Completion(CompletableFuture<ScheduleResult> future, ScheduleResult result, Throwable error) {
            this.future = future;
            this.result = result;
            this.error = error;
        }

        static Completion success(CompletableFuture<ScheduleResult> future, ScheduleResult result) {
            return new Completion(future, result, null);
        }

        static Completion failure(CompletableFuture<ScheduleResult> future, Throwable error) {
            return new Completion(future, null, error);
        }
    }
}
