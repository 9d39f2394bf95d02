package io.validator.core.withdraw;

import io.validator.core.metrics.SchedulerMetrics;
import io.validator.core.protocol.BalanceSettlement;
import io.validator.core.protocol.ObjectId;
import io.validator.core.state.AccountAmount;
import io.validator.core.state.FundsReader;

import java.math.BigInteger;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Logger;

/**
 * Keeps account state in memory across versions and advances it from
 * settlements instead of reading storage for every batch.
 *
 * <p>Accounts are loaded from the {@link FundsReader} on first reference;
 * concurrent batches referencing the same unknown account share one read. On
 * settlement the balance of each cached account that changed is re-derived
 * from storage at the new version (or, when configured, by adding the
 * settlement delta) and every cached account moves to the new version with
 * its reservations cleared. The re-derivation reads happen before admissions
 * are paused.
 *
 * <p>The cache is trimmed to {@code maxCachedAccounts} right after a
 * settlement, preferring accounts not referenced during the settled version.
 * States still holding reservations are never evicted.
 */
public final class EagerBalanceWithdrawScheduler extends BalanceWithdrawScheduler {
    private static final Logger LOG = Logger.getLogger(EagerBalanceWithdrawScheduler.class.getName());

    private final ConcurrentMap<ObjectId, AccountState> states = new ConcurrentHashMap<>();
    private final ConcurrentMap<ObjectId, CompletableFuture<AccountAmount>> loading = new ConcurrentHashMap<>();
    private final Set<ObjectId> touched = ConcurrentHashMap.newKeySet();
    private final int maxCachedAccounts;
    private final boolean applySettlementDeltas;

    public EagerBalanceWithdrawScheduler(FundsReader reader, long startingVersion, int readerThreads,
                                         int maxCachedAccounts, boolean applySettlementDeltas) {
        super("eager", reader, startingVersion, readerThreads);
        if (maxCachedAccounts <= 0) {
            throw new IllegalArgumentException("maxCachedAccounts must be > 0");
        }
        this.maxCachedAccounts = maxCachedAccounts;
        this.applySettlementDeltas = applySettlementDeltas;
    }

    public EagerBalanceWithdrawScheduler(FundsReader reader, long startingVersion) {
        this(reader, startingVersion, 4, 100_000, false);
    }

    @Override
    protected CompletableFuture<AccountAmount> fetch(ObjectId account) {
        touched.add(account);
        if (states.containsKey(account)) {
            return null;
        }
        CompletableFuture<AccountAmount> read = loading.computeIfAbsent(account, this::readLatest);
        if (read.isCompletedExceptionally()) {
            loading.remove(account, read);
            read = loading.computeIfAbsent(account, this::readLatest);
        }
        return read;
    }

    @Override
    protected AccountState resolve(ObjectId account, AccountAmount fetched) {
        if (fetched == null) {
            AccountState cached = states.get(account);
            if (cached == null) {
                throw new IllegalStateException("Cached state of " + account + " vanished at an unchanged version");
            }
            return cached;
        }
        AccountState state = states.computeIfAbsent(account,
                k -> new AccountState(fetched.balance(), fetched.version()));
        loading.remove(account);
        return state;
    }

    @Override
    protected Map<ObjectId, CompletableFuture<BigInteger>> prepareSettlement(BalanceSettlement settlement) {
        if (applySettlementDeltas) {
            return Collections.emptyMap();
        }
        Map<ObjectId, CompletableFuture<BigInteger>> reads = new LinkedHashMap<>();
        for (ObjectId account : settlement.balanceChanges().keySet()) {
            if (states.containsKey(account)) {
                reads.put(account, readAtVersion(account, settlement.nextAccumulatorVersion()));
            }
        }
        return reads;
    }

    @Override
    protected void onSettlement(long previousVersion, BalanceSettlement settlement, Map<ObjectId, BigInteger> rederived) {
        long next = settlement.nextAccumulatorVersion();

        int evicted = 0;
        for (Map.Entry<ObjectId, BigInteger> change : settlement.balanceChanges().entrySet()) {
            ObjectId account = change.getKey();
            AccountState state = states.get(account);
            if (state == null || state.committedVersion() >= next) {
                continue;
            }
            BigInteger balance = applySettlementDeltas
                    ? state.committedBalance().add(change.getValue())
                    : rederived.get(account);
            if (balance == null || balance.signum() < 0) {
                // reloaded from storage on next reference
                states.remove(account);
                evicted++;
                LOG.warning(name() + ": evicting " + account + ", no usable balance at version " + next);
                continue;
            }
            state.applySettlement(balance, next);
        }
        for (AccountState state : states.values()) {
            state.applySettlement(state.committedBalance(), next);
        }

        loading.clear();
        evicted += trimCache();
        touched.clear();
        if (evicted > 0) {
            SchedulerMetrics.recordEvictions(name(), evicted);
        }
    }

    private int trimCache() {
        int evicted = 0;
        evicted += evictWhile(true);
        evicted += evictWhile(false);
        return evicted;
    }

    private int evictWhile(boolean untouchedOnly) {
        int evicted = 0;
        Iterator<Map.Entry<ObjectId, AccountState>> it = states.entrySet().iterator();
        while (states.size() > maxCachedAccounts && it.hasNext()) {
            Map.Entry<ObjectId, AccountState> entry = it.next();
            if (untouchedOnly && touched.contains(entry.getKey())) {
                continue;
            }
            if (entry.getValue().hasReservations()) {
                continue;
            }
            it.remove();
            evicted++;
        }
        return evicted;
    }

    int cachedAccounts() {
        return states.size();
    }

    AccountState cachedState(ObjectId account) {
        return states.get(account);
    }
}
