package io.validator.core.state;

import io.validator.core.protocol.BalanceSettlement;
import io.validator.core.protocol.ObjectId;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * In-memory implementation of AccumulatorStore.
 * Keeps every committed balance per version so point-in-time reads work
 * until {@link #pruneBefore(long)} drops old history.
 * Not persistent; resets every process run.
 */
public final class InMemoryAccumulatorStore implements AccumulatorStore {

    /** account -> (version -> balance committed at that version) */
    private final Map<ObjectId, TreeMap<Long, BigInteger>> history = new HashMap<>();
    private long rootVersion;
    private long prunedBefore;

    public InMemoryAccumulatorStore() {
        this(0L);
    }

    public InMemoryAccumulatorStore(long rootVersion) {
        if (rootVersion < 0) {
            throw new IllegalArgumentException("rootVersion must be >= 0");
        }
        this.rootVersion = rootVersion;
        this.prunedBefore = rootVersion;
    }

    @Override
    public synchronized long rootVersion() {
        return rootVersion;
    }

    @Override
    public synchronized AccountAmount latestAccountAmount(ObjectId account) {
        TreeMap<Long, BigInteger> versions = history.get(account);
        BigInteger balance = versions == null ? BigInteger.ZERO : versions.lastEntry().getValue();
        return new AccountAmount(balance, rootVersion);
    }

    @Override
    public synchronized BigInteger accountAmountAtVersion(ObjectId account, long version) {
        if (version < 0) {
            throw new IllegalArgumentException("version must be >= 0");
        }
        if (version > rootVersion) {
            throw new FundsReadException("Version " + version + " not committed yet (root at " + rootVersion + ")");
        }
        if (version < prunedBefore) {
            throw new FundsReadException("Version " + version + " pruned (history starts at " + prunedBefore + ")");
        }
        TreeMap<Long, BigInteger> versions = history.get(account);
        if (versions == null) {
            return BigInteger.ZERO;
        }
        Map.Entry<Long, BigInteger> entry = versions.floorEntry(version);
        return entry == null ? BigInteger.ZERO : entry.getValue();
    }

    @Override
    public synchronized void setBalance(ObjectId account, BigInteger balance) {
        if (balance == null || balance.signum() < 0) {
            throw new IllegalArgumentException("balance must be >= 0");
        }
        history.computeIfAbsent(account, k -> new TreeMap<>()).put(rootVersion, balance);
    }

    @Override
    public synchronized void applyBalanceChanges(BalanceSettlement settlement) {
        long next = settlement.nextAccumulatorVersion();
        if (next <= rootVersion) {
            throw new IllegalArgumentException("Settlement version " + next + " does not advance root " + rootVersion);
        }
        // validate every delta before touching state
        Map<ObjectId, BigInteger> updated = new HashMap<>();
        for (Map.Entry<ObjectId, BigInteger> e : settlement.balanceChanges().entrySet()) {
            BigInteger current = latestAccountAmount(e.getKey()).balance();
            BigInteger after = current.add(e.getValue());
            if (after.signum() < 0) {
                throw new IllegalStateException("Settlement overdraws " + e.getKey() + ": " + current + " + " + e.getValue());
            }
            updated.put(e.getKey(), after);
        }
        for (Map.Entry<ObjectId, BigInteger> e : updated.entrySet()) {
            history.computeIfAbsent(e.getKey(), k -> new TreeMap<>()).put(next, e.getValue());
        }
        rootVersion = next;
    }

    /** Drop history older than {@code version}, keeping the balance in effect at that version. */
    public synchronized void pruneBefore(long version) {
        long bound = Math.min(version, rootVersion);
        if (bound <= prunedBefore) {
            return;
        }
        for (TreeMap<Long, BigInteger> versions : history.values()) {
            Map.Entry<Long, BigInteger> floor = versions.floorEntry(bound);
            if (floor != null) {
                versions.headMap(bound, false).clear();
                versions.put(bound, floor.getValue());
            }
        }
        prunedBefore = bound;
    }
}
