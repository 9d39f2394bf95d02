package io.validator.core.protocol;

import java.math.BigInteger;
import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Emitted once the balance effects up to an accumulator version are durable.
 * Advances the accumulator root to {@code nextAccumulatorVersion}.
 *
 * The per-account deltas identify which accounts changed. Schedulers re-read
 * the resulting balances from storage; the deltas themselves are only applied
 * when explicitly configured to.
 */
public final class BalanceSettlement {

    private final long nextAccumulatorVersion;
    private final SortedMap<ObjectId, BigInteger> balanceChanges;

    public BalanceSettlement(long nextAccumulatorVersion, SortedMap<ObjectId, BigInteger> balanceChanges) {
        if (nextAccumulatorVersion < 0) {
            throw new IllegalArgumentException("version must be >= 0");
        }
        this.nextAccumulatorVersion = nextAccumulatorVersion;
        this.balanceChanges = balanceChanges == null
                ? Collections.emptySortedMap()
                : Collections.unmodifiableSortedMap(new TreeMap<>(balanceChanges));
    }

    public static BalanceSettlement withoutChanges(long nextAccumulatorVersion) {
        return new BalanceSettlement(nextAccumulatorVersion, null);
    }

    public long nextAccumulatorVersion() { return nextAccumulatorVersion; }
    public SortedMap<ObjectId, BigInteger> balanceChanges() { return balanceChanges; }

    @Override
    public String toString() {
        return "BalanceSettlement{v=" + nextAccumulatorVersion + ", changes=" + balanceChanges.size() + '}';
    }
}
