package io.validator.core.node;

import io.validator.core.protocol.ObjectId;
import io.validator.core.state.AccumulatorStore;

import java.math.BigInteger;
import java.util.Map;

/**
 * Seeds initial accumulator balances.
 * Allocation keys are either {@code owner/coinType} or a hex object id.
 */
public final class AccumulatorGenesis {
    private AccumulatorGenesis(){}

    public static ObjectId accountId(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Empty allocation key");
        }
        int slash = key.indexOf('/');
        if (slash < 0) {
            return ObjectId.fromHex(key.trim());
        }
        return ObjectId.forBalance(key.substring(0, slash).trim(), key.substring(slash + 1).trim());
    }

    /** Write initial balances (allocations map) into the store. */
    public static void seedBalances(AccumulatorStore store, Map<String, Long> allocations) {
        if (allocations == null || allocations.isEmpty()) return;
        for (Map.Entry<String, Long> e : allocations.entrySet()) {
            long amount = e.getValue() == null ? 0L : e.getValue();
            if (amount < 0) {
                throw new IllegalArgumentException("Negative allocation for " + e.getKey());
            }
            store.setBalance(accountId(e.getKey()), BigInteger.valueOf(amount));
        }
    }

    /**
     * Seed balances only if none of the allocated accounts holds funds yet.
     * Idempotent: returns false and does nothing on an already seeded store.
     */
    public static boolean initIfNeeded(AccumulatorStore store, Map<String, Long> allocations) {
        if (allocations == null || allocations.isEmpty()) return false;
        for (String key : allocations.keySet()) {
            if (store.latestAccountAmount(accountId(key)).balance().signum() > 0) {
                return false;
            }
        }
        seedBalances(store, allocations);
        return true;
    }
}
