package io.validator.core.state;

import io.validator.core.protocol.BalanceSettlement;
import io.validator.core.protocol.ObjectId;

import java.math.BigInteger;

/**
 * Versioned accumulator balances: the object store behind a {@link FundsReader}.
 */
public interface AccumulatorStore extends FundsReader {

    /** Current version of the accumulator root. */
    long rootVersion();

    /** Overwrite a balance at the current root version (genesis funding or manual recovery). */
    void setBalance(ObjectId account, BigInteger balance);

    /**
     * Commit the deltas of a settlement and advance the root to its version.
     *
     * @throws IllegalArgumentException if the version does not advance the root
     * @throws IllegalStateException if a delta would overdraw an account
     */
    void applyBalanceChanges(BalanceSettlement settlement);
}
