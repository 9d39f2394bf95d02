package io.validator.core.execution;

import io.validator.core.protocol.BalanceWithdraw;

/** A sequenced transaction with withdrawals and the accumulator version consensus assigned it. */
public final class WithdrawCertificate {
    private final BalanceWithdraw withdraw;
    private final long accumulatorVersion;

    public WithdrawCertificate(BalanceWithdraw withdraw, long accumulatorVersion) {
        if (withdraw == null) {
            throw new IllegalArgumentException("withdraw required");
        }
        this.withdraw = withdraw;
        this.accumulatorVersion = accumulatorVersion;
    }

    public BalanceWithdraw withdraw() { return withdraw; }
    public long accumulatorVersion() { return accumulatorVersion; }

    @Override
    public String toString() {
        return "WithdrawCertificate{" + withdraw.txDigest() + " @v" + accumulatorVersion + '}';
    }
}
