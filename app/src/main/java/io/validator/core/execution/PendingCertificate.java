package io.validator.core.execution;

import io.validator.core.withdraw.ScheduleStatus;

/**
 * A certificate whose balance check is done, handed to the executor.
 * Insufficient-balance certificates are executed as guaranteed failures.
 */
public final class PendingCertificate {
    private final WithdrawCertificate certificate;
    private final ScheduleStatus balanceStatus;

    PendingCertificate(WithdrawCertificate certificate, ScheduleStatus balanceStatus) {
        if (balanceStatus == ScheduleStatus.ALREADY_EXECUTED) {
            throw new IllegalArgumentException("Already-executed certificates are not re-enqueued");
        }
        this.certificate = certificate;
        this.balanceStatus = balanceStatus;
    }

    public WithdrawCertificate certificate() { return certificate; }
    public ScheduleStatus balanceStatus() { return balanceStatus; }

    public boolean hasSufficientBalance() {
        return balanceStatus == ScheduleStatus.SUFFICIENT_BALANCE;
    }

    /** Effects are a failed execution produced without running the transaction. */
    public boolean isGuaranteedFailure() {
        return balanceStatus == ScheduleStatus.INSUFFICIENT_BALANCE;
    }

    @Override
    public String toString() {
        return "PendingCertificate{" + certificate + ", " + balanceStatus + '}';
    }
}
