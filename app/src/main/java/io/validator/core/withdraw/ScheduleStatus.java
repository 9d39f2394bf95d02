package io.validator.core.withdraw;

public enum ScheduleStatus {
    /** Withdrawals are guaranteed; the transaction may run once its other inputs are ready. */
    SUFFICIENT_BALANCE,
    /** Execute as a guaranteed failure without running the transaction's logic. */
    INSUFFICIENT_BALANCE,
    /** The accumulator moved past this transaction; leave it to the checkpoint-driven path. */
    ALREADY_EXECUTED
}
