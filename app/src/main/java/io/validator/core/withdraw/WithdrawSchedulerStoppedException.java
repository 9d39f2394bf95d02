package io.validator.core.withdraw;

public class WithdrawSchedulerStoppedException extends RuntimeException {
    public WithdrawSchedulerStoppedException(String message) {
        super(message);
    }
}
