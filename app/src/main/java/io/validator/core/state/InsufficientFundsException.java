package io.validator.core.state;

import io.validator.core.protocol.ObjectId;

import java.math.BigInteger;

public class InsufficientFundsException extends IllegalArgumentException {
    private final ObjectId account;
    private final BigInteger available;
    private final BigInteger requested;

    public InsufficientFundsException(ObjectId account, BigInteger available, BigInteger requested) {
        super("Insufficient funds for " + account + ": available " + available + ", requested " + requested);
        this.account = account;
        this.available = available;
        this.requested = requested;
    }

    public ObjectId account() { return account; }
    public BigInteger available() { return available; }
    public BigInteger requested() { return requested; }
}
