package io.validator.core.state;

import java.math.BigInteger;
import java.util.Objects;

/** Committed balance of an account together with the root version it was read at. */
public final class AccountAmount {
    private final BigInteger balance;
    private final long version;

    public AccountAmount(BigInteger balance, long version) {
        if (balance == null || balance.signum() < 0) {
            throw new IllegalArgumentException("balance must be >= 0");
        }
        this.balance = balance;
        this.version = version;
    }

    public BigInteger balance() { return balance; }
    public long version() { return version; }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof AccountAmount)) return false;
        AccountAmount other = (AccountAmount) o;
        return version == other.version && balance.equals(other.balance);
    }

    @Override public int hashCode() { return Objects.hash(balance, version); }
    @Override public String toString() { return balance + "@v" + version; }
}
