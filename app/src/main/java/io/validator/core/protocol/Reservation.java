package io.validator.core.protocol;

import java.math.BigInteger;

/**
 * One transaction's claim against one account: either at most a fixed amount,
 * or whatever remains of the guaranteed balance.
 */
public final class Reservation {

    public enum Kind { AT_MOST, ENTIRE_BALANCE }

    private static final Reservation ENTIRE = new Reservation(Kind.ENTIRE_BALANCE, 0L);

    private final Kind kind;
    private final long amount;

    private Reservation(Kind kind, long amount) {
        this.kind = kind;
        this.amount = amount;
    }

    /**
     * Reserve up to {@code amount} units. The argument holds an unsigned 64-bit
     * value, so {@code -1L} stands for 2^64 - 1.
     */
    public static Reservation atMost(long amount) {
        return new Reservation(Kind.AT_MOST, amount);
    }

    public static Reservation entireBalance() {
        return ENTIRE;
    }

    public Kind kind() { return kind; }
    public boolean isEntireBalance() { return kind == Kind.ENTIRE_BALANCE; }

    /** Requested amount as raw unsigned 64-bit bits; only meaningful for {@link Kind#AT_MOST}. */
    public long amount() {
        if (kind != Kind.AT_MOST) {
            throw new IllegalStateException("Entire-balance reservation has no fixed amount");
        }
        return amount;
    }

    /** {@link #amount()} widened to its unsigned value. */
    public BigInteger unsignedAmount() {
        return toUnsigned(amount());
    }

    public static BigInteger toUnsigned(long u64) {
        return new BigInteger(Long.toUnsignedString(u64));
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Reservation)) return false;
        Reservation other = (Reservation) o;
        return kind == other.kind && amount == other.amount;
    }

    @Override public int hashCode() { return kind.hashCode() * 31 + Long.hashCode(amount); }

    @Override
    public String toString() {
        return kind == Kind.AT_MOST ? "AtMost(" + Long.toUnsignedString(amount) + ")" : "EntireBalance";
    }
}
