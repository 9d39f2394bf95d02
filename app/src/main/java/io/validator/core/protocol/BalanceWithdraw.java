package io.validator.core.protocol;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Withdrawal request of one transaction: the accumulator accounts it withdraws
 * from and how much it reserves on each. Reservations iterate in ObjectId order.
 */
public final class BalanceWithdraw {

    private final TxDigest txDigest;
    private final SortedMap<ObjectId, Reservation> reservations;

    private BalanceWithdraw(TxDigest txDigest, SortedMap<ObjectId, Reservation> reservations) {
        this.txDigest = txDigest;
        this.reservations = Collections.unmodifiableSortedMap(new TreeMap<>(reservations));
        basicValidate();
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private TxDigest txDigest;
        private final SortedMap<ObjectId, Reservation> reservations = new TreeMap<>();

        public Builder txDigest(TxDigest d) { this.txDigest = d; return this; }
        public Builder atMost(ObjectId account, long amount) { return reserve(account, Reservation.atMost(amount)); }
        public Builder entireBalance(ObjectId account) { return reserve(account, Reservation.entireBalance()); }

        public Builder reserve(ObjectId account, Reservation reservation) {
            if (account == null || reservation == null) {
                throw new IllegalArgumentException("account and reservation required");
            }
            if (reservations.putIfAbsent(account, reservation) != null) {
                throw new IllegalArgumentException("Duplicate reservation for " + account);
            }
            return this;
        }

        public Builder reservations(Map<ObjectId, Reservation> all) {
            for (Map.Entry<ObjectId, Reservation> e : all.entrySet()) {
                reserve(e.getKey(), e.getValue());
            }
            return this;
        }

        public BalanceWithdraw build() {
            return new BalanceWithdraw(txDigest, reservations);
        }
    }

    public TxDigest txDigest() { return txDigest; }
    public SortedMap<ObjectId, Reservation> reservations() { return reservations; }

    /** Fixed amounts (unsigned 64-bit) requested per account; entire-balance claims are left out. */
    public SortedMap<ObjectId, Long> fixedAmounts() {
        SortedMap<ObjectId, Long> out = new TreeMap<>();
        for (Map.Entry<ObjectId, Reservation> e : reservations.entrySet()) {
            if (!e.getValue().isEntireBalance()) {
                out.put(e.getKey(), e.getValue().amount());
            }
        }
        return out;
    }

    public void basicValidate() {
        if (txDigest == null) throw new IllegalArgumentException("Missing tx digest");
        if (reservations.isEmpty()) throw new IllegalArgumentException("Withdraw has no reservations");
    }

    @Override
    public String toString() {
        return "BalanceWithdraw{" + txDigest + ", " + reservations + '}';
    }
}
