package io.validator.core.withdraw;

import io.validator.core.protocol.Reservation;

import java.math.BigInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory ledger of one accumulator account: the last committed balance and
 * version plus the reservations granted against it since.
 *
 * Invariant: {@code committedBalance - currentlyReserved >= 0}.
 * Every method takes the account's own lock; schedulers hold it across a whole
 * transaction via {@link #lock()} so multi-account reservations stay atomic.
 */
public final class AccountState {

    private final ReentrantLock lock = new ReentrantLock();

    private BigInteger committedBalance;
    private long committedVersion;
    private BigInteger currentlyReserved = BigInteger.ZERO;
    private boolean entireBalanceClaimed;

    public AccountState(BigInteger balance, long version) {
        if (balance == null || balance.signum() < 0) {
            throw new IllegalArgumentException("balance must be >= 0");
        }
        this.committedBalance = balance;
        this.committedVersion = version;
    }

    /** The amount still obtainable after all outstanding reservations. */
    public BigInteger guaranteedBalance() {
        lock.lock();
        try {
            return committedBalance.subtract(currentlyReserved);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Provisionally grant {@code reservation}. Never reserves partially; a
     * failed attempt leaves the state unchanged.
     */
    public boolean tryReserve(Reservation reservation) {
        lock.lock();
        try {
            if (entireBalanceClaimed) {
                return false;
            }
            if (reservation.isEntireBalance()) {
                currentlyReserved = committedBalance;
                entireBalanceClaimed = true;
                return true;
            }
            BigInteger amount = reservation.unsignedAmount();
            if (amount.compareTo(committedBalance.subtract(currentlyReserved)) > 0) {
                return false;
            }
            currentlyReserved = currentlyReserved.add(amount);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replace the committed balance with a durable outcome, discarding all
     * provisional reservations. Ignored unless {@code version} is newer.
     *
     * @return whether the settlement was applied
     */
    public boolean applySettlement(BigInteger balance, long version) {
        if (balance == null || balance.signum() < 0) {
            throw new IllegalArgumentException("balance must be >= 0");
        }
        lock.lock();
        try {
            if (version <= committedVersion) {
                return false;
            }
            committedBalance = balance;
            committedVersion = version;
            currentlyReserved = BigInteger.ZERO;
            entireBalanceClaimed = false;
            return true;
        } finally {
            lock.unlock();
        }
    }

    public BigInteger committedBalance() {
        lock.lock();
        try {
            return committedBalance;
        } finally {
            lock.unlock();
        }
    }

    public long committedVersion() {
        lock.lock();
        try {
            return committedVersion;
        } finally {
            lock.unlock();
        }
    }

    public boolean entireBalanceClaimed() {
        lock.lock();
        try {
            return entireBalanceClaimed;
        } finally {
            lock.unlock();
        }
    }

    boolean hasReservations() {
        lock.lock();
        try {
            return entireBalanceClaimed || currentlyReserved.signum() > 0;
        } finally {
            lock.unlock();
        }
    }

    // -------- scheduler-only hooks --------

    void lock() { lock.lock(); }
    void unlock() { lock.unlock(); }

    Snapshot snapshot() {
        return new Snapshot(currentlyReserved, entireBalanceClaimed);
    }

    void restore(Snapshot snapshot) {
        currentlyReserved = snapshot.reserved;
        entireBalanceClaimed = snapshot.entireClaimed;
    }

    static final class Snapshot {
        private final BigInteger reserved;
        private final boolean entireClaimed;

        private Snapshot(BigInteger reserved, boolean entireClaimed) {
            this.reserved = reserved;
            this.entireClaimed = entireClaimed;
        }
    }

    @Override
    public String toString() {
        return "AccountState{balance=" + committedBalance + ", version=" + committedVersion
                + ", reserved=" + currentlyReserved + (entireBalanceClaimed ? ", entire" : "") + '}';
    }
}
