package io.validator.core.state;

import io.validator.core.protocol.ObjectId;
import io.validator.core.protocol.Reservation;

import java.math.BigInteger;
import java.util.Map;
import java.util.SortedMap;

/**
 * Read access to committed accumulator balances.
 * Failures reading storage surface as {@link FundsReadException}.
 */
public interface FundsReader {

    /**
     * Latest committed balance of {@code account} and the root version it was read at.
     * An account that was never touched reads as zero at the current root version.
     */
    AccountAmount latestAccountAmount(ObjectId account);

    /** Point-in-time balance. Callers must make sure {@code version} has not been pruned. */
    BigInteger accountAmountAtVersion(ObjectId account, long version);

    /**
     * Unsequenced best-effort check that every account holds at least the requested amount.
     * Gives no ordering guarantee; only suitable for signing-time checks.
     * Requested amounts are unsigned 64-bit values.
     *
     * @throws InsufficientFundsException for the first account (in id order) that falls short
     */
    default void amountsAvailable(SortedMap<ObjectId, Long> requested) {
        for (Map.Entry<ObjectId, Long> e : requested.entrySet()) {
            BigInteger wanted = Reservation.toUnsigned(e.getValue());
            BigInteger available = latestAccountAmount(e.getKey()).balance();
            if (available.compareTo(wanted) < 0) {
                throw new InsufficientFundsException(e.getKey(), available, wanted);
            }
        }
    }
}
