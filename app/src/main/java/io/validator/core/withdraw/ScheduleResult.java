package io.validator.core.withdraw;

import io.validator.core.protocol.TxDigest;

import java.util.Objects;

public final class ScheduleResult {
    private final TxDigest txDigest;
    private final ScheduleStatus status;

    public ScheduleResult(TxDigest txDigest, ScheduleStatus status) {
        this.txDigest = Objects.requireNonNull(txDigest, "txDigest");
        this.status = Objects.requireNonNull(status, "status");
    }

    public TxDigest txDigest() { return txDigest; }
    public ScheduleStatus status() { return status; }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ScheduleResult)) return false;
        ScheduleResult other = (ScheduleResult) o;
        return txDigest.equals(other.txDigest) && status == other.status;
    }

    @Override public int hashCode() { return Objects.hash(txDigest, status); }
    @Override public String toString() { return "ScheduleResult{" + txDigest + ", " + status + '}'; }
}
