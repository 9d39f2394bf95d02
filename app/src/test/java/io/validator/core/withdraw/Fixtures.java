package io.validator.core.withdraw;

import io.validator.core.protocol.BalanceSettlement;
import io.validator.core.protocol.BalanceWithdraw;
import io.validator.core.protocol.ObjectId;
import io.validator.core.protocol.TxDigest;
import io.validator.core.state.AccountAmount;
import io.validator.core.state.FundsReadException;
import io.validator.core.state.FundsReader;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

final class Fixtures {
    private Fixtures() {}

    static ObjectId account(String owner) {
        return ObjectId.forBalance(owner, "0x2::sui::SUI");
    }

    static TxDigest digest(String label) {
        return TxDigest.of(label.getBytes(StandardCharsets.UTF_8));
    }

    static BalanceWithdraw atMost(String label, ObjectId account, long amount) {
        return BalanceWithdraw.builder().txDigest(digest(label)).atMost(account, amount).build();
    }

    static BalanceSettlement settlement(long nextVersion, ObjectId account, long delta) {
        TreeMap<ObjectId, BigInteger> changes = new TreeMap<>();
        changes.put(account, BigInteger.valueOf(delta));
        return new BalanceSettlement(nextVersion, changes);
    }

    /** Delegating reader that counts reads, fails for selected accounts and can hold reads of others. */
    static final class FlakyFundsReader implements FundsReader {
        private final FundsReader delegate;
        final Set<ObjectId> failLatest = ConcurrentHashMap.newKeySet();
        final Set<ObjectId> failAtVersion = ConcurrentHashMap.newKeySet();
        final AtomicInteger latestReads = new AtomicInteger();
        final AtomicInteger versionedReads = new AtomicInteger();
        final Set<ObjectId> gated = ConcurrentHashMap.newKeySet();
        final CountDownLatch gatedReadStarted = new CountDownLatch(1);
        final CountDownLatch gateOpen = new CountDownLatch(1);

        FlakyFundsReader(FundsReader delegate) {
            this.delegate = delegate;
        }

        @Override
        public AccountAmount latestAccountAmount(ObjectId account) {
            latestReads.incrementAndGet();
            holdIfGated(account);
            if (failLatest.contains(account)) {
                throw new FundsReadException("disk-failure");
            }
            return delegate.latestAccountAmount(account);
        }

        @Override
        public BigInteger accountAmountAtVersion(ObjectId account, long version) {
            versionedReads.incrementAndGet();
            holdIfGated(account);
            if (failAtVersion.contains(account)) {
                throw new FundsReadException("disk-failure");
            }
            return delegate.accountAmountAtVersion(account, version);
        }

        private void holdIfGated(ObjectId account) {
            if (!gated.contains(account)) {
                return;
            }
            gatedReadStarted.countDown();
            try {
                if (!gateOpen.await(30, TimeUnit.SECONDS)) {
                    throw new FundsReadException("gate never opened");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FundsReadException("interrupted", e);
            }
        }
    }
}
