package io.validator.core.execution;

import io.validator.core.protocol.BalanceSettlement;
import io.validator.core.protocol.BalanceWithdraw;
import io.validator.core.withdraw.BalanceWithdrawScheduler;
import io.validator.core.withdraw.ScheduleResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Routes sequenced certificates with withdrawals through the balance
 * withdraw scheduler and enqueues them for execution once their balance
 * check resolves.
 */
public final class ExecutionScheduler {
    private static final Logger LOG = Logger.getLogger(ExecutionScheduler.class.getName());

    private final BalanceWithdrawScheduler withdrawScheduler;
    private final Consumer<PendingCertificate> readyCertificates;

    public ExecutionScheduler(BalanceWithdrawScheduler withdrawScheduler, Consumer<PendingCertificate> readyCertificates) {
        this.withdrawScheduler = withdrawScheduler;
        this.readyCertificates = readyCertificates;
    }

    /**
     * Submit certificates in consensus order.
     *
     * @return a future completing once every certificate has been resolved
     * @throws IllegalArgumentException if accumulator versions decrease
     */
    public CompletableFuture<Void> scheduleBalanceWithdraws(List<WithdrawCertificate> certificates) {
        if (certificates == null || certificates.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        Map<Long, List<WithdrawCertificate>> byVersion = new TreeMap<>();
        long prevVersion = Long.MIN_VALUE;
        for (WithdrawCertificate cert : certificates) {
            if (cert.accumulatorVersion() < prevVersion) {
                throw new IllegalArgumentException("Certificates out of order: " + cert
                        + " after version " + prevVersion);
            }
            prevVersion = cert.accumulatorVersion();
            byVersion.computeIfAbsent(cert.accumulatorVersion(), v -> new ArrayList<>()).add(cert);
        }

        List<CompletableFuture<Void>> handled = new ArrayList<>(certificates.size());
        for (Map.Entry<Long, List<WithdrawCertificate>> e : byVersion.entrySet()) {
            List<WithdrawCertificate> certs = e.getValue();
            List<BalanceWithdraw> withdraws = new ArrayList<>(certs.size());
            for (WithdrawCertificate cert : certs) {
                withdraws.add(cert.withdraw());
            }
            List<CompletableFuture<ScheduleResult>> results = withdrawScheduler.scheduleWithdraws(e.getKey(), withdraws);
            for (int i = 0; i < certs.size(); i++) {
                WithdrawCertificate cert = certs.get(i);
                handled.add(results.get(i).handle((result, error) -> {
                    onScheduled(cert, result, error);
                    return null;
                }));
            }
        }
        return CompletableFuture.allOf(handled.toArray(new CompletableFuture[0]));
    }

    public void settleBalances(BalanceSettlement settlement) {
        withdrawScheduler.settleBalances(settlement);
    }

    private void onScheduled(WithdrawCertificate cert, ScheduleResult result, Throwable error) {
        if (error != null) {
            LOG.log(Level.SEVERE, "Withdraw scheduling failed for " + cert, error);
            return;
        }
        switch (result.status()) {
            case SUFFICIENT_BALANCE:
                LOG.fine(() -> "Balance withdraw scheduling result: Success " + result.txDigest());
                readyCertificates.accept(new PendingCertificate(cert, result.status()));
                break;
            case INSUFFICIENT_BALANCE:
                LOG.fine(() -> "Balance withdraw scheduling result: Insufficient balance " + result.txDigest());
                readyCertificates.accept(new PendingCertificate(cert, result.status()));
                break;
            case ALREADY_EXECUTED:
                LOG.fine(() -> "Withdraw already executed " + result.txDigest());
                break;
            default:
                throw new IllegalStateException("Unknown status " + result.status());
        }
    }
}
