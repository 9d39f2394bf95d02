package io.validator.core.execution;

import io.validator.core.protocol.BalanceSettlement;
import io.validator.core.protocol.BalanceWithdraw;
import io.validator.core.protocol.ObjectId;
import io.validator.core.protocol.TxDigest;
import io.validator.core.state.InMemoryAccumulatorStore;
import io.validator.core.withdraw.EagerBalanceWithdrawScheduler;
import io.validator.core.withdraw.ScheduleStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionSchedulerTest {

    private static final ObjectId ALICE = ObjectId.forBalance("alice", "0x2::sui::SUI");

    private InMemoryAccumulatorStore store;
    private EagerBalanceWithdrawScheduler withdrawScheduler;
    private final List<PendingCertificate> ready = Collections.synchronizedList(new ArrayList<>());
    private ExecutionScheduler scheduler;

    @BeforeEach
    void setUp() {
        store = new InMemoryAccumulatorStore();
        store.setBalance(ALICE, BigInteger.valueOf(1000));
        withdrawScheduler = new EagerBalanceWithdrawScheduler(store, 0);
        scheduler = new ExecutionScheduler(withdrawScheduler, ready::add);
    }

    @AfterEach
    void tearDown() {
        withdrawScheduler.close();
    }

    private static WithdrawCertificate cert(String label, long amount, long version) {
        BalanceWithdraw withdraw = BalanceWithdraw.builder()
                .txDigest(TxDigest.of(label.getBytes(StandardCharsets.UTF_8)))
                .atMost(ALICE, amount)
                .build();
        return new WithdrawCertificate(withdraw, version);
    }

    @Test
    void enqueuesSufficientAndInsufficientInOrder() throws Exception {
        WithdrawCertificate first = cert("tx1", 700, 0);
        WithdrawCertificate second = cert("tx2", 400, 0);

        scheduler.scheduleBalanceWithdraws(List.of(first, second)).get(5, TimeUnit.SECONDS);

        assertEquals(2, ready.size());
        assertSame(first, ready.get(0).certificate());
        assertTrue(ready.get(0).hasSufficientBalance());
        assertSame(second, ready.get(1).certificate());
        assertTrue(ready.get(1).isGuaranteedFailure());
    }

    @Test
    void laterVersionsWaitForSettlement() throws Exception {
        scheduler.scheduleBalanceWithdraws(List.of(cert("tx1", 900, 0))).get(5, TimeUnit.SECONDS);
        CompletableFuture<Void> done = scheduler.scheduleBalanceWithdraws(List.of(cert("tx2", 900, 1)));
        assertFalse(done.isDone());
        assertEquals(1, ready.size());

        scheduler.settleBalances(BalanceSettlement.withoutChanges(1));

        done.get(5, TimeUnit.SECONDS);
        assertEquals(2, ready.size());
        assertEquals(ScheduleStatus.SUFFICIENT_BALANCE, ready.get(1).balanceStatus());
    }

    @Test
    void dropsAlreadyExecutedCertificates() throws Exception {
        store.applyBalanceChanges(BalanceSettlement.withoutChanges(1));
        scheduler.settleBalances(BalanceSettlement.withoutChanges(1));

        scheduler.scheduleBalanceWithdraws(List.of(cert("old", 1, 0))).get(5, TimeUnit.SECONDS);

        assertTrue(ready.isEmpty());
    }

    @Test
    void rejectsDecreasingVersions() {
        assertThrows(IllegalArgumentException.class, () -> scheduler.scheduleBalanceWithdraws(List.of(
                cert("tx1", 1, 2),
                cert("tx2", 1, 1)
        )));
    }

    @Test
    void emptySubmissionCompletesImmediately() {
        assertTrue(scheduler.scheduleBalanceWithdraws(List.of()).isDone());
    }

    @Test
    void pendingCertificateRejectsAlreadyExecuted() {
        assertThrows(IllegalArgumentException.class,
                () -> new PendingCertificate(cert("tx", 1, 0), ScheduleStatus.ALREADY_EXECUTED));
    }
}
