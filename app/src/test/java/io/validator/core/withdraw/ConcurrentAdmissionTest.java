package io.validator.core.withdraw;

import io.validator.core.protocol.BalanceSettlement;
import io.validator.core.protocol.BalanceWithdraw;
import io.validator.core.protocol.ObjectId;
import io.validator.core.state.InMemoryAccumulatorStore;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static io.validator.core.withdraw.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ConcurrentAdmissionTest {

    private static final int THREADS = 8;

    private final ObjectId alice = account("alice");
    private final ObjectId bob = account("bob");

    private InMemoryAccumulatorStore seededStore() {
        InMemoryAccumulatorStore store = new InMemoryAccumulatorStore();
        store.setBalance(alice, BigInteger.valueOf(1000));
        store.setBalance(bob, BigInteger.valueOf(1000));
        return store;
    }

    @Test
    void naiveGrantsOnlyOneOfCompetingWithdraws() throws Exception {
        try (BalanceWithdrawScheduler scheduler = new NaiveBalanceWithdrawScheduler(seededStore(), 0, 4)) {
            assertOneGranted(scheduler);
        }
    }

    @Test
    void eagerGrantsOnlyOneOfCompetingWithdraws() throws Exception {
        try (BalanceWithdrawScheduler scheduler = new EagerBalanceWithdrawScheduler(seededStore(), 0)) {
            assertOneGranted(scheduler);
        }
    }

    @Test
    void opposingMultiAccountWithdrawsDoNotDeadlock() throws Exception {
        try (BalanceWithdrawScheduler scheduler = new EagerBalanceWithdrawScheduler(seededStore(), 0)) {
            List<ScheduleStatus> statuses = race(i -> {
                BalanceWithdraw.Builder b = BalanceWithdraw.builder().txDigest(digest("multi-" + i));
                // builder sorts by id, submission order alternates
                if (i % 2 == 0) {
                    b.atMost(alice, 100).atMost(bob, 100);
                } else {
                    b.atMost(bob, 100).atMost(alice, 100);
                }
                return b.build();
            }, scheduler);

            assertEquals(THREADS, statuses.stream().filter(s -> s == ScheduleStatus.SUFFICIENT_BALANCE).count());
        }
    }

    @Test
    void naivePendingReadDoesNotDelayOtherAccounts() throws Exception {
        FlakyFundsReader reader = new FlakyFundsReader(seededStore());
        try (BalanceWithdrawScheduler scheduler = new NaiveBalanceWithdrawScheduler(reader, 0, 4)) {
            assertOtherAccountsProceed(scheduler, reader);
        }
    }

    @Test
    void eagerPendingReadDoesNotDelayOtherAccounts() throws Exception {
        FlakyFundsReader reader = new FlakyFundsReader(seededStore());
        try (BalanceWithdrawScheduler scheduler = new EagerBalanceWithdrawScheduler(reader, 0)) {
            assertOtherAccountsProceed(scheduler, reader);
        }
    }

    @Test
    void naiveSettlementProceedsWhileReadIsPending() throws Exception {
        InMemoryAccumulatorStore store = seededStore();
        FlakyFundsReader reader = new FlakyFundsReader(store);
        try (BalanceWithdrawScheduler scheduler = new NaiveBalanceWithdrawScheduler(reader, 0, 4)) {
            assertSettlementProceeds(scheduler, store, reader);
        }
    }

    @Test
    void eagerSettlementProceedsWhileReadIsPending() throws Exception {
        InMemoryAccumulatorStore store = seededStore();
        FlakyFundsReader reader = new FlakyFundsReader(store);
        try (BalanceWithdrawScheduler scheduler = new EagerBalanceWithdrawScheduler(reader, 0)) {
            assertSettlementProceeds(scheduler, store, reader);
        }
    }

    @Test
    void naiveDecidesSameAccountInSubmissionOrder() throws Exception {
        FlakyFundsReader reader = new FlakyFundsReader(seededStore());
        try (BalanceWithdrawScheduler scheduler = new NaiveBalanceWithdrawScheduler(reader, 0, 4)) {
            assertSubmissionOrderKept(scheduler, reader);
        }
    }

    @Test
    void eagerDecidesSameAccountInSubmissionOrder() throws Exception {
        FlakyFundsReader reader = new FlakyFundsReader(seededStore());
        try (BalanceWithdrawScheduler scheduler = new EagerBalanceWithdrawScheduler(reader, 0)) {
            assertSubmissionOrderKept(scheduler, reader);
        }
    }

    @Test
    void closeFailsBatchWaitingOnStorage() throws Exception {
        FlakyFundsReader reader = new FlakyFundsReader(seededStore());
        reader.gated.add(alice);
        try {
            BalanceWithdrawScheduler scheduler = new EagerBalanceWithdrawScheduler(reader, 0);
            CompletableFuture<ScheduleResult> held =
                    scheduler.scheduleWithdraws(0, List.of(atMost("held", alice, 1))).get(0);
            assertTrue(reader.gatedReadStarted.await(5, TimeUnit.SECONDS));

            scheduler.close();

            ExecutionException error = assertThrows(ExecutionException.class, () -> held.get(5, TimeUnit.SECONDS));
            assertTrue(error.getCause() instanceof WithdrawSchedulerStoppedException);
        } finally {
            reader.gateOpen.countDown();
        }
    }

    private void assertOtherAccountsProceed(BalanceWithdrawScheduler scheduler, FlakyFundsReader reader) throws Exception {
        reader.gated.add(alice);
        try {
            CompletableFuture<ScheduleResult> held =
                    scheduler.scheduleWithdraws(0, List.of(atMost("held", alice, 100))).get(0);
            assertTrue(reader.gatedReadStarted.await(5, TimeUnit.SECONDS));

            ScheduleStatus free = assertTimeoutPreemptively(Duration.ofSeconds(5), () ->
                    scheduler.scheduleWithdraws(0, List.of(atMost("free", bob, 100))).get(0).get().status());

            assertEquals(ScheduleStatus.SUFFICIENT_BALANCE, free);
            assertFalse(held.isDone());
            reader.gateOpen.countDown();
            assertEquals(ScheduleStatus.SUFFICIENT_BALANCE, held.get(5, TimeUnit.SECONDS).status());
        } finally {
            reader.gateOpen.countDown();
        }
    }

    private void assertSettlementProceeds(BalanceWithdrawScheduler scheduler,
                                          InMemoryAccumulatorStore store,
                                          FlakyFundsReader reader) throws Exception {
        // bob already loaded, alice's load hangs
        assertEquals(ScheduleStatus.SUFFICIENT_BALANCE,
                scheduler.scheduleWithdraws(0, List.of(atMost("warm", bob, 1))).get(0).get(5, TimeUnit.SECONDS).status());
        reader.gated.add(alice);
        try {
            CompletableFuture<ScheduleResult> held =
                    scheduler.scheduleWithdraws(0, List.of(atMost("held", alice, 100))).get(0);
            assertTrue(reader.gatedReadStarted.await(5, TimeUnit.SECONDS));

            ScheduleStatus next = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
                store.applyBalanceChanges(BalanceSettlement.withoutChanges(1));
                scheduler.settleBalances(BalanceSettlement.withoutChanges(1));
                return scheduler.scheduleWithdraws(1, List.of(atMost("next", bob, 1000))).get(0).get().status();
            });

            assertEquals(1, scheduler.accumulatorVersion());
            assertEquals(ScheduleStatus.SUFFICIENT_BALANCE, next);
            reader.gateOpen.countDown();
            assertEquals(ScheduleStatus.ALREADY_EXECUTED, held.get(5, TimeUnit.SECONDS).status());
        } finally {
            reader.gateOpen.countDown();
        }
    }

    private void assertSubmissionOrderKept(BalanceWithdrawScheduler scheduler, FlakyFundsReader reader) throws Exception {
        reader.gated.add(alice);
        try {
            CompletableFuture<ScheduleResult> first =
                    scheduler.scheduleWithdraws(0, List.of(atMost("first", alice, 600))).get(0);
            CompletableFuture<ScheduleResult> second =
                    scheduler.scheduleWithdraws(0, List.of(atMost("second", alice, 600))).get(0);
            assertTrue(reader.gatedReadStarted.await(5, TimeUnit.SECONDS));
            assertFalse(first.isDone());
            assertFalse(second.isDone());

            reader.gateOpen.countDown();

            assertEquals(ScheduleStatus.SUFFICIENT_BALANCE, first.get(5, TimeUnit.SECONDS).status());
            assertEquals(ScheduleStatus.INSUFFICIENT_BALANCE, second.get(5, TimeUnit.SECONDS).status());
        } finally {
            reader.gateOpen.countDown();
        }
    }

    private void assertOneGranted(BalanceWithdrawScheduler scheduler) throws Exception {
        List<ScheduleStatus> statuses = race(i -> atMost("tx-" + i, alice, 600), scheduler);

        assertEquals(1, statuses.stream().filter(s -> s == ScheduleStatus.SUFFICIENT_BALANCE).count());
        assertEquals(THREADS - 1, statuses.stream().filter(s -> s == ScheduleStatus.INSUFFICIENT_BALANCE).count());
    }

    private List<ScheduleStatus> race(Function<Integer, BalanceWithdraw> withdraws,
                                      BalanceWithdrawScheduler scheduler) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<ScheduleStatus>> results = new ArrayList<>();
            for (int i = 0; i < THREADS; i++) {
                BalanceWithdraw withdraw = withdraws.apply(i);
                results.add(pool.submit(() -> {
                    start.await();
                    return scheduler.scheduleWithdraws(0, List.of(withdraw)).get(0).get(10, TimeUnit.SECONDS).status();
                }));
            }
            start.countDown();
            List<ScheduleStatus> statuses = new ArrayList<>();
            for (Future<ScheduleStatus> f : results) {
                statuses.add(f.get(10, TimeUnit.SECONDS));
            }
            return statuses;
        } finally {
            pool.shutdownNow();
        }
    }
}
