package com.questrail.timeoutlink.cancel;

import com.questrail.timeoutlink.internal.time.Cancellable;
import com.questrail.timeoutlink.time.DeterministicScheduler;
import com.questrail.timeoutlink.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CancellationSourceTest
 * -----------------------------------------------------------------------------
 * Explicit, timed and linked sources. Timed sources run on the deterministic
 * scheduler so nothing here depends on real time except the await tests.
 */
class CancellationSourceTest {

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
    }

    @Test
    void newSourceIsNotCancelled() {
        CancellationSource source = CancellationSource.create();

        assertFalse(source.isCancellationRequested());
        assertFalse(source.token().isCancellationRequested());
        assertDoesNotThrow(() -> source.token().throwIfCancellationRequested());
    }

    @Test
    void cancelRunsCallbacksOnceInRegistrationOrder() {
        CancellationSource source = CancellationSource.create();
        List<String> calls = new ArrayList<>();

        source.token().register(() -> calls.add("first"));
        source.token().register(() -> calls.add("second"));

        source.cancel();
        source.cancel();

        assertEquals(List.of("first", "second"), calls);
        assertTrue(source.token().isCancellationRequested());
    }

    @Test
    void registerAfterCancelRunsInline() {
        CancellationSource source = CancellationSource.create();
        source.cancel();

        AtomicInteger runs = new AtomicInteger();
        Cancellable registration = source.token().register(runs::incrementAndGet);

        assertEquals(1, runs.get());
        assertFalse(registration.cancel(), "Nothing left to unregister");
    }

    @Test
    void unregisteredCallbackDoesNotRun() {
        CancellationSource source = CancellationSource.create();
        AtomicInteger runs = new AtomicInteger();

        Cancellable registration = source.token().register(runs::incrementAndGet);
        assertTrue(registration.cancel());

        source.cancel();

        assertEquals(0, runs.get());
    }

    @Test
    void failingCallbackDoesNotStopLaterCallbacks() {
        CancellationSource source = CancellationSource.create();
        AtomicInteger runs = new AtomicInteger();

        source.token().register(() -> { throw new IllegalStateException("first"); });
        source.token().register(runs::incrementAndGet);
        source.token().register(() -> { throw new IllegalArgumentException("third"); });

        IllegalStateException thrown = assertThrows(IllegalStateException.class, source::cancel);

        assertEquals(1, runs.get());
        assertEquals(1, thrown.getSuppressed().length);
        assertInstanceOf(IllegalArgumentException.class, thrown.getSuppressed()[0]);
        assertTrue(source.isCancellationRequested());
    }

    @Test
    void throwIfCancellationRequestedCarriesTheToken() {
        CancellationSource source = CancellationSource.create();
        source.cancel();

        OperationCancelledException thrown = assertThrows(OperationCancelledException.class,
            () -> source.token().throwIfCancellationRequested());

        assertSame(source.token(), thrown.token());
    }

    @Test
    void timedSourceFiresAtDeadline() {
        CancellationSource source = CancellationSource.cancelAfter(Duration.ofMillis(40), scheduler, clock);

        scheduler.advanceMillis(39);
        assertFalse(source.isCancellationRequested());

        scheduler.advanceMillis(1);
        assertTrue(source.isCancellationRequested());
    }

    @Test
    void timedSourceWithZeroDelayFiresOnFirstRun() {
        CancellationSource source = CancellationSource.cancelAfter(Duration.ZERO, scheduler, clock);

        assertFalse(source.isCancellationRequested(), "Fires on the scheduler, not inline");
        scheduler.runDueTasks();
        assertTrue(source.isCancellationRequested());
    }

    @Test
    void timedSourceRejectsNegativeDelay() {
        assertThrows(IllegalArgumentException.class,
            () -> CancellationSource.cancelAfter(Duration.ofMillis(-1), scheduler, clock));
    }

    @Test
    void timedSourceSaturatesVeryLongDelays() {
        clock.advance(Duration.ofSeconds(1));

        CancellationSource source = CancellationSource.cancelAfter(Duration.ofSeconds(Long.MAX_VALUE), scheduler, clock);

        scheduler.advanceMillis(1_000_000);
        assertFalse(source.isCancellationRequested());
        assertEquals(1, scheduler.armedCount());
    }

    @Test
    void closeDisarmsTimer() {
        CancellationSource source = CancellationSource.cancelAfter(Duration.ofMillis(10), scheduler, clock);
        assertEquals(1, scheduler.armedCount());

        source.close();

        assertEquals(0, scheduler.armedCount());
        scheduler.advanceMillis(50);
        assertFalse(source.isCancellationRequested());
    }

    @Test
    void closeIsIdempotentAndDoesNotFire() {
        CancellationSource source = CancellationSource.create();
        AtomicInteger runs = new AtomicInteger();
        source.token().register(runs::incrementAndGet);

        source.close();
        source.close();

        assertFalse(source.isCancellationRequested());
        assertEquals(0, runs.get());

        source.cancel();
        assertEquals(1, runs.get(), "Explicit cancel still runs callbacks after close");
    }

    @Test
    void linkedSourceFiresWhenAnyInputFires() {
        CancellationSource first = CancellationSource.create();
        CancellationSource second = CancellationSource.create();
        CancellationSource linked = CancellationSource.linkedTo(first.token(), second.token());

        assertFalse(linked.isCancellationRequested());

        second.cancel();

        assertTrue(linked.isCancellationRequested());
        assertFalse(first.isCancellationRequested(), "Linking never propagates upstream");
    }

    @Test
    void linkedSourceIsAlreadyCancelledWhenAnInputHasFired() {
        CancellationSource input = CancellationSource.create();
        input.cancel();

        CancellationSource linked = CancellationSource.linkedTo(CancellationToken.NONE, input.token());

        assertTrue(linked.isCancellationRequested());
    }

    @Test
    void linkedSourceFollowsTimedInput() {
        CancellationSource timed = CancellationSource.cancelAfter(Duration.ofMillis(5), scheduler, clock);
        CancellationSource linked = CancellationSource.linkedTo(CancellationToken.NONE, timed.token());

        scheduler.advanceMillis(5);

        assertTrue(linked.isCancellationRequested());
    }

    @Test
    void closedLinkedSourceNoLongerFollowsInputs() {
        CancellationSource input = CancellationSource.create();
        CancellationSource linked = CancellationSource.linkedTo(input.token());

        linked.close();
        input.cancel();

        assertFalse(linked.isCancellationRequested());
    }

    @Test
    void linkedSourceRejectsNullInput() {
        assertThrows(NullPointerException.class, () -> CancellationSource.linkedTo(CancellationToken.NONE, null));
    }

    @Test
    void noneTokenNeverFires() throws InterruptedException {
        AtomicInteger runs = new AtomicInteger();
        Cancellable registration = CancellationToken.NONE.register(runs::incrementAndGet);

        assertFalse(CancellationToken.NONE.isCancellationRequested());
        assertFalse(CancellationToken.NONE.await(Duration.ofMillis(1)));
        assertFalse(registration.cancel());
        assertEquals(0, runs.get());
    }

    @Test
    void awaitReturnsWhenCancelledFromAnotherThread() throws InterruptedException {
        CancellationSource source = CancellationSource.create();
        CountDownLatch waiting = new CountDownLatch(1);

        Thread canceller = new Thread(() -> {
            try {
                waiting.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            source.cancel();
        });
        canceller.start();

        waiting.countDown();
        assertTrue(source.token().await(Duration.ofSeconds(5)));
        canceller.join(5_000);
    }

    @Test
    void awaitTimesOutWhenNotCancelled() throws InterruptedException {
        CancellationSource source = CancellationSource.create();

        assertFalse(source.token().await(Duration.ofMillis(20)));
    }

    @Test
    void asyncLinkedSourceHandsCallbacksToExecutorAfterReleasingWaiters() throws InterruptedException {
        List<Runnable> handedOff = new ArrayList<>();
        List<RuntimeException> failures = new ArrayList<>();
        CancellationSource input = CancellationSource.create();
        CancellationSource linked = CancellationSource.linkedTo(
            CallbackDispatch.async(handedOff::add, failures::add), input.token());
        List<String> calls = new ArrayList<>();
        linked.token().register(() -> calls.add("first"));
        linked.token().register(() -> calls.add("second"));

        input.cancel();

        assertTrue(linked.isCancellationRequested());
        assertTrue(linked.token().await(Duration.ZERO), "waiters do not wait for callbacks");
        assertTrue(calls.isEmpty());
        assertEquals(1, handedOff.size());

        handedOff.get(0).run();

        assertEquals(List.of("first", "second"), calls);
        assertTrue(failures.isEmpty());
    }

    @Test
    void asyncCallbackFailureGoesToHandlerAndNeverReachesTheFiringThread() {
        List<RuntimeException> failures = new ArrayList<>();
        CancellationSource input = CancellationSource.create();
        CancellationSource linked = CancellationSource.linkedTo(
            CallbackDispatch.async(Runnable::run, failures::add), input.token());
        IllegalStateException boom = new IllegalStateException("boom");
        AtomicInteger later = new AtomicInteger();
        linked.token().register(() -> {
            throw boom;
        });
        linked.token().register(later::incrementAndGet);

        assertDoesNotThrow(input::cancel);

        assertEquals(List.of(boom), failures);
        assertEquals(1, later.get());
    }

    @Test
    void rejectedHandOffRunsCallbacksOnTheFiringThread() {
        List<RuntimeException> failures = new ArrayList<>();
        CancellationSource linked = CancellationSource.linkedTo(
            CallbackDispatch.async(task -> {
                throw new RejectedExecutionException("shut down");
            }, failures::add));
        List<Thread> ranOn = new ArrayList<>();
        linked.token().register(() -> ranOn.add(Thread.currentThread()));

        linked.cancel();

        assertEquals(List.of(Thread.currentThread()), ranOn);
        assertTrue(failures.isEmpty());
    }

    @Test
    void concurrentCancelRunsCallbacksOnce() throws InterruptedException {
        for (int round = 0; round < 200; round++) {
            CancellationSource source = CancellationSource.create();
            AtomicInteger runs = new AtomicInteger();
            source.token().register(runs::incrementAndGet);

            CountDownLatch go = new CountDownLatch(1);
            Thread a = new Thread(() -> awaitThen(go, source::cancel));
            Thread b = new Thread(() -> awaitThen(go, source::cancel));
            a.start();
            b.start();
            go.countDown();
            a.join(5_000);
            b.join(5_000);

            assertEquals(1, runs.get(), "round " + round);
        }
    }

    private static void awaitThen(CountDownLatch latch, Runnable action) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        action.run();
    }
}
