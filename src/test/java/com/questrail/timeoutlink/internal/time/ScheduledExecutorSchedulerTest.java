package com.questrail.timeoutlink.internal.time;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScheduledExecutorSchedulerTest
 * -----------------------------------------------------------------------------
 * Tests for the production scheduler that arms gate deadline timers.
 *
 * Note: These tests use real time and may be slightly flaky on heavily loaded
 * systems. Tolerances are set generously to avoid false failures.
 */
class ScheduledExecutorSchedulerTest {

    private ScheduledExecutorService executor;
    private ScheduledExecutorScheduler scheduler;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadScheduledExecutor();
        scheduler = new ScheduledExecutorScheduler(executor, SystemMonotonicClock.INSTANCE);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void taskExecutesAfterDelay() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        long before = System.nanoTime();

        scheduler.scheduleAfter(Duration.ofMillis(50), SystemMonotonicClock.INSTANCE, latch::countDown);

        assertTrue(latch.await(2, TimeUnit.SECONDS), "Task should execute");
        assertTrue(System.nanoTime() - before >= TimeUnit.MILLISECONDS.toNanos(50), "Never early");
    }

    @Test
    void pastDeadlineExecutesImmediately() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        long deadline = SystemMonotonicClock.INSTANCE.nowNanos() - TimeUnit.SECONDS.toNanos(1);
        scheduler.scheduleAtNanos(deadline, latch::countDown);

        assertTrue(latch.await(500, TimeUnit.MILLISECONDS), "Task should execute immediately");
    }

    @Test
    void cancelPreventsExecution() throws InterruptedException {
        AtomicBoolean executed = new AtomicBoolean(false);

        Cancellable handle = scheduler.scheduleAfter(
            Duration.ofMillis(100), SystemMonotonicClock.INSTANCE, () -> executed.set(true));

        assertTrue(handle.cancel(), "Cancel should succeed");

        Thread.sleep(150);

        assertFalse(executed.get(), "Cancelled task should not execute");
    }

    @Test
    void cancelAfterExecutionReturnsFalse() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        Cancellable handle = scheduler.scheduleAtNanos(SystemMonotonicClock.INSTANCE.nowNanos(), latch::countDown);

        assertTrue(latch.await(500, TimeUnit.MILLISECONDS));
        // The future completes just after the task body returns.
        Thread.sleep(20);

        assertFalse(handle.cancel(), "Cancel after execution should return false");
    }

    @Test
    void tasksRunOnExecutorThread() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<Thread> ranOn = new AtomicReference<>();

        scheduler.scheduleAfter(Duration.ZERO, SystemMonotonicClock.INSTANCE, () -> {
            ranOn.set(Thread.currentThread());
            latch.countDown();
        });

        assertTrue(latch.await(500, TimeUnit.MILLISECONDS));
        assertNotSame(Thread.currentThread(), ranOn.get());
    }

    @Test
    void sharedSchedulerUsesDaemonThread() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        AtomicBoolean daemon = new AtomicBoolean(false);

        SharedDeadlineScheduler.instance().scheduleAfter(Duration.ZERO, SystemMonotonicClock.INSTANCE, () -> {
            daemon.set(Thread.currentThread().isDaemon());
            latch.countDown();
        });

        assertTrue(latch.await(500, TimeUnit.MILLISECONDS));
        assertTrue(daemon.get());
        assertSame(SharedDeadlineScheduler.instance(), SharedDeadlineScheduler.instance());
    }
}
