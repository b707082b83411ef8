package com.questrail.timeoutlink.internal.time;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} backed by a {@link ScheduledExecutorService}.
 *
 * <h2>Notification thread</h2>
 * <p>Deadline timers fire on the executor's thread, not on the request thread.
 * Anything a timer task triggers (cancellation callbacks, attribution writes)
 * therefore runs concurrently with the pipeline the gate is waiting on.</p>
 *
 * <h2>Executor ownership</h2>
 * <p>This class does <strong>not</strong> own the executor. The composition
 * root that created it is responsible for shutdown.</p>
 *
 * <h2>Precision</h2>
 * <p>Tasks may run slightly after their deadline under load, never before.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    /**
     * @param executor executor that runs the timer tasks
     * @param clock    clock used to turn deadlines into relative delays; must be
     *                 the same clock callers compute deadlines with
     */
    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        // Past deadlines run immediately.
        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());
        ScheduledFuture<?> future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);
        return new ScheduledFutureCancellable(future);
    }

    private static final class ScheduledFutureCancellable implements Cancellable {
        private final ScheduledFuture<?> future;

        private ScheduledFutureCancellable(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public boolean cancel() {
            return future.cancel(false);
        }
    }
}
