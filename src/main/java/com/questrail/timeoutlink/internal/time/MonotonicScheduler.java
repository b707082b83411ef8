package com.questrail.timeoutlink.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Arms one-shot tasks against a monotonic deadline. The gate uses it for the
 * per-request deadline timer; tests substitute a deterministic implementation.
 *
 * <h2>Binding invariant</h2>
 * Deadlines are expressed in monotonic nanoseconds or durations, never in
 * wall-clock instants.
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos deadline in nanoseconds (from {@link MonotonicClock#nowNanos()})
     * @param task          task to run once
     * @return handle that disarms the task
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Schedule a task to run once {@code delay} has elapsed on {@code clock}.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        // Saturate instead of overflowing for very long delays.
        long now = clock.nowNanos();
        long delayNanos = saturatedNanos(delay);
        long deadline = delayNanos > Long.MAX_VALUE - now ? Long.MAX_VALUE : now + delayNanos;
        return scheduleAtNanos(deadline, task);
    }

    private static long saturatedNanos(Duration delay)
    {
        try {
            return delay.toNanos();
        } catch (ArithmeticException overflow) {
            return Long.MAX_VALUE;
        }
    }
}
