package com.questrail.timeoutlink.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for deadline arithmetic and attribution timestamps.
 *
 * <h2>Binding invariant</h2>
 * Deadline timers and the ordering of cancellation triggers MUST use a
 * monotonic source. Wall-clock time is permitted only for observability
 * records (see {@link WallClock}).
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Values are
     * only meaningful relative to each other.
     */
    long nowNanos();
}
