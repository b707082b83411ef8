package com.questrail.timeoutlink.internal.time;

/**
 * SystemMonotonicClock
 * =============================================================================
 * Production {@link MonotonicClock} backed by {@link System#nanoTime()}.
 *
 * <p>Unaffected by NTP or manual wall-clock changes, so a deadline timer armed
 * against it cannot fire early or late because the host clock was adjusted.
 * Tests use {@code ManualMonotonicClock} instead.</p>
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
