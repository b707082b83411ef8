package com.questrail.timeoutlink.api;

import com.questrail.timeoutlink.internal.time.MonotonicClock;

import java.time.Duration;
import java.util.Objects;

/**
 * RemainingTimeOracle
 * =============================================================================
 * Host-provided view of how much execution time is left before the host
 * forcibly terminates the current invocation.
 *
 * <p>A time-boxed host publishes an oracle into {@link RequestContext#items()}
 * under {@link #CONTEXT_KEY}. Its absence is the normal state for local or
 * non-hosted execution and is not an error.</p>
 */
@FunctionalInterface
public interface RemainingTimeOracle
{
    /**
     * Well-known request item key.
     */
    String CONTEXT_KEY = "timeoutlink.remainingTimeOracle";

    /**
     * @return time left before forced termination; may be zero or negative
     *         once the host deadline has passed
     */
    Duration remainingTime();

    /**
     * Oracle counting down to an absolute monotonic deadline.
     *
     * @param clock         clock the deadline was computed with
     * @param deadlineNanos deadline in {@code clock} ticks
     */
    static RemainingTimeOracle untilDeadline(MonotonicClock clock, long deadlineNanos)
    {
        Objects.requireNonNull(clock, "clock");
        return () -> Duration.ofNanos(deadlineNanos - clock.nowNanos());
    }
}
