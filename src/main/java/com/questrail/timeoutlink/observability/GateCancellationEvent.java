package com.questrail.timeoutlink.observability;

import com.questrail.timeoutlink.gate.CancellationCause;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Record describing a cancellation induced by the gate.
 *
 * @param timestamp        wall-clock time the gate handled the cancellation
 * @param path             request path
 * @param cause            attributed cause
 * @param hostRemaining    remaining time the host reported when the budget was
 *                         computed; {@code null} when running unhosted
 * @param budget           effective budget the deadline timer was armed with
 * @param triggeredAfter   time from arming the combined token to the first
 *                         input firing; zero if an input had already fired,
 *                         {@code null} if no trigger was recorded
 * @param raised           {@code true} if the pipeline unwound with a
 *                         cancellation failure, {@code false} if it returned
 *                         normally after the signal fired
 * @param responseStarted  {@code true} if the response had already started, in
 *                         which case no status was written
 */
public record GateCancellationEvent(
    Instant timestamp,
    String path,
    CancellationCause cause,
    Duration hostRemaining,
    Duration budget,
    Duration triggeredAfter,
    boolean raised,
    boolean responseStarted
) {
    public GateCancellationEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(cause, "cause");
        Objects.requireNonNull(budget, "budget");
    }

    /**
     * @return host remaining time in milliseconds, or {@code null} when unhosted
     */
    public Long hostRemainingMillis() {
        return hostRemaining == null ? null : hostRemaining.toMillis();
    }

    /**
     * @return trigger delay in milliseconds, or {@code null} if unknown
     */
    public Long triggeredAfterMillis() {
        return triggeredAfter == null ? null : triggeredAfter.toMillis();
    }
}
