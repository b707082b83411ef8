package com.questrail.timeoutlink.gate;

import java.time.Duration;
import java.util.Objects;

/**
 * TimeoutLinkConfig
 * -----------------------------------------------------------------------------
 * Process-wide configuration of a {@link TimeoutLinkGate}. Fixed at
 * construction; not re-read per request.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>safetyBuffer</b>: slack subtracted from the host's reported
 *       remaining time so the request can wind down and flush before the host
 *       terminates the invocation. Must be non-negative.</li>
 *   <li><b>unhostedBudget</b>: deadline used when no remaining-time oracle is
 *       present (local/dev execution). Long enough that it never fires in
 *       practice; it only keeps the deadline wiring uniform. Must be
 *       positive.</li>
 * </ul>
 */
public record TimeoutLinkConfig(Duration safetyBuffer, Duration unhostedBudget) {

    public static final Duration DEFAULT_SAFETY_BUFFER = Duration.ofMillis(250);
    public static final Duration DEFAULT_UNHOSTED_BUDGET = Duration.ofHours(24);

    public TimeoutLinkConfig {
        Objects.requireNonNull(safetyBuffer, "safetyBuffer");
        Objects.requireNonNull(unhostedBudget, "unhostedBudget");

        if (safetyBuffer.isNegative()) {
            throw new IllegalArgumentException("safetyBuffer must be non-negative (current: " + safetyBuffer + ")");
        }
        if (unhostedBudget.isNegative() || unhostedBudget.isZero()) {
            throw new IllegalArgumentException("unhostedBudget must be positive (current: " + unhostedBudget + ")");
        }
    }

    /**
     * Defaults: safetyBuffer 250ms, unhostedBudget 24h.
     */
    public static TimeoutLinkConfig defaults() {
        return new TimeoutLinkConfig(DEFAULT_SAFETY_BUFFER, DEFAULT_UNHOSTED_BUDGET);
    }

    public static TimeoutLinkConfig withSafetyBuffer(Duration safetyBuffer) {
        return new TimeoutLinkConfig(safetyBuffer, DEFAULT_UNHOSTED_BUDGET);
    }
}
