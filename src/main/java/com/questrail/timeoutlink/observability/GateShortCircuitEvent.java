package com.questrail.timeoutlink.observability;

import java.time.Duration;
import java.time.Instant;

/**
 * Record describing a request rejected before entering the pipeline because
 * the host had no more than the safety buffer left.
 */
public record GateShortCircuitEvent(
    Instant timestamp,
    String path,
    Duration hostRemaining,
    Duration safetyBuffer,
    boolean responseStarted
) {
}
