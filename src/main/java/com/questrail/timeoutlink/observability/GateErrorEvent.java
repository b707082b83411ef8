package com.questrail.timeoutlink.observability;

import java.time.Instant;

/**
 * Record representing a failure in the host that the gate did not cause.
 */
public record GateErrorEvent(
    Instant timestamp,
    String path,
    String message,
    Throwable cause
) {
}
