package com.questrail.timeoutlink.gate;

/**
 * GateOutcome
 * -----------------------------------------------------------------------------
 * Terminal state of one pass through the gate.
 *
 * <pre>
 *   ARMED ──► RUNNING ──► COMPLETED
 *     │                ├─► CANCELLED_DEADLINE
 *     │                └─► CANCELLED_DISCONNECT
 *     └──────────────────► SHORT_CIRCUITED
 * </pre>
 *
 * <p>The states are mutually exclusive. Every one of them is reached only
 * after the original cancellation handle has been restored. A pipeline
 * failure the gate did not cause has no outcome; it propagates.</p>
 */
public enum GateOutcome {
    COMPLETED,
    SHORT_CIRCUITED,
    CANCELLED_DEADLINE,
    CANCELLED_DISCONNECT;

    public static GateOutcome cancelledBy(CancellationCause cause) {
        return switch (cause) {
            case DEADLINE_EXCEEDED -> CANCELLED_DEADLINE;
            case CALLER_DISCONNECTED -> CANCELLED_DISCONNECT;
        };
    }

    /**
     * @return {@code true} if the gate answered the request with a terminal
     *         status instead of letting the pipeline's response through
     */
    public boolean isTerminal() {
        return this != COMPLETED;
    }
}
