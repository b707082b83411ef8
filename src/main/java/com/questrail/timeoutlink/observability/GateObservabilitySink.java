package com.questrail.timeoutlink.observability;

/**
 * Receives diagnostic events from the timeout-link gate and the host adapter.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks run on the request thread (gate events) or on host threads
 * (errors). Implementations must be thread-safe.</p>
 */
public interface GateObservabilitySink {

    /**
     * Called when the gate handled a cancellation it induced, whether the
     * pipeline raised it or stopped silently.
     */
    void onCancellation(GateCancellationEvent event);

    /**
     * Called when a request arrived with no usable budget left and the pipeline
     * was skipped.
     */
    void onShortCircuit(GateShortCircuitEvent event);

    /**
     * Called when the host failed to process a request for a reason the gate
     * did not cause.
     */
    void onError(GateErrorEvent event);
}
