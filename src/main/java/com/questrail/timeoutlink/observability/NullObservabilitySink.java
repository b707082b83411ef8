package com.questrail.timeoutlink.observability;

/**
 * No-op implementation of GateObservabilitySink.
 */
public final class NullObservabilitySink implements GateObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onCancellation(GateCancellationEvent event) {}

    @Override
    public void onShortCircuit(GateShortCircuitEvent event) {}

    @Override
    public void onError(GateErrorEvent event) {}
}
