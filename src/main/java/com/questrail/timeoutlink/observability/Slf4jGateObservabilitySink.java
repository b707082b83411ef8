package com.questrail.timeoutlink.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of GateObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jGateObservabilitySink implements GateObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jGateObservabilitySink.class);

    @Override
    public void onCancellation(GateCancellationEvent event) {
        if (event.raised()) {
            log.warn("Request cancelled ({}). Path: {}, RemainingTimeMs: {}, BudgetMs: {}, TriggeredAfterMs: {}",
                event.cause().description(),
                event.path(),
                event.hostRemainingMillis(),
                event.budget().toMillis(),
                event.triggeredAfterMillis());
        } else {
            log.warn("Request stopped after cancellation ({}) without raising. Path: {}, RemainingTimeMs: {}, BudgetMs: {}, TriggeredAfterMs: {}",
                event.cause().description(),
                event.path(),
                event.hostRemainingMillis(),
                event.budget().toMillis(),
                event.triggeredAfterMillis());
        }

        if (event.responseStarted()) {
            log.debug("Response for {} already started; status left unchanged", event.path());
        }
    }

    @Override
    public void onShortCircuit(GateShortCircuitEvent event) {
        log.warn("Request rejected before processing, no time left. Path: {}, RemainingTimeMs: {}, SafetyBufferMs: {}",
            event.path(),
            event.hostRemaining() != null ? event.hostRemaining().toMillis() : null,
            event.safetyBuffer().toMillis());
    }

    @Override
    public void onError(GateErrorEvent event) {
        log.error("Request failed. Path: {}: {}", event.path(), event.message(), event.cause());
    }
}
