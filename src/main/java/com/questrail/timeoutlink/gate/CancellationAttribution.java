package com.questrail.timeoutlink.gate;

import com.questrail.timeoutlink.internal.time.MonotonicClock;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * CancellationAttribution
 * -----------------------------------------------------------------------------
 * Records which linked input fired first.
 *
 * <p>One recorder is registered on each input. Recorders may run concurrently
 * on different notification threads (the timer thread, the transport thread).
 * Both write into a single cell by compare-and-set, so the first recorder to
 * complete is the cause and the cell never changes afterwards. There is no
 * window in which two flags are both set with ambiguous ordering.</p>
 *
 * <p>The gate reads the cell only after the pipeline call has returned or
 * thrown.</p>
 */
final class CancellationAttribution {

    record Trigger(CancellationCause cause, long atNanos) {
    }

    private final MonotonicClock clock;
    private final AtomicReference<Trigger> first = new AtomicReference<>();

    CancellationAttribution(MonotonicClock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    Runnable recorder(CancellationCause cause) {
        Objects.requireNonNull(cause, "cause");
        return () -> record(cause);
    }

    /**
     * @return {@code true} if this call decided the attribution
     */
    boolean record(CancellationCause cause) {
        return first.compareAndSet(null, new Trigger(cause, clock.nowNanos()));
    }

    Optional<Trigger> firstTrigger() {
        return Optional.ofNullable(first.get());
    }

    /**
     * Resolve the cause. An empty cell resolves to
     * {@link CancellationCause#DEADLINE_EXCEEDED}.
     */
    CancellationCause resolve() {
        Trigger trigger = first.get();
        return trigger == null ? CancellationCause.DEADLINE_EXCEEDED : trigger.cause();
    }
}
