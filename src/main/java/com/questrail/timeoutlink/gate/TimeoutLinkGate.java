package com.questrail.timeoutlink.gate;

import com.questrail.timeoutlink.api.RemainingTimeOracle;
import com.questrail.timeoutlink.api.RequestContext;
import com.questrail.timeoutlink.api.RequestPipeline;
import com.questrail.timeoutlink.api.ResponseSink;
import com.questrail.timeoutlink.cancel.CallbackDispatch;
import com.questrail.timeoutlink.cancel.CancellationSource;
import com.questrail.timeoutlink.cancel.CancellationToken;
import com.questrail.timeoutlink.cancel.OperationCancelledException;
import com.questrail.timeoutlink.internal.time.Cancellable;
import com.questrail.timeoutlink.internal.time.MonotonicClock;
import com.questrail.timeoutlink.internal.time.MonotonicScheduler;
import com.questrail.timeoutlink.internal.time.SharedDeadlineScheduler;
import com.questrail.timeoutlink.internal.time.SystemMonotonicClock;
import com.questrail.timeoutlink.internal.time.SystemWallClock;
import com.questrail.timeoutlink.internal.time.WallClock;
import com.questrail.timeoutlink.observability.GateCancellationEvent;
import com.questrail.timeoutlink.observability.GateErrorEvent;
import com.questrail.timeoutlink.observability.GateObservabilitySink;
import com.questrail.timeoutlink.observability.GateShortCircuitEvent;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * TimeoutLinkGate
 * =============================================================================
 * Pipeline stage that links the host's execution deadline with the request's
 * own cancellation signal.
 *
 * <p>While the downstream pipeline runs, {@link RequestContext#cancellation()}
 * is replaced by a combined token that fires when either:</p>
 * <ol>
 *   <li>the original token fires (client disconnect, transport abort), or</li>
 *   <li>the host's remaining time minus the safety buffer runs out.</li>
 * </ol>
 *
 * <p>Without a {@link RemainingTimeOracle} in the request items (local/dev
 * execution) the deadline input is armed with the configured unhosted budget
 * and only the original token is effectively operative.</p>
 *
 * <h2>Terminal statuses</h2>
 * <ul>
 *   <li>No time left at entry: the pipeline is not invoked; 504, empty body.</li>
 *   <li>Combined token fired, deadline first: 504, empty body.</li>
 *   <li>Combined token fired, original first: 499, empty body.</li>
 * </ul>
 * <p>A status is written only if the response has not started. Headers are
 * cleared and the content length set to zero.</p>
 *
 * <h2>Failures</h2>
 * <p>An {@link OperationCancelledException} carrying the combined token, or one
 * of its two inputs, after the combined token fired, is the gate's own induced
 * cancellation: it is reported to the observability sink and not rethrown.
 * Every other failure propagates unchanged.</p>
 *
 * <h2>Placement</h2>
 * <p>Install before any stage that writes the response or reads the
 * cancellation handle.</p>
 *
 * <h2>Callback threads</h2>
 * <p>The deadline timer and the transport only flip state on the combined
 * token. Callbacks that downstream code registers on it run on the callback
 * executor; their failures are reported through
 * {@link GateObservabilitySink#onError} and never reach the timer or transport
 * thread.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>One instance serves all requests concurrently. All per-request state (the
 * deadline timer, the combined source, the attribution cell) is created and
 * released inside a single {@link #handle(RequestContext)} call.</p>
 */
public final class TimeoutLinkGate implements RequestPipeline {

    private final RequestPipeline next;
    private final GateObservabilitySink sink;
    private final TimeoutLinkConfig config;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final Executor callbackExecutor;

    /**
     * Gate with the default 250ms safety buffer on the shared deadline scheduler.
     */
    public TimeoutLinkGate(RequestPipeline next, GateObservabilitySink sink) {
        this(next, sink, TimeoutLinkConfig.defaults());
    }

    /**
     * @throws IllegalArgumentException if {@code safetyBuffer} is negative
     */
    public TimeoutLinkGate(RequestPipeline next, GateObservabilitySink sink, Duration safetyBuffer) {
        this(next, sink, TimeoutLinkConfig.withSafetyBuffer(safetyBuffer));
    }

    public TimeoutLinkGate(RequestPipeline next, GateObservabilitySink sink, TimeoutLinkConfig config) {
        this(next, sink, config,
            SharedDeadlineScheduler.instance(),
            SystemMonotonicClock.INSTANCE,
            SystemWallClock.INSTANCE);
    }

    public TimeoutLinkGate(
        RequestPipeline next,
        GateObservabilitySink sink,
        TimeoutLinkConfig config,
        MonotonicScheduler scheduler,
        MonotonicClock clock,
        WallClock wallClock
    ) {
        this(next, sink, config, scheduler, clock, wallClock, SharedDeadlineScheduler.callbackExecutor());
    }

    /**
     * @param next             downstream pipeline
     * @param sink             receives diagnostic events
     * @param config           safety buffer and unhosted budget
     * @param scheduler        arms the per-request deadline timer
     * @param clock            monotonic clock for the timer and attribution
     *                         timestamps; must be the clock {@code scheduler}
     *                         interprets deadlines with
     * @param wallClock        timestamps for observability events only
     * @param callbackExecutor runs callbacks registered on the combined token
     */
    public TimeoutLinkGate(
        RequestPipeline next,
        GateObservabilitySink sink,
        TimeoutLinkConfig config,
        MonotonicScheduler scheduler,
        MonotonicClock clock,
        WallClock wallClock,
        Executor callbackExecutor
    ) {
        this.next = Objects.requireNonNull(next, "next");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.config = Objects.requireNonNull(config, "config");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.callbackExecutor = Objects.requireNonNull(callbackExecutor, "callbackExecutor");
    }

    public TimeoutLinkConfig config() {
        return config;
    }

    @Override
    public void invoke(RequestContext context) throws Exception {
        handle(context);
    }

    /**
     * Run one request through the gate.
     *
     * @return how the request ended
     * @throws NullPointerException if {@code context} is null
     * @throws Exception            any pipeline failure the gate did not induce
     */
    public GateOutcome handle(RequestContext context) throws Exception {
        Objects.requireNonNull(context, "context");

        try (CancellationHandleLease lease = CancellationHandleLease.borrow(context)) {
            DeadlineBudget budget = DeadlineBudget.compute(lookupOracle(context), config);

            if (budget.isExhausted()) {
                return shortCircuit(context, budget);
            }
            return runLinked(context, lease, budget);
        }
    }

    private GateOutcome runLinked(RequestContext context, CancellationHandleLease lease, DeadlineBudget budget)
        throws Exception
    {
        CancellationToken original = lease.original();
        CancellationAttribution attribution = new CancellationAttribution(clock);
        long armedAtNanos = clock.nowNanos();

        try (CancellationSource deadline = CancellationSource.cancelAfter(budget.effective(), scheduler, clock)) {
            // Recorders go on the inputs before the link so they run ahead of
            // the combined source's own callbacks.
            Cancellable onDisconnect = original.register(attribution.recorder(CancellationCause.CALLER_DISCONNECTED));
            Cancellable onDeadline = deadline.token().register(attribution.recorder(CancellationCause.DEADLINE_EXCEEDED));

            CallbackDispatch dispatch = CallbackDispatch.async(callbackExecutor, failure -> sink.onError(
                new GateErrorEvent(wallClock.now(), context.path(), "Cancellation callback failed", failure)));

            try (CancellationSource linked = CancellationSource.linkedTo(dispatch, original, deadline.token())) {
                lease.substitute(linked.token());

                try {
                    next.invoke(context);
                } catch (OperationCancelledException e) {
                    if (!linked.isCancellationRequested() || !isLinkedToken(e.token(), linked, deadline, original)) {
                        throw e;
                    }
                    return terminate(context, budget, attribution, armedAtNanos, true);
                }

                if (!linked.isCancellationRequested()) {
                    return GateOutcome.COMPLETED;
                }
                return terminate(context, budget, attribution, armedAtNanos, false);
            } finally {
                onDisconnect.cancel();
                onDeadline.cancel();
            }
        }
    }

    private GateOutcome shortCircuit(RequestContext context, DeadlineBudget budget) {
        ResponseSink response = context.response();
        boolean started = response.hasStarted();

        sink.onShortCircuit(new GateShortCircuitEvent(
            wallClock.now(),
            context.path(),
            budget.hostRemaining().orElse(null),
            config.safetyBuffer(),
            started));

        if (!started) {
            writeTerminalStatus(response, CancellationCause.DEADLINE_EXCEEDED);
        }
        return GateOutcome.SHORT_CIRCUITED;
    }

    private GateOutcome terminate(
        RequestContext context,
        DeadlineBudget budget,
        CancellationAttribution attribution,
        long armedAtNanos,
        boolean raised
    ) {
        ResponseSink response = context.response();
        boolean started = response.hasStarted();
        CancellationCause cause = attribution.resolve();
        Duration triggeredAfter = attribution.firstTrigger()
            .map(t -> Duration.ofNanos(Math.max(0, t.atNanos() - armedAtNanos)))
            .orElse(null);

        sink.onCancellation(new GateCancellationEvent(
            wallClock.now(),
            context.path(),
            cause,
            budget.hostRemaining().orElse(null),
            budget.effective(),
            triggeredAfter,
            raised,
            started));

        if (!started) {
            writeTerminalStatus(response, cause);
        }
        return GateOutcome.cancelledBy(cause);
    }

    private static void writeTerminalStatus(ResponseSink response, CancellationCause cause) {
        response.clearHeaders();
        response.setContentLength(0);
        response.setStatus(cause.statusCode());
    }

    private static boolean isLinkedToken(
        CancellationToken observed,
        CancellationSource linked,
        CancellationSource deadline,
        CancellationToken original
    ) {
        return observed == linked.token() || observed == deadline.token() || observed == original;
    }

    private static Optional<RemainingTimeOracle> lookupOracle(RequestContext context) {
        Object item = context.items().get(RemainingTimeOracle.CONTEXT_KEY);
        return item instanceof RemainingTimeOracle oracle ? Optional.of(oracle) : Optional.empty();
    }
}
