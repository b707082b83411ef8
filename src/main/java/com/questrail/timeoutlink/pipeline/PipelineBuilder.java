package com.questrail.timeoutlink.pipeline;

import com.questrail.timeoutlink.api.Middleware;
import com.questrail.timeoutlink.api.RequestPipeline;
import com.questrail.timeoutlink.gate.TimeoutLinkConfig;
import com.questrail.timeoutlink.gate.TimeoutLinkGate;
import com.questrail.timeoutlink.internal.time.MonotonicClock;
import com.questrail.timeoutlink.internal.time.MonotonicScheduler;
import com.questrail.timeoutlink.internal.time.SharedDeadlineScheduler;
import com.questrail.timeoutlink.internal.time.SystemMonotonicClock;
import com.questrail.timeoutlink.internal.time.SystemWallClock;
import com.questrail.timeoutlink.internal.time.WallClock;
import com.questrail.timeoutlink.observability.GateObservabilitySink;
import com.questrail.timeoutlink.observability.NullObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * PipelineBuilder
 * =============================================================================
 * Composes middleware stages in front of a terminal request handler.
 *
 * <p>Stages run in installation order: the first stage installed is the
 * outermost and sees the request first.</p>
 *
 * <pre>{@code
 * RequestPipeline pipeline = PipelineBuilder.create()
 *     .withObservabilitySink(new Slf4jGateObservabilitySink())
 *     .useTimeoutLinkedCancellation(Duration.ofMillis(500))
 *     .use(next -> ctx -> { audit(ctx); next.invoke(ctx); })
 *     .run(ctx -> handleOrder(ctx));
 * }</pre>
 *
 * <p>Builders are not thread-safe. The built pipeline is.</p>
 */
public final class PipelineBuilder {
    private static final Logger log = LoggerFactory.getLogger(PipelineBuilder.class);

    private final List<Middleware> stages = new ArrayList<>();

    private GateObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
    private MonotonicScheduler scheduler = SharedDeadlineScheduler.instance();
    private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
    private WallClock wallClock = SystemWallClock.INSTANCE;
    private Executor callbackExecutor = SharedDeadlineScheduler.callbackExecutor();

    private PipelineBuilder() {
    }

    public static PipelineBuilder create() {
        return new PipelineBuilder();
    }

    /**
     * Sink handed to gates installed after this call.
     */
    public PipelineBuilder withObservabilitySink(GateObservabilitySink sink) {
        this.observabilitySink = Objects.requireNonNull(sink, "sink");
        return this;
    }

    /**
     * Deadline scheduler and clocks handed to gates installed after this call.
     */
    public PipelineBuilder withTime(MonotonicScheduler scheduler, MonotonicClock clock, WallClock wallClock) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        return this;
    }

    /**
     * Executor running callbacks registered on the combined token of gates
     * installed after this call.
     */
    public PipelineBuilder withCallbackExecutor(Executor callbackExecutor) {
        this.callbackExecutor = Objects.requireNonNull(callbackExecutor, "callbackExecutor");
        return this;
    }

    public PipelineBuilder use(Middleware middleware) {
        stages.add(Objects.requireNonNull(middleware, "middleware"));
        return this;
    }

    /**
     * Install the timeout-link gate with the default 250ms safety buffer.
     */
    public PipelineBuilder useTimeoutLinkedCancellation() {
        return useTimeoutLinkedCancellation(TimeoutLinkConfig.defaults());
    }

    /**
     * Install the timeout-link gate.
     *
     * @param safetyBuffer slack subtracted from the host's remaining time
     * @throws IllegalArgumentException if {@code safetyBuffer} is negative
     */
    public PipelineBuilder useTimeoutLinkedCancellation(Duration safetyBuffer) {
        return useTimeoutLinkedCancellation(TimeoutLinkConfig.withSafetyBuffer(safetyBuffer));
    }

    public PipelineBuilder useTimeoutLinkedCancellation(TimeoutLinkConfig config) {
        Objects.requireNonNull(config, "config");

        if (!stages.isEmpty()) {
            log.warn("Timeout-link gate installed behind {} stage(s); those stages will not observe the host deadline",
                stages.size());
        }

        // Capture now so later with*() calls do not affect this stage.
        GateObservabilitySink sink = observabilitySink;
        MonotonicScheduler s = scheduler;
        MonotonicClock c = clock;
        WallClock w = wallClock;
        Executor callbacks = callbackExecutor;
        return use(next -> new TimeoutLinkGate(next, sink, config, s, c, w, callbacks));
    }

    /**
     * Build the pipeline with {@code terminal} as the innermost handler.
     */
    public RequestPipeline run(RequestPipeline terminal) {
        RequestPipeline pipeline = Objects.requireNonNull(terminal, "terminal");
        for (int i = stages.size() - 1; i >= 0; i--) {
            pipeline = Objects.requireNonNull(stages.get(i).wrap(pipeline), "middleware returned null");
        }
        return pipeline;
    }
}
