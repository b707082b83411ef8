package com.questrail.timeoutlink.runtime;

import com.questrail.timeoutlink.api.RemainingTimeOracle;
import com.questrail.timeoutlink.api.RequestPipeline;
import com.questrail.timeoutlink.config.HttpHostConfig;
import com.questrail.timeoutlink.internal.time.MonotonicClock;
import com.questrail.timeoutlink.internal.time.ScheduledExecutorScheduler;
import com.questrail.timeoutlink.internal.time.SharedDeadlineScheduler;
import com.questrail.timeoutlink.internal.time.SystemMonotonicClock;
import com.questrail.timeoutlink.internal.time.SystemWallClock;
import com.questrail.timeoutlink.internal.time.WallClock;
import com.questrail.timeoutlink.observability.GateObservabilitySink;
import com.questrail.timeoutlink.observability.NullObservabilitySink;
import com.questrail.timeoutlink.pipeline.PipelineBuilder;
import com.questrail.timeoutlink.transport.http.HttpEndpoint;
import com.questrail.timeoutlink.transport.http.netty.NettyHttpServerEndpoint;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * TimeoutLinkHttpRuntime
 * =============================================================================
 * Composition root and lifecycle owner for an HTTP host that runs a pipeline
 * behind the timeout-link gate.
 *
 * <p>With an invocation timeout configured the host behaves like a time-boxed
 * function runtime: each request gets a {@link RemainingTimeOracle} counting
 * down from the moment it was accepted. Without one, requests run unhosted and
 * only client disconnects cancel them.</p>
 *
 * <p>Owns the deadline timer thread, the cancellation callback pool, the worker
 * pool and the Netty endpoint. {@link #stop()} releases them all.</p>
 */
public final class TimeoutLinkHttpRuntime {
    private final HttpHostConfig config;
    private final HttpEndpoint endpoint;
    private final ScheduledExecutorService timerExecutor;
    private final ExecutorService workerExecutor;
    private final ExecutorService callbackExecutor;

    private TimeoutLinkHttpRuntime(
            HttpHostConfig config,
            HttpEndpoint endpoint,
            ScheduledExecutorService timerExecutor,
            ExecutorService workerExecutor,
            ExecutorService callbackExecutor) {
        this.config = config;
        this.endpoint = endpoint;
        this.timerExecutor = timerExecutor;
        this.workerExecutor = workerExecutor;
        this.callbackExecutor = callbackExecutor;
    }

    public void start() {
        endpoint.start();
    }

    public void stop() {
        endpoint.stop();
        shutdown(workerExecutor);
        shutdown(timerExecutor);
        shutdown(callbackExecutor);
    }

    public InetSocketAddress localAddress() {
        return endpoint.localAddress();
    }

    public HttpHostConfig config() {
        return config;
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private HttpHostConfig config = HttpHostConfig.builder().build();
        private RequestPipeline pipeline;
        private GateObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private Consumer<PipelineBuilder> middleware = b -> { };

        public Builder withConfig(HttpHostConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Terminal handler run behind the gate.
         */
        public Builder withPipeline(RequestPipeline pipeline) {
            this.pipeline = pipeline;
            return this;
        }

        /**
         * Additional stages installed between the gate and the terminal handler.
         */
        public Builder withMiddleware(Consumer<PipelineBuilder> middleware) {
            this.middleware = middleware;
            return this;
        }

        public Builder withObservabilitySink(GateObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public TimeoutLinkHttpRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(pipeline, "pipeline");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(middleware, "middleware");

            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            WallClock wallClock = SystemWallClock.INSTANCE;

            ScheduledThreadPoolExecutor timerExecutor =
                    new ScheduledThreadPoolExecutor(1, SharedDeadlineScheduler.daemonThreads("timeout-link-timer"));
            timerExecutor.setRemoveOnCancelPolicy(true);
            ExecutorService workerExecutor = Executors.newFixedThreadPool(
                    config.workerThreads(), SharedDeadlineScheduler.daemonThreads("timeout-link-worker"));
            ExecutorService callbackExecutor =
                    Executors.newCachedThreadPool(SharedDeadlineScheduler.daemonThreads("timeout-link-callback"));

            PipelineBuilder builder = PipelineBuilder.create()
                    .withObservabilitySink(observabilitySink)
                    .withTime(new ScheduledExecutorScheduler(timerExecutor, clock), clock, wallClock)
                    .withCallbackExecutor(callbackExecutor)
                    .useTimeoutLinkedCancellation(config.gate());
            middleware.accept(builder);
            RequestPipeline gated = builder.run(pipeline);

            HttpEndpoint endpoint = new NettyHttpServerEndpoint(
                    config.bindAddress(),
                    gated,
                    workerExecutor,
                    oracleSeeder(config, clock),
                    observabilitySink,
                    wallClock,
                    config.maxContentLength());

            return new TimeoutLinkHttpRuntime(config, endpoint, timerExecutor, workerExecutor, callbackExecutor);
        }

        private static Consumer<Map<String, Object>> oracleSeeder(HttpHostConfig config, MonotonicClock clock) {
            if (!config.isTimeBoxed()) {
                return items -> { };
            }
            long timeoutNanos = config.invocationTimeout().map(Duration::toNanos).orElseThrow();
            return items -> items.put(
                    RemainingTimeOracle.CONTEXT_KEY,
                    RemainingTimeOracle.untilDeadline(clock, clock.nowNanos() + timeoutNanos));
        }
    }
}
