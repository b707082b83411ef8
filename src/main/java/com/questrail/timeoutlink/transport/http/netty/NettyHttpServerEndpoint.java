package com.questrail.timeoutlink.transport.http.netty;

import com.questrail.timeoutlink.api.RequestPipeline;
import com.questrail.timeoutlink.cancel.CancellationSource;
import com.questrail.timeoutlink.internal.time.WallClock;
import com.questrail.timeoutlink.observability.GateErrorEvent;
import com.questrail.timeoutlink.observability.GateObservabilitySink;
import com.questrail.timeoutlink.transport.http.HttpEndpoint;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoop;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;

import java.net.InetSocketAddress;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * NettyHttpServerEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link HttpEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. Per request it:
 * <ul>
 *   <li>creates an original {@link CancellationSource} that fires when the
 *       connection goes inactive (client disconnect, server shutdown),</li>
 *   <li>lets the composition root seed request items (e.g. a remaining-time
 *       oracle),</li>
 *   <li>runs the pipeline on the worker executor, never on the event loop,</li>
 *   <li>completes the response once the pipeline returns.</li>
 * </ul>
 * It does not compute deadlines or choose terminal statuses.
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package. Headers and body are copied into
 * plain Java types before the request buffer is released.
 *
 * <h2>One request at a time per connection</h2>
 * Requests pipelined on one connection are queued and run one after another,
 * so responses stay in request order. Reading is never suspended: a peer
 * close must be seen while a request is in flight.
 *
 * <h2>Malformed requests</h2>
 * A request the HTTP decoder could not parse is answered {@code 400} with an
 * empty body and the connection is closed. The pipeline never sees it.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} binds synchronously.
 * - {@link #stop()} closes the server channel and shuts down both event loop
 *   groups. The worker executor is owned by the caller.
 */
public final class NettyHttpServerEndpoint implements HttpEndpoint
{
    private static final int INTERNAL_SERVER_ERROR = 500;
    private static final int SERVICE_UNAVAILABLE = 503;

    private final InetSocketAddress bindAddress;
    private final RequestPipeline pipeline;
    private final ExecutorService workers;
    private final Consumer<Map<String, Object>> itemsInitializer;
    private final GateObservabilitySink observabilitySink;
    private final WallClock wallClock;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup ioGroup;
    private final ServerBootstrap bootstrap;

    private volatile Channel serverChannel;

    /**
     * @param bindAddress       local address; port 0 picks an ephemeral port
     * @param pipeline          pipeline run once per request
     * @param workers           executor the pipeline runs on
     * @param itemsInitializer  called on each new request's items before the
     *                          pipeline runs
     * @param observabilitySink receives pipeline failures
     * @param wallClock         timestamps for error events
     * @param maxContentLength  largest accepted request body, in bytes
     */
    public NettyHttpServerEndpoint(
        InetSocketAddress bindAddress,
        RequestPipeline pipeline,
        ExecutorService workers,
        Consumer<Map<String, Object>> itemsInitializer,
        GateObservabilitySink observabilitySink,
        WallClock wallClock,
        int maxContentLength)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.workers = Objects.requireNonNull(workers, "workers");
        this.itemsInitializer = Objects.requireNonNull(itemsInitializer, "itemsInitializer");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        if (maxContentLength <= 0) {
            throw new IllegalArgumentException("maxContentLength must be positive (current: " + maxContentLength + ")");
        }

        this.bossGroup = new NioEventLoopGroup(1);
        this.ioGroup = new NioEventLoopGroup();
        this.bootstrap = new ServerBootstrap();

        bootstrap.group(bossGroup, ioGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new HttpServerCodec());
                        p.addLast(new HttpObjectAggregator(maxContentLength));
                        p.addLast(newRequestHandler());
                    }
                });
    }

    @Override
    public void start()
    {
        if (serverChannel != null) {
            throw new IllegalStateException("endpoint already started");
        }
        ChannelFuture bound = bootstrap.bind(bindAddress).syncUninterruptibly();
        serverChannel = bound.channel();
    }

    @Override
    public void stop()
    {
        Channel ch = serverChannel;
        if (ch != null) {
            ch.close().syncUninterruptibly();
        }
        ioGroup.shutdownGracefully().syncUninterruptibly();
        bossGroup.shutdownGracefully().syncUninterruptibly();
    }

    @Override
    public InetSocketAddress localAddress()
    {
        Channel ch = serverChannel;
        if (ch == null) {
            throw new IllegalStateException("endpoint not started");
        }
        return (InetSocketAddress) ch.localAddress();
    }

    /**
     * Handler for one connection, placed after the HTTP codec and aggregator.
     */
    ChannelHandler newRequestHandler()
    {
        return new RequestHandler();
    }

    /**
     * RequestHandler
     * -------------------------------------------------------------------------
     * One instance per connection. Fields are touched only on the channel's
     * event loop.
     */
    private final class RequestHandler extends SimpleChannelInboundHandler<FullHttpRequest>
    {
        private final Deque<PendingRequest> queued = new ArrayDeque<>();
        private PendingRequest inFlight;

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request)
        {
            Channel channel = ctx.channel();
            if (request.decoderResult().isFailure()) {
                rejectMalformed(ctx, request);
                return;
            }

            CancellationSource aborted = CancellationSource.create();
            NettyResponseSink response = new NettyResponseSink(channel, HttpUtil.isKeepAlive(request));
            NettyRequestContext context = new NettyRequestContext(
                request.method().name(),
                new QueryStringDecoder(request.uri()).path(),
                copyHeaders(request),
                ByteBufUtil.getBytes(request.content()),
                aborted.token(),
                response);
            itemsInitializer.accept(context.items());

            queued.add(new PendingRequest(context, response, aborted));
            dispatchNext(channel);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception
        {
            try {
                PendingRequest current = inFlight;
                if (current != null) {
                    abort(current);
                }
                // Queued requests never reach the pipeline.
                for (PendingRequest pending : queued) {
                    abort(pending);
                }
            } finally {
                queued.clear();
                super.channelInactive(ctx);
            }
        }

        /**
         * Fire a request's original token. Callback failures are reported and
         * do not stop the remaining requests from being aborted.
         */
        private void abort(PendingRequest request)
        {
            try {
                request.aborted().cancel();
            } catch (RuntimeException e) {
                observabilitySink.onError(new GateErrorEvent(
                    wallClock.now(), request.context().path(), "Cancellation callback failed", e));
            }
        }

        private void rejectMalformed(ChannelHandlerContext ctx, FullHttpRequest request)
        {
            observabilitySink.onError(new GateErrorEvent(
                wallClock.now(), null, "Malformed request", request.decoderResult().cause()));

            FullHttpResponse response = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1, HttpResponseStatus.BAD_REQUEST, Unpooled.EMPTY_BUFFER);
            response.headers().set(HttpHeaderNames.CONTENT_LENGTH, 0);
            response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            observabilitySink.onError(new GateErrorEvent(wallClock.now(), null, "Transport failure", cause));
            ctx.close();
        }

        private void dispatchNext(Channel channel)
        {
            if (inFlight != null || queued.isEmpty()) {
                return;
            }
            if (!channel.isActive()) {
                for (PendingRequest pending : queued) {
                    abort(pending);
                }
                queued.clear();
                return;
            }
            PendingRequest next = queued.poll();
            inFlight = next;

            try {
                workers.execute(() -> process(channel, next));
            } catch (RejectedExecutionException e) {
                observabilitySink.onError(new GateErrorEvent(
                    wallClock.now(), next.context().path(), "Worker pool rejected request", e));
                next.response().setStatus(SERVICE_UNAVAILABLE);
                next.aborted().close();
                next.response().complete();
                inFlight = null;
                dispatchNext(channel);
            }
        }

        /**
         * Runs on a worker thread.
         */
        private void process(Channel channel, PendingRequest request)
        {
            try {
                pipeline.invoke(request.context());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail(request, e);
            } catch (Exception e) {
                fail(request, e);
            } finally {
                request.aborted().close();
                request.response().complete();

                EventLoop loop = channel.eventLoop();
                if (!loop.isShuttingDown()) {
                    loop.execute(() -> {
                        inFlight = null;
                        dispatchNext(channel);
                    });
                }
            }
        }

        private void fail(PendingRequest request, Exception e)
        {
            observabilitySink.onError(new GateErrorEvent(
                wallClock.now(), request.context().path(), "Pipeline failed: " + e.getClass().getSimpleName(), e));

            NettyResponseSink response = request.response();
            if (!response.hasStarted()) {
                response.clearHeaders();
                response.setContentLength(0);
                response.setStatus(INTERNAL_SERVER_ERROR);
            }
        }
    }

    private record PendingRequest(
        NettyRequestContext context,
        NettyResponseSink response,
        CancellationSource aborted)
    {
    }

    private static Map<String, List<String>> copyHeaders(FullHttpRequest request)
    {
        Map<String, List<String>> headers = new HashMap<>();
        for (Map.Entry<String, String> header : request.headers()) {
            headers.computeIfAbsent(header.getKey().toLowerCase(Locale.ROOT), k -> new ArrayList<>())
                   .add(header.getValue());
        }
        return headers;
    }
}
