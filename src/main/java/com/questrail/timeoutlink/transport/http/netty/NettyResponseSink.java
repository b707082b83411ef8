package com.questrail.timeoutlink.transport.http.netty;

import com.questrail.timeoutlink.api.ResponseSink;
import com.questrail.timeoutlink.gate.CancellationCause;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.DefaultHttpContent;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.DefaultHttpResponse;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.LastHttpContent;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * NettyResponseSink
 * =============================================================================
 * {@link ResponseSink} that streams to a Netty channel.
 *
 * <h2>Start semantics</h2>
 * <ul>
 *   <li>The first {@link #write(byte[])} commits status and headers. From then
 *       on {@link #hasStarted()} is {@code true} and the mutators throw.</li>
 *   <li>Without a declared content length the body is sent chunked.</li>
 *   <li>{@link #complete()} ends the response. A response that never started
 *       is sent as a single empty-bodied response with the current status.</li>
 * </ul>
 *
 * <p>Writes go through {@link Channel#writeAndFlush(Object)}, which is safe
 * from any thread. Writes after the client disconnected fail inside Netty and
 * are dropped there.</p>
 */
final class NettyResponseSink implements ResponseSink {

    static final HttpResponseStatus CLIENT_CLOSED_REQUEST =
        new HttpResponseStatus(CancellationCause.CALLER_DISCONNECTED.statusCode(), "Client Closed Request");

    private final Channel channel;
    private final boolean keepAlive;
    private final HttpHeaders headers = new DefaultHttpHeaders();

    private int status = 200;
    private long contentLength = -1;
    private volatile boolean started;
    private boolean completed;

    NettyResponseSink(Channel channel, boolean keepAlive) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.keepAlive = keepAlive;
    }

    @Override
    public boolean hasStarted() {
        return started;
    }

    @Override
    public synchronized int status() {
        return status;
    }

    @Override
    public synchronized void setStatus(int status) {
        ensureNotStarted();
        if (status < 100 || status > 999) {
            throw new IllegalArgumentException("status must be a three-digit code (current: " + status + ")");
        }
        this.status = status;
    }

    @Override
    public synchronized void setHeader(String name, String value) {
        ensureNotStarted();
        headers.set(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
    }

    @Override
    public synchronized void clearHeaders() {
        ensureNotStarted();
        headers.clear();
    }

    @Override
    public synchronized OptionalLong contentLength() {
        return contentLength < 0 ? OptionalLong.empty() : OptionalLong.of(contentLength);
    }

    @Override
    public synchronized void setContentLength(long length) {
        ensureNotStarted();
        if (length < 0) {
            throw new IllegalArgumentException("length must be >= 0");
        }
        this.contentLength = length;
    }

    @Override
    public synchronized void write(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (completed) {
            throw new IllegalStateException("response already completed");
        }
        if (!started) {
            channel.write(commitHeaders());
            started = true;
        }
        channel.writeAndFlush(new DefaultHttpContent(Unpooled.copiedBuffer(bytes)));
    }

    /**
     * End the response. Idempotent.
     *
     * @return future of the final write; already closed channels fail it
     */
    synchronized ChannelFuture complete() {
        if (completed) {
            return channel.newSucceededFuture();
        }
        completed = true;

        ChannelFuture last;
        if (started) {
            last = channel.writeAndFlush(LastHttpContent.EMPTY_LAST_CONTENT);
        } else {
            FullHttpResponse full = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1, statusOf(status), Unpooled.EMPTY_BUFFER);
            full.headers().set(headers);
            HttpUtil.setContentLength(full, 0);
            HttpUtil.setKeepAlive(full, keepAlive);
            started = true;
            last = channel.writeAndFlush(full);
        }

        if (!keepAlive) {
            last.addListener(ChannelFutureListener.CLOSE);
        }
        return last;
    }

    private HttpResponse commitHeaders() {
        HttpResponse response = new DefaultHttpResponse(HttpVersion.HTTP_1_1, statusOf(status));
        response.headers().set(headers);
        if (contentLength >= 0) {
            HttpUtil.setContentLength(response, contentLength);
        } else {
            HttpUtil.setTransferEncodingChunked(response, true);
        }
        HttpUtil.setKeepAlive(response, keepAlive);
        return response;
    }

    private void ensureNotStarted() {
        if (started) {
            throw new IllegalStateException("response has already started");
        }
    }

    static HttpResponseStatus statusOf(int code) {
        return code == CLIENT_CLOSED_REQUEST.code()
            ? CLIENT_CLOSED_REQUEST
            : HttpResponseStatus.valueOf(code);
    }
}
