package com.questrail.timeoutlink.transport.http.netty;

import com.questrail.timeoutlink.api.RequestContext;
import com.questrail.timeoutlink.api.ResponseSink;
import com.questrail.timeoutlink.cancel.CancellationToken;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link RequestContext} built from a fully aggregated Netty request.
 *
 * <p>Holds only plain Java types: headers and body are copied out of Netty
 * buffers before the request is released.</p>
 */
final class NettyRequestContext implements RequestContext {

    private final String method;
    private final String path;
    private final Map<String, List<String>> headers;
    private final byte[] body;
    private final ResponseSink response;
    private final Map<String, Object> items = new ConcurrentHashMap<>();

    private volatile CancellationToken cancellation;

    /**
     * @param headers header values keyed by lower-cased name
     */
    NettyRequestContext(
        String method,
        String path,
        Map<String, List<String>> headers,
        byte[] body,
        CancellationToken cancellation,
        ResponseSink response
    ) {
        this.method = Objects.requireNonNull(method, "method");
        this.path = Objects.requireNonNull(path, "path");
        this.headers = Map.copyOf(headers);
        this.body = Objects.requireNonNull(body, "body");
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation");
        this.response = Objects.requireNonNull(response, "response");
    }

    @Override
    public String method() {
        return method;
    }

    @Override
    public String path() {
        return path;
    }

    @Override
    public Optional<String> header(String name) {
        List<String> values = headers.get(name.toLowerCase(Locale.ROOT));
        return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    @Override
    public byte[] body() {
        return body.clone();
    }

    @Override
    public CancellationToken cancellation() {
        return cancellation;
    }

    @Override
    public void setCancellation(CancellationToken token) {
        this.cancellation = Objects.requireNonNull(token, "token");
    }

    @Override
    public Map<String, Object> items() {
        return items;
    }

    @Override
    public ResponseSink response() {
        return response;
    }
}
