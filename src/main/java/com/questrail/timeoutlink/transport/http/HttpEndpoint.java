package com.questrail.timeoutlink.transport.http;

import java.net.InetSocketAddress;

/**
 * HttpEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for an HTTP listener that feeds requests into a
 * {@link com.questrail.timeoutlink.api.RequestPipeline}.
 *
 * <p>Implementations may be backed by Netty or by a test harness.</p>
 */
public interface HttpEndpoint
{
    /**
     * Bind and start accepting requests. Returns once the listener is bound.
     *
     * @throws IllegalStateException if already started
     */
    void start();

    /**
     * Stop accepting requests and release all transport resources.
     * In-flight requests see their cancellation token fire as their
     * connections close.
     */
    void stop();

    /**
     * @return the bound address; resolves an ephemeral port
     * @throws IllegalStateException if not started
     */
    InetSocketAddress localAddress();
}
