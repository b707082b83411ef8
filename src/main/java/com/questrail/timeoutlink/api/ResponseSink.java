package com.questrail.timeoutlink.api;

import java.util.OptionalLong;

/**
 * ResponseSink
 * -----------------------------------------------------------------------------
 * Response side of a request.
 *
 * <p>A response is <em>started</em> once its status line and headers have been
 * committed to the transport (typically on the first body write). After that,
 * status, headers and content length are frozen: the mutators throw
 * {@link IllegalStateException}. Callers that may run after the start check
 * {@link #hasStarted()} first instead of catching that exception.</p>
 */
public interface ResponseSink
{
    boolean hasStarted();

    int status();

    void setStatus(int status);

    void setHeader(String name, String value);

    void clearHeaders();

    OptionalLong contentLength();

    void setContentLength(long length);

    /**
     * Append body bytes. Starts the response if it has not started yet.
     */
    void write(byte[] bytes);
}
