package com.questrail.timeoutlink.api;

import com.questrail.timeoutlink.cancel.CancellationToken;

import java.util.Map;
import java.util.Optional;

/**
 * RequestContext
 * =============================================================================
 * Per-request state shared by all pipeline stages.
 *
 * <h2>Cancellation handle</h2>
 * <p>{@link #cancellation()} is the slot downstream code observes to learn that
 * it should stop. The host seeds it with a token that fires on client
 * disconnect. A stage may substitute another token for the duration of its
 * downstream call, and MUST restore the previous value before returning.</p>
 *
 * <h2>Items</h2>
 * <p>{@link #items()} is mutable request-scoped storage. Hosts publish
 * collaborators there under well-known keys, e.g.
 * {@link RemainingTimeOracle#CONTEXT_KEY}.</p>
 *
 * <p>A context is confined to one logical request and is not required to be
 * thread-safe beyond the cancellation slot being safely readable from other
 * threads.</p>
 */
public interface RequestContext
{
    String method();

    /**
     * @return the request path, used for routing and diagnostics
     */
    String path();

    /**
     * @return first value of the named header, matched case-insensitively
     */
    Optional<String> header(String name);

    /**
     * @return the full request body; empty array if there is none
     */
    byte[] body();

    CancellationToken cancellation();

    void setCancellation(CancellationToken token);

    Map<String, Object> items();

    ResponseSink response();
}
