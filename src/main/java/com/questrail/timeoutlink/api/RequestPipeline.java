package com.questrail.timeoutlink.api;

/**
 * RequestPipeline
 * -----------------------------------------------------------------------------
 * The "next" stage of request processing. Invoked once per request and blocks
 * the calling thread until the stage completes, fails, or unwinds after
 * observing {@link RequestContext#cancellation()}.
 *
 * <p>Stages signal cooperative cancellation by throwing
 * {@link com.questrail.timeoutlink.cancel.OperationCancelledException}.</p>
 */
@FunctionalInterface
public interface RequestPipeline
{
    void invoke(RequestContext context) throws Exception;
}
