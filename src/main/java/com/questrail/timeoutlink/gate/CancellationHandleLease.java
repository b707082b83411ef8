package com.questrail.timeoutlink.gate;

import com.questrail.timeoutlink.api.RequestContext;
import com.questrail.timeoutlink.cancel.CancellationToken;

/**
 * Borrows the request's cancellation slot. Closing the lease puts back the
 * token that was there when it was borrowed, whatever was substituted since.
 */
final class CancellationHandleLease implements AutoCloseable {

    private final RequestContext context;
    private final CancellationToken original;

    private CancellationHandleLease(RequestContext context, CancellationToken original) {
        this.context = context;
        this.original = original;
    }

    static CancellationHandleLease borrow(RequestContext context) {
        return new CancellationHandleLease(context, context.cancellation());
    }

    CancellationToken original() {
        return original;
    }

    void substitute(CancellationToken token) {
        context.setCancellation(token);
    }

    @Override
    public void close() {
        context.setCancellation(original);
    }
}
