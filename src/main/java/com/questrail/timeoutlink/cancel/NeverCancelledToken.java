package com.questrail.timeoutlink.cancel;

import com.questrail.timeoutlink.internal.time.Cancellable;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Backing instance for {@link CancellationToken#NONE}.
 */
enum NeverCancelledToken implements CancellationToken {
    INSTANCE;

    private static final Cancellable NOTHING_REGISTERED = () -> false;

    @Override
    public boolean isCancellationRequested() {
        return false;
    }

    @Override
    public Cancellable register(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        return NOTHING_REGISTERED;
    }

    @Override
    public boolean await(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout");
        TimeUnit.NANOSECONDS.sleep(CancellationSource.saturatedNanos(timeout));
        return false;
    }

    @Override
    public String toString() {
        return "CancellationToken.NONE";
    }
}
