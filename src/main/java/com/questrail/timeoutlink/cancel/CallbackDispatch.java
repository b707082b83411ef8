package com.questrail.timeoutlink.cancel;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * CallbackDispatch
 * =============================================================================
 * How a {@link CancellationSource} runs the callbacks registered on its token
 * once it fires.
 *
 * <h2>Policies</h2>
 * <ul>
 *   <li>{@link #inline()}: callbacks run on the firing thread. The first
 *       failure is rethrown to whoever called {@link CancellationSource#cancel()}.</li>
 *   <li>{@link #async(Executor, Consumer)}: callbacks run on the executor. The
 *       firing thread only flips state and hands off, so a timer or transport
 *       thread is never held up by downstream code. Failures go to the failure
 *       handler and never reach the firing thread.</li>
 * </ul>
 *
 * <p>Either way, callbacks of one source run in registration order and every
 * callback runs even if an earlier one throws.</p>
 */
public final class CallbackDispatch {

    private static final CallbackDispatch INLINE = new CallbackDispatch(null, null);

    private final Executor executor;
    private final Consumer<? super RuntimeException> failureHandler;

    private CallbackDispatch(Executor executor, Consumer<? super RuntimeException> failureHandler) {
        this.executor = executor;
        this.failureHandler = failureHandler;
    }

    public static CallbackDispatch inline() {
        return INLINE;
    }

    /**
     * @param executor       runs the callbacks; if it rejects the hand-off they
     *                       run on the firing thread instead
     * @param failureHandler receives each callback failure
     */
    public static CallbackDispatch async(Executor executor, Consumer<? super RuntimeException> failureHandler) {
        return new CallbackDispatch(
            Objects.requireNonNull(executor, "executor"),
            Objects.requireNonNull(failureHandler, "failureHandler"));
    }

    boolean isInline() {
        return executor == null;
    }

    /**
     * Run {@code callbacks} according to this policy.
     *
     * @throws RuntimeException only for {@link #inline()}: the first callback
     *                          failure, with later ones suppressed
     */
    void dispatch(List<Runnable> callbacks) {
        if (callbacks.isEmpty()) {
            return;
        }
        if (isInline()) {
            RuntimeException failure = runAll(callbacks);
            if (failure != null) {
                throw failure;
            }
            return;
        }

        try {
            executor.execute(() -> runAndReport(callbacks));
        } catch (RejectedExecutionException rejected) {
            runAndReport(callbacks);
        }
    }

    private void runAndReport(List<Runnable> callbacks) {
        RuntimeException failure = runAll(callbacks);
        if (failure != null) {
            failureHandler.accept(failure);
        }
    }

    private static RuntimeException runAll(List<Runnable> callbacks) {
        RuntimeException failure = null;
        for (Runnable callback : callbacks) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        return failure;
    }
}
